package com.chunkr.ingest;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.chunkr.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkIdentityTest {

    @Test
    void shouldDeriveStableIdsFromDocumentAndIndex() {
        String id = ChunkIds.deterministicId("book-1", 0);

        assertEquals(id, ChunkIds.deterministicId("book-1", 0));
        assertNotEquals(id, ChunkIds.deterministicId("book-1", 1));
        assertNotEquals(id, ChunkIds.deterministicId("book-2", 0));
        assertEquals(36, id.length());
        assertThrows(IllegalArgumentException.class, () -> ChunkIds.deterministicId(" ", 0));
    }

    @Test
    void shouldFingerprintTextIndependentlyOfIdentity() {
        ChunkRecord first = ChunkRecord.of("same text", "a", "doc-a", 0, Map.of());
        ChunkRecord second = ChunkRecord.of("same text", "b", "doc-b", 7, Map.of());

        assertNotEquals(first.id(), second.id());
        assertEquals(first.fingerprint(), second.fingerprint());
        assertEquals(64, first.fingerprint().value().length());
    }

    @Test
    void shouldNormalizeBeforeFingerprinting() {
        assertEquals(FingerprintKey.of("caf\u00e9"), FingerprintKey.of("cafe\u0301"));
        assertEquals(FingerprintKey.of("text"), FingerprintKey.of("  text\n"));
        assertNotEquals(FingerprintKey.of("text"), FingerprintKey.of("Text"));
    }

    @Test
    void shouldFilterGovernedMetadataKeys() {
        AppConfig.MetadataConfig config = new AppConfig.MetadataConfig();
        config.setIncludeAuthors(false);
        config.setIncludeSourcePath(false);
        MetadataPolicy policy = new MetadataPolicy(config);

        Map<String, Object> selected = policy.select(Map.of("title", "T", "authors", "X", "genre", "poetry"));

        assertEquals(Map.of("title", "T", "genre", "poetry"), selected);
        assertFalse(policy.includes("source_path"));
        assertTrue(MetadataPolicy.includeAll().includes("authors"));
    }
}
