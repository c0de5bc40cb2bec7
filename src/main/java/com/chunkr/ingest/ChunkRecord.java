package com.chunkr.ingest;

import java.util.Map;

/**
 * Immutable unit of work read from a chunk file.
 *
 * @param id        deterministic storage key derived from {@code documentId} and {@code index}
 * @param lineNumber 1-based line of the record in its chunk file
 */
public record ChunkRecord(
        String id,
        String text,
        String sourcePath,
        String documentId,
        int index,
        Map<String, Object> metadata,
        int lineNumber) {

    public ChunkRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ChunkRecord of(String text, String sourcePath, String documentId, int index, Map<String, Object> metadata) {
        return of(text, sourcePath, documentId, index, metadata, 0);
    }

    public static ChunkRecord of(String text,
            String sourcePath,
            String documentId,
            int index,
            Map<String, Object> metadata,
            int lineNumber) {
        return new ChunkRecord(ChunkIds.deterministicId(documentId, index), text, sourcePath, documentId, index, metadata, lineNumber);
    }

    public FingerprintKey fingerprint() {
        return FingerprintKey.of(text);
    }
}
