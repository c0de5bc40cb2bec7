package com.chunkr.ingest;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class ChunkIds {
    private ChunkIds() {
    }

    /**
     * Name-based UUID of {@code documentId#index}. Re-processing the same input always yields the same
     * key, which is what makes replayed upserts land on the existing record.
     */
    public static String deterministicId(String documentId, int index) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId is required");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0 but was " + index);
        }
        String name = documentId + "#" + index;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
