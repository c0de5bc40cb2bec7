package com.chunkr.ingest;

import java.io.IOException;
import java.util.Optional;

/**
 * Ordered, replayable stream of chunk records from one chunk file.
 */
public interface ChunkSource extends AutoCloseable {
    Optional<ChunkRecord> next() throws IOException;

    int malformedRecords();

    @Override
    void close() throws IOException;
}
