package com.chunkr.sink;

import java.io.IOException;
import java.util.List;

/**
 * Similarity-search sink. {@link #upsert} is keyed by point id: replaying points overwrites them.
 */
public interface VectorStore {
    void ensureCollection() throws IOException;

    void checkReachable() throws IOException;

    void upsert(List<VectorPoint> points) throws IOException;

    String describe();
}
