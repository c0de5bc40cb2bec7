package com.chunkr.pipeline;

import java.util.List;

import com.chunkr.sink.WriteOutcome;

/**
 * Both sink outcomes of one batch. The two outcomes are produced independently and only meet here.
 */
public record BatchReport(int batchNumber, List<String> chunkIds, WriteOutcome vectors, WriteOutcome documents) {

    public boolean completed() {
        return vectors.isCommitted() && documents.isCommitted();
    }

    public int size() {
        return chunkIds.size();
    }
}
