package com.chunkr.pipeline;

public enum FileStatus {
    PENDING,
    IN_FLIGHT,
    COMPLETED,
    PARTIALLY_FAILED,
    ABANDONED,
    INTERRUPTED
}
