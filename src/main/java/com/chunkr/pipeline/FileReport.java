package com.chunkr.pipeline;

import java.util.List;

public record FileReport(
        String path,
        FileStatus status,
        int chunksRead,
        int malformedRecords,
        int skippedRecords,
        int cacheHits,
        int computed,
        int vectorsCommitted,
        int documentsCommitted,
        int batchesCompleted,
        int batchesAbandoned,
        List<String> abandonedIds,
        String error) {

    public FileReport {
        abandonedIds = List.copyOf(abandonedIds);
        error = error == null ? "" : error;
    }

    public static FileReport pending(String path) {
        return new FileReport(path, FileStatus.PENDING, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), "");
    }

    public static FileReport abandoned(String path, Throwable cause) {
        return new FileReport(path, FileStatus.ABANDONED, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), String.valueOf(cause));
    }
}
