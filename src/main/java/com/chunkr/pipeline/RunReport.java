package com.chunkr.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.chunkr.embed.EmbeddingCache;

/**
 * Per-file and aggregate counts of one insert run.
 *
 * @param finalCommit outcome of the deferred search index commit, {@code COMMITTED} when none was needed
 */
public record RunReport(
        List<FileReport> files,
        boolean stopped,
        String finalCommit,
        long providerRequests,
        EmbeddingCache.Stats cache) {

    public RunReport {
        files = List.copyOf(files);
    }

    public int chunksRead() {
        return files.stream().mapToInt(FileReport::chunksRead).sum();
    }

    public int cacheHits() {
        return files.stream().mapToInt(FileReport::cacheHits).sum();
    }

    public int computed() {
        return files.stream().mapToInt(FileReport::computed).sum();
    }

    public int vectorsCommitted() {
        return files.stream().mapToInt(FileReport::vectorsCommitted).sum();
    }

    public int documentsCommitted() {
        return files.stream().mapToInt(FileReport::documentsCommitted).sum();
    }

    public int malformedRecords() {
        return files.stream().mapToInt(FileReport::malformedRecords).sum();
    }

    public int abandonedChunks() {
        return files.stream().mapToInt(file -> file.abandonedIds().size()).sum();
    }

    public Map<String, List<String>> abandonedIds() {
        Map<String, List<String>> byFile = new LinkedHashMap<>();
        for (FileReport file : files) {
            if (!file.abandonedIds().isEmpty()) {
                byFile.put(file.path(), file.abandonedIds());
            }
        }
        return byFile;
    }

    public boolean allCompleted() {
        return !stopped
                && "COMMITTED".equals(finalCommit)
                && files.stream().allMatch(file -> file.status() == FileStatus.COMPLETED);
    }

    public FileReport file(String path) {
        return files.stream()
                .filter(file -> file.path().equals(path))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No report for " + path));
    }
}
