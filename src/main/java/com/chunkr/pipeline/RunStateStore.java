package com.chunkr.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Persists what a later run needs: the ids of abandoned chunks per chunk file, and the last run report.
 */
public class RunStateStore {
    static final String LEDGER_FILE = "abandoned.json";
    static final String REPORT_FILE = "last-run.json";

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path stateDir;

    public RunStateStore(Path stateDir) {
        this.stateDir = stateDir;
    }

    public Map<String, List<String>> loadLedger() throws IOException {
        Path path = stateDir.resolve(LEDGER_FILE);
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        return mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, List<String>>>() {
        });
    }

    /**
     * Folds the run into the previous ledger: files that ran replace their entry, interrupted files
     * keep the union, files that did not run keep their previous entry.
     */
    public Map<String, List<String>> updateLedger(Map<String, List<String>> previous, RunReport report) throws IOException {
        Map<String, List<String>> next = new LinkedHashMap<>(previous);
        for (FileReport file : report.files()) {
            if (file.status() == FileStatus.PENDING) {
                continue;
            }
            Set<String> ids = new LinkedHashSet<>(file.abandonedIds());
            if (file.status() == FileStatus.INTERRUPTED || file.status() == FileStatus.ABANDONED) {
                ids.addAll(previous.getOrDefault(file.path(), List.of()));
            }
            if (ids.isEmpty()) {
                next.remove(file.path());
            } else {
                next.put(file.path(), new ArrayList<>(ids));
            }
        }
        write(stateDir.resolve(LEDGER_FILE), next);
        return next;
    }

    public void saveReport(RunReport report) throws IOException {
        write(stateDir.resolve(REPORT_FILE), report);
    }

    public Path stateDir() {
        return stateDir;
    }

    private void write(Path path, Object value) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), value);
    }
}
