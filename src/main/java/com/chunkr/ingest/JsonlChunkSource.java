package com.chunkr.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chunkr.retry.ValidationException;

/**
 * Reads a JSONL chunk file lazily. Blank lines are ignored and malformed records are skipped with a
 * warning so one bad line never aborts the file.
 */
public class JsonlChunkSource implements ChunkSource {
    private static final Logger log = LoggerFactory.getLogger(JsonlChunkSource.class);

    private final Path path;
    private final BufferedReader reader;
    private final ChunkRecordParser parser;
    private int lineNumber;
    private int malformed;

    public JsonlChunkSource(Path path, ChunkRecordParser parser) throws IOException {
        this.path = path;
        this.parser = parser;
        this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    @Override
    public Optional<ChunkRecord> next() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                return Optional.of(parser.parse(line, path.toString(), lineNumber));
            } catch (ValidationException e) {
                malformed++;
                log.warn("chunk.record.skipped file={} line={} reason={}", path, lineNumber, e.getMessage());
            }
        }
        return Optional.empty();
    }

    @Override
    public int malformedRecords() {
        return malformed;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
