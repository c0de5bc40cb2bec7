package com.chunkr.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

public final class ChunkFiles {
    private ChunkFiles() {
    }

    /**
     * Every {@code *.jsonl} file below {@code root}, in a stable order.
     */
    public static List<Path> discover(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Chunk root is not a directory: " + root.toAbsolutePath().normalize());
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jsonl"))
                    .sorted()
                    .toList();
        }
    }
}
