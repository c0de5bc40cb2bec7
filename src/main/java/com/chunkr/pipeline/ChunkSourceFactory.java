package com.chunkr.pipeline;

import java.io.IOException;
import java.nio.file.Path;

import com.chunkr.ingest.ChunkSource;

@FunctionalInterface
public interface ChunkSourceFactory {
    ChunkSource open(Path path) throws IOException;
}
