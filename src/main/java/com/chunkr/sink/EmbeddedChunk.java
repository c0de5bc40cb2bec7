package com.chunkr.sink;

import com.chunkr.ingest.ChunkRecord;

public record EmbeddedChunk(ChunkRecord record, float[] vector) {
}
