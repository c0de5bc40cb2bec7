package com.chunkr.sink;

import java.util.Map;

public record VectorPoint(String id, float[] vector, Map<String, Object> payload) {
}
