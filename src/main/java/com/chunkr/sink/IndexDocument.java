package com.chunkr.sink;

import java.util.Map;

public record IndexDocument(String id, String text, Map<String, Object> metadata) {
}
