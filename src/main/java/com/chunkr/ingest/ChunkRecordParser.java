package com.chunkr.ingest;

import java.util.LinkedHashMap;
import java.util.Map;

import com.chunkr.retry.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses one JSON line of a chunk file. Field names follow the chunker's output
 * ({@code text}, {@code document_id}, {@code index}, {@code source_path}, {@code metadata}); the
 * identity fields fall back to their {@code metadata} counterparts and finally to the chunk file and
 * line position.
 */
public class ChunkRecordParser {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ChunkRecordParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ChunkRecordParser() {
        this(new ObjectMapper());
    }

    /**
     * Without an explicit index the record takes its 0-based physical line position, so fixing or
     * removing a malformed line never shifts the ids of the lines after it.
     *
     * @param lineNumber 1-based physical line, blank and malformed lines included
     * @throws ValidationException when the line is not a usable chunk record
     */
    public ChunkRecord parse(String line, String chunkFile, int lineNumber) {
        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ValidationException("line " + lineNumber + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("line " + lineNumber + " is not a JSON object");
        }

        JsonNode textNode = root.get("text");
        if (textNode == null || !textNode.isTextual() || textNode.asText().isBlank()) {
            throw new ValidationException("line " + lineNumber + " has no text");
        }

        JsonNode metadataNode = root.path("metadata");
        if (!metadataNode.isMissingNode() && !metadataNode.isNull() && !metadataNode.isObject()) {
            throw new ValidationException("line " + lineNumber + " has non-object metadata");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (metadataNode.isObject()) {
            Map<String, Object> raw = mapper.convertValue(metadataNode, MAP_TYPE);
            raw.forEach((key, value) -> {
                if (value != null) {
                    metadata.put(key, value);
                }
            });
        }

        String sourcePath = firstText(root, "source_path", "sourcePath");
        if (sourcePath == null) {
            sourcePath = textOrNull(metadataNode.get("source_path"));
        }
        if (sourcePath == null) {
            sourcePath = chunkFile;
        }

        String documentId = firstText(root, "document_id", "documentId");
        if (documentId == null) {
            documentId = textOrNull(metadataNode.get("calibre_id"));
        }
        if (documentId == null) {
            documentId = sourcePath;
        }

        int index = lineNumber - 1;
        JsonNode indexNode = root.has("index") ? root.get("index") : metadataNode.get("chunk_index");
        if (indexNode != null && !indexNode.isNull()) {
            if (!indexNode.canConvertToInt() || indexNode.asInt() < 0) {
                throw new ValidationException("line " + lineNumber + " has invalid index " + indexNode);
            }
            index = indexNode.asInt();
        }

        return ChunkRecord.of(textNode.asText(), sourcePath, documentId, index, metadata, lineNumber);
    }

    private static String firstText(JsonNode root, String... names) {
        for (String name : names) {
            String value = textOrNull(root.get(name));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
