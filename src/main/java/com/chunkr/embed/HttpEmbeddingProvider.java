package com.chunkr.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Embedding backend spoken over HTTP. Supports Ollama's batch endpoint and OpenAI-compatible servers.
 * Every failure is thrown; retrying is the caller's business.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final Kind kind;
    private final HttpUrl endpoint;
    private final String model;
    private final String apiKey;

    public HttpEmbeddingProvider(OkHttpClient httpClient, Kind kind, String baseUrl, String model, String apiKey) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.kind = kind;
        this.endpoint = resolve(baseUrl, kind.path);
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public List<float[]> embed(List<String> texts) throws IOException {
        String payload = mapper.writeValueAsString(Map.of("model", model, "input", texts));
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new EmbeddingException(kind.label + " embedding failed: HTTP " + response.code(), response.code());
            }
            if (body == null) {
                throw new EmbeddingException(kind.label + " returned an empty body", response.code());
            }
            JsonNode root = readTree(body.string());
            List<float[]> vectors = kind == Kind.OLLAMA ? parseOllama(root) : parseOpenAi(root);
            if (vectors.size() != texts.size()) {
                throw new EmbeddingException(kind.label + " returned " + vectors.size() + " vectors for " + texts.size() + " inputs");
            }
            return vectors;
        }
    }

    @Override
    public String name() {
        return kind.label + ":" + model;
    }

    private JsonNode readTree(String body) throws EmbeddingException {
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new EmbeddingException(kind.label + " returned malformed JSON: " + e.getMessage());
        }
    }

    private List<float[]> parseOllama(JsonNode root) throws EmbeddingException {
        JsonNode embeddings = root.path("embeddings");
        if (!embeddings.isArray()) {
            throw new EmbeddingException("missing embeddings in ollama response");
        }
        List<float[]> out = new ArrayList<>(embeddings.size());
        for (JsonNode vectorNode : embeddings) {
            out.add(toVector(vectorNode));
        }
        return out;
    }

    private List<float[]> parseOpenAi(JsonNode root) throws EmbeddingException {
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new EmbeddingException("missing data in openai response");
        }
        float[][] ordered = new float[data.size()][];
        for (JsonNode item : data) {
            int index = item.path("index").asInt(-1);
            if (index < 0 || index >= ordered.length || ordered[index] != null) {
                throw new EmbeddingException("invalid embedding index " + item.path("index"));
            }
            ordered[index] = toVector(item.path("embedding"));
        }
        return List.of(ordered);
    }

    private static float[] toVector(JsonNode vectorNode) throws EmbeddingException {
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new EmbeddingException("embedding is not a non-empty array");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            JsonNode value = vectorNode.get(i);
            if (!value.isNumber()) {
                throw new EmbeddingException("embedding contains a non-numeric value at " + i);
            }
            out[i] = (float) value.asDouble();
        }
        return out;
    }

    private static HttpUrl resolve(String baseUrl, String path) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid embedding base URL: " + baseUrl);
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                builder.addPathSegment(segment);
            }
        }
        return builder.build();
    }

    public enum Kind {
        OLLAMA("ollama", "api/embed"),
        OPENAI("openai", "v1/embeddings");

        private final String label;
        private final String path;

        Kind(String label, String path) {
            this.label = label;
            this.path = path;
        }

        public static Kind fromName(String name) {
            for (Kind kind : values()) {
                if (kind.label.equals(name.toLowerCase(Locale.ROOT))) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown embedding provider: " + name);
        }
    }
}
