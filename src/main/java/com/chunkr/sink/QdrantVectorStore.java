package com.chunkr.sink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Qdrant over its REST API. Points are upserted with {@code wait=true} so a success means the points
 * are persisted.
 */
public class QdrantVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStore.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String collection;
    private final int vectorSize;
    private final String distance;
    private final String apiKey;

    public QdrantVectorStore(OkHttpClient httpClient,
            String url,
            String collection,
            int vectorSize,
            String distance,
            String apiKey) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Qdrant URL: " + url);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = parsed;
        this.collection = collection;
        this.vectorSize = vectorSize;
        this.distance = distance;
        this.apiKey = apiKey;
    }

    @Override
    public void ensureCollection() throws IOException {
        Map<String, Object> body = Map.of("vectors", Map.of("size", vectorSize, "distance", distance));
        Request request = request(collectionUrl().build())
                .put(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                log.info("qdrant.collection.created collection={} size={} distance={}", collection, vectorSize, distance);
                return;
            }
            String text = bodyText(response);
            if (response.code() == 409 || text.contains("already exists")) {
                log.info("qdrant.collection.exists collection={}", collection);
                return;
            }
            throw new SinkHttpException("qdrant collection create failed: HTTP " + response.code() + " " + text, response.code());
        }
    }

    @Override
    public void checkReachable() throws IOException {
        Request request = request(collectionUrl().build()).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SinkHttpException("qdrant collection " + collection + " unavailable: HTTP " + response.code(), response.code());
            }
        }
    }

    @Override
    public void upsert(List<VectorPoint> points) throws IOException {
        List<Map<String, Object>> body = new ArrayList<>(points.size());
        for (VectorPoint point : points) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("id", point.id());
            json.put("vector", point.vector());
            json.put("payload", point.payload());
            body.add(json);
        }
        HttpUrl url = collectionUrl()
                .addPathSegment("points")
                .addQueryParameter("wait", "true")
                .build();
        Request request = request(url)
                .put(RequestBody.create(mapper.writeValueAsString(Map.of("points", body)), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SinkHttpException("qdrant upsert failed: HTTP " + response.code() + " " + bodyText(response), response.code());
            }
        }
    }

    @Override
    public String describe() {
        return "qdrant:" + collection;
    }

    private HttpUrl.Builder collectionUrl() {
        return baseUrl.newBuilder()
                .addPathSegment("collections")
                .addPathSegment(collection);
    }

    private Request.Builder request(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private static String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        String text = body.string();
        return text.length() > 500 ? text.substring(0, 500) : text;
    }
}
