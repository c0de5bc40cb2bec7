package com.chunkr.sink;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

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
 * Quickwit over its REST API. Quickwit appends, so when {@code replaceExisting} is set each ingest is
 * preceded by a delete task for the batch ids; a replayed batch then replaces its earlier copy.
 */
public class QuickwitSearchIndex implements SearchIndex {
    private static final Logger log = LoggerFactory.getLogger(QuickwitSearchIndex.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final MediaType NDJSON = MediaType.parse("application/x-ndjson");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String indexId;
    private final int commitTimeoutSeconds;
    private final boolean replaceExisting;

    public QuickwitSearchIndex(OkHttpClient httpClient,
            String url,
            String indexId,
            int commitTimeoutSeconds,
            boolean replaceExisting) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Quickwit URL: " + url);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = parsed;
        this.indexId = indexId;
        this.commitTimeoutSeconds = commitTimeoutSeconds;
        this.replaceExisting = replaceExisting;
    }

    @Override
    public void checkReachable() throws IOException {
        HttpUrl url = api().addPathSegment("indexes").addPathSegment(indexId).build();
        try (Response response = httpClient.newCall(new Request.Builder().url(url).get().build()).execute()) {
            if (!response.isSuccessful()) {
                throw new SinkHttpException("quickwit index " + indexId + " unavailable: HTTP " + response.code(), response.code());
            }
        }
    }

    @Override
    public void ingest(List<IndexDocument> documents, boolean commit) throws IOException {
        if (documents.isEmpty()) {
            return;
        }
        if (replaceExisting) {
            deleteExisting(documents);
        }
        StringBuilder body = new StringBuilder();
        for (IndexDocument document : documents) {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("id", document.id());
            doc.put("text", document.text());
            doc.put("metadata", document.metadata());
            body.append(mapper.writeValueAsString(doc)).append('\n');
        }
        post(ingestUrl(commit ? "force" : "auto"), RequestBody.create(body.toString(), NDJSON), "ingest");
    }

    @Override
    public void commit() throws IOException {
        post(ingestUrl("force"), RequestBody.create("", NDJSON), "commit");
        log.info("quickwit.commit index={}", indexId);
    }

    @Override
    public String describe() {
        return "quickwit:" + indexId;
    }

    private void deleteExisting(List<IndexDocument> documents) throws IOException {
        String ids = documents.stream()
                .map(document -> "\"" + document.id() + "\"")
                .collect(Collectors.joining(" "));
        Map<String, Object> task = Map.of("query", "id:IN [" + ids + "]");
        HttpUrl url = api().addPathSegment(indexId).addPathSegment("delete-tasks").build();
        post(url, RequestBody.create(mapper.writeValueAsString(task), JSON), "delete");
    }

    private HttpUrl ingestUrl(String commitMode) {
        return api().addPathSegment(indexId)
                .addPathSegment("ingest")
                .addQueryParameter("commit", commitMode)
                .addQueryParameter("commit_timeout_seconds", Integer.toString(commitTimeoutSeconds))
                .build();
    }

    private HttpUrl.Builder api() {
        return baseUrl.newBuilder().addPathSegment("api").addPathSegment("v1");
    }

    private void post(HttpUrl url, RequestBody body, String operation) throws IOException {
        Request request = new Request.Builder().url(url).post(body).build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SinkHttpException("quickwit " + operation + " failed: HTTP " + response.code() + " " + bodyText(response),
                        response.code());
            }
        }
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
