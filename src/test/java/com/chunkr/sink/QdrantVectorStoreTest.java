package com.chunkr.sink;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QdrantVectorStoreTest {

    private MockWebServer server;
    private QdrantVectorStore store;

    @BeforeEach
    void start() throws IOException {
        server = new MockWebServer();
        server.start();
        store = new QdrantVectorStore(new OkHttpClient(), server.url("/").toString(), "books", 2, "Cosine", "key-1");
    }

    @AfterEach
    void stop() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldUpsertPointsAndWaitForPersistence() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));

        store.upsert(List.of(new VectorPoint("7f1c1d9e-0000-3000-8000-000000000001", new float[] { 0.5f, 1f },
                Map.of("title", "T"))));

        RecordedRequest request = server.takeRequest();
        assertEquals("PUT", request.getMethod());
        assertEquals("/collections/books/points?wait=true", request.getPath());
        assertEquals("key-1", request.getHeader("api-key"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"id\":\"7f1c1d9e-0000-3000-8000-000000000001\""), body);
        assertTrue(body.contains("\"vector\":[0.5,1.0]"), body);
        assertTrue(body.contains("\"title\":\"T\""), body);
    }

    @Test
    void shouldTreatExistingCollectionAsSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(409).setBody("{\"status\":{\"error\":\"Collection already exists\"}}"));

        assertDoesNotThrow(() -> store.ensureCollection());

        RecordedRequest request = server.takeRequest();
        assertEquals("PUT", request.getMethod());
        assertEquals("/collections/books", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"size\":2"), body);
        assertTrue(body.contains("\"distance\":\"Cosine\""), body);
    }

    @Test
    void shouldClassifyServerErrorsAsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"status\":{\"error\":\"bad vector\"}}"));
        List<VectorPoint> points = List.of(new VectorPoint("id", new float[] { 1f, 2f }, Map.of()));

        SinkHttpException unavailable = assertThrows(SinkHttpException.class, () -> store.upsert(points));
        SinkHttpException rejected = assertThrows(SinkHttpException.class, () -> store.upsert(points));

        assertTrue(unavailable.isTransient());
        assertFalse(rejected.isTransient());
        assertTrue(SinkHttpException.isRetryable(unavailable));
        assertFalse(SinkHttpException.isRetryable(rejected));
        assertTrue(SinkHttpException.isRetryable(new IOException("connection reset")));
    }

    @Test
    void shouldReportUnreachableCollection() {
        server.enqueue(new MockResponse().setResponseCode(404));

        SinkHttpException error = assertThrows(SinkHttpException.class, () -> store.checkReachable());

        assertEquals(404, error.status());
    }
}
