package com.chunkr.sink;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.chunkr.ingest.ChunkRecord;
import com.chunkr.ingest.MetadataPolicy;
import com.chunkr.retry.RetryPolicy;
import com.chunkr.retry.ValidationException;
import com.chunkr.runtime.AppConfig;
import com.chunkr.runtime.AppConfig.CommitMode;
import com.fasterxml.jackson.databind.JsonMappingException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DualSinkWriterTest {

    private final InMemoryVectorStore vectors = new InMemoryVectorStore();
    private final InMemorySearchIndex documents = new InMemorySearchIndex();
    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy retryPolicy = new RetryPolicy(5, Duration.ofMillis(500), Duration.ofMillis(30_000), cause -> true);

    @Test
    void shouldCommitAfterTwoTransientFailures() {
        vectors.failNext(new SinkHttpException("busy", 503), new IOException("timeout"));
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());

        WriteOutcome outcome = writer.writeVectors(embedded(batch("a", "b")));

        assertEquals(WriteOutcome.Status.COMMITTED, outcome.status());
        assertEquals(3, outcome.attempts());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), sleeps);
        assertEquals(2, vectors.pointCount());
    }

    @Test
    void shouldRejectWrongDimensionWithoutCallingStore() {
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());
        ChunkRecord record = batch("a").get(0);

        WriteOutcome outcome = writer.writeVectors(List.of(new EmbeddedChunk(record, new float[] { 1f, 2f, 3f })));

        assertEquals(WriteOutcome.Status.FATAL_FAILURE, outcome.status());
        assertEquals(0, outcome.attempts());
        assertInstanceOf(ValidationException.class, outcome.cause());
        assertEquals(0, vectors.upsertCalls());
    }

    @Test
    void shouldReportRetryableFailureOnceRetriesAreExhausted() {
        vectors.failAlways(new SinkHttpException("down", 502));
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());

        WriteOutcome outcome = writer.writeVectors(embedded(batch("a")));

        assertEquals(WriteOutcome.Status.RETRYABLE_FAILURE, outcome.status());
        assertEquals(6, outcome.attempts());
        assertEquals(6, vectors.upsertCalls());
    }

    @Test
    void shouldNotRetryClientErrors() {
        documents.failAlways(new SinkHttpException("bad request", 400));
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());

        WriteOutcome outcome = writer.writeDocuments(batch("a"));

        assertEquals(WriteOutcome.Status.FATAL_FAILURE, outcome.status());
        assertEquals(1, outcome.attempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldNotRetryPayloadSerializationFailures() {
        vectors.failAlways(new JsonMappingException(null, "cannot serialize payload"));
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());

        WriteOutcome outcome = writer.writeVectors(embedded(batch("a")));

        assertEquals(WriteOutcome.Status.FATAL_FAILURE, outcome.status());
        assertEquals(1, outcome.attempts());
        assertEquals(1, vectors.upsertCalls());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldKeepOneRecordPerIdWhenBatchIsReplayed() {
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());
        List<ChunkRecord> batch = batch("a", "b", "c");

        writer.writeVectors(embedded(batch));
        writer.writeDocuments(batch);
        writer.writeVectors(embedded(batch));
        writer.writeDocuments(batch);

        assertEquals(3, vectors.pointCount());
        assertEquals(3, documents.committedCount());
        assertEquals(6, documents.documentsWritten());
    }

    @Test
    void shouldWriteSinksIndependently() {
        documents.failAlways(new SinkHttpException("down", 500));
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());
        List<ChunkRecord> batch = batch("a", "b");

        WriteOutcome vectorOutcome = writer.writeVectors(embedded(batch));
        WriteOutcome documentOutcome = writer.writeDocuments(batch);

        assertTrue(vectorOutcome.isCommitted());
        assertFalse(documentOutcome.isCommitted());
        assertEquals(2, vectors.pointCount());
        assertEquals(0, documents.committedCount());
    }

    @Test
    void shouldIssueSingleCommitAtEndOfDeferredRun() {
        DualSinkWriter writer = writer(CommitMode.DEFERRED, MetadataPolicy.includeAll());

        writer.writeDocuments(batch("a", "b"));
        writer.writeDocuments(batch("c"));
        assertEquals(0, documents.committedCount());
        assertEquals(3, documents.stagedCount());

        WriteOutcome commit = writer.finishRun();

        assertTrue(commit.isCommitted());
        assertEquals(1, documents.commitCalls());
        assertEquals(3, documents.committedCount());
        assertEquals(0, writer.finishRun().attempts());
        assertEquals(1, documents.commitCalls());
    }

    @Test
    void shouldNotCommitWhenImmediate() {
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll());

        writer.writeDocuments(batch("a"));
        writer.finishRun();

        assertEquals(0, documents.commitCalls());
        assertEquals(1, documents.committedCount());
    }

    @Test
    void shouldCarrySelectedMetadataAndIdentityInPayload() {
        AppConfig.MetadataConfig metadata = new AppConfig.MetadataConfig();
        metadata.setIncludeAuthors(false);
        metadata.setIncludeSourcePath(false);
        DualSinkWriter writer = writer(CommitMode.IMMEDIATE, new MetadataPolicy(metadata));
        ChunkRecord record = ChunkRecord.of("text", "books/a.epub", "doc", 3, Map.of("title", "T", "authors", "X"));

        writer.writeVectors(List.of(new EmbeddedChunk(record, new float[] { 1f, 2f })));
        writer.writeDocuments(List.of(record));

        Map<String, Object> payload = vectors.point(record.id()).payload();
        assertEquals("T", payload.get("title"));
        assertEquals("doc", payload.get("document_id"));
        assertEquals(3, payload.get("chunk_index"));
        assertFalse(payload.containsKey("authors"));
        assertFalse(payload.containsKey("source_path"));
        assertEquals(payload, documents.committed(record.id()).metadata());
    }

    @Test
    void shouldCreateCollectionDuringPreparation() throws IOException {
        writer(CommitMode.IMMEDIATE, MetadataPolicy.includeAll()).prepare(true);

        assertTrue(vectors.collectionEnsured());
    }

    private DualSinkWriter writer(CommitMode commitMode, MetadataPolicy policy) {
        return new DualSinkWriter(vectors, documents, policy, retryPolicy, sleeps::add, 2, commitMode);
    }

    private static List<ChunkRecord> batch(String... texts) {
        List<ChunkRecord> records = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            records.add(ChunkRecord.of(texts[i], "source", "doc", i, Map.of()));
        }
        return records;
    }

    private static List<EmbeddedChunk> embedded(List<ChunkRecord> records) {
        return records.stream()
                .map(record -> new EmbeddedChunk(record, new float[] { record.text().length(), 1f }))
                .toList();
    }
}
