package com.chunkr.sink;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chunkr.ingest.ChunkRecord;
import com.chunkr.ingest.MetadataPolicy;
import com.chunkr.retry.Attempted;
import com.chunkr.retry.RetryExecutor;
import com.chunkr.retry.RetryPolicy;
import com.chunkr.retry.Sleeper;
import com.chunkr.retry.ValidationException;
import com.chunkr.runtime.AppConfig.CommitMode;

/**
 * Commits batches to the vector store and the search index. The two write paths share no lock and
 * no state: each retries on its own budget and reports its own {@link WriteOutcome}, so a batch stuck
 * on one sink never holds up the other.
 */
public class DualSinkWriter {
    private static final Logger log = LoggerFactory.getLogger(DualSinkWriter.class);

    private final VectorStore vectorStore;
    private final SearchIndex searchIndex;
    private final MetadataPolicy metadataPolicy;
    private final RetryExecutor retryExecutor;
    private final int dimension;
    private final CommitMode commitMode;
    private final AtomicBoolean uncommittedDocuments = new AtomicBoolean(false);

    public DualSinkWriter(VectorStore vectorStore,
            SearchIndex searchIndex,
            MetadataPolicy metadataPolicy,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            int dimension,
            CommitMode commitMode) {
        this.vectorStore = vectorStore;
        this.searchIndex = searchIndex;
        this.metadataPolicy = metadataPolicy;
        this.retryExecutor = new RetryExecutor(retryPolicy.withRetryable(SinkHttpException::isRetryable), sleeper);
        this.dimension = dimension;
        this.commitMode = commitMode;
    }

    public WriteOutcome writeVectors(List<EmbeddedChunk> batch) {
        if (batch.isEmpty()) {
            return WriteOutcome.committed(Sink.VECTOR_STORE, 0);
        }
        for (EmbeddedChunk chunk : batch) {
            float[] vector = chunk.vector();
            if (vector == null || vector.length != dimension) {
                ValidationException mismatch = new ValidationException("chunk " + chunk.record().id()
                        + " has dimension " + (vector == null ? 0 : vector.length) + ", collection expects " + dimension);
                log.error("sink.vectors.rejected store={} chunks={} reason={}",
                        vectorStore.describe(), batch.size(), mismatch.getMessage());
                return WriteOutcome.fatalFailure(Sink.VECTOR_STORE, 0, mismatch);
            }
        }
        List<VectorPoint> points = batch.stream()
                .map(chunk -> new VectorPoint(chunk.record().id(), chunk.vector(), payload(chunk.record())))
                .toList();
        Attempted<Void> attempted = retryExecutor.execute("upsert " + vectorStore.describe(), attempt -> {
            vectorStore.upsert(points);
            return null;
        });
        return toOutcome(Sink.VECTOR_STORE, attempted);
    }

    public WriteOutcome writeDocuments(List<ChunkRecord> batch) {
        if (batch.isEmpty()) {
            return WriteOutcome.committed(Sink.SEARCH_INDEX, 0);
        }
        List<IndexDocument> documents = batch.stream()
                .map(record -> new IndexDocument(record.id(), record.text(), payload(record)))
                .toList();
        boolean commitNow = commitMode == CommitMode.IMMEDIATE;
        Attempted<Void> attempted = retryExecutor.execute("ingest " + searchIndex.describe(), attempt -> {
            searchIndex.ingest(documents, commitNow);
            return null;
        });
        if (attempted.succeeded() && !commitNow) {
            uncommittedDocuments.set(true);
        }
        return toOutcome(Sink.SEARCH_INDEX, attempted);
    }

    /**
     * End-of-run signal. Issues the single deferred commit when documents were ingested without one.
     */
    public WriteOutcome finishRun() {
        if (!uncommittedDocuments.getAndSet(false)) {
            return WriteOutcome.committed(Sink.SEARCH_INDEX, 0);
        }
        Attempted<Void> attempted = retryExecutor.execute("commit " + searchIndex.describe(), attempt -> {
            searchIndex.commit();
            return null;
        });
        if (!attempted.succeeded()) {
            uncommittedDocuments.set(true);
        }
        return toOutcome(Sink.SEARCH_INDEX, attempted);
    }

    /**
     * Checks both sinks before the first write, creating the vector collection when asked to.
     */
    public void prepare(boolean createCollection) throws IOException {
        if (createCollection) {
            vectorStore.ensureCollection();
        } else {
            vectorStore.checkReachable();
        }
        searchIndex.checkReachable();
    }

    private Map<String, Object> payload(ChunkRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>(metadataPolicy.select(record.metadata()));
        payload.put("document_id", record.documentId());
        payload.put("chunk_index", record.index());
        if (metadataPolicy.includes("source_path")) {
            payload.put("source_path", record.sourcePath());
        }
        return payload;
    }

    private static WriteOutcome toOutcome(Sink sink, Attempted<Void> attempted) {
        if (attempted.succeeded()) {
            return WriteOutcome.committed(sink, attempted.attempts());
        }
        if (attempted.exhausted()) {
            return WriteOutcome.retryableFailure(sink, attempted.attempts(), attempted.failure());
        }
        return WriteOutcome.fatalFailure(sink, attempted.attempts(), attempted.failure());
    }
}
