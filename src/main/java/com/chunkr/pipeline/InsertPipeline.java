package com.chunkr.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.chunkr.embed.EmbeddingCache;
import com.chunkr.embed.EmbeddingClient;
import com.chunkr.embed.EmbeddingResult;
import com.chunkr.embed.InFlightEmbeddings;
import com.chunkr.ingest.ChunkRecord;
import com.chunkr.ingest.ChunkSource;
import com.chunkr.ingest.FingerprintKey;
import com.chunkr.sink.DualSinkWriter;
import com.chunkr.sink.EmbeddedChunk;
import com.chunkr.sink.Sink;
import com.chunkr.sink.WriteOutcome;

/**
 * Drives chunk files through cache lookup, embedding and the dual-sink write.
 * <p>
 * Up to {@code maxParallelFiles} files are drained at once. Inside a file, batches are embedded in
 * order; the writes of a batch overlap with the embedding of the next one, and at most one batch's
 * writes are outstanding per file. {@link #requestStop()} stops admitting files and batches; work
 * already admitted runs to its final outcome.
 */
public class InsertPipeline {
    private static final Logger log = LoggerFactory.getLogger(InsertPipeline.class);

    private final EmbeddingCache cache;
    private final InFlightEmbeddings inFlight;
    private final EmbeddingClient embeddingClient;
    private final DualSinkWriter writer;
    private final ChunkSourceFactory sourceFactory;
    private final ExecutorService sinkExecutor;
    private final int batchSize;
    private final int maxParallelFiles;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public InsertPipeline(EmbeddingCache cache,
            InFlightEmbeddings inFlight,
            EmbeddingClient embeddingClient,
            DualSinkWriter writer,
            ChunkSourceFactory sourceFactory,
            ExecutorService sinkExecutor,
            int batchSize,
            int maxParallelFiles) {
        if (batchSize <= 0 || maxParallelFiles <= 0) {
            throw new IllegalArgumentException("batchSize and maxParallelFiles must be > 0");
        }
        this.cache = cache;
        this.inFlight = inFlight;
        this.embeddingClient = embeddingClient;
        this.writer = writer;
        this.sourceFactory = sourceFactory;
        this.sinkExecutor = sinkExecutor;
        this.batchSize = batchSize;
        this.maxParallelFiles = maxParallelFiles;
    }

    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.warn("insert.stop.requested admitting no further files or batches");
        }
    }

    public RunReport run(List<Path> files) {
        return run(files, Map.of());
    }

    /**
     * @param onlyIds when a file has an entry here, only chunks with those ids are submitted
     */
    public RunReport run(List<Path> files, Map<String, Set<String>> onlyIds) {
        log.info("insert.start files={} batchSize={} maxParallelFiles={}", files.size(), batchSize, maxParallelFiles);
        ExecutorService fileExecutor = Executors.newFixedThreadPool(maxParallelFiles, namedThreads("chunkr-file"));
        List<Future<FileReport>> futures = new ArrayList<>();
        try {
            for (Path file : files) {
                Set<String> ids = onlyIds.get(file.toString());
                Predicate<ChunkRecord> filter = ids == null ? record -> true : record -> ids.contains(record.id());
                futures.add(fileExecutor.submit(() -> admit(file, filter)));
            }
            List<FileReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                reports.add(await(files.get(i), futures.get(i)));
            }

            WriteOutcome commit = writer.finishRun();
            if (!commit.isCommitted()) {
                log.error("insert.commit.failed attempts={} cause={}", commit.attempts(), commit.causeMessage());
            }
            RunReport report = new RunReport(reports, stopRequested.get(), commit.status().name(),
                    embeddingClient.requestsIssued(), cache.stats());
            logSummary(report);
            return report;
        } finally {
            fileExecutor.shutdown();
        }
    }

    private FileReport await(Path file, Future<FileReport> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
            return FileReport.abandoned(file.toString(), e);
        } catch (ExecutionException e) {
            log.error("insert.file.crashed file={}", file, e.getCause());
            return FileReport.abandoned(file.toString(), e.getCause());
        }
    }

    private FileReport admit(Path file, Predicate<ChunkRecord> filter) {
        if (stopRequested.get()) {
            return FileReport.pending(file.toString());
        }
        MDC.put("file", file.getFileName().toString());
        try {
            return processFile(file, filter);
        } finally {
            MDC.remove("file");
        }
    }

    FileReport processFile(Path file, Predicate<ChunkRecord> filter) {
        FileProgress progress = new FileProgress(file.toString());
        log.info("insert.file.start file={}", file);
        try (ChunkSource source = sourceFactory.open(file)) {
            CompletableFuture<BatchReport> pendingWrites = null;
            try {
                int batchNumber = 0;
                while (true) {
                    if (stopRequested.get()) {
                        progress.interrupted = source.next().isPresent();
                        break;
                    }
                    List<ChunkRecord> batch = readBatch(source, filter, progress);
                    if (batch.isEmpty()) {
                        break;
                    }
                    batchNumber++;
                    BatchVectors vectors = resolveVectors(batch, progress);
                    if (pendingWrites != null) {
                        progress.record(pendingWrites.join());
                    }
                    pendingWrites = dispatchWrites(batchNumber, batch, vectors);
                }
            } catch (IOException e) {
                progress.failure = e;
                log.error("insert.file.read.failed file={} cause={}", file, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                progress.interrupted = true;
            } finally {
                if (pendingWrites != null) {
                    progress.record(pendingWrites.join());
                }
                progress.malformed = source.malformedRecords();
            }
        } catch (IOException e) {
            if (progress.failure == null) {
                progress.failure = e;
            }
            log.error("insert.file.open.failed file={} cause={}", file, e.toString());
        }
        FileReport report = progress.toReport();
        log.info("insert.file.done file={} status={} chunks={} cacheHits={} computed={} vectors={} documents={} abandoned={}",
                file, report.status(), report.chunksRead(), report.cacheHits(), report.computed(),
                report.vectorsCommitted(), report.documentsCommitted(), report.abandonedIds().size());
        return report;
    }

    private List<ChunkRecord> readBatch(ChunkSource source, Predicate<ChunkRecord> filter, FileProgress progress) throws IOException {
        List<ChunkRecord> batch = new ArrayList<>(batchSize);
        while (batch.size() < batchSize) {
            Optional<ChunkRecord> next = source.next();
            if (next.isEmpty()) {
                break;
            }
            if (!filter.test(next.get())) {
                progress.skipped++;
                continue;
            }
            batch.add(next.get());
        }
        progress.chunksRead += batch.size();
        return batch;
    }

    /**
     * Serves every chunk of the batch from the cache, from another worker's in-flight request for the
     * same text, or from one provider call covering the fingerprints this worker claimed.
     */
    BatchVectors resolveVectors(List<ChunkRecord> batch, FileProgress progress) throws InterruptedException {
        int size = batch.size();
        float[][] vectors = new float[size][];
        Throwable[] failures = new Throwable[size];
        Set<Integer> computedBy = new HashSet<>();
        Map<FingerprintKey, List<Integer>> owned = new LinkedHashMap<>();
        Map<FingerprintKey, List<Integer>> awaited = new LinkedHashMap<>();
        Map<FingerprintKey, InFlightEmbeddings.Claim> claims = new LinkedHashMap<>();

        for (int i = 0; i < size; i++) {
            FingerprintKey key = batch.get(i).fingerprint();
            if (owned.containsKey(key)) {
                owned.get(key).add(i);
                continue;
            }
            if (awaited.containsKey(key)) {
                awaited.get(key).add(i);
                continue;
            }
            Optional<float[]> cached = cache.lookup(key);
            if (cached.isPresent()) {
                vectors[i] = cached.get();
                continue;
            }
            InFlightEmbeddings.Claim claim = inFlight.claim(key);
            claims.put(key, claim);
            if (!claim.owner()) {
                awaited.computeIfAbsent(key, unused -> new ArrayList<>()).add(i);
                continue;
            }
            // another worker may have published between the lookup and the claim
            Optional<float[]> late = cache.lookup(key);
            if (late.isPresent()) {
                inFlight.complete(claim, late.get());
                vectors[i] = late.get();
                continue;
            }
            owned.computeIfAbsent(key, unused -> new ArrayList<>()).add(i);
        }

        if (!owned.isEmpty()) {
            computeOwned(batch, owned, claims, vectors, failures, computedBy);
        }
        for (Map.Entry<FingerprintKey, List<Integer>> entry : awaited.entrySet()) {
            float[] vector = null;
            Throwable failure = null;
            try {
                vector = claims.get(entry.getKey()).future().get();
            } catch (ExecutionException e) {
                failure = e.getCause();
            }
            for (int index : entry.getValue()) {
                vectors[index] = vector;
                failures[index] = failure;
            }
        }

        for (int i = 0; i < size; i++) {
            if (vectors[i] == null) {
                continue;
            }
            if (computedBy.contains(i)) {
                progress.computed++;
            } else {
                progress.cacheHits++;
            }
        }
        return new BatchVectors(vectors, failures);
    }

    private void computeOwned(List<ChunkRecord> batch,
            Map<FingerprintKey, List<Integer>> owned,
            Map<FingerprintKey, InFlightEmbeddings.Claim> claims,
            float[][] vectors,
            Throwable[] failures,
            Set<Integer> computedBy) throws InterruptedException {
        List<FingerprintKey> keys = new ArrayList<>(owned.keySet());
        List<String> texts = keys.stream().map(key -> batch.get(owned.get(key).get(0)).text()).toList();
        Set<FingerprintKey> published = new HashSet<>();
        try {
            EmbeddingResult result = embeddingClient.embed(texts);
            for (int j = 0; j < keys.size(); j++) {
                FingerprintKey key = keys.get(j);
                InFlightEmbeddings.Claim claim = claims.get(key);
                List<Integer> indexes = owned.get(key);
                float[] vector = result.vector(j);
                if (vector != null) {
                    cache.insert(key, vector);
                    inFlight.complete(claim, vector);
                    computedBy.add(indexes.get(0));
                    for (int index : indexes) {
                        vectors[index] = vector;
                    }
                } else {
                    Throwable cause = result.failureFor(j).cause();
                    inFlight.fail(claim, cause);
                    for (int index : indexes) {
                        failures[index] = cause;
                    }
                }
                published.add(key);
            }
        } finally {
            // waiters on our claims must never block forever
            for (FingerprintKey key : keys) {
                if (!published.contains(key)) {
                    inFlight.fail(claims.get(key), new IllegalStateException("embedding abandoned before completion"));
                }
            }
        }
    }

    private CompletableFuture<BatchReport> dispatchWrites(int batchNumber, List<ChunkRecord> batch, BatchVectors vectors) {
        List<String> ids = batch.stream().map(ChunkRecord::id).toList();
        CompletableFuture<WriteOutcome> vectorWrite;
        Optional<Throwable> embeddingFailure = vectors.firstFailure();
        if (embeddingFailure.isPresent()) {
            log.error("insert.batch.embedding.failed batch={} chunks={} missingVectors={} cause={}",
                    batchNumber, batch.size(), vectors.missing(), embeddingFailure.get().toString());
            vectorWrite = CompletableFuture.completedFuture(
                    WriteOutcome.fatalFailure(Sink.VECTOR_STORE, 0, embeddingFailure.get()));
        } else {
            List<EmbeddedChunk> embedded = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                embedded.add(new EmbeddedChunk(batch.get(i), vectors.vectors()[i]));
            }
            vectorWrite = CompletableFuture.supplyAsync(withMdc(() -> writer.writeVectors(embedded)), sinkExecutor);
        }
        CompletableFuture<WriteOutcome> documentWrite =
                CompletableFuture.supplyAsync(withMdc(() -> writer.writeDocuments(batch)), sinkExecutor);
        return vectorWrite.thenCombine(documentWrite,
                (vectorOutcome, documentOutcome) -> new BatchReport(batchNumber, ids, vectorOutcome, documentOutcome));
    }

    private static <T> Supplier<T> withMdc(Supplier<T> body) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return body.get();
            } finally {
                MDC.clear();
            }
        };
    }

    private void logSummary(RunReport report) {
        log.info("insert.complete files={} chunks={} cacheHits={} computed={} providerRequests={} vectorsCommitted={} documentsCommitted={} abandoned={} malformed={} stopped={} commit={}",
                report.files().size(), report.chunksRead(), report.cacheHits(), report.computed(),
                report.providerRequests(), report.vectorsCommitted(), report.documentsCommitted(),
                report.abandonedChunks(), report.malformedRecords(), report.stopped(), report.finalCommit());
        report.abandonedIds().forEach((file, ids) -> log.warn("insert.abandoned file={} ids={}", file, ids));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    record BatchVectors(float[][] vectors, Throwable[] failures) {
        Optional<Throwable> firstFailure() {
            for (int i = 0; i < vectors.length; i++) {
                if (vectors[i] == null) {
                    Throwable failure = failures[i];
                    return Optional.of(failure == null ? new IllegalStateException("vector missing") : failure);
                }
            }
            return Optional.empty();
        }

        int missing() {
            int count = 0;
            for (float[] vector : vectors) {
                if (vector == null) {
                    count++;
                }
            }
            return count;
        }
    }

    static final class FileProgress {
        private final String path;
        private int chunksRead;
        private int malformed;
        private int skipped;
        private int cacheHits;
        private int computed;
        private int vectorsCommitted;
        private int documentsCommitted;
        private int batchesCompleted;
        private int batchesAbandoned;
        private final List<String> abandonedIds = new ArrayList<>();
        private boolean interrupted;
        private Throwable failure;

        FileProgress(String path) {
            this.path = path;
        }

        void record(BatchReport batch) {
            if (batch.vectors().isCommitted()) {
                vectorsCommitted += batch.size();
            }
            if (batch.documents().isCommitted()) {
                documentsCommitted += batch.size();
            }
            if (batch.completed()) {
                batchesCompleted++;
                log.info("insert.batch.committed file={} batch={} chunks={} vectorAttempts={} documentAttempts={}",
                        path, batch.batchNumber(), batch.size(), batch.vectors().attempts(), batch.documents().attempts());
                return;
            }
            batchesAbandoned++;
            abandonedIds.addAll(batch.chunkIds());
            log.error("insert.batch.abandoned file={} batch={} vectors={}({}) documents={}({}) ids={}",
                    path, batch.batchNumber(),
                    batch.vectors().status(), batch.vectors().causeMessage(),
                    batch.documents().status(), batch.documents().causeMessage(),
                    batch.chunkIds());
        }

        FileReport toReport() {
            FileStatus status;
            if (failure != null && batchesCompleted == 0 && batchesAbandoned == 0) {
                status = FileStatus.ABANDONED;
            } else if (interrupted) {
                status = FileStatus.INTERRUPTED;
            } else if (failure != null || batchesAbandoned > 0) {
                status = FileStatus.PARTIALLY_FAILED;
            } else {
                status = FileStatus.COMPLETED;
            }
            return new FileReport(path, status, chunksRead, malformed, skipped, cacheHits, computed,
                    vectorsCommitted, documentsCommitted, batchesCompleted, batchesAbandoned, abandonedIds,
                    failure == null ? "" : failure.toString());
        }
    }
}
