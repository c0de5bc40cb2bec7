package com.chunkr.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chunkr.retry.Attempted;
import com.chunkr.retry.RetryExecutor;
import com.chunkr.retry.RetryPolicy;
import com.chunkr.retry.Sleeper;

/**
 * Sends texts to the embedding provider in sub-batches of {@code requestBatchSize}. Two limits apply
 * independently: at most {@code maxConcurrency} sub-batches of one call are in flight, and at most as
 * many requests as {@code globalPermits} allows are in flight across the whole process. A global
 * permit is held only while a request is on the wire, never during a backoff sleep.
 * <p>
 * A sub-batch that still fails after its retries only fails its own texts; the rest of the call
 * completes normally. The client does not cache.
 */
public class EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);

    private final EmbeddingProvider provider;
    private final Semaphore globalPermits;
    private final ExecutorService executor;
    private final RetryExecutor retryExecutor;
    private final int requestBatchSize;
    private final int maxConcurrency;
    private final int maxInputChars;
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong truncated = new AtomicLong();

    public EmbeddingClient(EmbeddingProvider provider,
            Semaphore globalPermits,
            ExecutorService executor,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            int requestBatchSize,
            int maxConcurrency,
            int maxInputChars) {
        if (requestBatchSize <= 0 || maxConcurrency <= 0 || maxInputChars <= 0) {
            throw new IllegalArgumentException("requestBatchSize, maxConcurrency and maxInputChars must be > 0");
        }
        this.provider = provider;
        this.globalPermits = globalPermits;
        this.executor = executor;
        // timeouts, non-2xx statuses and malformed bodies all surface as IOException
        this.retryExecutor = new RetryExecutor(retryPolicy.withRetryable(cause -> cause instanceof IOException), sleeper);
        this.requestBatchSize = requestBatchSize;
        this.maxConcurrency = maxConcurrency;
        this.maxInputChars = maxInputChars;
    }

    public EmbeddingResult embed(List<String> texts) throws InterruptedException {
        if (texts.isEmpty()) {
            return new EmbeddingResult(List.of(), List.of());
        }
        List<String> prepared = texts.stream().map(this::truncate).toList();
        Semaphore callPermits = new Semaphore(maxConcurrency);
        List<CompletableFuture<Attempted<List<float[]>>>> futures = new ArrayList<>();
        List<int[]> ranges = new ArrayList<>();

        for (int from = 0; from < prepared.size(); from += requestBatchSize) {
            int to = Math.min(from + requestBatchSize, prepared.size());
            List<String> slice = prepared.subList(from, to);
            String operation = "embed[" + from + ".." + to + ")";
            callPermits.acquire();
            CompletableFuture<Attempted<List<float[]>>> future;
            try {
                future = CompletableFuture.supplyAsync(() -> retryExecutor.execute(operation, attempt -> send(slice)), executor);
            } catch (RuntimeException e) {
                callPermits.release();
                throw e;
            }
            future.whenComplete((result, error) -> callPermits.release());
            futures.add(future);
            ranges.add(new int[] { from, to });
        }

        float[][] vectors = new float[prepared.size()][];
        List<EmbeddingResult.SubBatchFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            int from = ranges.get(i)[0];
            int to = ranges.get(i)[1];
            Attempted<List<float[]>> attempted = await(futures.get(i));
            if (attempted.succeeded()) {
                List<float[]> slice = attempted.value();
                for (int j = 0; j < slice.size(); j++) {
                    vectors[from + j] = slice.get(j);
                }
            } else {
                log.error("embed.subbatch.failed provider={} range=[{},{}) attempts={} cause={}",
                        provider.name(), from, to, attempted.attempts(), String.valueOf(attempted.failure()));
                failures.add(new EmbeddingResult.SubBatchFailure(from, to, attempted.attempts(), attempted.failure()));
            }
        }
        return new EmbeddingResult(Arrays.asList(vectors), failures);
    }

    public long requestsIssued() {
        return requests.get();
    }

    public long truncatedInputs() {
        return truncated.get();
    }

    private List<float[]> send(List<String> slice) throws Exception {
        globalPermits.acquire();
        try {
            requests.incrementAndGet();
            List<float[]> vectors = provider.embed(slice);
            if (vectors == null || vectors.size() != slice.size()) {
                throw new EmbeddingException(provider.name() + " returned "
                        + (vectors == null ? 0 : vectors.size()) + " vectors for " + slice.size() + " inputs");
            }
            return vectors;
        } finally {
            globalPermits.release();
        }
    }

    private Attempted<List<float[]>> await(CompletableFuture<Attempted<List<float[]>>> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return Attempted.failed(e.getCause(), 0, false);
        }
    }

    /**
     * Cuts the text to {@code maxInputChars} UTF-16 units without splitting a surrogate pair.
     */
    String truncate(String text) {
        if (text.length() <= maxInputChars) {
            return text;
        }
        int end = maxInputChars;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        truncated.incrementAndGet();
        log.warn("embed.input.truncated originalChars={} keptChars={}", text.length(), end);
        return text.substring(0, end);
    }
}
