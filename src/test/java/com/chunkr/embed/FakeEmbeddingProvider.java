package com.chunkr.embed;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Deterministic in-process provider: the vector of a text depends only on the text. Records every
 * request and the highest number of requests it saw at the same time.
 */
public class FakeEmbeddingProvider implements EmbeddingProvider {
    private final int dimension;
    private final long latencyMs;
    private final List<List<String>> requests = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile Predicate<List<String>> failWhen = texts -> false;

    public FakeEmbeddingProvider(int dimension) {
        this(dimension, 0);
    }

    public FakeEmbeddingProvider(int dimension, long latencyMs) {
        this.dimension = dimension;
        this.latencyMs = latencyMs;
    }

    public FakeEmbeddingProvider failFirst(int times) {
        failuresLeft.set(times);
        return this;
    }

    public FakeEmbeddingProvider failWhen(Predicate<List<String>> predicate) {
        this.failWhen = predicate;
        return this;
    }

    @Override
    public List<float[]> embed(List<String> texts) throws IOException {
        requests.add(List.copyOf(texts));
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            if (latencyMs > 0) {
                Thread.sleep(latencyMs);
            }
            if (failuresLeft.getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
                throw new EmbeddingException("provider unavailable", 503);
            }
            if (failWhen.test(texts)) {
                throw new EmbeddingException("provider rejected batch", 500);
            }
            List<float[]> vectors = new ArrayList<>(texts.size());
            for (String text : texts) {
                vectors.add(vectorFor(text, dimension));
            }
            return vectors;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public String name() {
        return "fake";
    }

    public int requestCount() {
        return requests.size();
    }

    public List<List<String>> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public int maxConcurrentRequests() {
        return maxInFlight.get();
    }

    public static float[] vectorFor(String text, int dimension) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = bytes.length == 0 ? 0f : bytes[i % bytes.length] + i;
        }
        return vector;
    }
}
