package com.chunkr.sink;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Vector store keyed by point id, with scripted failures for the next calls.
 */
public class InMemoryVectorStore implements VectorStore {
    private final Map<String, VectorPoint> points = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Deque<IOException> scriptedFailures = new ArrayDeque<>();
    private final AtomicInteger upsertCalls = new AtomicInteger();
    private final List<Integer> batchSizes = Collections.synchronizedList(new ArrayList<>());
    private volatile IOException alwaysFail;
    private boolean collectionEnsured;

    public synchronized InMemoryVectorStore failNext(IOException... failures) {
        Collections.addAll(scriptedFailures, failures);
        return this;
    }

    public InMemoryVectorStore failAlways(IOException failure) {
        this.alwaysFail = failure;
        return this;
    }

    @Override
    public synchronized void ensureCollection() {
        collectionEnsured = true;
    }

    @Override
    public void checkReachable() {
    }

    @Override
    public void upsert(List<VectorPoint> batch) throws IOException {
        upsertCalls.incrementAndGet();
        IOException failure;
        synchronized (this) {
            failure = scriptedFailures.poll();
        }
        if (failure == null) {
            failure = alwaysFail;
        }
        if (failure != null) {
            throw failure;
        }
        batchSizes.add(batch.size());
        for (VectorPoint point : batch) {
            points.put(point.id(), point);
        }
    }

    @Override
    public String describe() {
        return "memory:vectors";
    }

    public int upsertCalls() {
        return upsertCalls.get();
    }

    public int pointCount() {
        return points.size();
    }

    public VectorPoint point(String id) {
        return points.get(id);
    }

    public int pointsWritten() {
        synchronized (batchSizes) {
            return batchSizes.stream().mapToInt(Integer::intValue).sum();
        }
    }

    public synchronized boolean collectionEnsured() {
        return collectionEnsured;
    }
}
