package com.chunkr.embed;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.chunkr.ingest.FingerprintKey;

/**
 * Registry of fingerprints whose embedding is currently being computed. The first worker to claim a
 * fingerprint owns the provider call; later workers wait on the owner's future instead of issuing a
 * second request for the same text.
 */
public class InFlightEmbeddings {
    private final ConcurrentMap<FingerprintKey, CompletableFuture<float[]>> pending = new ConcurrentHashMap<>();

    public Claim claim(FingerprintKey key) {
        CompletableFuture<float[]> mine = new CompletableFuture<>();
        CompletableFuture<float[]> existing = pending.putIfAbsent(key, mine);
        if (existing == null) {
            return new Claim(key, mine, true);
        }
        return new Claim(key, existing, false);
    }

    /**
     * Publishes the owner's result. Callers insert into the cache first so a worker that misses the
     * registry afterwards finds the vector in the cache.
     */
    public void complete(Claim claim, float[] vector) {
        pending.remove(claim.key(), claim.future());
        claim.future().complete(vector);
    }

    public void fail(Claim claim, Throwable cause) {
        pending.remove(claim.key(), claim.future());
        claim.future().completeExceptionally(cause);
    }

    public int size() {
        return pending.size();
    }

    public record Claim(FingerprintKey key, CompletableFuture<float[]> future, boolean owner) {
    }
}
