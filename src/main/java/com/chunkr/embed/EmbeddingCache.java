package com.chunkr.embed;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.chunkr.ingest.FingerprintKey;

/**
 * Bounded, process-lifetime map from text fingerprint to embedding vector, shared by every file worker.
 * Evicts the least recently used entry on overflow; entries last used at the same instant leave in
 * insertion order. Writes are first-wins: inserting a key that is already present is a no-op.
 */
public class EmbeddingCache {
    private final int capacity;
    private final Clock clock;
    private final LinkedHashMap<FingerprintKey, CacheEntry> entries;
    private long hits;
    private long misses;
    private long evictions;

    public EmbeddingCache(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public EmbeddingCache(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.clock = clock;
        // access order keeps the least recently used entry at the head
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true);
    }

    public synchronized Optional<float[]> lookup(FingerprintKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        entries.put(key, entry.touch(clock.instant()));
        return Optional.of(entry.vector());
    }

    /**
     * @return true when the vector was stored, false when the key was already present
     */
    public synchronized boolean insert(FingerprintKey key, float[] vector) {
        if (entries.containsKey(key)) {
            return false;
        }
        entries.put(key, new CacheEntry(key, vector.clone(), clock.instant()));
        if (entries.size() > capacity) {
            Iterator<Map.Entry<FingerprintKey, CacheEntry>> eldest = entries.entrySet().iterator();
            eldest.next();
            eldest.remove();
            evictions++;
        }
        return true;
    }

    public synchronized boolean contains(FingerprintKey key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Stats stats() {
        return new Stats(entries.size(), capacity, hits, misses, evictions);
    }

    public record CacheEntry(FingerprintKey key, float[] vector, Instant lastUsed) {
        CacheEntry touch(Instant now) {
            return new CacheEntry(key, vector, now);
        }
    }

    public record Stats(int size, int capacity, long hits, long misses, long evictions) {
    }
}
