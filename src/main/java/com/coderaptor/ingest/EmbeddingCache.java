package com.coderaptor.ingest;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.runtime.RetryPolicy;

/**
 * Memoizes embeddings by content hash with least-recently-used eviction.
 *
 * <p>Lookups are lock-free and may run concurrently; inserts and evictions are serialized by a
 * single writer lock. Concurrent misses on the same text share one computation. Returned vectors
 * are shared with the cache and must not be modified.
 */
public class EmbeddingCache {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    private final EmbeddingService delegate;
    private final int capacity;
    private final RetryPolicy retryPolicy;

    private final Map<String, CachedVector> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<float[]>> inFlight = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong clock = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public EmbeddingCache(EmbeddingService delegate, int capacity, RetryPolicy retryPolicy) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.delegate = delegate;
        this.capacity = capacity;
        this.retryPolicy = retryPolicy;
    }

    public float[] getOrCompute(String text) throws EmbeddingException {
        String key = ContentHash.sha256(text);
        float[] cached = lookup(key);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<float[]> mine = new CompletableFuture<>();
        CompletableFuture<float[]> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return await(existing);
        }
        try {
            float[] raced = lookup(key);
            if (raced != null) {
                mine.complete(raced);
                return raced;
            }
            misses.incrementAndGet();
            float[] vector = retryPolicy.run("embed", EmbeddingException.class, () -> delegate.embed(text));
            if (vector == null || vector.length == 0) {
                throw new EmbeddingException("embedding service returned an empty vector");
            }
            insert(key, vector);
            mine.complete(vector);
            return vector;
        } catch (EmbeddingException | RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public Optional<float[]> get(String text) {
        return Optional.ofNullable(lookup(ContentHash.sha256(text)));
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public String embeddingVersion() {
        return delegate.version();
    }

    public void clear() {
        writeLock.lock();
        try {
            entries.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private float[] lookup(String key) {
        CachedVector entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        entry.lastUsed = clock.incrementAndGet();
        hits.incrementAndGet();
        return entry.vector;
    }

    private void insert(String key, float[] vector) {
        if (capacity == 0) {
            return;
        }
        writeLock.lock();
        try {
            CachedVector entry = new CachedVector(vector);
            entry.lastUsed = clock.incrementAndGet();
            entries.put(key, entry);
            while (entries.size() > capacity) {
                evictLeastRecentlyUsed();
            }
        } finally {
            writeLock.unlock();
        }
    }

    private void evictLeastRecentlyUsed() {
        String victim = null;
        long oldest = Long.MAX_VALUE;
        for (Map.Entry<String, CachedVector> entry : entries.entrySet()) {
            long used = entry.getValue().lastUsed;
            if (used < oldest) {
                oldest = used;
                victim = entry.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
            log.debug("embedding.cache.evicted key={} size={}", victim, entries.size());
        }
    }

    private static float[] await(CompletableFuture<float[]> pending) throws EmbeddingException {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("interrupted while waiting for a shared embedding", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingException embeddingException) {
                throw embeddingException;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new EmbeddingException("shared embedding failed", cause);
        }
    }

    private static final class CachedVector {
        private final float[] vector;
        private volatile long lastUsed;

        private CachedVector(float[] vector) {
            this.vector = vector;
        }
    }
}
