package io.thumbd.cache;

import io.thumbd.common.CacheKey;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToLongFunction;

/**
 * Size-bounded LRU map. When an insert would push the total past
 * {@code evictionTrigger * maxBytes}, least recently accessed entries are dropped until
 * the total is at most half the cap; a single value heavier than half the cap is refused.
 */
public final class MemoryTier<V> {

    private static final double EVICTION_TARGET_RATIO = 0.5;

    private record Entry<V>(V value, long weight) {}

    private final ToLongFunction<V> weigher;
    private final LinkedHashMap<CacheKey, Entry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();

    private long maxBytes;
    private final double evictionTrigger;
    private long sizeBytes;
    private long hits;
    private long misses;
    private long evictions;

    public MemoryTier(long maxBytes, double evictionTrigger, ToLongFunction<V> weigher) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (evictionTrigger <= EVICTION_TARGET_RATIO || evictionTrigger > 1.0) {
            throw new IllegalArgumentException("evictionTrigger must be in (0.5, 1.0]");
        }
        this.maxBytes = maxBytes;
        this.evictionTrigger = evictionTrigger;
        this.weigher = weigher;
    }

    public Optional<V> get(CacheKey key) {
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(CacheKey key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean put(CacheKey key, V value) {
        long weight = weigher.applyAsLong(value);

        lock.lock();
        try {
            if (weight > maxBytes / 2) {
                return false;
            }

            Entry<V> previous = entries.remove(key);
            if (previous != null) {
                sizeBytes -= previous.weight();
            }

            if (sizeBytes + weight > triggerBytes()) {
                evictDownTo((long) (maxBytes * EVICTION_TARGET_RATIO));
            }

            entries.put(key, new Entry<>(value, weight));
            sizeBytes += weight;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(CacheKey key) {
        lock.lock();
        try {
            Entry<V> entry = entries.remove(key);
            if (entry == null) {
                return false;
            }
            sizeBytes -= entry.weight();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void resize(long newMaxBytes) {
        if (newMaxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        lock.lock();
        try {
            maxBytes = newMaxBytes;
            if (sizeBytes > maxBytes) {
                evictDownTo((long) (maxBytes * EVICTION_TARGET_RATIO));
            }
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            sizeBytes = 0;
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long sizeInBytes() {
        lock.lock();
        try {
            return sizeBytes;
        } finally {
            lock.unlock();
        }
    }

    public long maxSizeInBytes() {
        lock.lock();
        try {
            return maxBytes;
        } finally {
            lock.unlock();
        }
    }

    public long hits() {
        lock.lock();
        try {
            return hits;
        } finally {
            lock.unlock();
        }
    }

    public long misses() {
        lock.lock();
        try {
            return misses;
        } finally {
            lock.unlock();
        }
    }

    public long evictions() {
        lock.lock();
        try {
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    private long triggerBytes() {
        return (long) (maxBytes * evictionTrigger);
    }

    // Iteration order of an access-ordered LinkedHashMap is least recently used first.
    private void evictDownTo(long targetBytes) {
        Iterator<Map.Entry<CacheKey, Entry<V>>> it = entries.entrySet().iterator();
        while (sizeBytes > targetBytes && it.hasNext()) {
            Entry<V> entry = it.next().getValue();
            it.remove();
            sizeBytes -= entry.weight();
            evictions++;
        }
    }
}
