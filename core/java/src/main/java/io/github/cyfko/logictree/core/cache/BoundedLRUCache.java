package io.github.cyfko.logictree.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe, size-bounded cache with least-recently-used eviction.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}; every read reorders the map, so all
 * operations run under one lock. Hit and miss counts are kept for {@link #getStats()}.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, LogicTree> cache = new BoundedLRUCache<>(100);
 * cache.put("a + b", tree);
 * LogicTree hit = cache.get("a + b");
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param maxSize the maximum number of entries to keep
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }

        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * Looks up a value and marks it most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if absent
     */
    public V get(K key) {
        lock.lock();
        try {
            V value = entries.get(key);
            (value != null ? hits : misses).incrementAndGet();
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry when full.
     *
     * @param key   the key to store
     * @param value the value to store, not null
     */
    public void put(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot cache a null value");
        }
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries and resets the hit and miss counters.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits.set(0);
            misses.set(0);
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    /**
     * @return statistics string
     */
    public String getStats() {
        return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d]",
                size(), maxSize, hits.get(), misses.get());
    }
}
