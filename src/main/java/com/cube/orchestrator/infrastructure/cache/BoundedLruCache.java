package com.cube.orchestrator.infrastructure.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded LRU (Least Recently Used) cache.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}: every read moves the entry
 * to the most-recently-used end, and inserting past capacity evicts the entry at
 * the least-recently-used end.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Reads reorder the map, so reads and writes share one exclusive lock.
 * </p>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class BoundedLruCache<K, V> {

    private final int maxSize;
    private final Map<K, V> cache;
    private final Lock lock = new ReentrantLock();

    /**
     * Creates a bounded LRU cache with the specified maximum size.
     *
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLruCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLruCache.this.maxSize;
            }
        };
    }

    /**
     * Retrieves a value and marks it as most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.lock();
        try {
            return cache.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value; evicts the least recently used entry when over capacity.
     */
    public void put(K key, V value) {
        lock.lock();
        try {
            cache.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    public V remove(K key) {
        lock.lock();
        try {
            return cache.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry only if it is still mapped to {@code expected}.
     */
    public boolean remove(K key, V expected) {
        lock.lock();
        try {
            return cache.remove(key, expected);
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.lock();
        try {
            return cache.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            cache.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public String getStats() {
        lock.lock();
        try {
            return String.format("BoundedLruCache[size=%d, maxSize=%d, utilization=%.1f%%]",
                    cache.size(), maxSize, (cache.size() * 100.0) / maxSize);
        } finally {
            lock.unlock();
        }
    }
}
