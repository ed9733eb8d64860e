package io.github.cyfko.veracity.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}: every successful lookup moves the entry
 * to the most-recently-used end, and inserting past capacity evicts the entry at the other
 * end. Because a lookup reorders the map, reads and writes share a single lock.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, Expr> cache = new BoundedLRUCache<>(1000);
 *
 * Expr tree = cache.computeIfAbsent("P∧Q", text -> parseUncached(text));
 *
 * cache.getStats();   // "BoundedLRUCache[size=1, maxSize=1000, hits=0, misses=1]"
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> entries;
    private final Lock lock = new ReentrantLock();
    private long hits;
    private long misses;

    /**
     * Creates a bounded LRU cache with the specified maximum size.
     *
     * @param maxSize the maximum number of entries to store
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
     * Retrieves a value and marks it most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                hits++;
            } else {
                misses++;
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry when the cache is full.
     *
     * @param key the key to store
     * @param value the value to store, must not be null
     */
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value cannot be null");
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it on a miss.
     * <p>
     * The mapping function runs under the cache lock, so concurrent callers with the same
     * key compute the value once. A null result is returned but not cached.
     * </p>
     *
     * @param key the key to compute for
     * @param mappingFunction the function computing the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                hits++;
                return value;
            }
            misses++;
            value = mappingFunction.apply(key);
            if (value != null) {
                entries.put(key, value);
            }
            return value;
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

    public boolean containsKey(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
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
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        lock.lock();
        try {
            return hits;
        } finally {
            lock.unlock();
        }
    }

    public long getMisses() {
        lock.lock();
        try {
            return misses;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        lock.lock();
        try {
            return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d]",
                entries.size(), maxSize, hits, misses);
        } finally {
            lock.unlock();
        }
    }
}
