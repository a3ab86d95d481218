package com.nana.results.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * ResultCache - Bounded LRU Memoisation
 *
 * <p>An access-ordered {@link LinkedHashMap} that drops its least recently
 * used entry once {@code capacity} is exceeded. Every method is
 * synchronised, and {@link #getOrCompute(Object, Supplier)} runs the
 * computation under the lock, so one key is computed at most once at a
 * time.
 *
 * <p>Cached values are shared between callers and must be immutable.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ResultCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    /** Capacity used when none is configured. */
    public static final int DEFAULT_CAPACITY = 32;

    private final int capacity;
    private final LinkedHashMap<K, V> entries;

    private long hits;
    private long misses;

    public ResultCache() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of entries; must be positive
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public ResultCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1, was " + capacity + ".");
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > ResultCache.this.capacity;
                if (evict) {
                    log.debug("Evicting least recently used cache entry {}.", eldest.getKey());
                }
                return evict;
            }
        };
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it
     * first if absent.
     *
     * @param key     cache key
     * @param compute produces the value on a miss; must not return null
     * @return the cached or freshly computed value
     * @throws IllegalStateException if {@code compute} returns null
     */
    public synchronized V getOrCompute(K key, Supplier<? extends V> compute) {
        V cached = entries.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        V value = compute.get();
        if (value == null) {
            throw new IllegalStateException("Cache computation returned null for key " + key + ".");
        }
        entries.put(key, value);
        return value;
    }

    /**
     * @param key cache key
     * @return true if an entry exists; does not count as an access
     */
    public synchronized boolean contains(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    public synchronized void clear() {
        entries.clear();
        log.debug("Result cache cleared.");
    }
}
