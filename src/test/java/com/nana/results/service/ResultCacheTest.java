package com.nana.results.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    @Test
    @DisplayName("computes once per key and counts hits and misses")
    void getOrCompute_memoises() {
        ResultCache<String, String> cache = new ResultCache<>(4);
        AtomicInteger calls = new AtomicInteger();

        String first = cache.getOrCompute("k", () -> "v" + calls.incrementAndGet());
        String second = cache.getOrCompute("k", () -> "v" + calls.incrementAndGet());

        assertEquals("v1", first);
        assertSame(first, second);
        assertEquals(1, calls.get());
        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());
    }

    @Test
    @DisplayName("evicts the least recently used entry beyond capacity")
    void lruEviction() {
        ResultCache<String, Integer> cache = new ResultCache<>(2);
        cache.getOrCompute("a", () -> 1);
        cache.getOrCompute("b", () -> 2);
        cache.getOrCompute("a", () -> 99);   // touch a
        cache.getOrCompute("c", () -> 3);    // evicts b

        assertTrue(cache.contains("a"));
        assertFalse(cache.contains("b"));
        assertTrue(cache.contains("c"));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("rejects null values and invalid capacity")
    void invalidUse() {
        ResultCache<String, String> cache = new ResultCache<>();

        assertEquals(ResultCache.DEFAULT_CAPACITY, cache.getCapacity());
        assertThrows(IllegalStateException.class, () -> cache.getOrCompute("k", () -> null));
        assertThrows(IllegalArgumentException.class, () -> new ResultCache<String, String>(0));
    }

    @Test
    @DisplayName("clear empties the cache")
    void clear() {
        ResultCache<String, String> cache = new ResultCache<>();
        cache.getOrCompute("k", () -> "v");

        cache.clear();

        assertEquals(0, cache.size());
    }
}
