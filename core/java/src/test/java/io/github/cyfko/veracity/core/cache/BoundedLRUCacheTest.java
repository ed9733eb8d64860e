package io.github.cyfko.veracity.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedLRUCache Tests")
class BoundedLRUCacheTest {

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedLRUCache<String, String>(0));
        assertThrows(IllegalArgumentException.class, () -> new BoundedLRUCache<String, String>(-5));
    }

    @Test
    @DisplayName("Should evict the least recently used entry")
    void testEviction() {
        // Given
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(2);
        cache.put("a", 1);
        cache.put("b", 2);

        // When: "a" is touched, so "b" becomes the eldest
        cache.get("a");
        cache.put("c", 3);

        // Then
        assertEquals(2, cache.size());
        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
    }

    @Test
    @DisplayName("Should count hits and misses")
    void testStatistics() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(10);
        cache.put("a", 1);

        assertEquals(1, cache.get("a"));
        assertNull(cache.get("missing"));

        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());
        assertEquals("BoundedLRUCache[size=1, maxSize=10, hits=1, misses=1]", cache.getStats());
    }

    @Test
    @DisplayName("Should compute a value once and serve it afterwards")
    void testComputeIfAbsent() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(10);
        AtomicInteger calls = new AtomicInteger();

        assertEquals(3, cache.computeIfAbsent("abc", key -> { calls.incrementAndGet(); return key.length(); }));
        assertEquals(3, cache.computeIfAbsent("abc", key -> { calls.incrementAndGet(); return -1; }));

        assertEquals(1, calls.get());
        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());
    }

    @Test
    @DisplayName("Should not cache a null result")
    void testComputeNull() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(10);

        assertNull(cache.computeIfAbsent("x", key -> null));
        assertFalse(cache.containsKey("x"));
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should reject null values")
    void testPutNull() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(10);

        assertThrows(NullPointerException.class, () -> cache.put("x", null));
    }

    @Test
    @DisplayName("Should reset entries and counters on clear")
    void testClear() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(10);
        cache.put("a", 1);
        cache.get("a");
        cache.get("b");

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(0, cache.getHits());
        assertEquals(0, cache.getMisses());
        assertEquals(10, cache.getMaxSize());
    }

    @Test
    @DisplayName("Should stay within capacity under concurrent access")
    void testConcurrentAccess() throws InterruptedException {
        // Given
        BoundedLRUCache<Integer, Integer> cache = new BoundedLRUCache<>(50);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);

        // When
        for (int t = 0; t < 8; t++) {
            int offset = t * 1000;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 500; i++) {
                        cache.computeIfAbsent(offset + (i % 100), key -> key * 2);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        // Then
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(cache.size() <= 50);
        assertEquals(8 * 500, cache.getHits() + cache.getMisses());
    }
}
