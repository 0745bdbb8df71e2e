package linkchecker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LruCacheTest {

    @Test
    void insertingBeyondCapacityEvictsLeastRecentlyUsed() {
        LruCache<String, Integer> cache = new LruCache<>(3);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("c", 3);
        cache.set("d", 4);

        assertEquals(3, cache.size());
        assertFalse(cache.containsKey("a"));
        assertTrue(cache.containsKey("b"));
        assertTrue(cache.containsKey("d"));
    }

    @Test
    void getProtectsKeyFromEviction() {
        LruCache<String, Integer> cache = new LruCache<>(3);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("c", 3);

        assertEquals(1, cache.get("a"));
        cache.set("d", 4);

        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
    }

    @Test
    void overwritePromotesAndReplacesWholeValue() {
        LruCache<String, Integer> cache = new LruCache<>(2);
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("a", 10);
        cache.set("c", 3);

        assertEquals(10, cache.get("a"));
        assertNull(cache.get("b"));
        assertEquals(2, cache.size());
    }

    @Test
    void statsCountEveryLookup() {
        LruCache<String, Integer> cache = new LruCache<>(2);
        assertEquals(0.0, cache.stats().hitRatio());

        cache.set("a", 1);
        cache.get("a");
        cache.get("a");
        cache.get("missing");
        cache.set("b", 2);
        cache.set("c", 3);   // evicts a
        cache.get("a");

        LruCache.CacheStats stats = cache.stats();
        assertEquals(4, stats.accesses());
        assertEquals(2, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(stats.accesses(), stats.hits() + stats.misses());
        assertEquals(0.5, stats.hitRatio(), 1e-9);
    }

    @Test
    void nonPositiveCapacityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LruCache<String, String>(0));
        assertThrows(IllegalArgumentException.class, () -> new LruCache<String, String>(-5));
    }

    @Test
    void concurrentUseKeepsSizeBoundAndCountersConsistent() throws Exception {
        int threads = 8;
        int opsPerThread = 2_000;
        LruCache<Integer, Integer> cache = new LruCache<>(50);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int offset = t * 37;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < opsPerThread; i++) {
                    int key = (i + offset) % 200;
                    if (cache.get(key) == null) cache.set(key, key);
                    assertTrue(cache.size() <= 50);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        LruCache.CacheStats stats = cache.stats();
        assertEquals((long) threads * opsPerThread, stats.accesses());
        assertEquals(stats.accesses(), stats.hits() + stats.misses());
        assertTrue(cache.size() <= 50);
    }
}
