package linkchecker;

import java.util.LinkedHashMap;
import java.util.Map;

// Thread-safe bounded key/value memo with least-recently-used eviction.
// Every operation runs under the instance lock, so readers never see a
// half-updated map and accesses == hits + misses holds at all times.
public class LruCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> store;

    private long accesses;
    private long hits;
    private long misses;

    public LruCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("max_size must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        // access order: get() and put() both move the key to the tail (most recently used)
        this.store = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LruCache.this.maxSize;
            }
        };
    }

    // Returns the cached value or null; counts the lookup either way.
    public synchronized V get(K key) {
        accesses++;
        V value = store.get(key);
        if (value != null) {
            hits++;
        } else {
            misses++;
        }
        return value;
    }

    // Insert or overwrite; evicts the least recently used entry when over capacity.
    public synchronized void set(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("null values are not cached");
        }
        store.put(key, value);
    }

    public synchronized boolean containsKey(K key) {
        return store.containsKey(key);
    }

    public synchronized int size() {
        return store.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(accesses, hits, misses);
    }

    // Snapshot of the lookup counters.
    public record CacheStats(long accesses, long hits, long misses) {

        public static final CacheStats EMPTY = new CacheStats(0, 0, 0);

        public double hitRatio() {
            return accesses > 0 ? (double) hits / accesses : 0.0;
        }
    }
}
