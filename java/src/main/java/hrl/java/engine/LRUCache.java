package hrl.java.engine;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Bounded map with least-recently-used eviction.
 *
 * <p>Backed by an access-ordered {@link LinkedHashMap}; every method is
 * synchronized on the cache. The eviction callback runs under that lock, so it
 * must not call back into the cache.
 *
 * @param <K> key type
 * @param <V> value type
 */
final class LRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    /**
     * @param maxSize maximum number of entries (must be > 0)
     * @param onEvict invoked for each entry dropped for capacity, may be null
     * @throws IllegalArgumentException if maxSize <= 0
     */
    LRUCache(int maxSize, BiConsumer<K, V> onEvict) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.map = new LinkedHashMap<>(Math.min(maxSize, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > LRUCache.this.maxSize;
                if (evict && onEvict != null) {
                    onEvict.accept(eldest.getKey(), eldest.getValue());
                }
                return evict;
            }
        };
    }

    LRUCache(int maxSize) {
        this(maxSize, null);
    }

    /** Marks the entry as recently used. */
    synchronized V get(K key) {
        return map.get(key);
    }

    synchronized V put(K key, V value) {
        return map.put(key, value);
    }

    /**
     * Returns the entry for {@code key}, creating it with {@code factory} if absent.
     * Only one value is ever created per key while it stays cached.
     */
    synchronized V getOrCreate(K key, Function<K, V> factory) {
        V existing = map.get(key);
        if (existing != null) {
            return existing;
        }
        V created = factory.apply(key);
        map.put(key, created);
        return created;
    }

    /** Explicit removal; the eviction callback is not invoked. */
    synchronized V remove(K key) {
        return map.remove(key);
    }

    /** Removes every entry whose key matches. */
    synchronized int removeIf(Predicate<K> matches) {
        int removed = 0;
        Iterator<K> it = map.keySet().iterator();
        while (it.hasNext()) {
            if (matches.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /** Does not mark the entry as recently used. */
    synchronized boolean containsKey(K key) {
        return map.containsKey(key);
    }

    synchronized int size() {
        return map.size();
    }

    synchronized void clear() {
        map.clear();
    }

    int maxSize() {
        return maxSize;
    }
}
