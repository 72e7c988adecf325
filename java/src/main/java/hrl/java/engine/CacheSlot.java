package hrl.java.engine;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One cached configuration value with its own refresh lock.
 *
 * <p>Reads of a fresh value take no lock. A stale or empty slot is reloaded
 * under the slot's lock, so concurrent misses on the same key cause a single
 * store read while other keys refresh independently. Absent values are cached
 * too.
 */
final class CacheSlot<V> {

    /** A loaded value and the instant it goes stale, published together. */
    private record Entry<V>(Optional<V> value, long expiresAtMs) {
        boolean freshAt(long nowMs) {
            return nowMs < expiresAtMs;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Entry<V> entry;

    /**
     * @param nowMs current time
     * @param ttlMs freshness window for a newly loaded value
     * @param loader store read, returning empty when nothing is stored
     * @param stats hit and miss counters to update
     */
    Optional<V> get(long nowMs, long ttlMs, Supplier<Optional<V>> loader, ConfigCache.Stats stats) {
        Entry<V> current = entry;
        if (current != null && current.freshAt(nowMs)) {
            stats.hit();
            return current.value();
        }
        lock.lock();
        try {
            current = entry;
            if (current != null && current.freshAt(nowMs)) {
                stats.hit();
                return current.value();
            }
            stats.miss();
            Optional<V> loaded = loader.get();
            entry = new Entry<>(loaded, nowMs + ttlMs);
            return loaded;
        } finally {
            lock.unlock();
        }
    }
}
