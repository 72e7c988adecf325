package hrl.core.clock;

/**
 * Source of wall-clock time in epoch milliseconds.
 *
 * Bucket timestamps are persisted and compared across processes, so this is
 * epoch time rather than a monotonic counter.
 */
public interface Clock {

    long nowMillis();

    default long nowSeconds() {
        return nowMillis() / 1000L;
    }
}
