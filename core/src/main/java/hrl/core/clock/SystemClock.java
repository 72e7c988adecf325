package hrl.core.clock;

/**
 * Wall clock in epoch milliseconds. Refill timestamps written with it are
 * compared across processes, so it must not be a monotonic counter.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}
