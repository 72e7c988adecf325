package hrl.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock driven by the test. Starts at the given epoch millisecond and only moves
 * when told to.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    @Override
    public long nowMillis() {
        return now.get();
    }

    public void advanceMillis(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceSeconds(long seconds) {
        advanceMillis(seconds * 1000L);
    }

    public void setMillis(long value) {
        now.set(value);
    }
}
