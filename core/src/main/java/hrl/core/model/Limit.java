package hrl.core.model;

/**
 * Token bucket quota.
 *
 * <p>The refill rate is kept as a fraction ({@code refillAmount / refillPeriodSeconds})
 * so no floating point is needed on the write path.
 *
 * @param name limit name, e.g. "rpm" or "tpm"
 * @param capacity tokens refilled per period (sustained rate)
 * @param burst bucket ceiling, {@code >= capacity}
 * @param refillAmount refill numerator
 * @param refillPeriodSeconds refill denominator
 */
public record Limit(
    String name,
    long capacity,
    long burst,
    long refillAmount,
    long refillPeriodSeconds
) {
    public static final long MILLI = 1000L;

    public Limit {
        Identifiers.limitName(name);
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (burst < capacity) throw new IllegalArgumentException("burst must be >= capacity");
        if (refillAmount <= 0) throw new IllegalArgumentException("refillAmount must be > 0");
        if (refillPeriodSeconds <= 0) throw new IllegalArgumentException("refillPeriodSeconds must be > 0");
    }

    public static Limit perSecond(String name, long capacity) {
        return new Limit(name, capacity, capacity, capacity, 1);
    }

    public static Limit perSecond(String name, long capacity, long burst) {
        return new Limit(name, capacity, burst, capacity, 1);
    }

    public static Limit perMinute(String name, long capacity) {
        return new Limit(name, capacity, capacity, capacity, 60);
    }

    public static Limit perMinute(String name, long capacity, long burst) {
        return new Limit(name, capacity, burst, capacity, 60);
    }

    public static Limit perHour(String name, long capacity) {
        return new Limit(name, capacity, capacity, capacity, 3600);
    }

    public static Limit perHour(String name, long capacity, long burst) {
        return new Limit(name, capacity, burst, capacity, 3600);
    }

    public static Limit perDay(String name, long capacity) {
        return new Limit(name, capacity, capacity, capacity, 86400);
    }

    public static Limit custom(String name, long capacity, long refillAmount, long refillPeriodSeconds, long burst) {
        return new Limit(name, capacity, burst, refillAmount, refillPeriodSeconds);
    }

    /** Tokens per second, for display. */
    public double refillRate() {
        return (double) refillAmount / refillPeriodSeconds;
    }

    /** Seconds for an empty bucket to refill to capacity. */
    public double timeToFillSeconds() {
        return ((double) capacity / refillAmount) * refillPeriodSeconds;
    }

    public long capacityMilli() {
        return capacity * MILLI;
    }

    public long burstMilli() {
        return burst * MILLI;
    }

    public long refillAmountMilli() {
        return refillAmount * MILLI;
    }

    public long refillPeriodMs() {
        return refillPeriodSeconds * 1000L;
    }
}
