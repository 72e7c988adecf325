package hrl.core.model;

/**
 * State of one limit inside a composite bucket. All quantities are millitokens,
 * all timestamps epoch milliseconds.
 *
 * <p>{@code tokensMilli} may be negative after an unchecked adjustment;
 * {@code totalConsumedMilli} only ever moves by the net amount consumed.
 */
public record BucketState(
    String entityId,
    String resource,
    String limitName,
    long tokensMilli,
    long lastRefillMs,
    long capacityMilli,
    long burstMilli,
    long refillAmountMilli,
    long refillPeriodMs,
    long totalConsumedMilli
) {

    /** A full bucket (tokens at burst) for a limit seen for the first time. */
    public static BucketState fromLimit(String entityId, String resource, Limit limit, long nowMs) {
        return new BucketState(
            entityId,
            resource,
            limit.name(),
            limit.burstMilli(),
            nowMs,
            limit.capacityMilli(),
            limit.burstMilli(),
            limit.refillAmountMilli(),
            limit.refillPeriodMs(),
            0L
        );
    }

    /** Rebuilds the limit definition stored alongside the state. */
    public Limit toLimit() {
        return new Limit(
            limitName,
            capacityMilli / Limit.MILLI,
            burstMilli / Limit.MILLI,
            refillAmountMilli / Limit.MILLI,
            refillPeriodMs / 1000L
        );
    }

    public BucketState withTokens(long newTokensMilli, long newLastRefillMs) {
        return new BucketState(entityId, resource, limitName, newTokensMilli, newLastRefillMs,
            capacityMilli, burstMilli, refillAmountMilli, refillPeriodMs, totalConsumedMilli);
    }

    /** Whole tokens currently in the bucket, without refill. */
    public long tokens() {
        return Math.floorDiv(tokensMilli, Limit.MILLI);
    }
}
