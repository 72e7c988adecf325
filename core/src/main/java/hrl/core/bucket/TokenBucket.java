package hrl.core.bucket;

import hrl.core.model.Amounts;
import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;
import hrl.core.model.Limit;
import hrl.core.model.LimitStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Token bucket arithmetic over persisted state.
 *
 * <p>Pure functions of (state, now): nothing here reads a clock or touches the store.
 * Everything is integer math in millitokens. Refill is continuous and capped at
 * burst; debits are not capped, so tokens may go negative.
 *
 * <p>Refill tracks how much elapsed time was actually turned into whole
 * millitokens, so repeated small refills don't drift from one large refill.
 */
public final class TokenBucket {

    private TokenBucket() {
    }

    /**
     * @param tokensMilli tokens after refill
     * @param lastRefillMs refill timestamp advanced by the time actually converted
     */
    public record RefillResult(long tokensMilli, long lastRefillMs) {
    }

    /**
     * @param available whole tokens after refill, before the debit
     * @param newTokensMilli tokens after refill and, on success, the debit
     */
    public record ConsumeResult(
        boolean success,
        long available,
        double retryAfterSeconds,
        long newTokensMilli,
        long newLastRefillMs
    ) {
    }

    public static RefillResult refill(
        long tokensMilli,
        long lastRefillMs,
        long nowMs,
        long burstMilli,
        long refillAmountMilli,
        long refillPeriodMs
    ) {
        long elapsed = nowMs - lastRefillMs;
        if (elapsed <= 0) {
            return new RefillResult(tokensMilli, lastRefillMs);
        }

        long toAdd;
        try {
            toAdd = Math.multiplyExact(elapsed, refillAmountMilli) / refillPeriodMs;
        } catch (ArithmeticException overflow) {
            // Long idle period: the bucket is full whatever the exact amount.
            return new RefillResult(burstMilli, nowMs);
        }
        if (toAdd == 0) {
            return new RefillResult(tokensMilli, lastRefillMs);
        }

        long timeUsed = toAdd * refillPeriodMs / refillAmountMilli;
        long newTokens = Math.min(burstMilli, tokensMilli + toAdd);
        return new RefillResult(newTokens, lastRefillMs + timeUsed);
    }

    public static RefillResult refill(BucketState state, long nowMs) {
        return refill(state.tokensMilli(), state.lastRefillMs(), nowMs,
            state.burstMilli(), state.refillAmountMilli(), state.refillPeriodMs());
    }

    /**
     * Refills, then debits {@code requested} whole tokens if they are there.
     */
    public static ConsumeResult tryConsume(BucketState state, long requested, long nowMs) {
        RefillResult refilled = refill(state, nowMs);
        long current = refilled.tokensMilli();
        long requestedMilli = requested * Limit.MILLI;
        long available = Math.floorDiv(current, Limit.MILLI);

        if (current >= requestedMilli) {
            return new ConsumeResult(true, available, 0.0, current - requestedMilli, refilled.lastRefillMs());
        }
        double retryAfter = retryAfterSeconds(requestedMilli - current,
            state.refillAmountMilli(), state.refillPeriodMs());
        return new ConsumeResult(false, available, retryAfter, current, refilled.lastRefillMs());
    }

    /**
     * Refills, then debits without checking. Negative amounts return tokens.
     */
    public static RefillResult forceConsume(BucketState state, long amount, long nowMs) {
        RefillResult refilled = refill(state, nowMs);
        return new RefillResult(refilled.tokensMilli() - amount * Limit.MILLI, refilled.lastRefillMs());
    }

    /** Seconds until {@code deficitMilli} has refilled, plus one millisecond for rounding. */
    public static double retryAfterSeconds(long deficitMilli, long refillAmountMilli, long refillPeriodMs) {
        if (deficitMilli <= 0) return 0.0;
        long timeMs = deficitMilli * refillPeriodMs / refillAmountMilli;
        return (timeMs + 1) / 1000.0;
    }

    /** Whole tokens available now, may be negative. */
    public static long available(BucketState state, long nowMs) {
        return Math.floorDiv(refill(state, nowMs).tokensMilli(), Limit.MILLI);
    }

    public static double timeUntilAvailable(BucketState state, long needed, long nowMs) {
        long current = refill(state, nowMs).tokensMilli();
        long neededMilli = needed * Limit.MILLI;
        if (current >= neededMilli) return 0.0;
        return retryAfterSeconds(neededMilli - current, state.refillAmountMilli(), state.refillPeriodMs());
    }

    public static LimitStatus status(BucketState state, Limit limit, long requested, long nowMs) {
        ConsumeResult result = tryConsume(state, requested, nowMs);
        return new LimitStatus(state.entityId(), state.resource(), limit.name(), limit,
            result.available(), requested, !result.success(), result.retryAfterSeconds());
    }

    /**
     * Refill catch-up for the asynchronous path: the non-negative number of
     * millitokens owed since {@code lastRefillMs}, capped at {@code ceilingMilli}.
     */
    public static long refillDelta(long tokensMilli, long lastRefillMs, long nowMs,
                                   long ceilingMilli, long refillAmountMilli, long refillPeriodMs) {
        RefillResult result = refill(tokensMilli, lastRefillMs, nowMs, ceilingMilli, refillAmountMilli, refillPeriodMs);
        return Math.max(0L, result.tokensMilli() - tokensMilli);
    }

    /**
     * Decides, from a bucket image returned by a failed conditional write, whether
     * refilling to {@code nowMs} would admit the request. Limits not named in
     * {@code consume} are ignored.
     */
    public static RefillCheck wouldRefillSatisfy(CompositeBucket bucket, Amounts consume, long nowMs) {
        List<LimitStatus> statuses = new ArrayList<>();
        boolean satisfiable = true;
        for (BucketState state : bucket.limits()) {
            if (!consume.contains(state.limitName())) continue;
            long requested = consume.get(state.limitName());
            LimitStatus status = status(state, state.toLimit(), requested, nowMs);
            statuses.add(status);
            if (status.exceeded()) satisfiable = false;
        }
        return new RefillCheck(satisfiable, statuses);
    }

    public record RefillCheck(boolean satisfiable, List<LimitStatus> statuses) {
        public RefillCheck {
            statuses = List.copyOf(statuses);
        }
    }
}
