package hrl.java.reconcile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What one change batch saw of a single composite bucket: the consumption
 * summed over the batch and the latest observed token level and definition
 * of each limit. The refill timestamp is the one the last event left behind,
 * which is what a catch-up refill locks on.
 */
public final class BucketRefillState {

    /** Identity of a bucket across events. */
    public record Key(String namespaceId, String entityId, String resource, int shard) {
    }

    /** Per-limit view. All amounts in millitokens. */
    public static final class LimitRefill {
        private long tcDelta;
        private long tokensMilli;
        private long capacityMilli;
        private long refillAmountMilli;
        private long refillPeriodMs;

        LimitRefill(long tcDelta, long tokensMilli, long capacityMilli, long refillAmountMilli, long refillPeriodMs) {
            this.tcDelta = tcDelta;
            this.tokensMilli = tokensMilli;
            this.capacityMilli = capacityMilli;
            this.refillAmountMilli = refillAmountMilli;
            this.refillPeriodMs = refillPeriodMs;
        }

        void merge(LimitRefill newer) {
            tcDelta += newer.tcDelta;
            tokensMilli = newer.tokensMilli;
            capacityMilli = newer.capacityMilli;
            refillAmountMilli = newer.refillAmountMilli;
            refillPeriodMs = newer.refillPeriodMs;
        }

        public long tcDelta() {
            return tcDelta;
        }

        public long tokensMilli() {
            return tokensMilli;
        }

        public long capacityMilli() {
            return capacityMilli;
        }

        public long refillAmountMilli() {
            return refillAmountMilli;
        }

        public long refillPeriodMs() {
            return refillPeriodMs;
        }
    }

    private final Key key;
    private long lastRefillMs;
    private final Map<String, LimitRefill> limits = new LinkedHashMap<>();

    BucketRefillState(Key key, long lastRefillMs) {
        this.key = key;
        this.lastRefillMs = lastRefillMs;
    }

    void observe(long refillMs, Map<String, LimitRefill> seen) {
        this.lastRefillMs = refillMs;
        seen.forEach((name, limit) -> {
            LimitRefill existing = limits.get(name);
            if (existing == null) {
                limits.put(name, new LimitRefill(limit.tcDelta, limit.tokensMilli, limit.capacityMilli,
                    limit.refillAmountMilli, limit.refillPeriodMs));
            } else {
                existing.merge(limit);
            }
        });
    }

    public Key key() {
        return key;
    }

    public long lastRefillMs() {
        return lastRefillMs;
    }

    public Map<String, LimitRefill> limits() {
        return Collections.unmodifiableMap(limits);
    }
}
