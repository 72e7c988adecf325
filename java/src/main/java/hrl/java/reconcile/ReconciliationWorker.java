package hrl.java.reconcile;

import hrl.core.bucket.TokenBucket;
import hrl.core.clock.Clock;
import hrl.core.model.Limit;
import hrl.core.model.WindowType;
import hrl.java.store.BucketCodec;
import hrl.java.store.ChangeEvent;
import hrl.java.store.Condition;
import hrl.java.store.ConditionFailedException;
import hrl.java.store.Index;
import hrl.java.store.Item;
import hrl.java.store.ItemKey;
import hrl.java.store.ItemStore;
import hrl.java.store.Schema;
import hrl.java.store.UpdateRequest;
import hrl.java.store.UsageRecords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumes bucket change events: rolls consumption up into usage windows and
 * writes catch-up refills for buckets that consumers are draining faster than
 * refill reaches them.
 *
 * <p>Every write here is an ADD, or SET of the refill timestamp under a lock on
 * its observed value, so replaying or reordering events never erases a
 * consumer's debit. A failure on one item is logged and recorded in the
 * {@link ProcessResult}; the rest of the batch still runs.
 *
 * <p>Thread-safety: stateless apart from its collaborators; batches may be
 * processed concurrently.
 */
public final class ReconciliationWorker {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationWorker.class);

    private static final long SECONDS_PER_DAY = 86_400L;

    private final ItemStore store;
    private final Clock clock;
    private final WorkerConfig config;

    public ReconciliationWorker(ItemStore store, Clock clock, WorkerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.clock = clock;
        this.config = config;
    }

    public WorkerConfig config() {
        return config;
    }

    public ProcessResult process(List<ChangeEvent> events) {
        List<String> errors = new ArrayList<>();
        List<ParsedBucket> buckets = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            try {
                ParsedBucket parsed = parse(events.get(i));
                if (parsed != null) buckets.add(parsed);
            } catch (RuntimeException e) {
                String message = "Error processing event: " + e.getMessage();
                log.atWarn()
                    .addKeyValue("event_index", i)
                    .addKeyValue("key", events.get(i).key())
                    .setCause(e)
                    .log(message);
                errors.add(message);
            }
        }
        List<ConsumptionDelta> deltas = new ArrayList<>();
        for (ParsedBucket parsed : buckets) {
            deltas.addAll(deltasOf(parsed));
        }

        int snapshots = 0;
        for (ConsumptionDelta delta : deltas) {
            for (WindowType window : config.windows()) {
                try {
                    updateSnapshot(delta, window);
                    snapshots++;
                } catch (RuntimeException e) {
                    String message = "Error updating snapshot: " + e.getMessage();
                    log.atWarn()
                        .addKeyValue("entity_id", delta.entityId())
                        .addKeyValue("resource", delta.resource())
                        .addKeyValue("limit_name", delta.limitName())
                        .addKeyValue("window", window.wireValue())
                        .setCause(e)
                        .log(message);
                    errors.add(message);
                }
            }
        }

        int refills = 0;
        long nowMs = clock.nowMillis();
        for (BucketRefillState state : aggregate(buckets).values()) {
            try {
                if (tryRefillBucket(state, nowMs)) refills++;
            } catch (RuntimeException e) {
                String message = "Error refilling bucket: " + e.getMessage();
                log.atWarn()
                    .addKeyValue("entity_id", state.key().entityId())
                    .addKeyValue("resource", state.key().resource())
                    .setCause(e)
                    .log(message);
                errors.add(message);
            }
        }

        log.atInfo()
            .addKeyValue("processed_count", events.size())
            .addKeyValue("deltas_extracted", deltas.size())
            .addKeyValue("snapshots_updated", snapshots)
            .addKeyValue("refills_written", refills)
            .addKeyValue("error_count", errors.size())
            .log("Batch processing completed");
        return new ProcessResult(events.size(), snapshots, refills, errors);
    }

    /**
     * One delta per limit whose consumption counter moved between the images.
     * Events on other records, and limits whose counter is missing from either
     * image, yield nothing.
     */
    public static List<ConsumptionDelta> extractDeltas(ChangeEvent event) {
        ParsedBucket parsed = parse(event);
        return parsed == null ? List.of() : deltasOf(parsed);
    }

    /**
     * Folds the batch into one state per bucket: consumption is summed, token
     * levels, definitions and the refill timestamp come from the last event.
     */
    public static Map<BucketRefillState.Key, BucketRefillState> aggregateBucketStates(List<ChangeEvent> events) {
        List<ParsedBucket> buckets = new ArrayList<>();
        for (ChangeEvent event : events) {
            ParsedBucket parsed = parse(event);
            if (parsed != null) buckets.add(parsed);
        }
        return aggregate(buckets);
    }

    private static List<ConsumptionDelta> deltasOf(ParsedBucket parsed) {
        List<ConsumptionDelta> deltas = new ArrayList<>();
        parsed.limits.forEach((name, limit) -> {
            if (limit.tcDelta() != 0) {
                deltas.add(new ConsumptionDelta(parsed.key.namespaceId(), parsed.key.entityId(),
                    parsed.key.resource(), name, limit.tcDelta(), parsed.refillMs));
            }
        });
        return deltas;
    }

    private static Map<BucketRefillState.Key, BucketRefillState> aggregate(List<ParsedBucket> buckets) {
        Map<BucketRefillState.Key, BucketRefillState> states = new LinkedHashMap<>();
        for (ParsedBucket parsed : buckets) {
            states.computeIfAbsent(parsed.key, k -> new BucketRefillState(k, parsed.refillMs))
                .observe(parsed.refillMs, parsed.limits);
        }
        return states;
    }

    /**
     * Adds owed refill to the limits whose projected level would not cover the
     * consumption seen in this batch. One write per bucket, locked on the
     * observed refill timestamp; a moved timestamp means another writer already
     * accounted for the elapsed time, and the refill is skipped.
     *
     * @return whether a refill was written
     */
    public boolean tryRefillBucket(BucketRefillState state, long nowMs) {
        BucketRefillState.Key key = state.key();
        UpdateRequest.Builder update = UpdateRequest.builder(
                new ItemKey(Schema.bucketPartition(key.namespaceId(), key.entityId(), key.resource(), key.shard()),
                    Schema.SK_STATE))
            .condition(Condition.equalTo(BucketCodec.REFILL, state.lastRefillMs()))
            .set(BucketCodec.REFILL, nowMs);

        List<String> refilled = new ArrayList<>();
        state.limits().forEach((name, limit) -> {
            if (limit.refillPeriodMs() <= 0 || limit.refillAmountMilli() <= 0) return;
            long refillDelta = TokenBucket.refillDelta(limit.tokensMilli(), state.lastRefillMs(), nowMs,
                limit.capacityMilli(), limit.refillAmountMilli(), limit.refillPeriodMs());
            if (refillDelta == 0) return;
            if (limit.tokensMilli() + refillDelta >= Math.max(0L, limit.tcDelta())) return;
            update.add(BucketCodec.attr(name, BucketCodec.TOKENS), refillDelta);
            refilled.add(name);
        });

        if (refilled.isEmpty()) {
            log.debug("Refill skipped for {}/{}: sufficient tokens", key.entityId(), key.resource());
            return false;
        }
        try {
            store.write(update.build());
        } catch (ConditionFailedException e) {
            log.debug("Refill skipped for {}/{}: refill timestamp moved", key.entityId(), key.resource());
            return false;
        }
        log.atDebug()
            .addKeyValue("entity_id", key.entityId())
            .addKeyValue("resource", key.resource())
            .addKeyValue("limits", refilled)
            .log("Bucket refilled");
        return true;
    }

    /**
     * Adds one delta to its usage window, creating the record on first use.
     */
    public void updateSnapshot(ConsumptionDelta delta, WindowType window) {
        String windowStart = window.windowStart(delta.timestampMs());
        String wire = window.wireValue();
        long expiry = clock.nowSeconds() + config.retentionDays() * SECONDS_PER_DAY;

        UpdateRequest request = UpdateRequest.builder(
                Schema.usageKey(delta.namespaceId(), delta.entityId(), delta.resource(), wire, windowStart))
            .set(Schema.ATTR_ENTITY_ID, delta.entityId())
            .setIfAbsent(Schema.ATTR_RESOURCE, delta.resource())
            .setIfAbsent(UsageRecords.WINDOW, wire)
            .setIfAbsent(UsageRecords.WINDOW_START, windowStart)
            .setIfAbsent(UsageRecords.WINDOW_END, window.windowEnd(delta.timestampMs()))
            .set(Index.RESOURCE.partitionAttribute(), Schema.resourcePartition(delta.namespaceId(), delta.resource()))
            .set(Index.RESOURCE.sortAttribute(), Schema.usageIndexSort(wire, windowStart, delta.entityId()))
            .setIfAbsent(Schema.ATTR_TTL, expiry)
            .add(UsageRecords.counter(delta.limitName()), Math.floorDiv(delta.tokensDeltaMilli(), Limit.MILLI))
            .add(UsageRecords.TOTAL_EVENTS, 1)
            .build();
        store.write(request);
    }

    private static final class ParsedBucket {
        private final BucketRefillState.Key key;
        private final long refillMs;
        private final Map<String, BucketRefillState.LimitRefill> limits;

        private ParsedBucket(BucketRefillState.Key key, long refillMs, Map<String, BucketRefillState.LimitRefill> limits) {
            this.key = key;
            this.refillMs = refillMs;
            this.limits = limits;
        }
    }

    /**
     * @return {@code null} unless both images are present and the item is a bucket
     *         with at least one limit counter in both
     */
    private static ParsedBucket parse(ChangeEvent event) {
        Item before = event.oldImage();
        Item after = event.newImage();
        if (before == null || after == null || !BucketCodec.isBucket(after)) return null;
        Schema.BucketPartition partition = Schema.parseBucketPartition(after.getString(Item.PK));
        String entityId = after.getString(Schema.ATTR_ENTITY_ID);
        if (entityId == null) entityId = partition.entityId();

        Map<String, BucketRefillState.LimitRefill> limits = new LinkedHashMap<>();
        for (String name : BucketCodec.limitNames(after)) {
            String tc = BucketCodec.attr(name, BucketCodec.CONSUMED);
            Long newTc = after.getLong(tc);
            Long oldTc = before.getLong(tc);
            if (newTc == null || oldTc == null) {
                log.debug("Skipping limit {} of {}/{} without consumption counter", name, entityId, partition.resource());
                continue;
            }
            limits.put(name, new BucketRefillState.LimitRefill(
                newTc - oldTc,
                after.getLong(BucketCodec.attr(name, BucketCodec.TOKENS), 0L),
                after.getLong(BucketCodec.attr(name, BucketCodec.CAPACITY), 0L),
                after.getLong(BucketCodec.attr(name, BucketCodec.REFILL_AMOUNT), 0L),
                after.getLong(BucketCodec.attr(name, BucketCodec.REFILL_PERIOD), 0L)));
        }
        if (limits.isEmpty()) return null;

        BucketRefillState.Key key = new BucketRefillState.Key(partition.namespace(), entityId,
            partition.resource(), partition.shard());
        return new ParsedBucket(key, after.getLong(BucketCodec.REFILL, 0L), limits);
    }
}
