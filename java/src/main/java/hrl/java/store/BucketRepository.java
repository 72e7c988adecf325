package hrl.java.store;

import hrl.core.model.Amounts;
import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Composite bucket reads and the conditional write shapes that mutate them.
 *
 * <p>Write shapes:
 * <ul>
 *   <li>create: write of a full record, fails if a bucket already exists</li>
 *   <li>normal: read-then-write, locked on the observed refill timestamp and
 *       guarded by a per-limit token floor</li>
 *   <li>speculative: debit without a prior read, conditioned on tokens for every limit</li>
 *   <li>retry: debit conditioned only on tokens, after a lost refill-timestamp race</li>
 *   <li>adjust: ADD for lease corrections and rollback, with no token guard</li>
 * </ul>
 * All amounts are millitokens. Token levels are only ever changed with ADD
 * outside of create, so these writes commute with each other and with the
 * reconciliation worker.
 *
 * <p>A record counts as a bucket only once it carries {@code rf}. Every ADD-based
 * write requires {@code rf}, so a debit or a rollback never recreates a deleted
 * or expired record as a bare set of counters. Reads treat a record without
 * {@code rf} as absent and create replaces it.
 */
public final class BucketRepository {

    private final ItemStore store;
    private final String namespaceId;

    public BucketRepository(ItemStore store, String namespaceId) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (namespaceId == null || namespaceId.isEmpty()) {
            throw new IllegalArgumentException("namespaceId cannot be empty");
        }
        this.store = store;
        this.namespaceId = namespaceId;
    }

    public String namespaceId() {
        return namespaceId;
    }

    public ItemKey key(String entityId, String resource) {
        return Schema.bucketKey(namespaceId, entityId, resource);
    }

    public Optional<CompositeBucket> getBucket(String entityId, String resource) {
        return store.get(key(entityId, resource)).filter(BucketRepository::isComplete).map(BucketCodec::decode);
    }

    /** Buckets of several entities for one resource, keyed by entity id. */
    public Map<String, CompositeBucket> batchGetBuckets(Collection<String> entityIds, String resource) {
        List<ItemKey> keys = new ArrayList<>();
        for (String entityId : entityIds) {
            keys.add(key(entityId, resource));
        }
        Map<String, CompositeBucket> found = new LinkedHashMap<>();
        for (Item item : store.batchGet(keys)) {
            if (!isComplete(item)) continue;
            CompositeBucket bucket = BucketCodec.decode(item);
            found.put(bucket.entityId(), bucket);
        }
        return found;
    }

    /** Every bucket of {@code resource} in this namespace, through the resource index. */
    public List<CompositeBucket> getResourceBuckets(String resource) {
        List<CompositeBucket> buckets = new ArrayList<>();
        for (Item item : store.queryIndex(Index.RESOURCE, Schema.resourcePartition(namespaceId, resource),
                Schema.bucketIndexSortPrefix())) {
            buckets.add(BucketCodec.decode(item));
        }
        return buckets;
    }

    /**
     * Writes every attribute of a new bucket. Conditioned on {@code rf} being absent,
     * so it fails against a live bucket and overwrites leftover counters.
     *
     * @param bucket record contents, with the admitted consumption already applied
     * @param ttlEpochSeconds expiry, or {@code null} for a permanent record
     */
    public UpdateRequest buildCreate(CompositeBucket bucket, Long ttlEpochSeconds) {
        UpdateRequest.Builder b = UpdateRequest.builder(key(bucket.entityId(), bucket.resource()))
            .condition(Condition.notExists(BucketCodec.REFILL));
        BucketCodec.encode(namespaceId, bucket, ttlEpochSeconds).asMap().forEach((name, value) -> {
            if (!Item.PK.equals(name) && !Item.SK.equals(name)) b.set(name, value);
        });
        return b.build();
    }

    /**
     * Read-then-write debit.
     *
     * <p>Condition: {@code rf == expectedRf}, and for every debited limit
     * {@code tk >= max(0, consumed - refill)}. The floor guard catches a
     * speculative debit that landed after our read without moving {@code rf}.
     * Limits in {@code newLimits} are not in the record yet; they are written with
     * SET under an absent-attribute condition. A failed condition carries the
     * current record, so the caller can tell lock contention from exhaustion.
     *
     * @param consumedMilli consumption per existing limit
     * @param refillMilli refill owed per existing limit since {@code expectedRf}
     * @param limits current definition of every limit, written back so a changed
     *               quota takes effect on the record
     * @param newLimits state for limits not yet in the record, consumption applied
     * @param ttlEpochSeconds {@code null} leaves expiry untouched, {@code 0} removes it
     */
    public UpdateRequest buildNormal(
        String entityId,
        String resource,
        Amounts consumedMilli,
        Amounts refillMilli,
        Collection<BucketState> limits,
        Collection<BucketState> newLimits,
        long nowMs,
        long expectedRf,
        Long ttlEpochSeconds
    ) {
        UpdateRequest.Builder b = UpdateRequest.builder(key(entityId, resource))
            .condition(Condition.equalTo(BucketCodec.REFILL, expectedRf))
            .set(BucketCodec.REFILL, nowMs)
            .returnOldOnFailure();

        for (BucketState state : limits) {
            String name = state.limitName();
            long consumed = consumedMilli.get(name);
            long refill = refillMilli.get(name);
            if (consumed > 0) {
                b.condition(Condition.atLeast(BucketCodec.attr(name, BucketCodec.TOKENS), Math.max(0L, consumed - refill)));
            }
            long tokenDelta = refill - consumed;
            if (tokenDelta != 0) b.add(BucketCodec.attr(name, BucketCodec.TOKENS), tokenDelta);
            if (consumed != 0) b.add(BucketCodec.attr(name, BucketCodec.CONSUMED), consumed);
            setDefinition(b, state);
        }
        for (BucketState state : newLimits) {
            String name = state.limitName();
            b.condition(Condition.notExists(BucketCodec.attr(name, BucketCodec.TOKENS)))
                .set(BucketCodec.attr(name, BucketCodec.TOKENS), state.tokensMilli())
                .set(BucketCodec.attr(name, BucketCodec.CONSUMED), state.totalConsumedMilli());
            setDefinition(b, state);
        }
        applyTtl(b, ttlEpochSeconds);
        return b.build();
    }

    /**
     * Debit after losing the refill-timestamp race: no refill, no lock, only a token guard.
     */
    public UpdateRequest buildRetry(String entityId, String resource, Amounts consumedMilli) {
        UpdateRequest.Builder b = UpdateRequest.builder(key(entityId, resource))
            .condition(Condition.exists(BucketCodec.REFILL));
        for (Map.Entry<String, Long> e : consumedMilli.asMap().entrySet()) {
            long consumed = e.getValue();
            if (consumed <= 0) continue;
            b.condition(Condition.atLeast(BucketCodec.attr(e.getKey(), BucketCodec.TOKENS), consumed))
                .add(BucketCodec.attr(e.getKey(), BucketCodec.TOKENS), -consumed)
                .add(BucketCodec.attr(e.getKey(), BucketCodec.CONSUMED), consumed);
        }
        return b.build();
    }

    /**
     * Correction with no token guard. Positive deltas consume, negative deltas
     * return tokens. Fails with {@link ConditionFailedException} when the bucket
     * no longer exists, in which case there is nothing left to correct.
     */
    public UpdateRequest buildAdjust(String entityId, String resource, Amounts deltasMilli) {
        UpdateRequest.Builder b = UpdateRequest.builder(key(entityId, resource))
            .condition(Condition.exists(BucketCodec.REFILL));
        deltasMilli.asMap().forEach((name, delta) -> {
            b.add(BucketCodec.attr(name, BucketCodec.TOKENS), -delta);
            b.add(BucketCodec.attr(name, BucketCodec.CONSUMED), delta);
        });
        return b.build();
    }

    /**
     * Debits {@code consumeMilli} in one conditional write without reading first.
     * Requires the record to exist and every requested limit to hold at least the
     * requested amount; otherwise nothing is debited.
     */
    public SpeculativeResult speculativeConsume(String entityId, String resource, Amounts consumeMilli) {
        UpdateRequest.Builder b = UpdateRequest.builder(key(entityId, resource))
            .condition(Condition.exists(BucketCodec.REFILL))
            .returnNew()
            .returnOldOnFailure();
        for (Map.Entry<String, Long> e : consumeMilli.asMap().entrySet()) {
            String tk = BucketCodec.attr(e.getKey(), BucketCodec.TOKENS);
            long amount = e.getValue();
            if (amount > 0) {
                b.condition(Condition.atLeast(tk, amount))
                    .add(tk, -amount)
                    .add(BucketCodec.attr(e.getKey(), BucketCodec.CONSUMED), amount);
            } else {
                b.condition(Condition.exists(tk));
            }
        }
        // A zero-amount request still needs an action; refresh the denormalized resource.
        b.set(Schema.ATTR_RESOURCE, resource);
        try {
            Optional<Item> after = store.write(b.build());
            return SpeculativeResult.admitted(BucketCodec.decode(after.orElseThrow()));
        } catch (ConditionFailedException e) {
            return e.oldImage()
                .filter(BucketRepository::isComplete)
                .map(old -> SpeculativeResult.rejected(BucketCodec.decode(old)))
                .orElseGet(SpeculativeResult::missing);
        }
    }

    /**
     * @return post-update image when the request asked for one
     * @throws ConditionFailedException if the request's condition did not hold
     */
    public Optional<Item> write(WriteRequest request) {
        return store.write(request);
    }

    private static boolean isComplete(Item item) {
        return item.has(BucketCodec.REFILL);
    }

    private static void setDefinition(UpdateRequest.Builder b, BucketState state) {
        String name = state.limitName();
        b.set(BucketCodec.attr(name, BucketCodec.CAPACITY), state.capacityMilli())
            .set(BucketCodec.attr(name, BucketCodec.BURST), state.burstMilli())
            .set(BucketCodec.attr(name, BucketCodec.REFILL_AMOUNT), state.refillAmountMilli())
            .set(BucketCodec.attr(name, BucketCodec.REFILL_PERIOD), state.refillPeriodMs());
    }

    private static void applyTtl(UpdateRequest.Builder b, Long ttlEpochSeconds) {
        if (ttlEpochSeconds == null) return;
        if (ttlEpochSeconds == 0L) {
            b.remove(Schema.ATTR_TTL);
        } else {
            b.set(Schema.ATTR_TTL, ttlEpochSeconds);
        }
    }
}
