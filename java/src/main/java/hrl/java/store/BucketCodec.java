package hrl.java.store;

import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wire encoding of a composite bucket.
 *
 * <p>All limits of one (entity, resource) pair live in one item. Per-limit fields
 * are flat attributes named {@code b_{limit}_{field}}; the refill timestamp
 * {@code rf} is shared. Keeping the limits flat lets one conditional update debit
 * every limit in a single round trip.
 */
public final class BucketCodec {

    public static final String PREFIX = "b_";
    public static final String REFILL = "rf";

    public static final String TOKENS = "tk";
    public static final String CONSUMED = "tc";
    public static final String CAPACITY = "cp";
    public static final String BURST = "bx";
    public static final String REFILL_AMOUNT = "ra";
    public static final String REFILL_PERIOD = "rp";

    private BucketCodec() {
    }

    /** Attribute name of one limit's field. */
    public static String attr(String limitName, String field) {
        return PREFIX + limitName + "_" + field;
    }

    public static boolean isBucket(Item item) {
        return item != null
            && Schema.SK_STATE.equals(item.getString(Item.SK))
            && Schema.parseBucketPartition(item.getString(Item.PK)) != null;
    }

    /** Names of the limits that have a token attribute, in attribute order. */
    public static Set<String> limitNames(Item item) {
        Set<String> names = new LinkedHashSet<>();
        String suffix = "_" + TOKENS;
        for (String attribute : item.names()) {
            if (attribute.startsWith(PREFIX) && attribute.endsWith(suffix)
                && attribute.length() > PREFIX.length() + suffix.length()) {
                names.add(attribute.substring(PREFIX.length(), attribute.length() - suffix.length()));
            }
        }
        return names;
    }

    /**
     * Full item for a new bucket record.
     *
     * @param ttlEpochSeconds expiry, or {@code null} for a permanent record
     */
    public static Item encode(String ns, CompositeBucket bucket, Long ttlEpochSeconds) {
        ItemKey key = Schema.bucketKey(ns, bucket.entityId(), bucket.resource());
        Item.Builder b = Item.builder()
            .key(key)
            .put(Schema.ATTR_ENTITY_ID, bucket.entityId())
            .put(Schema.ATTR_RESOURCE, bucket.resource())
            .put(REFILL, bucket.lastRefillMs())
            .put(Schema.ATTR_CASCADE, bucket.cascade())
            .put(Schema.ATTR_PARENT_ID, bucket.parentId())
            .put(Index.RESOURCE.partitionAttribute(), Schema.resourcePartition(ns, bucket.resource()))
            .put(Index.RESOURCE.sortAttribute(), Schema.bucketIndexSort(bucket.entityId()))
            .put(Index.ENTITY_BUCKETS.partitionAttribute(), Schema.entityPartition(ns, bucket.entityId()))
            .put(Index.ENTITY_BUCKETS.sortAttribute(), Schema.entityBucketSort(bucket.resource()))
            .put(Schema.ATTR_TTL, ttlEpochSeconds);
        for (BucketState state : bucket.limits()) {
            String name = state.limitName();
            b.put(attr(name, TOKENS), state.tokensMilli())
                .put(attr(name, CONSUMED), state.totalConsumedMilli())
                .put(attr(name, CAPACITY), state.capacityMilli())
                .put(attr(name, BURST), state.burstMilli())
                .put(attr(name, REFILL_AMOUNT), state.refillAmountMilli())
                .put(attr(name, REFILL_PERIOD), state.refillPeriodMs());
        }
        return b.build();
    }

    /**
     * Typed view of a bucket item. Limits missing any field are left out.
     */
    public static CompositeBucket decode(Item item) {
        String entityId = item.getString(Schema.ATTR_ENTITY_ID);
        String resource = item.getString(Schema.ATTR_RESOURCE);
        if (entityId == null || resource == null) {
            Schema.BucketPartition partition = Schema.parseBucketPartition(item.getString(Item.PK));
            if (partition != null) {
                entityId = partition.entityId();
                resource = partition.resource();
            }
        }
        long rf = item.getLong(REFILL, 0L);

        List<BucketState> limits = new ArrayList<>();
        for (String name : limitNames(item)) {
            Long tk = item.getLong(attr(name, TOKENS));
            Long cp = item.getLong(attr(name, CAPACITY));
            Long bx = item.getLong(attr(name, BURST));
            Long ra = item.getLong(attr(name, REFILL_AMOUNT));
            Long rp = item.getLong(attr(name, REFILL_PERIOD));
            if (tk == null || cp == null || bx == null || ra == null || rp == null) continue;
            long tc = item.getLong(attr(name, CONSUMED), 0L);
            limits.add(new BucketState(entityId, resource, name, tk, rf, cp, bx, ra, rp, tc));
        }
        return new CompositeBucket(entityId, resource, rf,
            item.getString(Schema.ATTR_PARENT_ID), item.getBoolean(Schema.ATTR_CASCADE, false), limits);
    }
}
