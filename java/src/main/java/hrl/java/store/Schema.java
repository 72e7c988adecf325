package hrl.java.store;

/**
 * Key layout of the single item table.
 *
 * <p>Every partition key is prefixed with the owning namespace id and a slash, so
 * tenants sharing a table never see each other's items. The reserved namespace
 * {@value #SYSTEM_NAMESPACE} holds the namespace registry and the schema version.
 */
public final class Schema {

    public static final String SYSTEM_NAMESPACE = "_";
    public static final String SCHEMA_VERSION = "1.0.0";

    /** Buckets are not sharded yet; the key keeps room for it. */
    public static final int DEFAULT_SHARD = 0;

    public static final String SK_STATE = "#STATE";
    public static final String SK_META = "#META";
    public static final String SK_CONFIG = "#CONFIG";
    public static final String SK_CONFIG_PREFIX = "#CONFIG#";
    public static final String SK_USAGE_PREFIX = "#USAGE#";
    public static final String SK_VERSION = "#VERSION";
    public static final String SK_NAMESPACE_PREFIX = "#NAMESPACE#";
    public static final String SK_NSID_PREFIX = "#NSID#";

    static final String BUCKET = "BUCKET#";
    static final String ENTITY = "ENTITY#";
    static final String PARENT = "PARENT#";
    static final String CHILD = "CHILD#";
    static final String RESOURCE = "RESOURCE#";
    static final String ENTITY_CONFIG = "ENTITY_CONFIG#";
    static final String SYSTEM = "SYSTEM#";
    static final String USAGE = "USAGE#";

    // Shared attribute names
    public static final String ATTR_ENTITY_ID = "entity_id";
    public static final String ATTR_RESOURCE = "resource";
    public static final String ATTR_PARENT_ID = "parent_id";
    public static final String ATTR_CASCADE = "cascade";
    public static final String ATTR_TTL = "ttl";

    private Schema() {
    }

    public static ItemKey bucketKey(String ns, String entityId, String resource) {
        return new ItemKey(bucketPartition(ns, entityId, resource, DEFAULT_SHARD), SK_STATE);
    }

    public static String bucketPartition(String ns, String entityId, String resource, int shard) {
        return ns + "/" + BUCKET + entityId + "#" + resource + "#" + shard;
    }

    /**
     * Splits a bucket partition key into namespace, entity, resource and shard.
     * Resource names may not contain {@code #}, so the split is unambiguous.
     *
     * @return {@code null} when {@code partition} is not a bucket key
     */
    public static BucketPartition parseBucketPartition(String partition) {
        if (partition == null) return null;
        int slash = partition.indexOf('/');
        if (slash < 0 || !partition.startsWith(BUCKET, slash + 1)) return null;
        String ns = partition.substring(0, slash);
        String[] parts = partition.substring(slash + 1 + BUCKET.length()).split("#");
        if (parts.length != 3) return null;
        try {
            return new BucketPartition(ns, parts[0], parts[1], Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public record BucketPartition(String namespace, String entityId, String resource, int shard) {
    }

    public static String resourcePartition(String ns, String resource) {
        return ns + "/" + RESOURCE + resource;
    }

    public static String bucketIndexSort(String entityId) {
        return BUCKET + entityId + "#" + DEFAULT_SHARD;
    }

    public static String bucketIndexSortPrefix() {
        return BUCKET;
    }

    public static String entityBucketSort(String resource) {
        return BUCKET + resource + "#" + DEFAULT_SHARD;
    }

    public static String entityPartition(String ns, String entityId) {
        return ns + "/" + ENTITY + entityId;
    }

    public static ItemKey entityKey(String ns, String entityId) {
        return new ItemKey(entityPartition(ns, entityId), SK_META);
    }

    public static String parentPartition(String ns, String parentId) {
        return ns + "/" + PARENT + parentId;
    }

    public static String childSort(String entityId) {
        return CHILD + entityId;
    }

    public static String childSortPrefix() {
        return CHILD;
    }

    public static ItemKey entityConfigKey(String ns, String entityId, String resource) {
        return new ItemKey(entityPartition(ns, entityId), SK_CONFIG_PREFIX + resource);
    }

    public static String entityConfigPartition(String ns, String resource) {
        return ns + "/" + ENTITY_CONFIG + resource;
    }

    public static ItemKey resourceConfigKey(String ns, String resource) {
        return new ItemKey(resourcePartition(ns, resource), SK_CONFIG);
    }

    public static ItemKey systemConfigKey(String ns) {
        return new ItemKey(systemPartition(ns), SK_CONFIG);
    }

    public static String systemPartition(String ns) {
        return ns + "/" + SYSTEM;
    }

    public static ItemKey usageKey(String ns, String entityId, String resource, String window, String windowStart) {
        return new ItemKey(entityPartition(ns, entityId), usageSortPrefix(resource, window) + windowStart);
    }

    public static String usageSortPrefix(String resource, String window) {
        return SK_USAGE_PREFIX + resource + "#" + window + "#";
    }

    public static String usageIndexSort(String window, String windowStart, String entityId) {
        return USAGE + window + "#" + windowStart + "#" + entityId;
    }

    public static ItemKey versionKey() {
        return new ItemKey(systemPartition(SYSTEM_NAMESPACE), SK_VERSION);
    }

    public static ItemKey namespaceKey(String name) {
        return new ItemKey(systemPartition(SYSTEM_NAMESPACE), SK_NAMESPACE_PREFIX + name);
    }

    public static ItemKey namespaceIdKey(String id) {
        return new ItemKey(systemPartition(SYSTEM_NAMESPACE), SK_NSID_PREFIX + id);
    }
}
