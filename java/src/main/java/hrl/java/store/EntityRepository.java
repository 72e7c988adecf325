package hrl.java.store;

import hrl.core.error.EntityExistsException;
import hrl.core.error.IncompatibleSchemaException;
import hrl.core.error.VersionMismatchException;
import hrl.core.model.Entity;
import hrl.core.model.FailureMode;
import hrl.core.model.Limit;
import hrl.core.model.UsageSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entities, stored limit configuration and usage snapshots of one namespace.
 *
 * <p>Limits are stored at three levels: per entity and resource (including the
 * entity-wide {@code _default_} resource), per resource, and per namespace. The
 * namespace level also carries the stored failure mode.
 */
public final class EntityRepository {

    static final String ATTR_NAME = "name";
    static final String ATTR_METADATA = "metadata";
    static final String ATTR_CREATED_AT = "created_at";
    static final String ATTR_LIMITS = "limits";
    static final String ATTR_ON_UNAVAILABLE = "on_unavailable";
    static final String ATTR_SCHEMA_VERSION = "schema_version";
    static final String LIMIT_PREFIX = "l_";

    private final ItemStore store;
    private final String namespaceId;

    public EntityRepository(ItemStore store, String namespaceId) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (namespaceId == null || namespaceId.isEmpty()) {
            throw new IllegalArgumentException("namespaceId cannot be empty");
        }
        this.store = store;
        this.namespaceId = namespaceId;
    }

    // Entities

    /**
     * @throws EntityExistsException if an entity with the same id exists
     */
    public Entity createEntity(Entity entity) {
        Item.Builder b = Item.builder()
            .key(Schema.entityKey(namespaceId, entity.id()))
            .put(Schema.ATTR_ENTITY_ID, entity.id())
            .put(ATTR_NAME, entity.name())
            .put(Schema.ATTR_PARENT_ID, entity.parentId())
            .put(Schema.ATTR_CASCADE, entity.cascade())
            .put(ATTR_CREATED_AT, entity.createdAt() == null ? null : entity.createdAt().toString());
        if (!entity.metadata().isEmpty()) {
            b.put(ATTR_METADATA, entity.metadata());
        }
        if (entity.parentId() != null) {
            b.put(Index.PARENT.partitionAttribute(), Schema.parentPartition(namespaceId, entity.parentId()))
                .put(Index.PARENT.sortAttribute(), Schema.childSort(entity.id()));
        }
        try {
            store.write(PutRequest.create(b.build()));
        } catch (ConditionFailedException e) {
            throw new EntityExistsException(entity.id());
        }
        return entity;
    }

    public Optional<Entity> getEntity(String entityId) {
        return store.get(Schema.entityKey(namespaceId, entityId)).map(EntityRepository::decodeEntity);
    }

    /**
     * Deletes the entity with its limit configuration, buckets and usage snapshots.
     */
    public void deleteEntity(String entityId) {
        for (Item bucket : store.queryIndex(Index.ENTITY_BUCKETS, Schema.entityPartition(namespaceId, entityId),
                Schema.bucketIndexSortPrefix())) {
            store.delete(bucket.key());
        }
        for (Item item : store.query(Schema.entityPartition(namespaceId, entityId), "#")) {
            store.delete(item.key());
        }
    }

    public List<Entity> getChildren(String parentId) {
        List<Entity> children = new ArrayList<>();
        for (Item item : store.queryIndex(Index.PARENT, Schema.parentPartition(namespaceId, parentId),
                Schema.childSortPrefix())) {
            children.add(decodeEntity(item));
        }
        return children;
    }

    // Limits

    public void setLimits(String entityId, String resource, List<Limit> limits) {
        Item.Builder b = limitsItem(Schema.entityConfigKey(namespaceId, entityId, resource), limits)
            .put(Schema.ATTR_ENTITY_ID, entityId)
            .put(Schema.ATTR_RESOURCE, resource)
            .put(Index.ENTITY_CONFIG.partitionAttribute(), Schema.entityConfigPartition(namespaceId, resource))
            .put(Index.ENTITY_CONFIG.sortAttribute(), entityId);
        store.write(PutRequest.overwrite(b.build()));
    }

    public Optional<List<Limit>> getLimits(String entityId, String resource) {
        return store.get(Schema.entityConfigKey(namespaceId, entityId, resource)).map(EntityRepository::decodeLimits);
    }

    public void deleteLimits(String entityId, String resource) {
        store.delete(Schema.entityConfigKey(namespaceId, entityId, resource));
    }

    /** Entity ids with custom limits on {@code resource}. */
    public List<String> listEntitiesWithCustomLimits(String resource) {
        List<String> ids = new ArrayList<>();
        for (Item item : store.queryIndex(Index.ENTITY_CONFIG, Schema.entityConfigPartition(namespaceId, resource), "")) {
            ids.add(item.getString(Schema.ATTR_ENTITY_ID));
        }
        return ids;
    }

    public void setResourceDefaults(String resource, List<Limit> limits) {
        Item item = limitsItem(Schema.resourceConfigKey(namespaceId, resource), limits)
            .put(Schema.ATTR_RESOURCE, resource)
            .build();
        store.write(PutRequest.overwrite(item));
    }

    public Optional<List<Limit>> getResourceDefaults(String resource) {
        return store.get(Schema.resourceConfigKey(namespaceId, resource)).map(EntityRepository::decodeLimits);
    }

    public void deleteResourceDefaults(String resource) {
        store.delete(Schema.resourceConfigKey(namespaceId, resource));
    }

    /**
     * @param onUnavailable stored failure mode, or {@code null} to leave it to the engine
     */
    public void setSystemDefaults(List<Limit> limits, FailureMode onUnavailable) {
        Item item = limitsItem(Schema.systemConfigKey(namespaceId), limits)
            .put(ATTR_ON_UNAVAILABLE, onUnavailable == null ? null : onUnavailable.wireValue())
            .build();
        store.write(PutRequest.overwrite(item));
    }

    public Optional<SystemDefaults> getSystemDefaults() {
        return store.get(Schema.systemConfigKey(namespaceId)).map(item -> {
            String mode = item.getString(ATTR_ON_UNAVAILABLE);
            return new SystemDefaults(decodeLimits(item), mode == null ? null : FailureMode.fromWire(mode));
        });
    }

    public void deleteSystemDefaults() {
        store.delete(Schema.systemConfigKey(namespaceId));
    }

    /**
     * @param limits possibly empty when only a failure mode is stored
     * @param onUnavailable {@code null} when not stored
     */
    public record SystemDefaults(List<Limit> limits, FailureMode onUnavailable) {
    }

    // Usage

    public List<UsageSnapshot> getUsageSnapshots(String entityId, String resource, String window) {
        List<UsageSnapshot> snapshots = new ArrayList<>();
        for (Item item : store.query(Schema.entityPartition(namespaceId, entityId), Schema.usageSortPrefix(resource, window))) {
            snapshots.add(UsageRecords.decode(item));
        }
        return snapshots;
    }

    // Schema version

    /**
     * Verifies the stored schema version against this client, initialising the
     * version record on a fresh table.
     *
     * @throws IncompatibleSchemaException on a major version difference
     * @throws VersionMismatchException on a minor version difference
     */
    public String checkSchemaVersion() {
        Optional<Item> record = store.get(Schema.versionKey());
        if (record.isEmpty()) {
            Item item = Item.builder()
                .key(Schema.versionKey())
                .put(ATTR_SCHEMA_VERSION, Schema.SCHEMA_VERSION)
                .build();
            try {
                store.write(PutRequest.create(item));
                return Schema.SCHEMA_VERSION;
            } catch (ConditionFailedException raced) {
                record = store.get(Schema.versionKey());
            }
        }
        String stored = record.map(i -> i.getString(ATTR_SCHEMA_VERSION)).orElse(Schema.SCHEMA_VERSION);
        String[] client = Schema.SCHEMA_VERSION.split("\\.");
        String[] schema = stored.split("\\.");
        if (!client[0].equals(schema[0])) {
            throw new IncompatibleSchemaException(Schema.SCHEMA_VERSION, stored, "Migrate the table before using this client.");
        }
        if (schema.length < 2 || !client[1].equals(schema[1])) {
            throw new VersionMismatchException(Schema.SCHEMA_VERSION, stored, "Upgrade the client or the schema record.");
        }
        return stored;
    }

    // Encoding

    private static Item.Builder limitsItem(ItemKey key, List<Limit> limits) {
        Item.Builder b = Item.builder().key(key);
        List<String> names = new ArrayList<>();
        for (Limit limit : limits) {
            names.add(limit.name());
            b.put(LIMIT_PREFIX + limit.name() + "_cp", limit.capacity())
                .put(LIMIT_PREFIX + limit.name() + "_bx", limit.burst())
                .put(LIMIT_PREFIX + limit.name() + "_ra", limit.refillAmount())
                .put(LIMIT_PREFIX + limit.name() + "_rp", limit.refillPeriodSeconds());
        }
        return b.put(ATTR_LIMITS, String.join(",", names));
    }

    static List<Limit> decodeLimits(Item item) {
        List<Limit> limits = new ArrayList<>();
        String names = item.getString(ATTR_LIMITS);
        if (names == null || names.isEmpty()) return limits;
        for (String name : names.split(",")) {
            limits.add(new Limit(
                name,
                item.getLong(LIMIT_PREFIX + name + "_cp", 0L),
                item.getLong(LIMIT_PREFIX + name + "_bx", 0L),
                item.getLong(LIMIT_PREFIX + name + "_ra", 0L),
                item.getLong(LIMIT_PREFIX + name + "_rp", 0L)
            ));
        }
        return limits;
    }

    private static Entity decodeEntity(Item item) {
        String createdAt = item.getString(ATTR_CREATED_AT);
        Map<String, String> metadata = item.getMap(ATTR_METADATA);
        return new Entity(
            item.getString(Schema.ATTR_ENTITY_ID),
            item.getString(ATTR_NAME),
            item.getString(Schema.ATTR_PARENT_ID),
            metadata,
            item.getBoolean(Schema.ATTR_CASCADE, false),
            createdAt == null ? null : Instant.parse(createdAt)
        );
    }
}
