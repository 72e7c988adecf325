package hrl.java.engine;

import hrl.core.clock.Clock;
import hrl.core.model.ConfigSource;
import hrl.core.model.Entity;
import hrl.core.model.FailureMode;
import hrl.core.model.Identifiers;
import hrl.core.model.Limit;
import hrl.core.model.LimitResolution;
import hrl.java.store.EntityRepository;
import hrl.java.store.EntityRepository.SystemDefaults;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through cache over stored limit configuration and entity metadata.
 *
 * <p>Resolution order for an (entity, resource) pair:
 * <ol>
 *   <li>limits stored for the entity and that resource</li>
 *   <li>limits stored for the entity under {@code _default_}</li>
 *   <li>resource defaults</li>
 *   <li>system defaults</li>
 * </ol>
 * The stored failure mode always comes from the system defaults.
 *
 * <p>Entries live for a fixed TTL and are bounded by an LRU. The engine
 * invalidates the keys its own writes touch; writes from other processes become
 * visible once the TTL lapses.
 */
final class ConfigCache {

    private final EntityRepository repository;
    private final Clock clock;
    private final long ttlMs;
    private final Stats stats = new Stats();

    private final LRUCache<String, CacheSlot<List<Limit>>> limits;
    private final LRUCache<String, CacheSlot<Entity>> entities;
    private volatile CacheSlot<SystemDefaults> system = new CacheSlot<>();

    ConfigCache(EntityRepository repository, Clock clock, Duration ttl, int maxSize) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.repository = repository;
        this.clock = clock;
        this.ttlMs = ttl.toMillis();
        this.limits = new LRUCache<>(maxSize, (key, slot) -> stats.evictions.incrementAndGet());
        this.entities = new LRUCache<>(maxSize, (key, slot) -> stats.evictions.incrementAndGet());
    }

    /**
     * @return the effective stored limits, or empty when no level defines any
     */
    Optional<LimitResolution> resolve(String entityId, String resource) {
        FailureMode onUnavailable = storedFailureMode();

        Optional<List<Limit>> found = entityLimits(entityId, resource);
        if (found.isPresent()) {
            return Optional.of(new LimitResolution(found.get(), onUnavailable, ConfigSource.ENTITY));
        }
        found = entityLimits(entityId, Identifiers.DEFAULT_RESOURCE);
        if (found.isPresent()) {
            return Optional.of(new LimitResolution(found.get(), onUnavailable, ConfigSource.ENTITY_DEFAULT));
        }
        found = resourceLimits(resource);
        if (found.isPresent()) {
            return Optional.of(new LimitResolution(found.get(), onUnavailable, ConfigSource.RESOURCE));
        }
        Optional<SystemDefaults> defaults = systemDefaults();
        if (defaults.isPresent() && !defaults.get().limits().isEmpty()) {
            return Optional.of(new LimitResolution(defaults.get().limits(), onUnavailable, ConfigSource.SYSTEM));
        }
        return Optional.empty();
    }

    /** Failure mode stored with the system defaults, or {@code null}. */
    FailureMode storedFailureMode() {
        return systemDefaults().map(SystemDefaults::onUnavailable).orElse(null);
    }

    Optional<Entity> entity(String entityId) {
        return entities.getOrCreate(entityId, k -> new CacheSlot<>())
            .get(clock.nowMillis(), ttlMs, () -> repository.getEntity(entityId), stats);
    }

    private Optional<List<Limit>> entityLimits(String entityId, String resource) {
        return limits.getOrCreate(entityKey(entityId, resource), k -> new CacheSlot<>())
            .get(clock.nowMillis(), ttlMs, () -> repository.getLimits(entityId, resource), stats);
    }

    private Optional<List<Limit>> resourceLimits(String resource) {
        return limits.getOrCreate(resourceKey(resource), k -> new CacheSlot<>())
            .get(clock.nowMillis(), ttlMs, () -> repository.getResourceDefaults(resource), stats);
    }

    private Optional<SystemDefaults> systemDefaults() {
        return system.get(clock.nowMillis(), ttlMs, repository::getSystemDefaults, stats);
    }

    void invalidateEntityLimits(String entityId, String resource) {
        limits.remove(entityKey(entityId, resource));
    }

    /** Drops the entity's metadata and every limit entry cached for it. */
    void invalidateEntity(String entityId) {
        entities.remove(entityId);
        String prefix = "E#" + entityId + "#";
        limits.removeIf(key -> key.startsWith(prefix));
    }

    void invalidateResource(String resource) {
        limits.remove(resourceKey(resource));
    }

    void invalidateSystem() {
        system = new CacheSlot<>();
    }

    void clear() {
        limits.clear();
        entities.clear();
        system = new CacheSlot<>();
    }

    Stats stats() {
        return stats;
    }

    int size() {
        return limits.size() + entities.size();
    }

    private static String entityKey(String entityId, String resource) {
        return "E#" + entityId + "#" + resource;
    }

    private static String resourceKey(String resource) {
        return "R#" + resource;
    }

    /** Lookup counters, cumulative since the cache was created. */
    static final class Stats {
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();
        private final AtomicLong evictions = new AtomicLong();

        void hit() {
            hits.incrementAndGet();
        }

        void miss() {
            misses.incrementAndGet();
        }

        long hits() {
            return hits.get();
        }

        long misses() {
            return misses.get();
        }

        long evictions() {
            return evictions.get();
        }
    }
}
