package hrl.java.engine;

import hrl.core.bucket.TokenBucket;
import hrl.core.clock.Clock;
import hrl.core.clock.SystemClock;
import hrl.core.error.EntityNotFoundException;
import hrl.core.error.RateLimitExceededException;
import hrl.core.error.RateLimiterUnavailableException;
import hrl.core.error.ValidationException;
import hrl.core.model.Amounts;
import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;
import hrl.core.model.ConfigSource;
import hrl.core.model.Entity;
import hrl.core.model.EntityCapacity;
import hrl.core.model.FailureMode;
import hrl.core.model.Identifiers;
import hrl.core.model.Limit;
import hrl.core.model.LimitResolution;
import hrl.core.model.LimitStatus;
import hrl.core.model.ResourceCapacity;
import hrl.core.model.UsageSnapshot;
import hrl.core.model.WindowType;
import hrl.java.store.BucketCodec;
import hrl.java.store.BucketRepository;
import hrl.java.store.ConditionFailedException;
import hrl.java.store.EntityRepository;
import hrl.java.store.EntityRepository.SystemDefaults;
import hrl.java.store.ItemStore;
import hrl.java.store.NamespaceRegistry;
import hrl.java.store.SpeculativeResult;
import hrl.java.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Multi-tenant token bucket rate limiter over a shared key-value store.
 *
 * <p>Admission state lives entirely in the store: every engine instance pointed
 * at the same table and namespace enforces the same quotas, and correctness rests
 * on the store's conditional writes rather than on in-process locks. The only
 * in-process state is the configuration cache and the cascade thread pool.
 *
 * <p>Acquire protocol:
 * <ol>
 *   <li>Resolve limits (stored configuration or caller-supplied) for the entity
 *       and, under cascade, its parent.</li>
 *   <li>Speculative phase: one conditional debit per bucket, no reads. If every
 *       bucket admits, done. Otherwise admitted buckets are compensated, and when
 *       a rejected bucket's image shows refill would not help, the request is
 *       rejected without further I/O.</li>
 *   <li>Read-then-write phase, per bucket: create a missing record, or refill and
 *       debit under an optimistic lock on the refill timestamp, with a bounded
 *       number of attempts.</li>
 * </ol>
 *
 * <p>Store failures are resolved by the failure mode: a per-call mode wins over
 * the mode stored with the system defaults, which wins over the engine's.
 *
 * <p>Usage example:
 * <pre>
 * RateLimiterEngine engine = RateLimiterEngine.builder(store).namespace("prod").build();
 * AcquireRequest request = AcquireRequest.builder("user-1", "gpt-4")
 *     .limits(Limit.perMinute("rpm", 100))
 *     .consume("rpm", 1)
 *     .build();
 * try (Lease lease = engine.acquire(request)) {
 *     // call the model
 *     lease.commit();
 * } catch (RateLimitExceededException e) {
 *     // reject with e.retryAfterHeader()
 * }
 * </pre>
 */
public final class RateLimiterEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEngine.class);

    private final String namespace;
    private final String namespaceId;
    private final Clock clock;
    private final EngineConfig config;
    private final BucketRepository buckets;
    private final EntityRepository entities;
    private final ConfigCache configCache;
    private final CascadeExecutor executor;

    private RateLimiterEngine(Builder b, String namespaceId) {
        this.namespace = b.namespace;
        this.namespaceId = namespaceId;
        this.clock = b.clock;
        this.config = b.config;
        this.buckets = new BucketRepository(b.store, namespaceId);
        this.entities = new EntityRepository(b.store, namespaceId);
        this.configCache = new ConfigCache(entities, clock, config.configCacheTtl(), config.configCacheSize());
        this.executor = CascadeExecutor.create(config.parallelMode(), config.parallelism());
    }

    public static Builder builder(ItemStore store) {
        return new Builder(store);
    }

    public String namespace() {
        return namespace;
    }

    /** Opaque id the namespace is stored under. */
    public String namespaceId() {
        return namespaceId;
    }

    public EngineConfig config() {
        return config;
    }

    // Entities

    public Entity createEntity(String entityId) {
        return createEntity(entityId, null, null, false, Map.of());
    }

    /**
     * @param parentId parent entity, which must already exist, or {@code null}
     * @param cascade mirror this entity's consumption onto its parent
     * @throws EntityNotFoundException if {@code parentId} does not exist
     * @throws hrl.core.error.EntityExistsException if {@code entityId} exists
     */
    public Entity createEntity(String entityId, String name, String parentId, boolean cascade,
                               Map<String, String> metadata) {
        Identifiers.entityId(entityId);
        if (parentId != null) {
            Identifiers.entityId(parentId);
        }
        return control(entityId, null, () -> {
            if (parentId != null && entities.getEntity(parentId).isEmpty()) {
                throw new EntityNotFoundException(parentId);
            }
            Entity entity = new Entity(entityId, name == null ? entityId : name, parentId, metadata, cascade,
                Instant.ofEpochMilli(clock.nowMillis()));
            Entity created = entities.createEntity(entity);
            configCache.invalidateEntity(entityId);
            return created;
        });
    }

    public Optional<Entity> getEntity(String entityId) {
        Identifiers.entityId(entityId);
        return control(entityId, null, () -> entities.getEntity(entityId));
    }

    /**
     * Deletes the entity with its stored limits, buckets and usage snapshots.
     *
     * @throws EntityNotFoundException if the entity does not exist
     */
    public void deleteEntity(String entityId) {
        Identifiers.entityId(entityId);
        control(entityId, null, () -> {
            if (entities.getEntity(entityId).isEmpty()) {
                throw new EntityNotFoundException(entityId);
            }
            entities.deleteEntity(entityId);
            configCache.invalidateEntity(entityId);
            return null;
        });
    }

    public List<Entity> getChildren(String parentId) {
        Identifiers.entityId(parentId);
        return control(parentId, null, () -> entities.getChildren(parentId));
    }

    // Stored limits

    /**
     * Stores limits for one entity and resource. Use {@link Identifiers#DEFAULT_RESOURCE}
     * for limits that apply to every resource the entity has no specific limits for.
     */
    public void setLimits(String entityId, String resource, List<Limit> limits) {
        Identifiers.entityId(entityId);
        Identifiers.configResource(resource);
        AcquireRequest.checkUniqueNames(limits);
        control(entityId, resource, () -> {
            entities.setLimits(entityId, resource, limits);
            configCache.invalidateEntityLimits(entityId, resource);
            return null;
        });
    }

    public Optional<List<Limit>> getLimits(String entityId, String resource) {
        Identifiers.entityId(entityId);
        Identifiers.configResource(resource);
        return control(entityId, resource, () -> entities.getLimits(entityId, resource));
    }

    public void deleteLimits(String entityId, String resource) {
        Identifiers.entityId(entityId);
        Identifiers.configResource(resource);
        control(entityId, resource, () -> {
            entities.deleteLimits(entityId, resource);
            configCache.invalidateEntityLimits(entityId, resource);
            return null;
        });
    }

    public List<String> listEntitiesWithCustomLimits(String resource) {
        Identifiers.configResource(resource);
        return control(null, resource, () -> entities.listEntitiesWithCustomLimits(resource));
    }

    public void setResourceDefaults(String resource, List<Limit> limits) {
        Identifiers.resource(resource);
        AcquireRequest.checkUniqueNames(limits);
        control(null, resource, () -> {
            entities.setResourceDefaults(resource, limits);
            configCache.invalidateResource(resource);
            return null;
        });
    }

    public Optional<List<Limit>> getResourceDefaults(String resource) {
        Identifiers.resource(resource);
        return control(null, resource, () -> entities.getResourceDefaults(resource));
    }

    public void deleteResourceDefaults(String resource) {
        Identifiers.resource(resource);
        control(null, resource, () -> {
            entities.deleteResourceDefaults(resource);
            configCache.invalidateResource(resource);
            return null;
        });
    }

    /**
     * @param onUnavailable namespace-wide failure mode, or {@code null} to use the engine's
     */
    public void setSystemDefaults(List<Limit> limits, FailureMode onUnavailable) {
        AcquireRequest.checkUniqueNames(limits);
        control(null, null, () -> {
            entities.setSystemDefaults(limits, onUnavailable);
            configCache.invalidateSystem();
            return null;
        });
    }

    public Optional<SystemDefaults> getSystemDefaults() {
        return control(null, null, entities::getSystemDefaults);
    }

    public void deleteSystemDefaults() {
        control(null, null, () -> {
            entities.deleteSystemDefaults();
            configCache.invalidateSystem();
            return null;
        });
    }

    /** Stored limits in force for the pair, through the configuration cache. */
    public Optional<LimitResolution> resolveLimits(String entityId, String resource) {
        Identifiers.entityId(entityId);
        Identifiers.resource(resource);
        return control(entityId, resource, () -> configCache.resolve(entityId, resource));
    }

    // Admission

    /**
     * Takes tokens and returns a lease over them.
     *
     * @throws ValidationException if no limits apply or a consumed name has no limit
     * @throws RateLimitExceededException if any bucket lacks the tokens; nothing is debited
     * @throws RateLimiterUnavailableException if the store failed and the failure mode is fail-closed
     */
    public Lease acquire(AcquireRequest request) {
        String entityId = request.entityId();
        String resource = request.resource();
        try {
            List<Target> targets = resolveTargets(request);
            admit(resource, targets, request.consume());
            return new Lease(this, entityId, resource, targets, request.consume(), request.failureMode());
        } catch (StoreException e) {
            if (effectiveFailureMode(request.failureMode()) == FailureMode.FAIL_OPEN) {
                log.atWarn()
                    .addKeyValue("entity_id", entityId)
                    .addKeyValue("resource", resource)
                    .setCause(e)
                    .log("Store unavailable, admitting with no-op lease");
                return Lease.noop(entityId, resource);
            }
            throw unavailable(e, entityId, resource);
        }
    }

    /**
     * Runs {@code callback} under a lease: committed when the callback returns,
     * rolled back when it throws. A failed rollback is attached to the callback's
     * exception as suppressed.
     */
    public <T, E extends Exception> T execute(AcquireRequest request, LeaseCallback<T, E> callback) throws E {
        try (Lease lease = acquire(request)) {
            T result = callback.apply(lease);
            lease.commit();
            return result;
        }
    }

    /**
     * Whole tokens available per limit, with refill projected to now. Nothing is
     * written; a limit without a bucket reports its burst.
     */
    public Map<String, Long> available(String entityId, String resource) {
        return available(entityId, resource, List.of());
    }

    public Map<String, Long> available(String entityId, String resource, List<Limit> fallback) {
        Identifiers.entityId(entityId);
        Identifiers.resource(resource);
        return control(entityId, resource, () -> {
            long now = clock.nowMillis();
            Target target = resolveTarget(entityId, resource, true, fallback, null, false);
            Optional<CompositeBucket> bucket = buckets.getBucket(entityId, resource);
            Map<String, Long> result = new LinkedHashMap<>();
            for (Limit limit : target.limits()) {
                BucketState state = projected(bucket, entityId, resource, limit, now);
                result.put(limit.name(), TokenBucket.available(state, now));
            }
            return result;
        });
    }

    /**
     * Seconds until every limit named in {@code needed} has the requested tokens,
     * the longest wait across limits; 0 when they are available now.
     */
    public double timeUntilAvailable(String entityId, String resource, Amounts needed, List<Limit> fallback) {
        Identifiers.entityId(entityId);
        Identifiers.resource(resource);
        return control(entityId, resource, () -> {
            long now = clock.nowMillis();
            Target target = resolveTarget(entityId, resource, true, fallback, null, false);
            validateNames(target, needed);
            Optional<CompositeBucket> bucket = buckets.getBucket(entityId, resource);
            double wait = 0.0;
            for (Map.Entry<String, Long> e : needed.asMap().entrySet()) {
                Limit limit = target.limit(e.getKey()).orElseThrow();
                BucketState state = projected(bucket, entityId, resource, limit, now);
                wait = Math.max(wait, TokenBucket.timeUntilAvailable(state, e.getValue(), now));
            }
            return wait;
        });
    }

    /**
     * Capacity and availability of one limit summed over every bucket of the
     * resource, with refill projected to now.
     *
     * @param parentsOnly skip buckets of entities that have a parent
     */
    public ResourceCapacity getResourceCapacity(String resource, String limitName, boolean parentsOnly) {
        Identifiers.resource(resource);
        Identifiers.limitName(limitName);
        return control(null, resource, () -> {
            long now = clock.nowMillis();
            List<EntityCapacity> perEntity = new ArrayList<>();
            long totalCapacity = 0;
            long totalAvailable = 0;
            for (CompositeBucket bucket : buckets.getResourceBuckets(resource)) {
                if (parentsOnly && bucket.parentId() != null) continue;
                Optional<BucketState> state = bucket.limit(limitName);
                if (state.isEmpty()) continue;
                long capacity = state.get().capacityMilli() / Limit.MILLI;
                long available = TokenBucket.available(state.get(), now);
                perEntity.add(new EntityCapacity(bucket.entityId(), capacity, available,
                    utilization(capacity, available)));
                totalCapacity += capacity;
                totalAvailable += available;
            }
            return new ResourceCapacity(resource, limitName, totalCapacity, totalAvailable,
                utilization(totalCapacity, totalAvailable), perEntity);
        });
    }

    public List<UsageSnapshot> getUsageSnapshots(String entityId, String resource, WindowType window) {
        Identifiers.entityId(entityId);
        Identifiers.resource(resource);
        return control(entityId, resource, () -> entities.getUsageSnapshots(entityId, resource, window.wireValue()));
    }

    /** Stops the cascade pool. The store is owned by the caller and stays open. */
    @Override
    public void close() {
        executor.close();
    }

    ConfigCache configCache() {
        return configCache;
    }

    // Lease callbacks

    /**
     * @return false if the store failed and the lease's failure mode let it through
     */
    boolean leaseAdmit(Lease lease, Amounts extra) {
        try {
            admit(lease.resource(), lease.targets(), extra);
            return true;
        } catch (StoreException e) {
            return leaseStoreFailure(lease, e, "consume");
        }
    }

    /**
     * Applies a correction with no token guard to every bucket of the lease. Buckets that
     * no longer exist are skipped.
     *
     * @return false if the store failed and the lease's failure mode let it through
     */
    boolean leaseAdjust(Lease lease, Amounts delta) {
        try {
            for (Target target : lease.targets()) {
                Amounts selected = target.select(delta);
                if (!selected.isEmpty()) {
                    adjust(target.entityId(), lease.resource(), selected.toMilli());
                }
            }
            return true;
        } catch (StoreException e) {
            return leaseStoreFailure(lease, e, "adjust");
        }
    }

    private boolean leaseStoreFailure(Lease lease, StoreException e, String operation) {
        if (effectiveFailureMode(lease.failureMode()) == FailureMode.FAIL_OPEN) {
            log.atWarn()
                .addKeyValue("entity_id", lease.entityId())
                .addKeyValue("resource", lease.resource())
                .addKeyValue("operation", operation)
                .setCause(e)
                .log("Store unavailable, lease change dropped");
            return false;
        }
        throw unavailable(e, lease.entityId(), lease.resource());
    }

    void validateNames(Target target, Amounts amounts) {
        for (String name : amounts.names()) {
            if (target.limit(name).isEmpty()) {
                throw new ValidationException("consume", name, "no limit with this name applies to the request");
            }
        }
    }

    // Limit resolution

    private List<Target> resolveTargets(AcquireRequest request) {
        String entityId = request.entityId();
        String resource = request.resource();
        Optional<Entity> entity = configCache.entity(entityId);
        String parentId = entity.map(Entity::parentId).orElse(null);
        boolean cascade = parentId != null
            && (request.cascade() != null ? request.cascade() : entity.get().cascade());

        Target child = resolveTarget(entityId, resource, request.useStoredLimits(), request.limits(),
            parentId, entity.map(Entity::cascade).orElse(false));
        validateNames(child, request.consume());
        if (!cascade) {
            return List.of(child);
        }

        Optional<Entity> parent = configCache.entity(parentId);
        Target parentTarget = resolveTarget(parentId, resource, request.useStoredLimits(), request.limits(),
            parent.map(Entity::parentId).orElse(null), parent.map(Entity::cascade).orElse(false));
        return List.of(child, parentTarget);
    }

    private Target resolveTarget(String entityId, String resource, boolean useStored, List<Limit> fallback,
                                 String parentId, boolean cascade) {
        if (useStored) {
            Optional<LimitResolution> stored = configCache.resolve(entityId, resource);
            if (stored.isPresent()) {
                return new Target(entityId, stored.get().limits(), stored.get().source(), parentId, cascade);
            }
        }
        if (fallback.isEmpty()) {
            throw new ValidationException("limits", resource, "no limits configured and none supplied");
        }
        return new Target(entityId, fallback, ConfigSource.OVERRIDE, parentId, cascade);
    }

    private FailureMode effectiveFailureMode(FailureMode perCall) {
        if (perCall != null) return perCall;
        try {
            FailureMode stored = configCache.storedFailureMode();
            if (stored != null) return stored;
        } catch (StoreException e) {
            log.debug("Stored failure mode unreadable, using engine default", e);
        }
        return config.failureMode();
    }

    // Admission protocol

    private void admit(String resource, List<Target> targets, Amounts consume) {
        if (config.speculativeWrites()) {
            List<Supplier<SpeculativeResult>> legs = new ArrayList<>(targets.size());
            for (Target target : targets) {
                Amounts amounts = target.select(consume).toMilli();
                legs.add(() -> buckets.speculativeConsume(target.entityId(), resource, amounts));
            }
            List<CascadeExecutor.Leg<SpeculativeResult>> results = executor.runAll(legs);

            boolean allAdmitted = true;
            RuntimeException failure = null;
            List<Target> admitted = new ArrayList<>();
            for (int i = 0; i < targets.size(); i++) {
                CascadeExecutor.Leg<SpeculativeResult> leg = results.get(i);
                if (leg.failed()) {
                    allAdmitted = false;
                    if (failure == null) failure = leg.error();
                } else if (leg.value().success()) {
                    admitted.add(targets.get(i));
                } else {
                    allAdmitted = false;
                }
            }
            if (allAdmitted) {
                return;
            }
            compensate(resource, admitted, consume, failure);
            if (failure != null) {
                throw failure;
            }
            rejectIfRefillWontHelp(resource, targets, results, consume);
        }
        slowAdmitAll(resource, targets, consume);
    }

    /**
     * Returns tokens taken by the admitted legs of a failed admission. A failed
     * compensation is logged and attached to {@code primary} when there is one,
     * otherwise thrown.
     */
    private void compensate(String resource, List<Target> admitted, Amounts consume, RuntimeException primary) {
        for (Target target : admitted) {
            Amounts amounts = target.select(consume);
            if (amounts.isEmpty()) continue;
            try {
                adjust(target.entityId(), resource, amounts.negated().toMilli());
            } catch (RuntimeException e) {
                log.atError()
                    .addKeyValue("entity_id", target.entityId())
                    .addKeyValue("resource", resource)
                    .addKeyValue("amounts", amounts)
                    .setCause(e)
                    .log("Failed to compensate admitted cascade leg");
                if (primary == null) throw e;
                primary.addSuppressed(e);
            }
        }
    }

    /** Applies a correction; a bucket that was deleted or expired meanwhile is left alone. */
    private void adjust(String entityId, String resource, Amounts deltasMilli) {
        try {
            buckets.write(buckets.buildAdjust(entityId, resource, deltasMilli));
        } catch (ConditionFailedException e) {
            log.atDebug()
                .addKeyValue("entity_id", entityId)
                .addKeyValue("resource", resource)
                .log("Bucket gone, correction dropped");
        }
    }

    private void rejectIfRefillWontHelp(String resource, List<Target> targets,
                                        List<CascadeExecutor.Leg<SpeculativeResult>> results, Amounts consume) {
        long now = clock.nowMillis();
        for (int i = 0; i < targets.size(); i++) {
            SpeculativeResult result = results.get(i).value();
            if (result.success() || !result.recordExists()) continue;
            Target target = targets.get(i);
            Amounts amounts = target.select(consume);
            CompositeBucket image = result.bucket();
            if (!sameDefinitions(image, target, amounts)) continue;
            TokenBucket.RefillCheck check = TokenBucket.wouldRefillSatisfy(image, amounts, now);
            if (!check.satisfiable()) {
                log.atDebug()
                    .addKeyValue("entity_id", target.entityId())
                    .addKeyValue("resource", resource)
                    .log("Rejected from speculative image");
                throw new RateLimitExceededException(check.statuses());
            }
        }
    }

    /** True when the image holds every requested limit under its current definition. */
    private static boolean sameDefinitions(CompositeBucket image, Target target, Amounts amounts) {
        for (String name : amounts.names()) {
            Optional<BucketState> stored = image.limit(name);
            if (stored.isEmpty() || !stored.get().toLimit().equals(target.limit(name).orElseThrow())) {
                return false;
            }
        }
        return true;
    }

    private void slowAdmitAll(String resource, List<Target> targets, Amounts consume) {
        Map<String, CompositeBucket> prefetched = prefetch(resource, targets);
        List<Target> done = new ArrayList<>(targets.size());
        try {
            for (Target target : targets) {
                slowAdmit(resource, target, target.select(consume),
                    Optional.ofNullable(prefetched.get(target.entityId())));
                done.add(target);
            }
        } catch (RuntimeException e) {
            compensate(resource, done, consume, e);
            throw e;
        }
    }

    /** First read of every target's bucket: one batch read for a cascade, one get otherwise. */
    private Map<String, CompositeBucket> prefetch(String resource, List<Target> targets) {
        if (targets.size() == 1) {
            Target only = targets.get(0);
            return buckets.getBucket(only.entityId(), resource)
                .map(bucket -> Map.of(only.entityId(), bucket))
                .orElse(Map.of());
        }
        List<String> entityIds = new ArrayList<>(targets.size());
        for (Target target : targets) {
            entityIds.add(target.entityId());
        }
        return buckets.batchGetBuckets(entityIds, resource);
    }

    /**
     * @param firstRead bucket as read before the first attempt; later attempts read again
     */
    private void slowAdmit(String resource, Target target, Amounts amounts, Optional<CompositeBucket> firstRead) {
        String entityId = target.entityId();
        for (int attempt = 0; attempt < config.maxRetries(); attempt++) {
            long now = clock.nowMillis();
            Optional<CompositeBucket> existing = attempt == 0 ? firstRead : buckets.getBucket(entityId, resource);
            if (existing.isEmpty()) {
                if (tryCreate(resource, target, amounts, now)) return;
                continue;
            }

            CompositeBucket bucket = existing.get();
            long expectedRf = bucket.lastRefillMs();
            List<BucketState> current = new ArrayList<>();
            List<BucketState> added = new ArrayList<>();
            List<LimitStatus> statuses = new ArrayList<>();
            Map<String, Long> consumed = new LinkedHashMap<>();
            Map<String, Long> refilled = new LinkedHashMap<>();
            boolean exceeded = false;

            for (Limit limit : target.limits()) {
                long requested = amounts.get(limit.name());
                Optional<BucketState> stored = bucket.limit(limit.name());
                if (stored.isPresent()) {
                    BucketState state = withDefinition(stored.get(), limit, expectedRf);
                    TokenBucket.ConsumeResult result = TokenBucket.tryConsume(state, requested, now);
                    consumed.put(limit.name(), requested * Limit.MILLI);
                    refilled.put(limit.name(), TokenBucket.refill(state, now).tokensMilli() - state.tokensMilli());
                    current.add(state);
                    exceeded |= addStatus(statuses, amounts, state, limit, result);
                } else {
                    BucketState fresh = BucketState.fromLimit(entityId, resource, limit, now);
                    TokenBucket.ConsumeResult result = TokenBucket.tryConsume(fresh, requested, now);
                    added.add(consumedState(fresh, result, requested));
                    exceeded |= addStatus(statuses, amounts, fresh, limit, result);
                }
            }
            if (exceeded) {
                throw new RateLimitExceededException(statuses);
            }

            Amounts consumedMilli = Amounts.copyOf(consumed);
            try {
                buckets.write(buckets.buildNormal(entityId, resource, consumedMilli, Amounts.copyOf(refilled),
                    current, added, now, expectedRf, updateTtl(target, now)));
                return;
            } catch (ConditionFailedException e) {
                Optional<CompositeBucket> old = e.oldImage().map(BucketCodec::decode);
                boolean lockLost = old.isPresent() && old.get().lastRefillMs() != expectedRf;
                if (lockLost && added.isEmpty() && hasDebit(consumedMilli) && tryRetry(resource, target, consumedMilli)) {
                    return;
                }
                log.debug("Optimistic lock lost on {}/{}, attempt {}", entityId, resource, attempt + 1);
            }
        }
        throw new StoreException("optimistic lock retries exhausted for " + entityId + "/" + resource);
    }

    private boolean tryCreate(String resource, Target target, Amounts amounts, long now) {
        List<BucketState> states = new ArrayList<>();
        List<LimitStatus> statuses = new ArrayList<>();
        boolean exceeded = false;
        for (Limit limit : target.limits()) {
            long requested = amounts.get(limit.name());
            BucketState fresh = BucketState.fromLimit(target.entityId(), resource, limit, now);
            TokenBucket.ConsumeResult result = TokenBucket.tryConsume(fresh, requested, now);
            states.add(consumedState(fresh, result, requested));
            exceeded |= addStatus(statuses, amounts, fresh, limit, result);
        }
        if (exceeded) {
            throw new RateLimitExceededException(statuses);
        }
        CompositeBucket bucket = new CompositeBucket(target.entityId(), resource, now, target.parentId(),
            target.cascade(), states);
        try {
            buckets.write(buckets.buildCreate(bucket, createTtl(target, now)));
            return true;
        } catch (ConditionFailedException e) {
            // Another writer created the record first.
            return false;
        }
    }

    private boolean tryRetry(String resource, Target target, Amounts consumedMilli) {
        try {
            buckets.write(buckets.buildRetry(target.entityId(), resource, consumedMilli));
            return true;
        } catch (ConditionFailedException e) {
            return false;
        }
    }

    private static boolean addStatus(List<LimitStatus> statuses, Amounts amounts, BucketState state, Limit limit,
                                  TokenBucket.ConsumeResult result) {
        if (!amounts.contains(limit.name())) return false;
        statuses.add(new LimitStatus(state.entityId(), state.resource(), limit.name(), limit, result.available(),
            amounts.get(limit.name()), !result.success(), result.retryAfterSeconds()));
        return !result.success();
    }

    private static boolean hasDebit(Amounts amounts) {
        for (long amount : amounts.asMap().values()) {
            if (amount > 0) return true;
        }
        return false;
    }

    /** Stored balance under the limit's current definition. */
    private static BucketState withDefinition(BucketState stored, Limit limit, long lastRefillMs) {
        return new BucketState(stored.entityId(), stored.resource(), limit.name(), stored.tokensMilli(), lastRefillMs,
            limit.capacityMilli(), limit.burstMilli(), limit.refillAmountMilli(), limit.refillPeriodMs(),
            stored.totalConsumedMilli());
    }

    private static BucketState consumedState(BucketState fresh, TokenBucket.ConsumeResult result, long requested) {
        return new BucketState(fresh.entityId(), fresh.resource(), fresh.limitName(), result.newTokensMilli(),
            fresh.lastRefillMs(), fresh.capacityMilli(), fresh.burstMilli(), fresh.refillAmountMilli(),
            fresh.refillPeriodMs(), requested * Limit.MILLI);
    }

    private static BucketState projected(Optional<CompositeBucket> bucket, String entityId, String resource,
                                         Limit limit, long now) {
        Optional<BucketState> stored = bucket.flatMap(b -> b.limit(limit.name()));
        if (stored.isEmpty()) {
            return BucketState.fromLimit(entityId, resource, limit, now);
        }
        return withDefinition(stored.get(), limit, bucket.get().lastRefillMs());
    }

    // Expiry

    private Long createTtl(Target target, long now) {
        if (!ttlEnabled(target)) return null;
        return ttlAt(target, now);
    }

    /** 0 removes an expiry left over from before the entity had custom limits. */
    private Long updateTtl(Target target, long now) {
        if (!ttlEnabled(target)) return 0L;
        return ttlAt(target, now);
    }

    private boolean ttlEnabled(Target target) {
        return config.bucketTtlMultiplier() > 0 && !target.hasCustomLimits();
    }

    private long ttlAt(Target target, long now) {
        return now / 1000L + (long) Math.ceil(target.maxTimeToFillSeconds() * config.bucketTtlMultiplier());
    }

    // Errors

    private <T> T control(String entityId, String resource, Supplier<T> action) {
        try {
            return action.get();
        } catch (StoreException e) {
            throw unavailable(e, entityId, resource);
        }
    }

    private RateLimiterUnavailableException unavailable(StoreException e, String entityId, String resource) {
        return new RateLimiterUnavailableException("Rate limiter store unavailable", e, namespace, entityId, resource);
    }

    private static double utilization(long capacity, long available) {
        if (capacity <= 0) return 0.0;
        return (capacity - available) * 100.0 / capacity;
    }

    public static final class Builder {
        private final ItemStore store;
        private String namespace = "default";
        private Clock clock = SystemClock.instance();
        private EngineConfig config = EngineConfig.defaults();
        private boolean registerNamespace = true;

        private Builder(ItemStore store) {
            if (store == null) {
                throw new IllegalArgumentException("store cannot be null");
            }
            this.store = store;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        public Builder config(EngineConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
            return this;
        }

        /**
         * When false, the namespace must already be registered and {@link #build()}
         * fails with {@link hrl.core.error.NamespaceNotFoundException} otherwise.
         */
        public Builder registerNamespace(boolean register) {
            this.registerNamespace = register;
            return this;
        }

        /**
         * @throws RateLimiterUnavailableException if the namespace registry cannot be reached
         */
        public RateLimiterEngine build() {
            Identifiers.namespace(namespace);
            NamespaceRegistry registry = new NamespaceRegistry(store);
            String id;
            try {
                id = registerNamespace ? registry.register(namespace) : registry.resolve(namespace);
            } catch (StoreException e) {
                throw new RateLimiterUnavailableException("Namespace registry unavailable", e, namespace, null, null);
            }
            log.atInfo()
                .addKeyValue("namespace", namespace)
                .addKeyValue("namespace_id", id)
                .addKeyValue("failure_mode", config.failureMode())
                .log("Rate limiter engine ready");
            return new RateLimiterEngine(this, id);
        }
    }
}
