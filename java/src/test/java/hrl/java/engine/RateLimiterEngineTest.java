package hrl.java.engine;

import hrl.core.clock.ManualClock;
import hrl.core.error.EntityExistsException;
import hrl.core.error.EntityNotFoundException;
import hrl.core.error.RateLimitExceededException;
import hrl.core.error.RateLimiterUnavailableException;
import hrl.core.error.ValidationException;
import hrl.core.model.Amounts;
import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;
import hrl.core.model.ConfigSource;
import hrl.core.model.FailureMode;
import hrl.core.model.Identifiers;
import hrl.core.model.Limit;
import hrl.core.model.LimitResolution;
import hrl.core.model.LimitStatus;
import hrl.core.model.ResourceCapacity;
import hrl.java.store.BucketCodec;
import hrl.java.store.BucketRepository;
import hrl.java.store.FailingItemStore;
import hrl.java.store.InMemoryItemStore;
import hrl.java.store.Item;
import hrl.java.store.ItemKey;
import hrl.java.store.Schema;
import hrl.java.store.StoreException;
import hrl.java.store.UpdateRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Functional tests for RateLimiterEngine over the in-memory store.
 *
 * Focus:
 * - Admit/reject and refill over time
 * - Cascade all-or-nothing admission
 * - Lease adjust, release and rollback
 * - Failure modes and optimistic-lock retries
 * - Stored limit resolution, bucket expiry, aggregate queries
 */
class RateLimiterEngineTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final String RESOURCE = "gpt-4";
    private static final Limit RPM_100 = Limit.perMinute("rpm", 100);

    private InMemoryItemStore store;
    private ManualClock clock;
    private RateLimiterEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryItemStore();
        clock = new ManualClock(T0);
        engine = RateLimiterEngine.builder(store).namespace("test").clock(clock).build();
    }

    private static AcquireRequest request(String entityId, Limit limit, long amount) {
        return AcquireRequest.builder(entityId, RESOURCE).limits(limit).consume(limit.name(), amount).build();
    }

    private void consume(String entityId, Limit limit, long amount) {
        engine.acquire(request(entityId, limit, amount)).commit();
    }

    private CompositeBucket bucket(String entityId) {
        return new BucketRepository(store, engine.namespaceId()).getBucket(entityId, RESOURCE).orElseThrow();
    }

    // Admission

    @Test
    void testAcquire_whenWithinLimit() {
        Lease lease = engine.acquire(request("user-1", RPM_100, 1));
        lease.commit();

        assertEquals(Amounts.of("rpm", 1), lease.consumed());
        assertFalse(lease.isNoop());
        assertEquals(99L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testAcquire_rejectsWhenDrained() {
        consume("user-1", RPM_100, 100);

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
            () -> engine.acquire(request("user-1", RPM_100, 1)));

        LimitStatus violation = e.primaryViolation();
        assertEquals("rpm", violation.limitName());
        assertEquals(0L, violation.available());
        assertEquals(1L, violation.requested());
        // 1 token at 100/min is 600 ms, plus 1 ms rounding
        assertEquals(0.601, e.retryAfterSeconds(), 1e-9);
    }

    @Test
    void testAcquire_drainLeavesZeroTokensInRecord() {
        consume("user-1", RPM_100, 100);
        assertEquals(0L, bucket("user-1").limit("rpm").orElseThrow().tokensMilli());
    }

    @Test
    void testAcquire_refillsAfterTime() {
        consume("user-1", RPM_100, 100);

        clock.advanceSeconds(30);
        consume("user-1", RPM_100, 50);

        assertThrows(RateLimitExceededException.class, () -> engine.acquire(request("user-1", RPM_100, 1)));
    }

    @Test
    void testAcquire_rejectsRequestLargerThanBurst() {
        assertThrows(RateLimitExceededException.class, () -> engine.acquire(request("user-1", RPM_100, 101)));
        assertEquals(100L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testAcquire_multipleLimitsAllOrNothing() {
        Limit tpm = Limit.perMinute("tpm", 1_000);
        AcquireRequest big = AcquireRequest.builder("user-1", RESOURCE)
            .limits(RPM_100, tpm)
            .consume(Amounts.of("rpm", 1, "tpm", 900))
            .build();
        engine.acquire(big).commit();

        AcquireRequest again = AcquireRequest.builder("user-1", RESOURCE)
            .limits(RPM_100, tpm)
            .consume(Amounts.of("rpm", 1, "tpm", 200))
            .build();
        RateLimitExceededException e = assertThrows(RateLimitExceededException.class, () -> engine.acquire(again));
        assertEquals("tpm", e.primaryViolation().limitName());

        // rpm was not debited by the rejected request
        Map<String, Long> available = engine.available("user-1", RESOURCE, List.of(RPM_100, tpm));
        assertEquals(99L, available.get("rpm"));
        assertEquals(100L, available.get("tpm"));
    }

    @Test
    void testAcquire_appliesChangedLimitDefinition() {
        Limit small = Limit.perMinute("rpm", 10);
        Limit large = Limit.perMinute("rpm", 20);
        consume("user-1", small, 10);

        clock.advanceSeconds(30);
        // Under the old definition only 5 tokens have refilled
        assertThrows(RateLimitExceededException.class, () -> engine.acquire(request("user-1", small, 8)));
        consume("user-1", large, 8);

        BucketState state = bucket("user-1").limit("rpm").orElseThrow();
        assertEquals(20_000L, state.capacityMilli());
        assertEquals(2_000L, state.tokensMilli());
    }

    @Test
    void testSpeculative_isMonotone() {
        consume("split", RPM_100, 30);
        consume("split", RPM_100, 20);
        consume("single", RPM_100, 50);

        BucketState split = bucket("split").limit("rpm").orElseThrow();
        BucketState single = bucket("single").limit("rpm").orElseThrow();
        assertEquals(single.tokensMilli(), split.tokensMilli());
        assertEquals(50_000L, split.totalConsumedMilli());
        assertEquals(single.totalConsumedMilli(), split.totalConsumedMilli());
    }

    @Test
    void testNamespaces_isolated() {
        consume("user-1", RPM_100, 100);

        RateLimiterEngine other = RateLimiterEngine.builder(store).namespace("other").clock(clock).build();
        assertNotEquals(engine.namespaceId(), other.namespaceId());
        assertEquals(100L, other.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    // Cascade

    @Test
    void testCascade_deniedWhenParentDrained() {
        engine.createEntity("org-1");
        engine.createEntity("team-1", "Team 1", "org-1", true, Map.of());
        engine.setLimits("org-1", RESOURCE, List.of(Limit.perMinute("rpm", 5)));
        engine.setLimits("team-1", RESOURCE, List.of(Limit.perMinute("rpm", 1_000)));

        Lease first = engine.acquire(AcquireRequest.builder("team-1", RESOURCE).consume("rpm", 5).build());
        first.commit();
        assertEquals(List.of("team-1", "org-1"), first.entityIds());
        assertEquals(0L, engine.available("org-1", RESOURCE).get("rpm"));

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
            () -> engine.acquire(AcquireRequest.builder("team-1", RESOURCE).consume("rpm", 1).build()));

        assertEquals("org-1", e.primaryViolation().entityId());
        // Neither bucket was debited by the denied request
        assertEquals(995L, engine.available("team-1", RESOURCE).get("rpm"));
        assertEquals(0L, engine.available("org-1", RESOURCE).get("rpm"));
    }

    @Test
    void testCascade_deniedWhenParentDrained_withoutSpeculativeWrites() {
        RateLimiterEngine slow = RateLimiterEngine.builder(store).namespace("slow").clock(clock)
            .config(EngineConfig.defaults().withSpeculativeWrites(false))
            .build();
        slow.createEntity("org-1");
        slow.createEntity("team-1", null, "org-1", true, Map.of());
        slow.setLimits("org-1", RESOURCE, List.of(Limit.perMinute("rpm", 5)));
        slow.setLimits("team-1", RESOURCE, List.of(Limit.perMinute("rpm", 1_000)));

        slow.acquire(AcquireRequest.builder("team-1", RESOURCE).consume("rpm", 5).build()).commit();
        assertThrows(RateLimitExceededException.class,
            () -> slow.acquire(AcquireRequest.builder("team-1", RESOURCE).consume("rpm", 1).build()));

        assertEquals(995L, slow.available("team-1", RESOURCE).get("rpm"));
    }

    @Test
    void testCascade_slowPathReadsBothBucketsInOneBatch() {
        FailingItemStore counting = new FailingItemStore(new InMemoryItemStore());
        RateLimiterEngine slow = RateLimiterEngine.builder(counting).clock(clock)
            .config(EngineConfig.defaults().withSpeculativeWrites(false))
            .build();
        slow.createEntity("org-1");
        slow.createEntity("team-1", null, "org-1", true, Map.of());

        slow.acquire(request("team-1", RPM_100, 10)).commit();
        assertEquals(1, counting.batchGets());
        slow.acquire(request("team-1", RPM_100, 10)).commit();
        assertEquals(2, counting.batchGets());

        assertEquals(80L, slow.available("team-1", RESOURCE, List.of(RPM_100)).get("rpm"));
        assertEquals(80L, slow.available("org-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testCascade_overrideDisablesParentDebit() {
        engine.createEntity("org-1");
        engine.createEntity("team-1", null, "org-1", true, Map.of());

        Lease lease = engine.acquire(AcquireRequest.builder("team-1", RESOURCE)
            .limits(RPM_100).consume("rpm", 10).cascade(false).build());
        lease.commit();

        assertEquals(List.of("team-1"), lease.entityIds());
        assertEquals(100L, engine.available("org-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testCascade_rollbackRestoresBoth() {
        engine.createEntity("org-1");
        engine.createEntity("team-1", null, "org-1", true, Map.of());

        try (Lease lease = engine.acquire(request("team-1", RPM_100, 10))) {
            assertEquals(Amounts.of("rpm", 10), lease.entityConsumed("org-1"));
            assertEquals(90L, engine.available("org-1", RESOURCE, List.of(RPM_100)).get("rpm"));
        }

        assertEquals(100L, engine.available("team-1", RESOURCE, List.of(RPM_100)).get("rpm"));
        assertEquals(100L, engine.available("org-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testCascade_pooledExecutor() {
        RateLimiterEngine pooled = RateLimiterEngine.builder(store).namespace("pooled").clock(clock)
            .config(EngineConfig.defaults().withParallelMode(ParallelMode.POOL, 2))
            .build();
        try {
            pooled.createEntity("org-1");
            pooled.createEntity("team-1", null, "org-1", true, Map.of());
            pooled.acquire(request("team-1", RPM_100, 40)).commit();
            pooled.acquire(request("team-1", RPM_100, 40)).commit();

            assertEquals(20L, pooled.available("org-1", RESOURCE, List.of(RPM_100)).get("rpm"));
        } finally {
            pooled.close();
        }
    }

    // Lease

    @Test
    void testLease_adjustRecordsNetConsumption() {
        Limit tpm = Limit.perMinute("tpm", 1_000);

        Lease lease = engine.acquire(request("user-1", tpm, 100));
        lease.adjust("tpm", 150);
        lease.commit();

        assertEquals(Amounts.of("tpm", 250), lease.consumed());
        assertEquals(750L, engine.available("user-1", RESOURCE, List.of(tpm)).get("tpm"));
    }

    @Test
    void testLease_adjustMayDriveBalanceNegative() {
        Limit small = Limit.perMinute("rpm", 10);

        Lease lease = engine.acquire(request("user-1", small, 10));
        lease.adjust("rpm", 5);
        lease.commit();

        assertEquals(-5_000L, bucket("user-1").limit("rpm").orElseThrow().tokensMilli());
        assertEquals(-5L, engine.available("user-1", RESOURCE, List.of(small)).get("rpm"));
    }

    @Test
    void testLease_releaseReturnsTokens() {
        Lease lease = engine.acquire(request("user-1", RPM_100, 30));
        lease.release("rpm", 10);
        lease.commit();

        assertEquals(Amounts.of("rpm", 20), lease.consumed());
        assertEquals(80L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testLease_consumeRechecksCapacity() {
        Limit small = Limit.perMinute("rpm", 10);
        Lease lease = engine.acquire(request("user-1", small, 5));

        lease.consume("rpm", 5);
        assertThrows(RateLimitExceededException.class, () -> lease.consume("rpm", 1));

        assertEquals(Amounts.of("rpm", 10), lease.consumed());
        lease.commit();
        assertEquals(0L, engine.available("user-1", RESOURCE, List.of(small)).get("rpm"));
    }

    @Test
    void testLease_rollbackRestoresBalance() {
        consume("user-1", RPM_100, 10);

        assertThrows(IllegalStateException.class, () -> {
            try (Lease lease = engine.acquire(request("user-1", RPM_100, 20))) {
                lease.adjust("rpm", 5);
                throw new IllegalStateException("downstream failed");
            }
        });

        assertEquals(90L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testExecute_commitsOnReturn() {
        String result = engine.execute(request("user-1", RPM_100, 10), lease -> "done");

        assertEquals("done", result);
        assertEquals(90L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testExecute_rollsBackOnCheckedException() {
        assertThrows(IOException.class, () -> engine.execute(request("user-1", RPM_100, 10), lease -> {
            throw new IOException("boom");
        }));

        assertEquals(100L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testLease_operationsAfterCommitFail() {
        Lease lease = engine.acquire(request("user-1", RPM_100, 1));
        lease.commit();

        assertFalse(lease.isOpen());
        assertThrows(IllegalStateException.class, () -> lease.adjust("rpm", 1));
        assertThrows(IllegalStateException.class, lease::rollback);
        // Closing a committed lease changes nothing
        lease.close();
        assertEquals(99L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testLease_rollbackAfterEntityDeleted_bucketStaysUsable() {
        engine.createEntity("user-1");
        Lease lease = engine.acquire(request("user-1", RPM_100, 10));

        engine.deleteEntity("user-1");
        lease.close();

        // The rollback found no bucket and wrote nothing
        assertTrue(store.get(Schema.bucketKey(engine.namespaceId(), "user-1", RESOURCE)).isEmpty());

        engine.createEntity("user-1");
        Lease next = engine.acquire(request("user-1", RPM_100, 50));
        next.commit();

        assertFalse(next.isNoop());
        assertEquals(50L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
        assertEquals(50_000L, bucket("user-1").limit("rpm").orElseThrow().totalConsumedMilli());
    }

    @Test
    void testLease_adjustAfterExpiry_isDropped() {
        Lease lease = engine.acquire(request("user-1", RPM_100, 10));
        store.expire(Long.MAX_VALUE);

        lease.adjust("rpm", 5);
        lease.commit();

        assertTrue(store.get(Schema.bucketKey(engine.namespaceId(), "user-1", RESOURCE)).isEmpty());
        assertEquals(100L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testAcquire_replacesRecordWithoutRefillTimestamp() {
        ItemKey key = Schema.bucketKey(engine.namespaceId(), "user-1", RESOURCE);
        store.write(UpdateRequest.builder(key)
            .add(BucketCodec.attr("rpm", BucketCodec.TOKENS), 10_000)
            .add(BucketCodec.attr("rpm", BucketCodec.CONSUMED), -10_000)
            .build());

        engine.acquire(request("user-1", RPM_100, 50)).commit();

        assertEquals(50L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
        Item item = store.get(key).orElseThrow();
        assertEquals(T0, item.getLong(BucketCodec.REFILL, 0L));
        assertEquals(50_000L, item.getLong(BucketCodec.attr("rpm", BucketCodec.CONSUMED), 0L));
    }

    @Test
    void testAcquire_replacesRecordWithoutRefillTimestamp_withoutSpeculativeWrites() {
        RateLimiterEngine slow = RateLimiterEngine.builder(store).namespace("slow").clock(clock)
            .config(EngineConfig.defaults().withSpeculativeWrites(false))
            .build();
        store.write(UpdateRequest.builder(Schema.bucketKey(slow.namespaceId(), "user-1", RESOURCE))
            .add(BucketCodec.attr("rpm", BucketCodec.TOKENS), 10_000)
            .build());

        slow.acquire(request("user-1", RPM_100, 30)).commit();

        assertEquals(70L, slow.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    // Failure modes

    @Test
    void testFailOpen_returnsNoopLease() {
        FailingItemStore failing = new FailingItemStore(new InMemoryItemStore());
        RateLimiterEngine e = RateLimiterEngine.builder(failing).clock(clock).build();
        failing.setFailing(true);

        Lease lease = e.acquire(AcquireRequest.builder("user-1", RESOURCE)
            .limits(RPM_100).consume("rpm", 1).failureMode(FailureMode.FAIL_OPEN).build());

        assertTrue(lease.isNoop());
        assertTrue(lease.consumed().isEmpty());
        lease.adjust("rpm", 5);
        assertTrue(lease.consumed().isEmpty());
        lease.close();
    }

    @Test
    void testFailClosed_raisesUnavailable() {
        FailingItemStore failing = new FailingItemStore(new InMemoryItemStore());
        RateLimiterEngine e = RateLimiterEngine.builder(failing).namespace("prod").clock(clock).build();
        failing.setFailing(true);

        RateLimiterUnavailableException ex = assertThrows(RateLimiterUnavailableException.class,
            () -> e.acquire(request("user-1", RPM_100, 1)));

        assertInstanceOf(StoreException.class, ex.getCause());
        assertEquals("prod", ex.namespace());
        assertEquals("user-1", ex.entityId());
        assertEquals(RESOURCE, ex.resource());
    }

    @Test
    void testFailureMode_storedSystemDefaultAppliesUnlessOverridden() {
        FailingItemStore failing = new FailingItemStore(new InMemoryItemStore());
        RateLimiterEngine e = RateLimiterEngine.builder(failing).clock(clock).build();
        e.setSystemDefaults(List.of(RPM_100), FailureMode.FAIL_OPEN);
        // Warm the configuration cache while the store is up
        e.acquire(AcquireRequest.builder("user-1", RESOURCE).consume("rpm", 1).build()).commit();

        failing.setFailing(true);
        Lease lease = e.acquire(AcquireRequest.builder("user-1", RESOURCE).consume("rpm", 1).build());
        assertTrue(lease.isNoop());

        assertThrows(RateLimiterUnavailableException.class, () -> e.acquire(AcquireRequest.builder("user-1", RESOURCE)
            .consume("rpm", 1).failureMode(FailureMode.FAIL_CLOSED).build()));
    }

    @Test
    void testLeaseConsume_duringOutageFollowsFailureMode() {
        FailingItemStore failing = new FailingItemStore(new InMemoryItemStore());
        RateLimiterEngine e = RateLimiterEngine.builder(failing).clock(clock).build();
        Lease lease = e.acquire(request("user-1", RPM_100, 1));

        failing.setFailing(true);
        assertThrows(RateLimiterUnavailableException.class, () -> lease.consume("rpm", 1));
        assertEquals(Amounts.of("rpm", 1), lease.consumed());
    }

    @Test
    void testControlPlane_outageRaisesUnavailable() {
        FailingItemStore failing = new FailingItemStore(new InMemoryItemStore());
        RateLimiterEngine e = RateLimiterEngine.builder(failing).clock(clock).build();
        failing.setFailing(true);

        assertThrows(RateLimiterUnavailableException.class, () -> e.createEntity("user-1"));
        assertThrows(RateLimiterUnavailableException.class, () -> e.available("user-1", RESOURCE, List.of(RPM_100)));
    }

    // Optimistic lock

    @Test
    void testLockContention_retriesWithoutRefill() {
        ContendedItemStore contended = new ContendedItemStore();
        RateLimiterEngine e = RateLimiterEngine.builder(contended).clock(clock)
            .config(EngineConfig.defaults().withSpeculativeWrites(false))
            .build();

        e.acquire(request("user-1", RPM_100, 1)).commit();
        e.acquire(request("user-1", RPM_100, 1)).commit();

        assertEquals(1, contended.lockedWrites());
        assertEquals(1, contended.retryWrites());
        CompositeBucket bucket = new BucketRepository(contended, e.namespaceId()).getBucket("user-1", RESOURCE)
            .orElseThrow();
        assertEquals(98_000L, bucket.limit("rpm").orElseThrow().tokensMilli());
        assertEquals(2_000L, bucket.limit("rpm").orElseThrow().totalConsumedMilli());
    }

    @Test
    void testLockContention_exhaustedRetriesAreUnavailable() {
        ContendedItemStore contended = new ContendedItemStore();
        RateLimiterEngine e = RateLimiterEngine.builder(contended).clock(clock)
            .config(EngineConfig.defaults().withSpeculativeWrites(false).withMaxRetries(3))
            .build();
        e.acquire(request("user-1", RPM_100, 1)).commit();
        contended.rejectRetries(true);

        assertThrows(RateLimiterUnavailableException.class, () -> e.acquire(request("user-1", RPM_100, 1)));
        assertEquals(3, contended.lockedWrites());

        Lease lease = e.acquire(AcquireRequest.builder("user-1", RESOURCE)
            .limits(RPM_100).consume("rpm", 1).failureMode(FailureMode.FAIL_OPEN).build());
        assertTrue(lease.isNoop());
    }

    // Stored limits

    @Test
    void testResolveLimits_followsHierarchy() {
        assertTrue(engine.resolveLimits("user-1", RESOURCE).isEmpty());

        engine.setSystemDefaults(List.of(Limit.perMinute("rpm", 10)), FailureMode.FAIL_OPEN);
        LimitResolution system = engine.resolveLimits("user-1", RESOURCE).orElseThrow();
        assertEquals(ConfigSource.SYSTEM, system.source());
        assertEquals(FailureMode.FAIL_OPEN, system.onUnavailable());

        engine.setResourceDefaults(RESOURCE, List.of(Limit.perMinute("rpm", 20)));
        assertEquals(ConfigSource.RESOURCE, engine.resolveLimits("user-1", RESOURCE).orElseThrow().source());

        engine.setLimits("user-1", Identifiers.DEFAULT_RESOURCE, List.of(Limit.perMinute("rpm", 30)));
        assertEquals(ConfigSource.ENTITY_DEFAULT, engine.resolveLimits("user-1", RESOURCE).orElseThrow().source());

        engine.setLimits("user-1", RESOURCE, List.of(Limit.perMinute("rpm", 40)));
        LimitResolution entity = engine.resolveLimits("user-1", RESOURCE).orElseThrow();
        assertEquals(ConfigSource.ENTITY, entity.source());
        assertEquals(40L, entity.limits().get(0).capacity());
        // Stored failure mode comes from the system level regardless of source
        assertEquals(FailureMode.FAIL_OPEN, entity.onUnavailable());

        engine.deleteLimits("user-1", RESOURCE);
        assertEquals(ConfigSource.ENTITY_DEFAULT, engine.resolveLimits("user-1", RESOURCE).orElseThrow().source());
    }

    @Test
    void testAcquire_usesStoredLimitsWhenNoneSupplied() {
        engine.setResourceDefaults(RESOURCE, List.of(Limit.perMinute("rpm", 3)));

        AcquireRequest one = AcquireRequest.builder("user-1", RESOURCE).consume("rpm", 1).build();
        assertTrue(one.useStoredLimits());
        engine.acquire(one).commit();
        engine.acquire(one).commit();
        engine.acquire(one).commit();

        assertThrows(RateLimitExceededException.class, () -> engine.acquire(one));
    }

    @Test
    void testAcquire_storedLimitsOverrideFallback() {
        engine.setLimits("user-1", RESOURCE, List.of(Limit.perMinute("rpm", 2)));
        AcquireRequest request = AcquireRequest.builder("user-1", RESOURCE)
            .limits(RPM_100).useStoredLimits(true).consume("rpm", 2).build();
        engine.acquire(request).commit();

        assertThrows(RateLimitExceededException.class, () -> engine.acquire(request));
        // Another entity without stored limits falls back to the supplied ones
        engine.acquire(AcquireRequest.builder("user-2", RESOURCE)
            .limits(RPM_100).useStoredLimits(true).consume("rpm", 50).build()).commit();
    }

    // Expiry

    @Test
    void testTtl_setFromSlowestLimit() {
        Limit rph = Limit.perHour("rph", 10);
        engine.acquire(AcquireRequest.builder("user-1", RESOURCE)
            .limits(RPM_100, rph).consume("rpm", 1).build()).commit();

        Item item = store.get(Schema.bucketKey(engine.namespaceId(), "user-1", RESOURCE)).orElseThrow();
        // 3600 s to fill rph, times the default multiplier of 7
        assertEquals(T0 / 1000 + 3600 * 7, item.getLong("ttl", 0L));
    }

    @Test
    void testTtl_absentForCustomEntityLimits() {
        engine.setLimits("user-1", RESOURCE, List.of(RPM_100));
        engine.acquire(AcquireRequest.builder("user-1", RESOURCE).consume("rpm", 1).build()).commit();

        Item item = store.get(Schema.bucketKey(engine.namespaceId(), "user-1", RESOURCE)).orElseThrow();
        assertFalse(item.has("ttl"));
    }

    @Test
    void testTtl_disabledByMultiplier() {
        RateLimiterEngine permanent = RateLimiterEngine.builder(store).namespace("perm").clock(clock)
            .config(EngineConfig.defaults().withBucketTtlMultiplier(0))
            .build();
        permanent.acquire(request("user-1", RPM_100, 1)).commit();

        Item item = store.get(Schema.bucketKey(permanent.namespaceId(), "user-1", RESOURCE)).orElseThrow();
        assertFalse(item.has("ttl"));
    }

    // Queries

    @Test
    void testTimeUntilAvailable_whenDrained() {
        consume("user-1", RPM_100, 100);

        double wait = engine.timeUntilAvailable("user-1", RESOURCE, Amounts.of("rpm", 10), List.of(RPM_100));
        assertEquals(6.001, wait, 1e-9);
        assertEquals(0.0, engine.timeUntilAvailable("user-2", RESOURCE, Amounts.of("rpm", 10), List.of(RPM_100)));
    }

    @Test
    void testResourceCapacity_sumsAcrossEntities() {
        consume("user-1", RPM_100, 10);
        consume("user-2", RPM_100, 30);

        ResourceCapacity capacity = engine.getResourceCapacity(RESOURCE, "rpm", false);

        assertEquals(200L, capacity.totalCapacity());
        assertEquals(160L, capacity.totalAvailable());
        assertEquals(20.0, capacity.utilizationPct(), 1e-9);
        assertEquals(2, capacity.entities().size());
    }

    @Test
    void testResourceCapacity_parentsOnly() {
        engine.createEntity("org-1");
        engine.createEntity("team-1", null, "org-1", false, Map.of());
        consume("org-1", RPM_100, 5);
        consume("team-1", RPM_100, 10);

        ResourceCapacity capacity = engine.getResourceCapacity(RESOURCE, "rpm", true);

        assertEquals(1, capacity.entities().size());
        assertEquals("org-1", capacity.entities().get(0).entityId());
        assertEquals(95L, capacity.totalAvailable());
    }

    // Entities and validation

    @Test
    void testEntities_lifecycle() {
        engine.createEntity("org-1", "Acme", null, false, Map.of("tier", "gold"));
        engine.createEntity("team-1", null, "org-1", true, Map.of());

        assertThrows(EntityExistsException.class, () -> engine.createEntity("org-1"));
        assertThrows(EntityNotFoundException.class,
            () -> engine.createEntity("team-2", null, "missing", false, Map.of()));
        assertEquals("gold", engine.getEntity("org-1").orElseThrow().metadata().get("tier"));
        assertEquals(1, engine.getChildren("org-1").size());

        consume("team-1", RPM_100, 100);
        engine.deleteEntity("team-1");

        assertEquals(Optional.empty(), engine.getEntity("team-1"));
        assertEquals(100L, engine.available("team-1", RESOURCE, List.of(RPM_100)).get("rpm"));
        assertThrows(EntityNotFoundException.class, () -> engine.deleteEntity("team-1"));
    }

    @Test
    void testValidation_rejectedBeforeStore() {
        assertThrows(ValidationException.class,
            () -> AcquireRequest.builder("bad#id", RESOURCE).limits(RPM_100).build());
        assertThrows(ValidationException.class,
            () -> AcquireRequest.builder("user-1", "9bad").limits(RPM_100).build());
        assertThrows(ValidationException.class,
            () -> AcquireRequest.builder("user-1", RESOURCE).limits(RPM_100).consume("rpm", -1).build());
        assertThrows(ValidationException.class,
            () -> AcquireRequest.builder("user-1", RESOURCE).limits(RPM_100, Limit.perHour("rpm", 5)).build());
    }

    @Test
    void testValidation_unknownLimitOrNoLimits() {
        assertThrows(ValidationException.class, () -> engine.acquire(AcquireRequest.builder("user-1", RESOURCE)
            .limits(RPM_100).consume("tpm", 1).build()));
        assertThrows(ValidationException.class, () -> engine.acquire(AcquireRequest.builder("user-1", RESOURCE)
            .consume("rpm", 1).build()));
    }
}
