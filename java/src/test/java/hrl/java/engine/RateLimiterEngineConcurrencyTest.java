package hrl.java.engine;

import hrl.core.clock.ManualClock;
import hrl.core.error.RateLimitExceededException;
import hrl.core.model.Amounts;
import hrl.core.model.FailureMode;
import hrl.core.model.Limit;
import hrl.java.store.InMemoryItemStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for RateLimiterEngine.
 *
 * Focus:
 * - No over-admission when many callers race on one bucket
 * - Cascade admission stays exact under contention on the parent
 * - Lease rollbacks commute with concurrent debits
 * - An interrupted cascade caller keeps every leg accounted for
 *
 * The clock is frozen so refill never changes the expected counts.
 */
class RateLimiterEngineConcurrencyTest {

    private static final String RESOURCE = "gpt-4";
    private static final Limit RPM_100 = Limit.perMinute("rpm", 100);

    private interface Task {
        void run() throws Exception;
    }

    private static void runConcurrently(int threads, Task task) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    task.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");
    }

    @Test
    void testConcurrent_sameBucketNeverOverAdmits() throws InterruptedException {
        RateLimiterEngine engine = RateLimiterEngine.builder(new InMemoryItemStore())
            .clock(new ManualClock(0L)).build();
        AtomicInteger allowed = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        runConcurrently(20, () -> {
            try {
                engine.acquire(AcquireRequest.builder("user-1", RESOURCE)
                    .limits(RPM_100).consume("rpm", 10).build()).commit();
                allowed.incrementAndGet();
            } catch (RateLimitExceededException e) {
                rejected.incrementAndGet();
            }
        });

        // 100 capacity / 10 per request
        assertEquals(10, allowed.get());
        assertEquals(10, rejected.get());
        assertEquals(0L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testConcurrent_sameBucketWithoutSpeculativeWrites() throws InterruptedException {
        RateLimiterEngine engine = RateLimiterEngine.builder(new InMemoryItemStore())
            .clock(new ManualClock(0L))
            .config(EngineConfig.defaults().withSpeculativeWrites(false).withMaxRetries(5))
            .build();
        AtomicInteger allowed = new AtomicInteger();

        runConcurrently(20, () -> {
            try {
                engine.acquire(AcquireRequest.builder("user-1", RESOURCE)
                    .limits(RPM_100).consume("rpm", 10).build()).commit();
                allowed.incrementAndGet();
            } catch (RateLimitExceededException e) {
                // expected once drained
            }
        });

        assertEquals(10, allowed.get());
        assertEquals(0L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }

    @Test
    void testConcurrent_cascadeParentIsExact() throws InterruptedException {
        RateLimiterEngine engine = RateLimiterEngine.builder(new InMemoryItemStore())
            .clock(new ManualClock(0L))
            .config(EngineConfig.defaults().withParallelMode(ParallelMode.POOL, 4))
            .build();
        engine.createEntity("org-1");
        engine.createEntity("team-a", null, "org-1", true, Map.of());
        engine.createEntity("team-b", null, "org-1", true, Map.of());
        engine.setLimits("org-1", RESOURCE, List.of(Limit.perMinute("rpm", 50)));
        engine.setLimits("team-a", RESOURCE, List.of(RPM_100));
        engine.setLimits("team-b", RESOURCE, List.of(RPM_100));
        // Create every bucket up front so no request takes the create path mid-race
        engine.acquire(AcquireRequest.builder("team-a", RESOURCE).consume("rpm", 0).build()).commit();
        engine.acquire(AcquireRequest.builder("team-b", RESOURCE).consume("rpm", 0).build()).commit();

        AtomicInteger next = new AtomicInteger();
        AtomicInteger allowed = new AtomicInteger();
        runConcurrently(20, () -> {
            String team = next.getAndIncrement() % 2 == 0 ? "team-a" : "team-b";
            try {
                engine.acquire(AcquireRequest.builder(team, RESOURCE).consume("rpm", 5).build()).commit();
                allowed.incrementAndGet();
            } catch (RateLimitExceededException e) {
                // parent drained
            }
        });
        engine.close();

        assertEquals(10, allowed.get());
        assertEquals(0L, engine.available("org-1", RESOURCE).get("rpm"));
        long teams = engine.available("team-a", RESOURCE).get("rpm") + engine.available("team-b", RESOURCE).get("rpm");
        assertEquals(150L, teams);
    }

    @Test
    void testCascade_interruptedCallerLeaksNoTokens() {
        RateLimiterEngine engine = RateLimiterEngine.builder(new InMemoryItemStore())
            .clock(new ManualClock(0L))
            .config(EngineConfig.defaults()
                .withParallelMode(ParallelMode.POOL, 2)
                .withFailureMode(FailureMode.FAIL_OPEN))
            .build();
        engine.createEntity("org-1");
        engine.createEntity("team-1", null, "org-1", true, Map.of());
        // Both buckets exist, so the next request takes the pooled speculative path
        engine.acquire(AcquireRequest.builder("team-1", RESOURCE).limits(RPM_100).consume("rpm", 1).build()).commit();

        Lease lease;
        Thread.currentThread().interrupt();
        try {
            lease = engine.acquire(AcquireRequest.builder("team-1", RESOURCE)
                .limits(RPM_100).consume("rpm", 30).build());
            lease.commit();
            assertTrue(Thread.interrupted(), "interrupt flag should be restored");
        } finally {
            Thread.interrupted();
        }

        long child = engine.available("team-1", RESOURCE, List.of(RPM_100)).get("rpm");
        long parent = engine.available("org-1", RESOURCE, List.of(RPM_100)).get("rpm");
        engine.close();

        assertFalse(lease.isNoop());
        assertEquals(Amounts.of("rpm", 30), lease.consumed());
        assertEquals(69L, child);
        assertEquals(69L, parent);
    }

    @Test
    void testConcurrent_rollbacksRestoreBalance() throws InterruptedException {
        RateLimiterEngine engine = RateLimiterEngine.builder(new InMemoryItemStore())
            .clock(new ManualClock(0L)).build();
        engine.acquire(AcquireRequest.builder("user-1", RESOURCE).limits(RPM_100).consume("rpm", 0).build()).commit();

        runConcurrently(10, () -> {
            Lease lease = engine.acquire(AcquireRequest.builder("user-1", RESOURCE)
                .limits(RPM_100).consume("rpm", 5).build());
            lease.adjust("rpm", 3);
            lease.rollback();
        });

        assertEquals(100L, engine.available("user-1", RESOURCE, List.of(RPM_100)).get("rpm"));
    }
}
