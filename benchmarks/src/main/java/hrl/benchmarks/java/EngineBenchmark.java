package hrl.benchmarks.java;

import hrl.core.error.RateLimitExceededException;
import hrl.core.model.Limit;
import hrl.java.engine.AcquireRequest;
import hrl.java.engine.EngineConfig;
import hrl.java.engine.RateLimiterEngine;
import hrl.java.store.InMemoryItemStore;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for RateLimiterEngine over the in-memory store.
 *
 * Scenarios:
 * - singleEntity: every acquire hits the same bucket (lock contention)
 * - multiEntity: rotating through 1000 entities
 * - parallel: 8 threads on one bucket
 * - readThenWrite: speculative writes disabled
 *
 * Run (org.openjdk.jmh.Main on the module classpath):
 *   org.openjdk.jmh.Main Engine
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class EngineBenchmark {

    private static final Limit UNBOUNDED = Limit.perSecond("rps", 1_000_000_000L);

    private RateLimiterEngine engine;
    private RateLimiterEngine readThenWriteEngine;
    private AcquireRequest hot;

    @Setup
    public void setup() {
        engine = RateLimiterEngine.builder(new InMemoryItemStore()).namespace("bench").build();
        readThenWriteEngine = RateLimiterEngine.builder(new InMemoryItemStore())
            .namespace("bench")
            .config(EngineConfig.defaults().withSpeculativeWrites(false))
            .build();
        hot = request("user-1");
    }

    @TearDown
    public void tearDown() {
        engine.close();
        readThenWriteEngine.close();
    }

    private static AcquireRequest request(String entityId) {
        return AcquireRequest.builder(entityId, "gpt-4").limits(UNBOUNDED).consume("rps", 1).build();
    }

    /** Rejections still count as an operation. */
    private static boolean acquire(RateLimiterEngine engine, AcquireRequest request) {
        try {
            engine.acquire(request).commit();
            return true;
        } catch (RateLimitExceededException e) {
            return false;
        }
    }

    @Benchmark
    public boolean singleEntity() {
        return acquire(engine, hot);
    }

    @Benchmark
    public boolean multiEntity() {
        return acquire(engine, request("user-" + ThreadLocalRandom.current().nextInt(1000)));
    }

    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return acquire(engine, hot);
    }

    @Benchmark
    public boolean readThenWrite() {
        return acquire(readThenWriteEngine, hot);
    }
}
