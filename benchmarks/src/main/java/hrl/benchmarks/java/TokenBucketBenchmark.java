package hrl.benchmarks.java;

import hrl.core.bucket.TokenBucket;
import hrl.core.model.Amounts;
import hrl.core.model.BucketState;
import hrl.core.model.CompositeBucket;
import hrl.core.model.Limit;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for the pure bucket math.
 *
 * Scenarios:
 * - allow: consume from a full bucket
 * - reject: consume from an empty bucket (includes retry-after computation)
 * - refill: refill after a partial period
 * - fastRejectCheck: refill projection over a three-limit composite bucket
 *
 * Run (org.openjdk.jmh.Main on the module classpath):
 *   org.openjdk.jmh.Main TokenBucket
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class TokenBucketBenchmark {

    private static final long T0 = 1_700_000_000_000L;

    private BucketState full;
    private BucketState empty;
    private CompositeBucket composite;
    private Amounts consume;
    private long now;

    @Setup
    public void setup() {
        Limit rpm = Limit.perMinute("rpm", 1_000);
        full = BucketState.fromLimit("user-1", "gpt-4", rpm, T0);
        empty = full.withTokens(0, T0);
        composite = new CompositeBucket("user-1", "gpt-4", T0, null, false, List.of(
            empty,
            BucketState.fromLimit("user-1", "gpt-4", Limit.perMinute("tpm", 100_000), T0),
            BucketState.fromLimit("user-1", "gpt-4", Limit.perDay("rpd", 10_000), T0)));
        consume = Amounts.of("rpm", 1, "tpm", 500);
        now = T0 + 1_234;
    }

    @Benchmark
    public void allow(Blackhole bh) {
        bh.consume(TokenBucket.tryConsume(full, 1, now));
    }

    @Benchmark
    public void reject(Blackhole bh) {
        bh.consume(TokenBucket.tryConsume(empty, 1, T0));
    }

    @Benchmark
    public void refill(Blackhole bh) {
        bh.consume(TokenBucket.refill(empty, now));
    }

    @Benchmark
    public void fastRejectCheck(Blackhole bh) {
        bh.consume(TokenBucket.wouldRefillSatisfy(composite, consume, now));
    }
}
