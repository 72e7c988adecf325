package hrl.java.engine;

import hrl.core.model.FailureMode;

import java.time.Duration;

/**
 * Engine-wide settings.
 *
 * @param failureMode outcome when the store is unavailable, unless a call or the
 *                    stored system defaults say otherwise
 * @param speculativeWrites try a single conditional debit before reading the bucket
 * @param maxRetries read-then-write attempts before giving up on lock contention
 * @param bucketTtlMultiplier bucket expiry in multiples of the slowest limit's
 *                            time-to-fill; {@code <= 0} keeps buckets forever
 * @param configCacheTtl how long resolved limit configuration is reused
 * @param configCacheSize maximum cached configuration keys
 * @param parallelMode how cascade legs are issued
 * @param parallelism pool size for {@link ParallelMode#POOL}
 */
public record EngineConfig(
    FailureMode failureMode,
    boolean speculativeWrites,
    int maxRetries,
    double bucketTtlMultiplier,
    Duration configCacheTtl,
    int configCacheSize,
    ParallelMode parallelMode,
    int parallelism
) {
    public EngineConfig {
        if (failureMode == null) throw new IllegalArgumentException("failureMode cannot be null");
        if (maxRetries <= 0) throw new IllegalArgumentException("maxRetries must be > 0");
        if (configCacheTtl == null || configCacheTtl.isNegative()) {
            throw new IllegalArgumentException("configCacheTtl must be >= 0");
        }
        if (configCacheSize <= 0) throw new IllegalArgumentException("configCacheSize must be > 0");
        if (parallelMode == null) throw new IllegalArgumentException("parallelMode cannot be null");
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0");
    }

    public static EngineConfig defaults() {
        return new EngineConfig(FailureMode.FAIL_CLOSED, true, 3, 7.0, Duration.ofSeconds(60), 10_000,
            ParallelMode.SERIAL, 2);
    }

    public EngineConfig withFailureMode(FailureMode mode) {
        return new EngineConfig(mode, speculativeWrites, maxRetries, bucketTtlMultiplier, configCacheTtl,
            configCacheSize, parallelMode, parallelism);
    }

    public EngineConfig withSpeculativeWrites(boolean enabled) {
        return new EngineConfig(failureMode, enabled, maxRetries, bucketTtlMultiplier, configCacheTtl,
            configCacheSize, parallelMode, parallelism);
    }

    public EngineConfig withMaxRetries(int retries) {
        return new EngineConfig(failureMode, speculativeWrites, retries, bucketTtlMultiplier, configCacheTtl,
            configCacheSize, parallelMode, parallelism);
    }

    public EngineConfig withBucketTtlMultiplier(double multiplier) {
        return new EngineConfig(failureMode, speculativeWrites, maxRetries, multiplier, configCacheTtl,
            configCacheSize, parallelMode, parallelism);
    }

    public EngineConfig withConfigCache(Duration ttl, int size) {
        return new EngineConfig(failureMode, speculativeWrites, maxRetries, bucketTtlMultiplier, ttl,
            size, parallelMode, parallelism);
    }

    public EngineConfig withParallelMode(ParallelMode mode, int threads) {
        return new EngineConfig(failureMode, speculativeWrites, maxRetries, bucketTtlMultiplier, configCacheTtl,
            configCacheSize, mode, threads);
    }
}
