package com.catalog.quality.normalization;

/**
 * Sizing and timing of the normalization worker pool.
 *
 * @param batchSize                  raw items read and written per batch
 * @param concurrency                databases normalized at the same time; more sessions queue
 * @param sessionTimeoutSeconds      hard limit on one session's run time
 * @param heartbeatStalenessSeconds  a running session without progress for this long is failed
 * @param reaperIntervalSeconds      how often stale sessions are swept
 * @param analyzeAfterNormalization  run duplicate, violation and suggestion analysis after a completed pass
 */
public record WorkerPoolConfig(
        int batchSize,
        int concurrency,
        long sessionTimeoutSeconds,
        long heartbeatStalenessSeconds,
        long reaperIntervalSeconds,
        boolean analyzeAfterNormalization
) {
    public WorkerPoolConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (sessionTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("sessionTimeoutSeconds must be > 0");
        }
        if (heartbeatStalenessSeconds <= 0) {
            throw new IllegalArgumentException("heartbeatStalenessSeconds must be > 0");
        }
        if (reaperIntervalSeconds <= 0) {
            throw new IllegalArgumentException("reaperIntervalSeconds must be > 0");
        }
    }

    /**
     * Batches of 100, 4 workers, one hour timeout, 5 minute staleness, sweep every 30s, analysis on.
     */
    public static WorkerPoolConfig defaults() {
        return new WorkerPoolConfig(100, 4, 3600, 300, 30, true);
    }
}
