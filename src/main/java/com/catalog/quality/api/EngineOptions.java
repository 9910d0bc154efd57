package com.catalog.quality.api;

import com.catalog.quality.aggregate.AggregatorConfig;
import com.catalog.quality.cache.CacheConfig;
import com.catalog.quality.duplicate.DetectionThresholds;
import com.catalog.quality.lock.LockConfig;
import com.catalog.quality.normalization.WorkerPoolConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for a {@link QualityEngine}: worker pool, detection, aggregation, cache and locking.
 * When a session file is set, sessions are persisted to it as JSON.
 */
public class EngineOptions {

    private final WorkerPoolConfig workerPool;
    private final DetectionThresholds detection;
    private final AggregatorConfig aggregator;
    private final CacheConfig cache;
    private final LockConfig lock;
    private final Path sessionFile;

    private EngineOptions(Builder builder) {
        this.workerPool = builder.workerPool;
        this.detection = builder.detection;
        this.aggregator = builder.aggregator;
        this.cache = builder.cache;
        this.lock = builder.lock;
        this.sessionFile = builder.sessionFile;
    }

    public WorkerPoolConfig getWorkerPool() {
        return workerPool;
    }

    public DetectionThresholds getDetection() {
        return detection;
    }

    public AggregatorConfig getAggregator() {
        return aggregator;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public LockConfig getLock() {
        return lock;
    }

    public Path getSessionFile() {
        return sessionFile;
    }

    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private WorkerPoolConfig workerPool = WorkerPoolConfig.defaults();
        private DetectionThresholds detection = DetectionThresholds.defaults();
        private AggregatorConfig aggregator = AggregatorConfig.defaults();
        private CacheConfig cache = CacheConfig.defaults();
        private LockConfig lock = LockConfig.defaults();
        private Path sessionFile;

        public Builder workerPool(WorkerPoolConfig workerPool) {
            this.workerPool = workerPool;
            return this;
        }

        public Builder detection(DetectionThresholds detection) {
            this.detection = detection;
            return this;
        }

        public Builder aggregator(AggregatorConfig aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder cache(CacheConfig cache) {
            this.cache = cache;
            return this;
        }

        public Builder lock(LockConfig lock) {
            this.lock = lock;
            return this;
        }

        /**
         * Persists sessions to this JSON file so they survive a restart.
         */
        public Builder sessionFile(Path sessionFile) {
            this.sessionFile = sessionFile;
            return this;
        }

        public EngineOptions build() {
            Objects.requireNonNull(workerPool, "workerPool is required");
            Objects.requireNonNull(detection, "detection is required");
            Objects.requireNonNull(aggregator, "aggregator is required");
            Objects.requireNonNull(cache, "cache is required");
            Objects.requireNonNull(lock, "lock is required");
            return new EngineOptions(this);
        }
    }
}
