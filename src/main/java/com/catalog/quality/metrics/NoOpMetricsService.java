package com.catalog.quality.metrics;

import com.catalog.quality.core.model.SessionStatus;
import com.catalog.quality.duplicate.DetectionMethod;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordItemsNormalized(int count) {
    }

    @Override
    public void recordItemsFailed(int count) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordSessionEnded(SessionStatus status) {
    }

    @Override
    public void recordGroupDetected(DetectionMethod method) {
    }

    @Override
    public void incrementGroupsMerged() {
    }

    @Override
    public void recordViolationsDetected(int count) {
    }

    @Override
    public void incrementViolationsResolved() {
    }

    @Override
    public void recordSuggestionsGenerated(int count) {
    }

    @Override
    public void incrementSuggestionsApplied() {
    }

    @Override
    public void recordAggregationDuration(Duration duration) {
    }

    @Override
    public void incrementDatabasesSkipped() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
