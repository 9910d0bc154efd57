package com.catalog.quality.metrics;

import com.catalog.quality.core.model.SessionStatus;
import com.catalog.quality.duplicate.DetectionMethod;

import java.time.Duration;

/**
 * Records engine metrics. {@link NoOpMetricsService} is the default.
 */
public interface MetricsService {

    void recordItemsNormalized(int count);

    void recordItemsFailed(int count);

    void recordBatchSize(int size);

    void recordSessionEnded(SessionStatus status);

    void recordGroupDetected(DetectionMethod method);

    void incrementGroupsMerged();

    void recordViolationsDetected(int count);

    void incrementViolationsResolved();

    void recordSuggestionsGenerated(int count);

    void incrementSuggestionsApplied();

    void recordAggregationDuration(Duration duration);

    void incrementDatabasesSkipped();

    void recordCacheHit();

    void recordCacheMiss();
}
