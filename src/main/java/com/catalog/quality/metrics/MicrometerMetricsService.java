package com.catalog.quality.metrics;

import com.catalog.quality.core.model.SessionStatus;
import com.catalog.quality.duplicate.DetectionMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <ul>
 *   <li>{@code catalog.items.normalized}, {@code catalog.items.failed}: counters</li>
 *   <li>{@code catalog.batch.size}: distribution summary</li>
 *   <li>{@code catalog.sessions.ended}: counter tagged by status</li>
 *   <li>{@code catalog.duplicates.detected}: counter tagged by method</li>
 *   <li>{@code catalog.duplicates.merged}, {@code catalog.violations.detected},
 *       {@code catalog.violations.resolved}, {@code catalog.suggestions.generated},
 *       {@code catalog.suggestions.applied}: counters</li>
 *   <li>{@code catalog.aggregation.duration}: timer</li>
 *   <li>{@code catalog.aggregation.skipped}: counter</li>
 *   <li>{@code catalog.cache.hit}, {@code catalog.cache.miss}: counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> taggedCounters = new ConcurrentHashMap<>();
    private final Counter itemsNormalized;
    private final Counter itemsFailed;
    private final DistributionSummary batchSize;
    private final Counter groupsMerged;
    private final Counter violationsDetected;
    private final Counter violationsResolved;
    private final Counter suggestionsGenerated;
    private final Counter suggestionsApplied;
    private final Timer aggregationTimer;
    private final Counter databasesSkipped;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.itemsNormalized = counter("catalog.items.normalized", "Raw items written as normalized records");
        this.itemsFailed = counter("catalog.items.failed", "Raw items skipped after a normalization failure");
        this.batchSize = DistributionSummary.builder("catalog.batch.size")
                .description("Items per normalization batch")
                .register(registry);
        this.groupsMerged = counter("catalog.duplicates.merged", "Duplicate groups merged");
        this.violationsDetected = counter("catalog.violations.detected", "Violations created");
        this.violationsResolved = counter("catalog.violations.resolved", "Violations resolved");
        this.suggestionsGenerated = counter("catalog.suggestions.generated", "Suggestions created");
        this.suggestionsApplied = counter("catalog.suggestions.applied", "Suggestions applied");
        this.aggregationTimer = Timer.builder("catalog.aggregation.duration")
                .description("Project statistics aggregation time")
                .register(registry);
        this.databasesSkipped = counter("catalog.aggregation.skipped", "Databases skipped during aggregation");
        this.cacheHits = counter("catalog.cache.hit", "Project stats cache hits");
        this.cacheMisses = counter("catalog.cache.miss", "Project stats cache misses");
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    private Counter tagged(String name, String tagKey, String tagValue) {
        return taggedCounters.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name).tag(tagKey, tagValue).register(registry));
    }

    @Override
    public void recordItemsNormalized(int count) {
        itemsNormalized.increment(count);
    }

    @Override
    public void recordItemsFailed(int count) {
        itemsFailed.increment(count);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSize.record(size);
    }

    @Override
    public void recordSessionEnded(SessionStatus status) {
        tagged("catalog.sessions.ended", "status", status.wireName()).increment();
    }

    @Override
    public void recordGroupDetected(DetectionMethod method) {
        tagged("catalog.duplicates.detected", "method", method.wireName()).increment();
    }

    @Override
    public void incrementGroupsMerged() {
        groupsMerged.increment();
    }

    @Override
    public void recordViolationsDetected(int count) {
        violationsDetected.increment(count);
    }

    @Override
    public void incrementViolationsResolved() {
        violationsResolved.increment();
    }

    @Override
    public void recordSuggestionsGenerated(int count) {
        suggestionsGenerated.increment(count);
    }

    @Override
    public void incrementSuggestionsApplied() {
        suggestionsApplied.increment();
    }

    @Override
    public void recordAggregationDuration(Duration duration) {
        aggregationTimer.record(duration);
    }

    @Override
    public void incrementDatabasesSkipped() {
        databasesSkipped.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }
}
