package com.catalog.quality.cdi;

import com.catalog.quality.aggregate.AggregatorConfig;
import com.catalog.quality.api.EngineOptions;
import com.catalog.quality.api.QualityEngine;
import com.catalog.quality.cache.CacheConfig;
import com.catalog.quality.duplicate.DetectionThresholds;
import com.catalog.quality.lock.LockConfig;
import com.catalog.quality.metrics.MicrometerMetricsService;
import com.catalog.quality.normalization.WorkerPoolConfig;
import com.catalog.quality.store.InMemoryCatalogDatabaseProvider;
import com.catalog.quality.store.InMemoryProjectDatabaseLookup;
import com.catalog.quality.store.ProjectDatabaseLookup;
import com.catalog.quality.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the quality engine from MicroProfile Config properties.
 *
 * <p>The project administration module supplies a {@link ProjectDatabaseLookup} bean. Target
 * databases are FalkorDB graphs when {@code catalog-quality.falkordb.enabled} is set, otherwise
 * an embedded in-memory store is used.</p>
 *
 * <pre>
 * catalog-quality.falkordb.enabled=true
 * catalog-quality.falkordb.host=localhost
 * catalog-quality.falkordb.port=6379
 * catalog-quality.workers.concurrency=4
 * </pre>
 */
@ApplicationScoped
public class QualityEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(QualityEngineProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-quality.falkordb.enabled", defaultValue = "false")
    boolean falkordbEnabled;

    @Inject
    @ConfigProperty(name = "catalog-quality.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "catalog-quality.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    // ── Workers and sessions ──────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-quality.workers.batch-size", defaultValue = "100")
    int batchSize;

    @Inject
    @ConfigProperty(name = "catalog-quality.workers.concurrency", defaultValue = "4")
    int workerConcurrency;

    @Inject
    @ConfigProperty(name = "catalog-quality.sessions.timeout-seconds", defaultValue = "3600")
    long sessionTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "catalog-quality.sessions.heartbeat-staleness-seconds", defaultValue = "300")
    long heartbeatStalenessSeconds;

    @Inject
    @ConfigProperty(name = "catalog-quality.sessions.reaper-interval-seconds", defaultValue = "30")
    long reaperIntervalSeconds;

    @Inject
    @ConfigProperty(name = "catalog-quality.sessions.file")
    Optional<String> sessionFile;

    @Inject
    @ConfigProperty(name = "catalog-quality.analysis.after-normalization", defaultValue = "true")
    boolean analyzeAfterNormalization;

    // ── Duplicate detection ───────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-quality.detection.semantic-threshold", defaultValue = "0.92")
    double semanticThreshold;

    @Inject
    @ConfigProperty(name = "catalog-quality.detection.word-based-threshold", defaultValue = "0.7")
    double wordBasedThreshold;

    @Inject
    @ConfigProperty(name = "catalog-quality.detection.max-block-size", defaultValue = "1000")
    int maxBlockSize;

    // ── Aggregation ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-quality.aggregator.concurrency", defaultValue = "5")
    int aggregatorConcurrency;

    @Inject
    @ConfigProperty(name = "catalog-quality.aggregator.base-deadline-seconds", defaultValue = "30")
    long baseDeadlineSeconds;

    @Inject
    @ConfigProperty(name = "catalog-quality.aggregator.per-database-seconds", defaultValue = "5")
    long perDatabaseSeconds;

    @Inject
    @ConfigProperty(name = "catalog-quality.aggregator.max-deadline-seconds", defaultValue = "120")
    long maxDeadlineSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-quality.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "catalog-quality.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "catalog-quality.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    // ── Locking and observability ─────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-quality.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "catalog-quality.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<ProjectDatabaseLookup> projectLookups;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public QualityEngine qualityEngine() {
        EngineOptions options = engineOptions();
        QualityEngine.Builder builder = QualityEngine.builder()
                .options(options)
                .projectLookup(projectLookup());

        if (falkordbEnabled) {
            log.info("Producing QualityEngine: falkordb={}:{}", falkordbHost, falkordbPort);
            builder.falkorDB(falkordbHost, falkordbPort);
        } else {
            log.info("Producing QualityEngine: embedded in-memory catalog databases");
            builder.catalogDatabases(new InMemoryCatalogDatabaseProvider());
        }
        if (meterRegistries.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistries.get()));
        }
        if (tracingEnabled) {
            builder.tracingService(new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer("catalog-quality")));
        }
        return builder.build();
    }

    public void closeEngine(@Disposes QualityEngine engine) {
        log.info("Closing QualityEngine");
        engine.close();
    }

    EngineOptions engineOptions() {
        return EngineOptions.builder()
                .workerPool(new WorkerPoolConfig(batchSize, workerConcurrency, sessionTimeoutSeconds,
                        heartbeatStalenessSeconds, reaperIntervalSeconds, analyzeAfterNormalization))
                .detection(new DetectionThresholds(semanticThreshold, wordBasedThreshold, maxBlockSize))
                .aggregator(new AggregatorConfig(aggregatorConcurrency, Duration.ofSeconds(baseDeadlineSeconds),
                        Duration.ofSeconds(perDatabaseSeconds), Duration.ofSeconds(maxDeadlineSeconds)))
                .cache(cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled())
                .lock(new LockConfig(lockTimeoutMs))
                .sessionFile(sessionFile.filter(f -> !f.isBlank()).map(Path::of).orElse(null))
                .build();
    }

    private ProjectDatabaseLookup projectLookup() {
        if (projectLookups.isResolvable()) {
            return projectLookups.get();
        }
        log.warn("No ProjectDatabaseLookup bean found; every project will be reported as unknown");
        return new InMemoryProjectDatabaseLookup();
    }
}
