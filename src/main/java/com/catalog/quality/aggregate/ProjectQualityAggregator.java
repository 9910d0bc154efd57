package com.catalog.quality.aggregate;

import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.error.UpstreamException;
import com.catalog.quality.logging.LogContext;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.store.CatalogDatabase;
import com.catalog.quality.store.CatalogDatabaseProvider;
import com.catalog.quality.store.ProjectDatabaseLookup;
import com.catalog.quality.tracing.Span;
import com.catalog.quality.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads the active databases of a project in parallel and combines their statistics.
 * A database that fails or misses the deadline is reported as skipped.
 *
 * <p>Each call reads at most {@link AggregatorConfig#concurrency()} databases at once. Reads
 * run on a growable pool, so a read that ignores the interrupt sent at the deadline holds on to
 * its own thread without delaying later calls.</p>
 */
public class ProjectQualityAggregator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProjectQualityAggregator.class);

    private final ProjectDatabaseLookup lookup;
    private final CatalogDatabaseProvider databases;
    private final AggregatorConfig config;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;
    private final ExecutorService executor;

    public ProjectQualityAggregator(ProjectDatabaseLookup lookup, CatalogDatabaseProvider databases,
                                    AggregatorConfig config, MetricsService metrics, TracingService tracing,
                                    Clock clock) {
        this.lookup = lookup;
        this.databases = databases;
        this.config = config;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "quality-aggregator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @throws com.catalog.quality.error.NotFoundException for an unknown project
     */
    public ProjectStats getProjectStats(String projectId) {
        List<TargetDatabase> targets = lookup.activeDatabases(projectId);
        long startNanos = System.nanoTime();
        try (LogContext ignored = LogContext.forAggregation(projectId);
             Span span = tracing.startSpan("quality.aggregation", Map.of("projectId", projectId))) {
            span.setAttribute("databases", targets.size());
            Semaphore permits = new Semaphore(config.concurrency());
            List<Future<DatabaseStats>> futures = targets.stream()
                    .map(target -> executor.submit(() -> readWithPermit(target, permits)))
                    .toList();
            Duration deadline = config.deadlineFor(targets.size());
            long deadlineNanos = System.nanoTime() + deadline.toNanos();

            List<DatabaseStats> included = new ArrayList<>();
            List<SkippedDatabase> skipped = new ArrayList<>();
            for (int i = 0; i < targets.size(); i++) {
                TargetDatabase target = targets.get(i);
                Future<DatabaseStats> future = futures.get(i);
                try {
                    included.add(future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    skipped.add(new SkippedDatabase(target.id(), target.filePath(), SkippedDatabase.TIMEOUT));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    skipped.add(new SkippedDatabase(target.id(), target.filePath(), reason(cause)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(true);
                    skipped.add(new SkippedDatabase(target.id(), target.filePath(), SkippedDatabase.INTERRUPTED));
                }
            }
            if (skipped.stream().anyMatch(s -> SkippedDatabase.TIMEOUT.equals(s.reason()))) {
                log.warn("aggregation.deadline.exceeded projectId={} deadlineMs={}", projectId, deadline.toMillis());
            }
            for (SkippedDatabase s : skipped) {
                metrics.incrementDatabasesSkipped();
                log.warn("aggregation.database.skipped projectId={} database={} reason={}",
                        projectId, s.path(), s.reason());
            }
            ProjectStats stats = ProjectStats.combine(projectId, targets.size(), included, skipped, clock.instant());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordAggregationDuration(elapsed);
            span.setAttribute("skipped", skipped.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("aggregation.completed projectId={} databases={} skipped={} totalItems={} durationMs={}",
                    projectId, targets.size(), skipped.size(), stats.totalItems(), elapsed.toMillis());
            return stats;
        }
    }

    /**
     * Statistics of one database.
     *
     * @throws UpstreamException if the database cannot be opened or read
     */
    public DatabaseStats getDatabaseStats(TargetDatabase target) {
        try {
            CatalogDatabase database = databases.open(target);
            return DatabaseStats.of(target, database.levelTallies());
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamException(target.filePath(), "Cannot read database: " + e.getMessage(), e);
        }
    }

    private DatabaseStats readWithPermit(TargetDatabase target, Semaphore permits) throws InterruptedException {
        permits.acquire();
        try {
            return getDatabaseStats(target);
        } finally {
            permits.release();
        }
    }

    private static String reason(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
