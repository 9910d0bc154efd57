package com.catalog.quality.cache;

import com.catalog.quality.aggregate.DatabaseStats;
import com.catalog.quality.aggregate.ProjectQualityAggregator;
import com.catalog.quality.aggregate.ProjectStats;
import com.catalog.quality.aggregate.SkippedDatabase;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.normalization.DatabaseChangeListener;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed cache of project statistics. Freshness is checked on read against the
 * {@link Ticker}; a stale entry is recomputed once and concurrent readers of the same project wait
 * for that computation. Readers of other projects never wait on it. Implements {@link DatabaseChangeListener} so entries covering a
 * changed database are dropped.
 */
public class QualityStatsCache implements DatabaseChangeListener {
    private static final Logger log = LoggerFactory.getLogger(QualityStatsCache.class);

    private final ProjectQualityAggregator aggregator;
    private final CacheConfig config;
    private final MetricsService metrics;
    private final Ticker ticker;
    private final Clock clock;
    private final long ttlNanos;
    private final Cache<String, Entry> cache;
    // Secondary index: database path -> projects whose cached stats cover it
    private final ConcurrentMap<String, Set<String>> databaseIndex = new ConcurrentHashMap<>();
    // one aggregation per project at a time, run outside the cache's own locks
    private final ConcurrentMap<String, CompletableFuture<Entry>> filling = new ConcurrentHashMap<>();
    private final AtomicLong invalidations = new AtomicLong();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public QualityStatsCache(ProjectQualityAggregator aggregator, CacheConfig config, MetricsService metrics) {
        this(aggregator, config, metrics, Ticker.systemTicker(), Clock.systemUTC());
    }

    public QualityStatsCache(ProjectQualityAggregator aggregator, CacheConfig config, MetricsService metrics,
                             Ticker ticker, Clock clock) {
        this.aggregator = aggregator;
        this.config = config;
        this.metrics = metrics;
        this.ticker = ticker;
        this.clock = clock;
        this.ttlNanos = TimeUnit.SECONDS.toNanos(config.ttlSeconds());
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String key, Entry value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        evictions.increment();
                    }
                    if (key != null && value != null) {
                        removeFromIndex(key, value.stats);
                    }
                })
                .build();
        log.info("QualityStatsCache initialized: enabled={}, maxSize={}, ttl={}s",
                config.enabled(), config.maxSize(), config.ttlSeconds());
    }

    /**
     * Project statistics, served from the cache while fresh.
     *
     * @throws com.catalog.quality.error.NotFoundException for an unknown project
     */
    public ProjectStats get(String projectId) {
        if (!config.enabled()) {
            return aggregator.getProjectStats(projectId);
        }
        Entry current = cache.getIfPresent(projectId);
        if (current != null && isFresh(current)) {
            return hit(current);
        }
        CompletableFuture<Entry> fill = new CompletableFuture<>();
        CompletableFuture<Entry> running = filling.putIfAbsent(projectId, fill);
        if (running != null) {
            return hit(await(running));
        }
        try {
            Entry latest = cache.getIfPresent(projectId);
            if (latest != null && isFresh(latest)) {
                fill.complete(latest);
                return hit(latest);
            }
            long generation = invalidations.get();
            Entry entry = new Entry(projectId, aggregator.getProjectStats(projectId), ticker.read(), clock.instant());
            cache.put(projectId, entry);
            index(entry);
            if (invalidations.get() != generation) {
                // invalidated while aggregating, the result may predate the change
                cache.asMap().remove(projectId, entry);
            }
            fill.complete(entry);
            misses.increment();
            metrics.recordCacheMiss();
            log.debug("cache.fill projectId={} totalItems={}", projectId, entry.stats.totalItems());
            return entry.stats;
        } catch (RuntimeException e) {
            fill.completeExceptionally(e);
            throw e;
        } finally {
            filling.remove(projectId, fill);
        }
    }

    private static Entry await(CompletableFuture<Entry> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    public Optional<ProjectQualityCacheEntry> entry(String projectId) {
        return Optional.ofNullable(cache.getIfPresent(projectId)).map(e -> e.view(config.ttlSeconds()));
    }

    public void invalidate(String projectId) {
        invalidations.incrementAndGet();
        cache.invalidate(projectId);
        log.debug("cache.invalidated projectId={}", projectId);
    }

    public void invalidateAll() {
        invalidations.incrementAndGet();
        cache.invalidateAll();
        databaseIndex.clear();
        log.debug("cache.invalidated.all");
    }

    @Override
    public void onDatabaseChanged(String databaseKey) {
        invalidations.incrementAndGet();
        Set<String> projects = databaseIndex.remove(databaseKey);
        if (projects != null) {
            projects.forEach(cache::invalidate);
            log.debug("cache.invalidated database={} projects={}", databaseKey, projects);
        }
    }

    public CacheStats stats() {
        if (!config.enabled()) {
            return CacheStats.disabled();
        }
        long total = 0;
        long valid = 0;
        for (Entry entry : cache.asMap().values()) {
            total++;
            if (isFresh(entry)) {
                valid++;
            }
        }
        return new CacheStats(true, total, valid, total - valid, config.ttlSeconds(),
                hits.sum(), misses.sum(), evictions.sum());
    }

    private ProjectStats hit(Entry entry) {
        entry.touch(clock.instant());
        hits.increment();
        metrics.recordCacheHit();
        return entry.stats;
    }

    private boolean isFresh(Entry entry) {
        return ticker.read() - entry.filledAtNanos <= ttlNanos;
    }

    private void index(Entry entry) {
        for (DatabaseStats db : entry.stats.databases()) {
            databaseIndex.computeIfAbsent(db.path(), k -> ConcurrentHashMap.newKeySet()).add(entry.projectId);
        }
        // a skipped database coming back must refresh the project too
        for (SkippedDatabase skipped : entry.stats.skipped()) {
            databaseIndex.computeIfAbsent(skipped.path(), k -> ConcurrentHashMap.newKeySet()).add(entry.projectId);
        }
    }

    private void removeFromIndex(String projectId, ProjectStats stats) {
        stats.databases().forEach(db -> unindex(db.path(), projectId));
        stats.skipped().forEach(skipped -> unindex(skipped.path(), projectId));
    }

    private void unindex(String databaseKey, String projectId) {
        Set<String> projects = databaseIndex.get(databaseKey);
        if (projects != null) {
            projects.remove(projectId);
        }
    }

    private static final class Entry {
        private final String projectId;
        private final ProjectStats stats;
        private final long filledAtNanos;
        private final Instant cachedAt;
        private final AtomicLong hitCount = new AtomicLong();
        private volatile Instant lastAccess;

        Entry(String projectId, ProjectStats stats, long filledAtNanos, Instant cachedAt) {
            this.projectId = projectId;
            this.stats = stats;
            this.filledAtNanos = filledAtNanos;
            this.cachedAt = cachedAt;
            this.lastAccess = cachedAt;
        }

        void touch(Instant now) {
            hitCount.incrementAndGet();
            lastAccess = now;
        }

        ProjectQualityCacheEntry view(int ttlSeconds) {
            return new ProjectQualityCacheEntry(projectId, cachedAt, lastAccess, hitCount.get(), ttlSeconds, stats);
        }
    }
}
