package com.catalog.quality.cache;

import com.catalog.quality.aggregate.DatabaseStats;
import com.catalog.quality.aggregate.ProjectQualityAggregator;
import com.catalog.quality.aggregate.ProjectStats;
import com.catalog.quality.aggregate.SkippedDatabase;
import com.catalog.quality.core.model.LevelTally;
import com.catalog.quality.core.model.ProcessingLevel;
import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class QualityStatsCacheTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");

    @Mock
    private ProjectQualityAggregator aggregator;

    private FakeTicker ticker;
    private QualityStatsCache cache;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        when(aggregator.getProjectStats(anyString())).thenAnswer(invocation -> stats(invocation.getArgument(0)));
        cache = new QualityStatsCache(aggregator, new CacheConfig(100, 300, true), new NoOpMetricsService(),
                ticker, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ProjectStats stats(String projectId) {
        DatabaseStats a = DatabaseStats.of(new TargetDatabase(1, "A", "/data/a.db", true),
                Map.of(ProcessingLevel.BASIC, new LevelTally(ProcessingLevel.BASIC, 10, 5.0)));
        return ProjectStats.combine(projectId, 2, List.of(a),
                List.of(new SkippedDatabase(2, "/data/b.db", "Database not reachable")), NOW);
    }

    @Nested
    @DisplayName("Freshness")
    class FreshnessTests {

        @Test
        @DisplayName("Should serve hits within the ttl and count them")
        void testHits() {
            ProjectStats first = cache.get("p1");
            ticker.advance(100);
            ProjectStats second = cache.get("p1");
            ticker.advance(100);
            cache.get("p1");

            assertSame(first, second);
            verify(aggregator, times(1)).getProjectStats("p1");
            ProjectQualityCacheEntry entry = cache.entry("p1").orElseThrow();
            assertEquals(2, entry.hitCount());
            assertEquals(300, entry.ttlSeconds());
            assertEquals(10, entry.payload().totalItems());
        }

        @Test
        @DisplayName("Should recompute once after expiry and restart the ttl")
        void testExpiry() {
            ProjectStats first = cache.get("p1");
            ticker.advance(301);

            ProjectStats refreshed = cache.get("p1");
            ProjectStats again = cache.get("p1");

            assertNotSame(first, refreshed);
            assertSame(refreshed, again);
            verify(aggregator, times(2)).getProjectStats("p1");
            assertEquals(1, cache.entry("p1").orElseThrow().hitCount());

            ticker.advance(299);
            cache.get("p1");
            verify(aggregator, times(2)).getProjectStats("p1");
        }

        @Test
        @DisplayName("Should keep projects apart")
        void testPerProject() {
            cache.get("p1");
            cache.get("p2");

            verify(aggregator).getProjectStats("p1");
            verify(aggregator).getProjectStats("p2");
            assertEquals(2, cache.stats().totalEntries());
        }

        @Test
        @DisplayName("Should not cache a failed computation")
        void testFailureNotCached() {
            when(aggregator.getProjectStats("missing")).thenThrow(NotFoundException.of("Project", "missing"));

            assertThrows(NotFoundException.class, () -> cache.get("missing"));
            assertTrue(cache.entry("missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrent fills")
    class ConcurrencyTests {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final ExecutorService readers = Executors.newFixedThreadPool(3);

        @BeforeEach
        void slowProject() {
            when(aggregator.getProjectStats("slow")).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return stats("slow");
            });
        }

        @AfterEach
        void shutdown() {
            release.countDown();
            readers.shutdownNow();
        }

        @Test
        @DisplayName("Should serve other projects while one is being aggregated")
        void testOtherProjectNotBlocked() throws Exception {
            Future<ProjectStats> slow = readers.submit(() -> cache.get("slow"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            ProjectStats other = readers.submit(() -> cache.get("p2")).get(2, TimeUnit.SECONDS);

            assertEquals("p2", other.projectId());
            assertFalse(slow.isDone());
            release.countDown();
            assertEquals("slow", slow.get(5, TimeUnit.SECONDS).projectId());
        }

        @Test
        @DisplayName("Should aggregate once for concurrent readers of one project")
        void testSingleFill() throws Exception {
            Future<ProjectStats> first = readers.submit(() -> cache.get("slow"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<ProjectStats> second = readers.submit(() -> cache.get("slow"));
            Thread.sleep(100);
            release.countDown();

            assertSame(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
            verify(aggregator, times(1)).getProjectStats("slow");
            assertEquals(1, cache.stats().totalHits());
            assertEquals(1, cache.stats().totalMisses());
        }

        @Test
        @DisplayName("Should not keep a result aggregated across an invalidation")
        void testInvalidatedDuringFill() throws Exception {
            Future<ProjectStats> slow = readers.submit(() -> cache.get("slow"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            cache.onDatabaseChanged("/data/a.db");
            release.countDown();

            assertEquals("slow", slow.get(5, TimeUnit.SECONDS).projectId());
            assertTrue(cache.entry("slow").isEmpty());
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class InvalidationTests {

        @Test
        @DisplayName("Should drop a project on request")
        void testInvalidate() {
            cache.get("p1");
            cache.invalidate("p1");
            cache.get("p1");

            verify(aggregator, times(2)).getProjectStats("p1");
        }

        @Test
        @DisplayName("Should drop projects covering a changed database")
        void testDatabaseChanged() {
            cache.get("p1");

            cache.onDatabaseChanged("/data/a.db");

            assertTrue(cache.entry("p1").isEmpty());
        }

        @Test
        @DisplayName("Should drop projects when a skipped database changes")
        void testSkippedDatabaseChanged() {
            cache.get("p1");

            cache.onDatabaseChanged("/data/b.db");

            assertTrue(cache.entry("p1").isEmpty());
        }

        @Test
        @DisplayName("Should ignore changes to unrelated databases")
        void testUnrelatedChange() {
            cache.get("p1");

            cache.onDatabaseChanged("/data/other.db");

            assertTrue(cache.entry("p1").isPresent());
        }
    }

    @Nested
    @DisplayName("Stats")
    class StatsTests {

        @Test
        @DisplayName("Should report entries, hits and misses")
        void testStats() {
            cache.get("p1");
            cache.get("p1");
            cache.get("p2");
            ticker.advance(400);

            CacheStats stats = cache.stats();

            assertTrue(stats.enabled());
            assertEquals(2, stats.totalEntries());
            assertEquals(0, stats.validEntries());
            assertEquals(2, stats.expiredEntries());
            assertEquals(1, stats.totalHits());
            assertEquals(2, stats.totalMisses());
            assertEquals(1.0 / 3, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("Should pass through when disabled")
        void testDisabled() {
            QualityStatsCache disabled = new QualityStatsCache(aggregator, CacheConfig.disabled(),
                    new NoOpMetricsService(), ticker, Clock.fixed(NOW, ZoneOffset.UTC));

            disabled.get("p1");
            disabled.get("p1");

            verify(aggregator, times(2)).getProjectStats("p1");
            assertFalse(disabled.stats().enabled());
            assertTrue(disabled.entry("p1").isEmpty());
        }

        @Test
        @DisplayName("Should reject invalid configuration")
        void testConfigValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 300, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }
    }

    private static final class FakeTicker implements Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(long seconds) {
            nanos.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
        }
    }
}
