package com.catalog.quality.api;

import com.catalog.quality.aggregate.ProjectStats;
import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.NormalizationSession;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.ProcessingLevel;
import com.catalog.quality.core.model.RawCatalogItem;
import com.catalog.quality.core.model.Severity;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.SuggestionPriority;
import com.catalog.quality.core.model.SuggestionType;
import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.core.model.Violation;
import com.catalog.quality.duplicate.DetectionMethod;
import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.ValidationException;
import com.catalog.quality.lock.LocalEntityLock;
import com.catalog.quality.normalization.AnalysisSummary;
import com.catalog.quality.normalization.NormalizationWorkerPool;
import com.catalog.quality.normalization.WorkerPoolConfig;
import com.catalog.quality.session.InMemorySessionStore;
import com.catalog.quality.store.InMemoryCatalogDatabase;
import com.catalog.quality.store.InMemoryCatalogDatabaseProvider;
import com.catalog.quality.store.InMemoryProjectDatabaseLookup;
import com.catalog.quality.store.InMemoryQualityStore;
import com.catalog.quality.violation.ViolationRules;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final String PROJECT = "project-1";
    private static final String DB = "/data/catalog.db";

    private InMemoryCatalogDatabaseProvider provider;
    private InMemoryProjectDatabaseLookup lookup;
    private InMemoryCatalogDatabase database;
    private QualityEngine engine;

    @BeforeEach
    void setUp() {
        provider = new InMemoryCatalogDatabaseProvider();
        lookup = new InMemoryProjectDatabaseLookup();
        database = provider.create(DB);
        database.addRawItems(List.of(
                new RawCatalogItem("r1", "CODE001", "Болт М8", ""),
                new RawCatalogItem("r2", "code 001", "Болт  М8 оцинкованный", ""),
                new RawCatalogItem("r3", "C-3", "ГАЙКА М10", ""),
                new RawCatalogItem("r4", "C-4", "Шайба", "<ИНН>7707083893</ИНН>")));
        lookup.register(PROJECT, new TargetDatabase(1, "Catalog", DB, true))
                .register(PROJECT, new TargetDatabase(2, "Archive", "/data/archive.db", false))
                .registerProject("empty");

        engine = QualityEngine.builder()
                .catalogDatabases(provider)
                .projectLookup(lookup)
                .options(EngineOptions.builder()
                        .workerPool(new WorkerPoolConfig(100, 2, 3600, 300, 60, true))
                        .build())
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private NormalizationStatus normalizeAndWait() throws InterruptedException {
        StartResult started = engine.startNormalization(NormalizationScope.database(DB));
        assertTrue(started.success());
        assertEquals(1, started.sessionIds().size());

        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            NormalizationStatus status = engine.normalizationStatus(NormalizationScope.database(DB));
            if (!status.isRunning()) {
                return status;
            }
            Thread.sleep(10);
        }
        fail("Normalization did not finish in time");
        return null;
    }

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Should normalize, analyze and report completion")
        void testRun() throws InterruptedException {
            NormalizationStatus status = normalizeAndWait();

            assertFalse(status.isRunning());
            assertEquals(100.0, status.progress());
            assertEquals(4, status.processed());
            assertEquals(4, status.total());
            assertEquals(NormalizationWorkerPool.STEP_DONE, status.currentStep());
            assertEquals(1, status.duplicatesFound());
            assertEquals(1, status.violationsFound());
            assertEquals(2, status.suggestionsFound());
            assertNull(status.error());
            assertEquals(4, database.recordCount());

            NormalizationSession session = engine.session(status.sessions().get(0).id());
            assertEquals(DB, session.databaseKey());
        }

        @Test
        @DisplayName("Should report idle before anything ran")
        void testIdle() {
            NormalizationStatus status = engine.normalizationStatus(NormalizationScope.global());

            assertFalse(status.isRunning());
            assertEquals(NormalizationStatus.IDLE, status.currentStep());
            assertTrue(status.sessions().isEmpty());
        }

        @Test
        @DisplayName("Should cover the project's active databases in project status")
        void testProjectStatus() throws InterruptedException {
            normalizeAndWait();

            NormalizationStatus status = engine.normalizationStatus(NormalizationScope.allActive(PROJECT));

            assertEquals(1, status.sessions().size());
            assertEquals(4, status.processed());
        }

        @Test
        @DisplayName("Should succeed when stopping with nothing running")
        void testStopIdle() {
            StopResponse response = engine.stopNormalization(NormalizationScope.global());

            assertTrue(response.success());
            assertFalse(response.wasRunning());
            assertTrue(response.sessionIds().isEmpty());
        }

        @Test
        @DisplayName("Should refuse start scopes that name no databases")
        void testStartValidation() {
            assertThrows(ValidationException.class, () -> engine.startNormalization(NormalizationScope.global()));
            assertThrows(ValidationException.class, () -> engine.startNormalization(NormalizationScope.allActive("empty")));
            assertThrows(NotFoundException.class, () -> engine.startNormalization(NormalizationScope.allActive("nope")));
            assertThrows(ValidationException.class, () -> NormalizationScope.database(" "));
        }

        @Test
        @DisplayName("Should report an unknown session")
        void testUnknownSession() {
            assertThrows(NotFoundException.class, () -> engine.session("missing"));
        }
    }

    @Nested
    @DisplayName("Analysis results")
    class ResultTests {

        @BeforeEach
        void normalize() throws InterruptedException {
            normalizeAndWait();
        }

        @Test
        @DisplayName("Should list the exact code group")
        void testDuplicates() {
            Page<DuplicateGroup> page = engine.listDuplicates(DuplicateFilter.forDatabase(DB), PageRequest.defaults());

            assertEquals(1, page.total());
            DuplicateGroup group = page.items().get(0);
            assertEquals(DetectionMethod.EXACT_CODE, group.getDetectionMethod());
            assertEquals(2, group.getItemCount());
            assertEquals(group, engine.duplicateGroup(group.getId()));
            assertEquals(0, engine.listDuplicates(DuplicateFilter.forDatabase("/data/other.db"),
                    PageRequest.defaults()).total());
        }

        @Test
        @DisplayName("Should filter violations")
        void testViolations() {
            Page<Violation> open = engine.listViolations(ViolationFilter.forDatabase(DB), PageRequest.defaults());

            assertEquals(1, open.total());
            assertEquals(ViolationRules.NAME_ALL_CAPS, open.items().get(0).getRuleName());

            ViolationFilter bySeverity = new ViolationFilter(DB, null, Severity.CRITICAL, null, false, null);
            assertEquals(0, engine.listViolations(bySeverity, PageRequest.defaults()).total());

            ViolationFilter bySearch = new ViolationFilter(null, PROJECT, null, null, false, "гайка");
            assertEquals(1, engine.listViolations(bySearch, PageRequest.defaults()).total());
        }

        @Test
        @DisplayName("Should hide resolved violations unless asked")
        void testResolve() {
            Violation violation = engine.listViolations(ViolationFilter.forDatabase(DB), PageRequest.defaults())
                    .items().get(0);

            engine.resolveViolation(violation.getId(), "editor");

            assertEquals(0, engine.listViolations(ViolationFilter.forDatabase(DB), PageRequest.defaults()).total());
            assertEquals(1, engine.listViolations(ViolationFilter.all(), PageRequest.defaults()).total());
        }

        @Test
        @DisplayName("Should page through suggestions")
        void testSuggestionPaging() {
            Page<Suggestion> first = engine.listSuggestions(SuggestionFilter.all(), PageRequest.first(1));
            Page<Suggestion> second = engine.listSuggestions(SuggestionFilter.all(), PageRequest.of(1, 1));

            assertEquals(2, first.total());
            assertEquals(1, first.items().size());
            assertTrue(first.hasNext());
            assertFalse(second.hasNext());
            assertNotEquals(first.items().get(0).getId(), second.items().get(0).getId());

            SuggestionFilter merges = new SuggestionFilter(DB, null, null, SuggestionType.MERGE, null, null);
            assertEquals(1, engine.listSuggestions(merges, PageRequest.defaults()).total());
        }

        @Test
        @DisplayName("Should find nothing new when analyzing again")
        void testAnalyzeAgain() {
            AnalysisSummary summary = engine.analyzeDatabase(DB);

            assertEquals(new AnalysisSummary(0, 0, 0), summary);
            assertThrows(ValidationException.class, () -> engine.analyzeDatabase(""));
        }
    }

    @Nested
    @DisplayName("Merge, apply and statistics")
    class StatisticsTests {

        @BeforeEach
        void normalize() throws InterruptedException {
            normalizeAndWait();
        }

        @Test
        @DisplayName("Should aggregate the project's active databases")
        void testProjectStats() {
            ProjectStats stats = engine.projectStats(PROJECT);

            assertEquals(4, stats.totalItems());
            assertEquals(0.8125, stats.averageQuality(), 1e-9);
            assertEquals(1, stats.benchmarkCount());
            assertEquals(25.0, stats.benchmarkPercentage(), 1e-9);
            assertEquals(1, stats.databasesCount());
            assertEquals(3, stats.byLevel().get(ProcessingLevel.BASIC).count());
            assertSame(stats, engine.projectStats(PROJECT));
            assertEquals(1, engine.cacheStats().totalHits());
        }

        @Test
        @DisplayName("Should refresh cached stats after a merge")
        void testMergeRefreshesStats() {
            engine.projectStats(PROJECT);
            DuplicateGroup group = engine.listDuplicates(DuplicateFilter.all(), PageRequest.defaults()).items().get(0);

            engine.mergeDuplicateGroup(group.getId());

            assertEquals(3, engine.projectStats(PROJECT).totalItems());
            assertThrows(ConflictException.class, () -> engine.mergeDuplicateGroup(group.getId()));
            assertEquals(0, engine.listDuplicates(new DuplicateFilter(DB, null, true), PageRequest.defaults()).total());
        }

        @Test
        @DisplayName("Should apply a format suggestion and rescore")
        void testApply() {
            SuggestionFilter formats = new SuggestionFilter(DB, null, null, SuggestionType.CORRECT_FORMAT, false, null);
            Suggestion suggestion = engine.listSuggestions(formats, PageRequest.defaults()).items().get(0);
            assertEquals("Гайка М10", suggestion.getSuggestedValue());

            engine.applySuggestion(suggestion.getId());

            assertEquals("Гайка М10", database.findById(suggestion.getNormalizedItemId()).orElseThrow().getName());
            assertEquals(0.85, engine.projectStats(PROJECT).averageQuality(), 1e-9);
            assertThrows(ConflictException.class, () -> engine.applySuggestion(suggestion.getId()));
        }

        @Test
        @DisplayName("Should return single database stats")
        void testDatabaseStats() {
            assertEquals(4, engine.databaseStats(DB).totalItems());
            assertThrows(ValidationException.class, () -> engine.databaseStats(" "));
        }

        @Test
        @DisplayName("Should invalidate on request and audit it")
        void testInvalidate() {
            ProjectStats first = engine.projectStats(PROJECT);

            engine.invalidateCache(PROJECT);

            assertNotSame(first, engine.projectStats(PROJECT));
            assertEquals(1, engine.getAuditService().entriesByAction(AuditAction.CACHE_INVALIDATED).size());
            engine.invalidateCache(null);
            assertEquals(0, engine.cacheStats().totalEntries());
        }
    }

    @Nested
    @DisplayName("Writes during normalization")
    class RunningSessionTests {

        private InMemorySessionStore sessions;
        private InMemoryQualityStore store;
        private QualityEngine guarded;
        private NormalizedRecord master;
        private NormalizedRecord other;

        @BeforeEach
        void seed() {
            sessions = new InMemorySessionStore();
            store = new InMemoryQualityStore();
            master = database.seed(NormalizedRecord.builder().databaseKey(DB).reference("r1")
                    .code("CODE001").name("Болт М8").qualityScore(0.8).build());
            other = database.seed(NormalizedRecord.builder().databaseKey(DB).reference("r2")
                    .code("CODE001").name("болт м8").qualityScore(0.5).build());
            sessions.create(NormalizationSession.start("running", DB, 3600, NOW));
            guarded = QualityEngine.builder()
                    .catalogDatabases(provider)
                    .projectLookup(lookup)
                    .sessionStore(sessions)
                    .qualityStore(store)
                    .entityLock(new LocalEntityLock())
                    .auditService(new AuditService(Clock.fixed(NOW, ZoneOffset.UTC)))
                    .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                    .build();
        }

        @AfterEach
        void closeGuarded() {
            guarded.close();
        }

        @Test
        @DisplayName("Should refuse merges while the database is being normalized")
        void testMergeRefused() {
            DuplicateGroup group = store.insertGroup(DuplicateGroup.builder()
                    .databaseKey(DB)
                    .detectionMethod(DetectionMethod.EXACT_CODE)
                    .similarityScore(1.0)
                    .suggestedMasterId(master.getId())
                    .memberIds(List.of(master.getId(), other.getId()))
                    .createdAt(NOW)
                    .build());

            ConflictException error = assertThrows(ConflictException.class,
                    () -> guarded.mergeDuplicateGroup(group.getId()));

            assertEquals(ConflictException.ConflictReason.ALREADY_RUNNING, error.getReason());
            assertTrue(database.findById(other.getId()).orElseThrow().isActive());
            assertFalse(store.findGroup(group.getId()).orElseThrow().isMerged());
        }

        @Test
        @DisplayName("Should refuse applies while the database is being normalized and accept them after")
        void testApplyRefused() {
            Suggestion suggestion = store.insertSuggestion(Suggestion.builder()
                    .databaseKey(DB)
                    .normalizedItemId(other.getId())
                    .type(SuggestionType.CORRECT_FORMAT)
                    .priority(SuggestionPriority.LOW)
                    .field("name")
                    .suggestedValue("Болт м8")
                    .confidence(0.9)
                    .createdAt(NOW)
                    .build());

            assertThrows(ConflictException.class, () -> guarded.applySuggestion(suggestion.getId()));
            assertEquals("болт м8", database.findById(other.getId()).orElseThrow().getName());

            guarded.stopNormalization(NormalizationScope.database(DB));

            assertTrue(guarded.applySuggestion(suggestion.getId()).isApplied());
            assertEquals("Болт м8", database.findById(other.getId()).orElseThrow().getName());
        }
    }
}
