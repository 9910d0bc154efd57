package com.catalog.quality.violation;

import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.Severity;
import com.catalog.quality.core.model.Violation;
import com.catalog.quality.core.model.ViolationCategory;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.ValidationException;
import com.catalog.quality.lock.LocalEntityLock;
import com.catalog.quality.metrics.NoOpMetricsService;
import com.catalog.quality.store.InMemoryQualityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViolationEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final String DB = "/data/catalog.db";

    private InMemoryQualityStore store;
    private AuditService audit;
    private ViolationEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryQualityStore();
        audit = new AuditService(clock);
        engine = new ViolationEngine(ViolationRules.catalogue(), store, new LocalEntityLock(),
                new NoOpMetricsService(), audit, clock);
    }

    private static NormalizedRecord record(long id, String code, String name) {
        return NormalizedRecord.builder()
                .id(id)
                .databaseKey(DB)
                .reference("ref-" + id)
                .code(code)
                .name(name)
                .normalizedName(name.toLowerCase())
                .qualityScore(0.8)
                .build();
    }

    @Nested
    @DisplayName("Detect")
    class DetectTests {

        @Test
        @DisplayName("Should create one violation per broken rule")
        void testDetect() {
            List<Violation> created = engine.detect(DB, List.of(record(1, "", "Болт М8"), record(2, "CODE002", "Гайка")));

            assertEquals(1, created.size());
            Violation violation = created.get(0);
            assertEquals(DB, violation.getDatabaseKey());
            assertEquals(1, violation.getNormalizedItemId());
            assertEquals(ViolationRules.CODE_REQUIRED, violation.getRuleName());
            assertEquals(ViolationCategory.COMPLETENESS, violation.getCategory());
            assertEquals(Severity.ERROR, violation.getSeverity());
            assertEquals("code", violation.getFieldName());
            assertEquals("Field 'code' is empty", violation.getMessage());
            assertFalse(violation.isResolved());
            assertEquals(NOW, violation.getCreatedAt());
        }

        @Test
        @DisplayName("Should not duplicate open violations on rerun")
        void testRerun() {
            List<NormalizedRecord> records = List.of(record(1, "", "БОЛТ М8"));

            assertEquals(2, engine.detect(DB, records).size());
            assertTrue(engine.detect(DB, records).isEmpty());
            assertEquals(2, store.violations(v -> true).size());
        }

        @Test
        @DisplayName("Should not recreate a resolved violation")
        void testResolvedNotRecreated() {
            List<NormalizedRecord> records = List.of(record(1, "", "Болт М8"));
            Violation violation = engine.detect(DB, records).get(0);
            engine.resolve(violation.getId(), "editor");

            assertTrue(engine.detect(DB, records).isEmpty());
            assertEquals(1, store.violations(v -> true).size());
        }

        @Test
        @DisplayName("Should skip inactive records")
        void testInactiveSkipped() {
            NormalizedRecord inactive = record(1, "", "Болт М8").toBuilder().active(false).build();

            assertTrue(engine.detect(DB, List.of(inactive)).isEmpty());
        }

        @Test
        @DisplayName("Should keep databases apart")
        void testPerDatabase() {
            engine.detect(DB, List.of(record(1, "", "Болт М8")));
            NormalizedRecord other = record(1, "", "Болт М8").toBuilder().databaseKey("/data/other.db").build();

            assertEquals(1, engine.detect("/data/other.db", List.of(other)).size());
        }
    }

    @Nested
    @DisplayName("Resolve")
    class ResolveTests {

        @Test
        @DisplayName("Should mark a violation resolved and audit it")
        void testResolve() {
            Violation violation = engine.detect(DB, List.of(record(1, "", "Болт М8"))).get(0);

            Violation resolved = engine.resolve(violation.getId(), "editor");

            assertTrue(resolved.isResolved());
            assertEquals("editor", resolved.getResolvedBy());
            assertEquals(NOW, resolved.getResolvedAt());
            assertEquals(1, audit.entriesByAction(AuditAction.VIOLATION_RESOLVED).size());
        }

        @Test
        @DisplayName("Should keep the first resolver when resolved twice")
        void testResolveTwice() {
            Violation violation = engine.detect(DB, List.of(record(1, "", "Болт М8"))).get(0);
            engine.resolve(violation.getId(), "editor");

            Violation again = engine.resolve(violation.getId(), "auditor");

            assertTrue(again.isResolved());
            assertEquals("editor", again.getResolvedBy());
            assertEquals(1, audit.entriesByAction(AuditAction.VIOLATION_RESOLVED).size());
        }

        @Test
        @DisplayName("Should require a resolver")
        void testBlankResolver() {
            Violation violation = engine.detect(DB, List.of(record(1, "", "Болт М8"))).get(0);

            assertThrows(ValidationException.class, () -> engine.resolve(violation.getId(), " "));
            assertThrows(ValidationException.class, () -> engine.resolve(violation.getId(), null));
            assertFalse(store.findViolation(violation.getId()).orElseThrow().isResolved());
        }

        @Test
        @DisplayName("Should report an unknown violation")
        void testUnknown() {
            assertThrows(NotFoundException.class, () -> engine.resolve(77, "editor"));
        }
    }
}
