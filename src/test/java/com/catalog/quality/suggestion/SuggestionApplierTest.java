package com.catalog.quality.suggestion;

import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.SuggestionPriority;
import com.catalog.quality.core.model.SuggestionType;
import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.ValidationException;
import com.catalog.quality.lock.LocalEntityLock;
import com.catalog.quality.metrics.NoOpMetricsService;
import com.catalog.quality.normalization.AttributeExtractor;
import com.catalog.quality.normalization.CatalogNormalizer;
import com.catalog.quality.normalization.CompletenessScorer;
import com.catalog.quality.normalization.NameNormalizer;
import com.catalog.quality.store.InMemoryCatalogDatabase;
import com.catalog.quality.store.InMemoryCatalogDatabaseProvider;
import com.catalog.quality.store.InMemoryQualityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class SuggestionApplierTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final String DB = "/data/catalog.db";

    private InMemoryQualityStore store;
    private InMemoryCatalogDatabaseProvider provider;
    private InMemoryCatalogDatabase database;
    private CatalogNormalizer normalizer;
    private AuditService audit;
    private List<String> changed;
    private AtomicBoolean normalizing;
    private SuggestionApplier applier;
    private NormalizedRecord record;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryQualityStore();
        provider = new InMemoryCatalogDatabaseProvider();
        database = provider.create(DB);
        normalizer = new CatalogNormalizer(NameNormalizer.defaults(), new AttributeExtractor(),
                new CompletenessScorer(), clock);
        audit = new AuditService(clock);
        changed = new CopyOnWriteArrayList<>();
        normalizing = new AtomicBoolean();
        applier = applier(store);
        record = database.seed(NormalizedRecord.builder()
                .databaseKey(DB)
                .reference("ref-1")
                .code("CODE001")
                .name("Болт  М8")
                .normalizedName("болт м8")
                .qualityScore(0.45)
                .createdAt(NOW.minusSeconds(60))
                .build());
    }

    private SuggestionApplier applier(InMemoryQualityStore suggestions) {
        return new SuggestionApplier(suggestions, provider, normalizer, new LocalEntityLock(),
                key -> normalizing.get(), List.of(changed::add), new NoOpMetricsService(), audit,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Suggestion suggestion(SuggestionType type, String field, String value) {
        return store.insertSuggestion(Suggestion.builder()
                .databaseKey(DB)
                .normalizedItemId(record.getId())
                .type(type)
                .priority(SuggestionPriority.LOW)
                .field(field)
                .suggestedValue(value)
                .confidence(0.95)
                .createdAt(NOW)
                .build());
    }

    @Nested
    @DisplayName("Apply")
    class ApplyTests {

        @Test
        @DisplayName("Should write the value, rescore the record and mark the suggestion applied")
        void testApply() {
            Suggestion s = suggestion(SuggestionType.CORRECT_FORMAT, "name", "Болт М8");

            Suggestion applied = applier.apply(s.getId());

            assertTrue(applied.isApplied());
            assertEquals(NOW, applied.getAppliedAt());
            assertTrue(store.findSuggestion(s.getId()).orElseThrow().isApplied());

            NormalizedRecord after = database.findById(record.getId()).orElseThrow();
            NormalizedRecord expected = normalizer.rescore(record.toBuilder().name("Болт М8").build());
            assertEquals("Болт М8", after.getName());
            assertEquals(expected.getNormalizedName(), after.getNormalizedName());
            assertEquals(expected.getQualityScore(), after.getQualityScore());
            assertEquals(NOW, after.getUpdatedAt());

            assertEquals(List.of(DB), changed);
            assertEquals(1, audit.entriesByAction(AuditAction.SUGGESTION_APPLIED).size());
        }

        @Test
        @DisplayName("Should write attributes through set_value")
        void testSetAttribute() {
            Suggestion s = suggestion(SuggestionType.SET_VALUE, AttributeExtractor.INN, "7707083893");

            applier.apply(s.getId());

            assertEquals("7707083893", database.findById(record.getId()).orElseThrow()
                    .getAttribute(AttributeExtractor.INN));
        }
    }

    @Nested
    @DisplayName("Refusals")
    class RefusalTests {

        @Test
        @DisplayName("Should refuse a second apply without writing again")
        void testAlreadyApplied() {
            Suggestion s = suggestion(SuggestionType.CORRECT_FORMAT, "name", "Болт М8");
            applier.apply(s.getId());
            NormalizedRecord afterFirst = database.findById(record.getId()).orElseThrow();

            ConflictException error = assertThrows(ConflictException.class, () -> applier.apply(s.getId()));

            assertEquals(ConflictException.ConflictReason.ALREADY_APPLIED, error.getReason());
            NormalizedRecord current = database.findById(record.getId()).orElseThrow();
            assertEquals(afterFirst.getName(), current.getName());
            assertEquals(afterFirst.getQualityScore(), current.getQualityScore());
            assertEquals(1, changed.size());
        }

        @Test
        @DisplayName("Should refuse types that do not write a field")
        void testNonWritingTypes() {
            Suggestion merge = suggestion(SuggestionType.MERGE, SuggestionGenerator.DUPLICATE_GROUP_FIELD, "3");
            Suggestion review = suggestion(SuggestionType.REVIEW, "name", null);

            assertThrows(ValidationException.class, () -> applier.apply(merge.getId()));
            assertThrows(ValidationException.class, () -> applier.apply(review.getId()));
            assertFalse(store.findSuggestion(merge.getId()).orElseThrow().isApplied());
        }

        @Test
        @DisplayName("Should refuse derived fields")
        void testDerivedField() {
            Suggestion s = suggestion(SuggestionType.SET_VALUE, "quality_score", "1.0");

            assertThrows(ValidationException.class, () -> applier.apply(s.getId()));
            assertEquals(0.45, database.findById(record.getId()).orElseThrow().getQualityScore());
        }

        @Test
        @DisplayName("Should report unknown suggestions and missing records")
        void testNotFound() {
            assertThrows(NotFoundException.class, () -> applier.apply(404));

            Suggestion orphan = store.insertSuggestion(Suggestion.builder()
                    .databaseKey(DB)
                    .normalizedItemId(999)
                    .type(SuggestionType.SET_VALUE)
                    .priority(SuggestionPriority.LOW)
                    .field("code")
                    .suggestedValue("X")
                    .confidence(0.5)
                    .build());
            assertThrows(NotFoundException.class, () -> applier.apply(orphan.getId()));
            assertFalse(store.findSuggestion(orphan.getId()).orElseThrow().isApplied());
        }
    }

    @Nested
    @DisplayName("Failure")
    class FailureTests {

        @Test
        @DisplayName("Should refuse to apply while normalization runs on the database")
        void testRefusedWhileRunning() {
            Suggestion s = suggestion(SuggestionType.CORRECT_FORMAT, "name", "Болт М8");
            normalizing.set(true);

            ConflictException error = assertThrows(ConflictException.class, () -> applier.apply(s.getId()));

            assertEquals(ConflictException.ConflictReason.ALREADY_RUNNING, error.getReason());
            assertEquals("Болт  М8", database.findById(record.getId()).orElseThrow().getName());
            assertFalse(store.findSuggestion(s.getId()).orElseThrow().isApplied());
            assertTrue(changed.isEmpty());
        }

        @Test
        @DisplayName("Should leave the suggestion unapplied when the record write fails")
        void testRecordWriteFailure() {
            InMemoryCatalogDatabase failing = spy(database);
            doThrow(new IllegalStateException("disk full")).when(failing).updateAll(anyList(), any());
            provider.register(failing);
            Suggestion s = suggestion(SuggestionType.CORRECT_FORMAT, "name", "Болт М8");

            assertThrows(IllegalStateException.class, () -> applier.apply(s.getId()));

            assertFalse(store.findSuggestion(s.getId()).orElseThrow().isApplied());
            assertEquals("Болт  М8", database.findById(record.getId()).orElseThrow().getName());
            assertTrue(changed.isEmpty());
            assertTrue(audit.entriesByAction(AuditAction.SUGGESTION_APPLIED).isEmpty());
        }

        @Test
        @DisplayName("Should restore the record when marking the suggestion fails")
        void testMarkFailure() {
            InMemoryQualityStore failing = spy(new InMemoryQualityStore());
            Suggestion s = failing.insertSuggestion(Suggestion.builder()
                    .databaseKey(DB)
                    .normalizedItemId(record.getId())
                    .type(SuggestionType.CORRECT_FORMAT)
                    .priority(SuggestionPriority.LOW)
                    .field("name")
                    .suggestedValue("Болт М8")
                    .confidence(0.95)
                    .createdAt(NOW)
                    .build());
            doThrow(new IllegalStateException("store down")).when(failing).updateSuggestion(any());

            assertThrows(IllegalStateException.class, () -> applier(failing).apply(s.getId()));

            NormalizedRecord current = database.findById(record.getId()).orElseThrow();
            assertEquals("Болт  М8", current.getName());
            assertEquals(0.45, current.getQualityScore());
            assertFalse(failing.findSuggestion(s.getId()).orElseThrow().isApplied());
            assertTrue(changed.isEmpty());
        }
    }
}
