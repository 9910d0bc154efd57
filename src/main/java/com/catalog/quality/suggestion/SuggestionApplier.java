package com.catalog.quality.suggestion;

import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.ConflictException.ConflictReason;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.ValidationException;
import com.catalog.quality.lock.EntityLock;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.normalization.CatalogNormalizer;
import com.catalog.quality.normalization.DatabaseChangeListener;
import com.catalog.quality.store.CatalogDatabase;
import com.catalog.quality.store.CatalogDatabaseProvider;
import com.catalog.quality.store.QualityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Writes a suggestion's value into its record. The field write and the applied flag
 * commit together; a suggestion applies once.
 */
public class SuggestionApplier {
    private static final Logger log = LoggerFactory.getLogger(SuggestionApplier.class);

    // computed by the scorer, never written by hand
    private static final Set<String> DERIVED_FIELDS = Set.of(
            "quality_score", "ai_confidence", "processing_level", SuggestionGenerator.DUPLICATE_GROUP_FIELD);

    private final QualityStore store;
    private final CatalogDatabaseProvider databases;
    private final CatalogNormalizer normalizer;
    private final EntityLock locks;
    private final Predicate<String> normalizationRunning;
    private final List<DatabaseChangeListener> listeners;
    private final MetricsService metrics;
    private final AuditService audit;
    private final Clock clock;

    public SuggestionApplier(QualityStore store, CatalogDatabaseProvider databases, CatalogNormalizer normalizer,
                             EntityLock locks, Predicate<String> normalizationRunning,
                             List<DatabaseChangeListener> listeners, MetricsService metrics,
                             AuditService audit, Clock clock) {
        this.store = store;
        this.databases = databases;
        this.normalizer = normalizer;
        this.locks = locks;
        this.normalizationRunning = normalizationRunning;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * @throws NotFoundException   for an unknown suggestion or a missing target record
     * @throws ConflictException   when the suggestion was already applied or normalization is running on
     *                             its database
     * @throws ValidationException when the suggestion type does not write a field
     */
    public Suggestion apply(long suggestionId) {
        Suggestion applied = locks.withLock(EntityLock.suggestionKey(suggestionId), () -> applyLocked(suggestionId));
        metrics.incrementSuggestionsApplied();
        Map<String, Object> details = new HashMap<>();
        details.put("field", applied.getField());
        details.put("recordId", applied.getNormalizedItemId());
        audit.record(AuditAction.SUGGESTION_APPLIED, "suggestion:" + suggestionId, AuditService.SYSTEM_ACTOR, details);
        listeners.forEach(listener -> listener.onDatabaseChanged(applied.getDatabaseKey()));
        log.info("suggestions.applied suggestionId={} recordId={} field={}",
                suggestionId, applied.getNormalizedItemId(), applied.getField());
        return applied;
    }

    private Suggestion applyLocked(long suggestionId) {
        Suggestion suggestion = store.findSuggestion(suggestionId)
                .orElseThrow(() -> NotFoundException.of("Suggestion", suggestionId));
        if (suggestion.isApplied()) {
            throw new ConflictException(ConflictReason.ALREADY_APPLIED, "Suggestion already applied: " + suggestionId);
        }
        if (!suggestion.getType().writesField()) {
            throw new ValidationException("Suggestions of type " + suggestion.getType().wireName()
                    + " cannot be applied; use merge or normalization instead");
        }
        String field = suggestion.getField();
        if (field == null || field.isBlank() || DERIVED_FIELDS.contains(field)) {
            throw new ValidationException("Field is not writable: " + field);
        }

        CatalogDatabase database = databases.open(TargetDatabase.ofPath(suggestion.getDatabaseKey()));
        long recordId = suggestion.getNormalizedItemId();
        return locks.withLock(EntityLock.databaseKey(database.key()), () -> {
            if (normalizationRunning.test(database.key())) {
                throw new ConflictException(ConflictReason.ALREADY_RUNNING,
                        "Normalization is running for " + database.key(), List.of(database.key()));
            }
            NormalizedRecord before = database.findById(recordId)
                    .orElseThrow(() -> NotFoundException.of("Record", database.key() + "#" + recordId));
            NormalizedRecord after = normalizer.rescore(
                    before.toBuilder().field(field, suggestion.getSuggestedValue()).build());
            Suggestion marked = suggestion.markApplied(clock.instant());
            database.updateAll(List.of(after), () -> store.updateSuggestion(marked));
            return marked;
        });
    }
}
