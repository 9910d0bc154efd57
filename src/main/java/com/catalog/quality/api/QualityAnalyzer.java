package com.catalog.quality.api;

import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.Violation;
import com.catalog.quality.duplicate.DuplicateDetector;
import com.catalog.quality.logging.LogContext;
import com.catalog.quality.normalization.AnalysisSummary;
import com.catalog.quality.normalization.DatabaseAnalyzer;
import com.catalog.quality.store.CatalogDatabase;
import com.catalog.quality.store.QualityStore;
import com.catalog.quality.suggestion.SuggestionGenerator;
import com.catalog.quality.tracing.Span;
import com.catalog.quality.tracing.TracingService;
import com.catalog.quality.violation.ViolationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Duplicates, then violations, then suggestions over the active records of one database.
 */
public class QualityAnalyzer implements DatabaseAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(QualityAnalyzer.class);

    public static final String STEP_DUPLICATES = "detecting_duplicates";
    public static final String STEP_VIOLATIONS = "detecting_violations";
    public static final String STEP_SUGGESTIONS = "generating_suggestions";

    private final DuplicateDetector detector;
    private final ViolationEngine violations;
    private final SuggestionGenerator suggestions;
    private final QualityStore store;
    private final TracingService tracing;

    public QualityAnalyzer(DuplicateDetector detector, ViolationEngine violations, SuggestionGenerator suggestions,
                           QualityStore store, TracingService tracing) {
        this.detector = detector;
        this.violations = violations;
        this.suggestions = suggestions;
        this.store = store;
        this.tracing = tracing;
    }

    @Override
    public AnalysisSummary analyze(CatalogDatabase database, Consumer<String> stepListener,
                                   BooleanSupplier stopRequested) {
        String key = database.key();
        try (LogContext ignored = LogContext.forAnalysis(key);
             Span span = tracing.startSpan("quality.analysis", Map.of("database", key))) {
            List<NormalizedRecord> records = database.activeRecords();
            span.setAttribute("records", records.size());

            if (stopRequested.getAsBoolean()) {
                return stopped(key, span, 0, 0);
            }
            stepListener.accept(STEP_DUPLICATES);
            List<DuplicateGroup> groups = detector.detect(key, records);

            if (stopRequested.getAsBoolean()) {
                return stopped(key, span, groups.size(), 0);
            }
            stepListener.accept(STEP_VIOLATIONS);
            List<Violation> detected = violations.detect(key, records);

            if (stopRequested.getAsBoolean()) {
                return stopped(key, span, groups.size(), detected.size());
            }
            stepListener.accept(STEP_SUGGESTIONS);
            List<Violation> open = store.violations(v -> key.equals(v.getDatabaseKey()) && !v.isResolved());
            List<DuplicateGroup> unmerged = store.groups(g -> key.equals(g.getDatabaseKey()) && !g.isMerged());
            List<Suggestion> generated = suggestions.generate(key, open, unmerged);

            span.setStatus(Span.SpanStatus.OK);
            log.info("analysis.completed database={} records={} groups={} violations={} suggestions={}",
                    key, records.size(), groups.size(), detected.size(), generated.size());
            return new AnalysisSummary(groups.size(), detected.size(), generated.size());
        }
    }

    private static AnalysisSummary stopped(String key, Span span, int groups, int violations) {
        span.setAttribute("stopped", "true");
        span.setStatus(Span.SpanStatus.OK);
        log.info("analysis.stopped database={} groups={} violations={}", key, groups, violations);
        return new AnalysisSummary(groups, violations, 0);
    }
}
