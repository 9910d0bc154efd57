package com.catalog.quality.suggestion;

import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.Suggestion;
import com.catalog.quality.core.model.SuggestionPriority;
import com.catalog.quality.core.model.SuggestionType;
import com.catalog.quality.core.model.Violation;
import com.catalog.quality.metrics.MetricsService;
import com.catalog.quality.normalization.CodeNormalizer;
import com.catalog.quality.store.QualityStore;
import com.catalog.quality.violation.ViolationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives suggestions from open violations and unmerged duplicate groups.
 */
public class SuggestionGenerator {
    private static final Logger log = LoggerFactory.getLogger(SuggestionGenerator.class);

    public static final double AUTO_APPLY_THRESHOLD = 0.9;
    public static final String DUPLICATE_GROUP_FIELD = "duplicate_group";

    static final double FORMAT_CONFIDENCE = 0.95;
    static final double CAPITALISE_CONFIDENCE = 0.75;
    static final double REVIEW_CONFIDENCE = 0.5;
    static final double REPROCESS_CONFIDENCE = 0.6;
    static final double HIGH_PRIORITY_MERGE_SCORE = 0.95;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final QualityStore store;
    private final MetricsService metrics;
    private final Clock clock;

    public SuggestionGenerator(QualityStore store, MetricsService metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return suggestions created by this call; proposals equal to an unapplied one are skipped
     */
    public List<Suggestion> generate(String databaseKey, Collection<Violation> violations,
                                     Collection<DuplicateGroup> groups) {
        Set<String> pending = new HashSet<>();
        for (Suggestion s : store.suggestions(s -> databaseKey.equals(s.getDatabaseKey()) && !s.isApplied())) {
            pending.add(identity(s));
        }

        List<Suggestion> proposals = new ArrayList<>();
        for (Violation violation : violations) {
            if (!violation.isResolved()) {
                fromViolation(violation).ifPresent(proposals::add);
            }
        }
        for (DuplicateGroup group : groups) {
            if (!group.isMerged()) {
                proposals.add(fromGroup(group));
            }
        }

        List<Suggestion> created = new ArrayList<>();
        for (Suggestion proposal : proposals) {
            if (pending.add(identity(proposal))) {
                created.add(store.insertSuggestion(proposal));
            }
        }
        metrics.recordSuggestionsGenerated(created.size());
        log.info("suggestions.generation.completed database={} proposed={} created={}",
                databaseKey, proposals.size(), created.size());
        return created;
    }

    Optional<Suggestion> fromViolation(Violation violation) {
        String value = violation.getCurrentValue();
        return switch (violation.getRuleName()) {
            case ViolationRules.NAME_WHITESPACE -> Optional.of(correction(violation, SuggestionType.CORRECT_FORMAT,
                    collapse(value), FORMAT_CONFIDENCE, "Remove surrounding and repeated spaces"));
            case ViolationRules.CODE_FORMAT -> Optional.of(correction(violation, SuggestionType.CORRECT_FORMAT,
                    CodeNormalizer.canonical(value), FORMAT_CONFIDENCE, "Use the canonical code form"));
            case ViolationRules.NAME_ALL_CAPS -> Optional.of(correction(violation, SuggestionType.CORRECT_FORMAT,
                    capitalise(value), CAPITALISE_CONFIDENCE, "Write the name in regular case"));
            case ViolationRules.NAME_REQUIRED, ViolationRules.CODE_REQUIRED, ViolationRules.INN_INVALID,
                    ViolationRules.KPP_INVALID, ViolationRules.NAME_TOO_SHORT ->
                    Optional.of(correction(violation, SuggestionType.REVIEW, null, REVIEW_CONFIDENCE,
                            violation.getMessage() + "; needs manual review"));
            case ViolationRules.LOW_QUALITY_SCORE, ViolationRules.BENCHMARK_INCONSISTENT,
                    ViolationRules.AI_LOW_CONFIDENCE ->
                    Optional.of(correction(violation, SuggestionType.REPROCESS, null, REPROCESS_CONFIDENCE,
                            violation.getMessage() + "; normalize the record again"));
            default -> Optional.empty();
        };
    }

    Suggestion fromGroup(DuplicateGroup group) {
        double score = group.getSimilarityScore();
        return Suggestion.builder()
                .databaseKey(group.getDatabaseKey())
                .normalizedItemId(group.getSuggestedMasterId())
                .type(SuggestionType.MERGE)
                .priority(score >= HIGH_PRIORITY_MERGE_SCORE ? SuggestionPriority.HIGH : SuggestionPriority.MEDIUM)
                .field(DUPLICATE_GROUP_FIELD)
                .suggestedValue(Long.toString(group.getId()))
                .confidence(score)
                .reasoning(group.getItemCount() + " records matched by " + group.getDetectionMethod().wireName())
                .createdAt(clock.instant())
                .build();
    }

    private Suggestion correction(Violation violation, SuggestionType type, String suggested,
                                  double confidence, String reasoning) {
        return Suggestion.builder()
                .databaseKey(violation.getDatabaseKey())
                .normalizedItemId(violation.getNormalizedItemId())
                .type(type)
                .priority(SuggestionPriority.fromSeverity(violation.getSeverity()))
                .field(violation.getFieldName())
                .currentValue(violation.getCurrentValue())
                .suggestedValue(suggested)
                .confidence(confidence)
                .reasoning(reasoning)
                .autoApplyable(type.writesField() && confidence >= AUTO_APPLY_THRESHOLD)
                .createdAt(clock.instant())
                .build();
    }

    static String collapse(String value) {
        return value == null ? "" : WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    /**
     * Lower-cases every word and upper-cases its first letter.
     */
    static String capitalise(String value) {
        String collapsed = collapse(value).toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(collapsed.length());
        boolean wordStart = true;
        for (char c : collapsed.toCharArray()) {
            out.append(wordStart && Character.isLetter(c) ? Character.toUpperCase(c) : c);
            wordStart = !Character.isLetterOrDigit(c);
        }
        return out.toString();
    }

    private static String identity(Suggestion s) {
        return s.getNormalizedItemId() + "|" + s.getType().wireName() + "|" + s.getField() + "|" + s.getSuggestedValue();
    }
}
