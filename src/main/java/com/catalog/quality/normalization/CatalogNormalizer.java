package com.catalog.quality.normalization;

import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.ProcessingLevel;
import com.catalog.quality.core.model.RawCatalogItem;

import java.time.Clock;
import java.util.Map;

/**
 * Turns a raw catalog item into a scored normalized record. Stateless and thread-safe
 * as long as the scorer is.
 */
public class CatalogNormalizer {

    public static final double BENCHMARK_THRESHOLD = 0.9;

    private final NameNormalizer names;
    private final AttributeExtractor attributes;
    private final RecordScorer scorer;
    private final Clock clock;

    public CatalogNormalizer() {
        this(NameNormalizer.defaults(), new AttributeExtractor(), new CompletenessScorer(), Clock.systemUTC());
    }

    public CatalogNormalizer(NameNormalizer names, AttributeExtractor attributes, RecordScorer scorer, Clock clock) {
        this.names = names;
        this.attributes = attributes;
        this.scorer = scorer;
        this.clock = clock;
    }

    public NormalizedRecord normalize(RawCatalogItem item, String databaseKey) {
        Map<String, String> extracted = attributes.extract(item.payload());
        NormalizedRecord unscored = NormalizedRecord.builder()
                .databaseKey(databaseKey)
                .reference(item.reference())
                .code(CodeNormalizer.canonical(item.code()))
                .name(names.canonical(item.name()))
                .normalizedName(names.matchKey(item.name()))
                .attributes(extracted)
                .createdAt(clock.instant())
                .build();
        return rescore(unscored);
    }

    /**
     * Recomputes match key, scores and processing level after a field changed.
     */
    public NormalizedRecord rescore(NormalizedRecord record) {
        RecordScore score = scorer.score(record);
        return record.toBuilder()
                .normalizedName(names.matchKey(record.getName()))
                .qualityScore(score.qualityScore())
                .aiConfidence(score.aiConfidence())
                .processingLevel(levelFor(score))
                .updatedAt(clock.instant())
                .build();
    }

    public NameNormalizer names() {
        return names;
    }

    static ProcessingLevel levelFor(RecordScore score) {
        if (score.qualityScore() >= BENCHMARK_THRESHOLD) {
            return ProcessingLevel.BENCHMARK;
        }
        if (score.aiConfidence() > 0.0) {
            return ProcessingLevel.AI_ENHANCED;
        }
        return ProcessingLevel.BASIC;
    }
}
