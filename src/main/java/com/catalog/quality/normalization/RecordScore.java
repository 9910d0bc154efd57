package com.catalog.quality.normalization;

/**
 * Output of a {@link RecordScorer}.
 */
public record RecordScore(double qualityScore, double aiConfidence) {

    public RecordScore {
        if (qualityScore < 0.0 || qualityScore > 1.0) {
            throw new IllegalArgumentException("qualityScore must be between 0.0 and 1.0: " + qualityScore);
        }
        if (aiConfidence < 0.0 || aiConfidence > 1.0) {
            throw new IllegalArgumentException("aiConfidence must be between 0.0 and 1.0: " + aiConfidence);
        }
    }
}
