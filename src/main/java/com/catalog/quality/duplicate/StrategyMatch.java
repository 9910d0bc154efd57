package com.catalog.quality.duplicate;

/**
 * Verdict of one strategy on one record pair.
 */
public record StrategyMatch(boolean matched, double score) {

    private static final StrategyMatch NONE = new StrategyMatch(false, 0.0);

    public StrategyMatch {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0: " + score);
        }
    }

    public static StrategyMatch none() {
        return NONE;
    }

    public static StrategyMatch of(double score) {
        return new StrategyMatch(true, Math.max(0.0, Math.min(1.0, score)));
    }
}
