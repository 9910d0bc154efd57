package com.catalog.quality.core.model;

/**
 * Count and quality-score sum of the active records at one processing level.
 */
public record LevelTally(ProcessingLevel level, long count, double qualitySum) {

    public LevelTally {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
    }

    public static LevelTally empty(ProcessingLevel level) {
        return new LevelTally(level, 0, 0.0);
    }

    public LevelTally add(double qualityScore) {
        return new LevelTally(level, count + 1, qualitySum + qualityScore);
    }

    public LevelTally plus(LevelTally other) {
        return new LevelTally(level, count + other.count, qualitySum + other.qualitySum);
    }

    public double averageQuality() {
        return count == 0 ? 0.0 : qualitySum / count;
    }
}
