package com.catalog.quality.duplicate;

/**
 * Thresholds for fuzzy duplicate strategies.
 *
 * @param semantic     minimum composite name similarity
 * @param wordBased    minimum token-set overlap
 * @param maxBlockSize fuzzy blocks larger than this are not compared pairwise
 */
public record DetectionThresholds(double semantic, double wordBased, int maxBlockSize) {

    public DetectionThresholds {
        if (semantic <= 0.0 || semantic > 1.0) {
            throw new IllegalArgumentException("semantic must be in (0, 1]: " + semantic);
        }
        if (wordBased <= 0.0 || wordBased > 1.0) {
            throw new IllegalArgumentException("wordBased must be in (0, 1]: " + wordBased);
        }
        if (maxBlockSize < 2) {
            throw new IllegalArgumentException("maxBlockSize must be >= 2");
        }
    }

    public static DetectionThresholds defaults() {
        return new DetectionThresholds(0.92, 0.7, 1000);
    }
}
