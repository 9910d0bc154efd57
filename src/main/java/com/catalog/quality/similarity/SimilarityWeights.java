package com.catalog.quality.similarity;

/**
 * Weights of the composite name similarity. They must sum to 1.
 */
public record SimilarityWeights(double levenshtein, double jaroWinkler, double jaccard) {

    public SimilarityWeights {
        if (levenshtein < 0 || jaroWinkler < 0 || jaccard < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = levenshtein + jaroWinkler + jaccard;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.4, 0.4, 0.2);
    }
}
