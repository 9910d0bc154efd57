package com.catalog.quality.similarity;

/**
 * Weighted blend of edit-distance, Jaro-Winkler and token overlap similarity.
 * Used by the semantic duplicate strategy.
 */
public class CompositeSimilarity implements StringSimilarity {

    private final StringSimilarity levenshtein = new LevenshteinSimilarity();
    private final StringSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final StringSimilarity jaccard = new TokenSetSimilarity();
    private final SimilarityWeights weights;

    public CompositeSimilarity() {
        this(SimilarityWeights.defaults());
    }

    public CompositeSimilarity(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        double score = weights.levenshtein() * levenshtein.compute(left, right)
                + weights.jaroWinkler() * jaroWinkler.compute(left, right)
                + weights.jaccard() * jaccard.compute(left, right);
        return Math.max(0.0, Math.min(1.0, score));
    }

    @Override
    public String name() {
        return "composite";
    }

    public SimilarityWeights weights() {
        return weights;
    }
}
