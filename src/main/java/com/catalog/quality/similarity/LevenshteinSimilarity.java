package com.catalog.quality.similarity;

/**
 * Normalized edit-distance similarity: {@code 1 - distance / longerLength}.
 */
public class LevenshteinSimilarity implements StringSimilarity {

    @Override
    public double compute(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        int longer = Math.max(left.length(), right.length());
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) distance(left, right) / longer;
    }

    @Override
    public String name() {
        return "levenshtein";
    }

    /**
     * Two-row dynamic programming over the shorter string.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int[] prev = new int[shorter.length() + 1];
        int[] curr = new int[shorter.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }
        for (int row = 1; row <= longer.length(); row++) {
            curr[0] = row;
            char c = longer.charAt(row - 1);
            for (int col = 1; col <= shorter.length(); col++) {
                int substitution = prev[col - 1] + (shorter.charAt(col - 1) == c ? 0 : 1);
                curr[col] = Math.min(substitution, Math.min(prev[col], curr[col - 1]) + 1);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[shorter.length()];
    }
}
