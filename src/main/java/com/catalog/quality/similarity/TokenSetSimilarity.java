package com.catalog.quality.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard overlap of whitespace-separated, lower-cased word sets.
 */
public class TokenSetSimilarity implements StringSimilarity {

    @Override
    public double compute(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        Set<String> a = tokens(left);
        Set<String> b = tokens(right);
        if (a.isEmpty() && b.isEmpty()) {
            return left.equals(right) ? 1.0 : 0.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (a.size() + b.size() - shared);
    }

    @Override
    public String name() {
        return "jaccard";
    }

    public static Set<String> tokens(String text) {
        Set<String> result = new HashSet<>();
        for (String token : text.toLowerCase().split("[\\s,;]+")) {
            if (!token.isBlank()) {
                result.add(token);
            }
        }
        return result;
    }
}
