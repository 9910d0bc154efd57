package com.catalog.quality.similarity;

/**
 * Jaro-Winkler similarity with a prefix bonus for up to four leading characters.
 */
public class JaroWinklerSimilarity implements StringSimilarity {

    private static final int PREFIX_LIMIT = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(0.1);
    }

    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("prefixScale must be within [0, 0.25]: " + prefixScale);
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String left, String right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(left, right);
        int limit = Math.min(PREFIX_LIMIT, Math.min(left.length(), right.length()));
        int prefix = 0;
        while (prefix < limit && left.charAt(prefix) == right.charAt(prefix)) {
            prefix++;
        }
        return Math.min(1.0, jaro + prefix * prefixScale * (1.0 - jaro));
    }

    @Override
    public String name() {
        return "jaro_winkler";
    }

    private static double jaro(String a, String b) {
        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] matchedA = new boolean[a.length()];
        boolean[] matchedB = new boolean[b.length()];
        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!matchedB[j] && a.charAt(i) == b.charAt(j)) {
                    matchedA[i] = true;
                    matchedB[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }
        int halfTranspositions = 0;
        int j = 0;
        for (int i = 0; i < a.length(); i++) {
            if (matchedA[i]) {
                while (!matchedB[j]) {
                    j++;
                }
                if (a.charAt(i) != b.charAt(j)) {
                    halfTranspositions++;
                }
                j++;
            }
        }
        double m = matches;
        return (m / a.length() + m / b.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}
