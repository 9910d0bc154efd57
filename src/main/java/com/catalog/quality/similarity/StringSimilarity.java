package com.catalog.quality.similarity;

/**
 * A string similarity measure returning a score in [0, 1], 1 meaning identical.
 */
public interface StringSimilarity {

    double compute(String left, String right);

    String name();
}
