package com.catalog.quality.normalization;

/**
 * Counts of rows newly created by one analysis pass.
 */
public record AnalysisSummary(int duplicatesFound, int violationsFound, int suggestionsFound) {

    public static AnalysisSummary empty() {
        return new AnalysisSummary(0, 0, 0);
    }
}
