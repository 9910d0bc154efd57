package com.catalog.quality.rest.dto;

import com.catalog.quality.normalization.AnalysisSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

public record AnalysisResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("duplicates_found") int duplicatesFound,
        @JsonProperty("violations_found") int violationsFound,
        @JsonProperty("suggestions_found") int suggestionsFound
) {
    public static AnalysisResponse from(AnalysisSummary summary) {
        return new AnalysisResponse(true, summary.duplicatesFound(), summary.violationsFound(),
                summary.suggestionsFound());
    }
}
