package com.catalog.quality.rest.dto;

import com.catalog.quality.api.NormalizationStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StatusResponse(
        @JsonProperty("is_running") boolean isRunning,
        @JsonProperty("progress") double progress,
        @JsonProperty("processed") long processed,
        @JsonProperty("total") long total,
        @JsonProperty("current_step") String currentStep,
        @JsonProperty("duplicates_found") int duplicatesFound,
        @JsonProperty("violations_found") int violationsFound,
        @JsonProperty("suggestions_found") int suggestionsFound,
        @JsonProperty("error") String error
) {
    public static StatusResponse from(NormalizationStatus status) {
        return new StatusResponse(status.isRunning(), status.progress(), status.processed(), status.total(),
                status.currentStep(), status.duplicatesFound(), status.violationsFound(),
                status.suggestionsFound(), status.error());
    }
}
