package com.catalog.quality.rest.dto;

import com.catalog.quality.api.StopResponse;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StopResponseDto(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("was_running") boolean wasRunning,
        @JsonProperty("session_ids") List<String> sessionIds
) {
    public static StopResponseDto from(StopResponse response) {
        return new StopResponseDto(response.success(), response.message(), response.wasRunning(),
                response.sessionIds());
    }
}
