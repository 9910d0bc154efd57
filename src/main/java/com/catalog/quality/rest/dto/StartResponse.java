package com.catalog.quality.rest.dto;

import com.catalog.quality.api.StartResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StartResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("session_ids") List<String> sessionIds
) {
    public static StartResponse from(StartResult result) {
        return new StartResponse(result.success(), result.message(),
                result.sessionIds().size() == 1 ? result.sessionIds().get(0) : null, result.sessionIds());
    }
}
