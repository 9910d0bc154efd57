package com.catalog.quality.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SuccessResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message
) {
    public static SuccessResponse ok(String message) {
        return new SuccessResponse(true, message);
    }
}
