package com.catalog.quality.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for resolving a violation.
 */
public record ResolveViolationRequest(@JsonProperty("resolved_by") String resolvedBy) {

    public ResolveViolationRequest {
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("resolved_by is required");
        }
    }
}
