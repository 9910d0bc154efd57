package com.catalog.quality.rest.dto;

import com.catalog.quality.core.model.Violation;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ViolationResponse(
        @JsonProperty("id") long id,
        @JsonProperty("database") String database,
        @JsonProperty("normalized_item_id") long normalizedItemId,
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("category") String category,
        @JsonProperty("severity") String severity,
        @JsonProperty("message") String message,
        @JsonProperty("recommendation") String recommendation,
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("current_value") String currentValue,
        @JsonProperty("resolved") boolean resolved,
        @JsonProperty("resolved_by") String resolvedBy,
        @JsonProperty("resolved_at") String resolvedAt,
        @JsonProperty("created_at") String createdAt
) {
    public static ViolationResponse from(Violation v) {
        return new ViolationResponse(v.getId(), v.getDatabaseKey(), v.getNormalizedItemId(), v.getRuleName(),
                v.getCategory().wireName(), v.getSeverity().wireName(), v.getMessage(), v.getRecommendation(),
                v.getFieldName(), v.getCurrentValue(), v.isResolved(), v.getResolvedBy(),
                Timestamps.iso(v.getResolvedAt()), Timestamps.iso(v.getCreatedAt()));
    }
}
