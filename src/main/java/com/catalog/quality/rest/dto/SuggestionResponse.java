package com.catalog.quality.rest.dto;

import com.catalog.quality.core.model.Suggestion;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SuggestionResponse(
        @JsonProperty("id") long id,
        @JsonProperty("database") String database,
        @JsonProperty("normalized_item_id") long normalizedItemId,
        @JsonProperty("type") String type,
        @JsonProperty("priority") String priority,
        @JsonProperty("field") String field,
        @JsonProperty("current_value") String currentValue,
        @JsonProperty("suggested_value") String suggestedValue,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("auto_applyable") boolean autoApplyable,
        @JsonProperty("applied") boolean applied,
        @JsonProperty("applied_at") String appliedAt,
        @JsonProperty("created_at") String createdAt
) {
    public static SuggestionResponse from(Suggestion s) {
        return new SuggestionResponse(s.getId(), s.getDatabaseKey(), s.getNormalizedItemId(), s.getType().wireName(),
                s.getPriority().wireName(), s.getField(), s.getCurrentValue(), s.getSuggestedValue(),
                s.getConfidence(), s.getReasoning(), s.isAutoApplyable(), s.isApplied(),
                Timestamps.iso(s.getAppliedAt()), Timestamps.iso(s.getCreatedAt()));
    }
}
