package com.catalog.quality.api;

import com.catalog.quality.core.model.SuggestionPriority;
import com.catalog.quality.core.model.SuggestionType;

/**
 * Null members match everything.
 */
public record SuggestionFilter(
        String database,
        String projectId,
        SuggestionPriority priority,
        SuggestionType type,
        Boolean applied,
        Boolean autoApplyable
) {

    public static SuggestionFilter all() {
        return new SuggestionFilter(null, null, null, null, null, null);
    }

    public static SuggestionFilter forDatabase(String database) {
        return new SuggestionFilter(database, null, null, null, null, null);
    }
}
