package com.catalog.quality.api;

import com.catalog.quality.core.model.Severity;
import com.catalog.quality.core.model.ViolationCategory;

/**
 * Null members match everything. {@code search} is a case-insensitive substring of the
 * message, rule name or current value.
 */
public record ViolationFilter(
        String database,
        String projectId,
        Severity severity,
        ViolationCategory category,
        boolean showResolved,
        String search
) {

    public static ViolationFilter all() {
        return new ViolationFilter(null, null, null, null, true, null);
    }

    public static ViolationFilter forDatabase(String database) {
        return new ViolationFilter(database, null, null, null, false, null);
    }
}
