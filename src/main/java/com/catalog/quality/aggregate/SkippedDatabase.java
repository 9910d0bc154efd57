package com.catalog.quality.aggregate;

/**
 * A database left out of a project aggregation, with the reason.
 */
public record SkippedDatabase(long id, String path, String reason) {

    public static final String TIMEOUT = "timeout";
    public static final String INTERRUPTED = "interrupted";
}
