package com.catalog.quality.api;

/**
 * @param database     database path, or null
 * @param projectId    project whose active databases to include, or null
 * @param unmergedOnly hide merged groups
 */
public record DuplicateFilter(String database, String projectId, boolean unmergedOnly) {

    public static DuplicateFilter all() {
        return new DuplicateFilter(null, null, false);
    }

    public static DuplicateFilter forDatabase(String database) {
        return new DuplicateFilter(database, null, false);
    }
}
