package com.catalog.quality.api;

import com.catalog.quality.error.ValidationException;

/**
 * Which databases a start, stop or status call addresses: one database by path, the active
 * databases of a project, or everything (stop and status only).
 */
public record NormalizationScope(Kind kind, String databasePath, String projectId) {

    public enum Kind { DATABASE, PROJECT, GLOBAL }

    public NormalizationScope {
        if (kind == null) {
            throw new ValidationException("scope kind is required");
        }
        if (kind == Kind.DATABASE && (databasePath == null || databasePath.isBlank())) {
            throw new ValidationException("database_path is required");
        }
        if (kind == Kind.PROJECT && (projectId == null || projectId.isBlank())) {
            throw new ValidationException("project_id is required for all_active");
        }
    }

    public static NormalizationScope database(String databasePath) {
        return new NormalizationScope(Kind.DATABASE, databasePath, null);
    }

    public static NormalizationScope allActive(String projectId) {
        return new NormalizationScope(Kind.PROJECT, null, projectId);
    }

    public static NormalizationScope global() {
        return new NormalizationScope(Kind.GLOBAL, null, null);
    }
}
