package com.catalog.quality.core.model;

/**
 * A project database that normalization and aggregation can target.
 * The file path is the database key used throughout the engine.
 *
 * @param id       database id assigned by the project module
 * @param name     display name
 * @param filePath location of the database, used as its identity
 * @param active   whether the database takes part in "all active" operations
 */
public record TargetDatabase(long id, String name, String filePath, boolean active) {

    public TargetDatabase {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("filePath is required");
        }
        if (name == null || name.isBlank()) {
            name = filePath;
        }
    }

    /**
     * Creates a target for a database addressed by path alone.
     */
    public static TargetDatabase ofPath(String filePath) {
        return new TargetDatabase(0, filePath, filePath, true);
    }
}
