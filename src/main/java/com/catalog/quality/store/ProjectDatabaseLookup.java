package com.catalog.quality.store;

import com.catalog.quality.core.model.TargetDatabase;

import java.util.List;

/**
 * Supplied by the project administration module.
 */
public interface ProjectDatabaseLookup {

    /**
     * Active target databases of a project.
     *
     * @throws com.catalog.quality.error.NotFoundException for an unknown project
     */
    List<TargetDatabase> activeDatabases(String projectId);
}
