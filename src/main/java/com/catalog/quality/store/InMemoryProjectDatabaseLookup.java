package com.catalog.quality.store;

import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.error.NotFoundException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryProjectDatabaseLookup implements ProjectDatabaseLookup {

    private final Map<String, List<TargetDatabase>> projects = new ConcurrentHashMap<>();

    public InMemoryProjectDatabaseLookup register(String projectId, TargetDatabase database) {
        projects.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(database);
        return this;
    }

    public InMemoryProjectDatabaseLookup registerProject(String projectId) {
        projects.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>());
        return this;
    }

    @Override
    public List<TargetDatabase> activeDatabases(String projectId) {
        List<TargetDatabase> databases = projects.get(projectId);
        if (databases == null) {
            throw NotFoundException.of("Project", projectId);
        }
        return databases.stream().filter(TargetDatabase::active).toList();
    }
}
