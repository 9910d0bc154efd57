package com.catalog.quality.store;

import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.error.UpstreamException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves registered {@link InMemoryCatalogDatabase}s by file path. Unregistered paths behave
 * like unreachable databases.
 */
public class InMemoryCatalogDatabaseProvider implements CatalogDatabaseProvider {

    private final Map<String, CatalogDatabase> databases = new ConcurrentHashMap<>();

    public InMemoryCatalogDatabase create(String path) {
        InMemoryCatalogDatabase database = new InMemoryCatalogDatabase(path);
        databases.put(path, database);
        return database;
    }

    public void register(CatalogDatabase database) {
        databases.put(database.key(), database);
    }

    @Override
    public CatalogDatabase open(TargetDatabase target) {
        CatalogDatabase database = databases.get(target.filePath());
        if (database == null) {
            throw new UpstreamException(target.filePath(), "Database not reachable: " + target.filePath());
        }
        return database;
    }
}
