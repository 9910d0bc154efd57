package com.catalog.quality.normalization;

/**
 * Notified after records of a database changed: a completed normalization, a merge or an
 * applied suggestion.
 */
@FunctionalInterface
public interface DatabaseChangeListener {

    void onDatabaseChanged(String databaseKey);
}
