package com.catalog.quality.store;

import com.catalog.quality.core.model.TargetDatabase;

/**
 * Opens project databases by their target descriptor.
 */
public interface CatalogDatabaseProvider {

    /**
     * @throws com.catalog.quality.error.UpstreamException if the database is unreachable or corrupt
     */
    CatalogDatabase open(TargetDatabase target);
}
