package com.catalog.quality.store;

import com.catalog.quality.core.model.RawCatalogItem;

import java.util.List;

/**
 * Forward-only read cursor over the raw items of one database.
 */
public interface RawItemCursor extends AutoCloseable {

    /**
     * Returns up to {@code max} next items, or an empty list once exhausted.
     */
    List<RawCatalogItem> nextBatch(int max);

    /**
     * Total number of items the cursor will yield, or -1 when unknown.
     */
    long total();

    @Override
    default void close() {
    }
}
