package com.catalog.quality.core.model;

/**
 * A raw catalog entry as supplied by the ingestion cursor.
 *
 * @param reference stable source reference, unique within one database
 * @param code      source code, possibly unnormalized
 * @param name      source name, possibly unnormalized
 * @param payload   tag-structured attribute document, may be empty
 */
public record RawCatalogItem(String reference, String code, String name, String payload) {

    public RawCatalogItem {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("reference is required");
        }
    }
}
