package com.catalog.quality.api;

import java.util.List;

/**
 * A page of results from a paginated listing.
 *
 * @param items  the content of this page (copied)
 * @param total  number of matching items across all pages
 * @param limit  the requested page size
 * @param offset the requested offset
 * @param <T>    the element type
 */
public record Page<T>(List<T> items, long total, int limit, int offset) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
    }

    /**
     * Slices an already filtered, id-ordered list.
     */
    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int from = (int) Math.min(request.offset(), all.size());
        int to = (int) Math.min((long) from + request.limit(), all.size());
        return new Page<>(all.subList(from, to), all.size(), request.limit(), request.offset());
    }

    public boolean hasNext() {
        return (long) offset + items.size() < total;
    }
}
