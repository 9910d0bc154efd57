package com.catalog.quality.api;

/**
 * Limit/offset pagination over id-ordered listings.
 */
public record PageRequest(int offset, int limit) {

    public static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 10_000;

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be > 0 and <= " + MAX_LIMIT);
        }
    }

    public static PageRequest of(int offset, int limit) {
        return new PageRequest(offset, limit);
    }

    /**
     * Creates a request for the first page of the given size.
     */
    public static PageRequest first(int limit) {
        return new PageRequest(0, limit);
    }

    public static PageRequest defaults() {
        return first(DEFAULT_LIMIT);
    }
}
