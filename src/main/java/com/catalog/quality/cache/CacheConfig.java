package com.catalog.quality.cache;

/**
 * Configuration for the project quality stats cache.
 *
 * @param maxSize    maximum number of cached projects
 * @param ttlSeconds seconds after a fill during which an entry is served
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 projects, 300s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 300, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
