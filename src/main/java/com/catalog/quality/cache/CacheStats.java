package com.catalog.quality.cache;

/**
 * Snapshot of the stats cache. Expired entries are those past their ttl and not yet refilled.
 */
public record CacheStats(
        boolean enabled,
        long totalEntries,
        long validEntries,
        long expiredEntries,
        int ttlSeconds,
        long totalHits,
        long totalMisses,
        long evictions
) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = totalHits + totalMisses;
        return total == 0 ? 0.0 : (double) totalHits / total;
    }

    public static CacheStats disabled() {
        return new CacheStats(false, 0, 0, 0, 0, 0, 0, 0);
    }
}
