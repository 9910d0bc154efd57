package com.catalog.quality.cache;

import com.catalog.quality.aggregate.ProjectStats;

import java.time.Instant;

/**
 * Read-only view of one cached project.
 */
public record ProjectQualityCacheEntry(
        String projectId,
        Instant cachedAt,
        Instant lastAccess,
        long hitCount,
        int ttlSeconds,
        ProjectStats payload
) {
}
