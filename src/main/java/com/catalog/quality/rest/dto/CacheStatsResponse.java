package com.catalog.quality.rest.dto;

import com.catalog.quality.cache.CacheStats;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStatsResponse(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("stats") Stats stats
) {

    public record Stats(
            @JsonProperty("total_entries") long totalEntries,
            @JsonProperty("valid_entries") long validEntries,
            @JsonProperty("expired_entries") long expiredEntries,
            @JsonProperty("ttl_seconds") int ttlSeconds,
            @JsonProperty("total_hits") long totalHits,
            @JsonProperty("total_misses") long totalMisses,
            @JsonProperty("hit_rate") double hitRate,
            @JsonProperty("evictions") long evictions
    ) {
    }

    public static CacheStatsResponse from(CacheStats stats) {
        if (!stats.enabled()) {
            return new CacheStatsResponse(false, null);
        }
        return new CacheStatsResponse(true, new Stats(stats.totalEntries(), stats.validEntries(),
                stats.expiredEntries(), stats.ttlSeconds(), stats.totalHits(), stats.totalMisses(),
                stats.hitRate(), stats.evictions()));
    }
}
