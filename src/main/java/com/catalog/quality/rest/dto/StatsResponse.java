package com.catalog.quality.rest.dto;

import com.catalog.quality.aggregate.DatabaseStats;
import com.catalog.quality.aggregate.LevelStats;
import com.catalog.quality.aggregate.ProjectStats;
import com.catalog.quality.core.model.ProcessingLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality statistics of a project, or of a single database when the project members are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatsResponse(
        @JsonProperty("total_items") long totalItems,
        @JsonProperty("average_quality") double averageQuality,
        @JsonProperty("by_level") Map<String, Level> byLevel,
        @JsonProperty("benchmark_count") long benchmarkCount,
        @JsonProperty("benchmark_percentage") double benchmarkPercentage,
        @JsonProperty("databases") List<Database> databases,
        @JsonProperty("databases_count") Integer databasesCount,
        @JsonProperty("databases_processed") Integer databasesProcessed,
        @JsonProperty("skipped") List<Skipped> skipped
) {

    public record Level(
            @JsonProperty("count") long count,
            @JsonProperty("avg_quality") double avgQuality,
            @JsonProperty("percentage") double percentage
    ) {
    }

    public record Database(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("path") String path,
            @JsonProperty("stats") StatsResponse stats
    ) {
    }

    public record Skipped(
            @JsonProperty("id") long id,
            @JsonProperty("path") String path,
            @JsonProperty("reason") String reason
    ) {
    }

    public static StatsResponse from(ProjectStats stats) {
        List<Database> databases = stats.databases().stream()
                .map(db -> new Database(db.id(), db.name(), db.path(), from(db)))
                .toList();
        List<Skipped> skipped = stats.skipped().stream()
                .map(s -> new Skipped(s.id(), s.path(), s.reason()))
                .toList();
        return new StatsResponse(stats.totalItems(), stats.averageQuality(), levels(stats.byLevel()),
                stats.benchmarkCount(), stats.benchmarkPercentage(), databases, stats.databasesCount(),
                stats.databasesProcessed(), skipped);
    }

    public static StatsResponse from(DatabaseStats stats) {
        return new StatsResponse(stats.totalItems(), stats.averageQuality(), levels(stats.byLevel()),
                stats.benchmarkCount(), stats.benchmarkPercentage(), null, null, null, null);
    }

    private static Map<String, Level> levels(Map<ProcessingLevel, LevelStats> byLevel) {
        Map<String, Level> levels = new LinkedHashMap<>();
        byLevel.forEach((level, ls) -> levels.put(level.wireName(),
                new Level(ls.count(), ls.avgQuality(), ls.percentage())));
        return levels;
    }
}
