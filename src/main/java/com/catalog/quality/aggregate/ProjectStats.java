package com.catalog.quality.aggregate;

import com.catalog.quality.core.model.LevelTally;
import com.catalog.quality.core.model.ProcessingLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combined statistics over the databases of a project that could be read.
 * Average quality is weighted by item count.
 */
public record ProjectStats(
        String projectId,
        long totalItems,
        double averageQuality,
        Map<ProcessingLevel, LevelStats> byLevel,
        long benchmarkCount,
        double benchmarkPercentage,
        List<DatabaseStats> databases,
        int databasesCount,
        int databasesProcessed,
        List<SkippedDatabase> skipped,
        Instant computedAt
) {

    public ProjectStats {
        byLevel = Collections.unmodifiableMap(new EnumMap<>(byLevel));
        databases = List.copyOf(databases);
        skipped = List.copyOf(skipped);
    }

    /**
     * Reduces per-database statistics into project totals.
     *
     * @param databasesCount number of databases the project had, skipped ones included
     */
    public static ProjectStats combine(String projectId, int databasesCount, List<DatabaseStats> included,
                                       List<SkippedDatabase> skipped, Instant computedAt) {
        Map<ProcessingLevel, LevelTally> sums = DatabaseStats.complete(Map.of());
        for (DatabaseStats stats : included) {
            stats.byLevel().forEach((level, ls) -> sums.merge(level,
                    new LevelTally(level, ls.count(), ls.avgQuality() * ls.count()), LevelTally::plus));
        }
        long total = sums.values().stream().mapToLong(LevelTally::count).sum();
        double qualitySum = sums.values().stream().mapToDouble(LevelTally::qualitySum).sum();
        Map<ProcessingLevel, LevelStats> byLevel = new EnumMap<>(ProcessingLevel.class);
        sums.forEach((level, tally) -> byLevel.put(level, LevelStats.of(tally, total)));
        long benchmark = sums.get(ProcessingLevel.BENCHMARK).count();

        List<DatabaseStats> ordered = new ArrayList<>(included);
        ordered.sort((a, b) -> a.path().compareTo(b.path()));
        return new ProjectStats(projectId, total, total == 0 ? 0.0 : qualitySum / total, byLevel, benchmark,
                DatabaseStats.percent(benchmark, total), ordered, databasesCount, included.size(), skipped,
                computedAt);
    }
}
