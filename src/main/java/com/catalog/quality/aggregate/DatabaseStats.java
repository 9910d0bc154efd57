package com.catalog.quality.aggregate;

import com.catalog.quality.core.model.LevelTally;
import com.catalog.quality.core.model.ProcessingLevel;
import com.catalog.quality.core.model.TargetDatabase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Quality statistics of one database. Every processing level is present, empty ones with a zero count.
 */
public record DatabaseStats(
        long id,
        String name,
        String path,
        long totalItems,
        double averageQuality,
        Map<ProcessingLevel, LevelStats> byLevel,
        long benchmarkCount,
        double benchmarkPercentage
) {

    public DatabaseStats {
        byLevel = Collections.unmodifiableMap(new EnumMap<>(byLevel));
    }

    public static DatabaseStats of(TargetDatabase database, Map<ProcessingLevel, LevelTally> tallies) {
        Map<ProcessingLevel, LevelTally> complete = complete(tallies);
        long total = complete.values().stream().mapToLong(LevelTally::count).sum();
        double qualitySum = complete.values().stream().mapToDouble(LevelTally::qualitySum).sum();
        Map<ProcessingLevel, LevelStats> byLevel = new EnumMap<>(ProcessingLevel.class);
        complete.forEach((level, tally) -> byLevel.put(level, LevelStats.of(tally, total)));
        long benchmark = complete.get(ProcessingLevel.BENCHMARK).count();
        return new DatabaseStats(database.id(), database.name(), database.filePath(), total,
                total == 0 ? 0.0 : qualitySum / total, byLevel, benchmark, percent(benchmark, total));
    }

    static Map<ProcessingLevel, LevelTally> complete(Map<ProcessingLevel, LevelTally> tallies) {
        Map<ProcessingLevel, LevelTally> complete = new EnumMap<>(ProcessingLevel.class);
        for (ProcessingLevel level : ProcessingLevel.values()) {
            complete.put(level, tallies.getOrDefault(level, LevelTally.empty(level)));
        }
        return complete;
    }

    static double percent(long part, long total) {
        return total == 0 ? 0.0 : part * 100.0 / total;
    }
}
