package com.catalog.quality.aggregate;

import com.catalog.quality.core.model.LevelTally;
import com.catalog.quality.core.model.ProcessingLevel;

/**
 * @param percentage share of the total item count, on a 0-100 scale
 */
public record LevelStats(ProcessingLevel level, long count, double avgQuality, double percentage) {

    static LevelStats of(LevelTally tally, long totalItems) {
        return new LevelStats(tally.level(), tally.count(), tally.averageQuality(),
                DatabaseStats.percent(tally.count(), totalItems));
    }
}
