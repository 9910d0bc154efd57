package com.catalog.quality.duplicate;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a group merge.
 *
 * @param deactivatedIds members folded into the master by this merge
 */
public record MergeResult(long groupId, String databaseKey, long masterId, List<Long> deactivatedIds, Instant mergedAt) {

    public MergeResult {
        deactivatedIds = List.copyOf(deactivatedIds);
    }
}
