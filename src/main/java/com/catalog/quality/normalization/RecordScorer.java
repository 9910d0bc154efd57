package com.catalog.quality.normalization;

import com.catalog.quality.core.model.NormalizedRecord;

/**
 * Scores a normalized record. Implementations must be thread-safe.
 */
@FunctionalInterface
public interface RecordScorer {

    RecordScore score(NormalizedRecord record);
}
