package com.catalog.quality.normalization;

import com.catalog.quality.store.CatalogDatabase;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Analysis pass run over one database after normalization or on demand.
 */
public interface DatabaseAnalyzer {

    default AnalysisSummary analyze(CatalogDatabase database, Consumer<String> stepListener) {
        return analyze(database, stepListener, () -> false);
    }

    /**
     * @param stepListener  receives each step name as it starts
     * @param stopRequested polled between steps; once true the remaining steps are skipped
     */
    AnalysisSummary analyze(CatalogDatabase database, Consumer<String> stepListener, BooleanSupplier stopRequested);
}
