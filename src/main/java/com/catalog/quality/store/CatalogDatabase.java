package com.catalog.quality.store;

import com.catalog.quality.core.model.LevelTally;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.ProcessingLevel;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One project database: raw items in, normalized records out.
 *
 * <p>Normalization batches, merges and applies write under the database's
 * {@link com.catalog.quality.lock.EntityLock#databaseKey(String) lock}, so they never interleave.</p>
 */
public interface CatalogDatabase {

    /**
     * Database identity, its file path.
     */
    String key();

    RawItemCursor openRawItems();

    /**
     * Inserts or replaces the record with the same raw reference. A new record gets the
     * next id; a replaced one keeps its id, created-at and merge state.
     *
     * @return the stored record
     */
    NormalizedRecord upsert(NormalizedRecord record);

    Optional<NormalizedRecord> findById(long id);

    /**
     * Replaces an existing record by id.
     *
     * @throws com.catalog.quality.error.NotFoundException if no record has that id
     */
    default NormalizedRecord update(NormalizedRecord record) {
        updateAll(List.of(record), () -> { });
        return record;
    }

    /**
     * Replaces existing records as one write: readers of this database see all of the new
     * versions or none of them. {@code alongside} runs inside the same write section once the
     * records are stored; when it throws, the previous versions are put back before the section
     * ends and the exception propagates.
     *
     * @throws com.catalog.quality.error.NotFoundException if any id is unknown; nothing is written
     */
    void updateAll(List<NormalizedRecord> records, Runnable alongside);

    /**
     * Active records ordered by id.
     */
    List<NormalizedRecord> activeRecords();

    /**
     * Per-level count and score sum over active records.
     */
    Map<ProcessingLevel, LevelTally> levelTallies();

    long recordCount();
}
