package com.catalog.quality.store;

import com.catalog.quality.core.model.LevelTally;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.core.model.ProcessingLevel;
import com.catalog.quality.core.model.RawCatalogItem;
import com.catalog.quality.error.NotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-resident {@link CatalogDatabase} for embedded use and tests. Multi-record reads and
 * writes go through one read/write lock.
 */
public class InMemoryCatalogDatabase implements CatalogDatabase {

    private final String key;
    private final List<RawCatalogItem> rawItems = new CopyOnWriteArrayList<>();
    private final ConcurrentSkipListMap<Long, NormalizedRecord> records = new ConcurrentSkipListMap<>();
    private final Map<String, Long> idsByReference = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryCatalogDatabase(String key) {
        this.key = key;
    }

    public InMemoryCatalogDatabase addRawItem(RawCatalogItem item) {
        rawItems.add(item);
        return this;
    }

    public InMemoryCatalogDatabase addRawItems(List<RawCatalogItem> items) {
        rawItems.addAll(items);
        return this;
    }

    /**
     * Stores a record as-is, assigning an id when it has none. Used to seed analysis tests.
     */
    public NormalizedRecord seed(NormalizedRecord record) {
        long id = record.getId() > 0 ? record.getId() : ids.incrementAndGet();
        ids.accumulateAndGet(id, Math::max);
        NormalizedRecord stored = record.toBuilder().id(id).databaseKey(key).build();
        records.put(id, stored);
        idsByReference.put(stored.getReference(), id);
        return stored;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public RawItemCursor openRawItems() {
        List<RawCatalogItem> snapshot = List.copyOf(rawItems);
        return new RawItemCursor() {
            private int position;

            @Override
            public List<RawCatalogItem> nextBatch(int max) {
                int end = Math.min(snapshot.size(), position + max);
                List<RawCatalogItem> batch = new ArrayList<>(snapshot.subList(position, end));
                position = end;
                return batch;
            }

            @Override
            public long total() {
                return snapshot.size();
            }
        };
    }

    @Override
    public NormalizedRecord upsert(NormalizedRecord record) {
        lock.writeLock().lock();
        try {
            Long existingId = idsByReference.get(record.getReference());
            NormalizedRecord stored;
            if (existingId == null) {
                stored = record.toBuilder().id(ids.incrementAndGet()).databaseKey(key).build();
            } else {
                NormalizedRecord existing = records.get(existingId);
                stored = record.toBuilder()
                        .id(existingId)
                        .databaseKey(key)
                        .createdAt(existing.getCreatedAt())
                        .updatedAt(Instant.now())
                        .active(existing.isActive())
                        .mergedCount(existing.getMergedCount())
                        .build();
            }
            records.put(stored.getId(), stored);
            idsByReference.put(stored.getReference(), stored.getId());
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<NormalizedRecord> findById(long id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public void updateAll(List<NormalizedRecord> changed, Runnable alongside) {
        lock.writeLock().lock();
        try {
            List<NormalizedRecord> previous = new ArrayList<>(changed.size());
            for (NormalizedRecord record : changed) {
                NormalizedRecord old = records.get(record.getId());
                if (old == null) {
                    throw NotFoundException.of("Record", key + "#" + record.getId());
                }
                previous.add(old);
            }
            try (StoreTransaction tx = new StoreTransaction("update " + changed.size() + " records in " + key)) {
                tx.step("write records", () -> putAll(changed), () -> putAll(previous));
                alongside.run();
                tx.commit();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void putAll(List<NormalizedRecord> values) {
        values.forEach(record -> records.put(record.getId(), record));
    }

    @Override
    public List<NormalizedRecord> activeRecords() {
        lock.readLock().lock();
        try {
            return records.values().stream().filter(NormalizedRecord::isActive).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<ProcessingLevel, LevelTally> levelTallies() {
        lock.readLock().lock();
        try {
            Map<ProcessingLevel, LevelTally> tallies = new EnumMap<>(ProcessingLevel.class);
            for (NormalizedRecord record : records.values()) {
                if (record.isActive()) {
                    tallies.merge(record.getProcessingLevel(),
                            LevelTally.empty(record.getProcessingLevel()).add(record.getQualityScore()),
                            LevelTally::plus);
                }
            }
            return tallies;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long recordCount() {
        return records.size();
    }
}
