package com.catalog.quality.duplicate;

import com.catalog.quality.audit.AuditAction;
import com.catalog.quality.audit.AuditEntry;
import com.catalog.quality.audit.AuditService;
import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.core.model.NormalizedRecord;
import com.catalog.quality.error.ConflictException;
import com.catalog.quality.error.NotFoundException;
import com.catalog.quality.error.UpstreamException;
import com.catalog.quality.lock.EntityLock;
import com.catalog.quality.lock.LocalEntityLock;
import com.catalog.quality.metrics.NoOpMetricsService;
import com.catalog.quality.store.InMemoryCatalogDatabase;
import com.catalog.quality.store.InMemoryCatalogDatabaseProvider;
import com.catalog.quality.store.InMemoryQualityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class DuplicateMergerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final String DB = "/data/catalog.db";

    private InMemoryQualityStore store;
    private InMemoryCatalogDatabaseProvider provider;
    private InMemoryCatalogDatabase database;
    private AuditService audit;
    private List<String> changed;
    private AtomicBoolean normalizing;
    private DuplicateMerger merger;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryQualityStore();
        provider = new InMemoryCatalogDatabaseProvider();
        database = provider.create(DB);
        audit = new AuditService(clock);
        changed = new CopyOnWriteArrayList<>();
        normalizing = new AtomicBoolean();
        merger = merger(store, new LocalEntityLock());
    }

    private DuplicateMerger merger(InMemoryQualityStore groups, EntityLock locks) {
        return new DuplicateMerger(groups, provider, locks, key -> normalizing.get(), List.of(changed::add),
                new NoOpMetricsService(), audit, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private NormalizedRecord seed(String reference, int mergedCount) {
        return database.seed(NormalizedRecord.builder()
                .databaseKey(DB)
                .reference(reference)
                .code("CODE001")
                .normalizedName("болт м8")
                .qualityScore(0.8)
                .mergedCount(mergedCount)
                .createdAt(NOW.minusSeconds(3600))
                .build());
    }

    private DuplicateGroup group(String databaseKey, long masterId, Long... members) {
        return store.insertGroup(DuplicateGroup.builder()
                .databaseKey(databaseKey)
                .detectionMethod(DetectionMethod.EXACT_CODE)
                .similarityScore(1.0)
                .suggestedMasterId(masterId)
                .memberIds(List.of(members))
                .createdAt(NOW)
                .build());
    }

    @Nested
    @DisplayName("Merge")
    class MergeTests {

        @Test
        @DisplayName("Should deactivate members and fold them into the master")
        void testMerge() {
            NormalizedRecord master = seed("r1", 1);
            NormalizedRecord second = seed("r2", 0);
            NormalizedRecord third = seed("r3", 0);
            DuplicateGroup group = group(DB, master.getId(), master.getId(), second.getId(), third.getId());

            MergeResult result = merger.merge(group.getId());

            assertEquals(master.getId(), result.masterId());
            assertEquals(List.of(second.getId(), third.getId()), result.deactivatedIds());
            assertEquals(NOW, result.mergedAt());

            NormalizedRecord folded = database.findById(master.getId()).orElseThrow();
            assertTrue(folded.isActive());
            assertEquals(3, folded.getMergedCount());
            assertFalse(database.findById(second.getId()).orElseThrow().isActive());
            assertFalse(database.findById(third.getId()).orElseThrow().isActive());
            assertEquals(1, database.activeRecords().size());

            DuplicateGroup stored = store.findGroup(group.getId()).orElseThrow();
            assertTrue(stored.isMerged());
            assertEquals(NOW, stored.getMergedAt());
        }

        @Test
        @DisplayName("Should notify listeners and write an audit entry")
        void testSideEffects() {
            NormalizedRecord master = seed("r1", 0);
            NormalizedRecord other = seed("r2", 0);
            DuplicateGroup group = group(DB, master.getId(), master.getId(), other.getId());

            merger.merge(group.getId());

            assertEquals(List.of(DB), changed);
            List<AuditEntry> entries = audit.entriesByAction(AuditAction.GROUP_MERGED);
            assertEquals(1, entries.size());
            assertEquals("group:" + group.getId(), entries.get(0).subject());
            assertEquals(master.getId(), entries.get(0).details().get("masterId"));
        }

        @Test
        @DisplayName("Should skip members that are already inactive")
        void testInactiveMemberSkipped() {
            NormalizedRecord master = seed("r1", 0);
            NormalizedRecord gone = database.seed(seed("r2", 0).toBuilder().active(false).build());
            DuplicateGroup group = group(DB, master.getId(), master.getId(), gone.getId());

            MergeResult result = merger.merge(group.getId());

            assertTrue(result.deactivatedIds().isEmpty());
            assertEquals(0, database.findById(master.getId()).orElseThrow().getMergedCount());
        }
    }

    @Nested
    @DisplayName("Consume once")
    class ConflictTests {

        @Test
        @DisplayName("Should refuse a second merge and leave state unchanged")
        void testAlreadyMerged() {
            NormalizedRecord master = seed("r1", 0);
            NormalizedRecord other = seed("r2", 0);
            DuplicateGroup group = group(DB, master.getId(), master.getId(), other.getId());
            merger.merge(group.getId());

            ConflictException error = assertThrows(ConflictException.class, () -> merger.merge(group.getId()));

            assertEquals(ConflictException.ConflictReason.ALREADY_MERGED, error.getReason());
            assertEquals(1, database.findById(master.getId()).orElseThrow().getMergedCount());
            assertEquals(1, audit.entriesByAction(AuditAction.GROUP_MERGED).size());
            assertEquals(1, changed.size());
        }

        @Test
        @DisplayName("Should refuse a group whose master was merged away")
        void testInactiveMaster() {
            NormalizedRecord master = seed("r1", 0);
            NormalizedRecord other = seed("r2", 0);
            database.update(master.toBuilder().active(false).build());
            DuplicateGroup group = group(DB, master.getId(), master.getId(), other.getId());

            assertThrows(ConflictException.class, () -> merger.merge(group.getId()));
            assertTrue(database.findById(other.getId()).orElseThrow().isActive());
            assertFalse(store.findGroup(group.getId()).orElseThrow().isMerged());
        }

        @Test
        @DisplayName("Should report an unknown group")
        void testUnknownGroup() {
            assertThrows(NotFoundException.class, () -> merger.merge(404));
            assertTrue(changed.isEmpty());
        }

        @Test
        @DisplayName("Should surface an unreachable database without merging")
        void testUnreachableDatabase() {
            DuplicateGroup group = group("/data/missing.db", 1, 1L, 2L);

            assertThrows(UpstreamException.class, () -> merger.merge(group.getId()));
            assertFalse(store.findGroup(group.getId()).orElseThrow().isMerged());
        }
    }

    @Nested
    @DisplayName("Concurrent normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Should refuse to merge while normalization runs on the database")
        void testRefusedWhileRunning() {
            NormalizedRecord master = seed("r1", 0);
            NormalizedRecord other = seed("r2", 0);
            DuplicateGroup group = group(DB, master.getId(), master.getId(), other.getId());
            normalizing.set(true);

            ConflictException error = assertThrows(ConflictException.class, () -> merger.merge(group.getId()));

            assertEquals(ConflictException.ConflictReason.ALREADY_RUNNING, error.getReason());
            assertEquals(List.of(DB), error.getConflicts());
            assertTrue(database.findById(other.getId()).orElseThrow().isActive());
            assertEquals(0, database.findById(master.getId()).orElseThrow().getMergedCount());
            assertFalse(store.findGroup(group.getId()).orElseThrow().isMerged());
            assertTrue(changed.isEmpty());
        }

        @Test
        @DisplayName("Should wait for a batch holding the database lock")
        void testWaitsForDatabaseLock() throws Exception {
            NormalizedRecord master = seed("r1", 0);
            NormalizedRecord other = seed("r2", 0);
            DuplicateGroup group = group(DB, master.getId(), master.getId(), other.getId());
            LocalEntityLock locks = new LocalEntityLock();
            DuplicateMerger locked = merger(store, locks);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                locks.lock(EntityLock.databaseKey(DB));
                Future<MergeResult> pending;
                try {
                    pending = executor.submit(() -> locked.merge(group.getId()));
                    Thread.sleep(100);
                    assertFalse(pending.isDone());
                    assertTrue(database.findById(other.getId()).orElseThrow().isActive());
                } finally {
                    locks.unlock(EntityLock.databaseKey(DB));
                }
                assertEquals(List.of(other.getId()), pending.get(5, TimeUnit.SECONDS).deactivatedIds());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Failure")
    class FailureTests {

        @Test
        @DisplayName("Should restore every record when marking the group fails")
        void testGroupUpdateFailure() {
            InMemoryQualityStore failing = spy(new InMemoryQualityStore());
            NormalizedRecord master = seed("r1", 2);
            NormalizedRecord second = seed("r2", 0);
            NormalizedRecord third = seed("r3", 0);
            DuplicateGroup group = failing.insertGroup(DuplicateGroup.builder()
                    .databaseKey(DB)
                    .detectionMethod(DetectionMethod.EXACT_CODE)
                    .similarityScore(1.0)
                    .suggestedMasterId(master.getId())
                    .memberIds(List.of(master.getId(), second.getId(), third.getId()))
                    .createdAt(NOW)
                    .build());
            doThrow(new IllegalStateException("store down")).when(failing).updateGroup(any());

            assertThrows(IllegalStateException.class, () -> merger(failing, new LocalEntityLock()).merge(group.getId()));

            NormalizedRecord restored = database.findById(master.getId()).orElseThrow();
            assertEquals(2, restored.getMergedCount());
            assertEquals(master.getUpdatedAt(), restored.getUpdatedAt());
            assertTrue(database.findById(second.getId()).orElseThrow().isActive());
            assertTrue(database.findById(third.getId()).orElseThrow().isActive());
            assertEquals(3, database.activeRecords().size());
            assertFalse(failing.findGroup(group.getId()).orElseThrow().isMerged());
            assertTrue(changed.isEmpty());
            assertTrue(audit.entriesByAction(AuditAction.GROUP_MERGED).isEmpty());
        }
    }
}
