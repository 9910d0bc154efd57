package com.catalog.quality.store;

import com.catalog.quality.api.Page;
import com.catalog.quality.api.PageRequest;
import com.catalog.quality.core.model.DuplicateGroup;
import com.catalog.quality.duplicate.DetectionMethod;
import com.catalog.quality.error.NotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryQualityStoreTest {

    private final InMemoryQualityStore store = new InMemoryQualityStore();

    private DuplicateGroup group(String database) {
        return DuplicateGroup.builder()
                .databaseKey(database)
                .detectionMethod(DetectionMethod.EXACT_CODE)
                .similarityScore(1.0)
                .suggestedMasterId(1L)
                .memberIds(List.of(1L, 2L))
                .build();
    }

    @Test
    void assignsIncreasingIds() {
        assertEquals(1, store.insertGroup(group("a")).getId());
        assertEquals(2, store.insertGroup(group("b")).getId());
        assertEquals("b", store.findGroup(2).orElseThrow().getDatabaseKey());
        assertTrue(store.findGroup(3).isEmpty());
    }

    @Test
    void listsFilteredInIdOrder() {
        store.insertGroup(group("a"));
        store.insertGroup(group("b"));
        store.insertGroup(group("a"));

        List<DuplicateGroup> fromA = store.groups(g -> g.getDatabaseKey().equals("a"));

        assertEquals(List.of(1L, 3L), fromA.stream().map(DuplicateGroup::getId).toList());
    }

    @Test
    void pagesOverListing() {
        for (int i = 0; i < 5; i++) {
            store.insertGroup(group("a"));
        }

        Page<DuplicateGroup> page = Page.of(store.groups(g -> true), PageRequest.of(3, 10));

        assertEquals(5, page.total());
        assertEquals(List.of(4L, 5L), page.items().stream().map(DuplicateGroup::getId).toList());
        assertFalse(page.hasNext());
        assertTrue(Page.of(store.groups(g -> true), PageRequest.of(10, 2)).items().isEmpty());
    }

    @Test
    void updateReplacesStoredValue() {
        DuplicateGroup stored = store.insertGroup(group("a"));

        store.updateGroup(stored.toBuilder().merged(true).mergedAt(Instant.EPOCH).build());

        assertTrue(store.findGroup(stored.getId()).orElseThrow().isMerged());
    }

    @Test
    void updateOfUnknownIdFails() {
        DuplicateGroup unknown = group("a").toBuilder().id(99).build();

        assertThrows(NotFoundException.class, () -> store.updateGroup(unknown));
    }
}
