package com.catalog.quality.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreTransactionTest {

    @Test
    @DisplayName("Should keep all steps on commit")
    void testCommit() {
        List<String> log = new ArrayList<>();
        try (StoreTransaction tx = new StoreTransaction("test")) {
            tx.step("one", () -> log.add("do 1"), () -> log.add("undo 1"));
            tx.step("two", () -> log.add("do 2"), () -> log.add("undo 2"));
            tx.commit();
            assertTrue(tx.isCommitted());
        }
        assertEquals(List.of("do 1", "do 2"), log);
    }

    @Test
    @DisplayName("Should undo completed steps in reverse order when a step fails")
    void testRollbackOnFailure() {
        List<String> log = new ArrayList<>();
        try (StoreTransaction tx = new StoreTransaction("test")) {
            tx.step("one", () -> log.add("do 1"), () -> log.add("undo 1"));
            tx.step("two", () -> log.add("do 2"), () -> log.add("undo 2"));
            assertThrows(IllegalStateException.class, () -> tx.step("three", () -> {
                throw new IllegalStateException("boom");
            }, () -> log.add("undo 3")));
        }
        assertEquals(List.of("do 1", "do 2", "undo 2", "undo 1"), log);
    }

    @Test
    @DisplayName("Should undo steps when closed without commit")
    void testRollbackOnClose() {
        List<String> log = new ArrayList<>();
        try (StoreTransaction tx = new StoreTransaction("test")) {
            tx.step("one", () -> log.add("do 1"), () -> log.add("undo 1"));
        }
        assertEquals(List.of("do 1", "undo 1"), log);
    }

    @Test
    @DisplayName("Should continue undoing when a compensation fails")
    void testFailingCompensation() {
        List<String> log = new ArrayList<>();
        try (StoreTransaction tx = new StoreTransaction("test")) {
            tx.step("one", () -> log.add("do 1"), () -> log.add("undo 1"));
            tx.step("two", () -> log.add("do 2"), () -> {
                throw new IllegalStateException("cannot undo");
            });
        }
        assertEquals(List.of("do 1", "do 2", "undo 1"), log);
    }

    @Test
    @DisplayName("Should refuse steps after commit")
    void testStepAfterCommit() {
        StoreTransaction tx = new StoreTransaction("test");
        tx.commit();
        assertThrows(IllegalStateException.class, () -> tx.step("late", () -> { }, () -> { }));
    }
}
