package com.catalog.quality.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LocalEntityLockTest {

    @Test
    @DisplayName("Should run the action and release the lock")
    void testWithLock() {
        LocalEntityLock lock = new LocalEntityLock();

        assertEquals("done", lock.withLock("group:1", () -> "done"));
        assertEquals("again", lock.withLock("group:1", () -> "again"));
    }

    @Test
    @DisplayName("Should be re-entrant for the holding thread")
    void testReentrant() {
        LocalEntityLock lock = new LocalEntityLock();

        String result = lock.withLock("record:a#1", () -> lock.withLock("record:a#1", () -> "nested"));

        assertEquals("nested", result);
    }

    @Test
    @DisplayName("Should time out when another thread holds the key")
    void testTimeout() throws Exception {
        LocalEntityLock lock = new LocalEntityLock(new LockConfig(50));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> {
                lock.lock("group:7");
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("group:7");
                }
            });
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertThrows(LockAcquisitionException.class, () -> lock.lock("group:7"));
            assertDoesNotThrow(() -> lock.withLock("group:8", () -> 1));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should serialize concurrent holders of one key")
    void testMutualExclusion() throws Exception {
        LocalEntityLock lock = new LocalEntityLock();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 20; i++) {
                executor.submit(() -> lock.withLock("violation:1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    inside.decrementAndGet();
                    return null;
                }));
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, maxInside.get());
    }

    @Test
    @DisplayName("Should ignore unlock of a key not held")
    void testUnlockNotHeld() {
        assertDoesNotThrow(() -> new LocalEntityLock().unlock("group:unknown"));
    }

    @Test
    @DisplayName("Should build keys per entity kind")
    void testKeys() {
        assertEquals("group:3", EntityLock.groupKey(3));
        assertEquals("violation:4", EntityLock.violationKey(4));
        assertEquals("suggestion:5", EntityLock.suggestionKey(5));
        assertEquals("database:/a.db", EntityLock.databaseKey("/a.db"));
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(0));
    }
}
