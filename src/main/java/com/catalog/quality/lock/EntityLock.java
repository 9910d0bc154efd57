package com.catalog.quality.lock;

/**
 * Per-entity mutual exclusion for merge, resolve and apply, and per-database exclusion
 * between normalization batches and record writes. Independent keys never contend.
 */
public interface EntityLock {

    /**
     * Acquires the lock for the key, waiting up to the configured timeout.
     *
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    void lock(String key);

    /**
     * Releases the lock if the current thread holds it.
     */
    void unlock(String key);

    /**
     * Runs the action while holding the key's lock.
     */
    default <T> T withLock(String key, java.util.function.Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }

    static String groupKey(long groupId) {
        return "group:" + groupId;
    }

    static String violationKey(long violationId) {
        return "violation:" + violationId;
    }

    static String suggestionKey(long suggestionId) {
        return "suggestion:" + suggestionId;
    }

    /**
     * Held by a normalization batch and by merge or apply while they write to the database.
     */
    static String databaseKey(String databaseKey) {
        return "database:" + databaseKey;
    }
}
