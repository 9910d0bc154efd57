package com.catalog.quality.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link EntityLock} backed by one {@link ReentrantLock} per key.
 */
public class LocalEntityLock implements EntityLock {
    private static final Logger log = LoggerFactory.getLogger(LocalEntityLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalEntityLock() {
        this(LockConfig.defaults());
    }

    public LocalEntityLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Could not lock '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("lock.acquired key={}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while locking '" + key + "'", e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("lock.released key={}", key);
        }
    }
}
