package com.talent.sourcing.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock using one {@link ReentrantLock} per key.
 * A key's lock object lives until {@link #forget(String)} drops it.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.timeoutMs());
        try {
            while (true) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                boolean acquired = lock.tryLock(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (!acquired) {
                    throw new LockAcquisitionException(
                            "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
                }
                if (locks.get(key) == lock) {
                    log.trace("lock.acquired key={} holds={}", key, lock.getHoldCount());
                    return true;
                }
                // forgotten between lookup and acquire
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
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

    @Override
    public void forget(String key) {
        ReentrantLock removed = locks.computeIfPresent(key,
                (k, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
        log.trace("lock.forgotten key={} kept={}", key, removed != null);
    }

    /**
     * Returns the number of keys that currently have a lock object.
     */
    public int trackedKeys() {
        return locks.size();
    }
}
