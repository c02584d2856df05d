package com.talent.sourcing.lock;

import java.util.function.Supplier;

/**
 * Per-key lock used to serialize writers of shared pipeline state.
 * Session state mutations take the lock keyed by session id so that concurrent
 * stage workers never lose each other's updates.
 */
public interface DistributedLock {

    /**
     * Attempts to acquire a lock on the given key.
     *
     * @param key the lock key (typically a session id)
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases a lock on the given key.
     *
     * @param key the lock key
     */
    void unlock(String key);

    /**
     * Drops whatever the lock keeps for {@code key} once the resource it guards is gone.
     * A key that is currently held or waited on is left alone.
     *
     * @param key the lock key
     */
    void forget(String key);

    /**
     * Runs the given action while holding the lock for {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
