package com.soccer.graph.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion per identity key. Merges touching the same key run one at a time;
 * merges on disjoint keys proceed concurrently.
 */
public interface KeyLock {

    /**
     * Acquires the lock for the given key, waiting up to the configured timeout.
     *
     * @return true if acquired
     * @throws LockAcquisitionException if the lock cannot be acquired within the timeout
     */
    boolean tryLock(String key);

    /**
     * Releases the lock for the given key. Does nothing if the current thread does not hold it.
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key}.
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
