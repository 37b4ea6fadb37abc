package com.soccer.graph.lock;

/**
 * Lock that never blocks. For single-threaded ingestion.
 */
public class NoOpKeyLock implements KeyLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
        // no-op
    }
}
