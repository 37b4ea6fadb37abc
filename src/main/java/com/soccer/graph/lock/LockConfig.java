package com.soccer.graph.lock;

/**
 * Configuration for per-key locking.
 *
 * @param timeoutMs maximum time to wait for a key lock in milliseconds
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
