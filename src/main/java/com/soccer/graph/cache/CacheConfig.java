package com.soccer.graph.cache;

/**
 * Configuration for the resolver memo cache.
 *
 * @param maxSize maximum number of entries, or {@link #UNBOUNDED}
 * @param enabled whether memoization is enabled
 */
public record CacheConfig(long maxSize, boolean enabled) {

    public static final long UNBOUNDED = -1;

    public CacheConfig {
        if (maxSize != UNBOUNDED && maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0 or UNBOUNDED, got " + maxSize);
        }
    }

    /**
     * Default: unbounded, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(UNBOUNDED, true);
    }

    public static CacheConfig bounded(long maxSize) {
        return new CacheConfig(maxSize, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(UNBOUNDED, false);
    }

    public boolean unbounded() {
        return maxSize == UNBOUNDED;
    }
}
