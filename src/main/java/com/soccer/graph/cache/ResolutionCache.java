package com.soccer.graph.cache;

import com.soccer.graph.alias.ResolvedName;

import java.util.Optional;
import java.util.function.Function;

/**
 * Memo of raw name to resolved name, owned by one resolver.
 */
public interface ResolutionCache {

    /**
     * Returns the cached resolution for {@code rawName}, computing and storing it on a miss.
     */
    ResolvedName get(String rawName, Function<String, ResolvedName> resolver);

    Optional<ResolvedName> getIfPresent(String rawName);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates a cache for the given configuration: Caffeine when enabled, pass-through otherwise.
     */
    static ResolutionCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineResolutionCache(config) : new NoOpResolutionCache();
    }
}
