package com.soccer.graph.cache;

import com.soccer.graph.alias.ResolvedName;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Pass-through cache used when memoization is disabled. Every lookup is a miss.
 */
public class NoOpResolutionCache implements ResolutionCache {

    private final AtomicLong misses = new AtomicLong();

    @Override
    public ResolvedName get(String rawName, Function<String, ResolvedName> resolver) {
        misses.incrementAndGet();
        return resolver.apply(rawName);
    }

    @Override
    public Optional<ResolvedName> getIfPresent(String rawName) {
        return Optional.empty();
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(0, misses.get(), 0, 0);
    }
}
