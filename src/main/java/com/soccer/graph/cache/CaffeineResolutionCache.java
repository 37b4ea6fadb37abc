package com.soccer.graph.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.soccer.graph.alias.ResolvedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * Caffeine-backed resolution memo. Unbounded unless the configuration sets a maximum size.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<String, ResolvedName> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().recordStats();
        if (!config.unbounded()) {
            builder.maximumSize(config.maxSize());
        }
        this.cache = builder.build();
        log.debug("CaffeineResolutionCache initialized: maxSize={}",
                config.unbounded() ? "unbounded" : config.maxSize());
    }

    @Override
    public ResolvedName get(String rawName, Function<String, ResolvedName> resolver) {
        return cache.get(rawName, resolver);
    }

    @Override
    public Optional<ResolvedName> getIfPresent(String rawName) {
        return Optional.ofNullable(cache.getIfPresent(rawName));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
