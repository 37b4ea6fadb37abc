package com.soccer.graph.alias;

import com.soccer.graph.cache.CacheConfig;
import com.soccer.graph.cache.CacheStats;
import com.soccer.graph.cache.ResolutionCache;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.metrics.MetricsService;
import com.soccer.graph.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves raw team or stadium names to their canonical display form.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>trim and collapse whitespace; case and diacritics are folded only for comparison</li>
 *   <li>split off a trailing {@code -XX} suffix when {@code XX} is a known region code</li>
 *   <li>look up the region-qualified alias, then the unqualified alias, then the unsplit input</li>
 *   <li>no match: the trimmed input, suffix included, becomes the canonical name (logged at INFO);
 *       the region is still reported, so {@code América-MG} and {@code América-RN} stay apart</li>
 * </ol>
 *
 * <p>Results are memoized per resolver instance, so one resolver should serve one ingestion run.</p>
 *
 * <pre>
 * AliasResolver teams = AliasResolver.builder(AliasCatalog.loadDefault().teams()).build();
 * teams.resolve("Corinthians-SP");   // Corinthians, region SP
 * </pre>
 */
public class AliasResolver {
    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    private final AliasTable table;
    private final RegionCodes regions;
    private final ResolutionCache cache;
    private final MetricsService metrics;
    private final AtomicLong fallbacks = new AtomicLong();

    private AliasResolver(Builder builder) {
        this.table = builder.table;
        this.regions = builder.regions;
        this.cache = ResolutionCache.create(builder.cacheConfig);
        this.metrics = builder.metrics;
    }

    /**
     * Resolves a raw name.
     *
     * @throws IllegalArgumentException if the name is null or blank
     */
    public ResolvedName resolve(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw new IllegalArgumentException("Name to resolve must not be null or blank");
        }
        return cache.get(rawName, this::doResolve);
    }

    /**
     * Canonical display form of a raw name.
     */
    public String canonicalName(String rawName) {
        return resolve(rawName).canonicalName();
    }

    /**
     * Region code carried by a trailing {@code -XX} suffix, if any.
     */
    public Optional<String> extractRegion(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(regions.split(rawName).region());
    }

    /**
     * Known aliases of whatever {@code name} resolves to.
     */
    public Set<String> aliasesOf(String name) {
        return table.aliasesOf(canonicalName(name));
    }

    public boolean isKnown(String rawName) {
        return resolve(rawName).known();
    }

    public EntityKind kind() {
        return table.kind();
    }

    public AliasTable table() {
        return table;
    }

    /**
     * Number of distinct inputs that fell back to the identity mapping.
     */
    public long fallbackCount() {
        return fallbacks.get();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    private ResolvedName doResolve(String rawName) {
        String trimmed = rawName.trim().replaceAll("\\s+", " ");
        RegionCodes.Split split = regions.split(trimmed);

        Optional<String> canonical = Optional.empty();
        if (split.hasRegion()) {
            canonical = table.lookup(split.base(), split.region());
        }
        if (canonical.isEmpty()) {
            canonical = table.lookup(split.base(), null);
        }
        if (canonical.isEmpty() && split.hasRegion()) {
            canonical = table.lookup(trimmed, null);
        }

        if (canonical.isPresent()) {
            return new ResolvedName(canonical.get(), split.region(), rawName, true);
        }

        String identity = split.hasRegion() ? split.base() + "-" + split.region() : trimmed;
        fallbacks.incrementAndGet();
        metrics.incrementResolutionFallback(table.kind());
        log.info("resolve.fallback kind={} input='{}' canonical='{}'", table.kind(), rawName, identity);
        return new ResolvedName(identity, split.region(), rawName, false);
    }

    public static Builder builder(AliasTable table) {
        return new Builder(table);
    }

    public static class Builder {
        private final AliasTable table;
        private RegionCodes regions = RegionCodes.brazilianStates();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metrics = new NoOpMetricsService();

        private Builder(AliasTable table) {
            this.table = Objects.requireNonNull(table, "table is required");
        }

        public Builder regions(RegionCodes regions) {
            this.regions = Objects.requireNonNull(regions, "regions is required");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public AliasResolver build() {
            return new AliasResolver(this);
        }
    }
}
