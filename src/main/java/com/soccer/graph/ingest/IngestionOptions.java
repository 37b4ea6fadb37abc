package com.soccer.graph.ingest;

import com.soccer.graph.cache.CacheConfig;
import com.soccer.graph.lock.LockConfig;
import com.soccer.graph.source.PlayerRosterAdapter;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for an ingestion run: worker pool size, locking, resolver caching,
 * the correlation window for enrichment rows and the roster nationality filter.
 */
public class IngestionOptions {

    private static final int DEFAULT_PARALLELISM = 4;
    private static final Duration DEFAULT_CORRELATION_WINDOW = Duration.ofHours(24);

    private final int parallelism;
    private final LockConfig lockConfig;
    private final CacheConfig cacheConfig;
    private final Duration correlationWindow;
    private final String rosterNationality;

    private IngestionOptions(Builder builder) {
        this.parallelism = builder.parallelism;
        this.lockConfig = builder.lockConfig;
        this.cacheConfig = builder.cacheConfig;
        this.correlationWindow = builder.correlationWindow;
        this.rosterNationality = builder.rosterNationality;
    }

    public int getParallelism() {
        return parallelism;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public Duration getCorrelationWindow() {
        return correlationWindow;
    }

    /**
     * Nationality kept by the roster adapter, or null to keep every player.
     */
    public String getRosterNationality() {
        return rosterNationality;
    }

    public static IngestionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int parallelism = DEFAULT_PARALLELISM;
        private LockConfig lockConfig = LockConfig.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private Duration correlationWindow = DEFAULT_CORRELATION_WINDOW;
        private String rosterNationality = PlayerRosterAdapter.DEFAULT_NATIONALITY;

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = Objects.requireNonNull(lockConfig, "lockConfig is required");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder correlationWindow(Duration correlationWindow) {
            Objects.requireNonNull(correlationWindow, "correlationWindow is required");
            if (correlationWindow.isNegative()) {
                throw new IllegalArgumentException("correlationWindow must not be negative");
            }
            this.correlationWindow = correlationWindow;
            return this;
        }

        public Builder rosterNationality(String rosterNationality) {
            this.rosterNationality = rosterNationality;
            return this;
        }

        public IngestionOptions build() {
            return new IngestionOptions(this);
        }
    }
}
