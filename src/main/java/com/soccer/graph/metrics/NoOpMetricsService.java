package com.soccer.graph.metrics;

import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.merge.MergeOutcome;

import java.time.Duration;

/**
 * No-op metrics implementation. Used when no metrics registry is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMergeOutcome(String element, MergeOutcome outcome) {
    }

    @Override
    public void incrementConflict(String element) {
    }

    @Override
    public void incrementRowSkipped(String source, String reason) {
    }

    @Override
    public void incrementResolutionFallback(EntityKind kind) {
    }

    @Override
    public void recordIngestionDuration(String source, Duration duration) {
    }

    @Override
    public void incrementTeamsDeduplicated() {
    }
}
