package com.soccer.graph.metrics;

import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.merge.MergeOutcome;

import java.time.Duration;

/**
 * Metrics facade for resolution, merge and ingestion operations.
 * Implementations may use Micrometer or be a no-op.
 */
public interface MetricsService {

    /**
     * Records one node or relationship merge outcome.
     *
     * @param element node kind or relationship kind name
     * @param outcome created, updated or unchanged
     */
    void recordMergeOutcome(String element, MergeOutcome outcome);

    void incrementConflict(String element);

    /**
     * Records a source row that was skipped before merging.
     *
     * @param source adapter name
     * @param reason PARSE, VALIDATION, MALFORMED, CORRELATION_MISS or CORRELATION_AMBIGUOUS
     */
    void incrementRowSkipped(String source, String reason);

    void incrementResolutionFallback(EntityKind kind);

    void recordIngestionDuration(String source, Duration duration);

    void incrementTeamsDeduplicated();
}
