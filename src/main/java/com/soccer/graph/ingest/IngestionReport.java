package com.soccer.graph.ingest;

import java.util.List;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Summaries of every source ingested in one run, in the order the sources were given.
 */
public record IngestionReport(String runId, List<IngestionSummary> summaries) {

    public IngestionReport {
        summaries = summaries != null ? List.copyOf(summaries) : List.of();
    }

    public Optional<IngestionSummary> forSource(String source) {
        return summaries.stream().filter(s -> s.source().equals(source)).findFirst();
    }

    public long totalProcessed() {
        return sum(IngestionSummary::processed);
    }

    public long totalCreated() {
        return sum(IngestionSummary::created);
    }

    public long totalSkipped() {
        return sum(IngestionSummary::skipped);
    }

    public long totalConflicts() {
        return sum(IngestionSummary::conflicts);
    }

    public long totalCorrelationMisses() {
        return sum(IngestionSummary::correlationMisses);
    }

    public boolean hasFailures() {
        return summaries.stream().anyMatch(IngestionSummary::hasFailures);
    }

    private long sum(ToLongFunction<IngestionSummary> field) {
        return summaries.stream().mapToLong(field).sum();
    }
}
