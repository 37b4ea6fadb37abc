package com.soccer.graph.ingest;

import com.soccer.graph.merge.MergeConflict;
import com.soccer.graph.source.RowIssue;

import java.time.Duration;
import java.util.List;

/**
 * Result of ingesting one source.
 *
 * @param processed         rows that produced a record or a row issue
 * @param created           nodes and relationships created
 * @param updated           nodes and relationships that gained or changed a value
 * @param unchanged         nodes and relationships left as they were
 * @param skipped           rows not merged: row issues plus malformed and uncorrelated records
 * @param filtered          rows outside the adapter's scope, e.g. other nationalities
 * @param correlationMisses enrichment rows with no matching match
 * @param ambiguous         enrichment rows tied between several matches
 * @param rowIssues         parse and validation problems, with line numbers
 * @param conflictDetails   values rejected by immutable fields
 * @param failures          records whose merge threw
 * @param failureMessage    why the whole source failed, or null
 */
public record IngestionSummary(
        String source,
        long processed,
        long created,
        long updated,
        long unchanged,
        long skipped,
        long filtered,
        long correlationMisses,
        long ambiguous,
        List<RowIssue> rowIssues,
        List<MergeConflict> conflictDetails,
        List<RecordFailure> failures,
        String failureMessage,
        Duration duration
) {
    public IngestionSummary {
        rowIssues = rowIssues != null ? List.copyOf(rowIssues) : List.of();
        conflictDetails = conflictDetails != null ? List.copyOf(conflictDetails) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    /**
     * A source that could not be read at all.
     */
    public static IngestionSummary failed(String source, String message, Duration duration) {
        return new IngestionSummary(source, 0, 0, 0, 0, 0, 0, 0, 0,
                List.of(), List.of(), List.of(), message, duration);
    }

    public long conflicts() {
        return conflictDetails.size();
    }

    public boolean isFailed() {
        return failureMessage != null;
    }

    public boolean hasFailures() {
        return isFailed() || !failures.isEmpty();
    }

    /**
     * A record whose merge threw.
     *
     * @param lineNumber line of the record in its source
     * @param message    the error message
     */
    public record RecordFailure(long lineNumber, String message) {}

    @Override
    public String toString() {
        return "IngestionSummary{source=" + source +
                ", processed=" + processed +
                ", created=" + created +
                ", updated=" + updated +
                ", unchanged=" + unchanged +
                ", skipped=" + skipped +
                ", conflicts=" + conflictDetails.size() +
                ", correlationMisses=" + correlationMisses +
                ", failures=" + failures.size() + '}';
    }
}
