package com.soccer.graph.graph;

import java.util.List;

/**
 * Outcome of exporting the store to a graph database.
 *
 * @param nodes         nodes written
 * @param relationships relationships written
 * @param failures      one message per element that could not be written
 */
public record ExportResult(int nodes, int relationships, List<String> failures) {

    public ExportResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
