package com.soccer.graph.merge;

import java.util.List;

/**
 * Result of upserting a single node or relationship.
 */
public record UpsertResult(MergeOutcome outcome, List<MergeConflict> conflicts) {

    public UpsertResult {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public static UpsertResult created() {
        return new UpsertResult(MergeOutcome.CREATED, List.of());
    }

    public static UpsertResult of(MergeOutcome outcome, List<MergeConflict> conflicts) {
        return new UpsertResult(outcome, conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
