package com.soccer.graph.merge;

import java.util.List;

/**
 * Result of folding one team into another.
 *
 * @param matchesRekeyed        matches moved to a new key that did not exist yet
 * @param matchesMerged         matches whose new key collided with an existing match
 * @param matchesDropped        matches between the two teams, which cannot survive the fold
 * @param relationshipsMigrated relationships re-pointed at the target team or a re-keyed match
 */
public record DeduplicationResult(
        boolean success,
        String sourceTeam,
        String targetTeam,
        int matchesRekeyed,
        int matchesMerged,
        int matchesDropped,
        int relationshipsMigrated,
        List<MergeConflict> conflicts,
        String errorMessage
) {
    public DeduplicationResult {
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public static DeduplicationResult success(String sourceTeam, String targetTeam, int matchesRekeyed,
                                              int matchesMerged, int matchesDropped, int relationshipsMigrated,
                                              List<MergeConflict> conflicts) {
        return new DeduplicationResult(true, sourceTeam, targetTeam, matchesRekeyed, matchesMerged,
                matchesDropped, relationshipsMigrated, conflicts, null);
    }

    public static DeduplicationResult failure(String sourceTeam, String targetTeam, String errorMessage) {
        return new DeduplicationResult(false, sourceTeam, targetTeam, 0, 0, 0, 0, List.of(), errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
