package com.soccer.graph.source;

import com.soccer.graph.alias.ResolvedName;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Extended statistics for a match that a primary source already created.
 * Joined onto the match by start time and team names.
 */
public record MatchStatsRecord(
        String source,
        long lineNumber,
        LocalDateTime startTime,
        ResolvedName homeTeam,
        ResolvedName awayTeam,
        SideStats home,
        SideStats away
) implements CanonicalRecord {

    public MatchStatsRecord {
        Objects.requireNonNull(startTime, "startTime is required");
        Objects.requireNonNull(homeTeam, "homeTeam is required");
        Objects.requireNonNull(awayTeam, "awayTeam is required");
        home = home != null ? home : SideStats.EMPTY;
        away = away != null ? away : SideStats.EMPTY;
    }

    /**
     * Statistics of one side. Any value may be null.
     */
    public record SideStats(Integer shots, Integer corners, Integer attacks) {

        public static final SideStats EMPTY = new SideStats(null, null, null);

        public boolean isEmpty() {
            return shots == null && corners == null && attacks == null;
        }
    }
}
