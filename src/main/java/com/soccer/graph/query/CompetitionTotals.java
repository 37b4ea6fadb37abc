package com.soccer.graph.query;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A team's matches and goals across every competition, with a per-competition breakdown.
 *
 * @param byCompetition statistics per competition name, sorted by name
 */
public record CompetitionTotals(
        String team,
        int matches,
        int goalsFor,
        int goalsAgainst,
        Map<String, TeamStatistics> byCompetition
) {
    public CompetitionTotals {
        Map<String, TeamStatistics> sorted = new TreeMap<>();
        if (byCompetition != null) {
            sorted.putAll(byCompetition);
        }
        byCompetition = Collections.unmodifiableMap(sorted);
    }
}
