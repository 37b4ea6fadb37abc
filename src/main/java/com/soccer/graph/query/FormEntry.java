package com.soccer.graph.query;

import com.soccer.graph.core.model.MatchOutcome;

/**
 * One match in a team's recent form.
 *
 * @param home whether the team played at home
 */
public record FormEntry(
        MatchSummary match,
        String opponent,
        boolean home,
        int goalsFor,
        int goalsAgainst,
        MatchOutcome result
) {
}
