package com.soccer.graph.query;

import java.util.Comparator;

/**
 * One line of a league table.
 *
 * @param position 1-based rank
 */
public record StandingRow(
        int position,
        String team,
        int played,
        int wins,
        int draws,
        int losses,
        int goalsFor,
        int goalsAgainst,
        int points
) {

    /**
     * Points, goal difference and goals scored, all descending, then team name ascending.
     */
    public static final Comparator<StandingRow> ORDER = Comparator
            .comparingInt(StandingRow::points).reversed()
            .thenComparing(Comparator.comparingInt(StandingRow::goalDifference).reversed())
            .thenComparing(Comparator.comparingInt(StandingRow::goalsFor).reversed())
            .thenComparing(StandingRow::team);

    static StandingRow unranked(TeamStatistics stats) {
        return new StandingRow(0, stats.team(), stats.played(), stats.wins(), stats.draws(), stats.losses(),
                stats.goalsFor(), stats.goalsAgainst(), stats.points());
    }

    StandingRow at(int position) {
        return new StandingRow(position, team, played, wins, draws, losses, goalsFor, goalsAgainst, points);
    }

    public int goalDifference() {
        return goalsFor - goalsAgainst;
    }
}
