package com.soccer.graph.query;

/**
 * Aggregate record of one team over a set of matches.
 *
 * @param cleanSheets matches in which the team conceded no goal
 */
public record TeamStatistics(
        String team,
        int played,
        int wins,
        int draws,
        int losses,
        int goalsFor,
        int goalsAgainst,
        int cleanSheets
) {

    public static TeamStatistics empty(String team) {
        return new TeamStatistics(team, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Three points per win, one per draw.
     */
    public int points() {
        return 3 * wins + draws;
    }

    public int goalDifference() {
        return goalsFor - goalsAgainst;
    }

    /**
     * Wins as a percentage of matches played, 0 when none were played.
     */
    public double winPercentage() {
        return played > 0 ? wins * 100.0 / played : 0.0;
    }

    public double averageGoalsScored() {
        return played > 0 ? (double) goalsFor / played : 0.0;
    }

    public double averageGoalsConceded() {
        return played > 0 ? (double) goalsAgainst / played : 0.0;
    }
}
