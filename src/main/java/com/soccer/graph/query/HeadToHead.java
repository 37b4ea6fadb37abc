package com.soccer.graph.query;

/**
 * Record of two teams against each other, from the point of view of {@code teamA}.
 */
public record HeadToHead(
        String teamA,
        String teamB,
        int matches,
        int aWins,
        int bWins,
        int draws,
        int aGoals,
        int bGoals
) {

    public static HeadToHead empty(String teamA, String teamB) {
        return new HeadToHead(teamA, teamB, 0, 0, 0, 0, 0, 0);
    }

    /**
     * The same record seen from {@code teamB}.
     */
    public HeadToHead mirror() {
        return new HeadToHead(teamB, teamA, matches, bWins, aWins, draws, bGoals, aGoals);
    }
}
