package com.soccer.graph.query;

/**
 * Goals scored by a team in one season, or over every season when {@code season} is null.
 */
public record TeamGoals(String team, int goals, int matches, Integer season) {

    public double goalsPerMatch() {
        return matches > 0 ? (double) goals / matches : 0.0;
    }
}
