package com.soccer.graph.core.model;

/**
 * Result of a match from one team's point of view.
 */
public enum MatchOutcome {
    WIN(3),
    DRAW(1),
    LOSS(0);

    private final int points;

    MatchOutcome(int points) {
        this.points = points;
    }

    public int points() {
        return points;
    }

    /**
     * The outcome seen from the other side of the same match.
     */
    public MatchOutcome opposite() {
        return switch (this) {
            case WIN -> LOSS;
            case LOSS -> WIN;
            case DRAW -> DRAW;
        };
    }

    /**
     * Derives the outcome from goal totals. The only place a result is computed.
     */
    public static MatchOutcome of(int goalsFor, int goalsAgainst) {
        if (goalsFor < 0 || goalsAgainst < 0) {
            throw new IllegalArgumentException(
                    "Goal totals must be >= 0, got " + goalsFor + "-" + goalsAgainst);
        }
        if (goalsFor > goalsAgainst) {
            return WIN;
        }
        return goalsFor == goalsAgainst ? DRAW : LOSS;
    }
}
