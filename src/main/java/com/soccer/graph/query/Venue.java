package com.soccer.graph.query;

/**
 * Which side of a fixture a team query keeps.
 */
public enum Venue {
    ANY,
    HOME,
    AWAY;

    boolean admits(boolean home) {
        return this == ANY || (this == HOME) == home;
    }
}
