package com.soccer.graph.core.model;

/**
 * Format of a competition.
 */
public enum CompetitionType {
    LEAGUE,
    CUP,
    INTERNATIONAL
}
