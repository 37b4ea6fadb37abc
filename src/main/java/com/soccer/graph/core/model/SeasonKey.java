package com.soccer.graph.core.model;

import java.util.Objects;

/**
 * Identity of a season: a year within one competition.
 */
public record SeasonKey(int year, String competition) {

    public SeasonKey {
        Objects.requireNonNull(competition, "competition is required");
    }

    public String value() {
        return competition + " " + year;
    }

    @Override
    public String toString() {
        return value();
    }
}
