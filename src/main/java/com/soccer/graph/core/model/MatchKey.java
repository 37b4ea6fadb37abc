package com.soccer.graph.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Identity of a match: kick-off time plus the canonical home and away team names.
 */
public record MatchKey(LocalDateTime startTime, String homeTeam, String awayTeam) {

    public MatchKey {
        Objects.requireNonNull(startTime, "startTime is required");
        Objects.requireNonNull(homeTeam, "homeTeam is required");
        Objects.requireNonNull(awayTeam, "awayTeam is required");
        if (homeTeam.equals(awayTeam)) {
            throw new IllegalArgumentException("Home and away team must differ: " + homeTeam);
        }
    }

    /**
     * String form used as the node key, e.g. {@code 2023-05-01T16:00|Flamengo|Palmeiras}.
     */
    public String value() {
        return startTime + "|" + homeTeam + "|" + awayTeam;
    }

    @Override
    public String toString() {
        return value();
    }
}
