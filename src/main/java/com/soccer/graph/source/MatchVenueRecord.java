package com.soccer.graph.source;

import com.soccer.graph.alias.ResolvedName;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Venue details for a match from the historical archive. Joined onto an existing
 * match by season, round and teams, or by external id.
 *
 * @param startTime kick-off, or null when the archive has no date
 * @param city      stadium city, or null
 * @param region    stadium region code, or null
 * @param capacity  stadium capacity, or null
 */
public record MatchVenueRecord(
        String source,
        long lineNumber,
        String externalId,
        LocalDateTime startTime,
        int season,
        String round,
        ResolvedName homeTeam,
        ResolvedName awayTeam,
        ResolvedName stadium,
        String city,
        String region,
        Integer capacity
) implements CanonicalRecord {

    public MatchVenueRecord {
        Objects.requireNonNull(homeTeam, "homeTeam is required");
        Objects.requireNonNull(awayTeam, "awayTeam is required");
        Objects.requireNonNull(stadium, "stadium is required");
    }
}
