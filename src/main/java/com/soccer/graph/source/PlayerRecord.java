package com.soccer.graph.source;

import com.soccer.graph.alias.ResolvedName;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A player from the roster source. Optional values are null when the row leaves them blank.
 *
 * @param club          resolved club, or null for free agents
 * @param wage          weekly wage in whole currency units
 * @param contractUntil last year of the contract
 */
public record PlayerRecord(
        String source,
        long lineNumber,
        long playerId,
        String name,
        String nationality,
        Integer age,
        String position,
        Integer overall,
        Integer potential,
        ResolvedName club,
        Integer wage,
        Integer jerseyNumber,
        LocalDate joined,
        Integer contractUntil
) implements CanonicalRecord {

    public PlayerRecord {
        Objects.requireNonNull(name, "name is required");
    }
}
