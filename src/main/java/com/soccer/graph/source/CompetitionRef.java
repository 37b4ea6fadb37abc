package com.soccer.graph.source;

import com.soccer.graph.core.model.CompetitionType;

import java.util.Objects;

/**
 * The competition a match source belongs to.
 */
public record CompetitionRef(String name, CompetitionType type, String country) {

    public static final CompetitionRef BRASILEIRAO =
            new CompetitionRef("Brasileirão Série A", CompetitionType.LEAGUE, "Brazil");
    public static final CompetitionRef COPA_DO_BRASIL =
            new CompetitionRef("Copa do Brasil", CompetitionType.CUP, "Brazil");
    public static final CompetitionRef LIBERTADORES =
            new CompetitionRef("Copa Libertadores", CompetitionType.INTERNATIONAL, "South America");

    public CompetitionRef {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
    }
}
