package com.soccer.graph.source;

import com.soccer.graph.alias.AliasResolver;

/**
 * National cup results: {@code datetime, home_team, away_team, home_goal, away_goal,
 * season, round}. The round is free text ("Quartas de final", "3ª fase").
 */
public class CupMatchAdapter extends AbstractMatchAdapter {

    public static final String NAME = "cup-matches";

    public CupMatchAdapter(AliasResolver teams, AliasResolver stadiums) {
        this(teams, stadiums, CompetitionRef.COPA_DO_BRASIL);
    }

    public CupMatchAdapter(AliasResolver teams, AliasResolver stadiums, CompetitionRef competition) {
        super(NAME, competition, teams, stadiums);
    }
}
