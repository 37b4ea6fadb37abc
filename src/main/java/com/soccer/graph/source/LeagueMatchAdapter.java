package com.soccer.graph.source;

import com.soccer.graph.alias.AliasResolver;

/**
 * League results: {@code datetime, home_team, home_team_state, away_team,
 * away_team_state, home_goal, away_goal, season, round}.
 */
public class LeagueMatchAdapter extends AbstractMatchAdapter {

    public static final String NAME = "league-matches";

    public LeagueMatchAdapter(AliasResolver teams, AliasResolver stadiums) {
        this(teams, stadiums, CompetitionRef.BRASILEIRAO);
    }

    public LeagueMatchAdapter(AliasResolver teams, AliasResolver stadiums, CompetitionRef competition) {
        super(NAME, competition, teams, stadiums);
    }

    @Override
    protected String homeRegionColumn() {
        return "home_team_state";
    }

    @Override
    protected String awayRegionColumn() {
        return "away_team_state";
    }
}
