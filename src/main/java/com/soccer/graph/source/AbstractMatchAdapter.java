package com.soccer.graph.source;

import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.ResolvedName;
import com.soccer.graph.alias.RegionCodes;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared mapping for match result sources: {@code datetime, home_team, away_team,
 * home_goal, away_goal, season, round} plus optional {@code stadium} and {@code id} columns.
 * Subclasses name the competition and any extra columns.
 */
public abstract class AbstractMatchAdapter implements SourceAdapter<MatchRecord> {

    protected static final String DATETIME = "datetime";
    protected static final String HOME_TEAM = "home_team";
    protected static final String AWAY_TEAM = "away_team";
    protected static final String HOME_GOAL = "home_goal";
    protected static final String AWAY_GOAL = "away_goal";
    protected static final String SEASON = "season";
    protected static final String ROUND = "round";
    protected static final String STADIUM = "stadium";
    protected static final String ID = "id";

    private final String name;
    private final CompetitionRef competition;
    protected final AliasResolver teams;
    protected final AliasResolver stadiums;
    private final RegionCodes regions = RegionCodes.brazilianStates();

    protected AbstractMatchAdapter(String name, CompetitionRef competition,
                                   AliasResolver teams, AliasResolver stadiums) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.competition = Objects.requireNonNull(competition, "competition is required");
        this.teams = Objects.requireNonNull(teams, "teams resolver is required");
        this.stadiums = Objects.requireNonNull(stadiums, "stadiums resolver is required");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RecordPhase phase() {
        return RecordPhase.PRIMARY;
    }

    public CompetitionRef competition() {
        return competition;
    }

    @Override
    public Optional<MatchRecord> map(SourceRow row) {
        LocalDateTime startTime = ValueParsers.parseDateTime(DATETIME, row.required(DATETIME));
        ResolvedName home = team(row, HOME_TEAM, homeRegionColumn());
        ResolvedName away = team(row, AWAY_TEAM, awayRegionColumn());
        if (home.canonicalName().equals(away.canonicalName())) {
            throw new RowValidationException(AWAY_TEAM,
                    "Home and away team resolve to the same team '" + home.canonicalName() + "'");
        }
        int homeGoals = goals(row, HOME_GOAL);
        int awayGoals = goals(row, AWAY_GOAL);
        String seasonValue = row.optional(SEASON);
        int season = seasonValue != null ? ValueParsers.parseInt(SEASON, seasonValue) : startTime.getYear();
        String stadium = row.optional(STADIUM);

        return Optional.of(new MatchRecord(
                name,
                row.lineNumber(),
                startTime,
                home,
                away,
                homeGoals,
                awayGoals,
                season,
                row.optional(ROUND),
                stage(row),
                competition,
                stadium != null ? stadiums.resolve(stadium) : null,
                row.optional(ID)));
    }

    /**
     * Column holding the home team's region, or null when the schema has none.
     */
    protected String homeRegionColumn() {
        return null;
    }

    protected String awayRegionColumn() {
        return null;
    }

    /**
     * Knockout stage of the match, or null.
     */
    protected String stage(SourceRow row) {
        return null;
    }

    /**
     * Resolves a team column. A region column only counts when the name carries no suffix
     * of its own; it then takes part in the region-qualified alias lookup. The returned
     * input is the column value as written.
     */
    protected ResolvedName team(SourceRow row, String column, String regionColumn) {
        String raw = row.required(column);
        if (regionColumn != null && !regions.split(raw).hasRegion()) {
            String region = row.optional(regionColumn);
            if (region != null && regions.contains(region)) {
                ResolvedName resolved = teams.resolve(raw + "-" + region);
                return new ResolvedName(resolved.canonicalName(), resolved.region(), raw, resolved.known());
            }
        }
        return teams.resolve(raw);
    }

    protected static int goals(SourceRow row, String column) {
        int goals = ValueParsers.parseInt(column, row.required(column));
        if (goals < 0) {
            throw new RowValidationException(column, "Goal total must be >= 0, got " + goals);
        }
        return goals;
    }
}
