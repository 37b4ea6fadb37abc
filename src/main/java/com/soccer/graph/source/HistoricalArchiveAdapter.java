package com.soccer.graph.source;

import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.ResolvedName;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Historical archive with venues: {@code id, date?, season, round, home_team, away_team,
 * arena, city?, state?, capacity?}.
 */
public class HistoricalArchiveAdapter implements SourceAdapter<MatchVenueRecord> {

    public static final String NAME = "historical-archive";

    private final AliasResolver teams;
    private final AliasResolver stadiums;

    public HistoricalArchiveAdapter(AliasResolver teams, AliasResolver stadiums) {
        this.teams = Objects.requireNonNull(teams, "teams resolver is required");
        this.stadiums = Objects.requireNonNull(stadiums, "stadiums resolver is required");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordPhase phase() {
        return RecordPhase.CORRELATED;
    }

    @Override
    public Optional<MatchVenueRecord> map(SourceRow row) {
        String date = row.optional("date");
        LocalDateTime startTime = date != null ? ValueParsers.parseDateTime("date", date) : null;
        int season = ValueParsers.parseInt("season", row.required("season"));
        String round = row.required("round");

        ResolvedName home = teams.resolve(row.required("home_team"));
        ResolvedName away = teams.resolve(row.required("away_team"));
        if (home.canonicalName().equals(away.canonicalName())) {
            throw new RowValidationException("away_team",
                    "Home and away team resolve to the same team '" + home.canonicalName() + "'");
        }
        ResolvedName arena = stadiums.resolve(row.required("arena"));

        String state = row.optional("state");
        Integer capacity = ValueParsers.parseOptionalCount("capacity", row.optional("capacity"));
        if (capacity != null && capacity <= 0) {
            throw new RowValidationException("capacity", "Capacity must be > 0, got " + capacity);
        }

        return Optional.of(new MatchVenueRecord(
                NAME,
                row.lineNumber(),
                row.optional("id"),
                startTime,
                season,
                round,
                home,
                away,
                arena,
                row.optional("city"),
                state != null ? state.toUpperCase(Locale.ROOT) : arena.region(),
                capacity));
    }
}
