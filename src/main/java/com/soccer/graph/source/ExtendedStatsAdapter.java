package com.soccer.graph.source;

import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.ResolvedName;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-match statistics: {@code date, time, home_team, away_team, home_goal?, away_goal?,
 * home_corner, away_corner, home_attack, away_attack, home_shots, away_shots}.
 *
 * <p>Goal columns are ignored; the score comes from the primary sources.</p>
 */
public class ExtendedStatsAdapter implements SourceAdapter<MatchStatsRecord> {

    public static final String NAME = "extended-stats";

    private final AliasResolver teams;

    public ExtendedStatsAdapter(AliasResolver teams) {
        this.teams = Objects.requireNonNull(teams, "teams resolver is required");
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
    public Optional<MatchStatsRecord> map(SourceRow row) {
        String date = row.required("date");
        String time = row.optional("time");
        LocalDateTime startTime = time != null
                ? ValueParsers.parseDateTime("time", date + " " + time.replace('h', ':'))
                : ValueParsers.parseDateTime("date", date);

        ResolvedName home = teams.resolve(row.required("home_team"));
        ResolvedName away = teams.resolve(row.required("away_team"));
        if (home.canonicalName().equals(away.canonicalName())) {
            throw new RowValidationException("away_team",
                    "Home and away team resolve to the same team '" + home.canonicalName() + "'");
        }

        MatchStatsRecord.SideStats homeStats = side(row, "home");
        MatchStatsRecord.SideStats awayStats = side(row, "away");
        if (homeStats.isEmpty() && awayStats.isEmpty()) {
            throw new RowValidationException(null, "Row carries no statistics");
        }
        return Optional.of(new MatchStatsRecord(NAME, row.lineNumber(), startTime, home, away, homeStats, awayStats));
    }

    private static MatchStatsRecord.SideStats side(SourceRow row, String prefix) {
        return new MatchStatsRecord.SideStats(
                count(row, prefix + "_shots"),
                count(row, prefix + "_corner"),
                count(row, prefix + "_attack"));
    }

    private static Integer count(SourceRow row, String column) {
        Integer value = ValueParsers.parseOptionalInt(column, row.optional(column));
        if (value != null && value < 0) {
            throw new RowValidationException(column, column + " must be >= 0, got " + value);
        }
        return value;
    }
}
