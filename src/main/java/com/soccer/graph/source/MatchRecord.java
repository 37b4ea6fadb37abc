package com.soccer.graph.source;

import com.soccer.graph.alias.ResolvedName;
import com.soccer.graph.core.model.MatchKey;
import com.soccer.graph.core.model.SeasonKey;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A played match from a league, cup or international source.
 *
 * @param stadium    resolved venue, or null when the source has none
 * @param round      round label, free text for cups
 * @param stage      knockout stage, or null
 * @param externalId source-specific match id, or null
 */
public record MatchRecord(
        String source,
        long lineNumber,
        LocalDateTime startTime,
        ResolvedName homeTeam,
        ResolvedName awayTeam,
        int homeGoals,
        int awayGoals,
        int season,
        String round,
        String stage,
        CompetitionRef competition,
        ResolvedName stadium,
        String externalId
) implements CanonicalRecord {

    public MatchRecord {
        Objects.requireNonNull(startTime, "startTime is required");
        Objects.requireNonNull(homeTeam, "homeTeam is required");
        Objects.requireNonNull(awayTeam, "awayTeam is required");
        Objects.requireNonNull(competition, "competition is required");
    }

    public MatchKey key() {
        return new MatchKey(startTime, homeTeam.canonicalName(), awayTeam.canonicalName());
    }

    public SeasonKey seasonKey() {
        return new SeasonKey(season, competition.name());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String source = "manual";
        private long lineNumber;
        private LocalDateTime startTime;
        private ResolvedName homeTeam;
        private ResolvedName awayTeam;
        private int homeGoals;
        private int awayGoals;
        private Integer season;
        private String round;
        private String stage;
        private CompetitionRef competition = CompetitionRef.BRASILEIRAO;
        private ResolvedName stadium;
        private String externalId;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder lineNumber(long lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder startTime(LocalDateTime startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder homeTeam(ResolvedName homeTeam) {
            this.homeTeam = homeTeam;
            return this;
        }

        public Builder awayTeam(ResolvedName awayTeam) {
            this.awayTeam = awayTeam;
            return this;
        }

        public Builder score(int homeGoals, int awayGoals) {
            this.homeGoals = homeGoals;
            this.awayGoals = awayGoals;
            return this;
        }

        public Builder season(int season) {
            this.season = season;
            return this;
        }

        public Builder round(String round) {
            this.round = round;
            return this;
        }

        public Builder stage(String stage) {
            this.stage = stage;
            return this;
        }

        public Builder competition(CompetitionRef competition) {
            this.competition = competition;
            return this;
        }

        public Builder stadium(ResolvedName stadium) {
            this.stadium = stadium;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        /**
         * Builds the record. The season defaults to the year of the start time.
         */
        public MatchRecord build() {
            int resolvedSeason = season != null ? season : startTime.getYear();
            return new MatchRecord(source, lineNumber, startTime, homeTeam, awayTeam, homeGoals, awayGoals,
                    resolvedSeason, round, stage, competition, stadium, externalId);
        }
    }
}
