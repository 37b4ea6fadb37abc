package com.soccer.graph.merge;

import com.soccer.graph.alias.ResolvedName;
import com.soccer.graph.audit.AuditAction;
import com.soccer.graph.audit.AuditService;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.MatchKey;
import com.soccer.graph.core.model.MatchOutcome;
import com.soccer.graph.core.model.RelationshipKind;
import com.soccer.graph.core.model.SeasonKey;
import com.soccer.graph.graph.GraphStore;
import com.soccer.graph.logging.LogContext;
import com.soccer.graph.metrics.MetricsService;
import com.soccer.graph.source.CanonicalRecord;
import com.soccer.graph.source.MatchRecord;
import com.soccer.graph.source.MatchStatsRecord;
import com.soccer.graph.source.MatchVenueRecord;
import com.soccer.graph.source.PlayerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges canonical records into the graph.
 *
 * <p>A match record touches both teams, the match, its competition and season and the
 * relationships between them. Derived values (competition, season, result) are read back
 * from the stored match so that a conflicting re-delivery cannot fork them.
 * Enrichment records are first correlated onto an existing match and skipped when that
 * fails.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final GraphUpserter upserter;
    private final MatchCorrelator correlator;
    private final AuditService auditService;
    private final MetricsService metrics;

    public MergeEngine(GraphUpserter upserter, MatchCorrelator correlator,
                       AuditService auditService, MetricsService metrics) {
        this.upserter = Objects.requireNonNull(upserter, "upserter is required");
        this.correlator = Objects.requireNonNull(correlator, "correlator is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public GraphStore store() {
        return upserter.store();
    }

    public RecordMergeResult merge(CanonicalRecord record) {
        Objects.requireNonNull(record, "record is required");
        try (LogContext ctx = LogContext.forMerge(record.source(), record.lineNumber())) {
            if (record instanceof MatchRecord match) {
                return mergeMatch(match);
            }
            if (record instanceof MatchStatsRecord stats) {
                return mergeStats(stats);
            }
            if (record instanceof MatchVenueRecord venue) {
                return mergeVenue(venue);
            }
            if (record instanceof PlayerRecord player) {
                return mergePlayer(player);
            }
            throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
        }
    }

    private RecordMergeResult mergeMatch(MatchRecord record) {
        String source = record.source();
        String home = record.homeTeam().canonicalName();
        String away = record.awayTeam().canonicalName();
        if (home.equals(away)) {
            return skip(record, SkipReason.MALFORMED, "Home and away team both resolve to " + home, null);
        }
        if (record.homeGoals() < 0 || record.awayGoals() < 0) {
            return skip(record, SkipReason.MALFORMED, "Negative goal total", null);
        }

        Steps steps = new Steps();
        upsertTeam(steps, record.homeTeam(), source);
        upsertTeam(steps, record.awayTeam(), source);

        String matchKey = new MatchKey(record.startTime(), home, away).value();
        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.START_TIME, record.startTime());
        values.put(EntitySchema.HOME_TEAM, home);
        values.put(EntitySchema.AWAY_TEAM, away);
        values.put(EntitySchema.HOME_GOALS, record.homeGoals());
        values.put(EntitySchema.AWAY_GOALS, record.awayGoals());
        values.put(EntitySchema.SEASON, record.season());
        values.put(EntitySchema.COMPETITION, record.competition().name());
        values.put(EntitySchema.ROUND, record.round());
        values.put(EntitySchema.STAGE, record.stage());
        values.put(EntitySchema.EXTERNAL_ID, record.externalId());
        steps.node(EntityKind.MATCH, matchKey, upserter.upsertNode(EntityKind.MATCH, matchKey, values, source));

        GraphNode match = store().findNode(EntityKind.MATCH, matchKey)
                .orElseThrow(() -> new IllegalStateException("Match vanished during merge: " + matchKey));
        String competition = match.getString(EntitySchema.COMPETITION);
        int season = match.getInt(EntitySchema.SEASON, record.season());
        int homeGoals = match.getInt(EntitySchema.HOME_GOALS, record.homeGoals());
        int awayGoals = match.getInt(EntitySchema.AWAY_GOALS, record.awayGoals());

        Map<String, Object> competitionValues = new HashMap<>();
        if (competition.equals(record.competition().name())) {
            competitionValues.put(EntitySchema.TYPE, record.competition().type());
            competitionValues.put(EntitySchema.COUNTRY, record.competition().country());
        }
        steps.node(EntityKind.COMPETITION, competition,
                upserter.upsertNode(EntityKind.COMPETITION, competition, competitionValues, source));

        String seasonKey = new SeasonKey(season, competition).value();
        steps.node(EntityKind.SEASON, seasonKey, upserter.upsertNode(EntityKind.SEASON, seasonKey,
                Map.of(EntitySchema.YEAR, season, EntitySchema.COMPETITION, competition), source));

        steps.relationship(RelationshipKind.PLAYED_HOME, matchKey, upserter.upsertRelationship(
                RelationshipKind.PLAYED_HOME, home, matchKey, null, played(homeGoals, awayGoals), source));
        steps.relationship(RelationshipKind.PLAYED_AWAY, matchKey, upserter.upsertRelationship(
                RelationshipKind.PLAYED_AWAY, away, matchKey, null, played(awayGoals, homeGoals), source));

        Map<String, Object> placement = new HashMap<>();
        placement.put(EntitySchema.ROUND, record.round());
        placement.put(EntitySchema.STAGE, record.stage());
        steps.relationship(RelationshipKind.IN_COMPETITION, matchKey, upserter.upsertRelationship(
                RelationshipKind.IN_COMPETITION, matchKey, competition, null, placement, source));
        steps.relationship(RelationshipKind.IN_SEASON, matchKey, upserter.upsertRelationship(
                RelationshipKind.IN_SEASON, matchKey, seasonKey, null, Map.of(), source));

        String discriminator = Integer.toString(season);
        for (String team : List.of(home, away)) {
            steps.relationship(RelationshipKind.COMPETES_IN, team, upserter.upsertRelationship(
                    RelationshipKind.COMPETES_IN, team, competition, discriminator,
                    Map.of(EntitySchema.SEASON, season), source));
        }

        if (record.stadium() != null) {
            String stadium = upsertStadium(steps, record.stadium(), null, null, null, source);
            steps.relationship(RelationshipKind.HOSTED_AT, matchKey, upserter.upsertRelationship(
                    RelationshipKind.HOSTED_AT, matchKey, stadium, null, Map.of(), source));
        }
        return steps.toResult(null);
    }

    private RecordMergeResult mergeStats(MatchStatsRecord record) {
        String source = record.source();
        Correlation correlation = correlator.correlate(record.startTime(),
                record.homeTeam().canonicalName(), record.awayTeam().canonicalName());
        if (!correlation.isMatched()) {
            return skipUncorrelated(record, correlation);
        }

        String matchKey = correlation.matchKey();
        GraphNode match = store().findNode(EntityKind.MATCH, matchKey)
                .orElseThrow(() -> new IllegalStateException("Correlated match not found: " + matchKey));

        Steps steps = new Steps();
        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.HOME_SHOTS, record.home().shots());
        values.put(EntitySchema.AWAY_SHOTS, record.away().shots());
        values.put(EntitySchema.HOME_CORNERS, record.home().corners());
        values.put(EntitySchema.AWAY_CORNERS, record.away().corners());
        values.put(EntitySchema.HOME_ATTACKS, record.home().attacks());
        values.put(EntitySchema.AWAY_ATTACKS, record.away().attacks());
        steps.node(EntityKind.MATCH, matchKey, upserter.upsertNode(EntityKind.MATCH, matchKey, values, source));

        int homeGoals = match.getInt(EntitySchema.HOME_GOALS, 0);
        int awayGoals = match.getInt(EntitySchema.AWAY_GOALS, 0);
        Map<String, Object> homeValues = played(homeGoals, awayGoals);
        homeValues.putAll(sideStats(record.home()));
        Map<String, Object> awayValues = played(awayGoals, homeGoals);
        awayValues.putAll(sideStats(record.away()));
        steps.relationship(RelationshipKind.PLAYED_HOME, matchKey, upserter.upsertRelationship(
                RelationshipKind.PLAYED_HOME, match.getString(EntitySchema.HOME_TEAM), matchKey, null,
                homeValues, source));
        steps.relationship(RelationshipKind.PLAYED_AWAY, matchKey, upserter.upsertRelationship(
                RelationshipKind.PLAYED_AWAY, match.getString(EntitySchema.AWAY_TEAM), matchKey, null,
                awayValues, source));

        log.debug("merge.stats.correlated match='{}' confidence={}", matchKey, correlation.confidence());
        return steps.toResult(correlation);
    }

    private RecordMergeResult mergeVenue(MatchVenueRecord record) {
        String source = record.source();
        Correlation correlation = correlator.correlateVenue(record);
        if (!correlation.isMatched()) {
            return skipUncorrelated(record, correlation);
        }

        String matchKey = correlation.matchKey();
        Steps steps = new Steps();
        String stadium = upsertStadium(steps, record.stadium(), record.city(), record.region(),
                record.capacity(), source);

        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.EXTERNAL_ID, record.externalId());
        steps.node(EntityKind.MATCH, matchKey, upserter.upsertNode(EntityKind.MATCH, matchKey, values, source));
        steps.relationship(RelationshipKind.HOSTED_AT, matchKey, upserter.upsertRelationship(
                RelationshipKind.HOSTED_AT, matchKey, stadium, null, Map.of(), source));

        log.debug("merge.venue.correlated match='{}' stadium='{}' confidence={}",
                matchKey, stadium, correlation.confidence());
        return steps.toResult(correlation);
    }

    private RecordMergeResult mergePlayer(PlayerRecord record) {
        String source = record.source();
        String playerKey = Long.toString(record.playerId());
        Steps steps = new Steps();

        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.NAME, record.name());
        values.put(EntitySchema.NATIONALITY, record.nationality());
        values.put(EntitySchema.AGE, record.age());
        values.put(EntitySchema.POSITION, record.position());
        values.put(EntitySchema.OVERALL, record.overall());
        values.put(EntitySchema.POTENTIAL, record.potential());
        values.put(EntitySchema.CLUB, record.club() != null ? record.club().canonicalName() : null);
        values.put(EntitySchema.WAGE, record.wage());
        steps.node(EntityKind.PLAYER, playerKey, upserter.upsertNode(EntityKind.PLAYER, playerKey, values, source));

        if (record.club() != null) {
            String club = upsertTeam(steps, record.club(), source);
            Map<String, Object> contract = new HashMap<>();
            contract.put(EntitySchema.JERSEY_NUMBER, record.jerseyNumber());
            contract.put(EntitySchema.JOINED, record.joined());
            contract.put(EntitySchema.CONTRACT_UNTIL, record.contractUntil());
            contract.put(EntitySchema.WAGE, record.wage());
            steps.relationship(RelationshipKind.BELONGS_TO, playerKey, upserter.upsertRelationship(
                    RelationshipKind.BELONGS_TO, playerKey, club, null, contract, source));
        }
        return steps.toResult(null);
    }

    private String upsertTeam(Steps steps, ResolvedName team, String source) {
        String key = team.canonicalName();
        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.DISPLAY_NAME, key);
        values.put(EntitySchema.REGION, team.region());
        values.put(EntitySchema.ALIASES, aliasesFor(team));
        steps.node(EntityKind.TEAM, key, upserter.upsertNode(EntityKind.TEAM, key, values, source));
        return key;
    }

    private String upsertStadium(Steps steps, ResolvedName stadium, String city, String region,
                                 Integer capacity, String source) {
        String key = stadium.canonicalName();
        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.CITY, city);
        values.put(EntitySchema.REGION, region != null ? region : stadium.region());
        values.put(EntitySchema.CAPACITY, capacity);
        values.put(EntitySchema.ALIASES, aliasesFor(stadium));
        steps.node(EntityKind.STADIUM, key, upserter.upsertNode(EntityKind.STADIUM, key, values, source));
        return key;
    }

    /**
     * The raw spelling, when it differs from the canonical name, joins the alias set.
     */
    private static Set<String> aliasesFor(ResolvedName name) {
        String input = name.input() != null ? name.input().trim() : null;
        if (input == null || input.isEmpty() || input.equals(name.canonicalName())) {
            return Set.of();
        }
        return Set.of(input);
    }

    private static Map<String, Object> played(int goalsFor, int goalsAgainst) {
        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.GOALS_FOR, goalsFor);
        values.put(EntitySchema.GOALS_AGAINST, goalsAgainst);
        values.put(EntitySchema.RESULT, MatchOutcome.of(goalsFor, goalsAgainst));
        return values;
    }

    private static Map<String, Object> sideStats(MatchStatsRecord.SideStats stats) {
        Map<String, Object> values = new HashMap<>();
        values.put(EntitySchema.SHOTS, stats.shots());
        values.put(EntitySchema.CORNERS, stats.corners());
        values.put(EntitySchema.ATTACKS, stats.attacks());
        return values;
    }

    private RecordMergeResult skipUncorrelated(CanonicalRecord record, Correlation correlation) {
        SkipReason reason = correlation.status() == Correlation.Status.AMBIGUOUS
                ? SkipReason.CORRELATION_AMBIGUOUS
                : SkipReason.CORRELATION_MISS;
        String message = reason == SkipReason.CORRELATION_AMBIGUOUS
                ? correlation.candidates() + " matches tie for this row"
                : "No match found for this row";
        auditService.record(AuditAction.CORRELATION_MISSED, record.source() + ":" + record.lineNumber(),
                record.source(), Map.of("reason", reason.name(), "candidates", correlation.candidates()));
        return skip(record, reason, message, correlation);
    }

    private RecordMergeResult skip(CanonicalRecord record, SkipReason reason, String message,
                                   Correlation correlation) {
        metrics.incrementRowSkipped(record.source(), reason.name());
        log.info("merge.skipped source={} line={} reason={} message='{}'",
                record.source(), record.lineNumber(), reason, message);
        return new RecordMergeResult(List.of(), List.of(), reason, message, correlation);
    }

    /**
     * Collects the outcome of every upsert made for one record.
     */
    private static final class Steps {
        private final List<MergeStep> steps = new ArrayList<>();
        private final List<MergeConflict> conflicts = new ArrayList<>();

        void node(EntityKind kind, String key, UpsertResult result) {
            add(kind.label(), key, result);
        }

        void relationship(RelationshipKind kind, String key, UpsertResult result) {
            add(kind.name(), key, result);
        }

        private void add(String element, String key, UpsertResult result) {
            steps.add(new MergeStep(element, key, result.outcome()));
            conflicts.addAll(result.conflicts());
        }

        RecordMergeResult toResult(Correlation correlation) {
            return RecordMergeResult.applied(steps, conflicts, correlation);
        }
    }
}
