package com.soccer.graph.merge;

import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.audit.AuditAction;
import com.soccer.graph.audit.AuditService;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.MatchKey;
import com.soccer.graph.core.model.Relationship;
import com.soccer.graph.core.model.RelationshipKind;
import com.soccer.graph.graph.GraphStore;
import com.soccer.graph.logging.LogContext;
import com.soccer.graph.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Folds a team discovered after ingestion to be an alias of another team into that team.
 *
 * <p>Merge process:</p>
 * <ol>
 *   <li>re-key every match of the source team, merging into any match that already has the new key</li>
 *   <li>move the match's relationships onto the new key</li>
 *   <li>re-point player memberships and competition entries at the target</li>
 *   <li>add the source name and its aliases to the target's alias set</li>
 *   <li>remove the source node</li>
 * </ol>
 */
public class TeamDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(TeamDeduplicator.class);

    static final String ACTOR = "deduplicator";

    private static final List<RelationshipKind> MATCH_OUTGOING = List.of(
            RelationshipKind.IN_COMPETITION, RelationshipKind.IN_SEASON, RelationshipKind.HOSTED_AT);

    private final GraphStore store;
    private final GraphUpserter upserter;
    private final MatchCorrelator correlator;
    private final AuditService auditService;
    private final MetricsService metrics;

    public TeamDeduplicator(GraphUpserter upserter, MatchCorrelator correlator,
                            AuditService auditService, MetricsService metrics) {
        this.upserter = Objects.requireNonNull(upserter, "upserter is required");
        this.store = upserter.store();
        this.correlator = Objects.requireNonNull(correlator, "correlator is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Merges every team whose key resolves to a different team that is already in the store.
     */
    public List<DeduplicationResult> deduplicate(AliasResolver teamResolver) {
        List<DeduplicationResult> results = new ArrayList<>();
        List<String> keys = store.nodes(EntityKind.TEAM).stream()
                .map(GraphNode::getKey)
                .sorted()
                .collect(Collectors.toList());
        for (String key : keys) {
            String canonical = teamResolver.canonicalName(key);
            if (!canonical.equals(key) && store.findNode(EntityKind.TEAM, canonical).isPresent()
                    && store.findNode(EntityKind.TEAM, key).isPresent()) {
                results.add(merge(key, canonical));
            }
        }
        log.info("dedup.pass.completed teams={} merged={}", keys.size(), results.stream()
                .filter(DeduplicationResult::isSuccess).count());
        return results;
    }

    /**
     * Folds {@code sourceTeam} into {@code targetTeam}.
     */
    public DeduplicationResult merge(String sourceTeam, String targetTeam) {
        try (LogContext ctx = LogContext.forDeduplication(sourceTeam, targetTeam)) {
            log.info("dedup.starting source='{}' target='{}'", sourceTeam, targetTeam);
            if (sourceTeam.equals(targetTeam)) {
                return DeduplicationResult.failure(sourceTeam, targetTeam, "Cannot merge a team into itself");
            }
            Optional<GraphNode> sourceNode = store.findNode(EntityKind.TEAM, sourceTeam);
            Optional<GraphNode> targetNode = store.findNode(EntityKind.TEAM, targetTeam);
            if (sourceNode.isEmpty()) {
                return DeduplicationResult.failure(sourceTeam, targetTeam, "Source team not found: " + sourceTeam);
            }
            if (targetNode.isEmpty()) {
                return DeduplicationResult.failure(sourceTeam, targetTeam, "Target team not found: " + targetTeam);
            }

            Counts counts = new Counts();
            List<String> matchKeys = new ArrayList<>();
            store.outgoing(RelationshipKind.PLAYED_HOME, sourceTeam).forEach(r -> matchKeys.add(r.getTargetKey()));
            store.outgoing(RelationshipKind.PLAYED_AWAY, sourceTeam).forEach(r -> matchKeys.add(r.getTargetKey()));
            for (String matchKey : matchKeys) {
                store.findNode(EntityKind.MATCH, matchKey)
                        .ifPresent(match -> rekeyMatch(match, sourceTeam, targetTeam, counts));
            }

            for (Relationship membership : store.incoming(RelationshipKind.BELONGS_TO, sourceTeam)) {
                UpsertResult moved = upserter.upsertRelationship(RelationshipKind.BELONGS_TO,
                        membership.getSourceKey(), targetTeam, null, membership.getProperties(), ACTOR);
                counts.add(moved);
                counts.migrated++;
            }
            for (GraphNode player : store.nodes(EntityKind.PLAYER)) {
                if (sourceTeam.equals(player.getString(EntitySchema.CLUB))) {
                    upserter.upsertNode(EntityKind.PLAYER, player.getKey(),
                            Map.of(EntitySchema.CLUB, targetTeam), ACTOR);
                }
            }

            for (Relationship entry : store.outgoing(RelationshipKind.COMPETES_IN, sourceTeam)) {
                counts.add(upserter.upsertRelationship(RelationshipKind.COMPETES_IN, targetTeam,
                        entry.getTargetKey(), entry.getDiscriminator(), entry.getProperties(), ACTOR));
                store.removeRelationship(entry.getKey());
                counts.migrated++;
            }

            GraphNode source = sourceNode.get();
            TreeSet<String> aliases = new TreeSet<>(source.getStringSet(EntitySchema.ALIASES));
            aliases.add(sourceTeam);
            Map<String, Object> targetValues = new HashMap<>();
            targetValues.put(EntitySchema.ALIASES, aliases);
            targetValues.put(EntitySchema.REGION, source.get(EntitySchema.REGION));
            counts.add(upserter.upsertNode(EntityKind.TEAM, targetTeam, targetValues, ACTOR));

            store.removeNode(EntityKind.TEAM, sourceTeam);
            correlator.invalidate();

            auditService.record(AuditAction.ENTITIES_MERGED, "Team:" + targetTeam, ACTOR, Map.of(
                    "source", sourceTeam,
                    "matchesRekeyed", counts.rekeyed,
                    "matchesMerged", counts.merged,
                    "matchesDropped", counts.dropped));
            auditService.record(AuditAction.RELATIONSHIPS_MIGRATED, "Team:" + targetTeam, ACTOR, Map.of(
                    "source", sourceTeam,
                    "count", counts.migrated));
            metrics.incrementTeamsDeduplicated();

            log.info("dedup.completed source='{}' target='{}' rekeyed={} merged={} dropped={} migrated={}",
                    sourceTeam, targetTeam, counts.rekeyed, counts.merged, counts.dropped, counts.migrated);
            return DeduplicationResult.success(sourceTeam, targetTeam, counts.rekeyed, counts.merged,
                    counts.dropped, counts.migrated, counts.conflicts);
        }
    }

    private void rekeyMatch(GraphNode match, String sourceTeam, String targetTeam, Counts counts) {
        String oldKey = match.getKey();
        String home = swap(match.getString(EntitySchema.HOME_TEAM), sourceTeam, targetTeam);
        String away = swap(match.getString(EntitySchema.AWAY_TEAM), sourceTeam, targetTeam);

        List<Relationship> attached = new ArrayList<>();
        attached.addAll(store.incoming(RelationshipKind.PLAYED_HOME, oldKey));
        attached.addAll(store.incoming(RelationshipKind.PLAYED_AWAY, oldKey));
        for (RelationshipKind kind : MATCH_OUTGOING) {
            attached.addAll(store.outgoing(kind, oldKey));
        }

        if (home.equals(away)) {
            log.warn("dedup.match.dropped match='{}' reason='both sides resolve to {}'", oldKey, home);
            auditService.record(AuditAction.RELATIONSHIPS_MIGRATED, "Match:" + oldKey, ACTOR,
                    Map.of("dropped", true, "team", home));
            attached.forEach(r -> store.removeRelationship(r.getKey()));
            store.removeNode(EntityKind.MATCH, oldKey);
            counts.dropped++;
            return;
        }

        String newKey = new MatchKey(match.getDateTime(EntitySchema.START_TIME), home, away).value();
        boolean collides = store.findNode(EntityKind.MATCH, newKey).isPresent();
        Map<String, Object> values = new HashMap<>(match.getProperties());
        values.remove(EntitySchema.KEY);
        values.put(EntitySchema.HOME_TEAM, home);
        values.put(EntitySchema.AWAY_TEAM, away);
        counts.add(upserter.upsertNode(EntityKind.MATCH, newKey, values, ACTOR));

        for (Relationship relationship : attached) {
            boolean fromMatch = relationship.getSourceKey().equals(oldKey);
            String from = fromMatch ? newKey : swap(relationship.getSourceKey(), sourceTeam, targetTeam);
            String to = fromMatch ? relationship.getTargetKey() : newKey;
            counts.add(upserter.upsertRelationship(relationship.getKind(), from, to,
                    relationship.getDiscriminator(), relationship.getProperties(), ACTOR));
            store.removeRelationship(relationship.getKey());
            counts.migrated++;
        }
        store.removeNode(EntityKind.MATCH, oldKey);

        if (collides) {
            counts.merged++;
            log.info("dedup.match.merged from='{}' into='{}'", oldKey, newKey);
        } else {
            counts.rekeyed++;
            log.debug("dedup.match.rekeyed from='{}' to='{}'", oldKey, newKey);
        }
    }

    private static String swap(String team, String sourceTeam, String targetTeam) {
        return sourceTeam.equals(team) ? targetTeam : team;
    }

    private static final class Counts {
        int rekeyed;
        int merged;
        int dropped;
        int migrated;
        final List<MergeConflict> conflicts = new ArrayList<>();

        void add(UpsertResult result) {
            conflicts.addAll(result.conflicts());
        }
    }
}
