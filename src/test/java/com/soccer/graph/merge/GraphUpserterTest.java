package com.soccer.graph.merge;

import com.soccer.graph.audit.AuditAction;
import com.soccer.graph.audit.AuditService;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.RelationshipKey;
import com.soccer.graph.core.model.RelationshipKind;
import com.soccer.graph.graph.InMemoryGraphStore;
import com.soccer.graph.lock.LocalKeyLock;
import com.soccer.graph.metrics.NoOpMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphUpserter Tests")
class GraphUpserterTest {

    private static final String MATCH = "2023-05-01T16:00|Flamengo|Palmeiras";

    private InMemoryGraphStore store;
    private AuditService auditService;
    private GraphUpserter upserter;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        auditService = new AuditService();
        upserter = new GraphUpserter(store, new LocalKeyLock(), auditService, new NoOpMetricsService());
    }

    private GraphNode node(EntityKind kind, String key) {
        return store.findNode(kind, key).orElseThrow();
    }

    @Nested
    @DisplayName("Node field policies")
    class NodePolicyTests {

        @Test
        @DisplayName("Should create a node and audit its creation")
        void testCreate() {
            UpsertResult result = upserter.upsertNode(EntityKind.TEAM, "Flamengo",
                    Map.of(EntitySchema.REGION, "RJ"), "league-matches");

            assertEquals(MergeOutcome.CREATED, result.outcome());
            assertEquals("RJ", node(EntityKind.TEAM, "Flamengo").getString(EntitySchema.REGION));
            assertEquals("league-matches", node(EntityKind.TEAM, "Flamengo").getCreatedBy());
            assertEquals(1, auditService.getEntriesForSubject("Team:Flamengo").size());
            assertEquals(AuditAction.ENTITY_CREATED, auditService.getEntriesForSubject("Team:Flamengo").get(0).action());
        }

        @Test
        @DisplayName("Should keep the first value of an immutable field and report one conflict")
        void testImmutableConflict() {
            upserter.upsertNode(EntityKind.MATCH, MATCH,
                    Map.of(EntitySchema.HOME_GOALS, 2, EntitySchema.AWAY_GOALS, 1), "league-matches");

            UpsertResult result = upserter.upsertNode(EntityKind.MATCH, MATCH,
                    Map.of(EntitySchema.HOME_GOALS, 3, EntitySchema.AWAY_GOALS, 1), "cup-matches");

            assertEquals(MergeOutcome.UNCHANGED, result.outcome());
            assertEquals(1, result.conflicts().size());
            MergeConflict conflict = result.conflicts().get(0);
            assertEquals("Match", conflict.element());
            assertEquals(EntitySchema.HOME_GOALS, conflict.field());
            assertEquals(2, conflict.storedValue());
            assertEquals(3, conflict.rejectedValue());
            assertEquals("cup-matches", conflict.source());
            assertEquals(Integer.valueOf(2), node(EntityKind.MATCH, MATCH).getInt(EntitySchema.HOME_GOALS));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.MERGE_CONFLICT).size());
            assertEquals("Match:" + MATCH,
                    auditService.getEntriesByAction(AuditAction.MERGE_CONFLICT).get(0).subject());
        }

        @Test
        @DisplayName("Should fill an unset field but never replace a set one")
        void testFillIfUnset() {
            upserter.upsertNode(EntityKind.TEAM, "Flamengo", Map.of(), "a");
            UpsertResult filled = upserter.upsertNode(EntityKind.TEAM, "Flamengo",
                    Map.of(EntitySchema.REGION, "RJ"), "b");
            UpsertResult ignored = upserter.upsertNode(EntityKind.TEAM, "Flamengo",
                    Map.of(EntitySchema.REGION, "SP"), "c");

            assertEquals(MergeOutcome.UPDATED, filled.outcome());
            assertEquals(MergeOutcome.UNCHANGED, ignored.outcome());
            assertTrue(ignored.conflicts().isEmpty());
            assertEquals("RJ", node(EntityKind.TEAM, "Flamengo").getString(EntitySchema.REGION));
        }

        @Test
        @DisplayName("Should overwrite player attributes with the latest value")
        void testOverwrite() {
            upserter.upsertNode(EntityKind.PLAYER, "1", Map.of(EntitySchema.AGE, 20, EntitySchema.NAME, "Gabriel"), "a");
            UpsertResult result = upserter.upsertNode(EntityKind.PLAYER, "1",
                    Map.of(EntitySchema.AGE, 21, EntitySchema.NAME, "Gabigol"), "b");

            assertEquals(MergeOutcome.UPDATED, result.outcome());
            assertEquals(Integer.valueOf(21), node(EntityKind.PLAYER, "1").getInt(EntitySchema.AGE));
            assertEquals("Gabriel", node(EntityKind.PLAYER, "1").getString(EntitySchema.NAME));
        }

        @Test
        @DisplayName("Should accumulate aliases as a sorted set union")
        void testAccumulate() {
            upserter.upsertNode(EntityKind.TEAM, "Corinthians",
                    Map.of(EntitySchema.ALIASES, List.of("Corinthians-SP")), "a");
            upserter.upsertNode(EntityKind.TEAM, "Corinthians",
                    Map.of(EntitySchema.ALIASES, Set.of("Sport Club Corinthians Paulista", "Corinthians-SP")), "b");
            UpsertResult repeat = upserter.upsertNode(EntityKind.TEAM, "Corinthians",
                    Map.of(EntitySchema.ALIASES, "Corinthians-SP"), "c");

            assertEquals(MergeOutcome.UNCHANGED, repeat.outcome());
            assertEquals(List.of("Corinthians-SP", "Sport Club Corinthians Paulista"),
                    List.copyOf(node(EntityKind.TEAM, "Corinthians").getStringSet(EntitySchema.ALIASES)));
        }

        @Test
        @DisplayName("Should ignore null values")
        void testNullIgnored() {
            upserter.upsertNode(EntityKind.TEAM, "Flamengo", Map.of(EntitySchema.REGION, "RJ"), "a");
            Map<String, Object> values = new HashMap<>();
            values.put(EntitySchema.REGION, null);

            UpsertResult result = upserter.upsertNode(EntityKind.TEAM, "Flamengo", values, "b");

            assertEquals(MergeOutcome.UNCHANGED, result.outcome());
            assertEquals("RJ", node(EntityKind.TEAM, "Flamengo").getString(EntitySchema.REGION));
        }

        @Test
        @DisplayName("Should be idempotent for the same values")
        void testIdempotent() {
            Map<String, Object> values = Map.of(EntitySchema.HOME_GOALS, 2, EntitySchema.ROUND, "4");
            upserter.upsertNode(EntityKind.MATCH, MATCH, values, "league-matches");

            UpsertResult again = upserter.upsertNode(EntityKind.MATCH, MATCH, values, "league-matches");

            assertEquals(MergeOutcome.UNCHANGED, again.outcome());
            assertFalse(again.hasConflicts());
            assertEquals(1, store.count(EntityKind.MATCH));
        }
    }

    @Nested
    @DisplayName("Relationship multiplicity")
    class MultiplicityTests {

        @BeforeEach
        void nodes() {
            for (String team : List.of("Flamengo", "Palmeiras", "Santos")) {
                upserter.upsertNode(EntityKind.TEAM, team, Map.of(), "setup");
            }
            upserter.upsertNode(EntityKind.MATCH, MATCH, Map.of(), "setup");
        }

        @Test
        @DisplayName("Should allow one home team per match")
        void testOnePerTarget() {
            upserter.upsertRelationship(RelationshipKind.PLAYED_HOME, "Flamengo", MATCH, null,
                    Map.of(EntitySchema.GOALS_FOR, 2), "a");

            UpsertResult result = upserter.upsertRelationship(RelationshipKind.PLAYED_HOME, "Santos", MATCH, null,
                    Map.of(EntitySchema.GOALS_FOR, 2), "b");

            assertEquals(MergeOutcome.UNCHANGED, result.outcome());
            assertEquals("source", result.conflicts().get(0).field());
            assertEquals("Flamengo", result.conflicts().get(0).storedValue());
            assertEquals(1, store.count(RelationshipKind.PLAYED_HOME));
        }

        @Test
        @DisplayName("Should keep the first stadium of a match")
        void testOnePerSource() {
            upserter.upsertNode(EntityKind.STADIUM, "Maracanã", Map.of(), "setup");
            upserter.upsertNode(EntityKind.STADIUM, "Allianz Parque", Map.of(), "setup");
            upserter.upsertRelationship(RelationshipKind.HOSTED_AT, MATCH, "Maracanã", null, Map.of(), "a");

            UpsertResult result = upserter.upsertRelationship(RelationshipKind.HOSTED_AT, MATCH, "Allianz Parque",
                    null, Map.of(), "b");

            assertEquals(MergeOutcome.UNCHANGED, result.outcome());
            assertEquals("target", result.conflicts().get(0).field());
            assertEquals("Maracanã", store.outgoing(RelationshipKind.HOSTED_AT, MATCH).get(0).getTargetKey());
        }

        @Test
        @DisplayName("Should replace a player's club and report it as an update")
        void testReplaceable() {
            upserter.upsertNode(EntityKind.PLAYER, "1", Map.of(), "setup");
            upserter.upsertRelationship(RelationshipKind.BELONGS_TO, "1", "Santos", null, Map.of(), "a");

            UpsertResult result = upserter.upsertRelationship(RelationshipKind.BELONGS_TO, "1", "Flamengo", null,
                    Map.of(EntitySchema.JERSEY_NUMBER, 9), "b");

            assertEquals(MergeOutcome.UPDATED, result.outcome());
            assertEquals(1, store.count(RelationshipKind.BELONGS_TO));
            assertEquals("Flamengo", store.outgoing(RelationshipKind.BELONGS_TO, "1").get(0).getTargetKey());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RELATIONSHIP_REPLACED).size());
        }

        @Test
        @DisplayName("Should keep one COMPETES_IN edge per season")
        void testMany() {
            upserter.upsertNode(EntityKind.COMPETITION, "Brasileirão Série A", Map.of(), "setup");
            upserter.upsertRelationship(RelationshipKind.COMPETES_IN, "Flamengo", "Brasileirão Série A", "2022",
                    Map.of(), "a");
            upserter.upsertRelationship(RelationshipKind.COMPETES_IN, "Flamengo", "Brasileirão Série A", "2023",
                    Map.of(), "a");
            UpsertResult repeat = upserter.upsertRelationship(RelationshipKind.COMPETES_IN, "Flamengo",
                    "Brasileirão Série A", "2023", Map.of(), "b");

            assertEquals(MergeOutcome.UNCHANGED, repeat.outcome());
            assertEquals(2, store.count(RelationshipKind.COMPETES_IN));
        }

        @Test
        @DisplayName("Should apply field policies to relationship properties")
        void testRelationshipPolicies() {
            upserter.upsertRelationship(RelationshipKind.PLAYED_HOME, "Flamengo", MATCH, null,
                    Map.of(EntitySchema.GOALS_FOR, 2), "league-matches");

            UpsertResult result = upserter.upsertRelationship(RelationshipKind.PLAYED_HOME, "Flamengo", MATCH, null,
                    Map.of(EntitySchema.GOALS_FOR, 1, EntitySchema.SHOTS, 12), "extended-stats");

            assertEquals(MergeOutcome.UPDATED, result.outcome());
            assertEquals(1, result.conflicts().size());
            assertEquals(EntitySchema.GOALS_FOR, result.conflicts().get(0).field());
            var played = store.findRelationship(RelationshipKey.of(RelationshipKind.PLAYED_HOME, "Flamengo", MATCH))
                    .orElseThrow();
            assertEquals(Integer.valueOf(2), played.getInt(EntitySchema.GOALS_FOR));
            assertEquals(Integer.valueOf(12), played.getInt(EntitySchema.SHOTS));
        }

        @Test
        @DisplayName("Should reject a relationship to a missing node")
        void testMissingEndpoint() {
            assertThrows(IllegalArgumentException.class, () -> upserter.upsertRelationship(
                    RelationshipKind.PLAYED_AWAY, "Grêmio", MATCH, null, Map.of(), "a"));
        }
    }
}
