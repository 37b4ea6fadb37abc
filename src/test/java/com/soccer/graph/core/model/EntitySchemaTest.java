package com.soccer.graph.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class EntitySchemaTest {

    @ParameterizedTest
    @DisplayName("Should map node fields to their fill policy")
    @CsvSource({
            "TEAM,name,IDENTITY",
            "TEAM,displayName,FILL_IF_UNSET",
            "TEAM,aliases,ACCUMULATE",
            "PLAYER,name,FILL_IF_UNSET",
            "PLAYER,club,OVERWRITE",
            "PLAYER,overall,OVERWRITE",
            "MATCH,homeGoals,IMMUTABLE",
            "MATCH,competition,IMMUTABLE",
            "MATCH,round,FILL_IF_UNSET",
            "MATCH,homeShots,FILL_IF_UNSET",
            "COMPETITION,type,IMMUTABLE",
            "SEASON,year,IMMUTABLE",
            "STADIUM,capacity,FILL_IF_UNSET"
    })
    void testNodePolicies(EntityKind kind, String field, FieldPolicy expected) {
        assertEquals(expected, EntitySchema.policyFor(kind, field));
    }

    @ParameterizedTest
    @DisplayName("Should map relationship fields to their fill policy")
    @CsvSource({
            "PLAYED_HOME,goalsFor,IMMUTABLE",
            "PLAYED_AWAY,result,IMMUTABLE",
            "PLAYED_HOME,shots,FILL_IF_UNSET",
            "BELONGS_TO,wage,OVERWRITE",
            "IN_COMPETITION,round,FILL_IF_UNSET"
    })
    void testRelationshipPolicies(RelationshipKind kind, String field, FieldPolicy expected) {
        assertEquals(expected, EntitySchema.policyFor(kind, field));
    }

    @Test
    @DisplayName("Should key matches by start time and both teams")
    void testMatchKey() {
        MatchKey key = new MatchKey(LocalDateTime.of(2023, 5, 1, 16, 0), "Flamengo", "Palmeiras");

        assertEquals("2023-05-01T16:00|Flamengo|Palmeiras", key.value());
        assertThrows(IllegalArgumentException.class, () ->
                new MatchKey(LocalDateTime.of(2023, 5, 1, 16, 0), "Flamengo", "Flamengo"));
    }

    @Test
    @DisplayName("Should describe relationship keys with both endpoint labels")
    void testRelationshipKeyToString() {
        RelationshipKey key = new RelationshipKey(RelationshipKind.COMPETES_IN, "Flamengo", "Brasileirão Série A", "2023");

        assertEquals("(Team:Flamengo)-[COMPETES_IN]->(Competition:Brasileirão Série A){2023}", key.toString());
        assertEquals("", RelationshipKey.of(RelationshipKind.IN_SEASON, "m", "s").discriminator());
    }

    @Test
    @DisplayName("Should not allow the identity field of a node to change")
    void testIdentityFieldFixed() {
        GraphNode team = GraphNode.builder(EntityKind.TEAM, "Flamengo").build();

        assertEquals("Flamengo", team.getString(EntitySchema.NAME));
        assertThrows(IllegalArgumentException.class, () -> team.put(EntitySchema.NAME, "Fla"));
    }
}
