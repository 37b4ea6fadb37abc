package com.soccer.graph.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Field names and per-field merge policies for every node and relationship kind.
 *
 * <p>Fields not listed for a kind default to {@link FieldPolicy#FILL_IF_UNSET}.</p>
 */
public final class EntitySchema {

    // Team / Stadium / Competition
    public static final String NAME = "name";
    public static final String DISPLAY_NAME = "displayName";
    public static final String REGION = "region";
    public static final String ALIASES = "aliases";
    public static final String CITY = "city";
    public static final String CAPACITY = "capacity";
    public static final String COUNTRY = "country";
    public static final String TYPE = "type";

    // Player
    public static final String ID = "id";
    public static final String NATIONALITY = "nationality";
    public static final String AGE = "age";
    public static final String POSITION = "position";
    public static final String OVERALL = "overall";
    public static final String POTENTIAL = "potential";
    public static final String CLUB = "club";
    public static final String WAGE = "wage";

    // Match / Season
    public static final String KEY = "key";
    public static final String START_TIME = "startTime";
    public static final String HOME_TEAM = "homeTeam";
    public static final String AWAY_TEAM = "awayTeam";
    public static final String HOME_GOALS = "homeGoals";
    public static final String AWAY_GOALS = "awayGoals";
    public static final String SEASON = "season";
    public static final String COMPETITION = "competition";
    public static final String ROUND = "round";
    public static final String STAGE = "stage";
    public static final String EXTERNAL_ID = "externalId";
    public static final String YEAR = "year";
    public static final String HOME_SHOTS = "homeShots";
    public static final String AWAY_SHOTS = "awayShots";
    public static final String HOME_CORNERS = "homeCorners";
    public static final String AWAY_CORNERS = "awayCorners";
    public static final String HOME_ATTACKS = "homeAttacks";
    public static final String AWAY_ATTACKS = "awayAttacks";

    // Relationship properties
    public static final String GOALS_FOR = "goalsFor";
    public static final String GOALS_AGAINST = "goalsAgainst";
    public static final String RESULT = "result";
    public static final String SHOTS = "shots";
    public static final String CORNERS = "corners";
    public static final String ATTACKS = "attacks";
    public static final String JERSEY_NUMBER = "jerseyNumber";
    public static final String JOINED = "joined";
    public static final String CONTRACT_UNTIL = "contractUntil";

    private static final Map<EntityKind, Map<String, FieldPolicy>> NODE_POLICIES = new EnumMap<>(EntityKind.class);
    private static final Map<RelationshipKind, Map<String, FieldPolicy>> RELATIONSHIP_POLICIES =
            new EnumMap<>(RelationshipKind.class);

    static {
        NODE_POLICIES.put(EntityKind.TEAM, Map.of(
                NAME, FieldPolicy.IDENTITY,
                DISPLAY_NAME, FieldPolicy.FILL_IF_UNSET,
                REGION, FieldPolicy.FILL_IF_UNSET,
                ALIASES, FieldPolicy.ACCUMULATE));
        NODE_POLICIES.put(EntityKind.PLAYER, Map.of(
                ID, FieldPolicy.IDENTITY,
                NAME, FieldPolicy.FILL_IF_UNSET,
                NATIONALITY, FieldPolicy.FILL_IF_UNSET,
                AGE, FieldPolicy.OVERWRITE,
                POSITION, FieldPolicy.OVERWRITE,
                OVERALL, FieldPolicy.OVERWRITE,
                POTENTIAL, FieldPolicy.OVERWRITE,
                CLUB, FieldPolicy.OVERWRITE,
                WAGE, FieldPolicy.OVERWRITE));
        NODE_POLICIES.put(EntityKind.MATCH, Map.of(
                KEY, FieldPolicy.IDENTITY,
                START_TIME, FieldPolicy.IDENTITY,
                HOME_TEAM, FieldPolicy.IDENTITY,
                AWAY_TEAM, FieldPolicy.IDENTITY,
                HOME_GOALS, FieldPolicy.IMMUTABLE,
                AWAY_GOALS, FieldPolicy.IMMUTABLE,
                SEASON, FieldPolicy.IMMUTABLE,
                COMPETITION, FieldPolicy.IMMUTABLE));
        NODE_POLICIES.put(EntityKind.COMPETITION, Map.of(
                NAME, FieldPolicy.IDENTITY,
                COUNTRY, FieldPolicy.IMMUTABLE,
                TYPE, FieldPolicy.IMMUTABLE));
        NODE_POLICIES.put(EntityKind.SEASON, Map.of(
                KEY, FieldPolicy.IDENTITY,
                YEAR, FieldPolicy.IMMUTABLE,
                COMPETITION, FieldPolicy.IMMUTABLE));
        NODE_POLICIES.put(EntityKind.STADIUM, Map.of(
                NAME, FieldPolicy.IDENTITY,
                ALIASES, FieldPolicy.ACCUMULATE));

        Map<String, FieldPolicy> played = Map.of(
                GOALS_FOR, FieldPolicy.IMMUTABLE,
                GOALS_AGAINST, FieldPolicy.IMMUTABLE,
                RESULT, FieldPolicy.IMMUTABLE);
        RELATIONSHIP_POLICIES.put(RelationshipKind.PLAYED_HOME, played);
        RELATIONSHIP_POLICIES.put(RelationshipKind.PLAYED_AWAY, played);
        RELATIONSHIP_POLICIES.put(RelationshipKind.BELONGS_TO, Map.of(
                JERSEY_NUMBER, FieldPolicy.OVERWRITE,
                JOINED, FieldPolicy.OVERWRITE,
                CONTRACT_UNTIL, FieldPolicy.OVERWRITE,
                WAGE, FieldPolicy.OVERWRITE));
        RELATIONSHIP_POLICIES.put(RelationshipKind.COMPETES_IN, Map.of(
                SEASON, FieldPolicy.IDENTITY));
    }

    private EntitySchema() {
        // Utility class
    }

    /**
     * Policy applied to {@code field} of a node of the given kind.
     */
    public static FieldPolicy policyFor(EntityKind kind, String field) {
        if (kind.identityField().equals(field)) {
            return FieldPolicy.IDENTITY;
        }
        return NODE_POLICIES.getOrDefault(kind, Map.of()).getOrDefault(field, FieldPolicy.FILL_IF_UNSET);
    }

    /**
     * Policy applied to {@code field} of a relationship of the given kind.
     */
    public static FieldPolicy policyFor(RelationshipKind kind, String field) {
        return RELATIONSHIP_POLICIES.getOrDefault(kind, Map.of()).getOrDefault(field, FieldPolicy.FILL_IF_UNSET);
    }
}
