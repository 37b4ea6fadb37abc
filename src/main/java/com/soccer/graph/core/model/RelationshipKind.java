package com.soccer.graph.core.model;

/**
 * Relationship kinds between graph nodes, with their endpoint kinds and multiplicity.
 */
public enum RelationshipKind {
    PLAYED_HOME(EntityKind.TEAM, EntityKind.MATCH, Multiplicity.ONE_PER_TARGET),
    PLAYED_AWAY(EntityKind.TEAM, EntityKind.MATCH, Multiplicity.ONE_PER_TARGET),
    BELONGS_TO(EntityKind.PLAYER, EntityKind.TEAM, Multiplicity.ONE_PER_SOURCE_REPLACEABLE),
    HOSTED_AT(EntityKind.MATCH, EntityKind.STADIUM, Multiplicity.ONE_PER_SOURCE),
    IN_COMPETITION(EntityKind.MATCH, EntityKind.COMPETITION, Multiplicity.ONE_PER_SOURCE),
    IN_SEASON(EntityKind.MATCH, EntityKind.SEASON, Multiplicity.ONE_PER_SOURCE),
    COMPETES_IN(EntityKind.TEAM, EntityKind.COMPETITION, Multiplicity.MANY);

    private final EntityKind sourceKind;
    private final EntityKind targetKind;
    private final Multiplicity multiplicity;

    RelationshipKind(EntityKind sourceKind, EntityKind targetKind, Multiplicity multiplicity) {
        this.sourceKind = sourceKind;
        this.targetKind = targetKind;
        this.multiplicity = multiplicity;
    }

    public EntityKind sourceKind() {
        return sourceKind;
    }

    public EntityKind targetKind() {
        return targetKind;
    }

    public Multiplicity multiplicity() {
        return multiplicity;
    }
}
