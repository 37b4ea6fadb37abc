package com.soccer.graph.core.model;

/**
 * Side a team played on.
 */
public enum MatchSide {
    HOME(RelationshipKind.PLAYED_HOME),
    AWAY(RelationshipKind.PLAYED_AWAY);

    private final RelationshipKind relationshipKind;

    MatchSide(RelationshipKind relationshipKind) {
        this.relationshipKind = relationshipKind;
    }

    public RelationshipKind relationshipKind() {
        return relationshipKind;
    }

    public MatchSide other() {
        return this == HOME ? AWAY : HOME;
    }
}
