package com.soccer.graph.core.model;

/**
 * Kinds of nodes held in the graph. Each kind has a graph label and the name
 * of the property that carries its identity key.
 */
public enum EntityKind {
    TEAM("Team", "name"),
    PLAYER("Player", "id"),
    MATCH("Match", "key"),
    COMPETITION("Competition", "name"),
    SEASON("Season", "key"),
    STADIUM("Stadium", "name");

    private final String label;
    private final String identityField;

    EntityKind(String label, String identityField) {
        this.label = label;
        this.identityField = identityField;
    }

    public String label() {
        return label;
    }

    public String identityField() {
        return identityField;
    }
}
