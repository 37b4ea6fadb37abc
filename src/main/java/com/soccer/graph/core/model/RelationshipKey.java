package com.soccer.graph.core.model;

import java.util.Objects;

/**
 * Identity of a relationship. The discriminator is empty for kinds that allow a
 * single edge between two nodes.
 */
public record RelationshipKey(RelationshipKind kind, String sourceKey, String targetKey, String discriminator) {

    public RelationshipKey {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(sourceKey, "sourceKey is required");
        Objects.requireNonNull(targetKey, "targetKey is required");
        discriminator = discriminator != null ? discriminator : "";
    }

    public static RelationshipKey of(RelationshipKind kind, String sourceKey, String targetKey) {
        return new RelationshipKey(kind, sourceKey, targetKey, "");
    }

    @Override
    public String toString() {
        String base = "(" + kind.sourceKind().label() + ":" + sourceKey + ")-[" + kind + "]->("
                + kind.targetKind().label() + ":" + targetKey + ")";
        return discriminator.isEmpty() ? base : base + "{" + discriminator + "}";
    }
}
