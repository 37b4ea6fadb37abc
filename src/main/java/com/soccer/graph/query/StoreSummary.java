package com.soccer.graph.query;

import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.RelationshipKind;

import java.util.Map;

/**
 * Node and relationship counts per kind.
 */
public record StoreSummary(Map<EntityKind, Integer> nodes, Map<RelationshipKind, Integer> relationships) {

    public StoreSummary {
        nodes = Map.copyOf(nodes);
        relationships = Map.copyOf(relationships);
    }

    public int nodeCount(EntityKind kind) {
        return nodes.getOrDefault(kind, 0);
    }

    public int relationshipCount(RelationshipKind kind) {
        return relationships.getOrDefault(kind, 0);
    }

    public int totalNodes() {
        return nodes.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalRelationships() {
        return relationships.values().stream().mapToInt(Integer::intValue).sum();
    }
}
