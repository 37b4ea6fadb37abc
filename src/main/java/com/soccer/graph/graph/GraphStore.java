package com.soccer.graph.graph;

import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.Relationship;
import com.soccer.graph.core.model.RelationshipKey;
import com.soccer.graph.core.model.RelationshipKind;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The unified graph: nodes keyed by (kind, identity key) and relationships keyed by
 * {@link RelationshipKey}, with adjacency lookups in both directions.
 *
 * <p>Implementations are safe for concurrent use. Read-modify-write sequences are
 * serialized by the caller through per-key locks.</p>
 */
public interface GraphStore {

    Optional<GraphNode> findNode(EntityKind kind, String key);

    /**
     * Adds a node unless one with the same kind and key exists.
     *
     * @return the stored node, which is the existing one if there was a race
     */
    GraphNode addNode(GraphNode node);

    /**
     * Removes a node. Its relationships must have been removed or migrated first.
     */
    boolean removeNode(EntityKind kind, String key);

    Collection<GraphNode> nodes(EntityKind kind);

    Optional<Relationship> findRelationship(RelationshipKey key);

    /**
     * Adds a relationship unless one with the same key exists.
     *
     * @return the stored relationship
     * @throws IllegalArgumentException if either endpoint node is missing
     */
    Relationship addRelationship(Relationship relationship);

    boolean removeRelationship(RelationshipKey key);

    /**
     * Relationships of {@code kind} leaving the node with {@code sourceKey}.
     */
    List<Relationship> outgoing(RelationshipKind kind, String sourceKey);

    /**
     * Relationships of {@code kind} entering the node with {@code targetKey}.
     */
    List<Relationship> incoming(RelationshipKind kind, String targetKey);

    Collection<Relationship> relationships(RelationshipKind kind);

    /**
     * Case- and diacritic-insensitive substring search over the names of nodes of one kind.
     */
    List<GraphNode> search(EntityKind kind, String text);

    int count(EntityKind kind);

    int count(RelationshipKind kind);

    void clear();
}
