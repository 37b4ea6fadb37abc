package com.soccer.graph.graph;

import com.soccer.graph.alias.NameNormalizer;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.Relationship;
import com.soccer.graph.core.model.RelationshipKey;
import com.soccer.graph.core.model.RelationshipKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Hash-keyed in-memory graph with per-node adjacency sets.
 */
public class InMemoryGraphStore implements GraphStore {

    private final Map<EntityKind, Map<String, GraphNode>> nodes = new EnumMap<>(EntityKind.class);
    private final Map<RelationshipKind, Map<RelationshipKey, Relationship>> relationships =
            new EnumMap<>(RelationshipKind.class);
    private final Map<RelationshipKind, Map<String, Set<RelationshipKey>>> outgoing =
            new EnumMap<>(RelationshipKind.class);
    private final Map<RelationshipKind, Map<String, Set<RelationshipKey>>> incoming =
            new EnumMap<>(RelationshipKind.class);
    private final NameNormalizer normalizer;

    public InMemoryGraphStore() {
        this(new NameNormalizer());
    }

    public InMemoryGraphStore(NameNormalizer normalizer) {
        this.normalizer = normalizer;
        for (EntityKind kind : EntityKind.values()) {
            nodes.put(kind, new ConcurrentHashMap<>());
        }
        for (RelationshipKind kind : RelationshipKind.values()) {
            relationships.put(kind, new ConcurrentHashMap<>());
            outgoing.put(kind, new ConcurrentHashMap<>());
            incoming.put(kind, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Optional<GraphNode> findNode(EntityKind kind, String key) {
        return Optional.ofNullable(nodes.get(kind).get(key));
    }

    @Override
    public GraphNode addNode(GraphNode node) {
        GraphNode existing = nodes.get(node.getKind()).putIfAbsent(node.getKey(), node);
        return existing != null ? existing : node;
    }

    @Override
    public boolean removeNode(EntityKind kind, String key) {
        return nodes.get(kind).remove(key) != null;
    }

    @Override
    public Collection<GraphNode> nodes(EntityKind kind) {
        return Collections.unmodifiableCollection(nodes.get(kind).values());
    }

    @Override
    public Optional<Relationship> findRelationship(RelationshipKey key) {
        return Optional.ofNullable(relationships.get(key.kind()).get(key));
    }

    @Override
    public Relationship addRelationship(Relationship relationship) {
        RelationshipKey key = relationship.getKey();
        RelationshipKind kind = key.kind();
        if (!nodes.get(kind.sourceKind()).containsKey(key.sourceKey())) {
            throw new IllegalArgumentException("Missing source node for " + key);
        }
        if (!nodes.get(kind.targetKind()).containsKey(key.targetKey())) {
            throw new IllegalArgumentException("Missing target node for " + key);
        }
        Relationship existing = relationships.get(kind).putIfAbsent(key, relationship);
        if (existing != null) {
            return existing;
        }
        outgoing.get(kind).computeIfAbsent(key.sourceKey(), k -> ConcurrentHashMap.newKeySet()).add(key);
        incoming.get(kind).computeIfAbsent(key.targetKey(), k -> ConcurrentHashMap.newKeySet()).add(key);
        return relationship;
    }

    @Override
    public boolean removeRelationship(RelationshipKey key) {
        Relationship removed = relationships.get(key.kind()).remove(key);
        if (removed == null) {
            return false;
        }
        Set<RelationshipKey> out = outgoing.get(key.kind()).get(key.sourceKey());
        if (out != null) {
            out.remove(key);
        }
        Set<RelationshipKey> in = incoming.get(key.kind()).get(key.targetKey());
        if (in != null) {
            in.remove(key);
        }
        return true;
    }

    @Override
    public List<Relationship> outgoing(RelationshipKind kind, String sourceKey) {
        return resolve(kind, outgoing.get(kind).get(sourceKey));
    }

    @Override
    public List<Relationship> incoming(RelationshipKind kind, String targetKey) {
        return resolve(kind, incoming.get(kind).get(targetKey));
    }

    @Override
    public Collection<Relationship> relationships(RelationshipKind kind) {
        return Collections.unmodifiableCollection(relationships.get(kind).values());
    }

    @Override
    public List<GraphNode> search(EntityKind kind, String text) {
        String folded = normalizer.fold(text, kind);
        if (folded.isEmpty()) {
            return List.of();
        }
        return nodes.get(kind).values().stream()
                .filter(node -> matches(node, folded, kind))
                .sorted(Comparator.comparing(GraphNode::getKey))
                .collect(Collectors.toList());
    }

    @Override
    public int count(EntityKind kind) {
        return nodes.get(kind).size();
    }

    @Override
    public int count(RelationshipKind kind) {
        return relationships.get(kind).size();
    }

    @Override
    public void clear() {
        nodes.values().forEach(Map::clear);
        relationships.values().forEach(Map::clear);
        outgoing.values().forEach(Map::clear);
        incoming.values().forEach(Map::clear);
    }

    private boolean matches(GraphNode node, String folded, EntityKind kind) {
        if (normalizer.fold(node.getString(EntitySchema.NAME), kind).contains(folded)) {
            return true;
        }
        for (String alias : node.getStringSet(EntitySchema.ALIASES)) {
            if (normalizer.fold(alias, kind).contains(folded)) {
                return true;
            }
        }
        return false;
    }

    private List<Relationship> resolve(RelationshipKind kind, Set<RelationshipKey> keys) {
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        Map<RelationshipKey, Relationship> byKey = relationships.get(kind);
        List<Relationship> result = new ArrayList<>(keys.size());
        for (RelationshipKey key : keys) {
            Relationship relationship = byKey.get(key);
            if (relationship != null) {
                result.add(relationship);
            }
        }
        return result;
    }
}
