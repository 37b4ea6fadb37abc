package com.soccer.graph.graph;

import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.Relationship;
import com.soccer.graph.core.model.RelationshipKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Writes the contents of a {@link GraphStore} to a Cypher graph database.
 *
 * <p>Every node becomes one {@code MERGE} on its label and identity property, every
 * relationship one {@code MERGE} between the matched endpoints. Running the export
 * twice leaves the database unchanged the second time.</p>
 */
public class GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(GraphExporter.class);

    static final String KEY_PARAM = "key";
    static final String SOURCE_PARAM = "source";
    static final String TARGET_PARAM = "target";
    static final String DISCRIMINATOR_PARAM = "discriminator";
    private static final String PROPERTY_PREFIX = "p_";

    private final GraphConnection connection;

    public GraphExporter(GraphConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection is required");
    }

    /**
     * Creates identity indexes for every label and full-text indexes on team, player
     * and stadium names. Existing indexes are left alone.
     */
    public void createSchema() {
        log.info("export.schema.creating graph={}", connection.getGraphName());
        for (EntityKind kind : EntityKind.values()) {
            safeExecute("CREATE INDEX FOR (n:" + kind.label() + ") ON (n." + kind.identityField() + ")");
        }
        safeExecute("CREATE INDEX FOR (m:Match) ON (m.startTime)");
        for (EntityKind kind : List.of(EntityKind.TEAM, EntityKind.PLAYER, EntityKind.STADIUM)) {
            safeExecute("CALL db.idx.fulltext.createNodeIndex('" + kind.label() + "', 'name')");
        }
        log.info("export.schema.created graph={}", connection.getGraphName());
    }

    /**
     * Exports all nodes, then all relationships. Failures are collected, not thrown.
     */
    public ExportResult export(GraphStore store) {
        List<String> failures = new ArrayList<>();
        int nodes = 0;
        int relationships = 0;

        for (EntityKind kind : EntityKind.values()) {
            for (GraphNode node : store.nodes(kind)) {
                try {
                    connection.execute(nodeStatement(node), nodeParams(node));
                    nodes++;
                } catch (RuntimeException e) {
                    failures.add(kind.label() + ":" + node.getKey() + " - " + e.getMessage());
                    log.warn("export.node.failed kind={} key='{}' error={}", kind, node.getKey(), e.getMessage());
                }
            }
        }
        for (RelationshipKind kind : RelationshipKind.values()) {
            for (Relationship relationship : store.relationships(kind)) {
                try {
                    connection.execute(relationshipStatement(relationship), relationshipParams(relationship));
                    relationships++;
                } catch (RuntimeException e) {
                    failures.add(relationship.getKey() + " - " + e.getMessage());
                    log.warn("export.relationship.failed key={} error={}", relationship.getKey(), e.getMessage());
                }
            }
        }

        ExportResult result = new ExportResult(nodes, relationships, failures);
        log.info("export.completed graph={} nodes={} relationships={} failures={}",
                connection.getGraphName(), nodes, relationships, failures.size());
        return result;
    }

    String nodeStatement(GraphNode node) {
        EntityKind kind = node.getKind();
        StringBuilder cypher = new StringBuilder("MERGE (n:")
                .append(kind.label())
                .append(" {")
                .append(kind.identityField())
                .append(": $")
                .append(KEY_PARAM)
                .append("})");
        appendSet(cypher, "n", properties(node.getProperties(), kind.identityField()).keySet());
        return cypher.toString();
    }

    Map<String, Object> nodeParams(GraphNode node) {
        Map<String, Object> params = new HashMap<>();
        params.put(KEY_PARAM, InputSanitizer.requireKey(node.getKind(), node.getKey()));
        properties(node.getProperties(), node.getKind().identityField())
                .forEach((field, value) -> params.put(PROPERTY_PREFIX + field, value));
        return params;
    }

    String relationshipStatement(Relationship relationship) {
        RelationshipKind kind = relationship.getKind();
        EntityKind source = kind.sourceKind();
        EntityKind target = kind.targetKind();
        InputSanitizer.requireIdentifier(kind.name());
        StringBuilder cypher = new StringBuilder()
                .append("MATCH (a:").append(source.label())
                .append(" {").append(source.identityField()).append(": $").append(SOURCE_PARAM).append("}), ")
                .append("(b:").append(target.label())
                .append(" {").append(target.identityField()).append(": $").append(TARGET_PARAM).append("}) ")
                .append("MERGE (a)-[r:").append(kind.name());
        if (!relationship.getDiscriminator().isEmpty()) {
            cypher.append(" {").append(discriminatorField(kind)).append(": $").append(DISCRIMINATOR_PARAM).append('}');
        }
        cypher.append("]->(b)");
        appendSet(cypher, "r", properties(relationship.getProperties(), discriminatorField(kind)).keySet());
        return cypher.toString();
    }

    Map<String, Object> relationshipParams(Relationship relationship) {
        Map<String, Object> params = new HashMap<>();
        params.put(SOURCE_PARAM, relationship.getSourceKey());
        params.put(TARGET_PARAM, relationship.getTargetKey());
        if (!relationship.getDiscriminator().isEmpty()) {
            params.put(DISCRIMINATOR_PARAM, relationship.getDiscriminator());
        }
        properties(relationship.getProperties(), discriminatorField(relationship.getKind()))
                .forEach((field, value) -> params.put(PROPERTY_PREFIX + field, value));
        return params;
    }

    private static String discriminatorField(RelationshipKind kind) {
        return kind == RelationshipKind.COMPETES_IN ? "season" : "discriminator";
    }

    private static void appendSet(StringBuilder cypher, String variable, Collection<String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        cypher.append(" SET ");
        boolean first = true;
        for (String field : fields) {
            InputSanitizer.requireIdentifier(field);
            if (!first) {
                cypher.append(", ");
            }
            cypher.append(variable).append('.').append(field).append(" = $").append(PROPERTY_PREFIX).append(field);
            first = false;
        }
    }

    /**
     * Properties in a stable order with values converted to types the database accepts.
     */
    private static Map<String, Object> properties(Map<String, Object> source, String excluded) {
        Map<String, Object> result = new TreeMap<>();
        source.forEach((field, value) -> {
            if (!field.equals(excluded)) {
                result.put(field, toCypherValue(value));
            }
        });
        return result;
    }

    static Object toCypherValue(Object value) {
        if (value instanceof Temporal || value instanceof Enum<?>) {
            return value.toString();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(Object::toString).sorted().collect(Collectors.toList());
        }
        if (value instanceof String s) {
            return InputSanitizer.requireValueLength(s);
        }
        return value;
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (RuntimeException e) {
            // Index might already exist
            log.debug("export.schema.skipped query={} reason={}", query, e.getMessage());
        }
    }
}
