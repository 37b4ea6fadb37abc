package com.soccer.graph.core.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A node of the unified graph: one team, player, match, competition, season or stadium.
 * The identity key is also stored under the kind's identity property.
 */
public class GraphNode {
    private final EntityKind kind;
    private final String key;
    private final Map<String, Object> properties;
    private final Instant createdAt;
    private Instant updatedAt;
    private final String createdBy;

    private GraphNode(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.key = Objects.requireNonNull(builder.key, "key is required");
        this.properties = new ConcurrentHashMap<>();
        if (builder.properties != null) {
            builder.properties.forEach((field, value) -> {
                if (value != null) {
                    properties.put(field, value);
                }
            });
        }
        this.properties.put(kind.identityField(), key);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = this.createdAt;
        this.createdBy = builder.createdBy;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public boolean has(String field) {
        return properties.containsKey(field);
    }

    public Object get(String field) {
        return properties.get(field);
    }

    public String getString(String field) {
        Object value = properties.get(field);
        return value != null ? value.toString() : null;
    }

    public Integer getInt(String field) {
        Object value = properties.get(field);
        return value instanceof Number n ? n.intValue() : null;
    }

    public int getInt(String field, int defaultValue) {
        Integer value = getInt(field);
        return value != null ? value : defaultValue;
    }

    public LocalDateTime getDateTime(String field) {
        Object value = properties.get(field);
        return value instanceof LocalDateTime dt ? dt : null;
    }

    @SuppressWarnings("unchecked")
    public Set<String> getStringSet(String field) {
        Object value = properties.get(field);
        return value instanceof Set<?> set ? (Set<String>) set : Set.of();
    }

    /**
     * Writes a field. Callers apply the field policy first; the identity field cannot be written.
     */
    public void put(String field, Object value) {
        Objects.requireNonNull(value, "value is required");
        if (kind.identityField().equals(field)) {
            throw new IllegalArgumentException("Identity field '" + field + "' of " + kind + " cannot change");
        }
        properties.put(field, value);
        this.updatedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return kind == that.kind && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, key);
    }

    @Override
    public String toString() {
        return "GraphNode{" +
                "kind=" + kind +
                ", key='" + key + '\'' +
                ", properties=" + properties.size() +
                '}';
    }

    public static Builder builder(EntityKind kind, String key) {
        return new Builder().kind(kind).key(key);
    }

    public static class Builder {
        private EntityKind kind;
        private String key;
        private Map<String, Object> properties;
        private Instant createdAt;
        private String createdBy;

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public GraphNode build() {
            return new GraphNode(this);
        }
    }
}
