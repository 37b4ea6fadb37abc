package com.soccer.graph.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directed, typed edge between two graph nodes, identified by its {@link RelationshipKey}.
 *
 * Endpoints are fixed. The deduplication pass moves a relationship by upserting it
 * between the new endpoints and removing the old one.
 */
public final class Relationship {

    private final RelationshipKey key;
    private final Map<String, Object> properties;
    private final Instant createdAt;
    private final String createdBy;

    private Relationship(Builder builder) {
        this.key = new RelationshipKey(
                Objects.requireNonNull(builder.kind, "kind is required"),
                Objects.requireNonNull(builder.sourceKey, "sourceKey is required"),
                Objects.requireNonNull(builder.targetKey, "targetKey is required"),
                builder.discriminator);
        this.properties = new ConcurrentHashMap<>();
        if (builder.properties != null) {
            builder.properties.forEach((field, value) -> {
                if (value != null) {
                    properties.put(field, value);
                }
            });
        }
        this.createdAt = Instant.now();
        this.createdBy = builder.createdBy;
    }

    public RelationshipKey getKey() {
        return key;
    }

    public RelationshipKind getKind() {
        return key.kind();
    }

    public String getSourceKey() {
        return key.sourceKey();
    }

    public String getTargetKey() {
        return key.targetKey();
    }

    public String getDiscriminator() {
        return key.discriminator();
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Object get(String field) {
        return properties.get(field);
    }

    public Integer getInt(String field) {
        Object value = properties.get(field);
        return value instanceof Number n ? n.intValue() : null;
    }

    public void put(String field, Object value) {
        properties.put(field, Objects.requireNonNull(value, "value is required"));
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return "Relationship{" + key + ", properties=" + properties + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RelationshipKind kind;
        private String sourceKey;
        private String targetKey;
        private String discriminator;
        private Map<String, Object> properties;
        private String createdBy;

        public Builder kind(RelationshipKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder sourceKey(String sourceKey) {
            this.sourceKey = sourceKey;
            return this;
        }

        public Builder targetKey(String targetKey) {
            this.targetKey = targetKey;
            return this;
        }

        public Builder discriminator(String discriminator) {
            this.discriminator = discriminator;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
