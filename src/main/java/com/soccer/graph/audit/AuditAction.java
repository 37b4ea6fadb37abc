package com.soccer.graph.audit;

/**
 * Types of auditable actions performed on the graph.
 */
public enum AuditAction {
    ENTITY_CREATED,
    ENTITY_UPDATED,
    RELATIONSHIP_CREATED,
    RELATIONSHIP_UPDATED,
    RELATIONSHIP_REPLACED,
    MERGE_CONFLICT,
    CORRELATION_MISSED,
    ENTITIES_MERGED,
    RELATIONSHIPS_MIGRATED
}
