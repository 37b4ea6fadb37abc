package com.soccer.graph.core.model;

/**
 * How many relationships of one kind a node may take part in.
 */
public enum Multiplicity {
    /** Any number of edges; identity includes the discriminator. */
    MANY,
    /** At most one outgoing edge per source node; a different target is a conflict. */
    ONE_PER_SOURCE,
    /** At most one outgoing edge per source node; a different target replaces the old edge. */
    ONE_PER_SOURCE_REPLACEABLE,
    /** At most one incoming edge per target node. */
    ONE_PER_TARGET
}
