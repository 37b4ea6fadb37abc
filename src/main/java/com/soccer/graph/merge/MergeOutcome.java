package com.soccer.graph.merge;

/**
 * What a merge did to one node or relationship.
 */
public enum MergeOutcome {
    CREATED,
    UPDATED,
    UNCHANGED
}
