package com.soccer.graph.source;

/**
 * When a source's records are merged relative to the others.
 */
public enum RecordPhase {
    /** Records that create matches and players on their own. */
    PRIMARY,
    /** Enrichment records that join onto matches created by primary sources. */
    CORRELATED
}
