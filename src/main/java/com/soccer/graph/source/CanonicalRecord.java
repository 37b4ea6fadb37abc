package com.soccer.graph.source;

/**
 * A source row translated into canonical names and types, ready to merge.
 */
public interface CanonicalRecord {

    /**
     * Name of the adapter that produced this record.
     */
    String source();

    long lineNumber();
}
