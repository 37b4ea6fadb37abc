package com.soccer.graph.merge;

/**
 * Why a record reached the merge engine but was not merged.
 */
public enum SkipReason {
    /** Identity cannot be derived, e.g. a team playing itself. */
    MALFORMED,
    /** No existing match satisfies the join predicate. */
    CORRELATION_MISS,
    /** Several matches satisfy the predicate and none is nearest in time. */
    CORRELATION_AMBIGUOUS
}
