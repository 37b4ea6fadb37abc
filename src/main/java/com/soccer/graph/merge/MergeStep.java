package com.soccer.graph.merge;

/**
 * Outcome for one node or relationship touched by a merge.
 */
public record MergeStep(String element, String key, MergeOutcome outcome) {
}
