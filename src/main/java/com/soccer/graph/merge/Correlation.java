package com.soccer.graph.merge;

/**
 * Result of joining an enrichment row onto an existing match.
 *
 * @param status     whether a single match was chosen
 * @param matchKey   key of the chosen match, or null
 * @param confidence how the match was chosen, or null unless matched
 * @param candidates number of matches that satisfied the join predicate
 */
public record Correlation(Status status, String matchKey, Confidence confidence, int candidates) {

    public enum Status {
        MATCHED,
        MISS,
        AMBIGUOUS
    }

    public enum Confidence {
        /** The row names the match's exact identity. */
        EXACT,
        /** A single match satisfied the predicate. */
        CONTAINMENT,
        /** Several matched; the one nearest in time was taken. */
        NEAREST_TIME
    }

    public static Correlation matched(String matchKey, Confidence confidence, int candidates) {
        return new Correlation(Status.MATCHED, matchKey, confidence, candidates);
    }

    public static Correlation miss() {
        return new Correlation(Status.MISS, null, null, 0);
    }

    public static Correlation ambiguous(int candidates) {
        return new Correlation(Status.AMBIGUOUS, null, null, candidates);
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }
}
