package com.soccer.graph.source;

/**
 * A skipped row.
 *
 * @param source     adapter name
 * @param lineNumber line in the source file (header is line 1)
 * @param kind       why the row was skipped
 * @param message    human-readable detail
 */
public record RowIssue(String source, long lineNumber, Kind kind, String message) {

    public enum Kind {
        /** A value could not be coerced. */
        PARSE,
        /** A required value is missing or breaks a rule. */
        VALIDATION
    }

    public static RowIssue of(String source, long lineNumber, RowException e) {
        return new RowIssue(source, lineNumber, e.kind(), e.getMessage());
    }
}
