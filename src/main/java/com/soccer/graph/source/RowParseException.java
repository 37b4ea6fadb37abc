package com.soccer.graph.source;

/**
 * A value could not be coerced to its target type (number, date, time).
 */
public class RowParseException extends RowException {

    public RowParseException(String field, String value, String expected) {
        super(field, "Cannot parse " + field + "='" + value + "' as " + expected);
    }

    public RowParseException(String field, String value, String expected, Throwable cause) {
        super(field, "Cannot parse " + field + "='" + value + "' as " + expected, cause);
    }

    @Override
    public RowIssue.Kind kind() {
        return RowIssue.Kind.PARSE;
    }
}
