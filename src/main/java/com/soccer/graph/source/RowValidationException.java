package com.soccer.graph.source;

/**
 * A row parsed but breaks a rule: a required field is missing, a goal total is
 * negative, or a team plays itself.
 */
public class RowValidationException extends RowException {

    public RowValidationException(String field, String message) {
        super(field, message);
    }

    @Override
    public RowIssue.Kind kind() {
        return RowIssue.Kind.VALIDATION;
    }
}
