package com.soccer.graph.source;

/**
 * A source row that cannot become a canonical record. The row is skipped and
 * reported; the adapter carries on with the next row.
 */
public abstract class RowException extends RuntimeException {

    private final String field;

    protected RowException(String field, String message) {
        super(message);
        this.field = field;
    }

    protected RowException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Column that caused the failure, or null when the row as a whole is invalid.
     */
    public String getField() {
        return field;
    }

    public abstract RowIssue.Kind kind();
}
