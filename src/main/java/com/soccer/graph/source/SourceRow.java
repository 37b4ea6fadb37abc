package com.soccer.graph.source;

import java.util.Map;
import java.util.Objects;

/**
 * One raw row: column name to raw string value, plus its line number.
 */
public final class SourceRow {

    private final long lineNumber;
    private final Map<String, String> values;

    public SourceRow(long lineNumber, Map<String, String> values) {
        this.lineNumber = lineNumber;
        this.values = Map.copyOf(Objects.requireNonNull(values, "values is required"));
    }

    public long lineNumber() {
        return lineNumber;
    }

    public Map<String, String> values() {
        return values;
    }

    /**
     * Trimmed value of {@code column}, or null when absent or blank.
     */
    public String optional(String column) {
        String value = values.get(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    /**
     * Trimmed value of {@code column}.
     *
     * @throws RowValidationException when the value is absent or blank
     */
    public String required(String column) {
        String value = optional(column);
        if (value == null) {
            throw new RowValidationException(column, "Missing required field '" + column + "'");
        }
        return value;
    }

    @Override
    public String toString() {
        return "SourceRow{line=" + lineNumber + ", values=" + values + '}';
    }
}
