package com.soccer.graph.source;

import java.util.Optional;

/**
 * Translates the rows of one source schema into canonical records.
 *
 * @param <R> the record type produced
 */
public interface SourceAdapter<R extends CanonicalRecord> {

    /**
     * Name used in summaries, logs and row issues.
     */
    String name();

    RecordPhase phase();

    /**
     * Maps one row.
     *
     * @return the record, or empty when the row is outside this source's scope (not an error)
     * @throws RowException when the row is invalid; the row is then skipped and reported
     */
    Optional<R> map(SourceRow row);

    /**
     * Wraps rows into a lazy, restartable sequence of records.
     */
    default AdaptedRecords<R> adapt(Iterable<SourceRow> rows) {
        return new AdaptedRecords<>(this, rows);
    }
}
