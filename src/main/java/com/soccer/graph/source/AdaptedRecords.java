package com.soccer.graph.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy, finite, restartable sequence of records from one adapter. Every call to
 * {@link #iterator()} reads the rows again from the start. Invalid rows are skipped
 * and collected as {@link RowIssue}s.
 *
 * @param <R> the record type
 */
public class AdaptedRecords<R extends CanonicalRecord> implements Iterable<R> {
    private static final Logger log = LoggerFactory.getLogger(AdaptedRecords.class);

    private final SourceAdapter<R> adapter;
    private final Iterable<SourceRow> rows;
    private volatile List<RowIssue> lastIssues = List.of();

    public AdaptedRecords(SourceAdapter<R> adapter, Iterable<SourceRow> rows) {
        this.adapter = Objects.requireNonNull(adapter, "adapter is required");
        this.rows = Objects.requireNonNull(rows, "rows is required");
    }

    public String source() {
        return adapter.name();
    }

    public RecordPhase phase() {
        return adapter.phase();
    }

    /**
     * Issues found by the most recently completed pass.
     */
    public List<RowIssue> issues() {
        return lastIssues;
    }

    /**
     * @throws SourceReadException if the underlying rows cannot be read at all
     */
    @Override
    public RecordIterator iterator() {
        return new RecordIterator(rows.iterator());
    }

    /**
     * One pass over the rows. Tracks the issues and filtered rows of this pass.
     */
    public class RecordIterator implements Iterator<R> {
        private final Iterator<SourceRow> rowIterator;
        private final List<RowIssue> issues = new ArrayList<>();
        private long filtered;
        private R next;
        private boolean finished;

        private RecordIterator(Iterator<SourceRow> rowIterator) {
            this.rowIterator = rowIterator;
        }

        @Override
        public boolean hasNext() {
            while (next == null && rowIterator.hasNext()) {
                SourceRow row = rowIterator.next();
                try {
                    next = adapter.map(row).orElse(null);
                    if (next == null) {
                        filtered++;
                    }
                } catch (RowException e) {
                    RowIssue issue = RowIssue.of(adapter.name(), row.lineNumber(), e);
                    issues.add(issue);
                    log.warn("adapter.row.skipped source={} line={} kind={} error={}",
                            adapter.name(), row.lineNumber(), issue.kind(), e.getMessage());
                }
            }
            if (next == null && !finished) {
                finished = true;
                lastIssues = List.copyOf(issues);
            }
            return next != null;
        }

        @Override
        public R next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            R record = next;
            next = null;
            return record;
        }

        public List<RowIssue> issues() {
            return List.copyOf(issues);
        }

        /**
         * Rows left out because they are outside the adapter's scope.
         */
        public long filteredCount() {
            return filtered;
        }
    }
}
