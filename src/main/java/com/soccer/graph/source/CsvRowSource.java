package com.soccer.graph.source;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Rows of a UTF-8 CSV file with a header line. Each {@link #iterator()} reopens the
 * input, so the rows can be read any number of times.
 *
 * <p>The parser is closed once the last row has been read. A failure to open or
 * read the input raises {@link SourceReadException}.</p>
 */
public class CsvRowSource implements Iterable<SourceRow> {
    private static final Logger log = LoggerFactory.getLogger(CsvRowSource.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .setTrim(true)
            .build();

    private final String description;
    private final ReaderOpener opener;

    /**
     * Opens a fresh reader over the CSV text.
     */
    @FunctionalInterface
    public interface ReaderOpener {
        Reader open() throws IOException;
    }

    public CsvRowSource(String description, ReaderOpener opener) {
        this.description = Objects.requireNonNull(description, "description is required");
        this.opener = Objects.requireNonNull(opener, "opener is required");
    }

    public static CsvRowSource of(Path path) {
        return new CsvRowSource(path.toString(), () -> Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public static CsvRowSource fromString(String description, String content) {
        return new CsvRowSource(description, () -> new StringReader(content));
    }

    /**
     * Rows of a classpath resource.
     */
    public static CsvRowSource fromResource(String resource) {
        return new CsvRowSource(resource, () -> {
            InputStream in = CsvRowSource.class.getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Resource not found: " + resource);
            }
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        });
    }

    public String description() {
        return description;
    }

    @Override
    public Iterator<SourceRow> iterator() {
        CSVParser parser;
        try {
            parser = new CSVParser(opener.open(), FORMAT);
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            throw new SourceReadException("Cannot open " + description + ": " + e.getMessage(), e);
        }
        log.debug("csv.opened source={} columns={}", description, parser.getHeaderNames());
        return new RowIterator(parser);
    }

    private class RowIterator implements Iterator<SourceRow> {
        private final CSVParser parser;
        private final Iterator<CSVRecord> records;
        private boolean closed;

        RowIterator(CSVParser parser) {
            this.parser = parser;
            this.records = parser.iterator();
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            try {
                boolean more = records.hasNext();
                if (!more) {
                    close();
                }
                return more;
            } catch (UncheckedIOException | IllegalStateException e) {
                close();
                throw new SourceReadException("Cannot read " + description + ": " + e.getMessage(), e);
            }
        }

        @Override
        public SourceRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CSVRecord record = records.next();
            // Line 1 is the header
            return new SourceRow(record.getRecordNumber() + 1, record.toMap());
        }

        private void close() {
            closed = true;
            try {
                parser.close();
            } catch (IOException e) {
                log.warn("csv.close.failed source={} error={}", description, e.getMessage());
            }
        }
    }
}
