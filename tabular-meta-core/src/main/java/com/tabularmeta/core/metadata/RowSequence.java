package com.tabularmeta.core.metadata;

import com.tabularmeta.core.validation.ValidationLog;
import com.tabularmeta.core.validation.ViolationHandler;

import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The typed rows of a table, read lazily.
 *
 * <p>Every call to {@link #iterator()} or {@link #stream()} reopens the data source and starts
 * from the first row, so a sequence can be iterated any number of times, also concurrently. The
 * source is closed when iteration is exhausted or the stream is closed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (Stream<Row> rows = table.rows(log).stream()) {
 *     rows.filter(r -> r.get("country") != null).forEach(this::index);
 * }
 * }</pre>
 */
public final class RowSequence implements Iterable<Row> {

    private final Table table;
    private final ValidationLog log;

    RowSequence(Table table, ValidationLog log) {
        this.table = table;
        this.log = log;
    }

    /**
     * @return iterator over a fresh pass of the source
     * @throws com.tabularmeta.core.error.MissingRequiredColumnException if the source lacks a
     *         required column
     */
    @Override
    public Iterator<Row> iterator() {
        TableReader reader = new TableReader(table, ViolationHandler.of(log));
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                boolean more = reader.hasNext();
                if (!more) {
                    reader.close();
                }
                return more;
            }

            @Override
            public Row next() {
                return reader.next();
            }
        };
    }

    /**
     * @return stream over a fresh pass of the source; close it to release the source early
     */
    public Stream<Row> stream() {
        TableReader reader = new TableReader(table, ViolationHandler.of(log));
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(reader, Spliterator.ORDERED), false)
            .onClose(reader::close);
    }

    /**
     * Reads all rows.
     *
     * @return rows in source order
     */
    public List<Row> toList() {
        try (Stream<Row> rows = stream()) {
            return rows.toList();
        }
    }

    public Table getTable() {
        return table;
    }
}
