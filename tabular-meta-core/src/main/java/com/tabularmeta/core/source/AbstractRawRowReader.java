package com.tabularmeta.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Applies the filtering rules of a {@link Dialect} to the records of an underlying tokenizer.
 *
 * <p>Order of rules per record: {@code skipRows}, comment capture, blank-row skip, header
 * extraction (once), then {@code trim} and {@code skipColumns} on every cell.
 *
 * <p>Subclasses supply {@link #readRecord()} and {@link #closeSource()}.
 */
public abstract class AbstractRawRowReader implements RawRowReader {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final Dialect dialect;
    private final List<SourceComment> comments = new ArrayList<>();
    private int recordsRead;
    private boolean started;
    private List<String> header;
    private RawRow next;
    private boolean closed;

    protected AbstractRawRowReader(Dialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Reads the next tokenized record.
     *
     * @return next record, or null at the end of the source
     */
    protected abstract RawRow readRecord();

    protected abstract void closeSource();

    @Override
    public List<String> header() {
        start();
        return header;
    }

    @Override
    public List<SourceComment> comments() {
        return Collections.unmodifiableList(comments);
    }

    @Override
    public boolean hasNext() {
        start();
        if (next == null && !closed) {
            next = nextFiltered();
            if (next == null) {
                close();
            }
        }
        return next != null;
    }

    @Override
    public RawRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RawRow row = next;
        next = null;
        return row;
    }

    private void start() {
        if (started) {
            return;
        }
        started = true;
        if (dialect.header() && dialect.headerRowCount() > 0) {
            RawRow first = nextFiltered();
            if (first != null) {
                header = first.cells();
                for (int i = 1; i < dialect.headerRowCount() && nextFiltered() != null; i++) {
                    log.debug("Ignoring additional header row {}", i + 1);
                }
            }
        }
    }

    private RawRow nextFiltered() {
        while (!closed) {
            RawRow record = readRecord();
            if (record == null) {
                return null;
            }
            recordsRead++;
            if (recordsRead <= dialect.skipRows()) {
                continue;
            }
            List<String> cells = record.cells();
            String prefix = dialect.commentPrefix();
            if (prefix != null && !cells.isEmpty() && cells.get(0).startsWith(prefix)) {
                String text = String.join(String.valueOf(dialect.delimiter()), cells).substring(prefix.length()).strip();
                comments.add(new SourceComment(record.lineNumber(), text));
                continue;
            }
            if (dialect.skipBlankRows() && record.isBlank()) {
                continue;
            }
            return new RawRow(record.lineNumber(), shape(cells));
        }
        return null;
    }

    private List<String> shape(List<String> cells) {
        List<String> shaped = new ArrayList<>(cells.size());
        for (int i = dialect.skipColumns(); i < cells.size(); i++) {
            shaped.add(dialect.trim(cells.get(i)));
        }
        return shaped;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            closeSource();
        }
    }
}
