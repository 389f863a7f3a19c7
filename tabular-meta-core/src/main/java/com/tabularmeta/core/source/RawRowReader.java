package com.tabularmeta.core.source;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;

/**
 * Pull-based reader over the data records of one source, with dialect rules already applied.
 *
 * <p>Readers are single-use: a new iteration opens a new reader. I/O failures surface as
 * {@link java.io.UncheckedIOException}.
 */
public interface RawRowReader extends Iterator<RawRow>, Closeable {

    /**
     * @return the header row if the dialect declares one, otherwise null
     */
    List<String> header();

    /**
     * @return comment lines seen so far
     */
    List<SourceComment> comments();

    @Override
    void close();
}
