package com.tabularmeta.core.source;

/**
 * Something that can be read as delimited rows, any number of times.
 */
public interface RawRowSource {

    /**
     * @return name used in violation messages, e.g. a file name
     */
    String name();

    /**
     * Opens a fresh reader from the start of the source.
     *
     * @param dialect dialect to apply
     * @return reader positioned before the first data row
     * @throws java.io.UncheckedIOException if the source cannot be opened
     */
    RawRowReader open(Dialect dialect);
}
