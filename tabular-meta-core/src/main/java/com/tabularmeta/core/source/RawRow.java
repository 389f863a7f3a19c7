package com.tabularmeta.core.source;

import java.util.List;
import java.util.Objects;

/**
 * One record of a data source, before typing.
 *
 * @param lineNumber 1-based line the record starts at
 * @param cells cell texts in source order
 */
public record RawRow(int lineNumber, List<String> cells) {

    public RawRow {
        Objects.requireNonNull(cells, "cells must not be null");
        cells = List.copyOf(cells);
    }

    /**
     * @return true if the record has no cells or only empty ones
     */
    public boolean isBlank() {
        return cells.stream().allMatch(String::isEmpty);
    }
}
