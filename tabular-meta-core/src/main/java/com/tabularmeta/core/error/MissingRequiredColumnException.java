package com.tabularmeta.core.error;

import java.util.Set;

/**
 * The header of a data source lacks a column the schema marks as required.
 * Structural: reading the table is aborted.
 */
public class MissingRequiredColumnException extends CsvwException {

    private final Set<String> missingColumns;

    public MissingRequiredColumnException(String source, Set<String> missingColumns) {
        super(source + " is missing required columns " + missingColumns);
        this.missingColumns = Set.copyOf(missingColumns);
    }

    public Set<String> getMissingColumns() {
        return missingColumns;
    }
}
