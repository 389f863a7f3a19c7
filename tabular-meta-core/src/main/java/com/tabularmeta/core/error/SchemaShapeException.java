package com.tabularmeta.core.error;

/**
 * A foreign key whose shape cannot be checked: unknown referenced table or column, column
 * count mismatch, or incompatible base datatypes. Raised before any row is scanned.
 */
public class SchemaShapeException extends CsvwException {

    public SchemaShapeException(String message) {
        super(message);
    }
}
