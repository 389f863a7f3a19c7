package com.tabularmeta.core.error;

/**
 * A cell of a required column is empty or holds one of the column's null tokens.
 */
public class MissingRequiredValueException extends CsvwException {

    public MissingRequiredValueException() {
        super("required column value is missing");
    }

    public MissingRequiredValueException(String message) {
        super(message);
    }
}
