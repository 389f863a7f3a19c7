package com.tabularmeta.core.error;

/**
 * A foreign-key value without a matching row in the referenced table.
 */
public class ReferentialIntegrityException extends CsvwException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }
}
