package com.tabularmeta.core.error;

/**
 * Two rows of one table share the same primary-key tuple.
 */
public class DuplicatePrimaryKeyException extends CsvwException {

    public DuplicatePrimaryKeyException(String message) {
        super(message);
    }
}
