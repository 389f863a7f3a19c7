package com.tabularmeta.core.error;

/**
 * Malformed metadata: an unknown datatype, an invalid date or number pattern, inconsistent
 * length or bound constraints, a virtual column followed by a non-virtual one, etc.
 *
 * <p>Always thrown while the description is being built, never logged.
 */
public class InvalidDescriptionException extends CsvwException {

    public InvalidDescriptionException(String message) {
        super(message);
    }

    public InvalidDescriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
