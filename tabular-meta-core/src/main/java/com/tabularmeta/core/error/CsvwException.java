package com.tabularmeta.core.error;

/**
 * Root of all failures raised while building or reading CSVW described tables.
 *
 * <p>All subclasses are unchecked. Construction-time and structural failures are always thrown;
 * per-cell and per-row failures go through a {@link com.tabularmeta.core.validation.ViolationHandler}
 * which either throws them or reports them to a log sink.
 *
 * <p>Row-level failures carry the location they were found at ({@code source:line[:column]}),
 * which is prepended to the message.
 */
public class CsvwException extends RuntimeException {

    private String location;

    public CsvwException(String message) {
        super(message);
    }

    public CsvwException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attaches the source location. The first location attached wins.
     *
     * @param location e.g. {@code data.csv:12:3 name:}
     * @return this exception
     */
    public CsvwException atLocation(String location) {
        if (this.location == null) {
            this.location = location;
        }
        return this;
    }

    /**
     * @return source location, or null if the failure is not tied to a row
     */
    public String getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        return location == null ? super.getMessage() : location + " " + super.getMessage();
    }
}
