package com.tabularmeta.core.validation;

import org.slf4j.event.Level;

/**
 * Sink for row- and cell-level violations.
 *
 * <p>Passing a {@code ValidationLog} to a read or check operation selects lenient mode:
 * violations are reported here and the offending row is skipped. Passing {@code null}
 * selects strict mode: the first violation is thrown.
 *
 * <p>Implementations are never called concurrently by this library.
 *
 * @see ViolationHandler
 */
@FunctionalInterface
public interface ValidationLog {

    /**
     * Records a message.
     *
     * @param level severity
     * @param message human-readable description, usually prefixed with {@code source:line}
     */
    void log(Level level, String message);

    /**
     * Records a warning.
     *
     * @param message message text
     */
    default void warn(String message) {
        log(Level.WARN, message);
    }

    /**
     * Returns a sink that discards everything. Useful to read only the valid rows of a table.
     *
     * @return discarding sink
     */
    static ValidationLog discard() {
        return (level, message) -> { };
    }
}
