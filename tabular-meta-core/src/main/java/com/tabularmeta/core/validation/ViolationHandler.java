package com.tabularmeta.core.validation;

import com.tabularmeta.core.error.CsvwException;
import org.slf4j.event.Level;

/**
 * The log-or-raise policy applied to every row- and cell-level violation.
 *
 * <p>Strict (no sink): {@link #report(CsvwException, String)} throws, aborting the current
 * operation. Lenient (sink present): the message is logged and the caller continues, usually by
 * dropping the offending row.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ViolationHandler handler = ViolationHandler.of(log);
 * try {
 *     values.put(header, column.read(cell));
 * } catch (InvalidLexicalValueException e) {
 *     handler.report(e, source + ":" + line + ":" + col + " " + header + ":");
 *     rowValid = false;
 * }
 * }</pre>
 */
public final class ViolationHandler {

    private final ValidationLog log;
    private final Level level;

    private ViolationHandler(ValidationLog log, Level level) {
        this.log = log;
        this.level = level;
    }

    /**
     * Creates a handler reporting at {@code WARN}.
     *
     * @param log sink, or {@code null} for strict mode
     * @return handler
     */
    public static ViolationHandler of(ValidationLog log) {
        return new ViolationHandler(log, Level.WARN);
    }

    /**
     * Creates a handler reporting at the given level.
     *
     * @param log sink, or {@code null} for strict mode
     * @param level level used in lenient mode
     * @return handler
     */
    public static ViolationHandler of(ValidationLog log, Level level) {
        return new ViolationHandler(log, level);
    }

    /**
     * @return true if violations are thrown
     */
    public boolean isStrict() {
        return log == null;
    }

    /**
     * Reports a violation that is not tied to a source location.
     *
     * @param violation the violation
     * @throws CsvwException the violation itself, in strict mode
     */
    public void report(CsvwException violation) {
        if (log == null) {
            throw violation;
        }
        log.log(level, violation.getMessage());
    }

    /**
     * Reports a violation found at the given location.
     *
     * @param violation the violation
     * @param location e.g. {@code data.csv:12:3 name:}
     * @throws CsvwException the violation, located, in strict mode
     */
    public void report(CsvwException violation, String location) {
        report(violation.atLocation(location));
    }
}
