package com.tabularmeta.core.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Objects;

/**
 * {@link ValidationLog} forwarding to an SLF4J logger and counting what it forwarded.
 */
public class Slf4jValidationLog implements ValidationLog {

    private final Logger logger;
    private int count;

    public Slf4jValidationLog() {
        this(LoggerFactory.getLogger(Slf4jValidationLog.class));
    }

    public Slf4jValidationLog(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void log(Level level, String message) {
        count++;
        logger.atLevel(level).log(message);
    }

    /**
     * @return number of messages logged so far
     */
    public int getCount() {
        return count;
    }
}
