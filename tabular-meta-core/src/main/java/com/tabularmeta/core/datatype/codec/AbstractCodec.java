package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.TypeCodec;
import com.tabularmeta.core.error.InvalidLexicalValueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for codec families.
 *
 * <p>Provides:
 * <ul>
 *   <li>one logger per codec class</li>
 *   <li>the datatype name used in error messages</li>
 *   <li>helpers to read the {@code format} annotation ({@link #formatText(JsonNode)})</li>
 *   <li>{@link #invalid(String)} to build lexical-value failures</li>
 * </ul>
 */
public abstract class AbstractCodec implements TypeCodec {

    protected final Logger log;
    protected final String name;

    protected AbstractCodec(String name) {
        this.log = LoggerFactory.getLogger(getClass());
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the format as text: the node itself if textual, the {@code pattern} member if the
     * format is an object, otherwise null.
     *
     * @param format format annotation, may be null
     * @return pattern text or null
     */
    protected static String formatText(JsonNode format) {
        if (format == null || format.isNull() || format.isMissingNode()) {
            return null;
        }
        if (format.isTextual()) {
            return format.asText();
        }
        if (format.isObject() && format.path("pattern").isTextual()) {
            return format.get("pattern").asText();
        }
        return null;
    }

    protected InvalidLexicalValueException invalid(String value) {
        return new InvalidLexicalValueException(name, value);
    }

    protected InvalidLexicalValueException invalid(String value, String detail) {
        return new InvalidLexicalValueException(name, value, detail);
    }

    protected InvalidLexicalValueException invalid(String value, String detail, Throwable cause) {
        return new InvalidLexicalValueException(name, value, detail, cause);
    }
}
