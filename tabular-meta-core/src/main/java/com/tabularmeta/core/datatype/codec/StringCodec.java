package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * String-like datatypes. A {@code format} is a regular expression the whole value must match.
 *
 * <p>Variants:
 * <ul>
 *   <li>{@link Kind#PLAIN}: {@code string}, {@code QName}, {@code gYear}, {@code xml}, ...</li>
 *   <li>{@link Kind#NMTOKEN}: only word characters, {@code .}, {@code :} and {@code -}</li>
 *   <li>{@link Kind#NORMALIZED}: tabs and line breaks become spaces, then the value is trimmed</li>
 * </ul>
 *
 * <p>An invalid regular expression is ignored with a warning.
 */
public class StringCodec extends AbstractCodec {

    private static final Pattern NMTOKEN = Pattern.compile("[\\w.:-]*", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Lexical-space variant.
     */
    public enum Kind {
        PLAIN,
        NMTOKEN,
        NORMALIZED
    }

    private final Kind kind;

    public StringCodec(String name, Kind kind) {
        super(name);
        this.kind = kind;
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        Pattern regex = compileFormat(format);
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                return parseString(lexical, regex);
            }

            @Override
            public String format(Object value) {
                return String.valueOf(value);
            }
        };
    }

    /**
     * Compiles the format as a regex anchored at both ends.
     *
     * @param format format annotation
     * @return compiled regex or null
     */
    protected Pattern compileFormat(JsonNode format) {
        String text = format != null && format.isTextual() ? format.asText() : null;
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile("(?:" + text + ")");
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex pattern as {} format: {}", name, text);
            return null;
        }
    }

    protected String parseString(String lexical, Pattern regex) {
        String value = lexical;
        if (kind == Kind.NORMALIZED && value != null && !value.isEmpty()) {
            value = value.replace('\r', ' ').replace('\n', ' ').replace('\t', ' ').strip();
        }
        if (regex != null && !regex.matcher(value).matches()) {
            throw invalid(lexical, "does not match " + regex.pattern());
        }
        if (kind == Kind.NMTOKEN && !NMTOKEN.matcher(value).matches()) {
            throw invalid(lexical);
        }
        return value;
    }
}
