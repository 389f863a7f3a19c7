package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.util.List;

/**
 * {@code boolean}: values map to {@link Boolean}.
 *
 * <p>A {@code format} of the form {@code "yes|no"} replaces the default tokens
 * ({@code true}/{@code 1} and {@code false}/{@code 0}). The first token of each list is used for
 * formatting.
 *
 * @see <a href="https://www.w3.org/TR/tabular-data-model/#formats-for-booleans">Formats for booleans</a>
 */
public class BooleanCodec extends AbstractCodec {

    private static final List<String> DEFAULT_TRUE = List.of("true", "1");
    private static final List<String> DEFAULT_FALSE = List.of("false", "0");

    public BooleanCodec(String name) {
        super(name);
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        List<String> trueTokens = DEFAULT_TRUE;
        List<String> falseTokens = DEFAULT_FALSE;
        if (format != null && !format.isNull() && !format.isMissingNode()) {
            String text = format.isTextual() ? format.asText() : null;
            if (text != null && text.chars().filter(c -> c == '|').count() == 1) {
                int bar = text.indexOf('|');
                trueTokens = List.of(text.substring(0, bar));
                falseTokens = List.of(text.substring(bar + 1));
            } else {
                log.warn("Invalid boolean format: {}", format);
            }
        }
        return new Tokens(trueTokens, falseTokens);
    }

    private final class Tokens implements DerivedCodec {

        private final List<String> trueTokens;
        private final List<String> falseTokens;

        Tokens(List<String> trueTokens, List<String> falseTokens) {
            this.trueTokens = trueTokens;
            this.falseTokens = falseTokens;
        }

        @Override
        public Object parse(String lexical) {
            if (trueTokens.contains(lexical)) {
                return Boolean.TRUE;
            }
            if (falseTokens.contains(lexical)) {
                return Boolean.FALSE;
            }
            throw invalid(lexical);
        }

        @Override
        public String format(Object value) {
            return Boolean.TRUE.equals(value) ? trueTokens.get(0) : falseTokens.get(0);
        }
    }
}
