package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * {@code decimal}: values map to {@link BigDecimal}, so lexical values round-trip exactly.
 *
 * <p>The special values {@code INF}, {@code -INF} and {@code NaN} map to the corresponding
 * {@link Double} constants. Exponent notation and doubled group characters are rejected. A
 * trailing {@code %} divides by 100, a trailing {@code ‰} by 1000.
 *
 * <pre>{@code
 * Datatype dt = Datatype.fromJson("{\"base\": \"decimal\", \"format\": {\"groupChar\": \".\", \"decimalChar\": \",\"}}");
 * dt.read("1.234,5");   // 1234.5
 * }</pre>
 */
public class DecimalCodec extends AbstractCodec {

    static final Map<String, Double> SPECIAL = Map.of(
        "INF", Double.POSITIVE_INFINITY,
        "-INF", Double.NEGATIVE_INFINITY,
        "NaN", Double.NaN
    );

    private static final BigDecimal PERCENT = new BigDecimal("0.01");
    private static final BigDecimal PERMILLE = new BigDecimal("0.001");

    public DecimalCodec(String name) {
        super(name);
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        NumberFormat numberFormat = NumberFormat.of(format);
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                return parseNumber(lexical, numberFormat);
            }

            @Override
            public String format(Object value) {
                return formatNumber(value, numberFormat);
            }
        };
    }

    /**
     * Parses a lexical decimal.
     *
     * @param lexical lexical value
     * @param format number format
     * @return {@link BigDecimal}, or a {@link Double} for the special values
     */
    protected Number parseNumber(String lexical, NumberFormat format) {
        if (lexical.toLowerCase().indexOf('e') >= 0) {
            throw invalid(lexical, "exponent notation is not allowed");
        }
        String group = String.valueOf(format.group());
        if (lexical.contains(group + group)) {
            throw invalid(lexical, "repeated group separator");
        }
        if (format.pattern() != null && !format.pattern().isValid(format.normalize(lexical))) {
            throw invalid(lexical, "does not match pattern " + format.pattern());
        }
        if (SPECIAL.containsKey(lexical)) {
            log.debug("special value {} for {}", lexical, name);
            return SPECIAL.get(lexical);
        }

        String text = lexical;
        if (format.groupChar() != null) {
            text = text.replace(String.valueOf(format.groupChar()), "");
        }
        if (format.decimalChar() != null && format.decimalChar() != '.') {
            text = text.replace(format.decimalChar(), '.');
        }
        BigDecimal factor = null;
        if (text.indexOf('%') >= 0) {
            text = text.replace("%", "");
            factor = PERCENT;
        } else if (text.indexOf('‰') >= 0) {
            text = text.replace("‰", "");
            factor = PERMILLE;
        }
        try {
            BigDecimal value = new BigDecimal(text);
            return factor == null ? value : value.multiply(factor);
        } catch (NumberFormatException e) {
            throw invalid(lexical);
        }
    }

    protected String formatNumber(Object value, NumberFormat format) {
        if (value instanceof Double d && (d.isInfinite() || d.isNaN())) {
            return d.isNaN() ? "NaN" : (d > 0 ? "INF" : "-INF");
        }
        BigDecimal decimal = toBigDecimal(value);
        if (format.pattern() != null) {
            return format.formatWithPattern(decimal);
        }
        return format.formatPlain(decimal);
    }

    static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        if (value instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        return new BigDecimal(String.valueOf(value));
    }
}
