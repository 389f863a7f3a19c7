package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * {@code float}, {@code double} and {@code number}: values map to {@link Double}.
 *
 * <p>Accepts optional sign, digits with an optional fraction and an optional exponent, plus
 * {@code INF}, {@code -INF} and {@code NaN}. Binary floating point means round-tripping is not
 * guaranteed for every lexical form.
 */
public class FloatCodec extends DecimalCodec {

    private static final Pattern LEXICAL = Pattern.compile("[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    public FloatCodec(String name) {
        super(name);
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        NumberFormat numberFormat = NumberFormat.of(format);
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                return parseDouble(lexical, numberFormat);
            }

            @Override
            public String format(Object value) {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    return formatNumber(d, numberFormat);
                }
                if (numberFormat.pattern() != null) {
                    return numberFormat.formatWithPattern(new BigDecimal(Double.toString(d)));
                }
                return Double.toString(d);
            }
        };
    }

    private Double parseDouble(String lexical, NumberFormat format) {
        if (format.pattern() != null && !format.pattern().isValid(format.normalize(lexical))) {
            throw invalid(lexical, "does not match pattern " + format.pattern());
        }
        if (SPECIAL.containsKey(lexical)) {
            return SPECIAL.get(lexical);
        }
        String text = lexical;
        if (format.groupChar() != null) {
            text = text.replace(String.valueOf(format.groupChar()), "");
        }
        if (format.decimalChar() != null && format.decimalChar() != '.') {
            text = text.replace(format.decimalChar(), '.');
        }
        if (!LEXICAL.matcher(text).matches()) {
            throw invalid(lexical);
        }
        return Double.valueOf(text);
    }
}
