package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Integer datatypes: values map to {@link BigInteger}.
 *
 * <p>The lexical value is read as a decimal first; a non-integral result is rejected. Bounded
 * subtypes add an inclusive range, e.g. {@code unsignedByte} accepts 0 to 255.
 */
public class IntegerCodec extends DecimalCodec {

    private final BigInteger min;
    private final BigInteger max;

    /**
     * @param name datatype name
     * @param min inclusive lower bound, or null
     * @param max inclusive upper bound, or null
     */
    public IntegerCodec(String name, BigInteger min, BigInteger max) {
        super(name);
        this.min = min;
        this.max = max;
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        NumberFormat numberFormat = NumberFormat.of(format);
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                return parseInteger(lexical, numberFormat);
            }

            @Override
            public String format(Object value) {
                return formatNumber(value, numberFormat);
            }
        };
    }

    private BigInteger parseInteger(String lexical, NumberFormat format) {
        if (!(parseNumber(lexical, format) instanceof BigDecimal decimal)) {
            throw invalid(lexical, "not an integer");
        }
        BigInteger value;
        try {
            value = decimal.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw invalid(lexical, "not an integer");
        }
        if ((min != null && value.compareTo(min) < 0) || (max != null && value.compareTo(max) > 0)) {
            throw invalid(lexical, name + " must be an integer between "
                + (min == null ? "-INF" : min) + " and " + (max == null ? "INF" : max));
        }
        return value;
    }

    public BigInteger getMin() {
        return min;
    }

    public BigInteger getMax() {
        return max;
    }
}
