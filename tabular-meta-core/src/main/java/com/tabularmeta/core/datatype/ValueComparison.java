package com.tabularmeta.core.datatype;

import javax.xml.datatype.DatatypeConstants;
import javax.xml.datatype.Duration;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.temporal.TemporalAccessor;

/**
 * Ordering and length of typed values, used by datatype bound and length constraints.
 */
public final class ValueComparison {

    private ValueComparison() {
    }

    /**
     * Compares two values of the same family.
     *
     * <p>Numbers compare exactly; {@code INF}/{@code NaN} fall back to double comparison.
     * Temporal values of different classes compare on their local date-time; times without a
     * date are anchored to today.
     *
     * @param left first value
     * @param right second value
     * @return negative, zero or positive
     * @throws IllegalArgumentException if the values are not comparable
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r);
        }
        if (left instanceof Duration l && right instanceof Duration r) {
            int result = l.compare(r);
            if (result == DatatypeConstants.INDETERMINATE) {
                throw new IllegalArgumentException("durations " + l + " and " + r + " are not comparable");
            }
            return result;
        }
        if (left instanceof TemporalAccessor l && right instanceof TemporalAccessor r) {
            return compareTemporals(l, r);
        }
        throw new IllegalArgumentException("cannot compare " + describe(left) + " with " + describe(right));
    }

    private static int compareNumbers(Number left, Number right) {
        if (isSpecial(left) || isSpecial(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isSpecial(Number n) {
        return n instanceof Double d && (d.isNaN() || d.isInfinite())
            || n instanceof Float f && (f.isNaN() || f.isInfinite());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        return new BigDecimal(n.toString());
    }

    private static int compareTemporals(TemporalAccessor left, TemporalAccessor right) {
        if (left instanceof OffsetDateTime l && right instanceof OffsetDateTime r) {
            return l.toInstant().compareTo(r.toInstant());
        }
        if (left instanceof OffsetTime l && right instanceof OffsetTime r) {
            return l.compareTo(r);
        }
        return toLocalDateTime(left).compareTo(toLocalDateTime(right));
    }

    private static LocalDateTime toLocalDateTime(TemporalAccessor value) {
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (value instanceof LocalTime time) {
            return LocalDate.now().atTime(time);
        }
        if (value instanceof OffsetTime time) {
            return LocalDate.now().atTime(time.toLocalTime());
        }
        throw new IllegalArgumentException("unsupported temporal value " + describe(value));
    }

    /**
     * Length of a value for length constraints: characters for strings, octets for binary.
     *
     * @param value typed value
     * @return length
     */
    public static int length(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes.length;
        }
        if (value instanceof String s) {
            return s.codePointCount(0, s.length());
        }
        if (value instanceof URI uri) {
            return uri.toString().length();
        }
        return String.valueOf(value).getBytes(StandardCharsets.UTF_8).length;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
