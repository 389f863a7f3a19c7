package com.tabularmeta.core.datatype.pattern;

import com.tabularmeta.core.error.InvalidDescriptionException;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Digit-count validator derived from a CLDR decimal format pattern such as {@code #,##0.00}.
 *
 * <p>Recognises the symbols {@code 0}, {@code #}, {@code .}, {@code ,}, {@code E}, {@code +},
 * {@code %} and {@code ‰}. A pattern may carry a negative sub-pattern after {@code ;}; without
 * one, the negative pattern is {@code -} followed by the positive pattern.
 *
 * <p>The number of {@code #} placeholders before the decimal point does not matter, since no
 * maximum is imposed on integer digits. Candidates are checked in their normalized form, i.e.
 * with {@code ,} as group and {@code .} as decimal separator.
 *
 * @see <a href="https://www.w3.org/TR/tabular-data-model/#formats-for-numeric-types">Formats for numeric types</a>
 */
public final class NumberPattern {

    private static final Pattern TRAILING_ZEROS = Pattern.compile("(0+)$");
    private static final String NON_DIGITS = ".,E+-%‰";

    private final String pattern;
    private final String positive;
    private final String negative;

    private final Integer primaryGroupingSize;
    private final Integer secondaryGroupingSize;
    private final int minIntegerDigits;
    private final int exponentDigits;
    private final int decimalDigits;
    private final int significantDecimalDigits;

    /**
     * Parses a pattern.
     *
     * @param pattern CLDR decimal pattern
     * @throws InvalidDescriptionException if the pattern has more than one sub-pattern separator
     */
    public NumberPattern(String pattern) {
        if (pattern == null || pattern.chars().filter(c -> c == ';').count() > 1) {
            throw new InvalidDescriptionException("invalid number format pattern: " + pattern);
        }
        this.pattern = pattern;
        int semicolon = pattern.indexOf(';');
        this.positive = semicolon < 0 ? pattern : pattern.substring(0, semicolon);
        String neg = semicolon < 0 ? "" : pattern.substring(semicolon + 1);
        this.negative = neg.isEmpty() ? "-" + positive.replace("+", "") : neg;

        String integral = positive.split("\\.", -1)[0];
        String[] groups = integral.split(",", -1);
        this.primaryGroupingSize = groups.length > 1 ? countDigits(groups[groups.length - 1]) : null;
        this.secondaryGroupingSize = groups.length > 2 ? Integer.valueOf(countDigits(groups[1])) : primaryGroupingSize;

        Matcher zeros = TRAILING_ZEROS.matcher(integral);
        this.minIntegerDigits = zeros.find() ? zeros.group(1).length() : 0;

        this.exponentDigits = countExponentDigits(positive);
        this.decimalDigits = countDecimalDigits(positive);
        this.significantDecimalDigits = countSignificantDecimalDigits(positive);
    }

    private static int countDigits(String group) {
        return (int) group.chars().filter(c -> c == '#' || c == '0').count();
    }

    private static int countExponentDigits(String positive) {
        int e = positive.toLowerCase().indexOf('e');
        if (e < 0) {
            return 0;
        }
        int n = 0;
        for (char c : positive.substring(e + 1).toCharArray()) {
            if (c == '0' || c == '#') {
                n++;
            } else if (c != ',') {
                break;
            }
        }
        return n;
    }

    private static String decimalPart(String positive) {
        int dot = positive.indexOf('.');
        return dot < 0 ? "" : positive.substring(dot + 1);
    }

    private static int countDecimalDigits(String positive) {
        int n = 0;
        for (char c : decimalPart(positive).toCharArray()) {
            if (c == 'E') {
                break;
            }
            if (c == '#' || c == '0') {
                n++;
            }
        }
        return n;
    }

    private static int countSignificantDecimalDigits(String positive) {
        int n = 0;
        for (char c : decimalPart(positive).toCharArray()) {
            if (c == 'E' || c == '#') {
                break;
            }
            if (c == '0') {
                n++;
            }
        }
        return n;
    }

    /**
     * Checks a normalized candidate against the digit counts of the positive pattern.
     *
     * @param candidate number text with {@code ,} grouping and {@code .} decimal separator
     * @return true if grouping widths, integer digits, fraction digits and exponent digits conform
     */
    public boolean isValid(String candidate) {
        int dot = candidate.indexOf('.');
        String integral = dot < 0 ? candidate : candidate.substring(0, dot);
        String rest = dot < 0 ? "" : candidate.substring(dot + 1).toLowerCase();
        String exponent = "";
        int e = rest.indexOf('e');
        String fraction = e < 0 ? rest : rest.substring(0, e);
        if (dot < 0) {
            int ie = integral.toLowerCase().indexOf('e');
            if (ie >= 0) {
                exponent = integral.substring(ie + 1);
                integral = integral.substring(0, ie);
            }
        } else if (e >= 0) {
            exponent = rest.substring(e + 1);
        }
        List<String> groups = List.of(integral.split(",", -1));

        int significant = 0;
        boolean leadingZero = false;
        boolean skip = true;
        for (char c : String.join("", groups).toCharArray()) {
            if (c == '+' || c == '-' || c == '%' || c == '‰') {
                continue;
            }
            if (c == '0' && skip) {
                leadingZero = true;
                continue;
            }
            skip = false;
            significant++;
        }
        if (significant == 0 && leadingZero) {
            significant = 1;
        }
        if (minIntegerDigits > 0 && significant < minIntegerDigits) {
            return false;
        }

        if (primaryGroupingSize != null && primaryGroupingSize > 0) {
            int last = digitCount(groups.get(groups.size() - 1));
            if (last > primaryGroupingSize) {
                return false;
            }
            if (groups.size() > 1 && last < primaryGroupingSize) {
                return false;
            }
        }
        if (secondaryGroupingSize != null && secondaryGroupingSize > 0 && groups.size() > 1) {
            for (int i = 0; i < groups.size() - 1; i++) {
                int n = digitCount(groups.get(i));
                if (i == 0 ? n > secondaryGroupingSize : n != secondaryGroupingSize) {
                    return false;
                }
            }
        }

        if (!fraction.isEmpty() && digitCount(fraction) > decimalDigits) {
            return false;
        }
        if (significantDecimalDigits > 0 && (fraction.isEmpty() || digitCount(fraction) < significantDecimalDigits)) {
            return false;
        }
        if (exponentDigits > 0 && !exponent.isEmpty() && digitCount(exponent) > exponentDigits) {
            return false;
        }
        return true;
    }

    private static int digitCount(String s) {
        return (int) s.chars().filter(c -> NON_DIGITS.indexOf(c) < 0 && c != 'e').count();
    }

    public String getPattern() {
        return pattern;
    }

    public String getPositive() {
        return positive;
    }

    public String getNegative() {
        return negative;
    }

    /**
     * @return digits in the group closest to the decimal point, or null without grouping
     */
    public Integer getPrimaryGroupingSize() {
        return primaryGroupingSize;
    }

    /**
     * @return digits in the other groups, or null without grouping
     */
    public Integer getSecondaryGroupingSize() {
        return secondaryGroupingSize;
    }

    public int getMinIntegerDigits() {
        return minIntegerDigits;
    }

    public int getExponentDigits() {
        return exponentDigits;
    }

    public int getDecimalDigits() {
        return decimalDigits;
    }

    public int getSignificantDecimalDigits() {
        return significantDecimalDigits;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
