package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.pattern.NumberPattern;
import com.tabularmeta.core.error.InvalidDescriptionException;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Format state of a numeric datatype: an optional CLDR pattern plus group and decimal characters.
 *
 * <p>The {@code format} annotation is either a pattern string or an object with optional
 * {@code pattern}, {@code groupChar} and {@code decimalChar} members. Without explicit characters,
 * a pattern implies {@code ,} for grouping (if it contains one) and {@code .} as decimal point.
 *
 * @param pattern compiled pattern, or null
 * @param groupChar group separator, or null if grouping is not allowed
 * @param decimalChar decimal separator, or null for the default {@code .}
 */
record NumberFormat(NumberPattern pattern, Character groupChar, Character decimalChar) {

    static final NumberFormat NONE = new NumberFormat(null, null, null);

    static NumberFormat of(JsonNode format) {
        if (format == null || format.isNull() || format.isMissingNode()) {
            return NONE;
        }
        String patternText = null;
        Character group = null;
        Character decimal = null;
        if (format.isTextual()) {
            patternText = format.asText();
        } else if (format.isObject()) {
            patternText = format.path("pattern").isTextual() ? format.get("pattern").asText() : null;
            group = singleChar(format, "groupChar");
            decimal = singleChar(format, "decimalChar");
        } else {
            throw new InvalidDescriptionException("invalid number format: " + format);
        }
        NumberPattern pattern = patternText == null || patternText.isEmpty() ? null : new NumberPattern(patternText);
        if (pattern != null) {
            if (group == null && patternText.contains(",")) {
                group = ',';
            }
            if (decimal == null && patternText.contains(".")) {
                decimal = '.';
            }
        }
        return new NumberFormat(pattern, group, decimal);
    }

    private static Character singleChar(JsonNode format, String field) {
        JsonNode node = format.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        if (text.length() != 1) {
            throw new InvalidDescriptionException(field + " must be a single character: " + text);
        }
        return text.charAt(0);
    }

    char group() {
        return groupChar == null ? ',' : groupChar;
    }

    char decimal() {
        return decimalChar == null ? '.' : decimalChar;
    }

    /**
     * Rewrites the value so that {@code ,} separates groups and {@code .} marks the decimal point.
     *
     * @param value lexical value in this format's separators
     * @return normalized text
     */
    String normalize(String value) {
        char group = group();
        char decimal = decimal();
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == group) {
                sb.append(',');
            } else if (c == decimal) {
                sb.append('.');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Formats with the pattern using this format's separators.
     *
     * @param value value to format
     * @return formatted text
     */
    String formatWithPattern(BigDecimal value) {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ENGLISH);
        symbols.setGroupingSeparator(group());
        symbols.setDecimalSeparator(decimal());
        DecimalFormat format = new DecimalFormat(pattern.getPattern(), symbols);
        return format.format(value);
    }

    /**
     * Plain notation, grouped by three if a group character is set.
     *
     * @param value value to format
     * @return formatted text
     */
    String formatPlain(BigDecimal value) {
        String plain = value.toPlainString();
        if (groupChar == null && decimalChar == null) {
            return plain;
        }
        String sign = plain.startsWith("-") ? "-" : "";
        String unsigned = sign.isEmpty() ? plain : plain.substring(1);
        int dot = unsigned.indexOf('.');
        String integral = dot < 0 ? unsigned : unsigned.substring(0, dot);
        String fraction = dot < 0 ? "" : unsigned.substring(dot + 1);

        StringBuilder out = new StringBuilder(sign);
        if (groupChar != null) {
            int lead = integral.length() % 3 == 0 ? 3 : integral.length() % 3;
            out.append(integral, 0, lead);
            for (int i = lead; i < integral.length(); i += 3) {
                out.append(groupChar).append(integral, i, i + 3);
            }
        } else {
            out.append(integral);
        }
        if (!fraction.isEmpty()) {
            out.append(decimal()).append(fraction);
        }
        return out.toString();
    }
}
