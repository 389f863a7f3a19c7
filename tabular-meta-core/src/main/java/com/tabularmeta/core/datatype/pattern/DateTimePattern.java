package com.tabularmeta.core.datatype.pattern;

import com.tabularmeta.core.error.InvalidDescriptionException;

import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled form of a CLDR date/time format pattern, restricted to the subset CSVW requires.
 *
 * <p>Supported patterns are one of a fixed set of date forms ({@code yyyy-MM-dd}, {@code d.M.yyyy},
 * ...), one of a fixed set of time forms ({@code HH:mm:ss}, {@code HHmm}, ...), or a date and a
 * time joined by a single space or {@code T}. A time may carry a {@code .S+} fractional-seconds
 * suffix and the whole pattern may end with a timezone marker ({@code x}, {@code xx}, {@code xxx},
 * {@code X}, {@code XX} or {@code XXX}, optionally preceded by one space).
 *
 * <p>Compilation yields a regular expression with named groups used for parsing and a list of
 * template parts used for formatting. Anything outside the subset is rejected with
 * {@link InvalidDescriptionException}, so a bad pattern fails when its datatype is built, not
 * when a cell is read.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DateTimePattern pattern = DateTimePattern.compile("d.M.yyyy HH:mm");
 * DateTimePattern.Fields fields = pattern.parse("22.3.2015 22:05").orElseThrow();
 * String text = pattern.format(LocalDateTime.of(2015, 3, 22, 22, 5));  // "22.3.2015 22:05"
 * }</pre>
 *
 * @see <a href="https://www.w3.org/TR/tabular-data-model/#formats-for-dates-and-times">Formats for dates and times</a>
 */
public final class DateTimePattern {

    private static final Set<String> DATE_PATTERNS = Set.of(
        "yyyy-MM-dd",
        "yyyyMMdd",
        "dd-MM-yyyy",
        "d-M-yyyy",
        "MM-dd-yyyy",
        "M-d-yyyy",
        "dd/MM/yyyy",
        "d/M/yyyy",
        "MM/dd/yyyy",
        "M/d/yyyy",
        "dd.MM.yyyy",
        "d.M.yyyy",
        "MM.dd.yyyy",
        "M.d.yyyy"
    );

    private static final Set<String> TIME_PATTERNS = Set.of("HH:mm:ss", "HHmmss", "HH:mm", "HHmm");

    /** Token to (field, minimum width, regex fragment). */
    private static final Map<String, Token> TOKENS = Map.of(
        "yyyy", new Token(ChronoField.YEAR, 4, "(?<year>[0-9]{4})"),
        "MM", new Token(ChronoField.MONTH_OF_YEAR, 2, "(?<month>[0-9]{2})"),
        "dd", new Token(ChronoField.DAY_OF_MONTH, 2, "(?<day>[0-9]{2})"),
        "M", new Token(ChronoField.MONTH_OF_YEAR, 1, "(?<month>[0-9]{1,2})"),
        "d", new Token(ChronoField.DAY_OF_MONTH, 1, "(?<day>[0-9]{1,2})"),
        "HH", new Token(ChronoField.HOUR_OF_DAY, 2, "(?<hour>[0-9]{2})"),
        "mm", new Token(ChronoField.MINUTE_OF_HOUR, 2, "(?<minute>[0-9]{2})"),
        "ss", new Token(ChronoField.SECOND_OF_MINUTE, 2, "(?<second>[0-9]{2})")
    );

    private static final Pattern MARKER = Pattern.compile("( ?)([xX]{1,3})$");

    private static final String OFFSET_REGEX = "(?<tz>Z|[+-][0-9]{2}(?::?[0-9]{2})?)";

    private record Token(ChronoField field, int width, String regex) {}

    /**
     * One piece of the format template: either literal text or a zero-padded field.
     *
     * @param literal literal text, or null for a field
     * @param field field to print, or null for a literal
     * @param width minimum width (zero padded); for {@link ChronoField#NANO_OF_SECOND} the exact
     *              number of fraction digits
     */
    public record TemplatePart(String literal, ChronoField field, int width) {

        static TemplatePart literal(String text) {
            return new TemplatePart(text, null, 0);
        }

        static TemplatePart field(ChronoField field, int width) {
            return new TemplatePart(null, field, width);
        }

        public boolean isLiteral() {
            return literal != null;
        }
    }

    /**
     * Components matched from a lexical value. Absent components are null.
     *
     * @param year year
     * @param month month of year
     * @param day day of month
     * @param hour hour of day
     * @param minute minute of hour
     * @param second second of minute
     * @param nano fraction of second in nanoseconds
     * @param offset zone offset, if the value carried one
     */
    public record Fields(
        Integer year,
        Integer month,
        Integer day,
        Integer hour,
        Integer minute,
        Integer second,
        Integer nano,
        ZoneOffset offset
    ) {
        public boolean hasDate() {
            return year != null;
        }

        public boolean hasTime() {
            return hour != null;
        }
    }

    private final String source;
    private final Pattern regex;
    private final List<TemplatePart> template;
    private final String timezoneMarker;
    private final int fractionDigits;

    private DateTimePattern(String source, Pattern regex, List<TemplatePart> template,
                            String timezoneMarker, int fractionDigits) {
        this.source = source;
        this.regex = regex;
        this.template = List.copyOf(template);
        this.timezoneMarker = timezoneMarker;
        this.fractionDigits = fractionDigits;
    }

    /**
     * Compiles a date, date-time, or (with a date part) time pattern.
     *
     * @param pattern CLDR pattern
     * @return compiled pattern
     * @throws InvalidDescriptionException if the pattern is outside the supported subset
     */
    public static DateTimePattern compile(String pattern) {
        return compile(pattern, false);
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern CLDR pattern
     * @param timeOnly whether a pattern without date/time joiner is a time rather than a date
     * @return compiled pattern
     * @throws InvalidDescriptionException if the pattern is outside the supported subset
     */
    public static DateTimePattern compile(String pattern, boolean timeOnly) {
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidDescriptionException("empty date/time format pattern");
        }
        String rest = pattern;

        String marker = null;
        Matcher markerMatch = MARKER.matcher(rest);
        if (markerMatch.find()) {
            String letters = markerMatch.group(2);
            if (letters.chars().distinct().count() != 1) {
                throw invalid(pattern, "timezone marker mixes x and X");
            }
            marker = markerMatch.group(1) + letters;
            rest = rest.substring(0, markerMatch.start());
        }

        String joiner = null;
        if (rest.contains(" ")) {
            joiner = " ";
        } else if (rest.contains("T")) {
            joiner = "T";
        }

        String datePart;
        String timePart;
        if (joiner != null) {
            String[] parts = rest.split(Pattern.quote(joiner), -1);
            if (parts.length != 2) {
                throw invalid(pattern, "more than one date/time separator");
            }
            datePart = parts[0];
            timePart = parts[1];
        } else if (timeOnly) {
            datePart = null;
            timePart = rest;
        } else {
            datePart = rest;
            timePart = null;
        }

        int fraction = 0;
        if (timePart != null && timePart.contains(".")) {
            int dot = timePart.indexOf('.');
            String suffix = timePart.substring(dot + 1);
            if (suffix.isEmpty() || !suffix.chars().allMatch(c -> c == 'S')) {
                throw invalid(pattern, "invalid fractional seconds");
            }
            fraction = suffix.length();
            timePart = timePart.substring(0, dot);
        }

        if (datePart != null && !DATE_PATTERNS.contains(datePart)) {
            throw invalid(pattern, "unsupported date pattern " + datePart);
        }
        if (timePart != null && !TIME_PATTERNS.contains(timePart)) {
            throw invalid(pattern, "unsupported time pattern " + timePart);
        }

        StringBuilder regex = new StringBuilder();
        List<TemplatePart> template = new ArrayList<>();

        if (datePart != null) {
            appendTokens(datePart, firstSeparator(datePart, ".-/"), regex, template);
        }
        if (joiner != null) {
            regex.append(Pattern.quote(joiner));
            template.add(TemplatePart.literal(joiner));
        }
        if (timePart != null) {
            appendTokens(timePart, timePart.contains(":") ? ":" : null, regex, template);
        }

        if (fraction > 0) {
            regex.append("(?:\\.(?<fraction>[0-9]{1,").append(fraction).append("})(?![0-9]))?");
            regex.append("(?:\\.(?<extrafraction>[0-9]{").append(fraction + 1).append(",})(?![0-9]))?");
            template.add(TemplatePart.literal("."));
            template.add(TemplatePart.field(ChronoField.NANO_OF_SECOND, fraction));
        }

        if (marker != null) {
            String space = marker.startsWith(" ") ? " " : "";
            regex.append("(?:").append(space).append(OFFSET_REGEX).append(")?");
        }

        return new DateTimePattern(pattern, Pattern.compile(regex.toString()), template, marker, fraction);
    }

    private static String firstSeparator(String part, String candidates) {
        for (char c : candidates.toCharArray()) {
            if (part.indexOf(c) >= 0) {
                return String.valueOf(c);
            }
        }
        return null;
    }

    private static void appendTokens(String part, String separator, StringBuilder regex,
                                     List<TemplatePart> template) {
        List<String> tokens = new ArrayList<>();
        if (separator != null) {
            tokens.addAll(List.of(part.split(Pattern.quote(separator), -1)));
        } else {
            // runs of the same letter, e.g. yyyyMMdd -> yyyy, MM, dd
            int start = 0;
            for (int i = 1; i <= part.length(); i++) {
                if (i == part.length() || part.charAt(i) != part.charAt(start)) {
                    tokens.add(part.substring(start, i));
                    start = i;
                }
            }
        }
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) {
                regex.append(Pattern.quote(separator));
                template.add(TemplatePart.literal(separator));
            }
            Token token = TOKENS.get(tokens.get(i));
            regex.append(token.regex());
            template.add(TemplatePart.field(token.field(), token.width()));
        }
    }

    private static InvalidDescriptionException invalid(String pattern, String reason) {
        return new InvalidDescriptionException("invalid date/time format \"" + pattern + "\": " + reason);
    }

    /**
     * Matches a lexical value against the whole pattern.
     *
     * @param value lexical value
     * @return matched components, or empty if the value does not match or carries more fraction
     *         digits than the pattern allows
     */
    public Optional<Fields> parse(String value) {
        Matcher m = regex.matcher(value);
        if (!m.matches()) {
            return Optional.empty();
        }
        if (fractionDigits > 0 && m.group("extrafraction") != null) {
            return Optional.empty();
        }
        Integer nano = null;
        if (fractionDigits > 0 && m.group("fraction") != null) {
            String digits = m.group("fraction");
            nano = Integer.parseInt((digits + "000000000").substring(0, 9));
        }
        ZoneOffset offset = null;
        if (timezoneMarker != null && m.group("tz") != null) {
            offset = parseOffset(m.group("tz"));
        }
        return Optional.of(new Fields(
            intGroup(m, "year"),
            intGroup(m, "month"),
            intGroup(m, "day"),
            intGroup(m, "hour"),
            intGroup(m, "minute"),
            intGroup(m, "second"),
            nano,
            offset
        ));
    }

    private Integer intGroup(Matcher m, String name) {
        if (!regex.pattern().contains("(?<" + name + ">")) {
            return null;
        }
        String group = m.group(name);
        return group == null ? null : Integer.valueOf(group);
    }

    /**
     * Parses an ISO-like offset: {@code Z}, {@code +HH}, {@code +HHmm} or {@code +HH:mm}.
     *
     * @param text offset text
     * @return offset
     */
    public static ZoneOffset parseOffset(String text) {
        if ("Z".equals(text)) {
            return ZoneOffset.UTC;
        }
        String digits = text.substring(1).replace(":", "");
        int hours = Integer.parseInt(digits.substring(0, 2));
        int minutes = digits.length() > 2 ? Integer.parseInt(digits.substring(2, 4)) : 0;
        int sign = text.charAt(0) == '-' ? -1 : 1;
        return ZoneOffset.ofHoursMinutes(sign * hours, sign * minutes);
    }

    /**
     * Formats a temporal value. Date fields are taken from the value only if the pattern has a
     * date part; the offset is appended only if the pattern has a timezone marker and the value
     * has an offset.
     *
     * @param value temporal value supporting all fields the pattern uses
     * @return formatted text
     */
    public String format(TemporalAccessor value) {
        StringBuilder out = new StringBuilder();
        for (TemplatePart part : template) {
            if (part.isLiteral()) {
                out.append(part.literal());
            } else if (part.field() == ChronoField.NANO_OF_SECOND) {
                int nano = value.isSupported(ChronoField.NANO_OF_SECOND) ? value.get(ChronoField.NANO_OF_SECOND) : 0;
                out.append(String.format("%09d", nano), 0, part.width());
            } else {
                String digits = Integer.toString(value.get(part.field()));
                out.append("0".repeat(Math.max(0, part.width() - digits.length()))).append(digits);
            }
        }
        if (timezoneMarker != null && value.isSupported(ChronoField.OFFSET_SECONDS)) {
            if (timezoneMarker.startsWith(" ")) {
                out.append(' ');
            }
            out.append(formatOffset(ZoneOffset.ofTotalSeconds(value.get(ChronoField.OFFSET_SECONDS))));
        }
        return out.toString();
    }

    /**
     * Formats an offset sized to this pattern's timezone marker: width 1 gives {@code +HH} (with
     * minutes only if non-zero), width 2 {@code +HHmm}, width 3 {@code +HH:mm}. Upper-case markers
     * print UTC as {@code Z}.
     *
     * @param offset offset to format
     * @return formatted offset
     */
    String formatOffset(ZoneOffset offset) {
        String letters = timezoneMarker.trim();
        if (offset.getTotalSeconds() == 0 && letters.charAt(0) == 'X') {
            return "Z";
        }
        int total = Math.abs(offset.getTotalSeconds());
        String sign = offset.getTotalSeconds() < 0 ? "-" : "+";
        String hours = String.format("%02d", total / 3600);
        String minutes = String.format("%02d", (total / 60) % 60);
        return switch (letters.length()) {
            case 1 -> sign + hours + ("00".equals(minutes) ? "" : minutes);
            case 2 -> sign + hours + minutes;
            default -> sign + hours + ":" + minutes;
        };
    }

    public String getSource() {
        return source;
    }

    public Pattern getRegex() {
        return regex;
    }

    public List<TemplatePart> getTemplate() {
        return template;
    }

    /**
     * @return the timezone marker including a leading space if present, or null
     */
    public String getTimezoneMarker() {
        return timezoneMarker;
    }

    public boolean hasTimezoneMarker() {
        return timezoneMarker != null;
    }

    public int getFractionDigits() {
        return fractionDigits;
    }

    /**
     * Renders the format template, e.g. {@code {DayOfMonth}.{MonthOfYear}.{Year:4}}.
     *
     * @return template text
     */
    public String getFormatTemplate() {
        StringBuilder sb = new StringBuilder();
        for (TemplatePart part : template) {
            if (part.isLiteral()) {
                sb.append(part.literal());
            } else {
                sb.append('{').append(part.field());
                if (part.width() > 1) {
                    sb.append(':').append(part.width());
                }
                sb.append('}');
            }
        }
        if (timezoneMarker != null) {
            sb.append(timezoneMarker.startsWith(" ") ? " " : "").append("{Offset}");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
