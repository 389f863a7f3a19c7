package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;
import com.tabularmeta.core.datatype.pattern.DateTimePattern;
import com.tabularmeta.core.error.InvalidDescriptionException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Temporal datatypes driven by a {@link DateTimePattern}.
 *
 * <p>Values without an offset map to {@link LocalDate}, {@link LocalDateTime} or {@link LocalTime};
 * values carrying one map to {@link OffsetDateTime} or {@link OffsetTime}. If the format declares
 * no timezone marker, a trailing ISO zone ({@code Z} or {@code +HH:MM}) on the value is still
 * accepted and written back in ISO form.
 *
 * <p>A {@code datetime} without a format is read as ISO-8601.
 */
public class DateTimeCodec extends AbstractCodec {

    private static final Pattern TRAILING_ZONE = Pattern.compile("(.+?)(Z|[+-][0-9]{2}:[0-9]{2})$");

    /**
     * Temporal family member.
     */
    public enum Kind {
        DATE("yyyy-MM-dd"),
        DATETIME(null),
        DATETIMESTAMP("yyyy-MM-ddTHH:mm:ss.SSSSSSXXX"),
        TIME("HH:mm:ss");

        private final String defaultPattern;

        Kind(String defaultPattern) {
            this.defaultPattern = defaultPattern;
        }
    }

    private final Kind kind;

    public DateTimeCodec(String name, Kind kind) {
        super(name);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        String text = formatText(format);
        if (text == null || text.isEmpty()) {
            text = kind.defaultPattern;
        }
        if (text == null) {
            return new IsoDateTime();
        }
        DateTimePattern pattern = DateTimePattern.compile(text, kind == Kind.TIME);
        if (kind == Kind.DATETIMESTAMP && !pattern.hasTimezoneMarker()) {
            throw new InvalidDescriptionException(name + " format requires a timezone marker: " + text);
        }
        log.debug("Compiled {} format {} as {}", name, text, pattern.getFormatTemplate());
        return new Patterned(pattern);
    }

    private final class Patterned implements DerivedCodec {

        private final DateTimePattern pattern;

        Patterned(DateTimePattern pattern) {
            this.pattern = pattern;
        }

        @Override
        public Object parse(String lexical) {
            Optional<DateTimePattern.Fields> fields = pattern.parse(lexical);
            ZoneOffset trailing = null;
            if (fields.isEmpty() && !pattern.hasTimezoneMarker()) {
                Matcher m = TRAILING_ZONE.matcher(lexical);
                if (m.matches()) {
                    fields = pattern.parse(m.group(1));
                    trailing = DateTimePattern.parseOffset(m.group(2));
                }
            }
            if (fields.isEmpty()) {
                throw invalid(lexical, "does not match " + pattern);
            }
            DateTimePattern.Fields f = fields.get();
            ZoneOffset offset = f.offset() != null ? f.offset() : trailing;
            try {
                return build(f, offset, lexical);
            } catch (DateTimeException e) {
                throw invalid(lexical, e.getMessage(), e);
            }
        }

        private Object build(DateTimePattern.Fields f, ZoneOffset offset, String lexical) {
            LocalTime time = f.hasTime()
                ? LocalTime.of(f.hour(), f.minute(), orZero(f.second()), orZero(f.nano()))
                : LocalTime.MIDNIGHT;
            if (kind == Kind.TIME) {
                return offset == null ? time : OffsetTime.of(time, offset);
            }
            LocalDate date = LocalDate.of(f.year(), f.month(), f.day());
            if (kind == Kind.DATE) {
                return offset == null ? date : OffsetDateTime.of(date, LocalTime.MIDNIGHT, offset);
            }
            if (offset == null) {
                if (kind == Kind.DATETIMESTAMP) {
                    throw invalid(lexical, "timezone offset is required");
                }
                return LocalDateTime.of(date, time);
            }
            return OffsetDateTime.of(date, time, offset);
        }

        @Override
        public String format(Object value) {
            TemporalAccessor temporal = (TemporalAccessor) value;
            String text = pattern.format(temporal);
            if (!pattern.hasTimezoneMarker() && temporal.isSupported(ChronoField.OFFSET_SECONDS)) {
                text += ZoneOffset.ofTotalSeconds(temporal.get(ChronoField.OFFSET_SECONDS)).getId();
            }
            return text;
        }
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private final class IsoDateTime implements DerivedCodec {

        @Override
        public Object parse(String lexical) {
            try {
                return DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    lexical, OffsetDateTime::from, LocalDateTime::from);
            } catch (DateTimeException e) {
                log.trace("{} is not an ISO date-time, trying ISO date", lexical);
            }
            try {
                return LocalDate.parse(lexical).atStartOfDay();
            } catch (DateTimeException e) {
                throw invalid(lexical, "not an ISO-8601 date-time", e);
            }
        }

        @Override
        public String format(Object value) {
            if (value instanceof OffsetDateTime odt) {
                return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt);
            }
            if (value instanceof LocalDate date) {
                return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
            }
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((TemporalAccessor) value);
        }
    }
}
