package com.tabularmeta.core.datatype.pattern;

import com.tabularmeta.core.error.InvalidDescriptionException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateTimePatternTest {

    @Test
    void isoDate_requiresTwoDigitMonthAndDay() {
        DateTimePattern pattern = DateTimePattern.compile("yyyy-MM-dd");

        assertThat(pattern.parse("2024-01-31")).hasValueSatisfying(f -> {
            assertThat(f.year()).isEqualTo(2024);
            assertThat(f.month()).isEqualTo(1);
            assertThat(f.day()).isEqualTo(31);
            assertThat(f.hasTime()).isFalse();
        });
        assertThat(pattern.parse("2024-1-31")).isEmpty();
    }

    @Test
    void shortFields_acceptOneOrTwoDigits() {
        DateTimePattern pattern = DateTimePattern.compile("d.M.yyyy HH:mm");

        assertThat(pattern.parse("1.2.2024 09:05")).isPresent();
        assertThat(pattern.parse("01.12.2024 09:05")).isPresent();
        assertThat(pattern.format(LocalDateTime.of(2024, 2, 1, 9, 5))).isEqualTo("1.2.2024 09:05");
    }

    @Test
    void format_thenParse_isStable() {
        DateTimePattern pattern = DateTimePattern.compile("d.M.yyyy HH:mm");
        String once = pattern.format(LocalDateTime.of(2024, 11, 30, 23, 59));

        DateTimePattern.Fields fields = pattern.parse(once).orElseThrow();
        String twice = pattern.format(LocalDateTime.of(fields.year(), fields.month(), fields.day(),
            fields.hour(), fields.minute()));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void fractionalSeconds_limitedToPatternWidth() {
        DateTimePattern pattern = DateTimePattern.compile("yyyy-MM-ddTHH:mm:ss.SSS");

        assertThat(pattern.parse("2024-01-31T12:30:00.5")).hasValueSatisfying(
            f -> assertThat(f.nano()).isEqualTo(500_000_000));
        assertThat(pattern.parse("2024-01-31T12:30:00.1234")).isEmpty();
        assertThat(pattern.getFractionDigits()).isEqualTo(3);
    }

    @Test
    void timezoneMarker_isOptionalAndFormattedBySize() {
        DateTimePattern pattern = DateTimePattern.compile("yyyy-MM-ddTHH:mm:ssXXX");

        assertThat(pattern.hasTimezoneMarker()).isTrue();
        assertThat(pattern.parse("2024-01-31T12:30:00Z")).hasValueSatisfying(
            f -> assertThat(f.offset()).isEqualTo(ZoneOffset.UTC));
        assertThat(pattern.parse("2024-01-31T12:30:00")).hasValueSatisfying(
            f -> assertThat(f.offset()).isNull());
        assertThat(pattern.format(OffsetDateTime.of(2024, 1, 31, 12, 30, 0, 0, ZoneOffset.ofHours(-5))))
            .isEqualTo("2024-01-31T12:30:00-05:00");
    }

    @Test
    void parseOffset_acceptsCompactAndColonForms() {
        assertThat(DateTimePattern.parseOffset("Z")).isEqualTo(ZoneOffset.UTC);
        assertThat(DateTimePattern.parseOffset("+0530")).isEqualTo(ZoneOffset.ofHoursMinutes(5, 30));
        assertThat(DateTimePattern.parseOffset("-03:00")).isEqualTo(ZoneOffset.ofHours(-3));
        assertThat(DateTimePattern.parseOffset("+02")).isEqualTo(ZoneOffset.ofHours(2));
    }

    @Test
    void unsupportedPattern_isRejected() {
        assertThatThrownBy(() -> DateTimePattern.compile("MMM d, yyyy"))
            .isInstanceOf(InvalidDescriptionException.class);
        assertThatThrownBy(() -> DateTimePattern.compile("yyyy-MM-dd HH:mm xX"))
            .isInstanceOf(InvalidDescriptionException.class);
    }
}
