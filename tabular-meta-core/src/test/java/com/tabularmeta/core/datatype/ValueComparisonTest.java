package com.tabularmeta.core.datatype;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueComparisonTest {

    @Test
    void numbers_compareExactlyAcrossTypes() {
        assertThat(ValueComparison.compare(new BigDecimal("1.0"), BigInteger.ONE)).isZero();
        assertThat(ValueComparison.compare(new BigDecimal("0.1"), 0.2)).isNegative();
        assertThat(ValueComparison.compare(Double.POSITIVE_INFINITY, new BigDecimal("1e300"))).isPositive();
    }

    @Test
    void offsetDateTimes_compareByInstant() {
        OffsetDateTime berlin = OffsetDateTime.of(2024, 1, 1, 13, 0, 0, 0, ZoneOffset.ofHours(1));
        OffsetDateTime utc = OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC);

        assertThat(ValueComparison.compare(berlin, utc)).isZero();
    }

    @Test
    void dateAndDateTime_compareOnLocalTimeline() {
        assertThat(ValueComparison.compare(LocalDate.of(2024, 1, 2), LocalDateTime.of(2024, 1, 1, 23, 0)))
            .isPositive();
    }

    @Test
    void durations_indeterminateOrder_isRejected() {
        Object month = BaseType.DURATION.parse("P1M");
        Object days = BaseType.DURATION.parse("P30D");

        assertThatThrownBy(() -> ValueComparison.compare(month, days))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(ValueComparison.compare(BaseType.DURATION.parse("P1Y"), month)).isPositive();
    }

    @Test
    void incomparableValues_areRejected() {
        assertThatThrownBy(() -> ValueComparison.compare("a", 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void length_countsCodePointsAndBytes() {
        assertThat(ValueComparison.length("a😀b")).isEqualTo(3);
        assertThat(ValueComparison.length(new byte[] {1, 2, 3, 4})).isEqualTo(4);
        assertThat(ValueComparison.length(URI.create("http://x"))).isEqualTo(8);
    }
}
