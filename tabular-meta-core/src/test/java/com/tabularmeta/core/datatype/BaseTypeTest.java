package com.tabularmeta.core.datatype;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tabularmeta.core.error.InvalidLexicalValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BaseType} and the codecs behind it.
 */
class BaseTypeTest {

    @ParameterizedTest
    @EnumSource(value = BaseType.class, mode = EnumSource.Mode.EXCLUDE, names = {"ANY_URI", "HEX_BINARY"})
    void example_parseThenFormat_returnsExample(BaseType type) {
        Object value = type.parse(type.getExample());

        assertThat(value).isInstanceOf(type.valueType());
        assertThat(type.format(value)).isEqualTo(type.getExample());
    }

    @Test
    void hexBinary_formatsUpperCase() {
        Object value = BaseType.HEX_BINARY.parse("0fb7");

        assertThat((byte[]) value).containsExactly(0x0f, 0xb7);
        assertThat(BaseType.HEX_BINARY.format(value)).isEqualTo("0FB7");
    }

    @Test
    void forName_knownAndUnknownNames() {
        assertThat(BaseType.forName("dateTimeStamp")).contains(BaseType.DATE_TIME_STAMP);
        assertThat(BaseType.forName("anyURI")).contains(BaseType.ANY_URI);
        assertThat(BaseType.forName("varchar")).isEmpty();
    }

    @Test
    void isOrdered_onlyForNumbersDatesAndDurations() {
        assertThat(BaseType.INTEGER.isOrdered()).isTrue();
        assertThat(BaseType.DATE.isOrdered()).isTrue();
        assertThat(BaseType.DURATION.isOrdered()).isTrue();
        assertThat(BaseType.STRING.isOrdered()).isFalse();
        assertThat(BaseType.BOOLEAN.isOrdered()).isFalse();
    }

    @Test
    void supportsLength_onlyForStringsAndBinary() {
        assertThat(BaseType.STRING.supportsLength()).isTrue();
        assertThat(BaseType.BASE64_BINARY.supportsLength()).isTrue();
        assertThat(BaseType.DECIMAL.supportsLength()).isFalse();
    }

    @Test
    @DisplayName("boolean accepts true/false/1/0 and nothing else by default")
    void boolean_defaultTokens() {
        assertThat(BaseType.BOOLEAN.parse("1")).isEqualTo(true);
        assertThat(BaseType.BOOLEAN.parse("false")).isEqualTo(false);
        assertThatThrownBy(() -> BaseType.BOOLEAN.parse("yes"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void boolean_customTokens() {
        DerivedCodec codec = BaseType.BOOLEAN.derive(TextNode.valueOf("ja|nein"));

        assertThat(codec.parse("ja")).isEqualTo(true);
        assertThat(codec.parse("nein")).isEqualTo(false);
        assertThat(codec.format(false)).isEqualTo("nein");
        assertThatThrownBy(() -> codec.parse("true")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"YWJ", "YW Jj", "!!!!"})
    void base64_invalidInput_isRejected(String lexical) {
        assertThatThrownBy(() -> BaseType.BASE64_BINARY.parse(lexical))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "zz"})
    void hexBinary_invalidInput_isRejected(String lexical) {
        assertThatThrownBy(() -> BaseType.HEX_BINARY.parse(lexical))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void decimal_rejectsExponentNotation() {
        assertThatThrownBy(() -> BaseType.DECIMAL.parse("1.5e3"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void decimal_specialValuesMapToDoubles() {
        assertThat(BaseType.DECIMAL.parse("INF")).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(BaseType.DECIMAL.parse("-INF")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat((Double) BaseType.DECIMAL.parse("NaN")).isNaN();
        assertThat(BaseType.DECIMAL.format(Double.NEGATIVE_INFINITY)).isEqualTo("-INF");
    }

    @Test
    void decimal_swappedSeparators() {
        JsonNode format = json(Map.of("groupChar", ".", "decimalChar", ","));
        DerivedCodec codec = BaseType.DECIMAL.derive(format);

        Object value = codec.parse("1.234,5");

        assertThat((BigDecimal) value).isEqualByComparingTo("1234.5");
        assertThat(codec.format(value)).isEqualTo("1.234,5");
    }

    @Test
    void decimal_repeatedGroupChar_isRejected() {
        DerivedCodec codec = BaseType.DECIMAL.derive(json(Map.of("groupChar", ",")));

        assertThatThrownBy(() -> codec.parse("1,,234")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void decimal_percentAndPermille() {
        assertThat((BigDecimal) BaseType.DECIMAL.parse("50%")).isEqualByComparingTo("0.5");
        assertThat((BigDecimal) BaseType.DECIMAL.parse("5‰")).isEqualByComparingTo("0.005");
    }

    @Test
    void decimal_patternEnforcesGrouping() {
        DerivedCodec codec = BaseType.DECIMAL.derive(TextNode.valueOf("#,##0.00"));

        assertThat((BigDecimal) codec.parse("1,234.50")).isEqualByComparingTo("1234.5");
        assertThatThrownBy(() -> codec.parse("1234.50")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void unsignedTypes_enforceRange() {
        assertThat(BaseType.UNSIGNED_BYTE.parse("255")).isEqualTo(BigInteger.valueOf(255));
        assertThatThrownBy(() -> BaseType.UNSIGNED_BYTE.parse("256"))
            .isInstanceOf(InvalidLexicalValueException.class);
        assertThatThrownBy(() -> BaseType.UNSIGNED_INT.parse("-1"))
            .isInstanceOf(InvalidLexicalValueException.class);
        assertThat(BaseType.UNSIGNED_LONG.parse("18446744073709551615"))
            .isEqualTo(new BigInteger("18446744073709551615"));
    }

    @Test
    void integer_rejectsFraction() {
        assertThatThrownBy(() -> BaseType.INTEGER.parse("1.5"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void double_acceptsExponent() {
        assertThat(BaseType.DOUBLE.parse("1.5E3")).isEqualTo(1500.0);
    }

    @Test
    void date_withFormatPattern() {
        DerivedCodec codec = BaseType.DATE.derive(TextNode.valueOf("d.M.yyyy"));

        assertThat(codec.parse("3.2.2024")).isEqualTo(LocalDate.of(2024, 2, 3));
        assertThat(codec.format(LocalDate.of(2024, 2, 3))).isEqualTo("3.2.2024");
        assertThatThrownBy(() -> codec.parse("2024-02-03")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void date_invalidCalendarDate_isRejected() {
        assertThatThrownBy(() -> BaseType.DATE.parse("2024-02-30"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void dateTime_withOffset_keepsOffset() {
        Object value = BaseType.DATE_TIME.parse("2024-01-31T12:30:00+02:00");

        assertThat(value).isEqualTo(OffsetDateTime.of(2024, 1, 31, 12, 30, 0, 0, ZoneOffset.ofHours(2)));
    }

    @Test
    void dateTime_withTimezoneMarkerPattern_roundTrips() {
        DerivedCodec codec = BaseType.DATE_TIME.derive(TextNode.valueOf("yyyy-MM-dd HH:mm X"));

        Object withOffset = codec.parse("2024-01-31 12:30 +0130");
        Object withoutOffset = codec.parse("2024-01-31 12:30");

        assertThat(withOffset).isEqualTo(OffsetDateTime.of(2024, 1, 31, 12, 30, 0, 0, ZoneOffset.ofHoursMinutes(1, 30)));
        assertThat(withoutOffset).isEqualTo(LocalDateTime.of(2024, 1, 31, 12, 30));
        assertThat(codec.format(withoutOffset)).isEqualTo("2024-01-31 12:30");
    }

    @Test
    void dateTimeStamp_withoutOffset_isRejected() {
        assertThatThrownBy(() -> BaseType.DATE_TIME_STAMP.parse("2024-01-31T12:30:00.123456"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void durations_checkTheirSubtype() {
        assertThat(BaseType.DAY_TIME_DURATION.format(BaseType.DAY_TIME_DURATION.parse("PT36H"))).isEqualTo("PT36H");
        assertThatThrownBy(() -> BaseType.YEAR_MONTH_DURATION.parse("P1D"))
            .isInstanceOf(InvalidLexicalValueException.class);
        assertThatThrownBy(() -> BaseType.DURATION.parse("1 day"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void json_schemaFormat_rejectsNonConformingValues() {
        DerivedCodec codec = BaseType.JSON.derive(TextNode.valueOf("{\"type\": \"object\", \"required\": [\"id\"]}"));

        assertThat(codec.parse("{\"id\": 1}")).isInstanceOf(JsonNode.class);
        assertThatThrownBy(() -> codec.parse("{\"name\": \"x\"}")).isInstanceOf(InvalidLexicalValueException.class);
        assertThatThrownBy(() -> codec.parse("[1, 2]")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void json_malformedText_isRejected() {
        assertThatThrownBy(() -> BaseType.JSON.parse("{\"a\": 1} x"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void string_regexFormat_isEnforced() {
        DerivedCodec codec = BaseType.STRING.derive(TextNode.valueOf("[A-Z]{2}"));

        assertThat(codec.parse("DE")).isEqualTo("DE");
        assertThatThrownBy(() -> codec.parse("Deu")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void nmtoken_rejectsWhitespace() {
        assertThatThrownBy(() -> BaseType.NMTOKEN.parse("a b"))
            .isInstanceOf(InvalidLexicalValueException.class);
    }

    private static JsonNode json(Map<String, String> fields) {
        com.fasterxml.jackson.databind.node.ObjectNode node =
            com.fasterxml.jackson.databind.node.JsonNodeFactory.instance.objectNode();
        fields.forEach(node::put);
        return node;
    }
}
