package com.tabularmeta.core.metadata;

import com.tabularmeta.core.error.InvalidDescriptionException;
import com.tabularmeta.core.error.InvalidLexicalValueException;
import com.tabularmeta.core.error.MissingRequiredValueException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Column} cell reading and writing.
 */
class ColumnTest extends MetadataTestBase {

    private static Column column(String json) {
        return Column.fromJson(json(json));
    }

    @Test
    void read_emptyCell_isNull() {
        Column column = column("{\"name\": \"a\"}");

        assertThat(column.read("")).isNull();
        assertThat(column.read("x")).isEqualTo("x");
    }

    @Test
    void read_emptyCell_takesDefault() {
        Column column = column("{\"name\": \"a\", \"default\": \"7\", \"datatype\": \"integer\"}");

        assertThat(column.read("")).isEqualTo(BigInteger.valueOf(7));
    }

    @Test
    void read_customNullTokens() {
        Column column = column("{\"name\": \"a\", \"null\": [\"NA\", \"-\"], \"datatype\": \"integer\"}");

        assertThat(column.read("NA")).isNull();
        assertThat(column.read("-")).isNull();
        assertThatThrownBy(() -> column.read("")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void read_requiredEmptyCell_isMissingValue() {
        Column column = column("{\"name\": \"a\", \"required\": true}");

        assertThatThrownBy(() -> column.read("")).isInstanceOf(MissingRequiredValueException.class);
        assertThat(column.read("x")).isEqualTo("x");
    }

    @Test
    void read_requiredIsCheckedBeforeSeparator() {
        Column column = column("{\"name\": \"a\", \"required\": true, \"separator\": \";\"}");

        assertThatThrownBy(() -> column.read("")).isInstanceOf(MissingRequiredValueException.class);
    }

    @Test
    void read_separator_splitsAndTypesElements() {
        Column column = column("{\"name\": \"a\", \"separator\": \" \", \"datatype\": \"integer\"}");

        assertThat(column.read("1 2 3")).isEqualTo(List.of(BigInteger.ONE, BigInteger.TWO, BigInteger.valueOf(3)));
        assertThat(column.read("")).isEqualTo(List.of());
    }

    @Test
    void read_separator_nullTokenIsNullAndEmptyElementsTakeDefault() {
        Column column = column("{\"name\": \"a\", \"separator\": \";\", \"null\": \"NA\", \"default\": \"x\"}");

        assertThat(column.read("NA")).isNull();
        assertThat(column.read("a;;NA")).isEqualTo(Arrays.asList("a", "x", null));
    }

    @Test
    void read_invalidElement_failsWholeCell() {
        Column column = column("{\"name\": \"a\", \"separator\": \",\", \"datatype\": \"integer\"}");

        assertThatThrownBy(() -> column.read("1,x")).isInstanceOf(InvalidLexicalValueException.class);
    }

    @Test
    void write_joinsListsAndWritesNullToken() {
        Column list = column("{\"name\": \"a\", \"separator\": \"|\", \"datatype\": \"integer\"}");
        Column scalar = column("{\"name\": \"b\", \"null\": \"NA\", \"datatype\": {\"base\": \"decimal\", \"format\": {\"decimalChar\": \",\"}}}");

        assertThat(list.write(List.of(BigInteger.ONE, BigInteger.TWO))).isEqualTo("1|2");
        assertThat(scalar.write(null)).isEqualTo("NA");
        assertThat(scalar.write(new java.math.BigDecimal("1.5"))).isEqualTo("1,5");
    }

    @Test
    void header_fallsBackToTitleThenPosition() {
        Schema schema = Schema.fromJson(json("""
            {"columns": [{"name": "id"}, {"titles": {"en": ["Name"], "de": ["Name"]}}, {}]}
            """));

        assertThat(schema.getColumns()).extracting(Column::header).containsExactly("id", "Name", "_col.3");
    }

    @Test
    void invalidName_isRejected() {
        assertThatThrownBy(() -> column("{\"name\": \"first name\"}"))
            .isInstanceOf(InvalidDescriptionException.class);
    }

    @Test
    void effectiveDatatype_defaultsToString() {
        assertThat(column("{\"name\": \"a\"}").effectiveDatatype().getBase())
            .isEqualTo(com.tabularmeta.core.datatype.BaseType.STRING);
    }
}
