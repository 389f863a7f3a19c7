package com.tabularmeta.core.metadata;

import com.tabularmeta.core.error.InvalidDescriptionException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Schema} and property inheritance.
 */
class SchemaTest extends MetadataTestBase {

    @Test
    void columns_inheritDatatypeFromSchema() {
        Schema schema = Schema.fromJson(json("""
            {"datatype": "integer", "columns": [{"name": "a"}, {"name": "b", "datatype": "string"}]}
            """));

        assertThat(schema.getColumns().get(0).read("5")).isEqualTo(BigInteger.valueOf(5));
        assertThat(schema.getColumns().get(1).read("5")).isEqualTo("5");
    }

    @Test
    void columns_inheritFromTableGroup() {
        data("t.csv", List.of(List.of("a"), List.of("NA")));
        TableGroup group = group("""
            {"null": "NA", "required": false,
             "tables": [{"url": "t.csv", "tableSchema": {"columns": [{"name": "a"}]}}]}
            """);
        Column column = group.getTables().get(0).getSchema().getColumns().get(0);

        assertThat(column.read("NA")).isNull();
        assertThat(column.inherit("null")).isEqualTo(List.of("NA"));
        assertThat(column.getParent()).containsInstanceOf(Schema.class);
    }

    @Test
    void virtualColumns_mustFormTheTail() {
        assertThatThrownBy(() -> Schema.fromJson(json("""
            {"columns": [{"name": "v", "virtual": true}, {"name": "b"}]}
            """)))
            .isInstanceOf(InvalidDescriptionException.class);
    }

    @Test
    void ordinals_areOneBased() {
        Schema schema = Schema.fromJson(json("{\"columns\": [{\"name\": \"a\"}, {\"name\": \"b\"}]}"));

        assertThat(schema.getColumns()).extracting(Column::getOrdinal).containsExactly(1, 2);
    }

    @Test
    void column_lookupByNameTitleOrPropertyUrl() {
        Schema schema = Schema.fromJson(json("""
            {"columns": [
              {"name": "id", "titles": "Identifier"},
              {"name": "label", "propertyUrl": "http://schema.org/name"}
            ]}
            """));

        assertThat(schema.column("id")).map(Column::header).contains("id");
        assertThat(schema.column("Identifier")).map(Column::header).contains("id");
        assertThat(schema.column("http://schema.org/name")).map(Column::header).contains("label");
        assertThat(schema.column("unknown")).isEmpty();
    }

    @Test
    void keysAcceptSingleNameOrArray() {
        Schema schema = Schema.fromJson(json("""
            {"columns": [{"name": "a"}, {"name": "b"}], "primaryKey": ["a", "b"], "rowTitles": "b"}
            """));

        assertThat(schema.getPrimaryKey()).containsExactly("a", "b");
        assertThat(schema.getRowTitles()).containsExactly("b");
    }

    @Test
    void foreignKey_referenceNeedsExactlyOneTarget() {
        assertThatThrownBy(() -> Schema.fromJson(json("""
            {"columns": [{"name": "a"}],
             "foreignKeys": [{"columnReference": "a",
                              "reference": {"resource": "x.csv", "schemaReference": "s", "columnReference": "id"}}]}
            """)))
            .isInstanceOf(InvalidDescriptionException.class);
    }

    @Test
    void duplicateHeaders_areRejected() {
        assertThatThrownBy(() -> Schema.fromJson(json("""
            {"columns": [{"name": "a"}, {"titles": "b"}, {"name": "b"}]}
            """)))
            .isInstanceOf(InvalidDescriptionException.class)
            .hasMessageContaining("duplicate column name: b");
    }
}
