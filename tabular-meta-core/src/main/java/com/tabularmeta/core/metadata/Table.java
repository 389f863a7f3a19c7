package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import com.tabularmeta.core.error.DuplicatePrimaryKeyException;
import com.tabularmeta.core.error.InvalidDescriptionException;
import com.tabularmeta.core.source.Dialect;
import com.tabularmeta.core.source.RawRowSource;
import com.tabularmeta.core.source.RowSourceResolver;
import com.tabularmeta.core.validation.ValidationLog;
import com.tabularmeta.core.validation.ViolationHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A table description: a data source bound to a {@link Schema} and a {@link Dialect}.
 *
 * <p>The table's own dialect is used if it declares one, else the group's, else
 * {@link Dialect#DEFAULT}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Table table = group.table("countries.csv").orElseThrow();
 * CollectingValidationLog log = new CollectingValidationLog();
 * for (Row row : table.rows(log)) {
 *     ...
 * }
 * boolean unique = table.checkPrimaryKey(log);
 * }</pre>
 */
public class Table extends Description {

    static final Set<String> FIELDS = withInherited(
        "url", "tableSchema", "dialect", "notes", "tableDirection", "transformations", "suppressOutput");

    private static final List<String> TABLE_DIRECTIONS = List.of("rtl", "ltr", "auto");

    private final String url;
    private final Schema schema;
    private final Dialect dialect;
    private final boolean suppressOutput;
    private final String tableDirection;
    private final List<JsonNode> notes;
    private final RowSourceResolver resolver;

    Table(DescriptionProperties props, RowSourceResolver resolver) {
        super(props);
        this.url = props.text("url");
        if (url == null) {
            throw new InvalidDescriptionException("table without url");
        }
        JsonNode schemaNode = props.field("tableSchema");
        if (schemaNode != null && schemaNode.isTextual()) {
            throw new InvalidDescriptionException("external schema references are not supported: " + schemaNode.asText());
        }
        this.schema = Schema.fromJson(schemaNode);
        this.schema.attachTo(this);
        JsonNode dialectNode = props.field("dialect");
        this.dialect = dialectNode == null ? null : Dialect.fromJson(dialectNode);
        this.suppressOutput = props.flag("suppressOutput", false);
        this.tableDirection = tableDirection(props);
        List<JsonNode> noteList = new ArrayList<>();
        JsonNode notesNode = props.field("notes");
        if (notesNode != null && notesNode.isArray()) {
            notesNode.forEach(noteList::add);
        }
        this.notes = List.copyOf(noteList);
        this.resolver = resolver;
    }

    static String tableDirection(DescriptionProperties props) {
        String direction = props.text("tableDirection");
        if (direction == null) {
            return "auto";
        }
        if (!TABLE_DIRECTIONS.contains(direction)) {
            throw new InvalidDescriptionException("invalid tableDirection: " + direction);
        }
        return direction;
    }

    /**
     * Reads a standalone table description.
     *
     * @param node table description
     * @param resolver where the table's data lives
     * @return table
     */
    public static Table fromJson(JsonNode node, RowSourceResolver resolver) {
        return new Table(DescriptionProperties.partition(node, FIELDS, "table"), resolver);
    }

    /**
     * @return the dialect rows are read and written with
     */
    public Dialect getDialect() {
        if (dialect != null) {
            return dialect;
        }
        return getParent()
            .filter(TableGroup.class::isInstance)
            .map(p -> ((TableGroup) p).getDialect())
            .orElse(Dialect.DEFAULT);
    }

    RawRowSource getRowSource() {
        return resolver.resolve(url);
    }

    /**
     * Typed rows of this table.
     *
     * @param log sink for violations, or null to throw the first one
     * @return lazy, restartable row sequence
     */
    public RowSequence rows(ValidationLog log) {
        return new RowSequence(this, log);
    }

    /**
     * Typed rows in strict mode: the first violation is thrown.
     *
     * @return lazy, restartable row sequence
     */
    public RowSequence rows() {
        return rows(null);
    }

    /**
     * Checks that no two valid rows share a primary key. Invalid rows are ignored.
     *
     * @param log sink for duplicates, or null to throw the first one
     * @return true if all keys are unique
     * @throws DuplicatePrimaryKeyException on the first duplicate, in strict mode
     */
    public boolean checkPrimaryKey(ValidationLog log) {
        List<String> keyHeaders = headers(schema.getPrimaryKey());
        if (keyHeaders.isEmpty()) {
            return true;
        }
        ViolationHandler handler = ViolationHandler.of(log);
        Set<KeyTuple> seen = new HashSet<>();
        boolean success = true;
        try (Stream<Row> rows = rows(ValidationLog.discard()).stream()) {
            Iterator<Row> it = rows.iterator();
            while (it.hasNext()) {
                Row row = it.next();
                KeyTuple key = KeyTuple.of(row, keyHeaders);
                if (!seen.add(key)) {
                    handler.report(new DuplicatePrimaryKeyException("duplicate primary key: " + key), row.location());
                    success = false;
                }
            }
        }
        return success;
    }

    /**
     * Maps column references to row headers.
     *
     * @param columnReference column names
     * @return headers
     * @throws InvalidDescriptionException if a name does not denote a column
     */
    List<String> headers(List<String> columnReference) {
        List<String> headers = new ArrayList<>(columnReference.size());
        for (String ref : columnReference) {
            headers.add(schema.column(ref)
                .orElseThrow(() -> new InvalidDescriptionException(url + " has no column " + ref))
                .header());
        }
        return headers;
    }

    /**
     * Writes rows as delimited text. Virtual columns are not written; a header row is written if
     * the dialect declares one.
     *
     * @param rows rows as maps keyed by header or column name, or as lists in column order
     * @param out target, closed when done
     * @return number of rows written
     * @throws UncheckedIOException on write failure
     */
    public int write(Iterable<?> rows, Writer out) {
        Dialect d = getDialect();
        List<Column> physical = schema.getColumns().stream().filter(c -> !c.isVirtual()).toList();
        int count = 0;
        try (ICSVWriter writer = new CSVWriterBuilder(out)
            .withSeparator(d.delimiter())
            .withQuoteChar(d.quoteChar() == null ? ICSVWriter.NO_QUOTE_CHARACTER : d.quoteChar())
            .withEscapeChar(d.doubleQuote() ? ICSVWriter.DEFAULT_ESCAPE_CHARACTER : '\\')
            .withLineEnd(d.lineTerminators().isEmpty() ? ICSVWriter.DEFAULT_LINE_END : d.lineTerminators().get(0))
            .build()) {
            if (d.header()) {
                writer.writeNext(physical.stream().map(Column::header).toArray(String[]::new), false);
            }
            for (Object item : rows) {
                String[] cells = new String[physical.size()];
                for (int i = 0; i < physical.size(); i++) {
                    cells[i] = physical.get(i).write(valueOf(item, physical.get(i), i));
                }
                writer.writeNext(cells, false);
                count++;
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + url, e);
        }
        log.debug("Wrote {} rows of {}", count, url);
        return count;
    }

    private static Object valueOf(Object item, Column column, int index) {
        if (item instanceof Row row) {
            return row.get(column.header());
        }
        if (item instanceof Map<?, ?> map) {
            Object value = map.get(column.header());
            return value != null ? value : column.getName().map(map::get).orElse(null);
        }
        if (item instanceof List<?> list) {
            return index < list.size() ? list.get(index) : null;
        }
        throw new IllegalArgumentException("cannot write row of type " + item.getClass().getName());
    }

    public String getUrl() {
        return url;
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * @return the dialect declared on this table itself
     */
    public Optional<Dialect> getOwnDialect() {
        return Optional.ofNullable(dialect);
    }

    public boolean isSuppressOutput() {
        return suppressOutput;
    }

    public String getTableDirection() {
        return tableDirection;
    }

    public List<JsonNode> getNotes() {
        return notes;
    }

    @Override
    public String toString() {
        return url;
    }
}
