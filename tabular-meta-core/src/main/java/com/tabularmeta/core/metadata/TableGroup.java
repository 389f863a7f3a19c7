package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabularmeta.core.datatype.BaseType;
import com.tabularmeta.core.error.InvalidDescriptionException;
import com.tabularmeta.core.error.ReferentialIntegrityException;
import com.tabularmeta.core.error.SchemaShapeException;
import com.tabularmeta.core.source.Dialect;
import com.tabularmeta.core.source.RowSourceResolver;
import com.tabularmeta.core.validation.ValidationLog;
import com.tabularmeta.core.validation.ViolationHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A group of tables described by one metadata document, with the foreign keys between them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TableGroup group = TableGroup.fromFile(Path.of("metadata.json"));
 * CollectingValidationLog log = new CollectingValidationLog();
 * if (!group.validate(log)) {
 *     log.getMessages().forEach(System.err::println);
 * }
 * }</pre>
 *
 * <p>Referential integrity is checked in two phases. The shape of every foreign key (arity,
 * column existence, compatible datatypes) is checked first and always throws
 * {@link SchemaShapeException}. Then, per referenced table and column tuple, the set of key values
 * is collected in one pass and every referencing row is looked up in it. Keys with a null
 * component are skipped; a list-valued single-column key is checked element by element.
 */
public class TableGroup extends Description {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Set<String> FIELDS = withInherited(
        "tables", "dialect", "notes", "tableDirection", "transformations", "url");

    /**
     * One foreign key, resolved.
     *
     * @param referenced referenced table
     * @param referencedHeaders referenced headers
     * @param child referencing table
     * @param childHeaders referencing headers
     */
    record Edge(Table referenced, List<String> referencedHeaders, Table child, List<String> childHeaders) {}

    private final List<Table> tables;
    private final Dialect dialect;
    private final String tableDirection;
    private final Path metadataFile;

    TableGroup(DescriptionProperties props, RowSourceResolver resolver, Path metadataFile) {
        super(props);
        JsonNode dialectNode = props.field("dialect");
        this.dialect = dialectNode == null ? null : Dialect.fromJson(dialectNode);
        this.tableDirection = Table.tableDirection(props);
        this.metadataFile = metadataFile;
        List<Table> list = new ArrayList<>();
        JsonNode tablesNode = props.field("tables");
        if (tablesNode == null || !tablesNode.isArray() || tablesNode.isEmpty()) {
            throw new InvalidDescriptionException("table group needs a non-empty tables array");
        }
        for (JsonNode tableNode : tablesNode) {
            Table table = Table.fromJson(tableNode, resolver);
            table.attachTo(this);
            list.add(table);
        }
        this.tables = List.copyOf(list);
        log.debug("Built table group with {} tables", tables.size());
    }

    /**
     * Reads a metadata document. Table urls resolve against the document's directory.
     *
     * @param metadataFile JSON metadata document
     * @return table group
     * @throws UncheckedIOException if the file cannot be read
     * @throws InvalidDescriptionException if the document is malformed
     */
    public static TableGroup fromFile(Path metadataFile) {
        JsonNode node;
        try {
            node = MAPPER.readTree(metadataFile.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read metadata " + metadataFile, e);
        }
        Path base = metadataFile.toAbsolutePath().getParent();
        return new TableGroup(DescriptionProperties.partition(node, FIELDS, "table group"),
            RowSourceResolver.relativeTo(base), metadataFile);
    }

    /**
     * Reads a table group description.
     *
     * @param node description
     * @param resolver where the tables' data lives
     * @return table group
     */
    public static TableGroup fromJson(JsonNode node, RowSourceResolver resolver) {
        return new TableGroup(DescriptionProperties.partition(node, FIELDS, "table group"), resolver, null);
    }

    /**
     * @param url table url as written in the metadata
     * @return the table
     */
    public Optional<Table> table(String url) {
        return tables.stream().filter(t -> t.getUrl().equals(url)).findFirst();
    }

    /**
     * Reads all rows of all tables.
     *
     * @param log violation sink, or null for strict mode
     * @return rows by table url
     */
    public Map<String, List<Row>> read(ValidationLog log) {
        Map<String, List<Row>> result = new LinkedHashMap<>();
        for (Table table : tables) {
            result.put(table.getUrl(), table.rows(log).toList());
        }
        return result;
    }

    /**
     * Reads all rows of all tables in strict mode.
     *
     * @return rows by table url
     */
    public Map<String, List<Row>> read() {
        return read(null);
    }

    /**
     * Checks primary keys of every table, then referential integrity.
     *
     * @param log violation sink, or null for strict mode
     * @return true if no violation was found
     */
    public boolean validate(ValidationLog log) {
        boolean success = true;
        for (Table table : tables) {
            success &= table.checkPrimaryKey(log);
        }
        return checkReferentialIntegrity(log) && success;
    }

    /**
     * Checks that every foreign key value of every table has a matching referenced row.
     *
     * @param log violation sink, or null for strict mode
     * @return true if all references resolve
     * @throws SchemaShapeException if a foreign key is malformed, in either mode
     * @throws ReferentialIntegrityException on the first dangling reference, in strict mode
     */
    public boolean checkReferentialIntegrity(ValidationLog log) {
        return checkReferentialIntegrity(log, log);
    }

    /**
     * Checks referential integrity, reporting invalid cells of the rows read for it to a sink of
     * their own. Callers that already validated every row pass {@link ValidationLog#discard()}.
     *
     * @param log sink for dangling references, or null for strict mode
     * @param rowLog sink for invalid rows met while reading, or null for strict mode
     * @return true if all references resolve
     */
    public boolean checkReferentialIntegrity(ValidationLog log, ValidationLog rowLog) {
        List<Edge> edges = resolveForeignKeys();
        ViolationHandler handler = ViolationHandler.of(log);
        boolean success = true;

        Map<Table, Map<List<String>, List<Edge>>> byTable = new LinkedHashMap<>();
        for (Edge edge : edges) {
            byTable.computeIfAbsent(edge.referenced(), t -> new LinkedHashMap<>())
                .computeIfAbsent(edge.referencedHeaders(), k -> new ArrayList<>())
                .add(edge);
        }

        for (Map.Entry<Table, Map<List<String>, List<Edge>>> entry : byTable.entrySet()) {
            Table referenced = entry.getKey();
            Map<List<String>, Set<KeyTuple>> seen = new LinkedHashMap<>();
            entry.getValue().keySet().forEach(k -> seen.put(k, new HashSet<>()));
            try (Stream<Row> rows = referenced.rows(rowLog).stream()) {
                rows.forEach(row -> seen.forEach((headers, keys) -> keys.add(KeyTuple.of(row, headers))));
            }
            for (Map.Entry<List<String>, List<Edge>> shape : entry.getValue().entrySet()) {
                Set<KeyTuple> keys = seen.get(shape.getKey());
                for (Edge edge : shape.getValue()) {
                    success &= checkEdge(edge, keys, handler, rowLog);
                }
            }
        }
        return success;
    }

    private boolean checkEdge(Edge edge, Set<KeyTuple> keys, ViolationHandler handler, ValidationLog rowLog) {
        boolean success = true;
        try (Stream<Row> rows = edge.child().rows(rowLog).stream()) {
            Iterator<Row> it = rows.iterator();
            while (it.hasNext()) {
                success &= checkRow(edge, it.next(), keys, handler);
            }
        }
        return success;
    }

    private boolean checkRow(Edge edge, Row row, Set<KeyTuple> keys, ViolationHandler handler) {
        List<KeyTuple> candidates = new ArrayList<>();
        Object first = row.get(edge.childHeaders().get(0));
        if (edge.childHeaders().size() == 1 && first instanceof List<?> list) {
            for (Object element : list) {
                candidates.add(KeyTuple.of(edge.referencedHeaders(), Collections.singletonList(element)));
            }
        } else {
            List<Object> values = new ArrayList<>();
            edge.childHeaders().forEach(h -> values.add(row.get(h)));
            candidates.add(KeyTuple.of(edge.referencedHeaders(), values));
        }
        boolean success = true;
        for (KeyTuple candidate : candidates) {
            if (candidate.hasNull()) {
                continue;
            }
            if (!keys.contains(candidate)) {
                String keyText = KeyTuple.of(edge.childHeaders(), candidate.values()).toString();
                handler.report(new ReferentialIntegrityException(
                    "key " + keyText + " not found in table " + edge.referenced().getUrl()), row.location());
                success = false;
            }
        }
        return success;
    }

    /**
     * Checks the shape of every foreign key without reading any rows.
     *
     * @throws SchemaShapeException on the first malformed foreign key
     */
    public void checkForeignKeyShapes() {
        resolveForeignKeys();
    }

    /**
     * Resolves and checks the shape of every foreign key.
     *
     * @return resolved foreign keys
     * @throws SchemaShapeException if a reference does not resolve, arities differ, a column is
     *         missing or the datatypes are incompatible
     */
    List<Edge> resolveForeignKeys() {
        List<Edge> edges = new ArrayList<>();
        for (Table child : tables) {
            for (ForeignKey fk : child.getSchema().getForeignKeys()) {
                Reference ref = fk.reference();
                Table referenced = ref.resource() != null
                    ? table(ref.resource()).orElseThrow(() -> new SchemaShapeException(
                        child.getUrl() + ": foreign key references unknown table " + ref.resource()))
                    : tableWithSchema(ref.schemaReference()).orElseThrow(() -> new SchemaShapeException(
                        child.getUrl() + ": foreign key references unknown schema " + ref.schemaReference()));
                if (fk.columnReference().size() != ref.columnReference().size()) {
                    throw new SchemaShapeException(child.getUrl() + ": foreign key " + fk.columnReference()
                        + " and reference " + ref.columnReference() + " differ in size");
                }
                List<Column> childColumns = columns(child, fk.columnReference());
                List<Column> referencedColumns = columns(referenced, ref.columnReference());
                for (int i = 0; i < childColumns.size(); i++) {
                    BaseType childType = childColumns.get(i).effectiveDatatype().getBase();
                    BaseType referencedType = referencedColumns.get(i).effectiveDatatype().getBase();
                    if (!childType.valueType().equals(referencedType.valueType())) {
                        throw new SchemaShapeException(child.getUrl() + ": foreign key column "
                            + childColumns.get(i) + " (" + childType + ") is incompatible with "
                            + referenced.getUrl() + " column " + referencedColumns.get(i) + " (" + referencedType + ")");
                    }
                }
                edges.add(new Edge(referenced, headers(referencedColumns), child, headers(childColumns)));
            }
        }
        return edges;
    }

    private Optional<Table> tableWithSchema(String schemaId) {
        return tables.stream()
            .filter(t -> t.getSchema().getId().filter(schemaId::equals).isPresent())
            .findFirst();
    }

    private static List<Column> columns(Table table, List<String> names) {
        List<Column> columns = new ArrayList<>(names.size());
        for (String name : names) {
            columns.add(table.getSchema().column(name).orElseThrow(() -> new SchemaShapeException(
                table.getUrl() + " has no column " + name)));
        }
        return columns;
    }

    private static List<String> headers(List<Column> columns) {
        return columns.stream().map(Column::header).toList();
    }

    /**
     * @return the group-level dialect, or {@link Dialect#DEFAULT}
     */
    public Dialect getDialect() {
        return dialect == null ? Dialect.DEFAULT : dialect;
    }

    public List<Table> getTables() {
        return tables;
    }

    public String getTableDirection() {
        return tableDirection;
    }

    /**
     * @return the metadata document this group was loaded from, if any
     */
    public Optional<Path> getMetadataFile() {
        return Optional.ofNullable(metadataFile);
    }
}
