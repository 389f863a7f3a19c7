package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.error.InvalidDescriptionException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A table schema: ordered columns, foreign keys, primary key and row titles.
 *
 * <p>Virtual columns form the tail of the column list; a non-virtual column after a virtual one
 * is rejected, as are two columns with the same header.
 */
public class Schema extends Description {

    static final Set<String> FIELDS = withInherited("columns", "foreignKeys", "primaryKey", "rowTitles");

    private final List<Column> columns;
    private final List<ForeignKey> foreignKeys;
    private final List<String> primaryKey;
    private final List<String> rowTitles;

    Schema(DescriptionProperties props) {
        super(props);
        List<Column> cols = new ArrayList<>();
        JsonNode columnsNode = props.field("columns");
        if (columnsNode != null && columnsNode.isArray()) {
            columnsNode.forEach(c -> cols.add(Column.fromJson(c)));
        } else if (columnsNode != null && !columnsNode.isNull()) {
            throw new InvalidDescriptionException("columns must be an array: " + columnsNode);
        }
        boolean virtual = false;
        for (int i = 0; i < cols.size(); i++) {
            Column col = cols.get(i);
            if (col.isVirtual()) {
                virtual = true;
            } else if (virtual) {
                throw new InvalidDescriptionException("no non-virtual column allowed after virtual columns: " + col);
            }
            col.bind(this, i + 1);
        }
        Set<String> headers = new HashSet<>();
        for (Column col : cols) {
            if (!headers.add(col.header())) {
                throw new InvalidDescriptionException("duplicate column name: " + col.header());
            }
        }
        this.columns = List.copyOf(cols);

        List<ForeignKey> keys = new ArrayList<>();
        JsonNode keysNode = props.field("foreignKeys");
        if (keysNode != null && keysNode.isArray()) {
            keysNode.forEach(k -> keys.add(ForeignKey.fromJson(k)));
        }
        this.foreignKeys = List.copyOf(keys);
        this.primaryKey = List.copyOf(ForeignKey.columnReference(props.field("primaryKey")));
        this.rowTitles = List.copyOf(ForeignKey.columnReference(props.field("rowTitles")));
        log.debug("Built schema with {} columns, {} foreign keys", columns.size(), foreignKeys.size());
    }

    /**
     * @param node schema description
     * @return schema
     */
    public static Schema fromJson(JsonNode node) {
        return new Schema(DescriptionProperties.partition(node, FIELDS, "schema"));
    }

    /**
     * @return columns by header, in schema order
     */
    public Map<String, Column> columnsByHeader() {
        Map<String, Column> map = new LinkedHashMap<>();
        columns.forEach(c -> map.put(c.header(), c));
        return map;
    }

    /**
     * Looks up a column by header, then by first title, then by {@code propertyUrl}.
     *
     * @param key header, title or property URL
     * @return the column, if any matches
     */
    public Optional<Column> column(String key) {
        Column byHeader = columnsByHeader().get(key);
        if (byHeader != null) {
            return Optional.of(byHeader);
        }
        for (Column c : columns) {
            if (c.getTitles().flatMap(NaturalLanguage::getFirst).filter(key::equals).isPresent()) {
                return Optional.of(c);
            }
            UriTemplate propertyUrl = c.getInheritedProperties().propertyUrl();
            if (propertyUrl != null && propertyUrl.getTemplate().equals(key)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<ForeignKey> getForeignKeys() {
        return foreignKeys;
    }

    public List<String> getPrimaryKey() {
        return primaryKey;
    }

    public List<String> getRowTitles() {
        return rowTitles;
    }
}
