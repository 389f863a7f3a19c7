package com.tabularmeta.core.metadata;

import com.tabularmeta.core.error.CsvwException;
import com.tabularmeta.core.error.MissingRequiredColumnException;
import com.tabularmeta.core.error.MissingRequiredValueException;
import com.tabularmeta.core.source.Dialect;
import com.tabularmeta.core.source.RawRow;
import com.tabularmeta.core.source.RawRowReader;
import com.tabularmeta.core.source.RawRowSource;
import com.tabularmeta.core.validation.ViolationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * One pass over a table's data: matches source cells to columns and reads them.
 *
 * <p>If the source header equals the schema's non-virtual headers, cells are matched by position;
 * otherwise each header is looked up in the schema and unmatched cells pass through as text.
 * Rows with a violation are reported and skipped.
 */
final class TableReader implements Iterator<Row>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TableReader.class);

    private record Slot(int index, String header, Column column) {}

    private final Table table;
    private final ViolationHandler handler;
    private final RawRowReader reader;
    private final String sourceName;
    private final List<Slot> slots;
    private final List<Column> virtualColumns;
    private int rowNumber;
    private Row next;

    TableReader(Table table, ViolationHandler handler) {
        this.table = table;
        this.handler = handler;
        Dialect dialect = table.getDialect();
        RawRowSource source = table.getRowSource();
        this.sourceName = source.name();
        this.reader = source.open(dialect);
        try {
            this.slots = match(dialect.header() ? reader.header() : null);
        } catch (RuntimeException e) {
            reader.close();
            throw e;
        }
        this.virtualColumns = table.getSchema().getColumns().stream()
            .filter(c -> c.isVirtual() && c.getInheritedProperties().valueUrl() != null)
            .toList();
    }

    private List<Slot> match(List<String> sourceHeader) {
        Schema schema = table.getSchema();
        List<Column> physical = schema.getColumns().stream().filter(c -> !c.isVirtual()).toList();
        List<String> names = physical.stream().map(Column::header).toList();
        List<String> header = sourceHeader == null ? names : sourceHeader;

        List<Slot> result = new ArrayList<>(header.size());
        if (header.equals(names)) {
            for (int i = 0; i < header.size(); i++) {
                result.add(new Slot(i, header.get(i), physical.get(i)));
            }
        } else {
            for (int i = 0; i < header.size(); i++) {
                result.add(new Slot(i, header.get(i), schema.column(header.get(i)).orElse(null)));
            }
        }

        Set<String> missing = new LinkedHashSet<>();
        for (Column column : schema.getColumns()) {
            if (column.inherit(InheritedProperty.REQUIRED) && !column.isVirtual()) {
                missing.add(column.header());
            }
        }
        result.stream().filter(s -> s.column() != null).forEach(s -> missing.remove(s.column().header()));
        if (!missing.isEmpty()) {
            throw new MissingRequiredColumnException(sourceName, missing);
        }
        log.debug("Reading {} with columns {}", sourceName, header);
        return result;
    }

    @Override
    public boolean hasNext() {
        try {
            while (next == null && reader.hasNext()) {
                next = decode(reader.next());
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        return next != null;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Row row = next;
        next = null;
        return row;
    }

    private Row decode(RawRow raw) {
        rowNumber++;
        Map<String, Object> values = new LinkedHashMap<>();
        boolean valid = true;
        List<String> cells = raw.cells();
        for (Slot slot : slots) {
            if (slot.index() >= cells.size()) {
                if (slot.column() != null && slot.column().inherit(InheritedProperty.REQUIRED)) {
                    handler.report(new MissingRequiredValueException(), location(raw, slot));
                    valid = false;
                }
                continue;
            }
            String cell = cells.get(slot.index());
            if (slot.column() == null) {
                values.put(slot.header(), cell);
                continue;
            }
            try {
                values.put(slot.column().header(), slot.column().read(cell));
            } catch (CsvwException e) {
                handler.report(e, location(raw, slot));
                valid = false;
            }
        }
        if (!valid) {
            return null;
        }
        if (!virtualColumns.isEmpty()) {
            Map<String, Object> variables = new LinkedHashMap<>(values);
            variables.put("_row", rowNumber);
            variables.put("_sourceRow", raw.lineNumber());
            for (Column column : virtualColumns) {
                values.put(column.header(), column.getInheritedProperties().valueUrl().expand(variables));
            }
        }
        return new Row(sourceName, raw.lineNumber(), values);
    }

    private String location(RawRow raw, Slot slot) {
        return sourceName + ":" + raw.lineNumber() + ":" + (slot.index() + 1) + " " + slot.header() + ":";
    }

    @Override
    public void close() {
        reader.close();
    }
}
