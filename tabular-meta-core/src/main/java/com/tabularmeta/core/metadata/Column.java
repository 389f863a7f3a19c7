package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.BaseType;
import com.tabularmeta.core.error.InvalidDescriptionException;
import com.tabularmeta.core.error.MissingRequiredValueException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A column description: maps one cell to a typed value and back.
 *
 * <p>{@code required}, {@code null}, {@code default}, {@code separator} and {@code datatype} are
 * resolved through the inheritance chain (column, schema, table, table group).
 *
 * <p><b>Cell reading:</b>
 * <ol>
 *   <li>an empty cell takes the {@code default}</li>
 *   <li>a required column whose value is a null token is a {@link MissingRequiredValueException}</li>
 *   <li>with a {@code separator}: an empty value is an empty list, a null token is null, otherwise
 *       the value is split and each element is read (empty elements take the default, null tokens
 *       become null)</li>
 *   <li>without: a null token is null</li>
 *   <li>the remaining text goes through {@link Datatype#read(String)}</li>
 * </ol>
 */
public class Column extends Description {

    static final Set<String> FIELDS = withInherited("name", "titles", "virtual", "suppressOutput");

    /** Level-1 variable names of RFC 6570. */
    private static final Pattern VARNAME = Pattern.compile(
        "(?:[a-zA-Z0-9_]|%[a-fA-F0-9]{2})(?:\\.?(?:[a-zA-Z0-9_]|%[a-fA-F0-9]{2}))*");

    private final String name;
    private final NaturalLanguage titles;
    private final boolean virtual;
    private final boolean suppressOutput;
    private int ordinal;

    Column(DescriptionProperties props) {
        super(props);
        this.name = props.text("name");
        if (name != null && !VARNAME.matcher(name).matches()) {
            throw new InvalidDescriptionException("invalid column name: " + name);
        }
        JsonNode titlesNode = props.field("titles");
        this.titles = titlesNode == null || titlesNode.isNull() ? null : NaturalLanguage.fromJson(titlesNode);
        this.virtual = props.flag("virtual", false);
        this.suppressOutput = props.flag("suppressOutput", false);
    }

    /**
     * @param node column description
     * @return column, not yet part of a schema
     */
    public static Column fromJson(JsonNode node) {
        return new Column(DescriptionProperties.partition(node, FIELDS, "column"));
    }

    void bind(Schema schema, int ordinal) {
        attachTo(schema);
        this.ordinal = ordinal;
    }

    /**
     * @return name, else the first title, else {@code _col.N}
     */
    public String header() {
        if (name != null) {
            return name;
        }
        return Optional.ofNullable(titles).flatMap(NaturalLanguage::getFirst).orElse("_col." + ordinal);
    }

    /**
     * Reads one cell.
     *
     * @param cell raw cell text, may be null
     * @return typed value, a list of typed values for separator columns, or null
     * @throws MissingRequiredValueException if the column is required and the cell is a null token
     * @throws com.tabularmeta.core.error.InvalidLexicalValueException if a value does not fit the datatype
     */
    public Object read(String cell) {
        boolean required = inherit(InheritedProperty.REQUIRED);
        List<String> nulls = inherit(InheritedProperty.NULL);
        String defaultValue = inherit(InheritedProperty.DEFAULT);
        String separator = inherit(InheritedProperty.SEPARATOR);
        Datatype datatype = inherit(InheritedProperty.DATATYPE);

        String value = cell == null || cell.isEmpty() ? defaultValue : cell;
        if (required && nulls.contains(value)) {
            throw new MissingRequiredValueException();
        }

        if (separator != null) {
            if (value.isEmpty()) {
                return List.of();
            }
            if (nulls.contains(value)) {
                return null;
            }
            List<Object> items = new ArrayList<>();
            for (String element : value.split(Pattern.quote(separator), -1)) {
                String item = element.isEmpty() ? defaultValue : element;
                items.add(nulls.contains(item) ? null : readScalar(item, datatype));
            }
            return Collections.unmodifiableList(items);
        }
        if (nulls.contains(value)) {
            return null;
        }
        return readScalar(value, datatype);
    }

    private static Object readScalar(String value, Datatype datatype) {
        return datatype == null ? value : datatype.read(value);
    }

    /**
     * Formats a value for writing. Null becomes the first null token; lists are joined with the
     * separator.
     *
     * @param value typed value, list of typed values, or null
     * @return cell text
     */
    public String write(Object value) {
        String separator = inherit(InheritedProperty.SEPARATOR);
        if (separator != null) {
            if (value == null) {
                return "";
            }
            Collection<?> items = value instanceof Collection<?> c ? c : List.of(value);
            return items.stream().map(this::writeScalar).collect(Collectors.joining(separator));
        }
        return writeScalar(value);
    }

    private String writeScalar(Object value) {
        if (value == null) {
            List<String> nulls = inherit(InheritedProperty.NULL);
            return nulls.isEmpty() ? "" : nulls.get(0);
        }
        Datatype datatype = inherit(InheritedProperty.DATATYPE);
        return datatype == null ? String.valueOf(value) : datatype.formatted(value);
    }

    /**
     * @return the base datatype this column reads with; {@code string} if none is declared
     */
    public Datatype effectiveDatatype() {
        Datatype datatype = inherit(InheritedProperty.DATATYPE);
        return datatype == null ? Datatype.of(BaseType.STRING) : datatype;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<NaturalLanguage> getTitles() {
        return Optional.ofNullable(titles);
    }

    public boolean isVirtual() {
        return virtual;
    }

    public boolean isSuppressOutput() {
        return suppressOutput;
    }

    /**
     * @return 1-based position within the schema
     */
    public int getOrdinal() {
        return ordinal;
    }

    @Override
    public String toString() {
        return header();
    }
}
