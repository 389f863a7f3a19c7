package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabularmeta.core.datatype.BaseType;
import com.tabularmeta.core.datatype.DerivedCodec;
import com.tabularmeta.core.datatype.ValueComparison;
import com.tabularmeta.core.error.InvalidDescriptionException;
import com.tabularmeta.core.error.InvalidLexicalValueException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A basetype plus the constraints a column declares on it: {@code format}, lengths and bounds.
 *
 * <p>All constraints are checked when the datatype is built; a datatype that exists is internally
 * consistent. Bound literals are parsed once, with the basetype's canonical format.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Datatype dt = Datatype.fromJson("{\"base\": \"integer\", \"minimum\": 1, \"maximum\": 10}");
 * Object value = dt.read("7");      // BigInteger 7
 * dt.read("11");                    // throws InvalidLexicalValueException
 * }</pre>
 */
public final class Datatype {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String XSD = "http://www.w3.org/2001/XMLSchema#";

    static final Set<String> FIELDS = Set.of(
        "base", "format", "length", "minLength", "maxLength",
        "minimum", "maximum", "minInclusive", "maxInclusive", "minExclusive", "maxExclusive");

    /**
     * A lower or upper bound.
     *
     * @param value parsed bound value
     * @param lexical bound as written
     * @param inclusive whether the bound value itself is allowed
     */
    public record Bound(Object value, String lexical, boolean inclusive) {}

    private final BaseType base;
    private final JsonNode format;
    private final Integer length;
    private final Integer minLength;
    private final Integer maxLength;
    private final Bound lower;
    private final Bound upper;
    private final DerivedCodec codec;
    private final Map<String, JsonNode> commonProperties;
    private final Map<String, JsonNode> atProperties;

    private Datatype(BaseType base, DescriptionProperties props) {
        this.base = base;
        this.format = props.field("format");
        this.length = nonNegative(props, "length");
        this.minLength = nonNegative(props, "minLength");
        this.maxLength = nonNegative(props, "maxLength");
        this.lower = bound(props, "minimum", "minInclusive", "minExclusive");
        this.upper = bound(props, "maximum", "maxInclusive", "maxExclusive");
        this.commonProperties = props.commonProperties();
        this.atProperties = props.atProperties();
        checkLengths();
        checkBounds();
        this.codec = base.derive(format);
    }

    /**
     * @param base basetype
     * @return datatype without constraints
     */
    public static Datatype of(BaseType base) {
        return new Datatype(base, DescriptionProperties.EMPTY);
    }

    /**
     * Reads a datatype description: a basetype name, or an object with {@code base} (default
     * {@code string}) and constraints.
     *
     * @param node description
     * @return datatype
     * @throws InvalidDescriptionException if the description is malformed or inconsistent
     */
    public static Datatype fromJson(JsonNode node) {
        if (node.isTextual()) {
            return new Datatype(baseType(node.asText()), DescriptionProperties.EMPTY);
        }
        DescriptionProperties props = DescriptionProperties.partition(node, FIELDS, "datatype");
        String base = props.text("base");
        return new Datatype(base == null ? BaseType.STRING : baseType(base), props);
    }

    /**
     * Reads a datatype description from JSON text.
     *
     * @param json JSON text, e.g. {@code "\"date\""} or {@code {"base": "date", "format": "d.M.yyyy"}}
     * @return datatype
     */
    public static Datatype fromJson(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidDescriptionException("invalid datatype JSON: " + json, e);
        }
    }

    private static BaseType baseType(String name) {
        String local = name.startsWith(XSD) ? name.substring(XSD.length())
            : name.startsWith("xsd:") ? name.substring(4) : name;
        return BaseType.forName(local)
            .orElseThrow(() -> new InvalidDescriptionException("unknown datatype base: " + name));
    }

    private static Integer nonNegative(DescriptionProperties props, String field) {
        JsonNode node = props.field(field);
        if (node == null || node.isNull()) {
            return null;
        }
        int value;
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            value = node.asInt();
        } else if (node.isTextual()) {
            value = parseInt(field, node.asText());
        } else {
            throw new InvalidDescriptionException(field + " must be an integer: " + node);
        }
        if (value < 0) {
            throw new InvalidDescriptionException(field + " must not be negative: " + value);
        }
        return value;
    }

    private static int parseInt(String field, String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new InvalidDescriptionException(field + " must be an integer: " + text, e);
        }
    }

    private Bound bound(DescriptionProperties props, String alias, String inclusive, String exclusive) {
        JsonNode aliasNode = props.field(alias);
        JsonNode inclusiveNode = props.field(inclusive);
        JsonNode exclusiveNode = props.field(exclusive);
        if (aliasNode != null && inclusiveNode != null && !aliasNode.asText().equals(inclusiveNode.asText())) {
            throw new InvalidDescriptionException(alias + " and " + inclusive + " differ");
        }
        JsonNode in = inclusiveNode != null ? inclusiveNode : aliasNode;
        if (in != null && exclusiveNode != null) {
            throw new InvalidDescriptionException(inclusive + " and " + exclusive + " must not both be set");
        }
        JsonNode node = in != null ? in : exclusiveNode;
        if (node == null || node.isNull()) {
            return null;
        }
        if (!base.isOrdered()) {
            throw new InvalidDescriptionException("bounds are not allowed for datatype " + base);
        }
        String lexical = node.asText();
        try {
            return new Bound(base.parse(lexical), lexical, in != null);
        } catch (InvalidLexicalValueException e) {
            throw new InvalidDescriptionException("invalid bound for " + base + ": " + lexical, e);
        }
    }

    private void checkLengths() {
        if ((length != null || minLength != null || maxLength != null) && !base.supportsLength()) {
            throw new InvalidDescriptionException("length constraints are not allowed for datatype " + base);
        }
        if (length != null && minLength != null && length < minLength) {
            throw new InvalidDescriptionException("length " + length + " is less than minLength " + minLength);
        }
        if (length != null && maxLength != null && length > maxLength) {
            throw new InvalidDescriptionException("length " + length + " is greater than maxLength " + maxLength);
        }
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new InvalidDescriptionException("minLength " + minLength + " is greater than maxLength " + maxLength);
        }
    }

    private void checkBounds() {
        if (lower == null || upper == null) {
            return;
        }
        int cmp;
        try {
            cmp = ValueComparison.compare(lower.value(), upper.value());
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptionException("bounds " + lower.lexical() + " and " + upper.lexical()
                + " are not comparable", e);
        }
        if (cmp > 0 || (cmp == 0 && !(lower.inclusive() && upper.inclusive()))) {
            throw new InvalidDescriptionException("empty value range: " + lower.lexical() + " .. " + upper.lexical());
        }
    }

    /**
     * Parses without checking constraints.
     *
     * @param lexical lexical value, may be null
     * @return typed value, or null for null input
     */
    public Object parse(String lexical) {
        return lexical == null ? null : codec.parse(lexical);
    }

    /**
     * Checks a parsed value against the length and bound constraints.
     *
     * @param value typed value, may be null
     * @return the value
     * @throws InvalidLexicalValueException if a constraint is violated
     */
    public Object validate(Object value) {
        if (value == null) {
            return null;
        }
        if (base.supportsLength()) {
            int actual = ValueComparison.length(value);
            if (length != null && actual != length) {
                throw violation(value, "length " + actual + " is not " + length);
            }
            if (minLength != null && actual < minLength) {
                throw violation(value, "length " + actual + " is less than minLength " + minLength);
            }
            if (maxLength != null && actual > maxLength) {
                throw violation(value, "length " + actual + " is greater than maxLength " + maxLength);
            }
        }
        if (lower != null) {
            int cmp = compare(value, lower);
            if (cmp < 0 || (cmp == 0 && !lower.inclusive())) {
                throw violation(value, "below minimum " + lower.lexical());
            }
        }
        if (upper != null) {
            int cmp = compare(value, upper);
            if (cmp > 0 || (cmp == 0 && !upper.inclusive())) {
                throw violation(value, "above maximum " + upper.lexical());
            }
        }
        return value;
    }

    private int compare(Object value, Bound bound) {
        try {
            return ValueComparison.compare(value, bound.value());
        } catch (IllegalArgumentException e) {
            throw new InvalidLexicalValueException(base.getName(), formatted(value), e.getMessage(), e);
        }
    }

    private InvalidLexicalValueException violation(Object value, String detail) {
        return new InvalidLexicalValueException(base.getName(), formatted(value), detail);
    }

    /**
     * Parses and validates.
     *
     * @param lexical lexical value, may be null
     * @return typed value
     */
    public Object read(String lexical) {
        return validate(parse(lexical));
    }

    /**
     * Formats a typed value with this datatype's format.
     *
     * @param value typed value
     * @return lexical value
     */
    public String formatted(Object value) {
        return codec.format(value);
    }

    public BaseType getBase() {
        return base;
    }

    public Optional<JsonNode> getFormat() {
        return Optional.ofNullable(format);
    }

    public Integer getLength() {
        return length;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public Optional<Bound> getLowerBound() {
        return Optional.ofNullable(lower);
    }

    public Optional<Bound> getUpperBound() {
        return Optional.ofNullable(upper);
    }

    public Map<String, JsonNode> getCommonProperties() {
        return commonProperties;
    }

    public Map<String, JsonNode> getAtProperties() {
        return atProperties;
    }

    @Override
    public String toString() {
        return format == null ? base.getName()
            : base.getName() + "(" + (format.isTextual() ? format.asText() : format.toString()) + ")";
    }
}
