package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Base of the descriptions that carry inherited properties: {@link Column}, {@link Schema},
 * {@link Table} and {@link TableGroup}.
 *
 * <p>Each description holds a link to the description containing it, set once by the container
 * while it is constructed. {@link #inherit(InheritedProperty)} walks this chain upwards until a
 * description sets the property, falling back to the property's terminal default.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Column column = schema.column("price").orElseThrow();
 * Datatype datatype = column.inherit(InheritedProperty.DATATYPE);   // may come from the table group
 * List<String> nulls = column.inherit(InheritedProperty.NULL);      // [""] unless set somewhere
 * }</pre>
 */
public abstract class Description {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final InheritedProperties inherited;
    private final Map<String, JsonNode> commonProperties;
    private final Map<String, JsonNode> atProperties;
    private Description parent;

    protected Description(DescriptionProperties props) {
        this.inherited = InheritedProperties.from(props);
        this.commonProperties = props.commonProperties();
        this.atProperties = props.atProperties();
    }

    /**
     * Known-field set of a description kind: its own fields plus the inherited properties.
     *
     * @param own fields specific to the kind
     * @return all known fields
     */
    protected static Set<String> withInherited(String... own) {
        Set<String> fields = new HashSet<>(InheritedProperties.NAMES);
        fields.addAll(Set.of(own));
        return Set.copyOf(fields);
    }

    /**
     * Links this description to its container. Called once, during the container's construction.
     *
     * @param container the containing description
     * @throws IllegalStateException if a different container was linked before
     */
    final void attachTo(Description container) {
        if (parent != null && parent != container) {
            throw new IllegalStateException(this + " already belongs to " + parent);
        }
        this.parent = container;
    }

    public Optional<Description> getParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Resolves an inherited property through the parent chain.
     *
     * @param property the property
     * @param <T> value type
     * @return the nearest declared value, or the property's terminal default
     */
    public <T> T inherit(InheritedProperty<T> property) {
        T own = property.get(inherited);
        if (own != null) {
            return own;
        }
        if (parent != null) {
            return parent.inherit(property);
        }
        return property.terminalDefault();
    }

    /**
     * Resolves an inherited property by name.
     *
     * @param name property name, e.g. {@code "datatype"}
     * @return resolved value, may be null
     * @throws IllegalArgumentException if the name is not an inherited property
     */
    public Object inherit(String name) {
        return inherit(InheritedProperty.byName(name)
            .orElseThrow(() -> new IllegalArgumentException("not an inherited property: " + name)));
    }

    public InheritedProperties getInheritedProperties() {
        return inherited;
    }

    public Map<String, JsonNode> getCommonProperties() {
        return commonProperties;
    }

    public Map<String, JsonNode> getAtProperties() {
        return atProperties;
    }

    /**
     * @return the {@code @id} of this description, if any
     */
    public Optional<String> getId() {
        JsonNode id = atProperties.get("id");
        return id == null || id.isNull() ? Optional.empty() : Optional.of(id.asText());
    }
}
