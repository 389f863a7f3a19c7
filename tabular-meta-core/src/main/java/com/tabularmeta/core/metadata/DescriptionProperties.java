package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.error.InvalidDescriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The members of a description object, classified.
 *
 * <ul>
 *   <li>{@code fields}: members the entity knows</li>
 *   <li>{@code commonProperties}: {@code prefix:name} members, kept as given</li>
 *   <li>{@code atProperties}: {@code @}-members ({@code @id}, {@code @type}, ...), keyed without
 *       the {@code @}</li>
 * </ul>
 *
 * Any other member is ignored with a warning.
 *
 * @param fields known fields
 * @param commonProperties common properties
 * @param atProperties {@code @}-properties
 */
public record DescriptionProperties(
    Map<String, JsonNode> fields,
    Map<String, JsonNode> commonProperties,
    Map<String, JsonNode> atProperties
) {

    private static final Logger log = LoggerFactory.getLogger(DescriptionProperties.class);

    static final DescriptionProperties EMPTY = new DescriptionProperties(Map.of(), Map.of(), Map.of());

    public DescriptionProperties {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        commonProperties = Collections.unmodifiableMap(new LinkedHashMap<>(commonProperties));
        atProperties = Collections.unmodifiableMap(new LinkedHashMap<>(atProperties));
    }

    /**
     * Classifies the members of a description object.
     *
     * @param node description object, or null for an empty description
     * @param knownFields names the owning entity understands
     * @param owner entity kind, used in warnings
     * @return classified members
     * @throws InvalidDescriptionException if the node is not an object
     */
    public static DescriptionProperties partition(JsonNode node, Set<String> knownFields, String owner) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new InvalidDescriptionException(owner + " description must be an object: " + node);
        }
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Map<String, JsonNode> common = new LinkedHashMap<>();
        Map<String, JsonNode> at = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            if (key.startsWith("@")) {
                at.put(key.substring(1), entry.getValue());
            } else if (key.contains(":")) {
                common.put(key, entry.getValue());
            } else if (knownFields.contains(key)) {
                fields.put(key, entry.getValue());
            } else {
                log.warn("Ignoring unknown {} property: {}", owner, key);
            }
        });
        return new DescriptionProperties(fields, common, at);
    }

    /**
     * @param name field name
     * @return the field's value, or null if absent
     */
    public JsonNode field(String name) {
        return fields.get(name);
    }

    /**
     * @param name field name
     * @return the field as text, or null if absent or JSON null
     */
    public String text(String name) {
        JsonNode node = fields.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * @param name field name
     * @param defaultValue value if absent
     * @return the field as boolean
     */
    public boolean flag(String name, boolean defaultValue) {
        JsonNode node = fields.get(name);
        return node == null || node.isNull() ? defaultValue : node.asBoolean(defaultValue);
    }
}
