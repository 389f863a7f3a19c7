package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.error.InvalidDescriptionException;

import java.util.List;

/**
 * Target of a foreign key: a table ({@code resource}) or a schema ({@code schemaReference}),
 * never both, and the referenced columns.
 *
 * @param resource url of the referenced table, or null
 * @param schemaReference {@code @id} of the referenced schema, or null
 * @param columnReference referenced column names
 */
public record Reference(String resource, String schemaReference, List<String> columnReference) {

    public Reference {
        if ((resource == null) == (schemaReference == null)) {
            throw new InvalidDescriptionException(
                "foreign key reference needs exactly one of resource and schemaReference");
        }
        columnReference = List.copyOf(columnReference);
        if (columnReference.isEmpty()) {
            throw new InvalidDescriptionException("foreign key reference needs a columnReference");
        }
    }

    static Reference fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidDescriptionException("foreign key reference must be an object: " + node);
        }
        return new Reference(
            node.hasNonNull("resource") ? node.get("resource").asText() : null,
            node.hasNonNull("schemaReference") ? node.get("schemaReference").asText() : null,
            ForeignKey.columnReference(node.get("columnReference")));
    }
}
