package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.error.InvalidDescriptionException;

import java.util.ArrayList;
import java.util.List;

/**
 * A foreign key of a schema.
 *
 * @param columnReference referencing column names of the owning schema
 * @param reference referenced table or schema and columns
 */
public record ForeignKey(List<String> columnReference, Reference reference) {

    public ForeignKey {
        columnReference = List.copyOf(columnReference);
        if (columnReference.isEmpty()) {
            throw new InvalidDescriptionException("foreign key needs a columnReference");
        }
    }

    static ForeignKey fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidDescriptionException("foreign key must be an object: " + node);
        }
        return new ForeignKey(columnReference(node.get("columnReference")), Reference.fromJson(node.get("reference")));
    }

    /**
     * Reads a column reference: a single name or an array of names.
     *
     * @param node reference node, may be null
     * @return names, empty if absent
     */
    static List<String> columnReference(JsonNode node) {
        List<String> names = new ArrayList<>();
        if (node == null || node.isNull()) {
            return names;
        }
        if (node.isArray()) {
            node.forEach(n -> names.add(n.asText()));
        } else {
            names.add(node.asText());
        }
        return names;
    }
}
