package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The inherited properties declared on one description. A null component means the property is
 * not set here and resolves through the parent chain.
 *
 * @param aboutUrl subject URI template
 * @param datatype cell datatype
 * @param defaultValue value substituted for empty cells
 * @param lang language of cell values
 * @param nullValues cell values meaning "no value"
 * @param ordered whether list values are ordered
 * @param propertyUrl property URI template
 * @param required whether a value is required
 * @param separator list separator
 * @param textDirection text direction
 * @param valueUrl value URI template
 */
public record InheritedProperties(
    UriTemplate aboutUrl,
    Datatype datatype,
    String defaultValue,
    String lang,
    List<String> nullValues,
    Boolean ordered,
    UriTemplate propertyUrl,
    Boolean required,
    String separator,
    String textDirection,
    UriTemplate valueUrl
) {

    /**
     * Names of all inherited properties as they appear in metadata documents.
     */
    public static final Set<String> NAMES = Set.of(
        "aboutUrl", "datatype", "default", "lang", "null", "ordered",
        "propertyUrl", "required", "separator", "textDirection", "valueUrl");

    public static final InheritedProperties NONE = new InheritedProperties(
        null, null, null, null, null, null, null, null, null, null, null);

    public InheritedProperties {
        nullValues = nullValues == null ? null : List.copyOf(nullValues);
    }

    /**
     * Reads the inherited properties among a description's fields.
     *
     * @param props classified description members
     * @return inherited properties
     */
    static InheritedProperties from(DescriptionProperties props) {
        JsonNode datatype = props.field("datatype");
        return new InheritedProperties(
            template(props.text("aboutUrl")),
            datatype == null || datatype.isNull() || (datatype.isTextual() && datatype.asText().isEmpty())
                ? null : Datatype.fromJson(datatype),
            props.text("default"),
            props.text("lang"),
            nullValues(props.field("null")),
            props.field("ordered") == null ? null : props.flag("ordered", false),
            template(props.text("propertyUrl")),
            props.field("required") == null ? null : props.flag("required", false),
            props.text("separator"),
            props.text("textDirection"),
            template(props.text("valueUrl"))
        );
    }

    private static UriTemplate template(String text) {
        return text == null ? null : UriTemplate.parse(text);
    }

    private static List<String> nullValues(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(n -> values.add(n.asText()));
            return values;
        }
        return List.of(node.asText());
    }
}
