package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@code json}: values map to Jackson {@link JsonNode} trees.
 *
 * <p>A {@code format} holding a JSON Schema document constrains the parsed values. A format that
 * is not JSON is ignored; a format that is JSON but not a usable schema is ignored with a warning.
 *
 * <pre>{@code
 * Datatype dt = Datatype.fromJson("{\"base\": \"json\", \"format\": \"{\\\"type\\\": \\\"object\\\"}\"}");
 * dt.read("{}");   // ObjectNode
 * dt.read("4");    // InvalidLexicalValueException
 * }</pre>
 */
public class JsonCodec extends AbstractCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    public JsonCodec(String name) {
        super(name);
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        JsonSchema schema = loadSchema(format);
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                JsonNode value;
                try {
                    value = MAPPER.readTree(lexical);
                } catch (JsonProcessingException e) {
                    throw invalid(lexical, e.getOriginalMessage(), e);
                }
                if (value == null || value.isMissingNode()) {
                    throw invalid(lexical);
                }
                if (schema != null) {
                    Set<ValidationMessage> errors = schema.validate(value);
                    if (!errors.isEmpty()) {
                        throw invalid(lexical, errors.stream()
                            .map(ValidationMessage::getMessage)
                            .collect(Collectors.joining("; ")));
                    }
                }
                return value;
            }

            @Override
            public String format(Object value) {
                try {
                    return MAPPER.writeValueAsString(value);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("value cannot be serialized as JSON: " + value, e);
                }
            }
        };
    }

    private JsonSchema loadSchema(JsonNode format) {
        String text = format != null && format.isTextual() ? format.asText() : null;
        if (text == null || text.isBlank()) {
            return null;
        }
        JsonNode schemaNode;
        try {
            schemaNode = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("json format is not a JSON document, ignoring: {}", text);
            return null;
        }
        if (schemaNode == null || !schemaNode.isObject()) {
            log.warn("Invalid JSON schema as datatype format: {}", text);
            return null;
        }
        try {
            return SCHEMA_FACTORY.getSchema(schemaNode);
        } catch (JsonSchemaException e) {
            log.warn("Invalid JSON schema as datatype format: {}", e.getMessage());
            return null;
        }
    }
}
