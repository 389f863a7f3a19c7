package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.error.InvalidDescriptionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A natural-language property such as {@code titles}: strings grouped by language tag.
 * Untagged strings use the tag {@code und}.
 */
public final class NaturalLanguage {

    public static final String UNDEFINED = "und";

    private final Map<String, List<String>> values;

    private NaturalLanguage(Map<String, List<String>> values) {
        this.values = values;
    }

    /**
     * Reads a string, an array of strings, or an object mapping language tags to either.
     *
     * @param node property value
     * @return natural-language value
     * @throws InvalidDescriptionException for any other shape
     */
    public static NaturalLanguage fromJson(JsonNode node) {
        Map<String, List<String>> values = new LinkedHashMap<>();
        if (node.isTextual()) {
            values.put(UNDEFINED, List.of(node.asText()));
        } else if (node.isArray()) {
            values.put(UNDEFINED, strings(node));
        } else if (node.isObject()) {
            node.fields().forEachRemaining(e -> values.put(e.getKey(),
                e.getValue().isArray() ? strings(e.getValue()) : List.of(e.getValue().asText())));
        } else {
            throw new InvalidDescriptionException("invalid value type for natural language property: " + node);
        }
        return new NaturalLanguage(Collections.unmodifiableMap(values));
    }

    public static NaturalLanguage of(String... titles) {
        return new NaturalLanguage(Map.of(UNDEFINED, List.of(titles)));
    }

    private static List<String> strings(JsonNode array) {
        List<String> result = new ArrayList<>();
        array.forEach(n -> result.add(n.asText()));
        return List.copyOf(result);
    }

    /**
     * @return the first untagged string, else the first string of any language
     */
    public Optional<String> getFirst() {
        return getFirst(UNDEFINED).or(() -> values.values().stream()
            .filter(v -> !v.isEmpty())
            .map(v -> v.get(0))
            .findFirst());
    }

    public Optional<String> getFirst(String lang) {
        List<String> list = values.get(lang);
        return list == null || list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    public Map<String, List<String>> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return getFirst().orElse("");
    }
}
