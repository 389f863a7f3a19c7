package com.tabularmeta.core.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabularmeta.core.source.ListRowSource;
import com.tabularmeta.core.source.RowSourceResolver;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for metadata tests.
 *
 * <p>Provides JSON parsing and in-memory table groups backed by {@link ListRowSource}s, so tests
 * can state a metadata document and its data side by side.
 */
public abstract class MetadataTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, ListRowSource> sources = new LinkedHashMap<>();

    /**
     * Parses JSON text.
     *
     * @param text JSON text
     * @return tree
     */
    protected static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Registers in-memory data for a table url. The first row is the header, unless the
     * table's dialect says otherwise.
     *
     * @param url table url
     * @param rows rows of cells
     */
    protected void data(String url, List<List<String>> rows) {
        sources.put(url, new ListRowSource(url, rows));
    }

    /**
     * Builds a table group over the registered data.
     *
     * @param metadata metadata document
     * @return table group
     */
    protected TableGroup group(String metadata) {
        return TableGroup.fromJson(json(metadata), RowSourceResolver.of(sources));
    }

    /**
     * Builds a group with a single table and returns the table.
     *
     * @param url table url
     * @param schema table schema JSON
     * @return table
     */
    protected Table table(String url, String schema) {
        return group("{\"tables\": [{\"url\": \"" + url + "\", \"tableSchema\": " + schema + "}]}")
            .table(url).orElseThrow();
    }
}
