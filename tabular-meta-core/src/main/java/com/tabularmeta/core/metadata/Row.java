package com.tabularmeta.core.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One typed row.
 *
 * @param source name of the data source
 * @param lineNumber 1-based line of the row in the source
 * @param values values by column header, in column order; null for missing values, a list for
 *               separator columns
 */
public record Row(String source, int lineNumber, Map<String, Object> values) {

    public Row {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @param header column header
     * @return value, or null
     */
    public Object get(String header) {
        return values.get(header);
    }

    /**
     * @return {@code source:line}
     */
    public String location() {
        return source + ":" + lineNumber;
    }
}
