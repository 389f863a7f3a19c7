package com.tabularmeta.core.metadata;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Values of a primary or foreign key, normalized for equality: decimals compare by value
 * ({@code 1.0} equals {@code 1}) and binary values by content.
 */
final class KeyTuple {

    private final List<String> headers;
    private final List<Object> values;

    private KeyTuple(List<String> headers, List<Object> values) {
        this.headers = headers;
        this.values = values;
    }

    static KeyTuple of(List<String> headers, List<?> rawValues) {
        List<Object> values = new ArrayList<>(rawValues.size());
        for (Object value : rawValues) {
            values.add(normalize(value));
        }
        return new KeyTuple(headers, Collections.unmodifiableList(values));
    }

    static KeyTuple of(Row row, List<String> headers) {
        List<Object> values = new ArrayList<>(headers.size());
        for (String header : headers) {
            values.add(row.get(header));
        }
        return of(headers, values);
    }

    private static Object normalize(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros();
        }
        if (value instanceof byte[] bytes) {
            return ByteBuffer.wrap(bytes.clone());
        }
        return value;
    }

    boolean hasNull() {
        return values.contains(null);
    }

    List<Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeyTuple other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /**
     * @return {@code header:value} pairs, e.g. {@code ref:2}
     */
    @Override
    public String toString() {
        return IntStream.range(0, values.size())
            .mapToObj(i -> headers.get(i) + ":" + values.get(i))
            .collect(Collectors.joining(", "));
    }
}
