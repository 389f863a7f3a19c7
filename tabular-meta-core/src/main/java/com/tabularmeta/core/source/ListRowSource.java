package com.tabularmeta.core.source;

import java.util.Iterator;
import java.util.List;

/**
 * Pre-tokenized rows held in memory. Row {@code i} (0-based) is reported as line {@code i + 1};
 * a header row, if the dialect declares one, is the first element.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RawRowSource source = new ListRowSource("a.csv", List.of(
 *     List.of("id", "name"),
 *     List.of("1", "Anna")));
 * }</pre>
 */
public class ListRowSource implements RawRowSource {

    private final String name;
    private final List<List<String>> rows;

    public ListRowSource(String name, List<List<String>> rows) {
        this.name = name;
        this.rows = rows.stream().map(List::copyOf).toList();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RawRowReader open(Dialect dialect) {
        Iterator<List<String>> it = rows.iterator();
        return new AbstractRawRowReader(dialect) {
            private int line;

            @Override
            protected RawRow readRecord() {
                if (!it.hasNext()) {
                    return null;
                }
                return new RawRow(++line, it.next());
            }

            @Override
            protected void closeSource() {
                log.trace("Closed in-memory source {}", name);
            }
        };
    }
}
