package com.tabularmeta.core.source;

import java.nio.file.Path;
import java.util.Map;

/**
 * Maps a table {@code url} to the source holding its data.
 */
@FunctionalInterface
public interface RowSourceResolver {

    RawRowSource resolve(String url);

    /**
     * Resolves URLs as paths relative to a base directory, read with OpenCSV.
     *
     * @param baseDirectory directory of the metadata document
     * @return resolver
     */
    static RowSourceResolver relativeTo(Path baseDirectory) {
        return url -> new CsvRowSource(baseDirectory.resolve(url));
    }

    /**
     * Resolves URLs from a fixed map, e.g. of {@link ListRowSource}s.
     *
     * @param sources sources by url
     * @return resolver
     * @throws IllegalArgumentException on lookup of an unknown url
     */
    static RowSourceResolver of(Map<String, ? extends RawRowSource> sources) {
        Map<String, RawRowSource> copy = Map.copyOf(sources);
        return url -> {
            RawRowSource source = copy.get(url);
            if (source == null) {
                throw new IllegalArgumentException("No row source registered for " + url);
            }
            return source;
        };
    }
}
