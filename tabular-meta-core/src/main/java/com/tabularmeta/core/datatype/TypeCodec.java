package com.tabularmeta.core.datatype;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Codec family of a {@link BaseType}: turns a datatype's {@code format} annotation into a
 * {@link DerivedCodec}.
 */
@FunctionalInterface
public interface TypeCodec {

    /**
     * Precomputes the format-dependent state.
     *
     * @param format the datatype's {@code format} (a string or an object), or null
     * @return codec bound to the format
     * @throws com.tabularmeta.core.error.InvalidDescriptionException if the format is malformed
     *         in a way that must fail fast (e.g. an unsupported date pattern)
     */
    DerivedCodec derive(JsonNode format);
}
