package com.tabularmeta.core.datatype;

/**
 * A basetype codec bound to one datatype's format.
 *
 * <p>Everything that depends on the format (compiled regex, date pattern, number pattern,
 * boolean tokens, JSON schema) is computed once when the codec is derived; {@link #parse} and
 * {@link #format} only apply it. Instances are immutable and may be shared between threads.
 */
public interface DerivedCodec {

    /**
     * Maps a lexical value to its typed value.
     *
     * @param lexical cell text
     * @return typed value
     * @throws com.tabularmeta.core.error.InvalidLexicalValueException if the text is not in the
     *         datatype's lexical space or does not match the format
     */
    Object parse(String lexical);

    /**
     * Maps a typed value back to text.
     *
     * @param value typed value as produced by {@link #parse}
     * @return lexical value
     */
    String format(Object value);
}
