package com.tabularmeta.core.source;

/**
 * A comment line captured while reading a data source.
 *
 * @param lineNumber 1-based line of the comment
 * @param text comment text without the comment prefix, trimmed
 */
public record SourceComment(int lineNumber, String text) {
}
