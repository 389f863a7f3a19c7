package com.tabularmeta.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.error.InvalidDescriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CSVW dialect description: how the records of a data file are delimited and filtered.
 *
 * <p>Tokenizing (delimiter, quoting, line terminators) is delegated to OpenCSV; the filtering
 * properties ({@code skipRows}, {@code commentPrefix}, {@code skipBlankRows},
 * {@code skipColumns}, {@code trim}, header rows) are applied by {@link AbstractRawRowReader}.
 *
 * @param encoding character encoding name
 * @param lineTerminators accepted line terminators; the first is used for writing
 * @param quoteChar quote character, or null to disable quoting
 * @param doubleQuote whether quotes are escaped by doubling (otherwise by backslash)
 * @param skipRows number of leading records to skip
 * @param commentPrefix prefix marking comment records, or null
 * @param header whether the first non-skipped record is a header
 * @param headerRowCount number of header records
 * @param delimiter cell delimiter
 * @param skipColumns number of leading cells to drop from every record
 * @param skipBlankRows whether records with only empty cells are skipped
 * @param skipInitialSpace whether whitespace after a delimiter is ignored
 * @param trim one of {@code true}, {@code false}, {@code start}, {@code end}
 */
public record Dialect(
    String encoding,
    List<String> lineTerminators,
    Character quoteChar,
    boolean doubleQuote,
    int skipRows,
    String commentPrefix,
    boolean header,
    int headerRowCount,
    char delimiter,
    int skipColumns,
    boolean skipBlankRows,
    boolean skipInitialSpace,
    String trim
) {

    private static final Logger log = LoggerFactory.getLogger(Dialect.class);

    private static final List<String> TRIM_MODES = List.of("true", "false", "start", "end");

    public static final Dialect DEFAULT = new Dialect(
        "utf-8", List.of("\r\n", "\n"), '"', true, 0, "#", true, 1, ',', 0, false, false, "false");

    public Dialect {
        Objects.requireNonNull(encoding, "encoding must not be null");
        lineTerminators = List.copyOf(lineTerminators);
        if (skipRows < 0 || headerRowCount < 0 || skipColumns < 0) {
            throw new InvalidDescriptionException("dialect counts must not be negative");
        }
        if (!TRIM_MODES.contains(trim)) {
            throw new InvalidDescriptionException("invalid dialect trim: " + trim);
        }
    }

    /**
     * Reads a dialect description; absent properties take the CSVW defaults.
     *
     * @param node dialect object, or null
     * @return dialect
     * @throws InvalidDescriptionException if a property has an invalid value
     */
    public static Dialect fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return DEFAULT;
        }
        if (!node.isObject()) {
            throw new InvalidDescriptionException("dialect must be an object: " + node);
        }
        List<String> terminators = new ArrayList<>();
        JsonNode lt = node.get("lineTerminators");
        if (lt == null) {
            terminators.addAll(DEFAULT.lineTerminators);
        } else if (lt.isArray()) {
            lt.forEach(t -> terminators.add(t.asText()));
        } else {
            terminators.add(lt.asText());
        }
        Character quote = DEFAULT.quoteChar;
        if (node.has("quoteChar")) {
            JsonNode q = node.get("quoteChar");
            quote = q.isNull() || q.asText().isEmpty() ? null : q.asText().charAt(0);
        }
        String comment = DEFAULT.commentPrefix;
        if (node.has("commentPrefix")) {
            JsonNode c = node.get("commentPrefix");
            comment = c.isNull() || c.asText().isEmpty() ? null : c.asText();
        }
        String delimiter = node.path("delimiter").asText(",");
        if (delimiter.length() != 1) {
            throw new InvalidDescriptionException("dialect delimiter must be a single character: " + delimiter);
        }
        JsonNode trimNode = node.get("trim");
        String trim = trimNode == null ? DEFAULT.trim : trimNode.asText().toLowerCase();

        return new Dialect(
            encoding(node.path("encoding").asText(DEFAULT.encoding)),
            terminators,
            quote,
            node.path("doubleQuote").asBoolean(DEFAULT.doubleQuote),
            node.path("skipRows").asInt(DEFAULT.skipRows),
            comment,
            node.path("header").asBoolean(DEFAULT.header),
            node.path("headerRowCount").asInt(DEFAULT.headerRowCount),
            delimiter.charAt(0),
            node.path("skipColumns").asInt(DEFAULT.skipColumns),
            node.path("skipBlankRows").asBoolean(DEFAULT.skipBlankRows),
            node.path("skipInitialSpace").asBoolean(DEFAULT.skipInitialSpace),
            trim
        );
    }

    private static String encoding(String name) {
        if ("UTF-8-BOM".equalsIgnoreCase(name)) {
            return "utf-8";
        }
        if (!Charset.isSupported(name)) {
            log.warn("Invalid value for property encoding: {}. Using utf-8.", name);
            return "utf-8";
        }
        return name;
    }

    /**
     * @return the configured charset
     */
    public Charset charset() {
        return Charset.isSupported(encoding) ? Charset.forName(encoding) : StandardCharsets.UTF_8;
    }

    /**
     * Applies the {@code trim} mode to a cell.
     *
     * @param cell cell text
     * @return trimmed text
     */
    public String trim(String cell) {
        return switch (trim) {
            case "true" -> cell.strip();
            case "start" -> cell.stripLeading();
            case "end" -> cell.stripTrailing();
            default -> cell;
        };
    }

    /**
     * @return a copy with a different header flag
     */
    public Dialect withHeader(boolean header) {
        return new Dialect(encoding, lineTerminators, quoteChar, doubleQuote, skipRows, commentPrefix,
            header, headerRowCount, delimiter, skipColumns, skipBlankRows, skipInitialSpace, trim);
    }
}
