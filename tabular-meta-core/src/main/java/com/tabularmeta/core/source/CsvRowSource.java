package com.tabularmeta.core.source;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * A delimited text file, tokenized with OpenCSV.
 *
 * <p>Line numbers are physical: a record spanning several lines (quoted line breaks) is numbered
 * by its first line. A leading byte order mark is dropped.
 */
public class CsvRowSource implements RawRowSource {

    private static final char BOM = '\uFEFF';

    private final Path path;

    public CsvRowSource(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String name() {
        return path.getFileName().toString();
    }

    @Override
    public RawRowReader open(Dialect dialect) {
        try {
            Reader reader = Files.newBufferedReader(path, dialect.charset());
            return new Csv(reader, dialect);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + path, e);
        }
    }

    @Override
    public String toString() {
        return path.toString();
    }

    static CSVParser parser(Dialect dialect) {
        Character quote = dialect.quoteChar();
        return new CSVParserBuilder()
            .withSeparator(dialect.delimiter())
            .withQuoteChar(quote == null ? ICSVParser.NULL_CHARACTER : quote)
            .withEscapeChar(dialect.doubleQuote() || quote == null ? ICSVParser.NULL_CHARACTER : '\\')
            .withIgnoreLeadingWhiteSpace(dialect.skipInitialSpace())
            .withIgnoreQuotations(quote == null)
            .withStrictQuotes(false)
            .build();
    }

    private final class Csv extends AbstractRawRowReader {

        private final CSVReader reader;
        private boolean first = true;

        Csv(Reader source, Dialect dialect) {
            super(dialect);
            this.reader = new CSVReaderBuilder(source)
                .withCSVParser(parser(dialect))
                .withKeepCarriageReturn(false)
                .build();
            log.debug("Opened {} with delimiter '{}'", path, dialect.delimiter());
        }

        @Override
        protected RawRow readRecord() {
            try {
                long lineNumber = reader.getLinesRead() + 1;
                String[] cells = reader.readNext();
                if (cells == null) {
                    return null;
                }
                if (first && cells.length > 0 && !cells[0].isEmpty() && cells[0].charAt(0) == BOM) {
                    cells[0] = cells[0].substring(1);
                }
                first = false;
                return new RawRow((int) lineNumber, Arrays.asList(cells));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + path, e);
            } catch (CsvValidationException e) {
                throw new UncheckedIOException(new IOException("Failed to read " + path + ": " + e.getMessage(), e));
            }
        }

        @Override
        protected void closeSource() {
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close " + path, e);
            }
        }
    }
}
