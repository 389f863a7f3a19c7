package com.tabularmeta.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand} exit codes.
 */
class ValidateCommandTest {

    private static final String METADATA = """
        {"tables": [
          {"url": "countries.csv",
           "tableSchema": {"columns": [{"name": "code"}, {"name": "population", "datatype": "integer"}],
                           "primaryKey": "code"}},
          {"url": "cities.csv",
           "tableSchema": {
             "columns": [{"name": "name"}, {"name": "country"}],
             "foreignKeys": [{"columnReference": "country",
                              "reference": {"resource": "countries.csv", "columnReference": "code"}}]}}
        ]}
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Path metadata;

    @BeforeEach
    void setUp() throws IOException {
        metadata = createFile("metadata.json", METADATA);
        createFile("countries.csv", "code,population\nDE,83000000\nFR,68000000\n");
        createFile("cities.csv", "name,country\nBerlin,DE\nParis,FR\n");
    }

    private Path createFile(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private int run(String... args) {
        ValidateCommand command = new ValidateCommand(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return new CommandLine(command).execute(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    void validData_returnsZero() {
        int exitCode = run(metadata.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).isEqualTo("OK");
    }

    @Test
    @DisplayName("violations in lenient mode return 1")
    void invalidCell_lenient_returnsOne() throws IOException {
        createFile("countries.csv", "code,population\nDE,many\nFR,68000000\n");

        int exitCode = run(metadata.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output()).isEqualTo("FAIL");
    }

    @Test
    void invalidCell_lenient_isCountedOnce() throws IOException {
        createFile("countries.csv", "code,population\nDE,83000000\nFR,68000000\nIT,many\n");
        Logger logger = (Logger) LoggerFactory.getLogger(ValidateCommand.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertThat(run(metadata.toString())).isEqualTo(1);
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
            .contains("1 violations found")
            .filteredOn(m -> m.contains("many"))
            .hasSize(1);
    }

    @Test
    void danglingReference_lenient_returnsOne() throws IOException {
        createFile("cities.csv", "name,country\nBerlin,DE\nRome,IT\n");

        assertThat(run(metadata.toString())).isEqualTo(1);
    }

    @Test
    void duplicatePrimaryKey_lenient_returnsOne() throws IOException {
        createFile("countries.csv", "code,population\nDE,1\nDE,2\n");

        assertThat(run(metadata.toString())).isEqualTo(1);
    }

    @Test
    void invalidCell_strict_returnsTwo() throws IOException {
        createFile("countries.csv", "code,population\nDE,many\n");

        int exitCode = run("--strict", metadata.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(output()).isEqualTo("FAIL");
    }

    @Test
    void strictModeFromConfig_returnsTwo() throws IOException {
        createFile("countries.csv", "code,population\nDE,many\n");
        createFile("tabularmeta.yaml", """
            validation:
              mode: strict
            """);

        assertThat(run(metadata.toString())).isEqualTo(2);
    }

    @Test
    void disabledForeignKeyCheck_ignoresDanglingReference() throws IOException {
        createFile("cities.csv", "name,country\nRome,IT\n");
        Path config = createFile("custom.yaml", """
            validation:
              foreignKeys: false
            """);

        assertThat(run("-c", config.toString(), metadata.toString())).isZero();
    }

    @Test
    void malformedMetadata_returnsTwo() throws IOException {
        createFile("metadata.json", "{\"tables\": [");

        assertThat(run(metadata.toString())).isEqualTo(2);
    }

    @Test
    void invalidDescription_returnsTwo() throws IOException {
        createFile("metadata.json", METADATA.replace("\"datatype\": \"integer\"", "\"datatype\": \"bigint\""));

        assertThat(run(metadata.toString())).isEqualTo(2);
    }

    @Test
    void missingDataFile_returnsTwo() throws IOException {
        Files.delete(tempDir.resolve("cities.csv"));

        assertThat(run(metadata.toString())).isEqualTo(2);
    }

    @Test
    void missingRequiredColumn_returnsTwo() throws IOException {
        createFile("metadata.json", METADATA.replace("{\"name\": \"code\"}", "{\"name\": \"code\", \"required\": true}"));
        createFile("countries.csv", "population\n1\n");

        assertThat(run(metadata.toString())).isEqualTo(2);
    }
}
