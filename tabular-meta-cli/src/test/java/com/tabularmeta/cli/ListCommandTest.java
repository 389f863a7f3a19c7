package com.tabularmeta.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ListCommandTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String... args) {
        ListCommand command = new ListCommand(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return new CommandLine(command).execute(args);
    }

    @Test
    void datatypes_listsEveryBaseType() {
        int exitCode = run("datatypes");
        String output = buffer.toString(StandardCharsets.UTF_8);

        assertThat(exitCode).isZero();
        assertThat(output)
            .contains("Available Datatypes:")
            .contains("• dateTimeStamp (temporal)")
            .contains("Example: P1DT2H")
            .contains("• hexBinary (binary)");
    }

    @Test
    void defaultType_isDatatypes() {
        assertThat(run()).isZero();
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("• integer (numeric)");
    }

    @Test
    void unknownType_returnsOne() {
        assertThat(run("scanners")).isEqualTo(1);
    }
}
