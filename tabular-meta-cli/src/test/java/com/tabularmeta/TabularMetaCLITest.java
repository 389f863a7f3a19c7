package com.tabularmeta;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class TabularMetaCLITest {

    private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    private final Level original = root.getLevel();

    @AfterEach
    void restoreLevel() {
        root.setLevel(original);
    }

    @Test
    void subcommands_areRegistered() {
        CommandLine commandLine = TabularMetaCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsKeys("validate", "list");
    }

    @Test
    void verboseFlag_setsDebugLevel() {
        int exitCode = TabularMetaCLI.commandLine().execute("-v", "list", "datatypes");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quietFlag_setsErrorLevel() {
        int exitCode = TabularMetaCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void unknownOption_isUsageError() {
        assertThat(TabularMetaCLI.commandLine().execute("--frobnicate")).isEqualTo(2);
    }
}
