package com.tabularmeta.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("tabularmeta.yaml");
        Files.writeString(configFile, """
            validation:
              mode: strict
              level: info
              primaryKeys: false
              foreignKeys: true
            """);

        ValidatorConfig config = ConfigLoader.load(configFile);

        ValidatorConfig.ValidationSettings settings = config.effectiveValidation();
        assertThat(settings.effectiveMode()).isEqualTo(ValidatorConfig.Mode.STRICT);
        assertThat(settings.effectiveLevel()).isEqualTo("INFO");
        assertThat(settings.checkPrimaryKeys()).isFalse();
        assertThat(settings.checkForeignKeys()).isTrue();
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tabularmeta.yaml");
        Files.writeString(configFile, """
            validation:
              foreignKeys: false
            """);

        ValidatorConfig.ValidationSettings settings = ConfigLoader.load(configFile).effectiveValidation();

        assertThat(settings.mode()).isNull();
        assertThat(settings.effectiveMode()).isEqualTo(ValidatorConfig.Mode.LENIENT);
        assertThat(settings.effectiveLevel()).isEqualTo("WARN");
        assertThat(settings.checkPrimaryKeys()).isTrue();
        assertThat(settings.checkForeignKeys()).isFalse();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("tabularmeta.yaml");
        Files.writeString(configFile, """
            output:
              directory: ./out
            validation:
              mode: lenient
            """);

        ValidatorConfig config = ConfigLoader.load(configFile);

        assertThat(config.effectiveValidation().effectiveMode()).isEqualTo(ValidatorConfig.Mode.LENIENT);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        ValidatorConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tabularmeta.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void load_invalidMode_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tabularmeta.yaml");
        Files.writeString(configFile, """
            validation:
              mode: sometimes
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ValidatorConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tabularmeta.yaml");
        Files.writeString(configFile, "");

        ValidatorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isNotNull();
        assertThat(config.effectiveValidation().effectiveMode()).isEqualTo(ValidatorConfig.Mode.LENIENT);
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = tempDir.resolve("directory");
        Files.createDirectory(directory);

        assertThat(ConfigLoader.load(directory)).isEqualTo(ValidatorConfig.defaults());
    }
}
