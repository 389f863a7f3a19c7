package com.tabularmeta.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ValidatorConfig} from a YAML file.
 *
 * <p>A missing, unreadable or malformed file is logged and replaced by
 * {@link ValidatorConfig#defaults()}; loading never fails.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidatorConfig config = ConfigLoader.load(Path.of("tabularmeta.yaml"));
 * if (config.effectiveValidation().checkForeignKeys()) {
 *     group.checkReferentialIntegrity(log);
 * }
 * }</pre>
 */
public class ConfigLoader {

    /** Default file name looked up next to the metadata document. */
    public static final String DEFAULT_FILE_NAME = "tabularmeta.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code tabularmeta.yaml}
     * @return loaded configuration, or defaults if unavailable
     */
    public static ValidatorConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ValidatorConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ValidatorConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ValidatorConfig config = YAML_MAPPER.readValue(configPath.toFile(), ValidatorConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ValidatorConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ValidatorConfig.defaults();
        }
    }
}
