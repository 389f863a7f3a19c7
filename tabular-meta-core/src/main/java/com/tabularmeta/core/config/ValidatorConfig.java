package com.tabularmeta.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Validation settings, loaded from {@code tabularmeta.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * validation:
 *   mode: lenient        # strict | lenient
 *   level: warn          # level violations are logged at in lenient mode
 *   primaryKeys: true
 *   foreignKeys: true
 * }</pre>
 *
 * @param validation validation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidatorConfig(
    @JsonProperty("validation") ValidationSettings validation
) {
    /**
     * Lenient mode with all checks enabled.
     *
     * @return default configuration
     */
    public static ValidatorConfig defaults() {
        return new ValidatorConfig(ValidationSettings.defaults());
    }

    /**
     * @return validation settings, never null
     */
    public ValidationSettings effectiveValidation() {
        return validation == null ? ValidationSettings.defaults() : validation;
    }

    /**
     * How row- and cell-level violations propagate.
     */
    public enum Mode {
        /** The first violation aborts validation */
        STRICT,
        /** Violations are logged and the offending rows skipped */
        LENIENT;

        @JsonCreator
        public static Mode fromString(String value) {
            return value == null ? null : Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * @param mode strict or lenient; null means lenient
     * @param level SLF4J level name for violations in lenient mode; null means {@code WARN}
     * @param primaryKeys whether primary keys are checked; null means true
     * @param foreignKeys whether referential integrity is checked; null means true
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("mode") Mode mode,
        @JsonProperty("level") String level,
        @JsonProperty("primaryKeys") Boolean primaryKeys,
        @JsonProperty("foreignKeys") Boolean foreignKeys
    ) {
        public static ValidationSettings defaults() {
            return new ValidationSettings(Mode.LENIENT, "WARN", true, true);
        }

        public Mode effectiveMode() {
            return mode == null ? Mode.LENIENT : mode;
        }

        public String effectiveLevel() {
            return level == null ? "WARN" : level.toUpperCase(Locale.ROOT);
        }

        public boolean checkPrimaryKeys() {
            return primaryKeys == null || primaryKeys;
        }

        public boolean checkForeignKeys() {
            return foreignKeys == null || foreignKeys;
        }
    }
}
