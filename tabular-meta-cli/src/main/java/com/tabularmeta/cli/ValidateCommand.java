package com.tabularmeta.cli;

import com.tabularmeta.core.config.ConfigLoader;
import com.tabularmeta.core.config.ValidatorConfig;
import com.tabularmeta.core.error.CsvwException;
import com.tabularmeta.core.metadata.Row;
import com.tabularmeta.core.metadata.Table;
import com.tabularmeta.core.metadata.TableGroup;
import com.tabularmeta.core.validation.Slf4jValidationLog;
import com.tabularmeta.core.validation.ValidationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Validates the tables of a metadata document.
 *
 * <p>Reads every row of every table, then checks primary keys and referential integrity as
 * configured. Exit codes:
 * <ul>
 *   <li>0 - everything valid</li>
 *   <li>1 - violations were logged (lenient mode)</li>
 *   <li>2 - the metadata is invalid, a file could not be read, or a violation aborted
 *       validation (strict mode)</li>
 * </ul>
 */
@Command(
    name = "validate",
    description = "Validate CSV data against its CSVW metadata. Returns 0 on success, 1 on warnings and 2 on error.",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "JSON metadata document")
    private Path metadata;

    @Option(names = {"-c", "--config"},
        description = "Configuration file (default: tabularmeta.yaml next to the metadata)")
    private Path configFile;

    @Option(names = "--strict", description = "Abort on the first violation")
    private boolean strict;

    private final PrintStream out;

    public ValidateCommand() {
        this(System.out);
    }

    ValidateCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        ValidatorConfig.ValidationSettings settings = loadConfig().effectiveValidation();
        boolean strictMode = strict || settings.effectiveMode() == ValidatorConfig.Mode.STRICT;
        Level level = level(settings.effectiveLevel());
        Slf4jValidationLog counter = new Slf4jValidationLog(log);
        ValidationLog sink = strictMode ? null : (ignored, message) -> counter.log(level, message);

        try {
            log.info("Validating {} ({} mode)", metadata, strictMode ? "strict" : "lenient");
            TableGroup group = TableGroup.fromFile(metadata);
            group.checkForeignKeyShapes();
            for (Table table : group.getTables()) {
                long rows;
                try (Stream<Row> stream = table.rows(sink).stream()) {
                    rows = stream.count();
                }
                log.info("{}: {} valid rows", table.getUrl(), rows);
            }
            if (settings.checkPrimaryKeys()) {
                group.getTables().forEach(t -> t.checkPrimaryKey(sink));
            }
            // rows were already reported by the pass above
            if (settings.checkForeignKeys()) {
                group.checkReferentialIntegrity(sink, strictMode ? null : ValidationLog.discard());
            }
        } catch (CsvwException | UncheckedIOException e) {
            log.error("Validation aborted: {}", e.getMessage());
            out.println("FAIL");
            return 2;
        }

        if (counter.getCount() > 0) {
            log.warn("{} violations found", counter.getCount());
            out.println("FAIL");
            return 1;
        }
        out.println("OK");
        return 0;
    }

    private static Level level(String name) {
        try {
            return Level.valueOf(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown log level '{}' in configuration, using WARN", name);
            return Level.WARN;
        }
    }

    private ValidatorConfig loadConfig() {
        Path path = configFile;
        if (path == null) {
            Path dir = metadata.toAbsolutePath().getParent();
            path = dir == null ? Path.of(ConfigLoader.DEFAULT_FILE_NAME) : dir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        }
        return ConfigLoader.load(path);
    }
}
