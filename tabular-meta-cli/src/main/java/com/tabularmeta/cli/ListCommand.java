package com.tabularmeta.cli;

import com.tabularmeta.core.datatype.BaseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.util.concurrent.Callable;

/**
 * Lists the built-in datatypes with their families and an example value.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tabular-meta list datatypes
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported datatypes",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "Type to list: datatypes", defaultValue = "datatypes")
    private String type;

    private final PrintStream out;

    public ListCommand() {
        this(System.out);
    }

    ListCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "datatypes", "datatype" -> listDatatypes();
            default -> {
                log.error("Unknown type: {}. Use: datatypes", type);
                yield 1;
            }
        };
    }

    private int listDatatypes() {
        out.println("Available Datatypes:");
        out.println();
        for (BaseType type : BaseType.values()) {
            out.printf("  • %s (%s)%n", type.getName(), type.getFamily().name().toLowerCase());
            out.printf("    Value: %s%n", type.valueType().getSimpleName());
            out.printf("    Example: %s%n", type.getExample());
            if (type.isOrdered()) {
                out.println("    Bounds: yes");
            }
            if (type.supportsLength()) {
                out.println("    Length: yes");
            }
        }
        return 0;
    }
}
