package com.infragraph.cli;

import com.infragraph.core.generator.DiagramGenerator;
import com.infragraph.core.parser.IacParser;
import com.infragraph.core.parser.ParserRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available parsers or generators.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI) and displays
 * their capabilities.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List everything
 * infragraph list
 *
 * # List parsers only
 * infragraph list parsers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available parsers and generators",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Type to list: parsers, generators or all (default: all)",
        defaultValue = "all"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "parsers", "parser" -> listParsers();
            case "generators", "generator" -> listGenerators();
            case "all" -> listParsers() + listGenerators();
            default -> {
                log.error("Unknown type: {}. Use: parsers, generators or all", type);
                yield 1;
            }
        };
    }

    private int listParsers() {
        System.out.println("Available Parsers:");
        System.out.println();

        boolean found = false;
        for (IacParser parser : ParserRegistry.load().all()) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", parser.getDisplayName(), parser.getId());
            System.out.printf("    Dialect: %s%n", parser.getDialect().id());
            System.out.printf("    Files: %s%n", String.join(", ", parser.getSupportedFilePatterns().stream().sorted().toList()));
            System.out.println();
        }

        if (!found) {
            System.out.println("  No parsers found.");
        }
        return 0;
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        ServiceLoader<DiagramGenerator> generators = ServiceLoader.load(DiagramGenerator.class);
        boolean found = false;

        for (DiagramGenerator generator : generators) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No generators found.");
        }
        return 0;
    }
}
