package com.infragraph;

import com.infragraph.cli.GraphCommand;
import com.infragraph.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for InfraGraph.
 *
 * <p>InfraGraph reads infrastructure-as-code files (Terraform, CloudFormation, Bicep,
 * Pulumi YAML), builds a resource graph with inferred clusters and derives layout
 * parameters for the diagram.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code graph} - Build the resource graph and generate a diagram</li>
 *   <li>{@code list} - List available parsers and generators</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Mermaid diagram of a Terraform tree
 * infragraph graph infra/terraform
 *
 * # Graphviz output, vertical, with debug logging
 * infragraph -v graph --format dot --direction TB template.yaml
 *
 * # List parsers and generators
 * infragraph list
 * }</pre>
 */
@Command(
    name = "infragraph",
    mixinStandardHelpOptions = true,
    version = "InfraGraph 1.0.0-SNAPSHOT",
    description = "Resource graphs and adaptive layouts for infrastructure-as-code diagrams",
    subcommands = {
        GraphCommand.class,
        ListCommand.class
    }
)
public class InfraGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(InfraGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("InfraGraph - Infrastructure-as-Code Diagram Engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'infragraph --help' to see available commands");
        System.out.println("Use 'infragraph <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        InfraGraphCLI cli = new InfraGraphCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
