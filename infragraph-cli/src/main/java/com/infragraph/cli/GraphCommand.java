package com.infragraph.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.infragraph.core.config.ConfigLoader;
import com.infragraph.core.config.LayoutSettings;
import com.infragraph.core.config.ProjectConfig;
import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.generator.DiagramGenerator;
import com.infragraph.core.generator.GeneratedDiagram;
import com.infragraph.core.generator.GeneratorConfig;
import com.infragraph.core.model.ClusterKind;
import com.infragraph.core.model.LayoutDirection;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.ParserRegistry;
import com.infragraph.core.pipeline.DiagramPipeline;
import com.infragraph.core.pipeline.PipelineResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to build the resource graph of IaC files and generate a diagram.
 *
 * <p>Orchestrates the full pipeline:
 * <ol>
 *   <li>Load {@code infragraph.yaml} (or defaults)</li>
 *   <li>Collect documents from the given files and directories, within the limits</li>
 *   <li>Run the {@link DiagramPipeline}</li>
 *   <li>Report diagnostics</li>
 *   <li>Generate the diagram and write it to standard output or the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Mermaid diagram of the current directory
 * infragraph graph .
 *
 * # DOT file in docs/, network grouping, fail on parse errors
 * infragraph graph infra --format dot --group-by network -o docs --fail-on-diagnostics
 * }</pre>
 */
@Command(
    name = "graph",
    description = "Build the resource graph of IaC files and generate a diagram",
    mixinStandardHelpOptions = true
)
public class GraphCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GraphCommand.class);

    private static final String DIAGNOSTICS_FILE = "diagnostics.json";

    @Parameters(
        arity = "1..*",
        description = "IaC files or directories"
    )
    private List<Path> inputs;

    @Option(names = {"-f", "--format"}, description = "Generator id: mermaid, dot or json (overrides config)")
    private String format;

    @Option(names = {"-d", "--direction"}, description = "Layout direction: auto, LR, TB, RL or BT (overrides config)")
    private String direction;

    @Option(names = {"-g", "--group-by"}, description = "Cluster grouping: provider, category or network (overrides config)")
    private String groupBy;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: infragraph.yaml)")
    private Path configPath;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: standard output)")
    private Path outputDir;

    @Option(names = {"--title"}, description = "Diagram title (default: project name)")
    private String title;

    @Option(names = {"--legend"}, description = "Append an edge style legend where the format supports it")
    private boolean legend;

    @Option(names = {"--fail-on-diagnostics"}, description = "Exit with 1 when any parse error was reported")
    private boolean failOnDiagnostics;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = ConfigLoader.loadOrDefaults(configPath);
            LayoutSettings settings = layoutSettings(config);
            ClusterKind grouping = GeneratorConfig.parseGroupBy(groupBy != null ? groupBy : config.diagram().groupBy());
            String generatorId = format != null ? format : config.diagram().format();

            Optional<DiagramGenerator> generator = findGenerator(generatorId);
            if (generator.isEmpty()) {
                log.error("Unknown format: {}. Use 'infragraph list generators'", generatorId);
                return 1;
            }

            ParserRegistry registry = ParserRegistry.load();
            List<IacDocument> documents = new InputCollector(registry, config.limits()).collect(inputs);
            if (documents.isEmpty()) {
                log.error("No IaC files found in {}", inputs);
                return 1;
            }

            PipelineResult result = new DiagramPipeline(settings, registry).run(documents);
            report(result.diagnostics());

            GeneratorConfig generatorConfig = new GeneratorConfig(
                title != null ? title : config.project().name(), grouping, legend, Map.of());
            GeneratedDiagram diagram = generator.get().generate(result.graph(), generatorConfig);
            Path target = outputDir != null ? outputDir : outputDirectory(config);
            write(diagram, result.diagnostics(), target);

            if (failOnDiagnostics && result.hasErrors()) {
                log.error("Parse errors reported, failing as requested");
                return 1;
            }
            return 0;

        } catch (IOException | IllegalArgumentException e) {
            log.error("Graph failed: {}", e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("Stack trace", e);
            }
            return 1;
        }
    }

    private LayoutSettings layoutSettings(ProjectConfig config) {
        LayoutSettings settings = config.layout();
        if (direction == null) {
            return settings;
        }
        LayoutDirection requested = LayoutDirection.parse(direction);
        if (requested == LayoutDirection.AUTO && !"auto".equalsIgnoreCase(direction.strip())) {
            log.warn("Unknown direction '{}', using auto", direction);
        }
        return settings.withDirection(requested);
    }

    private static Optional<DiagramGenerator> findGenerator(String id) {
        String wanted = id.strip().toLowerCase(Locale.ROOT);
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            if (generator.getId().equals(wanted)) {
                return Optional.of(generator);
            }
        }
        return Optional.empty();
    }

    private static Path outputDirectory(ProjectConfig config) {
        String directory = config.output().directory();
        return directory == null || directory.isBlank() ? null : Path.of(directory);
    }

    private static void report(List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                log.warn("{}", diagnostic);
            } else {
                log.info("{}", diagnostic);
            }
        }
        if (!diagnostics.isEmpty()) {
            log.info("{} diagnostics reported", diagnostics.size());
        }
    }

    private static void write(GeneratedDiagram diagram, List<Diagnostic> diagnostics, Path target) throws IOException {
        if (target == null) {
            System.out.print(diagram.content());
            return;
        }
        Files.createDirectories(target);
        Path file = target.resolve(diagram.fileName());
        Files.writeString(file, diagram.content(), StandardCharsets.UTF_8);
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        mapper.writeValue(target.resolve(DIAGNOSTICS_FILE).toFile(), diagnostics);
        log.info("Wrote {} and {}", file, target.resolve(DIAGNOSTICS_FILE));
    }
}
