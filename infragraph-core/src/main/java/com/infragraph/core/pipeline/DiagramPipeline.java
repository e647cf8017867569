package com.infragraph.core.pipeline;

import com.infragraph.core.cluster.ClusterInferencer;
import com.infragraph.core.config.LayoutSettings;
import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.diagnostic.InvariantViolationException;
import com.infragraph.core.graph.GraphBuilder;
import com.infragraph.core.graph.TerraformModuleExpander;
import com.infragraph.core.layout.ComplexityAnalyzer;
import com.infragraph.core.layout.LayoutParameterDeriver;
import com.infragraph.core.model.DiagramComplexity;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.LayoutParams;
import com.infragraph.core.model.LayoutReadyGraph;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.IacParser;
import com.infragraph.core.parser.ParseResult;
import com.infragraph.core.parser.ParserRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the whole transform from IaC documents to a {@link LayoutReadyGraph}.
 *
 * <p><b>Stages:</b>
 * <ol>
 *   <li>parse every document on a fixed thread pool</li>
 *   <li>expand local Terraform module calls ({@link TerraformModuleExpander})</li>
 *   <li>tag environments detected from the document paths</li>
 *   <li>merge, resolve and deduplicate ({@link GraphBuilder})</li>
 *   <li>infer clusters ({@link ClusterInferencer})</li>
 *   <li>analyze complexity ({@link ComplexityAnalyzer})</li>
 *   <li>derive layout and edge styles ({@link LayoutParameterDeriver})</li>
 * </ol>
 *
 * <p>Input problems never abort a run: they come back as diagnostics next to a
 * possibly partial graph. Only {@link InvariantViolationException} escapes.
 *
 * <p>When documents span more than one environment, node ids get an
 * {@code <environment>__} prefix on the logical-name segment so the same resource
 * declared for {@code dev} and {@code prod} stays two nodes; documents without an
 * environment are then assigned {@value EnvironmentDetector#SHARED}.
 *
 * <p>Instances hold no state between runs.
 */
public class DiagramPipeline {

    private static final Logger log = LoggerFactory.getLogger(DiagramPipeline.class);

    static final String ENVIRONMENT_SEPARATOR = "__";

    private final LayoutSettings settings;
    private final ParserRegistry registry;
    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();
    private final LayoutParameterDeriver deriver = new LayoutParameterDeriver();
    private final ClusterInferencer clusterInferencer = new ClusterInferencer();
    private final TerraformModuleExpander moduleExpander = new TerraformModuleExpander();

    public DiagramPipeline(LayoutSettings settings) {
        this(settings, ParserRegistry.load());
    }

    public DiagramPipeline(LayoutSettings settings, ParserRegistry registry) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Runs the pipeline.
     *
     * @param documents documents in any order, already limited by the caller
     * @return graph and diagnostics
     * @throws InvariantViolationException if an internal invariant is broken
     */
    public PipelineResult run(List<IacDocument> documents) {
        Objects.requireNonNull(documents, "documents must not be null");
        log.info("Running pipeline on {} documents", documents.size());

        List<ParseResult> parsed = parseAll(documents);
        List<ParseResult> tagged = tagEnvironments(moduleExpander.expand(parsed));

        List<Diagnostic> diagnostics = new ArrayList<>();
        tagged.forEach(result -> diagnostics.addAll(result.diagnostics()));

        GraphBuilder.BuildResult built = new GraphBuilder(settings.implicitOrderingFallback()).build(tagged);
        diagnostics.addAll(built.diagnostics());

        ClusterInferencer.Inference inference = clusterInferencer.infer(built.graph());
        diagnostics.addAll(inference.diagnostics());

        DiagramComplexity complexity = analyzer.analyze(built.graph(), inference.clusters());
        ResourceGraph styled = deriver.classify(built.graph());
        LayoutParams layout = deriver.derive(complexity, settings.requestedDirection(), settings)
            .withEdgeStyles(LayoutParameterDeriver.countStyles(styled.edges()));

        LayoutReadyGraph graph = new LayoutReadyGraph(styled.nodes(), styled.edges(), inference.clusters(),
            layout, complexity);
        log.info("Pipeline finished: {} nodes, {} edges, {} clusters, direction {}, {} diagnostics",
            graph.nodes().size(), graph.edges().size(), graph.clusters().size(), layout.direction(),
            diagnostics.size());
        return new PipelineResult(graph, diagnostics);
    }

    // ==================== Parsing ====================

    private List<ParseResult> parseAll(List<IacDocument> documents) {
        if (documents.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(documents.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<ParseResult>> futures = documents.stream()
                .map(document -> CompletableFuture.supplyAsync(() -> parseOne(document), executor))
                .toList();
            List<ParseResult> results = new ArrayList<>(futures.size());
            for (CompletableFuture<ParseResult> future : futures) {
                results.add(join(future));
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private ParseResult parseOne(IacDocument document) {
        Optional<IacParser> parser = registry.forDialect(document.dialect());
        if (parser.isEmpty()) {
            log.warn("No parser registered for dialect {} ({})", document.dialect(), document.path());
            return ParseResult.failed("none", document.path(), Diagnostic.parseError(document.path(),
                Diagnostic.NO_OFFSET, "No parser registered for dialect " + document.dialect()));
        }
        try {
            ParseResult result = parser.get().parse(document);
            log.debug("Parsed {}: {}", document.path(), result.statistics().getSummary());
            return result;
        } catch (InvariantViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Parser {} failed on {}: {}", parser.get().getId(), document.path(), e.getMessage());
            return ParseResult.failed(parser.get().getId(), document.path(), Diagnostic.parseError(document.path(),
                Diagnostic.NO_OFFSET, "Parser failure: " + e.getMessage()));
        }
    }

    private static ParseResult join(CompletableFuture<ParseResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    // ==================== Environments ====================

    private static List<ParseResult> tagEnvironments(List<ParseResult> results) {
        Map<String, Optional<String>> environments = new LinkedHashMap<>();
        Set<String> distinct = new TreeSet<>();
        for (ParseResult result : results) {
            Optional<String> environment = EnvironmentDetector.detect(result.source());
            environments.put(result.source(), environment);
            environment.ifPresent(distinct::add);
        }
        if (distinct.isEmpty()) {
            return results;
        }
        boolean prefixIds = distinct.size() > 1;
        if (prefixIds) {
            log.info("Documents span environments {}, prefixing resource ids", distinct);
        }

        List<ParseResult> tagged = new ArrayList<>(results.size());
        for (ParseResult result : results) {
            String environment = environments.get(result.source())
                .orElse(prefixIds ? EnvironmentDetector.SHARED : null);
            tagged.add(environment == null ? result : withEnvironment(result, environment, prefixIds));
        }
        return tagged;
    }

    private static ParseResult withEnvironment(ParseResult result, String environment, boolean prefixIds) {
        List<ResourceNode> nodes = result.nodes().stream()
            .sorted(Comparator.comparing(ResourceNode::id))
            .map(node -> {
                Map<String, String> tags = new LinkedHashMap<>(node.tags());
                tags.put(ResourceNode.TAG_ENVIRONMENT, environment);
                String id = prefixIds ? prefixId(node.id(), environment) : node.id();
                return new ResourceNode(id, node.type(), node.provider(), node.displayName(), node.logicalName(),
                    node.dialect(), node.attributes(), tags);
            })
            .toList();
        // the dependency may live in another environment, it is resolved at merge time
        List<EdgeHint> hints = prefixIds
            ? result.edgeHints().stream()
                .map(hint -> new EdgeHint(hint.from(), prefixId(hint.to(), environment), hint.kind()))
                .toList()
            : result.edgeHints();
        return new ParseResult(result.parserId(), result.source(), nodes, hints, result.symbols(),
            result.diagnostics(), result.statistics(), result.moduleCalls(), result.outputs());
    }

    /**
     * Prefixes the logical-name segment of a node id with an environment.
     *
     * @param id node id {@code <dialect>:<type>:<logical-name>}
     * @param environment environment name
     * @return {@code <dialect>:<type>:<environment>__<logical-name>}
     */
    static String prefixId(String id, String environment) {
        int split = id.lastIndexOf(':');
        return id.substring(0, split + 1) + environment + ENVIRONMENT_SEPARATOR + id.substring(split + 1);
    }
}
