package com.infragraph.core.graph;

import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.parser.ParseResult;
import com.infragraph.core.util.ResourceTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges parse results into one canonical {@link ResourceGraph}.
 *
 * <p><b>Merge rules</b></p>
 * <ul>
 *   <li>Results are applied in lexicographic source-path order, so the outcome does not
 *       depend on the order parsing finished in</li>
 *   <li>Nodes are keyed by id; a later declaration replaces the attributes and tags of an
 *       earlier one, while edges from both declarations are kept</li>
 *   <li>Edges on the same ordered pair collapse to one, keeping the strongest kind
 *       (explicit &gt; attribute reference &gt; implicit ordering)</li>
 *   <li>Self-loops are dropped</li>
 *   <li>The provider tag comes from {@link ResourceTaxonomy#provider(String)}</li>
 * </ul>
 *
 * <p>With {@code implicitOrderingFallback} enabled, a merged graph without any edge gets
 * {@link EdgeKind#IMPLICIT_ORDERING} chains linking the nodes of each dialect,
 * environment and module instance in id order.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final ReferenceResolver resolver;
    private final boolean implicitOrderingFallback;

    public GraphBuilder(boolean implicitOrderingFallback) {
        this(new ReferenceResolver(), implicitOrderingFallback);
    }

    public GraphBuilder(ReferenceResolver resolver, boolean implicitOrderingFallback) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.implicitOrderingFallback = implicitOrderingFallback;
    }

    /**
     * Graph plus the references that could not be turned into edges.
     *
     * @param graph merged graph
     * @param diagnostics unresolved reference diagnostics
     */
    public record BuildResult(ResourceGraph graph, List<Diagnostic> diagnostics) {

        public BuildResult {
            Objects.requireNonNull(graph, "graph must not be null");
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * Builds the graph from parse results.
     *
     * @param results parse results in any order
     * @return graph and resolution diagnostics
     */
    public BuildResult build(List<ParseResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<ParseResult> ordered = results.stream()
            .sorted(Comparator.comparing(ParseResult::source))
            .toList();

        List<ResourceNode> declarations = new ArrayList<>();
        Map<String, ResourceNode> nodes = new LinkedHashMap<>();
        List<EdgeHint> hints = new ArrayList<>();
        Set<String> symbols = new HashSet<>();
        for (ParseResult result : ordered) {
            for (ResourceNode node : result.nodes()) {
                ResourceNode tagged = node.withProvider(ResourceTaxonomy.provider(node.type()));
                declarations.add(tagged);
                if (nodes.put(tagged.id(), tagged) != null) {
                    log.debug("Node {} redeclared in {}, later declaration wins", tagged.id(), result.source());
                }
            }
            hints.addAll(result.edgeHints());
            symbols.addAll(result.symbols());
        }

        // every declaration contributes references, not only the surviving one
        ReferenceResolver.Resolution resolution = resolver.resolve(declarations, hints, symbols);
        List<Edge> edges = deduplicate(resolution.edges());
        if (edges.isEmpty() && implicitOrderingFallback) {
            edges = fallbackChains(nodes.values());
            log.debug("No edges found, added {} implicit ordering edges", edges.size());
        }

        ResourceGraph graph = new ResourceGraph(List.copyOf(nodes.values()), edges);
        GraphInvariants.verify(graph);
        log.info("Built graph with {} nodes and {} edges from {} documents",
            graph.nodes().size(), graph.edges().size(), ordered.size());
        return new BuildResult(graph, resolution.diagnostics());
    }

    /**
     * Collapses edges on the same ordered pair to the strongest kind and drops self-loops.
     *
     * @param edges raw edges
     * @return unique edges in first-seen order
     */
    static List<Edge> deduplicate(List<Edge> edges) {
        Map<String, Edge> byPair = new LinkedHashMap<>();
        for (Edge edge : edges) {
            if (edge.from().equals(edge.to())) {
                continue;
            }
            byPair.merge(edge.pairKey(), edge,
                (existing, added) -> existing.kind() == EdgeKind.strongest(existing.kind(), added.kind())
                    ? existing
                    : added);
        }
        return List.copyOf(byPair.values());
    }

    private static List<Edge> fallbackChains(Iterable<ResourceNode> nodes) {
        Map<String, List<ResourceNode>> groups = new TreeMap<>();
        for (ResourceNode node : nodes) {
            String group = node.dialect().id() + "|" + Objects.requireNonNullElse(node.environment(), "")
                + "|" + node.tags().getOrDefault(ResourceNode.TAG_MODULE, "");
            groups.computeIfAbsent(group, g -> new ArrayList<>()).add(node);
        }
        List<Edge> edges = new ArrayList<>();
        for (List<ResourceNode> group : groups.values()) {
            group.sort(Comparator.comparing(ResourceNode::id));
            for (int i = 1; i < group.size(); i++) {
                edges.add(Edge.of(group.get(i - 1).id(), group.get(i).id(), EdgeKind.IMPLICIT_ORDERING));
            }
        }
        return edges;
    }
}
