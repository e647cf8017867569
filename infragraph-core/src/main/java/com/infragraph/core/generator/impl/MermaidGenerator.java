package com.infragraph.core.generator.impl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.core.generator.DiagramGenerator;
import com.infragraph.core.generator.GeneratedDiagram;
import com.infragraph.core.generator.GeneratorConfig;
import com.infragraph.core.model.Cluster;
import com.infragraph.core.model.ClusterKind;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.EdgeStyle;
import com.infragraph.core.model.LayoutParams;
import com.infragraph.core.model.LayoutReadyGraph;
import com.infragraph.core.model.ResourceNode;

/**
 * Generates Mermaid flowchart definitions from layout-ready graphs.
 *
 * <p>The output is Markdown with an embedded {@code ```mermaid} block, suitable for
 * rendering in GitHub, GitLab and documentation sites.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li><b>Direction:</b> {@code flowchart LR|RL|TB|BT} from {@link LayoutParams#direction()}</li>
 *   <li><b>Spacing:</b> an {@code init} directive with node and rank spacing in pixels</li>
 *   <li><b>Clusters:</b> one {@code subgraph} per cluster of the configured kind; network
 *       clusters nest, the ungrouped bucket is drawn without a frame. When resources span
 *       several environments, provider and category subgraphs sit inside one subgraph per
 *       environment</li>
 *   <li><b>Edges:</b> {@code -->} default, {@code ==>} data, {@code -.->} cross-boundary,
 *       {@code -. security .->} security, each colored with {@code linkStyle}</li>
 * </ul>
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "md";
    private static final String DIAGRAM_NAME = "infrastructure";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Sanitization patterns
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    // Layout parameters are in inches, Mermaid spacing in pixels
    private static final int PIXELS_PER_INCH = 72;

    private static final String EMPTY_NODE = "  empty[No resources found]\n";

    private static final Map<EdgeStyle, String> EDGE_COLORS = Map.of(
        EdgeStyle.SECURITY, "#d62728",
        EdgeStyle.DATA, "#1f77b4",
        EdgeStyle.CROSS_BOUNDARY, "#7f7f7f"
    );

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(LayoutReadyGraph graph, GeneratorConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");
        log.debug("Generating Mermaid flowchart grouped by {}", config.groupBy());

        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, config.title(), graph.layout());

        if (graph.nodes().isEmpty()) {
            sb.append(EMPTY_NODE);
        } else {
            Map<String, String> aliases = aliases(graph.nodes());
            appendNodes(sb, graph, config.groupBy(), aliases);
            appendEdges(sb, graph.edges(), aliases);
        }
        sb.append(CODE_BLOCK_END);

        if (config.includeLegend()) {
            appendLegend(sb, graph.layout());
        }

        log.info("Generated Mermaid flowchart with {} nodes and {} edges", graph.nodes().size(), graph.edges().size());
        return new GeneratedDiagram(DIAGRAM_NAME, sb.toString(), getFileExtension());
    }

    private void appendDiagramHeader(StringBuilder sb, String title, LayoutParams layout) {
        if (title != null && !title.isBlank()) {
            sb.append(MARKDOWN_HEADER_PREFIX).append(escape(title)).append(MARKDOWN_NEWLINE.repeat(2));
        }
        sb.append(CODE_BLOCK_START);
        sb.append(String.format(Locale.ROOT,
            "%%%%{init: {\"flowchart\": {\"nodeSpacing\": %d, \"rankSpacing\": %d, \"padding\": %d}}}%%%%\n",
            pixels(layout.nodeSeparation()), pixels(layout.rankSeparation()), pixels(layout.pad())));
        sb.append("flowchart ").append(layout.direction().code()).append(MARKDOWN_NEWLINE);
    }

    // ==================== Nodes and subgraphs ====================

    private void appendNodes(StringBuilder sb, LayoutReadyGraph graph, ClusterKind groupBy, Map<String, String> aliases) {
        Map<String, ResourceNode> nodes = new LinkedHashMap<>();
        graph.nodes().forEach(node -> nodes.put(node.id(), node));
        List<Cluster> clusters = graph.clustersOf(groupBy);

        if (groupBy == ClusterKind.NETWORK_CONTAINER) {
            appendClusterTree(sb, clusters, null, nodes, aliases, "  ");
            clusters.stream()
                .filter(Cluster::isUngrouped)
                .flatMap(c -> c.memberIds().stream())
                .forEach(id -> appendNode(sb, nodes.get(id), aliases, "  "));
            return;
        }

        Map<String, List<ResourceNode>> byEnvironment = new TreeMap<>();
        for (ResourceNode node : graph.nodes()) {
            byEnvironment.computeIfAbsent(Objects.requireNonNullElse(node.environment(), ""), k -> new ArrayList<>())
                .add(node);
        }
        if (byEnvironment.size() <= 1) {
            appendClusterTree(sb, clusters, null, nodes, aliases, "  ");
            return;
        }
        for (Map.Entry<String, List<ResourceNode>> entry : byEnvironment.entrySet()) {
            String environment = entry.getKey().isEmpty() ? "shared" : entry.getKey();
            Set<String> members = new HashSet<>();
            entry.getValue().forEach(node -> members.add(node.id()));
            sb.append("  subgraph ").append(sanitizeId("env_" + environment))
                .append("[\"").append(escape(environmentLabel(environment))).append("\"]\n");
            for (Cluster cluster : clusters) {
                Set<String> inEnvironment = new TreeSet<>(cluster.memberIds());
                inEnvironment.retainAll(members);
                if (inEnvironment.isEmpty()) {
                    continue;
                }
                sb.append("    subgraph ").append(sanitizeId(environment + "_" + cluster.id()))
                    .append("[\"").append(escape(cluster.label())).append("\"]\n");
                inEnvironment.forEach(id -> appendNode(sb, nodes.get(id), aliases, "      "));
                sb.append("    end\n");
            }
            sb.append("  end\n");
        }
    }

    private void appendClusterTree(StringBuilder sb, List<Cluster> clusters, String parentId,
                                   Map<String, ResourceNode> nodes, Map<String, String> aliases, String indent) {
        for (Cluster cluster : clusters) {
            if (cluster.isUngrouped() || !Objects.equals(cluster.parentId(), parentId)) {
                continue;
            }
            sb.append(indent).append("subgraph ").append(sanitizeId(cluster.id()))
                .append("[\"").append(escape(cluster.label())).append("\"]\n");
            for (String memberId : cluster.memberIds()) {
                appendNode(sb, nodes.get(memberId), aliases, indent + "  ");
            }
            appendClusterTree(sb, clusters, cluster.id(), nodes, aliases, indent + "  ");
            sb.append(indent).append("end\n");
        }
    }

    private void appendNode(StringBuilder sb, ResourceNode node, Map<String, String> aliases, String indent) {
        if (node == null) {
            return;
        }
        sb.append(indent).append(aliases.get(node.id()))
            .append("[\"").append(escape(node.displayName())).append("<br/><small>")
            .append(escape(node.type())).append("</small>\"]\n");
    }

    // ==================== Edges ====================

    private void appendEdges(StringBuilder sb, List<Edge> edges, Map<String, String> aliases) {
        List<String> linkStyles = new ArrayList<>();
        for (int i = 0; i < edges.size(); i++) {
            Edge edge = edges.get(i);
            EdgeStyle style = edge.styleHint() == null ? EdgeStyle.DEFAULT : edge.styleHint();
            sb.append("  ").append(aliases.get(edge.from())).append(' ')
                .append(arrow(style)).append(' ').append(aliases.get(edge.to())).append(MARKDOWN_NEWLINE);
            String color = EDGE_COLORS.get(style);
            if (color != null) {
                linkStyles.add("  linkStyle " + i + " stroke:" + color + "\n");
            }
        }
        linkStyles.forEach(sb::append);
    }

    private static String arrow(EdgeStyle style) {
        return switch (style) {
            case SECURITY -> "-. security .->";
            case DATA -> "==>";
            case CROSS_BOUNDARY -> "-.->";
            case DEFAULT -> "-->";
        };
    }

    private void appendLegend(StringBuilder sb, LayoutParams layout) {
        sb.append(MARKDOWN_NEWLINE);
        sb.append("| Edge style | Count |\n");
        sb.append("|---|---|\n");
        for (EdgeStyle style : EdgeStyle.values()) {
            sb.append("| ").append(style.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                .append(" | ").append(layout.edgeStyles().getOrDefault(style, 0)).append(" |\n");
        }
    }

    // ==================== Helpers ====================

    /**
     * Assigns every node a Mermaid-safe identifier, unique even when two ids sanitize
     * to the same text.
     */
    private Map<String, String> aliases(List<ResourceNode> nodes) {
        Map<String, String> aliases = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (ResourceNode node : nodes) {
            String base = sanitizeId(node.id());
            String alias = base;
            for (int suffix = 2; !used.add(alias); suffix++) {
                alias = base + "_" + suffix;
            }
            aliases.put(node.id(), alias);
        }
        return aliases;
    }

    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Escapes text for a quoted Mermaid label: double quotes become single quotes,
     * newlines become spaces, angle brackets become entities.
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String environmentLabel(String environment) {
        StringBuilder label = new StringBuilder();
        for (String word : environment.replace('-', ' ').split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }

    private static int pixels(double inches) {
        return (int) Math.round(inches * PIXELS_PER_INCH);
    }
}
