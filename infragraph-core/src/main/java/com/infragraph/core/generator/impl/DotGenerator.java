package com.infragraph.core.generator.impl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

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
 * Generates Graphviz DOT from layout-ready graphs.
 *
 * <p>{@link LayoutParams} map one to one onto graph attributes ({@code rankdir},
 * {@code pad}, {@code nodesep}, {@code ranksep}). Clusters of the configured kind become
 * {@code subgraph cluster_N} blocks, nested along the network forest; the ungrouped
 * bucket is left unframed. Edge style hints set {@code style} and {@code color}.
 *
 * <p>Custom settings: {@code fontName} (default {@code Helvetica}).
 */
public class DotGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(DotGenerator.class);

    private static final String GENERATOR_ID = "dot";
    private static final String GENERATOR_DISPLAY_NAME = "Graphviz DOT Generator";
    private static final String FILE_EXTENSION = "dot";
    private static final String DIAGRAM_NAME = "infrastructure";

    private static final String SETTING_FONT_NAME = "fontName";
    private static final String DEFAULT_FONT_NAME = "Helvetica";

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

        String font = config.getSettingOrDefault(SETTING_FONT_NAME, DEFAULT_FONT_NAME);
        LayoutParams layout = graph.layout();
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(config.title() == null ? DIAGRAM_NAME : config.title())).append(" {\n");
        sb.append(String.format(Locale.ROOT,
            "  graph [rankdir=%s, pad=%.2f, nodesep=%.2f, ranksep=%.2f, compound=true, fontname=%s];\n",
            layout.direction().code(), layout.pad(), layout.nodeSeparation(), layout.rankSeparation(), quote(font)));
        sb.append("  node [shape=box, style=\"rounded,filled\", fillcolor=\"#f7f7f7\", fontname=")
            .append(quote(font)).append("];\n");
        sb.append("  edge [fontname=").append(quote(font)).append("];\n");

        Map<String, ResourceNode> nodes = new LinkedHashMap<>();
        graph.nodes().forEach(node -> nodes.put(node.id(), node));
        List<Cluster> clusters = graph.clustersOf(config.groupBy());
        int[] counter = {0};
        appendClusters(sb, clusters, null, nodes, counter, "  ");
        clusters.stream()
            .filter(Cluster::isUngrouped)
            .flatMap(c -> c.memberIds().stream())
            .forEach(id -> appendNode(sb, nodes.get(id), "  "));
        if (clusters.isEmpty()) {
            nodes.values().forEach(node -> appendNode(sb, node, "  "));
        }

        for (Edge edge : graph.edges()) {
            sb.append("  ").append(quote(edge.from())).append(" -> ").append(quote(edge.to()))
                .append(edgeAttributes(edge)).append(";\n");
        }
        sb.append("}\n");

        log.info("Generated DOT graph with {} nodes and {} edges", graph.nodes().size(), graph.edges().size());
        return new GeneratedDiagram(DIAGRAM_NAME, sb.toString(), getFileExtension());
    }

    private void appendClusters(StringBuilder sb, List<Cluster> clusters, String parentId,
                                Map<String, ResourceNode> nodes, int[] counter, String indent) {
        for (Cluster cluster : clusters) {
            if (cluster.isUngrouped() || !Objects.equals(cluster.parentId(), parentId)) {
                continue;
            }
            sb.append(indent).append("subgraph cluster_").append(counter[0]++).append(" {\n");
            sb.append(indent).append("  label=").append(quote(cluster.label())).append(";\n");
            if (cluster.kind() == ClusterKind.NETWORK_CONTAINER) {
                sb.append(indent).append("  style=dashed;\n");
            }
            for (String memberId : cluster.memberIds()) {
                appendNode(sb, nodes.get(memberId), indent + "  ");
            }
            appendClusters(sb, clusters, cluster.id(), nodes, counter, indent + "  ");
            sb.append(indent).append("}\n");
        }
    }

    private void appendNode(StringBuilder sb, ResourceNode node, String indent) {
        if (node == null) {
            return;
        }
        sb.append(indent).append(quote(node.id()))
            .append(" [label=").append(quote(node.displayName() + "\n" + node.type())).append("];\n");
    }

    private static String edgeAttributes(Edge edge) {
        EdgeStyle style = edge.styleHint() == null ? EdgeStyle.DEFAULT : edge.styleHint();
        return switch (style) {
            case SECURITY -> " [color=\"#d62728\", style=bold]";
            case DATA -> " [color=\"#1f77b4\", penwidth=2]";
            case CROSS_BOUNDARY -> " [color=\"#7f7f7f\", style=dashed]";
            case DEFAULT -> "";
        };
    }

    /**
     * Quotes a DOT identifier, escaping backslashes and double quotes and turning
     * newlines into centered line breaks.
     */
    static String quote(String text) {
        String escaped = text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
        return "\"" + escaped + "\"";
    }
}
