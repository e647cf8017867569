package com.infragraph.core.model;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical merged resource graph.
 *
 * <p>Nodes are kept sorted by id and edges by {@code (from, to)} so every consumer
 * iterates in the same order regardless of parse order.
 *
 * @param nodes resources, unique by id
 * @param edges directed edges between node ids
 */
public record ResourceGraph(
    List<ResourceNode> nodes,
    List<Edge> edges
) {
    /**
     * Compact constructor with validation and canonical ordering.
     */
    public ResourceGraph {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        nodes = nodes.stream()
            .sorted(Comparator.comparing(ResourceNode::id))
            .toList();
        edges = edges.stream()
            .sorted(Comparator.comparing(Edge::from).thenComparing(Edge::to))
            .toList();
    }

    /**
     * Returns an empty graph.
     *
     * @return graph without nodes or edges
     */
    public static ResourceGraph empty() {
        return new ResourceGraph(List.of(), List.of());
    }

    /**
     * Indexes nodes by id.
     *
     * @return id to node map in id order
     */
    public Map<String, ResourceNode> nodesById() {
        Map<String, ResourceNode> byId = new LinkedHashMap<>();
        for (ResourceNode node : nodes) {
            byId.put(node.id(), node);
        }
        return byId;
    }

    /**
     * Returns the distinct provider tags present in the graph.
     *
     * @return sorted provider tags
     */
    public Set<String> providers() {
        Set<String> providers = new TreeSet<>();
        for (ResourceNode node : nodes) {
            providers.add(node.provider());
        }
        return providers;
    }

    /**
     * Returns a copy with the given edges.
     *
     * @param newEdges replacement edges
     * @return new graph
     */
    public ResourceGraph withEdges(List<Edge> newEdges) {
        return new ResourceGraph(nodes, newEdges);
    }
}
