package com.infragraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Final pipeline output handed to rendering backends.
 *
 * @param nodes resources in id order
 * @param edges edges with style hints set
 * @param clusters cluster forest (all kinds)
 * @param layout derived layout parameters
 * @param complexity complexity snapshot the layout was derived from
 */
public record LayoutReadyGraph(
    List<ResourceNode> nodes,
    List<Edge> edges,
    List<Cluster> clusters,
    LayoutParams layout,
    DiagramComplexity complexity
) {
    /**
     * Compact constructor with validation.
     */
    public LayoutReadyGraph {
        Objects.requireNonNull(layout, "layout must not be null");
        Objects.requireNonNull(complexity, "complexity must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
    }

    /**
     * Returns the clusters of one kind.
     *
     * @param kind cluster kind
     * @return clusters of that kind, in forest order
     */
    public List<Cluster> clustersOf(ClusterKind kind) {
        return clusters.stream()
            .filter(c -> c.kind() == kind)
            .toList();
    }
}
