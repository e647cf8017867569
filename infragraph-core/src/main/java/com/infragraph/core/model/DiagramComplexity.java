package com.infragraph.core.model;

/**
 * Read-only complexity snapshot of a finished graph and its clusters.
 *
 * <p>The sub-score accessors normalise each raw metric to {@code [0, 1]} with a
 * saturating ramp ({@code value / threshold}, capped at 1).
 *
 * @param nodeCount number of resources
 * @param edgeCount number of edges
 * @param clusterCount number of clusters (the ungrouped bucket excluded)
 * @param maxClusterDepth longest parent chain in the cluster forest
 * @param maxLabelLength longest display name
 * @param providerCount distinct provider tags
 * @param avgEdgesPerNode {@code edgeCount / max(nodeCount, 1)}
 * @param overallScore weighted complexity score
 */
public record DiagramComplexity(
    int nodeCount,
    int edgeCount,
    int clusterCount,
    int maxClusterDepth,
    int maxLabelLength,
    int providerCount,
    double avgEdgesPerNode,
    double overallScore
) {
    public static final double NODE_THRESHOLD = 50.0;
    public static final double EDGE_DENSITY_THRESHOLD = 4.0;
    public static final double CLUSTER_THRESHOLD = 10.0;
    public static final double DEPTH_THRESHOLD = 3.0;
    public static final double LABEL_THRESHOLD = 40.0;
    public static final double PROVIDER_THRESHOLD = 3.0;

    public DiagramComplexity {
        if (nodeCount < 0 || edgeCount < 0 || clusterCount < 0
            || maxClusterDepth < 0 || maxLabelLength < 0 || providerCount < 0) {
            throw new IllegalArgumentException("Complexity counts must not be negative");
        }
    }

    public double nodeScore() {
        return ramp(nodeCount, NODE_THRESHOLD);
    }

    public double edgeDensityScore() {
        return ramp(avgEdgesPerNode, EDGE_DENSITY_THRESHOLD);
    }

    public double clusterScore() {
        return ramp(clusterCount, CLUSTER_THRESHOLD);
    }

    public double depthScore() {
        return ramp(maxClusterDepth, DEPTH_THRESHOLD);
    }

    public double labelScore() {
        return ramp(maxLabelLength, LABEL_THRESHOLD);
    }

    public double providerScore() {
        return ramp(providerCount, PROVIDER_THRESHOLD);
    }

    /**
     * Saturating ramp: {@code value / threshold} capped at 1.0, never negative.
     *
     * @param value raw metric
     * @param threshold saturation point
     * @return normalised score in [0, 1]
     */
    public static double ramp(double value, double threshold) {
        if (value <= 0.0) {
            return 0.0;
        }
        return Math.min(value / threshold, 1.0);
    }
}
