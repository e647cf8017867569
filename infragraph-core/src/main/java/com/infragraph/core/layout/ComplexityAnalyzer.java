package com.infragraph.core.layout;

import com.infragraph.core.cluster.ClusterForest;
import com.infragraph.core.model.Cluster;
import com.infragraph.core.model.DiagramComplexity;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Measures how hard a graph will be to lay out.
 *
 * <p>The overall score is a weighted sum of six sub-scores, each normalised with
 * {@link DiagramComplexity#ramp(double, double)}:
 * <pre>
 * 0.25 nodes + 0.25 edge density + 0.15 clusters + 0.15 depth + 0.10 labels + 0.10 providers
 * </pre>
 *
 * <p>Pure and deterministic: only counts and maxima are used, so cycles in the graph
 * and the order of nodes, edges or clusters do not affect the result.
 */
public class ComplexityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    // --- Weights ---
    static final double NODE_WEIGHT = 0.25;
    static final double EDGE_DENSITY_WEIGHT = 0.25;
    static final double CLUSTER_WEIGHT = 0.15;
    static final double DEPTH_WEIGHT = 0.15;
    static final double LABEL_WEIGHT = 0.10;
    static final double PROVIDER_WEIGHT = 0.10;

    /**
     * Analyzes a graph and its cluster forest.
     *
     * @param graph resource graph
     * @param clusters clusters of all kinds; the ungrouped bucket is not counted
     * @return complexity snapshot
     */
    public DiagramComplexity analyze(ResourceGraph graph, List<Cluster> clusters) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(clusters, "clusters must not be null");

        int nodeCount = graph.nodes().size();
        int edgeCount = graph.edges().size();
        int clusterCount = (int) clusters.stream().filter(c -> !c.isUngrouped()).count();
        int maxDepth = ClusterForest.maxDepth(clusters);
        int maxLabelLength = graph.nodes().stream()
            .map(ResourceNode::displayName)
            .mapToInt(String::length)
            .max()
            .orElse(0);
        int providerCount = graph.providers().size();
        double avgEdgesPerNode = (double) edgeCount / Math.max(nodeCount, 1);

        DiagramComplexity partial = new DiagramComplexity(nodeCount, edgeCount, clusterCount, maxDepth,
            maxLabelLength, providerCount, avgEdgesPerNode, 0.0);
        double score = score(partial);
        DiagramComplexity complexity = new DiagramComplexity(nodeCount, edgeCount, clusterCount, maxDepth,
            maxLabelLength, providerCount, avgEdgesPerNode, score);

        log.debug("Complexity: nodes={}, edges={}, clusters={}, depth={}, score={}",
            nodeCount, edgeCount, clusterCount, maxDepth, score);
        return complexity;
    }

    /**
     * Computes the weighted overall score from the sub-scores of a snapshot.
     *
     * @param complexity snapshot (its own overall score is ignored)
     * @return weighted score
     */
    static double score(DiagramComplexity complexity) {
        return NODE_WEIGHT * complexity.nodeScore()
            + EDGE_DENSITY_WEIGHT * complexity.edgeDensityScore()
            + CLUSTER_WEIGHT * complexity.clusterScore()
            + DEPTH_WEIGHT * complexity.depthScore()
            + LABEL_WEIGHT * complexity.labelScore()
            + PROVIDER_WEIGHT * complexity.providerScore();
    }
}
