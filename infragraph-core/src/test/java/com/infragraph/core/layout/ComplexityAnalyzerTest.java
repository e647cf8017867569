package com.infragraph.core.layout;

import com.infragraph.core.model.Cluster;
import com.infragraph.core.model.ClusterKind;
import com.infragraph.core.model.DiagramComplexity;
import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComplexityAnalyzer}.
 */
class ComplexityAnalyzerTest {

    private ComplexityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ComplexityAnalyzer();
    }

    @Test
    void analyze_countsMetrics() {
        // Given: four nodes from two providers, three edges, a VPC with one child and an ungrouped bucket
        ResourceGraph graph = new ResourceGraph(List.of(
            node("n0", "aws"), node("n1", "aws"), node("a-much-longer-name", "aws"), node("n3", "azure")),
            List.of(edge(0, 1), edge(1, 3), edge(2, 3)));
        List<Cluster> clusters = List.of(
            new Cluster("network:vpc", "vpc", ClusterKind.NETWORK_CONTAINER, null, Set.of(id("n0"))),
            new Cluster("network:subnet", "subnet", ClusterKind.NETWORK_CONTAINER, "network:vpc",
                Set.of(id("n1"), id("a-much-longer-name"))),
            new Cluster(Cluster.UNGROUPED_ID, "Ungrouped", ClusterKind.NETWORK_CONTAINER, null, Set.of(id("n3"))));

        // When: analyzing
        DiagramComplexity complexity = analyzer.analyze(graph, clusters);

        // Then: the ungrouped bucket is not counted as a cluster
        assertThat(complexity.nodeCount()).isEqualTo(4);
        assertThat(complexity.edgeCount()).isEqualTo(3);
        assertThat(complexity.clusterCount()).isEqualTo(2);
        assertThat(complexity.maxClusterDepth()).isEqualTo(2);
        assertThat(complexity.maxLabelLength()).isEqualTo("a-much-longer-name".length());
        assertThat(complexity.providerCount()).isEqualTo(2);
        assertThat(complexity.avgEdgesPerNode()).isEqualTo(0.75);
        assertThat(complexity.overallScore()).isEqualTo(ComplexityAnalyzer.score(complexity));
    }

    @Test
    void analyze_emptyGraph_scoresZero() {
        DiagramComplexity complexity = analyzer.analyze(ResourceGraph.empty(), List.of());

        assertThat(complexity.nodeCount()).isZero();
        assertThat(complexity.avgEdgesPerNode()).isZero();
        assertThat(complexity.overallScore()).isZero();
    }

    @Test
    void analyze_largeDenseGraph_scoresHigherThanSmallSparseGraph() {
        // Given: 5 nodes with 4 edges versus 50 nodes with 200 edges
        ResourceGraph small = chain(5);
        ResourceGraph large = ring(50, 4);

        // When: analyzing both
        DiagramComplexity smallComplexity = analyzer.analyze(small, List.of());
        DiagramComplexity largeComplexity = analyzer.analyze(large, List.of());

        // Then: densities match the inputs and the larger graph is more complex
        assertThat(smallComplexity.avgEdgesPerNode()).isEqualTo(0.8);
        assertThat(large.edges()).hasSize(200);
        assertThat(largeComplexity.avgEdgesPerNode()).isEqualTo(4.0);
        assertThat(largeComplexity.overallScore()).isGreaterThan(smallComplexity.overallScore());
    }

    @Test
    void score_saturatesAtOne() {
        DiagramComplexity huge = new DiagramComplexity(500, 5000, 50, 9, 200, 7, 10.0, 0.0);

        assertThat(ComplexityAnalyzer.score(huge)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void score_isMonotonicInNodeCountAndDensity() {
        double previous = -1.0;
        for (int nodes = 0; nodes <= 80; nodes += 5) {
            double score = ComplexityAnalyzer.score(new DiagramComplexity(nodes, 0, 2, 1, 10, 1, 1.0, 0.0));
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
        previous = -1.0;
        for (double density = 0.0; density <= 6.0; density += 0.5) {
            double score = ComplexityAnalyzer.score(new DiagramComplexity(10, 0, 2, 1, 10, 1, density, 0.0));
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void analyze_ignoresNodeAndEdgeOrder() {
        ResourceGraph graph = ring(8, 2);
        List<ResourceNode> nodes = new ArrayList<>(graph.nodes());
        List<Edge> edges = new ArrayList<>(graph.edges());
        Collections.reverse(nodes);
        Collections.reverse(edges);

        assertThat(analyzer.analyze(new ResourceGraph(nodes, edges), List.of()))
            .isEqualTo(analyzer.analyze(graph, List.of()));
    }

    @Test
    void complexity_withNegativeCount_throwsException() {
        assertThatThrownBy(() -> new DiagramComplexity(-1, 0, 0, 0, 0, 0, 0.0, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Builds {@code size} nodes where node i points at the next {@code fanOut} nodes.
     */
    static ResourceGraph ring(int size, int fanOut) {
        List<ResourceNode> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            nodes.add(node(String.format("n%02d", i), "aws"));
        }
        for (int i = 0; i < size; i++) {
            for (int k = 1; k <= fanOut; k++) {
                edges.add(Edge.of(nodes.get(i).id(), nodes.get((i + k) % size).id(), EdgeKind.ATTRIBUTE_REFERENCE));
            }
        }
        return new ResourceGraph(nodes, edges);
    }

    /**
     * Builds {@code size} nodes linked in a single chain.
     */
    static ResourceGraph chain(int size) {
        ResourceGraph ring = ring(size, 1);
        String last = ring.nodes().get(size - 1).id();
        return ring.withEdges(ring.edges().stream().filter(edge -> !edge.from().equals(last)).toList());
    }

    private static ResourceNode node(String name, String provider) {
        return new ResourceNode(id(name), "aws_instance", provider, null, name, Dialect.TERRAFORM, Map.of(), Map.of());
    }

    private static String id(String name) {
        return ResourceNode.idOf(Dialect.TERRAFORM, "aws_instance", name);
    }

    private static Edge edge(int from, int to) {
        List<String> names = List.of("n0", "n1", "a-much-longer-name", "n3");
        return Edge.of(id(names.get(from)), id(names.get(to)), EdgeKind.ATTRIBUTE_REFERENCE);
    }
}
