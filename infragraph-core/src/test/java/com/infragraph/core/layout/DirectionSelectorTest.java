package com.infragraph.core.layout;

import com.infragraph.core.model.DiagramComplexity;
import com.infragraph.core.model.LayoutDirection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DirectionSelector}.
 */
class DirectionSelectorTest {

    @Test
    void select_manyNodesInShallowClusters_choosesHorizontal() {
        // Given: 60 nodes, 8 clusters of depth 1, 1.5 edges per node
        DiagramComplexity complexity = complexity(60, 90, 8, 1, 1.5);

        // When / Then
        assertThat(DirectionSelector.horizontalScore(complexity))
            .isGreaterThan(DirectionSelector.verticalScore(complexity));
        assertThat(DirectionSelector.select(complexity)).isEqualTo(LayoutDirection.LEFT_RIGHT);
    }

    @Test
    void select_fewNodesDeepAndDense_choosesVertical() {
        // Given: 15 nodes nested three levels deep with 5 edges per node
        DiagramComplexity complexity = complexity(15, 75, 3, 3, 5.0);

        // When / Then
        assertThat(DirectionSelector.verticalScore(complexity))
            .isGreaterThan(DirectionSelector.horizontalScore(complexity));
        assertThat(DirectionSelector.select(complexity)).isEqualTo(LayoutDirection.TOP_BOTTOM);
    }

    @Test
    void scores_stayWithinUnitInterval() {
        DiagramComplexity extreme = complexity(1000, 10000, 100, 10, 10.0);
        DiagramComplexity empty = complexity(0, 0, 0, 0, 0.0);

        for (DiagramComplexity c : new DiagramComplexity[] {extreme, empty}) {
            assertThat(DirectionSelector.horizontalScore(c)).isBetween(0.0, 1.0);
            assertThat(DirectionSelector.verticalScore(c)).isBetween(0.0, 1.0);
        }
    }

    private static DiagramComplexity complexity(int nodes, int edges, int clusters, int depth, double density) {
        return new DiagramComplexity(nodes, edges, clusters, depth, 20, 1, density, 0.0);
    }
}
