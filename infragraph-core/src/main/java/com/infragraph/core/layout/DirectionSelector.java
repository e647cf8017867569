package com.infragraph.core.layout;

import com.infragraph.core.model.DiagramComplexity;
import com.infragraph.core.model.LayoutDirection;

/**
 * Chooses between a wide and a tall diagram from complexity metrics.
 *
 * <p>Both candidates are scored from the same sub-scores, weighted in opposite
 * directions:
 * <ul>
 *   <li><b>Horizontal</b> favours many nodes, many clusters, low edge density, shallow
 *       nesting, long labels and several providers (side by side lanes)</li>
 *   <li><b>Vertical</b> favours high edge density, deep nesting, few nodes and few but
 *       large clusters</li>
 * </ul>
 * Ties go to horizontal.
 */
public final class DirectionSelector {

    private DirectionSelector() {
        // Prevent instantiation
    }

    /** Nodes per cluster at which clusters count as fully "large". */
    static final double CLUSTER_SIZE_THRESHOLD = 10.0;

    /**
     * Selects the orientation.
     *
     * @param complexity complexity snapshot
     * @return {@link LayoutDirection#LEFT_RIGHT} or {@link LayoutDirection#TOP_BOTTOM}
     */
    public static LayoutDirection select(DiagramComplexity complexity) {
        return horizontalScore(complexity) >= verticalScore(complexity)
            ? LayoutDirection.LEFT_RIGHT
            : LayoutDirection.TOP_BOTTOM;
    }

    static double horizontalScore(DiagramComplexity c) {
        return 0.25 * c.nodeScore()
            + 0.25 * (1.0 - c.edgeDensityScore())
            + 0.15 * c.clusterScore()
            + 0.15 * (1.0 - c.depthScore())
            + 0.10 * c.labelScore()
            + 0.10 * c.providerScore();
    }

    static double verticalScore(DiagramComplexity c) {
        double nodesPerCluster = (double) c.nodeCount() / Math.max(c.clusterCount(), 1);
        return 0.25 * (1.0 - c.nodeScore())
            + 0.25 * c.edgeDensityScore()
            + 0.15 * DiagramComplexity.ramp(nodesPerCluster, CLUSTER_SIZE_THRESHOLD)
            + 0.15 * c.depthScore()
            + 0.10 * (1.0 - c.labelScore())
            + 0.10 * (1.0 - c.providerScore());
    }
}
