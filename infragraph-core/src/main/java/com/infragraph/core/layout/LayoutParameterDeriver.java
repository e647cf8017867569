package com.infragraph.core.layout;

import com.infragraph.core.config.LayoutSettings;
import com.infragraph.core.diagnostic.InvariantViolationException;
import com.infragraph.core.model.DiagramComplexity;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.EdgeStyle;
import com.infragraph.core.model.LayoutDirection;
import com.infragraph.core.model.LayoutParams;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a complexity snapshot into rendering parameters.
 *
 * <p><b>Spacing.</b> Each of pad, node separation and rank separation starts at its
 * configured minimum and is multiplied by:
 * <ol>
 *   <li>{@code 1 + overallScore^0.7 * complexityScaleFactor}</li>
 *   <li>{@value #DIRECTION_FACTOR} on node separation for horizontal layouts, or on
 *       rank separation for vertical ones</li>
 *   <li>{@code edgeDensityScaleFactor} when {@code avgEdgesPerNode} exceeds
 *       {@code edgeDensityThreshold}</li>
 * </ol>
 * Results are rounded to two decimals. For a fixed direction and settings every output
 * is non-decreasing in the overall score.
 *
 * <p><b>Edge styles.</b> {@link #classify(ResourceGraph)} sets the style hint of every
 * edge with {@link EdgeStyleClassifier}.
 */
public class LayoutParameterDeriver {

    private static final Logger log = LoggerFactory.getLogger(LayoutParameterDeriver.class);

    static final double DAMPING_EXPONENT = 0.7;
    static final double DIRECTION_FACTOR = 1.2;

    /**
     * Derives layout parameters.
     *
     * @param complexity complexity snapshot
     * @param requested requested direction; {@link LayoutDirection#AUTO} selects one
     * @param settings spacing minimums and scale factors
     * @return layout parameters without edge style counts
     */
    public LayoutParams derive(DiagramComplexity complexity, LayoutDirection requested, LayoutSettings settings) {
        Objects.requireNonNull(complexity, "complexity must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        LayoutDirection direction = requested == null || requested == LayoutDirection.AUTO
            ? DirectionSelector.select(complexity)
            : requested;

        double growth = 1.0 + Math.pow(Math.max(complexity.overallScore(), 0.0), DAMPING_EXPONENT)
            * settings.complexityScaleFactor();
        double density = complexity.avgEdgesPerNode() > settings.edgeDensityThreshold()
            ? Math.max(settings.edgeDensityScaleFactor(), 1.0)
            : 1.0;

        double pad = settings.minPad() * growth * density;
        double nodeSeparation = settings.minNodeSeparation() * growth * density;
        double rankSeparation = settings.minRankSeparation() * growth * density;
        if (direction.isHorizontal()) {
            nodeSeparation *= DIRECTION_FACTOR;
        } else {
            rankSeparation *= DIRECTION_FACTOR;
        }

        LayoutParams params = new LayoutParams(direction, round(pad), round(nodeSeparation), round(rankSeparation), null);
        log.debug("Derived layout {} (requested {}): pad={}, nodesep={}, ranksep={}",
            direction, requested, params.pad(), params.nodeSeparation(), params.rankSeparation());
        return params;
    }

    /**
     * Returns a copy of the graph whose edges carry style hints.
     *
     * @param graph graph with unstyled edges
     * @return styled graph
     * @throws InvariantViolationException if an edge names an unknown node
     */
    public ResourceGraph classify(ResourceGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        Map<String, ResourceNode> nodes = graph.nodesById();
        List<Edge> styled = new ArrayList<>(graph.edges().size());
        for (Edge edge : graph.edges()) {
            ResourceNode from = nodes.get(edge.from());
            ResourceNode to = nodes.get(edge.to());
            if (from == null || to == null) {
                throw new InvariantViolationException("Edge " + edge.pairKey() + " names an unknown node");
            }
            styled.add(edge.withStyle(EdgeStyleClassifier.classify(from, to)));
        }
        return graph.withEdges(styled);
    }

    /**
     * Counts styled edges per style.
     *
     * @param edges styled edges
     * @return count per style, styles without edges omitted
     */
    public static Map<EdgeStyle, Integer> countStyles(List<Edge> edges) {
        Map<EdgeStyle, Integer> counts = new EnumMap<>(EdgeStyle.class);
        for (Edge edge : edges) {
            EdgeStyle style = edge.styleHint() == null ? EdgeStyle.DEFAULT : edge.styleHint();
            counts.merge(style, 1, Integer::sum);
        }
        return counts;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
