package com.infragraph.core.graph;

import com.infragraph.core.diagnostic.InvariantViolationException;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural checks on a built graph.
 *
 * <p>A failure here is a bug in the pipeline, never a problem with the input.
 */
public final class GraphInvariants {

    private GraphInvariants() {
        // Prevent instantiation
    }

    /**
     * Verifies unique node ids, no self-loops, no duplicate ordered pairs and no
     * dangling edge endpoints.
     *
     * @param graph graph to check
     * @throws InvariantViolationException on the first violation found
     */
    public static void verify(ResourceGraph graph) {
        Set<String> ids = new HashSet<>();
        for (ResourceNode node : graph.nodes()) {
            if (!ids.add(node.id())) {
                throw new InvariantViolationException("Duplicate node id " + node.id());
            }
        }
        Set<String> pairs = new HashSet<>();
        for (Edge edge : graph.edges()) {
            if (edge.from().equals(edge.to())) {
                throw new InvariantViolationException("Self-loop on " + edge.from());
            }
            if (!ids.contains(edge.from()) || !ids.contains(edge.to())) {
                throw new InvariantViolationException("Edge " + edge.pairKey() + " references an unknown node");
            }
            if (!pairs.add(edge.pairKey())) {
                throw new InvariantViolationException("Duplicate edge " + edge.pairKey());
            }
        }
    }
}
