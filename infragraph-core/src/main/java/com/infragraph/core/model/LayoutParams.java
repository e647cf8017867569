package com.infragraph.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rendering parameters derived from graph complexity.
 *
 * @param direction resolved orientation, never {@link LayoutDirection#AUTO}
 * @param pad outer padding (inches, Graphviz {@code pad})
 * @param nodeSeparation space between nodes of one rank ({@code nodesep})
 * @param rankSeparation space between ranks ({@code ranksep})
 * @param edgeStyles number of edges per style hint
 */
public record LayoutParams(
    LayoutDirection direction,
    double pad,
    double nodeSeparation,
    double rankSeparation,
    Map<EdgeStyle, Integer> edgeStyles
) {
    /**
     * Compact constructor with validation.
     */
    public LayoutParams {
        Objects.requireNonNull(direction, "direction must not be null");
        if (direction == LayoutDirection.AUTO) {
            throw new IllegalArgumentException("LayoutParams need a resolved direction");
        }
        EnumMap<EdgeStyle, Integer> counts = new EnumMap<>(EdgeStyle.class);
        if (edgeStyles != null) {
            counts.putAll(edgeStyles);
        }
        edgeStyles = Collections.unmodifiableMap(counts);
    }

    /**
     * Returns a copy with the given edge style counts.
     *
     * @param counts style counts
     * @return new params
     */
    public LayoutParams withEdgeStyles(Map<EdgeStyle, Integer> counts) {
        return new LayoutParams(direction, pad, nodeSeparation, rankSeparation, counts);
    }
}
