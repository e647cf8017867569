package com.infragraph.core.model;

import java.util.Objects;

/**
 * Directed relationship between two resources.
 *
 * <p>The edge points from the dependency to the dependent: if B references A the
 * edge is A → B.
 *
 * @param from id of the referenced resource
 * @param to id of the referencing resource
 * @param kind how the edge was discovered
 * @param styleHint visual class, {@code null} until the layout deriver runs
 */
public record Edge(
    String from,
    String to,
    EdgeKind kind,
    EdgeStyle styleHint
) {
    /**
     * Compact constructor with validation.
     */
    public Edge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (from.equals(to)) {
            throw new IllegalArgumentException("Self-loop edge on " + from);
        }
    }

    /**
     * Creates an unstyled edge.
     *
     * @param from referenced resource id
     * @param to referencing resource id
     * @param kind edge kind
     * @return new edge
     */
    public static Edge of(String from, String to, EdgeKind kind) {
        return new Edge(from, to, kind, null);
    }

    /**
     * Returns a copy carrying the given style hint.
     *
     * @param style style hint
     * @return styled edge
     */
    public Edge withStyle(EdgeStyle style) {
        return new Edge(from, to, kind, style);
    }

    /**
     * Returns the ordered pair key used for deduplication.
     *
     * @return {@code from->to}
     */
    public String pairKey() {
        return from + "->" + to;
    }
}
