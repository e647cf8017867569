package com.infragraph.core.model;

/**
 * How an edge between two resources was discovered.
 */
public enum EdgeKind {
    /** Stated by an ordering directive such as {@code depends_on} or {@code DependsOn} */
    EXPLICIT_DEPENDENCY(3),

    /** Found by resolving a reference expression inside an attribute */
    ATTRIBUTE_REFERENCE(2),

    /** Inferred from declaration structure (Bicep {@code parent}, fallback chains) */
    IMPLICIT_ORDERING(1);

    private final int precedence;

    EdgeKind(int precedence) {
        this.precedence = precedence;
    }

    /**
     * Returns the precedence used when duplicate edges on the same pair collapse.
     *
     * @return higher wins
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Returns the stronger of two kinds.
     *
     * @param a first kind
     * @param b second kind
     * @return kind with the higher precedence
     */
    public static EdgeKind strongest(EdgeKind a, EdgeKind b) {
        return a.precedence >= b.precedence ? a : b;
    }
}
