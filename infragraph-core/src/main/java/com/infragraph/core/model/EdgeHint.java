package com.infragraph.core.model;

import java.util.Objects;

/**
 * Dependency stated explicitly in a document.
 *
 * <p>Hints name node ids, so they need no attribute scanning. For an ordering directive
 * on B naming A the hint is {@code from=A, to=B}. The dependency may live in another
 * document of the same run; when ids carry an environment prefix, {@code from} keeps the
 * unprefixed id and is matched to a node when the graph is merged.
 *
 * @param from node id of the dependency, possibly without environment prefix
 * @param to node id of the dependent
 * @param kind edge kind to create
 */
public record EdgeHint(
    String from,
    String to,
    EdgeKind kind
) {
    /**
     * Compact constructor with validation.
     */
    public EdgeHint {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
