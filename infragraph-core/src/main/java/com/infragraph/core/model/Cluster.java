package com.infragraph.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named group of resources, possibly nested inside a parent cluster.
 *
 * @param id unique cluster id (e.g. {@code provider:aws}, {@code network:<node-id>})
 * @param label display label
 * @param kind grouping dimension
 * @param parentId id of the enclosing cluster, {@code null} for roots
 * @param memberIds ids of the resources directly in this cluster
 */
public record Cluster(
    String id,
    String label,
    ClusterKind kind,
    String parentId,
    Set<String> memberIds
) {
    /** Id of the bucket holding resources without network containment. */
    public static final String UNGROUPED_ID = "network:ungrouped";

    /**
     * Compact constructor with validation.
     */
    public Cluster {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (id.equals(parentId)) {
            throw new IllegalArgumentException("Cluster cannot be its own parent: " + id);
        }
        memberIds = memberIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(memberIds));
    }

    /**
     * Returns true for the bucket of resources without network containment.
     *
     * @return true if this is the ungrouped bucket
     */
    public boolean isUngrouped() {
        return UNGROUPED_ID.equals(id);
    }

    /**
     * Returns true if this cluster has no parent.
     *
     * @return true for roots
     */
    public boolean isRoot() {
        return parentId == null;
    }
}
