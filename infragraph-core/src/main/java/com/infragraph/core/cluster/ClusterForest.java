package com.infragraph.core.cluster;

import com.infragraph.core.diagnostic.InvariantViolationException;
import com.infragraph.core.model.Cluster;
import com.infragraph.core.model.ClusterKind;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks and measurements on a cluster forest.
 */
public final class ClusterForest {

    private ClusterForest() {
        // Prevent instantiation
    }

    /**
     * Verifies the forest invariants:
     * <ul>
     *   <li>cluster ids are unique</li>
     *   <li>every parent exists and has the same kind as its child</li>
     *   <li>parent chains terminate (no cycles)</li>
     *   <li>every node is a member of exactly one cluster per kind</li>
     * </ul>
     *
     * @param clusters clusters of all kinds
     * @param nodeIds ids of all graph nodes
     * @throws InvariantViolationException on the first violation found
     */
    public static void verify(List<Cluster> clusters, Collection<String> nodeIds) {
        Map<String, Cluster> byId = index(clusters);
        for (Cluster cluster : clusters) {
            if (cluster.parentId() == null) {
                continue;
            }
            Cluster parent = byId.get(cluster.parentId());
            if (parent == null) {
                throw new InvariantViolationException("Cluster " + cluster.id() + " has unknown parent " + cluster.parentId());
            }
            if (parent.kind() != cluster.kind()) {
                throw new InvariantViolationException("Cluster " + cluster.id() + " nests under a cluster of another kind");
            }
            depthOf(cluster, byId);
        }

        Map<ClusterKind, Map<String, String>> owners = new EnumMap<>(ClusterKind.class);
        for (Cluster cluster : clusters) {
            Map<String, String> owner = owners.computeIfAbsent(cluster.kind(), k -> new HashMap<>());
            for (String member : cluster.memberIds()) {
                String previous = owner.put(member, cluster.id());
                if (previous != null) {
                    throw new InvariantViolationException("Node " + member + " is in both " + previous
                        + " and " + cluster.id());
                }
            }
        }
        for (ClusterKind kind : owners.keySet()) {
            Map<String, String> owner = owners.get(kind);
            for (String nodeId : nodeIds) {
                if (!owner.containsKey(nodeId)) {
                    throw new InvariantViolationException("Node " + nodeId + " has no " + kind + " cluster");
                }
            }
            if (owner.size() != nodeIds.size()) {
                throw new InvariantViolationException(kind + " clusters reference unknown nodes");
            }
        }
    }

    /**
     * Returns the longest parent chain (a root counts as 1, an empty forest as 0).
     *
     * @param clusters clusters of all kinds
     * @return maximum depth
     */
    public static int maxDepth(List<Cluster> clusters) {
        Map<String, Cluster> byId = index(clusters);
        int max = 0;
        for (Cluster cluster : clusters) {
            max = Math.max(max, depthOf(cluster, byId));
        }
        return max;
    }

    private static int depthOf(Cluster cluster, Map<String, Cluster> byId) {
        Set<String> seen = new HashSet<>();
        int depth = 0;
        Cluster current = cluster;
        while (current != null) {
            if (!seen.add(current.id())) {
                throw new InvariantViolationException("Cluster cycle through " + current.id());
            }
            depth++;
            current = current.parentId() == null ? null : byId.get(current.parentId());
        }
        return depth;
    }

    private static Map<String, Cluster> index(List<Cluster> clusters) {
        Map<String, Cluster> byId = new HashMap<>();
        for (Cluster cluster : clusters) {
            if (byId.put(cluster.id(), cluster) != null) {
                throw new InvariantViolationException("Duplicate cluster id " + cluster.id());
            }
        }
        return byId;
    }
}
