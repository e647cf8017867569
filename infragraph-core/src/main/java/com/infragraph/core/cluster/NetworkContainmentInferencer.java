package com.infragraph.core.cluster;

import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.model.Cluster;
import com.infragraph.core.model.ClusterKind;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.util.ResourceTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Infers network-container clusters (VPC / virtual network, then subnet) from the edges
 * already in the graph.
 *
 * <p><b>Pass 1</b> links each sub-container to a container it shares an edge with (in
 * either direction; the lowest id wins when there are several, with an ambiguity
 * warning). A container that references another container nests under the root of that
 * container's chain, so nesting never exceeds two levels; a sub-container whose
 * container is itself nested attaches to the root.
 *
 * <p><b>Pass 2</b> places every other resource in the lowest-id sub-container it shares
 * an edge with, else in the lowest-id container, else in the ungrouped bucket.
 *
 * <p>No edges are created; only existing nodes are grouped.
 */
class NetworkContainmentInferencer {

    private static final Logger log = LoggerFactory.getLogger(NetworkContainmentInferencer.class);

    private static final String CLUSTER_PREFIX = "network:";
    private static final String UNGROUPED_LABEL = "Ungrouped";
    private static final String PUBLIC_SUFFIX = " (public)";
    private static final List<String> PUBLIC_NAME_MARKERS = List.of("public", "dmz", "external");
    private static final List<String> PUBLIC_IP_ATTRIBUTES = List.of("map_public_ip_on_launch", "MapPublicIpOnLaunch");

    /**
     * Returns the network clusters ordered by (depth, id), the ungrouped bucket last.
     *
     * @param graph resource graph
     * @param diagnostics receives ambiguity warnings
     * @return network-container clusters
     */
    List<Cluster> infer(ResourceGraph graph, Consumer<Diagnostic> diagnostics) {
        Map<String, ResourceNode> nodes = graph.nodesById();
        Set<String> containers = new TreeSet<>();
        Set<String> subContainers = new TreeSet<>();
        for (ResourceNode node : nodes.values()) {
            if (ResourceTaxonomy.isSubContainer(node.type())) {
                subContainers.add(node.id());
            } else if (ResourceTaxonomy.isContainer(node.type())) {
                containers.add(node.id());
            }
        }

        Map<String, Set<String>> neighbours = new HashMap<>();
        Map<String, Set<String>> referencedBy = new HashMap<>();
        for (Edge edge : graph.edges()) {
            neighbours.computeIfAbsent(edge.from(), k -> new TreeSet<>()).add(edge.to());
            neighbours.computeIfAbsent(edge.to(), k -> new TreeSet<>()).add(edge.from());
            referencedBy.computeIfAbsent(edge.to(), k -> new TreeSet<>()).add(edge.from());
        }

        Map<String, String> containerParent = nestContainers(containers, referencedBy, diagnostics);

        Map<String, String> subContainerParent = new TreeMap<>();
        for (String sub : subContainers) {
            List<String> candidates = neighbours.getOrDefault(sub, Set.of()).stream()
                .filter(containers::contains)
                .toList();
            if (candidates.isEmpty()) {
                continue;
            }
            String container = candidates.get(0);
            if (candidates.size() > 1) {
                diagnostics.accept(Diagnostic.clusteringAmbiguity(sub,
                    "Subnet " + sub + " touches several networks " + candidates + ", placed under " + container));
            }
            subContainerParent.put(sub, rootOf(container, containerParent));
        }

        Map<String, Set<String>> members = new LinkedHashMap<>();
        containers.forEach(id -> members.computeIfAbsent(id, k -> new TreeSet<>()).add(id));
        subContainers.forEach(id -> members.computeIfAbsent(id, k -> new TreeSet<>()).add(id));
        Set<String> ungrouped = new TreeSet<>();
        boolean hasContainment = !containers.isEmpty() || !subContainers.isEmpty();

        for (ResourceNode node : nodes.values()) {
            String id = node.id();
            if (containers.contains(id) || subContainers.contains(id)) {
                continue;
            }
            Set<String> adjacent = neighbours.getOrDefault(id, Set.of());
            String owner = adjacent.stream().filter(subContainers::contains).findFirst()
                .orElseGet(() -> adjacent.stream().filter(containers::contains).findFirst().orElse(null));
            if (owner != null) {
                members.get(owner).add(id);
                continue;
            }
            ungrouped.add(id);
            if (hasContainment) {
                diagnostics.accept(Diagnostic.clusteringAmbiguity(id,
                    "Resource " + id + " has no network containment, placed in the ungrouped bucket"));
            }
        }

        List<Cluster> roots = new ArrayList<>();
        List<Cluster> children = new ArrayList<>();
        for (String id : members.keySet()) {
            String parent = containers.contains(id) ? containerParent.get(id) : subContainerParent.get(id);
            Cluster cluster = new Cluster(CLUSTER_PREFIX + id, label(nodes.get(id), subContainers.contains(id)),
                ClusterKind.NETWORK_CONTAINER, parent == null ? null : CLUSTER_PREFIX + parent, members.get(id));
            (parent == null ? roots : children).add(cluster);
        }
        roots.sort(Comparator.comparing(Cluster::id));
        children.sort(Comparator.comparing(Cluster::id));
        List<Cluster> clusters = new ArrayList<>(roots);
        clusters.addAll(children);
        if (!ungrouped.isEmpty()) {
            clusters.add(new Cluster(Cluster.UNGROUPED_ID, UNGROUPED_LABEL, ClusterKind.NETWORK_CONTAINER, null, ungrouped));
        }
        log.debug("Inferred {} network clusters ({} ungrouped resources)", clusters.size(), ungrouped.size());
        return clusters;
    }

    /**
     * Picks for every container the container it references (lowest id), breaks cycles
     * and collapses chains so the parent is always a root.
     */
    private static Map<String, String> nestContainers(Set<String> containers, Map<String, Set<String>> referencedBy,
                                                      Consumer<Diagnostic> diagnostics) {
        Map<String, String> rawParent = new TreeMap<>();
        for (String container : containers) {
            List<String> referenced = referencedBy.getOrDefault(container, Set.of()).stream()
                .filter(containers::contains)
                .toList();
            if (referenced.isEmpty()) {
                continue;
            }
            if (referenced.size() > 1) {
                diagnostics.accept(Diagnostic.clusteringAmbiguity(container,
                    "Network " + container + " references several networks " + referenced
                        + ", nested under " + referenced.get(0)));
            }
            rawParent.put(container, referenced.get(0));
        }

        for (String container : containers) {
            Set<String> seen = new HashSet<>();
            String current = container;
            while (current != null && seen.add(current)) {
                current = rawParent.get(current);
            }
            if (current != null && current.equals(container)) {
                log.debug("Breaking network nesting cycle at {}", container);
                rawParent.remove(container);
            }
        }

        Map<String, String> parent = new TreeMap<>();
        for (String container : rawParent.keySet()) {
            parent.put(container, rootOf(rawParent.get(container), rawParent));
        }
        return parent;
    }

    private static String rootOf(String container, Map<String, String> parents) {
        Set<String> seen = new HashSet<>();
        String current = container;
        while (parents.containsKey(current) && seen.add(current)) {
            current = parents.get(current);
        }
        return current;
    }

    private static String label(ResourceNode node, boolean subContainer) {
        String label = node.displayName();
        return subContainer && isPublic(node) ? label + PUBLIC_SUFFIX : label;
    }

    private static boolean isPublic(ResourceNode node) {
        String name = (node.logicalName() + " " + node.displayName()).toLowerCase(Locale.ROOT);
        if (PUBLIC_NAME_MARKERS.stream().anyMatch(name::contains)) {
            return true;
        }
        for (String attribute : PUBLIC_IP_ATTRIBUTES) {
            Object value = node.attributes().get(attribute);
            if (Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value))) {
                return true;
            }
        }
        return false;
    }
}
