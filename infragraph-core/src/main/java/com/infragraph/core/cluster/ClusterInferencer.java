package com.infragraph.core.cluster;

import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.model.Cluster;
import com.infragraph.core.model.ClusterKind;
import com.infragraph.core.model.ResourceCategory;
import com.infragraph.core.model.ResourceGraph;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.util.ResourceTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups the resources of a graph into a cluster forest along three dimensions.
 *
 * <ul>
 *   <li><b>Provider</b>: one cluster per provider tag ({@code provider:aws})</li>
 *   <li><b>Category</b>: one cluster per category in use ({@code category:network}),
 *       from {@link ResourceTaxonomy#category(String)}</li>
 *   <li><b>Network container</b>: inferred VPC / subnet containment
 *       ({@code network:<node-id>}), plus {@value Cluster#UNGROUPED_ID} for resources
 *       without containment</li>
 * </ul>
 *
 * <p>Every node ends up in exactly one cluster of each kind. The forest is verified by
 * {@link ClusterForest#verify} before it is returned.
 */
public class ClusterInferencer {

    private static final Logger log = LoggerFactory.getLogger(ClusterInferencer.class);

    /** User tag that overrides the keyword-based category. */
    public static final String TAG_CATEGORY = "category";

    private final NetworkContainmentInferencer networkInferencer = new NetworkContainmentInferencer();

    /**
     * Cluster forest plus the ambiguity warnings raised while building it.
     *
     * @param clusters provider clusters, then category clusters, then network clusters
     * @param diagnostics clustering ambiguity warnings
     */
    public record Inference(List<Cluster> clusters, List<Diagnostic> diagnostics) {

        public Inference {
            clusters = List.copyOf(clusters);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * Infers all clusters of a graph.
     *
     * @param graph resource graph
     * @return clusters and warnings
     */
    public Inference infer(ResourceGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Cluster> clusters = new ArrayList<>();
        clusters.addAll(providerClusters(graph));
        clusters.addAll(categoryClusters(graph));
        clusters.addAll(networkInferencer.infer(graph, diagnostics::add));

        ClusterForest.verify(clusters, graph.nodesById().keySet());
        log.info("Inferred {} clusters with {} ambiguity warnings", clusters.size(), diagnostics.size());
        return new Inference(clusters, diagnostics);
    }

    private static List<Cluster> providerClusters(ResourceGraph graph) {
        Map<String, Set<String>> byProvider = new TreeMap<>();
        for (ResourceNode node : graph.nodes()) {
            byProvider.computeIfAbsent(node.provider(), p -> new TreeSet<>()).add(node.id());
        }
        List<Cluster> clusters = new ArrayList<>();
        byProvider.forEach((provider, members) -> clusters.add(new Cluster(
            "provider:" + provider, ResourceTaxonomy.providerLabel(provider), ClusterKind.PROVIDER, null, members)));
        return clusters;
    }

    private static List<Cluster> categoryClusters(ResourceGraph graph) {
        Map<ResourceCategory, Set<String>> byCategory = new EnumMap<>(ResourceCategory.class);
        for (ResourceNode node : graph.nodes()) {
            byCategory.computeIfAbsent(categoryOf(node), c -> new TreeSet<>()).add(node.id());
        }
        List<Cluster> clusters = new ArrayList<>();
        byCategory.forEach((category, members) -> clusters.add(new Cluster(
            "category:" + category.name().toLowerCase(Locale.ROOT), category.label(), ClusterKind.CATEGORY, null, members)));
        return clusters;
    }

    /**
     * Returns the category of a node: its {@value #TAG_CATEGORY} tag when that names a
     * known category, else the keyword lookup on its type.
     *
     * @param node resource
     * @return category
     */
    static ResourceCategory categoryOf(ResourceNode node) {
        String declared = node.tags().get(TAG_CATEGORY);
        if (declared != null) {
            for (ResourceCategory category : ResourceCategory.values()) {
                if (category.name().equalsIgnoreCase(declared.strip())) {
                    return category;
                }
            }
        }
        return ResourceTaxonomy.category(node.type());
    }
}
