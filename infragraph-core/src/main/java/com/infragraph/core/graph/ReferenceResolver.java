package com.infragraph.core.graph;

import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.Edge;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns reference expressions and explicit hints into edges.
 *
 * <p>For every declaration the attribute tree is walked and each value is offered to
 * the dialect's {@link ReferenceExtractor}. A resource declared more than once is
 * walked once per declaration, so the edges of all its declarations are kept. A lookup
 * key resolves against the nodes of the same dialect, first within the referencing
 * node's environment and then across all environments:
 * <ul>
 *   <li>exactly one candidate: an {@link EdgeKind#ATTRIBUTE_REFERENCE} edge from the
 *       referenced node to the referencing node</li>
 *   <li>no candidate: dropped with an {@code UNRESOLVED_REFERENCE} diagnostic, unless the
 *       key names a declared parameter, variable or output</li>
 *   <li>several candidates: dropped with an {@code UNRESOLVED_REFERENCE} diagnostic</li>
 * </ul>
 *
 * <p>Self references are dropped silently. A hint endpoint that is a node id is used as
 * it is; otherwise it is read as an id without environment prefix and resolved the same
 * way, preferring the environment of the dependent. A hint naming an unknown or
 * ambiguous resource is dropped with a diagnostic.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    /**
     * Edges and diagnostics of one resolution run.
     *
     * @param edges resolved edges, possibly with duplicate pairs
     * @param diagnostics dropped references
     */
    public record Resolution(List<Edge> edges, List<Diagnostic> diagnostics) {

        public Resolution {
            edges = List.copyOf(edges);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * Resolves all references of the given declarations.
     *
     * @param declarations parsed nodes; an id may repeat, the last declaration of an id
     *                     is the node references resolve to
     * @param hints explicit hints from the parsers
     * @param symbols non-resource names that references may legitimately target
     * @return edges and diagnostics
     */
    public Resolution resolve(Collection<ResourceNode> declarations, Collection<EdgeHint> hints, Set<String> symbols) {
        Objects.requireNonNull(declarations, "declarations must not be null");
        Objects.requireNonNull(hints, "hints must not be null");
        Set<String> knownSymbols = symbols == null ? Set.of() : symbols;

        Map<String, ResourceNode> byId = new LinkedHashMap<>();
        declarations.forEach(node -> byId.put(node.id(), node));
        List<ResourceNode> nodes = byId.values().stream()
            .sorted(Comparator.comparing(ResourceNode::id))
            .toList();
        Map<Dialect, Map<String, List<ResourceNode>>> index = buildIndex(nodes);
        Map<String, List<ResourceNode>> byLogicalId = new HashMap<>();
        for (ResourceNode node : nodes) {
            byLogicalId.computeIfAbsent(logicalId(node), k -> new ArrayList<>()).add(node);
        }

        List<Edge> edges = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        // stable sort keeps redeclarations in merge order
        List<ResourceNode> walked = declarations.stream()
            .sorted(Comparator.comparing(ResourceNode::id))
            .toList();
        for (ResourceNode node : walked) {
            ReferencePatterns.Rules rules = ReferencePatterns.forDialect(node.dialect());
            Set<String> keys = new LinkedHashSet<>();
            walk(node.attributes(), rules, keys);
            for (String key : keys) {
                resolveKey(node, key, index.getOrDefault(node.dialect(), Map.of()), knownSymbols, edges, diagnostics);
            }
        }

        for (EdgeHint hint : hints) {
            resolveHint(hint, byId, byLogicalId, edges, diagnostics);
        }

        log.debug("Resolved {} edges with {} dropped references", edges.size(), diagnostics.size());
        return new Resolution(edges, diagnostics);
    }

    private static void resolveHint(EdgeHint hint, Map<String, ResourceNode> byId,
                                    Map<String, List<ResourceNode>> byLogicalId,
                                    List<Edge> edges, List<Diagnostic> diagnostics) {
        if (hint.from().equals(hint.to())) {
            return;
        }
        List<ResourceNode> dependents = hintCandidates(hint.to(), null, byId, byLogicalId);
        String environment = dependents.size() == 1 ? dependents.get(0).environment() : null;
        List<ResourceNode> dependencies = hintCandidates(hint.from(), environment, byId, byLogicalId);

        if (dependents.isEmpty() || dependencies.isEmpty()) {
            String missing = dependencies.isEmpty() ? hint.from() : hint.to();
            diagnostics.add(Diagnostic.unresolvedReference(hint.to(),
                "Dependency " + hint.from() + " -> " + hint.to() + " names unknown resource " + missing));
            return;
        }
        if (dependents.size() > 1 || dependencies.size() > 1) {
            List<ResourceNode> ambiguous = dependencies.size() > 1 ? dependencies : dependents;
            diagnostics.add(Diagnostic.unresolvedReference(hint.to(),
                "Dependency " + hint.from() + " -> " + hint.to() + " is ambiguous between "
                    + ambiguous.stream().map(ResourceNode::id).toList()));
            return;
        }
        String from = dependencies.get(0).id();
        String to = dependents.get(0).id();
        if (!from.equals(to)) {
            edges.add(Edge.of(from, to, hint.kind()));
        }
    }

    private static List<ResourceNode> hintCandidates(String id, String environment, Map<String, ResourceNode> byId,
                                                     Map<String, List<ResourceNode>> byLogicalId) {
        ResourceNode exact = byId.get(id);
        if (exact != null) {
            return List.of(exact);
        }
        List<ResourceNode> candidates = byLogicalId.getOrDefault(id, List.of());
        List<ResourceNode> scoped = candidates.stream()
            .filter(candidate -> environment != null && environment.equals(candidate.environment()))
            .toList();
        return scoped.isEmpty() ? candidates : scoped;
    }

    /**
     * Id of a node as its parser produced it, before any environment prefix.
     */
    private static String logicalId(ResourceNode node) {
        return ResourceNode.idOf(node.dialect(), node.type(), node.logicalName());
    }

    private static Map<Dialect, Map<String, List<ResourceNode>>> buildIndex(List<ResourceNode> nodes) {
        Map<Dialect, Map<String, List<ResourceNode>>> index = new EnumMap<>(Dialect.class);
        for (ResourceNode node : nodes) {
            String key = ReferencePatterns.forDialect(node.dialect()).indexKey().apply(node);
            index.computeIfAbsent(node.dialect(), d -> new HashMap<>())
                .computeIfAbsent(key, k -> new ArrayList<>())
                .add(node);
        }
        return index;
    }

    private void resolveKey(ResourceNode node, String key, Map<String, List<ResourceNode>> index, Set<String> symbols,
                            List<Edge> edges, List<Diagnostic> diagnostics) {
        List<ResourceNode> candidates = index.getOrDefault(key, List.of());
        if (candidates.isEmpty()) {
            if (symbols.contains(key)) {
                return;
            }
            diagnostics.add(Diagnostic.unresolvedReference(sourceOf(node),
                node.id() + " references unknown resource '" + key + "'"));
            return;
        }

        List<ResourceNode> scoped = candidates.stream()
            .filter(candidate -> Objects.equals(candidate.environment(), node.environment()))
            .toList();
        List<ResourceNode> effective = scoped.isEmpty() ? candidates : scoped;
        if (effective.size() > 1) {
            diagnostics.add(Diagnostic.unresolvedReference(sourceOf(node),
                node.id() + " reference '" + key + "' is ambiguous between "
                    + effective.stream().map(ResourceNode::id).toList()));
            return;
        }

        ResourceNode target = effective.get(0);
        if (target.id().equals(node.id())) {
            return;
        }
        edges.add(Edge.of(target.id(), node.id(), EdgeKind.ATTRIBUTE_REFERENCE));
    }

    private static void walk(Object value, ReferencePatterns.Rules rules, Set<String> keys) {
        rules.extractor().extract(value, keys::add);
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!rules.skippedKeys().contains(String.valueOf(entry.getKey()))) {
                    walk(entry.getValue(), rules, keys);
                }
            }
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                walk(item, rules, keys);
            }
        }
    }

    private static String sourceOf(ResourceNode node) {
        return node.tags().getOrDefault(ResourceNode.TAG_SOURCE_FILE, node.id());
    }
}
