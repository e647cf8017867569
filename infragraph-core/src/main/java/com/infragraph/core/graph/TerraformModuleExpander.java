package com.infragraph.core.graph;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.model.UnresolvedReference;
import com.infragraph.core.parser.ModuleCall;
import com.infragraph.core.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Expands calls of local Terraform modules into one set of nodes per instance.
 *
 * <p>A {@code module "network" { source = "./modules/network" }} block whose source is
 * a relative path is resolved against the directory of the calling document. The
 * {@code .tf} and {@code .hcl} documents of the run that live in that directory are the
 * module members. For each call:
 * <ul>
 *   <li>every member resource is copied with the logical name
 *       {@code module_<name>__<logical-name>} and tagged with the module path</li>
 *   <li>references between member resources are rewritten to the copied names, so two
 *       instances of one module stay apart</li>
 *   <li>{@code module.<name>.<output>} references in the caller become
 *       {@link EdgeKind#ATTRIBUTE_REFERENCE} hints from the resources the output value
 *       refers to</li>
 *   <li>the copies are added to the calling document, so they share its environment</li>
 * </ul>
 * Modules calling modules are expanded with composed prefixes. Member documents that
 * were expanded at least once keep their diagnostics and symbols but no longer
 * contribute nodes of their own. Registry and remote sources are left alone.
 */
public class TerraformModuleExpander {

    private static final Logger log = LoggerFactory.getLogger(TerraformModuleExpander.class);

    // --- Magic Strings ---
    static final String MODULE_PREFIX = "module_";
    static final String INSTANCE_SEPARATOR = "__";
    private static final List<String> MODULE_FILE_SUFFIXES = List.of(".tf", ".hcl");

    private static final Pattern MODULE_OUTPUT =
        Pattern.compile("(?<![\\w.-])module\\.([A-Za-z_][A-Za-z0-9_-]*)\\.([A-Za-z_][A-Za-z0-9_-]*)");

    /**
     * Nodes and hints of one expanded module instance.
     *
     * @param nodes copied member resources, nested instances included
     * @param hints copied hints plus module output hints
     * @param outputs node ids each output value refers to
     * @param members sources of the expanded member documents
     */
    private record Instance(
        List<ResourceNode> nodes,
        List<EdgeHint> hints,
        Map<String, Set<String>> outputs,
        Set<String> members
    ) {
    }

    /**
     * Expands the module calls of a run.
     *
     * @param results parse results of all documents
     * @return results with module instances added to their callers, in input order
     */
    public List<ParseResult> expand(List<ParseResult> results) {
        Map<String, List<ParseResult>> byDirectory = new LinkedHashMap<>();
        for (ParseResult result : results) {
            if (isModuleFile(result.source())) {
                directoryOf(result.source()).ifPresent(directory ->
                    byDirectory.computeIfAbsent(directory, d -> new ArrayList<>()).add(result));
            }
        }

        Set<String> calledDirectories = new HashSet<>();
        for (ParseResult result : results) {
            for (ModuleCall call : result.moduleCalls()) {
                moduleDirectory(result.source(), call).ifPresent(calledDirectories::add);
            }
        }
        if (calledDirectories.isEmpty()) {
            return results;
        }

        Set<String> expandedMembers = new HashSet<>();
        List<ParseResult> expanded = new ArrayList<>(results.size());
        for (ParseResult result : results) {
            boolean root = directoryOf(result.source()).map(d -> !calledDirectories.contains(d)).orElse(true);
            if (!root || result.moduleCalls().isEmpty()) {
                expanded.add(result);
                continue;
            }
            expanded.add(expandRoot(result, byDirectory, expandedMembers));
        }

        List<ParseResult> trimmed = new ArrayList<>(expanded.size());
        for (ParseResult result : expanded) {
            trimmed.add(expandedMembers.contains(result.source()) ? withoutResources(result) : result);
        }
        log.debug("Expanded local modules, {} member documents folded into their callers", expandedMembers.size());
        return trimmed;
    }

    private ParseResult expandRoot(ParseResult root, Map<String, List<ParseResult>> byDirectory,
                                   Set<String> expandedMembers) {
        List<ResourceNode> nodes = new ArrayList<>(root.nodes());
        List<EdgeHint> hints = new ArrayList<>(root.edgeHints());
        Map<String, Instance> instances = new LinkedHashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        directoryOf(root.source()).ifPresent(stack::push);

        for (ModuleCall call : root.moduleCalls()) {
            instantiate(root.source(), call, "", "", byDirectory, stack).ifPresent(instance -> {
                instances.put(call.name(), instance);
                nodes.addAll(instance.nodes());
                hints.addAll(instance.hints());
                expandedMembers.addAll(instance.members());
            });
        }
        for (ResourceNode node : root.nodes()) {
            hints.addAll(outputHints(node.attributes(), node.id(), instances));
        }
        return new ParseResult(root.parserId(), root.source(), nodes, hints, root.symbols(), root.diagnostics(),
            root.statistics(), root.moduleCalls(), root.outputs());
    }

    private Optional<Instance> instantiate(String callerSource, ModuleCall call, String parentPrefix,
                                           String parentPath, Map<String, List<ParseResult>> byDirectory,
                                           Deque<String> stack) {
        Optional<String> directory = moduleDirectory(callerSource, call);
        if (directory.isEmpty()) {
            log.debug("Module {} in {} has non-local source {}, not expanded", call.name(), callerSource,
                call.source());
            return Optional.empty();
        }
        List<ParseResult> members = byDirectory.get(directory.get());
        if (members == null) {
            log.debug("Module {} in {}: no documents found in {}", call.name(), callerSource, directory.get());
            return Optional.empty();
        }
        if (stack.contains(directory.get())) {
            log.warn("Module {} in {} calls {} recursively, not expanded", call.name(), callerSource,
                directory.get());
            return Optional.empty();
        }

        String prefix = parentPrefix + MODULE_PREFIX + call.name() + INSTANCE_SEPARATOR;
        String path = parentPath.isEmpty() ? call.name() : parentPath + "." + call.name();
        Map<String, String> renamedKeys = new LinkedHashMap<>();
        Map<String, String> renamedIds = new LinkedHashMap<>();
        Map<String, String> idsByKey = new LinkedHashMap<>();
        for (ParseResult member : members) {
            for (ResourceNode node : member.nodes()) {
                String renamed = prefix + node.logicalName();
                String newId = ResourceNode.idOf(node.dialect(), node.type(), renamed);
                renamedKeys.put(node.type() + "." + node.logicalName(), node.type() + "." + renamed);
                renamedIds.put(node.id(), newId);
                idsByKey.put(node.type() + "." + node.logicalName(), newId);
            }
        }
        KeyRewriter rewriter = new KeyRewriter(renamedKeys);

        List<ResourceNode> nodes = new ArrayList<>();
        List<EdgeHint> hints = new ArrayList<>();
        Set<String> expandedMembers = new LinkedHashSet<>();
        Map<String, Instance> nested = new LinkedHashMap<>();

        stack.push(directory.get());
        for (ParseResult member : members) {
            for (ModuleCall inner : member.moduleCalls()) {
                instantiate(member.source(), inner, prefix, path, byDirectory, stack).ifPresent(instance -> {
                    nested.put(inner.name(), instance);
                    nodes.addAll(instance.nodes());
                    hints.addAll(instance.hints());
                    expandedMembers.addAll(instance.members());
                });
            }
        }
        stack.pop();

        for (ParseResult member : members) {
            expandedMembers.add(member.source());
            for (ResourceNode node : member.nodes()) {
                String newId = renamedIds.get(node.id());
                Map<String, String> tags = new LinkedHashMap<>(node.tags());
                tags.put(ResourceNode.TAG_MODULE, path);
                String displayName = node.displayName().equals(node.logicalName()) ? null : node.displayName();
                @SuppressWarnings("unchecked")
                Map<String, Object> attributes = (Map<String, Object>) rewriter.rewrite(node.attributes());
                nodes.add(new ResourceNode(newId, node.type(), node.provider(), displayName,
                    prefix + node.logicalName(), node.dialect(), attributes, tags));
                hints.addAll(outputHints(node.attributes(), newId, nested));
            }
            for (EdgeHint hint : member.edgeHints()) {
                hints.add(new EdgeHint(renamedIds.getOrDefault(hint.from(), hint.from()),
                    renamedIds.getOrDefault(hint.to(), hint.to()), hint.kind()));
            }
        }

        Map<String, Set<String>> outputs = new LinkedHashMap<>();
        for (ParseResult member : members) {
            member.outputs().forEach((name, value) -> outputs.put(name, outputTargets(value, idsByKey, nested)));
        }
        log.debug("Expanded module {} from {} into {} resources", path, directory.get(), nodes.size());
        return Optional.of(new Instance(nodes, hints, outputs, expandedMembers));
    }

    /**
     * Node ids an output value refers to, following outputs of nested instances.
     */
    private static Set<String> outputTargets(Object value, Map<String, String> idsByKey,
                                             Map<String, Instance> nested) {
        Set<String> targets = new LinkedHashSet<>();
        Set<String> keys = new LinkedHashSet<>();
        collectKeys(value, keys);
        for (String key : keys) {
            String id = idsByKey.get(key);
            if (id != null) {
                targets.add(id);
            }
        }
        for (String[] output : moduleOutputs(value)) {
            Instance instance = nested.get(output[0]);
            if (instance != null) {
                targets.addAll(instance.outputs().getOrDefault(output[1], Set.of()));
            }
        }
        return targets;
    }

    private static List<EdgeHint> outputHints(Map<String, Object> attributes, String dependentId,
                                              Map<String, Instance> instances) {
        List<EdgeHint> hints = new ArrayList<>();
        if (instances.isEmpty()) {
            return hints;
        }
        for (String[] output : moduleOutputs(attributes)) {
            Instance instance = instances.get(output[0]);
            if (instance == null) {
                continue;
            }
            for (String target : instance.outputs().getOrDefault(output[1], Set.of())) {
                hints.add(new EdgeHint(target, dependentId, EdgeKind.ATTRIBUTE_REFERENCE));
            }
        }
        return hints;
    }

    /**
     * Returns {@code {module, output}} pairs of every {@code module.<name>.<output>}
     * reference in a value tree.
     */
    private static List<String[]> moduleOutputs(Object value) {
        List<String[]> outputs = new ArrayList<>();
        forEachExpression(value, code -> {
            Matcher matcher = MODULE_OUTPUT.matcher(code);
            while (matcher.find()) {
                outputs.add(new String[] {matcher.group(1), matcher.group(2)});
            }
        });
        return outputs;
    }

    private static void collectKeys(Object value, Set<String> keys) {
        ReferenceExtractor extractor = ReferencePatterns.forDialect(Dialect.TERRAFORM).extractor();
        walk(value, item -> extractor.extract(item, keys::add));
    }

    private static void forEachExpression(Object value, Consumer<String> code) {
        walk(value, item -> {
            if (item instanceof UnresolvedReference reference) {
                code.accept(ReferencePatterns.codeOnly(reference.expression(), '"'));
            } else if (item instanceof String text) {
                ReferencePatterns.interpolations(text).forEach(code);
            }
        });
    }

    private static void walk(Object value, Consumer<Object> visitor) {
        visitor.accept(value);
        if (value instanceof Map<?, ?> map) {
            map.values().forEach(item -> walk(item, visitor));
        } else if (value instanceof List<?> list) {
            list.forEach(item -> walk(item, visitor));
        }
    }

    private static ParseResult withoutResources(ParseResult member) {
        return new ParseResult(member.parserId(), member.source(), List.of(), List.of(), member.symbols(),
            member.diagnostics(), member.statistics(), List.of(), member.outputs());
    }

    // ==================== Paths ====================

    private static boolean isModuleFile(String source) {
        return MODULE_FILE_SUFFIXES.stream().anyMatch(source::endsWith);
    }

    private static Optional<String> directoryOf(String source) {
        try {
            Path parent = Path.of(source.replace('\\', '/')).getParent();
            return Optional.of(parent == null ? "" : parent.normalize().toString());
        } catch (InvalidPathException e) {
            log.debug("Cannot use {} as a path: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> moduleDirectory(String callerSource, ModuleCall call) {
        if (!call.isLocal()) {
            return Optional.empty();
        }
        return directoryOf(callerSource).map(directory -> {
            Path base = Path.of(directory);
            return base.resolve(call.source().replace('\\', '/')).normalize().toString();
        });
    }

    /**
     * Rewrites {@code type.name} keys of module members inside expressions and
     * interpolated strings.
     */
    private static final class KeyRewriter {

        private final Map<String, String> renamed;
        private final Pattern keys;

        KeyRewriter(Map<String, String> renamed) {
            this.renamed = renamed;
            this.keys = renamed.isEmpty()
                ? null
                : Pattern.compile("(?<![\\w.-])(" + renamed.keySet().stream()
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|")) + ")(?![\\w-])");
        }

        Object rewrite(Object value) {
            if (keys == null) {
                return value;
            }
            if (value instanceof UnresolvedReference reference) {
                return new UnresolvedReference(replace(reference.expression()));
            }
            if (value instanceof String text && text.contains("${")) {
                return replace(text);
            }
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((key, item) -> copy.put(String.valueOf(key), rewrite(item)));
                return copy;
            }
            if (value instanceof List<?> list) {
                List<Object> copy = new ArrayList<>(list.size());
                list.forEach(item -> copy.add(rewrite(item)));
                return copy;
            }
            return value;
        }

        private String replace(String text) {
            Matcher matcher = keys.matcher(text);
            StringBuilder out = new StringBuilder();
            while (matcher.find()) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(renamed.get(matcher.group(1))));
            }
            matcher.appendTail(out);
            return out.toString();
        }
    }
}
