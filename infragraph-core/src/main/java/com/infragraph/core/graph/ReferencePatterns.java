package com.infragraph.core.graph;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.model.UnresolvedReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-dialect reference syntax.
 *
 * <p>Each dialect supplies an extractor, the attribute keys whose values are ordering
 * directives (already turned into explicit hints by the parser) and the lookup key a
 * node is indexed under:
 *
 * <table>
 *   <tr><th>Dialect</th><th>Reference forms</th><th>Lookup key</th></tr>
 *   <tr><td>Terraform</td><td>{@code aws_vpc.main.id}, {@code "${aws_vpc.main.id}"}</td><td>{@code type.name}</td></tr>
 *   <tr><td>CloudFormation</td><td>{@code Ref}, {@code Fn::GetAtt}, {@code ${X}} in {@code Fn::Sub}</td><td>logical id</td></tr>
 *   <tr><td>Bicep</td><td>{@code vnet.id}, {@code vnet}, {@code '${vnet.name}'}, {@code vnet::app.id}</td><td>symbol</td></tr>
 *   <tr><td>Pulumi YAML</td><td>{@code ${bucket.id}}, {@code ${bucket}}</td><td>resource name</td></tr>
 * </table>
 */
public final class ReferencePatterns {

    // --- Regex Patterns ---
    private static final Pattern TERRAFORM_TRAVERSAL =
        Pattern.compile("(?<![\\w.-])([a-zA-Z][a-zA-Z0-9_-]*)\\.([a-zA-Z_][a-zA-Z0-9_-]*)");
    private static final Pattern CFN_SUB_VARIABLE =
        Pattern.compile("\\$\\{([A-Za-z0-9]+)(?:\\.[^}]+)?}");
    private static final Pattern BICEP_NESTED_ACCESSOR =
        Pattern.compile("(?<![\\w.$:@])[A-Za-z_][A-Za-z0-9_]*(?:::([A-Za-z_][A-Za-z0-9_]*))+");
    private static final Pattern BICEP_IDENTIFIER =
        Pattern.compile("(?<![\\w.$:@])([A-Za-z_][A-Za-z0-9_]*)(?!\\s*\\()(?![\\w(])");
    private static final Pattern PULUMI_INTERPOLATION =
        Pattern.compile("(?<!\\$)\\$\\{\\s*([A-Za-z0-9_-]+)");

    /** Traversal roots that never name a managed Terraform resource. */
    private static final Set<String> TERRAFORM_NON_RESOURCE_ROOTS = Set.of(
        "data", "var", "local", "module", "each", "count", "path", "terraform", "self");

    private static final Set<String> BICEP_KEYWORDS = Set.of(
        "true", "false", "null", "if", "for", "in", "existing", "resource", "param", "var", "output", "module");

    private static final Set<String> PULUMI_BUILTINS = Set.of("pulumi");

    private static final Map<Dialect, Rules> RULES = buildRules();

    private ReferencePatterns() {
        // Prevent instantiation
    }

    /**
     * Reference rules of one dialect.
     *
     * @param extractor finds lookup keys in attribute values
     * @param skippedKeys attribute keys whose subtrees are not scanned
     * @param indexKey lookup key of a node
     */
    public record Rules(
        ReferenceExtractor extractor,
        Set<String> skippedKeys,
        Function<ResourceNode, String> indexKey
    ) {
    }

    /**
     * Returns the rules of a dialect.
     *
     * @param dialect dialect
     * @return reference rules
     */
    public static Rules forDialect(Dialect dialect) {
        return RULES.get(dialect);
    }

    private static Map<Dialect, Rules> buildRules() {
        Map<Dialect, Rules> rules = new EnumMap<>(Dialect.class);
        rules.put(Dialect.TERRAFORM, new Rules(
            ReferencePatterns::terraform,
            Set.of("depends_on"),
            node -> node.type() + "." + node.logicalName()));
        rules.put(Dialect.CLOUDFORMATION, new Rules(
            ReferencePatterns::cloudFormation,
            Set.of("DependsOn"),
            ResourceNode::logicalName));
        rules.put(Dialect.BICEP, new Rules(
            ReferencePatterns::bicep,
            Set.of("dependsOn", "parent"),
            ResourceNode::logicalName));
        rules.put(Dialect.PULUMI_YAML, new Rules(
            ReferencePatterns::pulumi,
            Set.of("dependsOn"),
            ResourceNode::logicalName));
        return Collections.unmodifiableMap(rules);
    }

    // ==================== Terraform ====================

    private static void terraform(Object value, Consumer<String> sink) {
        if (value instanceof UnresolvedReference reference) {
            terraformTraversals(codeOnly(reference.expression(), '"'), sink);
        } else if (value instanceof String text) {
            for (String interpolation : interpolations(text)) {
                terraformTraversals(interpolation, sink);
            }
        }
    }

    private static void terraformTraversals(String code, Consumer<String> sink) {
        Matcher matcher = TERRAFORM_TRAVERSAL.matcher(code);
        while (matcher.find()) {
            String type = matcher.group(1);
            // managed resource types are always <provider>_<kind>
            if (!TERRAFORM_NON_RESOURCE_ROOTS.contains(type) && type.contains("_")) {
                sink.accept(type + "." + matcher.group(2));
            }
        }
    }

    // ==================== CloudFormation ====================

    private static void cloudFormation(Object value, Consumer<String> sink) {
        if (!(value instanceof Map<?, ?> map) || map.size() != 1) {
            return;
        }
        Map.Entry<?, ?> entry = map.entrySet().iterator().next();
        String function = String.valueOf(entry.getKey());
        Object argument = entry.getValue();
        switch (function) {
            case "Ref" -> {
                if (argument instanceof String name && !name.contains("::")) {
                    sink.accept(name);
                }
            }
            case "Fn::GetAtt" -> {
                if (argument instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof String name) {
                    sink.accept(name);
                } else if (argument instanceof String dotted && dotted.indexOf('.') > 0) {
                    sink.accept(dotted.substring(0, dotted.indexOf('.')));
                }
            }
            case "Fn::Sub" -> cloudFormationSub(argument, sink);
            default -> {
                // other intrinsics carry nested Ref/GetAtt maps, reached by the tree walk
            }
        }
    }

    private static void cloudFormationSub(Object argument, Consumer<String> sink) {
        String template = null;
        Set<String> localVariables = new HashSet<>();
        if (argument instanceof String text) {
            template = text;
        } else if (argument instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof String text) {
            template = text;
            if (list.size() > 1 && list.get(1) instanceof Map<?, ?> variables) {
                variables.keySet().forEach(key -> localVariables.add(String.valueOf(key)));
            }
        }
        if (template == null) {
            return;
        }
        Matcher matcher = CFN_SUB_VARIABLE.matcher(template);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!localVariables.contains(name)) {
                sink.accept(name);
            }
        }
    }

    // ==================== Bicep ====================

    private static void bicep(Object value, Consumer<String> sink) {
        if (value instanceof UnresolvedReference reference) {
            bicepIdentifiers(codeOnly(reference.expression(), '\''), sink);
        } else if (value instanceof String text) {
            for (String interpolation : interpolations(text)) {
                bicepIdentifiers(codeOnly(interpolation, '\''), sink);
            }
        }
    }

    private static void bicepIdentifiers(String code, Consumer<String> sink) {
        StringBuilder rest = new StringBuilder(code);
        Matcher nested = BICEP_NESTED_ACCESSOR.matcher(code);
        while (nested.find()) {
            // parent::child names the innermost child declaration
            sink.accept(nested.group(1));
            for (int i = nested.start(); i < nested.end(); i++) {
                rest.setCharAt(i, ' ');
            }
        }
        String remaining = rest.toString();
        Matcher matcher = BICEP_IDENTIFIER.matcher(remaining);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!BICEP_KEYWORDS.contains(name) && !isObjectKey(remaining, matcher.end())) {
                sink.accept(name);
            }
        }
    }

    private static boolean isObjectKey(String code, int end) {
        int i = end;
        while (i < code.length() && code.charAt(i) == ' ') {
            i++;
        }
        return i < code.length() && code.charAt(i) == ':' && (i + 1 >= code.length() || code.charAt(i + 1) != ':');
    }

    // ==================== Pulumi ====================

    private static void pulumi(Object value, Consumer<String> sink) {
        if (!(value instanceof String text)) {
            return;
        }
        Matcher matcher = PULUMI_INTERPOLATION.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!PULUMI_BUILTINS.contains(name)) {
                sink.accept(name);
            }
        }
    }

    // ==================== Text Helpers ====================

    /**
     * Returns the contents of every {@code ${...}} sequence in a string, honouring nested
     * braces. {@code $${} is a literal escape and is skipped.
     *
     * @param text string value
     * @return interpolation bodies in order
     */
    static List<String> interpolations(String text) {
        List<String> bodies = new ArrayList<>();
        int i = 0;
        while (i < text.length() - 1) {
            if (text.charAt(i) == '$' && text.charAt(i + 1) == '{' && (i == 0 || text.charAt(i - 1) != '$')) {
                int depth = 1;
                int j = i + 2;
                while (j < text.length() && depth > 0) {
                    char c = text.charAt(j);
                    if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                    }
                    j++;
                }
                int end = depth == 0 ? j - 1 : text.length();
                bodies.add(text.substring(i + 2, end));
                i = j;
            } else {
                i++;
            }
        }
        return bodies;
    }

    /**
     * Blanks out string literals delimited by {@code quote}, keeping the contents of
     * their interpolations.
     *
     * @param expression expression source
     * @param quote string delimiter of the dialect
     * @return code with literal text replaced by spaces
     */
    static String codeOnly(String expression, char quote) {
        StringBuilder code = new StringBuilder(expression.length());
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c != quote) {
                code.append(c);
                i++;
                continue;
            }
            int close = i + 1;
            while (close < expression.length() && expression.charAt(close) != quote) {
                if (expression.charAt(close) == '\\') {
                    close++;
                } else if (expression.startsWith("${", close)) {
                    int depth = 1;
                    close += 2;
                    while (close < expression.length() && depth > 0) {
                        char inner = expression.charAt(close);
                        if (inner == '{') {
                            depth++;
                        } else if (inner == '}') {
                            depth--;
                        }
                        if (depth > 0) {
                            close++;
                        }
                    }
                }
                close++;
            }
            String literal = expression.substring(i, Math.min(close + 1, expression.length()));
            code.append(' ');
            for (String interpolation : interpolations(literal)) {
                code.append(interpolation).append(' ');
            }
            i = close + 1;
        }
        return code.toString();
    }
}
