package com.infragraph.core.parser.impl.pulumi;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.IacParseException;
import com.infragraph.core.parser.base.AbstractYamlParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Pulumi YAML programs ({@code Pulumi.yaml}).
 *
 * <pre>{@code
 * resources:
 *   bucket:
 *     type: aws:s3:Bucket
 *   policy:
 *     type: aws:s3:BucketPolicy
 *     properties:
 *       bucket: ${bucket.id}
 *     options:
 *       dependsOn:
 *         - ${bucket}
 * }</pre>
 *
 * <p>{@code properties} is kept as the attribute tree. {@code options.dependsOn} entries
 * become explicit hints and {@code options.parent} an implicit-ordering hint. Names under
 * {@code config} and {@code variables} are reported as symbols.
 */
public class PulumiYamlParser extends AbstractYamlParser {

    // --- Regex Patterns ---
    private static final Pattern INTERPOLATED_NAME = Pattern.compile("^\\$\\{\\s*([A-Za-z0-9_-]+)");

    // --- Magic Strings ---
    private static final String PARSER_ID = "pulumi-yaml";
    private static final String PARSER_DISPLAY_NAME = "Pulumi YAML Parser";
    private static final String RESOURCES = "resources";
    private static final String TYPE = "type";
    private static final String NAME = "name";
    private static final String PROPERTIES = "properties";
    private static final String OPTIONS = "options";
    private static final String DEPENDS_ON = "dependsOn";
    private static final String PARENT = "parent";
    private static final String TAGS = "tags";
    private static final List<String> SYMBOL_SECTIONS = List.of("config", "variables", "configuration");

    @Override
    public String getId() {
        return PARSER_ID;
    }

    @Override
    public String getDisplayName() {
        return PARSER_DISPLAY_NAME;
    }

    @Override
    public Dialect getDialect() {
        return Dialect.PULUMI_YAML;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("Pulumi.yaml", "Pulumi.yml", "*.pulumi.yaml", "*.pulumi.yml");
    }

    @Override
    protected void parseDocument(IacDocument document, ParseAccumulator accumulator) throws IacParseException {
        Map<String, Object> program = asMap(loadYaml(document.text()));
        if (program == null) {
            throw new IacParseException("Pulumi program root is not a mapping", 0);
        }

        for (String section : SYMBOL_SECTIONS) {
            Map<String, Object> entries = asMap(program.get(section));
            if (entries != null) {
                entries.keySet().forEach(accumulator::addSymbol);
            }
        }

        Map<String, Object> resources = asMap(program.get(RESOURCES));
        if (resources == null) {
            log.debug("No resources section in {}", document.path());
            return;
        }

        Map<String, String> idsByName = new LinkedHashMap<>();
        resources.forEach((name, body) -> {
            Map<String, Object> resource = asMap(body);
            String type = resource != null ? asText(resource.get(TYPE)) : null;
            if (type != null) {
                idsByName.put(name, ResourceNode.idOf(Dialect.PULUMI_YAML, type, name));
            }
        });

        for (Map.Entry<String, Object> entry : resources.entrySet()) {
            String name = entry.getKey();
            Map<String, Object> resource = asMap(entry.getValue());
            if (!idsByName.containsKey(name) || resource == null) {
                accumulator.error(-1, "Resource " + name + " has no type");
                accumulator.skip();
                continue;
            }
            extractResource(name, resource, idsByName, accumulator);
        }
    }

    private void extractResource(String name, Map<String, Object> resource, Map<String, String> idsByName,
                                 ParseAccumulator accumulator) {
        String type = asText(resource.get(TYPE));
        Map<String, Object> properties = asMap(resource.get(PROPERTIES));
        if (properties == null) {
            properties = Map.of();
        }
        Map<String, String> tags = readTags(properties.get(TAGS));
        String displayName = asText(resource.get(NAME));
        String id = accumulator.addResource(type, name, displayName, properties, tags);

        Map<String, Object> options = asMap(resource.get(OPTIONS));
        if (options == null) {
            return;
        }
        for (String dependency : referencedNames(options.get(DEPENDS_ON))) {
            hint(dependency, id, EdgeKind.EXPLICIT_DEPENDENCY, idsByName, accumulator);
        }
        for (String parent : referencedNames(options.get(PARENT))) {
            hint(parent, id, EdgeKind.IMPLICIT_ORDERING, idsByName, accumulator);
        }
    }

    private void hint(String name, String dependentId, EdgeKind kind, Map<String, String> idsByName,
                      ParseAccumulator accumulator) {
        String targetId = idsByName.get(name);
        if (targetId == null) {
            accumulator.unresolved(dependentId + " depends on unknown resource " + name);
            return;
        }
        accumulator.addHint(targetId, dependentId, kind);
    }

    private static List<String> referencedNames(Object value) {
        List<String> names = new ArrayList<>();
        for (String expression : stringOrList(value)) {
            Matcher matcher = INTERPOLATED_NAME.matcher(expression.strip());
            if (matcher.find()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }
}
