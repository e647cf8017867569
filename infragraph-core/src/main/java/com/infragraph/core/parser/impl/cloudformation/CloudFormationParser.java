package com.infragraph.core.parser.impl.cloudformation;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.IacParseException;
import com.infragraph.core.parser.base.AbstractYamlParser;
import com.infragraph.core.parser.impl.cloudformation.util.IntrinsicFunctionConstructor;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Parser for AWS CloudFormation templates in YAML or JSON.
 *
 * <p>Entries of the {@code Resources} map become nodes; {@code Properties} is kept as
 * the attribute tree. Short-form intrinsic tags ({@code !Ref}, {@code !GetAtt},
 * {@code !Sub}, ...) are expanded by {@link IntrinsicFunctionConstructor} so YAML and
 * JSON templates produce identical trees.
 *
 * <pre>{@code
 * Resources:
 *   Bucket:
 *     Type: AWS::S3::Bucket
 *   Policy:
 *     Type: AWS::S3::BucketPolicy
 *     DependsOn: Bucket
 *     Properties:
 *       Bucket: !Ref Bucket
 * }</pre>
 *
 * <p>{@code DependsOn} (string or list) becomes explicit hints; a {@code Tags} list of
 * {@code Key}/{@code Value} pairs populates node tags. Parameter names are reported as
 * symbols so references to them are not treated as dangling.
 */
public class CloudFormationParser extends AbstractYamlParser {

    // --- Magic Strings ---
    private static final String PARSER_ID = "cloudformation";
    private static final String PARSER_DISPLAY_NAME = "AWS CloudFormation Parser";
    private static final String RESOURCES = "Resources";
    private static final String PARAMETERS = "Parameters";
    private static final String TYPE = "Type";
    private static final String PROPERTIES = "Properties";
    private static final String DEPENDS_ON = "DependsOn";
    private static final String TAGS = "Tags";
    private static final String NAME_TAG = "Name";

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
        return Dialect.CLOUDFORMATION;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("*.cfn.yaml", "*.cfn.yml", "*.cfn.json", "template.yaml", "template.yml", "template.json");
    }

    @Override
    protected Yaml createYaml() {
        return new Yaml(new IntrinsicFunctionConstructor(new LoaderOptions()));
    }

    @Override
    protected void parseDocument(IacDocument document, ParseAccumulator accumulator) throws IacParseException {
        String text = document.text();
        Object root = text.stripLeading().startsWith("{") ? loadJson(text) : loadYaml(text);
        Map<String, Object> template = asMap(root);
        if (template == null) {
            throw new IacParseException("Template root is not a mapping", 0);
        }

        Map<String, Object> parameters = asMap(template.get(PARAMETERS));
        if (parameters != null) {
            parameters.keySet().forEach(accumulator::addSymbol);
        }

        Map<String, Object> resources = asMap(template.get(RESOURCES));
        if (resources == null) {
            log.debug("No Resources section in {}", document.path());
            return;
        }

        Map<String, String> typesByName = new LinkedHashMap<>();
        resources.forEach((name, body) -> {
            Map<String, Object> resource = asMap(body);
            String type = resource != null ? asText(resource.get(TYPE)) : null;
            if (type != null) {
                typesByName.put(name, type);
            }
        });

        for (Map.Entry<String, Object> entry : resources.entrySet()) {
            String name = entry.getKey();
            String type = typesByName.get(name);
            if (type == null) {
                accumulator.error(-1, "Resource " + name + " has no Type");
                accumulator.skip();
                continue;
            }
            extractResource(name, type, asMap(entry.getValue()), typesByName, accumulator);
        }
    }

    private void extractResource(String name, String type, Map<String, Object> resource,
                                 Map<String, String> typesByName, ParseAccumulator accumulator) {
        Map<String, Object> properties = asMap(resource.get(PROPERTIES));
        if (properties == null) {
            properties = Map.of();
        }
        Map<String, String> tags = readTags(properties.get(TAGS));
        String id = accumulator.addResource(type, name, tags.get(NAME_TAG), properties, tags);

        for (String dependency : stringOrList(resource.get(DEPENDS_ON))) {
            String dependencyType = typesByName.get(dependency);
            if (dependencyType == null) {
                accumulator.unresolved(id + " depends on unknown resource " + dependency);
                continue;
            }
            accumulator.addHint(ResourceNode.idOf(Dialect.CLOUDFORMATION, dependencyType, dependency), id,
                EdgeKind.EXPLICIT_DEPENDENCY);
        }
    }
}
