package com.infragraph.core.parser.impl.cloudformation.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SnakeYAML constructor that expands CloudFormation short-form intrinsic tags.
 *
 * <p>Each tag becomes the long-form map CloudFormation uses in JSON templates, so the
 * rest of the pipeline sees one representation:
 *
 * <pre>{@code
 * !Ref Vpc                 ->  {Ref: Vpc}
 * !GetAtt Vpc.CidrBlock    ->  {Fn::GetAtt: [Vpc, CidrBlock]}
 * !Sub "${Bucket}-logs"    ->  {Fn::Sub: "${Bucket}-logs"}
 * !Condition IsProd        ->  {Condition: IsProd}
 * }</pre>
 *
 * <p>Instances are not thread-safe; create one per document.
 */
public class IntrinsicFunctionConstructor extends SafeConstructor {

    /** Short-form tags expanded to {@code Fn::<Name>}. */
    public static final List<String> FUNCTION_TAGS = List.of(
        "GetAtt", "Join", "Sub", "Select", "Split", "GetAZs", "Base64", "ImportValue",
        "FindInMap", "Cidr", "Transform", "If", "Equals", "Not", "And", "Or");

    public IntrinsicFunctionConstructor(LoaderOptions options) {
        super(options);
        yamlConstructors.put(new Tag("!Ref"), new ConstructIntrinsic("Ref", false));
        yamlConstructors.put(new Tag("!Condition"), new ConstructIntrinsic("Condition", false));
        for (String function : FUNCTION_TAGS) {
            yamlConstructors.put(new Tag("!" + function), new ConstructIntrinsic("Fn::" + function, "GetAtt".equals(function)));
        }
    }

    private class ConstructIntrinsic extends AbstractConstruct {

        private final String key;
        private final boolean splitDotted;

        ConstructIntrinsic(String key, boolean splitDotted) {
            this.key = key;
            this.splitDotted = splitDotted;
        }

        @Override
        public Object construct(Node node) {
            Object value;
            if (node instanceof ScalarNode scalar) {
                String text = constructScalar(scalar);
                value = splitDotted ? splitAttribute(text) : text;
            } else if (node instanceof SequenceNode sequence) {
                value = constructSequence(sequence);
            } else {
                value = constructMapping((MappingNode) node);
            }
            Map<String, Object> intrinsic = new LinkedHashMap<>();
            intrinsic.put(key, value);
            return intrinsic;
        }

        private Object splitAttribute(String text) {
            int dot = text.indexOf('.');
            if (dot <= 0) {
                return text;
            }
            List<Object> parts = new ArrayList<>();
            parts.add(text.substring(0, dot));
            parts.add(text.substring(dot + 1));
            return parts;
        }
    }
}
