package com.infragraph.core.parser.impl.terraform;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.model.UnresolvedReference;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.base.AbstractParser;
import com.infragraph.core.parser.base.SyntaxErrorCollector.SyntaxError;
import com.infragraph.core.parser.impl.terraform.util.HclDocumentReader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for Terraform configuration files.
 *
 * <p>Uses the ANTLR-based {@link HclDocumentReader} to read every top-level block and
 * emits one resource per {@code resource} block:
 *
 * <pre>{@code
 * resource "aws_subnet" "public_a" {
 *   vpc_id     = aws_vpc.main.id
 *   cidr_block = "10.0.1.0/24"
 *   depends_on = [aws_internet_gateway.gw]
 *   tags = {
 *     Name = "public-a"
 *   }
 * }
 * }</pre>
 *
 * <p><b>Extraction rules</b></p>
 * <ul>
 *   <li>{@code depends_on} entries of the form {@code <type>.<name>} become explicit hints</li>
 *   <li>{@code tags} / {@code labels} object attributes populate node tags; a
 *       {@code Name} tag becomes the display name</li>
 *   <li>{@code null_*} resources are skipped</li>
 *   <li>{@code module} blocks are reported as module calls with their {@code source};
 *       local modules are expanded later in the pipeline</li>
 *   <li>{@code output} blocks are reported with their {@code value} so references to a
 *       module output can be followed into the module instance</li>
 *   <li>{@code data}, {@code variable}, {@code locals}, {@code provider} and
 *       {@code terraform} blocks are parsed but not emitted</li>
 * </ul>
 *
 * <p>A malformed block yields one parse error and is skipped; the blocks around it are
 * still extracted.
 *
 * @see HclDocumentReader
 */
public class TerraformParser extends AbstractParser {

    // --- Magic Strings ---
    private static final String PARSER_ID = "terraform";
    private static final String PARSER_DISPLAY_NAME = "Terraform HCL Parser";
    private static final String RESOURCE_BLOCK = "resource";
    private static final String MODULE_BLOCK = "module";
    private static final String OUTPUT_BLOCK = "output";
    private static final String SOURCE = "source";
    private static final String VALUE = "value";
    private static final String DEPENDS_ON = "depends_on";
    private static final String NULL_TYPE_PREFIX = "null_";
    private static final String NAME_TAG = "Name";
    private static final List<String> TAG_ATTRIBUTES = List.of("tags", "labels");
    private static final Set<String> SYMBOL_BLOCKS = Set.of("variable", "module");

    /** Traversal roots that never name a managed resource. */
    private static final Set<String> NON_RESOURCE_ROOTS = Set.of(
        "data", "module", "var", "local", "each", "count", "path", "terraform", "self");

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
        return Dialect.TERRAFORM;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("*.tf", "*.hcl");
    }

    @Override
    protected void parseDocument(IacDocument document, ParseAccumulator accumulator) {
        String text = document.text();
        HclDocumentReader.Result parsed = HclDocumentReader.read(text);

        for (SyntaxError error : parsed.errors()) {
            log.debug("Syntax error in {} at char {}: {}", document.path(), error.offset(), error.message());
            accumulator.error(byteOffset(text, error.offset()), error.message());
        }

        for (HclDocumentReader.Block block : parsed.blocks()) {
            if (SYMBOL_BLOCKS.contains(block.type()) && !block.labels().isEmpty()) {
                accumulator.addSymbol(block.labels().get(0));
            }
            if (MODULE_BLOCK.equals(block.type()) && block.labels().size() == 1
                && block.body().get(SOURCE) instanceof String source && !source.isBlank()) {
                accumulator.addModuleCall(block.labels().get(0), source.strip());
            }
            if (OUTPUT_BLOCK.equals(block.type()) && block.labels().size() == 1) {
                accumulator.addOutput(block.labels().get(0), block.body().get(VALUE));
            }
            if (!RESOURCE_BLOCK.equals(block.type())) {
                continue;
            }
            if (block.labels().size() != 2) {
                accumulator.error(byteOffset(text, block.offset()),
                    "resource block needs exactly two labels (type and name), found " + block.labels().size());
                accumulator.skip();
                continue;
            }
            extractResource(block, accumulator);
        }
    }

    private void extractResource(HclDocumentReader.Block block, ParseAccumulator accumulator) {
        String type = block.labels().get(0);
        String name = block.labels().get(1);
        if (type.startsWith(NULL_TYPE_PREFIX)) {
            log.debug("Skipping helper resource {}.{}", type, name);
            accumulator.skip();
            return;
        }

        Map<String, String> tags = extractTags(block.body());
        String id = accumulator.addResource(type, name, tags.get(NAME_TAG), block.body(), tags);

        for (String target : dependencyTargets(block.body().get(DEPENDS_ON))) {
            String[] parts = target.split("\\.");
            if (parts.length < 2 || NON_RESOURCE_ROOTS.contains(parts[0])) {
                log.debug("Ignoring non-resource dependency {} on {}", target, id);
                continue;
            }
            accumulator.addHint(ResourceNode.idOf(Dialect.TERRAFORM, parts[0], parts[1]), id, EdgeKind.EXPLICIT_DEPENDENCY);
        }
    }

    private static List<String> dependencyTargets(Object dependsOn) {
        List<String> targets = new ArrayList<>();
        if (dependsOn instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof UnresolvedReference reference) {
                    targets.add(reference.expression());
                } else if (item instanceof String s) {
                    targets.add(s.strip());
                }
            }
        }
        return targets;
    }

    private static Map<String, String> extractTags(Map<String, Object> body) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (String attribute : TAG_ATTRIBUTES) {
            Map<String, Object> values = asMap(body.get(attribute));
            if (values == null) {
                continue;
            }
            values.forEach((key, value) -> {
                String text = asText(value);
                if (text != null) {
                    tags.put(key, text);
                }
            });
        }
        return tags;
    }
}
