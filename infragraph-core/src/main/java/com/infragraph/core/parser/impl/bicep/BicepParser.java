package com.infragraph.core.parser.impl.bicep;

import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.model.UnresolvedReference;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.base.AbstractParser;
import com.infragraph.core.parser.base.SyntaxErrorCollector.SyntaxError;
import com.infragraph.core.parser.impl.bicep.util.BicepDocumentReader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Azure Bicep files.
 *
 * <p>Resource declarations are read by the ANTLR-based {@link BicepDocumentReader}:
 *
 * <pre>{@code
 * resource vnet 'Microsoft.Network/virtualNetworks@2023-04-01' = {
 *   name: 'core-vnet'
 *   location: location
 * }
 *
 * resource subnet 'Microsoft.Network/virtualNetworks/subnets@2023-04-01' = {
 *   parent: vnet
 *   name: 'app'
 * }
 * }</pre>
 *
 * <p>The API version is stripped from the type and kept in the {@code apiVersion} tag.
 * {@code dependsOn} entries become explicit hints; {@code parent} and child
 * declarations become implicit-ordering hints from parent to child. The {@code name}
 * property, when it is a plain string, is used as display name.
 */
public class BicepParser extends AbstractParser {

    // --- Regex Patterns ---
    private static final Pattern LEADING_SYMBOL = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)");

    // --- Magic Strings ---
    private static final String PARSER_ID = "bicep";
    private static final String PARSER_DISPLAY_NAME = "Azure Bicep Parser";
    private static final String DEPENDS_ON = "dependsOn";
    private static final String PARENT = "parent";
    private static final String NAME = "name";
    private static final String TAGS = "tags";
    private static final String TAG_API_VERSION = "apiVersion";
    private static final String TAG_EXISTING = "existing";

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
        return Dialect.BICEP;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("*.bicep");
    }

    @Override
    protected void parseDocument(IacDocument document, ParseAccumulator accumulator) {
        String text = document.text();
        BicepDocumentReader.Result read = BicepDocumentReader.read(text);

        for (SyntaxError error : read.errors()) {
            accumulator.error(byteOffset(text, error.offset()), error.message());
        }
        read.symbols().forEach(accumulator::addSymbol);

        Map<String, String> idsBySymbol = new LinkedHashMap<>();
        for (BicepDocumentReader.Declaration declaration : read.resources()) {
            idsBySymbol.put(declaration.symbol(),
                ResourceNode.idOf(Dialect.BICEP, declaration.type(), declaration.symbol()));
        }

        for (BicepDocumentReader.Declaration declaration : read.resources()) {
            extractResource(declaration, idsBySymbol, read.symbols(), accumulator);
        }
    }

    private void extractResource(BicepDocumentReader.Declaration declaration, Map<String, String> idsBySymbol,
                                 Set<String> symbols, ParseAccumulator accumulator) {
        Map<String, Object> body = declaration.body();
        Map<String, String> tags = new LinkedHashMap<>();
        Map<String, Object> userTags = asMap(body.get(TAGS));
        if (userTags != null) {
            userTags.forEach((key, value) -> {
                String text = asText(value);
                if (text != null) {
                    tags.put(key, text);
                }
            });
        }
        if (!declaration.apiVersion().isEmpty()) {
            tags.put(TAG_API_VERSION, declaration.apiVersion());
        }
        if (declaration.existing()) {
            tags.put(TAG_EXISTING, "true");
        }

        String displayName = body.get(NAME) instanceof String name && !name.contains("${") ? name : null;
        String id = accumulator.addResource(declaration.type(), declaration.symbol(), displayName, body, tags);

        for (String symbol : dependencySymbols(body.get(DEPENDS_ON))) {
            hint(symbol, id, EdgeKind.EXPLICIT_DEPENDENCY, idsBySymbol, symbols, accumulator);
        }
        String parent = declaration.parentSymbol();
        if (parent == null && body.get(PARENT) instanceof UnresolvedReference reference) {
            parent = leadingSymbol(reference.expression());
        }
        if (parent != null) {
            hint(parent, id, EdgeKind.IMPLICIT_ORDERING, idsBySymbol, symbols, accumulator);
        }
    }

    private void hint(String symbol, String dependentId, EdgeKind kind, Map<String, String> idsBySymbol,
                      Set<String> symbols, ParseAccumulator accumulator) {
        String targetId = idsBySymbol.get(symbol);
        if (targetId != null) {
            accumulator.addHint(targetId, dependentId, kind);
        } else if (symbols.contains(symbol)) {
            log.debug("Dependency of {} on module or variable {} is not a resource", dependentId, symbol);
        } else {
            accumulator.unresolved(dependentId + " depends on unknown symbol " + symbol);
        }
    }

    private static List<String> dependencySymbols(Object dependsOn) {
        List<String> result = new ArrayList<>();
        if (dependsOn instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof UnresolvedReference reference) {
                    String symbol = leadingSymbol(reference.expression());
                    if (symbol != null) {
                        result.add(symbol);
                    }
                }
            }
        }
        return result;
    }

    private static String leadingSymbol(String expression) {
        Matcher matcher = LEADING_SYMBOL.matcher(expression);
        return matcher.find() ? matcher.group(1) : null;
    }
}
