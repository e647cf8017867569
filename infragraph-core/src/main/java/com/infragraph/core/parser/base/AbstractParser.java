package com.infragraph.core.parser.base;

import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.model.Dialect;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.EdgeKind;
import com.infragraph.core.model.ResourceNode;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.IacParseException;
import com.infragraph.core.parser.IacParser;
import com.infragraph.core.parser.ModuleCall;
import com.infragraph.core.parser.ParseResult;
import com.infragraph.core.parser.ParseStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract base class for dialect parsers providing common functionality.
 *
 * <p>This class reduces duplication across parser implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per parser class)</li>
 *   <li>A fail-soft {@link #parse(IacDocument)} template that turns a document-level
 *       {@link IacParseException} into a diagnostic instead of propagating it</li>
 *   <li>A per-document {@link ParseAccumulator} for nodes, hints and diagnostics</li>
 *   <li>Node construction with canonical ids and the source-file tag</li>
 * </ul>
 *
 * <p>Concrete parsers implement {@link #parseDocument(IacDocument, ParseAccumulator)}
 * and catch {@link IacParseException} per resource block themselves when they can
 * recover and continue with the next block.
 *
 * @see IacParser
 * @see ParseResult
 */
public abstract class AbstractParser implements IacParser {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    protected AbstractParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final ParseResult parse(IacDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        if (document.dialect() != getDialect()) {
            throw new IllegalArgumentException("Parser " + getId() + " cannot parse "
                + document.dialect() + " document " + document.path());
        }
        if (document.content().length == 0) {
            log.debug("Skipping empty document: {}", document.path());
            return ParseResult.empty(getId(), document.path());
        }

        ParseAccumulator accumulator = new ParseAccumulator(document);
        try {
            parseDocument(document, accumulator);
        } catch (IacParseException e) {
            log.warn("Failed to parse {}: {}", document.path(), e.getMessage());
            accumulator.error(e.getOffset(), e.getMessage());
        }

        ParseResult result = accumulator.toResult();
        log.debug("Parsed {}: {}", document.path(), result.statistics().getSummary());
        return result;
    }

    /**
     * Extracts resources from one document into the accumulator.
     *
     * @param document document to parse (dialect already checked)
     * @param accumulator collector for this document
     * @throws IacParseException if the document cannot be parsed at all
     */
    protected abstract void parseDocument(IacDocument document, ParseAccumulator accumulator)
        throws IacParseException;

    // ==================== Offset Utilities ====================

    /**
     * Converts a character index in the decoded text to a UTF-8 byte offset.
     *
     * @param text decoded document text
     * @param charIndex character index, may be out of range
     * @return byte offset, or {@code -1} for a negative index
     */
    protected static long byteOffset(String text, int charIndex) {
        if (charIndex < 0) {
            return Diagnostic.NO_OFFSET;
        }
        int end = Math.min(charIndex, text.length());
        return text.substring(0, end).getBytes(StandardCharsets.UTF_8).length;
    }

    // ==================== Value Utilities ====================

    /**
     * Returns the value as a string map, or null when it is not a map.
     *
     * @param value raw value
     * @return map view or null
     */
    @SuppressWarnings("unchecked")
    protected static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return null;
    }

    /**
     * Returns the value as a string when it is a scalar.
     *
     * @param value raw value
     * @return string form of a scalar, or null for maps, lists and null
     */
    protected static String asText(Object value) {
        if (value == null || value instanceof Map<?, ?> || value instanceof List<?>) {
            return null;
        }
        return String.valueOf(value);
    }

    /**
     * Collects for one document the nodes, hints, symbols and diagnostics.
     *
     * <p>Not thread-safe; one accumulator belongs to one {@link #parse} call.
     */
    protected final class ParseAccumulator {

        private final IacDocument document;
        private final Map<String, ResourceNode> nodes = new LinkedHashMap<>();
        private final List<EdgeHint> hints = new ArrayList<>();
        private final Set<String> symbols = new LinkedHashSet<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final List<ModuleCall> moduleCalls = new ArrayList<>();
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private int declared;
        private int skipped;

        private ParseAccumulator(IacDocument document) {
            this.document = document;
        }

        /**
         * Adds a resource and returns its node id.
         *
         * @param type resource type
         * @param logicalName declared name
         * @param displayName label, null to use the logical name
         * @param attributes attribute tree
         * @param tags user tags
         * @return node id
         */
        public String addResource(String type, String logicalName, String displayName,
                                  Map<String, Object> attributes, Map<String, String> tags) {
            declared++;
            Dialect dialect = getDialect();
            String id = ResourceNode.idOf(dialect, type, logicalName);
            Map<String, String> allTags = new LinkedHashMap<>();
            if (tags != null) {
                allTags.putAll(tags);
            }
            allTags.put(ResourceNode.TAG_SOURCE_FILE, document.path());
            ResourceNode node = new ResourceNode(id, type, null, displayName, logicalName,
                dialect, attributes, allTags);
            if (nodes.put(id, node) != null) {
                log.debug("Resource {} declared twice in {}, keeping the last declaration", id, document.path());
            }
            return id;
        }

        /**
         * Records a resource declaration that was dropped.
         */
        public void skip() {
            declared++;
            skipped++;
        }

        /**
         * Adds an explicit dependency hint.
         *
         * @param fromId dependency node id
         * @param toId dependent node id
         * @param kind edge kind
         */
        public void addHint(String fromId, String toId, EdgeKind kind) {
            if (fromId.equals(toId)) {
                log.debug("Ignoring self dependency on {}", fromId);
                return;
            }
            hints.add(new EdgeHint(fromId, toId, kind));
        }

        /**
         * Registers a non-resource declaration name (parameter, variable, output).
         *
         * @param name symbol name
         */
        public void addSymbol(String name) {
            if (name != null && !name.isBlank()) {
                symbols.add(name);
            }
        }

        /**
         * Records a module call.
         *
         * @param name instance name
         * @param source module source as written
         */
        public void addModuleCall(String name, String source) {
            moduleCalls.add(new ModuleCall(name, source));
        }

        /**
         * Records an output value and registers its name as a symbol.
         *
         * @param name output name
         * @param value output value tree
         */
        public void addOutput(String name, Object value) {
            addSymbol(name);
            outputs.put(name, value);
        }

        /**
         * Reports a parse error at a byte offset.
         *
         * @param offset byte offset, or -1 when unknown
         * @param message description
         */
        public void error(long offset, String message) {
            diagnostics.add(Diagnostic.parseError(document.path(), offset, message));
        }

        /**
         * Reports an unresolvable dependency directive.
         *
         * @param message description
         */
        public void unresolved(String message) {
            diagnostics.add(Diagnostic.unresolvedReference(document.path(), message));
        }

        /**
         * Returns true if a node with this id was already added.
         *
         * @param id node id
         * @return true if present
         */
        public boolean hasNode(String id) {
            return nodes.containsKey(id);
        }

        private ParseResult toResult() {
            int extracted = nodes.size();
            return new ParseResult(
                getId(),
                document.path(),
                List.copyOf(nodes.values()),
                hints,
                symbols,
                diagnostics,
                new ParseStatistics(declared, extracted, skipped),
                moduleCalls,
                outputs
            );
        }
    }
}
