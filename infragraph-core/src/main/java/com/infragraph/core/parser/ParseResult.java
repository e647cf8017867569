package com.infragraph.core.parser;

import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.model.EdgeHint;
import com.infragraph.core.model.ResourceNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Output of parsing one document.
 *
 * <p>A result may be partial: malformed blocks are skipped and reported in
 * {@code diagnostics} while the rest of the document is still extracted.
 *
 * @param parserId id of the parser that produced this result
 * @param source document path
 * @param nodes extracted resources (provider tag not yet assigned)
 * @param edgeHints explicit dependency hints, by node id
 * @param symbols names of non-resource declarations (parameters, variables, outputs)
 *                that attribute expressions may legitimately refer to
 * @param diagnostics recoverable problems found in the document
 * @param statistics parse counters
 * @param moduleCalls module calls declared in the document
 * @param outputs output values by output name, for references into a module instance
 */
public record ParseResult(
    String parserId,
    String source,
    List<ResourceNode> nodes,
    List<EdgeHint> edgeHints,
    Set<String> symbols,
    List<Diagnostic> diagnostics,
    ParseStatistics statistics,
    List<ModuleCall> moduleCalls,
    Map<String, Object> outputs
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        Objects.requireNonNull(parserId, "parserId must not be null");
        Objects.requireNonNull(source, "source must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edgeHints = edgeHints == null ? List.of() : List.copyOf(edgeHints);
        symbols = symbols == null ? Set.of() : Set.copyOf(symbols);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        if (statistics == null) {
            statistics = ParseStatistics.empty();
        }
        moduleCalls = moduleCalls == null ? List.of() : List.copyOf(moduleCalls);
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public ParseResult(String parserId, String source, List<ResourceNode> nodes, List<EdgeHint> edgeHints,
                       Set<String> symbols, List<Diagnostic> diagnostics, ParseStatistics statistics) {
        this(parserId, source, nodes, edgeHints, symbols, diagnostics, statistics, List.of(), Map.of());
    }

    /**
     * Creates a result with nothing extracted and no problems.
     *
     * @param parserId parser id
     * @param source document path
     * @return empty result
     */
    public static ParseResult empty(String parserId, String source) {
        return new ParseResult(parserId, source, List.of(), List.of(), Set.of(), List.of(), ParseStatistics.empty());
    }

    /**
     * Creates a result for a document that could not be parsed at all.
     *
     * @param parserId parser id
     * @param source document path
     * @param diagnostic the parse error
     * @return result carrying only the diagnostic
     */
    public static ParseResult failed(String parserId, String source, Diagnostic diagnostic) {
        return new ParseResult(parserId, source, List.of(), List.of(), Set.of(), List.of(diagnostic), ParseStatistics.empty());
    }

    /**
     * Returns true if any resource was extracted.
     *
     * @return true when nodes were found
     */
    public boolean hasFindings() {
        return !nodes.isEmpty();
    }

    /**
     * Returns true if at least one diagnostic is an error.
     *
     * @return true when errors were reported
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
