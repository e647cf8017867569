package com.infragraph.core.pipeline;

import com.infragraph.core.diagnostic.Diagnostic;
import com.infragraph.core.diagnostic.DiagnosticType;
import com.infragraph.core.model.LayoutReadyGraph;

import java.util.List;
import java.util.Objects;

/**
 * Output of one pipeline run.
 *
 * @param graph layout-ready graph, possibly partial
 * @param diagnostics every recoverable problem found, parse errors first
 */
public record PipelineResult(
    LayoutReadyGraph graph,
    List<Diagnostic> diagnostics
) {
    public PipelineResult {
        Objects.requireNonNull(graph, "graph must not be null");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the diagnostics of one type.
     *
     * @param type diagnostic type
     * @return matching diagnostics in report order
     */
    public List<Diagnostic> diagnosticsOf(DiagnosticType type) {
        return diagnostics.stream()
            .filter(d -> d.type() == type)
            .toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
