package com.infragraph.core.diagnostic;

/**
 * Categories of recoverable problems reported alongside a pipeline result.
 */
public enum DiagnosticType {
    /** Malformed or unsupported syntax in one document */
    PARSE_ERROR(Severity.ERROR),

    /** A reference expression matched zero or several resources */
    UNRESOLVED_REFERENCE(Severity.WARNING),

    /** A resource could not be placed in a network-container cluster */
    CLUSTERING_AMBIGUITY(Severity.WARNING);

    private final Severity severity;

    DiagnosticType(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * Diagnostic severity.
     */
    public enum Severity {
        WARNING,
        ERROR
    }
}
