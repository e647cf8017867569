package com.infragraph.core.diagnostic;

import java.util.Objects;

/**
 * A recoverable problem found while building the graph.
 *
 * @param type problem category
 * @param source document path or resource id the problem relates to
 * @param offset byte offset in the document, or {@code -1} when not known
 * @param message human readable description
 */
public record Diagnostic(
    DiagnosticType type,
    String source,
    long offset,
    String message
) {
    /** Offset value used when the position is unknown. */
    public static final long NO_OFFSET = -1L;

    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (source == null) {
            source = "";
        }
        if (offset < 0) {
            offset = NO_OFFSET;
        }
    }

    public static Diagnostic parseError(String source, long offset, String message) {
        return new Diagnostic(DiagnosticType.PARSE_ERROR, source, offset, message);
    }

    public static Diagnostic unresolvedReference(String source, String message) {
        return new Diagnostic(DiagnosticType.UNRESOLVED_REFERENCE, source, NO_OFFSET, message);
    }

    public static Diagnostic clusteringAmbiguity(String source, String message) {
        return new Diagnostic(DiagnosticType.CLUSTERING_AMBIGUITY, source, NO_OFFSET, message);
    }

    /**
     * Returns true for error-severity diagnostics.
     *
     * @return true if this is an error
     */
    public boolean isError() {
        return type.severity() == DiagnosticType.Severity.ERROR;
    }

    @Override
    public String toString() {
        String position = offset >= 0 ? source + "@" + offset : source;
        return type + " [" + position + "] " + message;
    }
}
