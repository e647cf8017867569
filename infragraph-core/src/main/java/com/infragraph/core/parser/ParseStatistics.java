package com.infragraph.core.parser;

/**
 * Counters collected while parsing one document.
 *
 * @param resourcesDeclared resource declarations encountered
 * @param resourcesExtracted resources turned into nodes
 * @param resourcesSkipped declarations dropped (malformed or filtered)
 */
public record ParseStatistics(
    int resourcesDeclared,
    int resourcesExtracted,
    int resourcesSkipped
) {
    public ParseStatistics {
        if (resourcesDeclared < 0) {
            resourcesDeclared = 0;
        }
        if (resourcesExtracted < 0) {
            resourcesExtracted = 0;
        }
        if (resourcesSkipped < 0) {
            resourcesSkipped = 0;
        }
    }

    public static ParseStatistics empty() {
        return new ParseStatistics(0, 0, 0);
    }

    /**
     * Returns a human-readable summary.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format("Declared: %d, Extracted: %d, Skipped: %d",
            resourcesDeclared, resourcesExtracted, resourcesSkipped);
    }
}
