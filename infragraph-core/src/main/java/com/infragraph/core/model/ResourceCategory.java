package com.infragraph.core.model;

/**
 * Fixed category taxonomy.
 *
 * <p>Declaration order is the tie-break precedence: when a type matches keywords of
 * several categories the first one declared here wins.
 */
public enum ResourceCategory {
    NETWORK("Network"),
    SECURITY("Security"),
    COMPUTE("Compute"),
    DATA("Data"),
    STORAGE("Storage"),
    INTEGRATION("Integration"),
    MANAGEMENT("Management"),
    OTHER("Other");

    private final String label;

    ResourceCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
