package com.infragraph.core.model;

/**
 * Visual classification of an edge, assigned by the layout deriver.
 */
public enum EdgeStyle {
    DEFAULT,
    SECURITY,
    DATA,
    CROSS_BOUNDARY
}
