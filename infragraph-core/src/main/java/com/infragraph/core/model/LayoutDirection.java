package com.infragraph.core.model;

import java.util.Locale;

/**
 * Diagram orientation.
 */
public enum LayoutDirection {
    /** Choose horizontal or vertical from the graph's complexity */
    AUTO("AUTO"),
    LEFT_RIGHT("LR"),
    RIGHT_LEFT("RL"),
    TOP_BOTTOM("TB"),
    BOTTOM_TOP("BT");

    private final String code;

    LayoutDirection(String code) {
        this.code = code;
    }

    /**
     * Returns the two-letter code used by Mermaid and Graphviz.
     *
     * @return direction code
     */
    public String code() {
        return code;
    }

    /**
     * Returns true for left-right and right-left layouts.
     *
     * @return true if horizontal
     */
    public boolean isHorizontal() {
        return this == LEFT_RIGHT || this == RIGHT_LEFT;
    }

    /**
     * Parses a direction leniently.
     *
     * <p>Accepts the enum names, the two-letter codes ({@code TD} is read as
     * {@code TB}), and the words {@code horizontal}/{@code vertical}. Blank or
     * unrecognised input yields {@link #AUTO}.
     *
     * @param raw raw value, may be null
     * @return parsed direction
     */
    public static LayoutDirection parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        String value = raw.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (value) {
            case "LR", "LEFT_RIGHT", "HORIZONTAL" -> LEFT_RIGHT;
            case "RL", "RIGHT_LEFT" -> RIGHT_LEFT;
            case "TB", "TD", "TOP_BOTTOM", "VERTICAL" -> TOP_BOTTOM;
            case "BT", "BOTTOM_TOP" -> BOTTOM_TOP;
            default -> AUTO;
        };
    }
}
