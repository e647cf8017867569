package com.infragraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infragraph.core.model.LayoutDirection;

/**
 * Tuning knobs of the layout parameter deriver.
 *
 * <p>Missing values fall back to the defaults below, so a partial {@code layout:}
 * section in {@code infragraph.yaml} is valid.
 *
 * <pre>{@code
 * layout:
 *   direction: auto            # auto | LR | TB | RL | BT
 *   minPad: 0.3
 *   minNodeSeparation: 0.25
 *   minRankSeparation: 0.65
 *   complexityScaleFactor: 1.5
 *   edgeDensityScaleFactor: 1.2
 *   edgeDensityThreshold: 2.5
 *   implicitOrderingFallback: false
 * }</pre>
 *
 * @param direction requested orientation, parsed leniently ({@code auto} when blank)
 * @param minPad minimum outer padding
 * @param minNodeSeparation minimum space between nodes of one rank
 * @param minRankSeparation minimum space between ranks
 * @param complexityScaleFactor how strongly complexity widens spacing
 * @param edgeDensityScaleFactor spacing multiplier for edge-dense graphs
 * @param edgeDensityThreshold edges per node above which the density multiplier applies
 * @param implicitOrderingFallback chain nodes with ordering edges when a graph has no edges
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutSettings(
    @JsonProperty("direction") String direction,
    @JsonProperty("minPad") Double minPad,
    @JsonProperty("minNodeSeparation") Double minNodeSeparation,
    @JsonProperty("minRankSeparation") Double minRankSeparation,
    @JsonProperty("complexityScaleFactor") Double complexityScaleFactor,
    @JsonProperty("edgeDensityScaleFactor") Double edgeDensityScaleFactor,
    @JsonProperty("edgeDensityThreshold") Double edgeDensityThreshold,
    @JsonProperty("implicitOrderingFallback") Boolean implicitOrderingFallback
) {
    public static final double DEFAULT_MIN_PAD = 0.3;
    public static final double DEFAULT_MIN_NODE_SEPARATION = 0.25;
    public static final double DEFAULT_MIN_RANK_SEPARATION = 0.65;
    public static final double DEFAULT_COMPLEXITY_SCALE_FACTOR = 1.5;
    public static final double DEFAULT_EDGE_DENSITY_SCALE_FACTOR = 1.2;
    public static final double DEFAULT_EDGE_DENSITY_THRESHOLD = 2.5;

    /**
     * Compact constructor applying defaults and validating ranges.
     */
    public LayoutSettings {
        if (direction == null || direction.isBlank()) {
            direction = LayoutDirection.AUTO.name();
        }
        minPad = positiveOr(minPad, DEFAULT_MIN_PAD, "minPad");
        minNodeSeparation = positiveOr(minNodeSeparation, DEFAULT_MIN_NODE_SEPARATION, "minNodeSeparation");
        minRankSeparation = positiveOr(minRankSeparation, DEFAULT_MIN_RANK_SEPARATION, "minRankSeparation");
        complexityScaleFactor = positiveOr(complexityScaleFactor, DEFAULT_COMPLEXITY_SCALE_FACTOR, "complexityScaleFactor");
        edgeDensityScaleFactor = positiveOr(edgeDensityScaleFactor, DEFAULT_EDGE_DENSITY_SCALE_FACTOR, "edgeDensityScaleFactor");
        edgeDensityThreshold = positiveOr(edgeDensityThreshold, DEFAULT_EDGE_DENSITY_THRESHOLD, "edgeDensityThreshold");
        if (implicitOrderingFallback == null) {
            implicitOrderingFallback = Boolean.FALSE;
        }
    }

    /**
     * Returns the settings with every default applied.
     *
     * @return default settings
     */
    public static LayoutSettings defaults() {
        return new LayoutSettings(null, null, null, null, null, null, null, null);
    }

    /**
     * Returns the parsed requested direction.
     *
     * @return requested direction, {@link LayoutDirection#AUTO} when unset
     */
    public LayoutDirection requestedDirection() {
        return LayoutDirection.parse(direction);
    }

    /**
     * Returns a copy with a different requested direction.
     *
     * @param newDirection direction
     * @return new settings
     */
    public LayoutSettings withDirection(LayoutDirection newDirection) {
        return new LayoutSettings(newDirection.name(), minPad, minNodeSeparation, minRankSeparation,
            complexityScaleFactor, edgeDensityScaleFactor, edgeDensityThreshold, implicitOrderingFallback);
    }

    private static Double positiveOr(Double value, double fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNaN() || value < 0.0) {
            throw new IllegalArgumentException(name + " must be a non-negative number, got " + value);
        }
        return value;
    }
}
