package com.infragraph.core.generator;

import com.infragraph.core.model.ClusterKind;

import java.util.Locale;
import java.util.Map;

/**
 * Configuration for diagram generation.
 *
 * @param title diagram title, {@code null} for none
 * @param groupBy cluster kind rendered as subgraphs
 * @param includeLegend whether to append a legend of edge styles
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    String title,
    ClusterKind groupBy,
    boolean includeLegend,
    Map<String, Object> customSettings
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (groupBy == null) {
            groupBy = ClusterKind.PROVIDER;
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, ClusterKind.PROVIDER, false, Map.of());
    }

    /**
     * Parses a grouping name ({@code provider}, {@code category}, {@code network}).
     *
     * @param raw raw value, may be null
     * @return cluster kind, {@link ClusterKind#PROVIDER} when blank
     * @throws IllegalArgumentException for unknown names
     */
    public static ClusterKind parseGroupBy(String raw) {
        if (raw == null || raw.isBlank()) {
            return ClusterKind.PROVIDER;
        }
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "provider" -> ClusterKind.PROVIDER;
            case "category" -> ClusterKind.CATEGORY;
            case "network", "network-container", "network_container" -> ClusterKind.NETWORK_CONTAINER;
            default -> throw new IllegalArgumentException("Unknown grouping: " + raw
                + " (expected provider, category or network)");
        };
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
