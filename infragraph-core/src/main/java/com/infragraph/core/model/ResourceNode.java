package com.infragraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One declared infrastructure resource.
 *
 * <p>Attribute values are kept as a generic structure: {@link String}, {@link Number},
 * {@link Boolean}, {@link java.util.List}, {@link Map} or {@link UnresolvedReference}.
 * The map preserves declaration order.
 *
 * @param id stable key, {@code <dialect>:<type>:<logical-name>}
 * @param type provider-specific resource type (e.g. {@code aws_s3_bucket})
 * @param provider provider tag derived from the type prefix ({@code "other"} when unknown)
 * @param displayName human label, falls back to the logical name
 * @param logicalName name the resource is declared under in its document
 * @param dialect dialect the resource was declared in
 * @param attributes raw attribute tree
 * @param tags user metadata and pipeline annotations (environment, source file, module)
 */
public record ResourceNode(
    String id,
    String type,
    String provider,
    String displayName,
    String logicalName,
    Dialect dialect,
    Map<String, Object> attributes,
    Map<String, String> tags
) {
    /** Tag holding the environment a resource was detected in. */
    public static final String TAG_ENVIRONMENT = "environment";

    /** Tag holding the path of the document a resource came from. */
    public static final String TAG_SOURCE_FILE = "sourceFile";

    /** Tag holding the dotted module instance path of a resource declared in a module. */
    public static final String TAG_MODULE = "module";

    /**
     * Compact constructor with validation.
     */
    public ResourceNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(logicalName, "logicalName must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        if (provider == null || provider.isBlank()) {
            provider = "other";
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = logicalName;
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        tags = tags == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    /**
     * Builds the canonical node id.
     *
     * @param dialect declaring dialect
     * @param type resource type
     * @param logicalName logical name
     * @return id of the form {@code <dialect>:<type>:<logical-name>}
     */
    public static String idOf(Dialect dialect, String type, String logicalName) {
        return dialect.id() + ":" + type + ":" + logicalName;
    }

    /**
     * Returns the environment tag, or {@code null} when none was detected.
     *
     * @return environment name or null
     */
    public String environment() {
        return tags.get(TAG_ENVIRONMENT);
    }

    /**
     * Returns a copy with a different provider tag.
     *
     * @param newProvider provider tag
     * @return new node
     */
    public ResourceNode withProvider(String newProvider) {
        return new ResourceNode(id, type, newProvider, displayName, logicalName, dialect, attributes, tags);
    }
}
