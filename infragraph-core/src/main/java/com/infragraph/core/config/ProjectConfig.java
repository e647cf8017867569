package com.infragraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for InfraGraph runs.
 *
 * <p>Loaded from {@code infragraph.yaml}. Every section is optional; missing sections
 * fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "platform-infra"
 *
 * diagram:
 *   format: mermaid
 *   groupBy: provider
 *
 * layout:
 *   direction: auto
 *   complexityScaleFactor: 1.5
 *
 * limits:
 *   maxFiles: 25
 *   maxBytesPerFile: 30000
 *
 * output:
 *   directory: "./docs/infrastructure"
 * }</pre>
 *
 * @param project project metadata
 * @param diagram diagram generation settings
 * @param layout layout tuning
 * @param limits input limits
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("diagram") DiagramSettings diagram,
    @JsonProperty("layout") LayoutSettings layout,
    @JsonProperty("limits") Limits limits,
    @JsonProperty("output") OutputConfig output
) {
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo("infrastructure", null);
        }
        if (diagram == null) {
            diagram = new DiagramSettings(null, null);
        }
        if (layout == null) {
            layout = LayoutSettings.defaults();
        }
        if (limits == null) {
            limits = Limits.defaults();
        }
        if (output == null) {
            output = new OutputConfig(null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name, used as the diagram title
     * @param description optional description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    /**
     * Diagram generation settings.
     *
     * @param format default generator id ({@code mermaid} when unset)
     * @param groupBy cluster kind the generators group by ({@code provider} when unset)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramSettings(
        @JsonProperty("format") String format,
        @JsonProperty("groupBy") String groupBy
    ) {
        public DiagramSettings {
            if (format == null || format.isBlank()) {
                format = "mermaid";
            }
            if (groupBy == null || groupBy.isBlank()) {
                groupBy = "provider";
            }
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory, {@code null} writes to standard output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {}
}
