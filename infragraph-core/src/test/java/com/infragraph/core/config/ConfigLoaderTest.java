package com.infragraph.core.config;

import com.infragraph.core.model.LayoutDirection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "platform-infra"
              description: "Shared platform"

            diagram:
              format: dot
              groupBy: category

            layout:
              direction: vertical
              minPad: 0.5
              complexityScaleFactor: 2.0
              implicitOrderingFallback: true

            limits:
              maxFiles: 10
              maxBytesPerFile: 5000

            output:
              directory: "./docs/infrastructure"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("platform-infra");
        assertThat(config.project().description()).isEqualTo("Shared platform");
        assertThat(config.diagram().format()).isEqualTo("dot");
        assertThat(config.diagram().groupBy()).isEqualTo("category");
        assertThat(config.layout().requestedDirection()).isEqualTo(LayoutDirection.TOP_BOTTOM);
        assertThat(config.layout().minPad()).isEqualTo(0.5);
        assertThat(config.layout().complexityScaleFactor()).isEqualTo(2.0);
        assertThat(config.layout().minNodeSeparation()).isEqualTo(LayoutSettings.DEFAULT_MIN_NODE_SEPARATION);
        assertThat(config.layout().implicitOrderingFallback()).isTrue();
        assertThat(config.limits().maxFiles()).isEqualTo(10);
        assertThat(config.limits().maxBytesPerFile()).isEqualTo(5000);
        assertThat(config.output().directory()).isEqualTo("./docs/infrastructure");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "minimal"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("minimal");
        assertThat(config.diagram().format()).isEqualTo("mermaid");
        assertThat(config.diagram().groupBy()).isEqualTo("provider");
        assertThat(config.layout()).isEqualTo(LayoutSettings.defaults());
        assertThat(config.limits()).isEqualTo(Limits.defaults());
        assertThat(config.output().directory()).isNull();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, "layout: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void read_negativeSpacing_fallsBackForLayoutOnly() throws IOException {
        // Given: a valid project section next to an invalid layout section
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "kept"
            layout:
              minPad: -1
            """);

        // When: reading
        ConfigLoader.Loaded loaded = ConfigLoader.read(configFile);

        // Then: only the layout section is replaced by its defaults
        assertThat(loaded.config().project().name()).isEqualTo("kept");
        assertThat(loaded.config().layout()).isEqualTo(LayoutSettings.defaults());
        assertThat(loaded.source()).isEqualTo(configFile);
        assertThat(loaded.warnings()).hasSize(1);
        assertThat(loaded.warnings().get(0))
            .startsWith("Invalid 'layout' section")
            .contains("minPad must be a non-negative number");
    }

    @Test
    void read_unknownSection_isReportedAndIgnored() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, """
            diagram:
              format: dot
            layuot:
              direction: LR
            """);

        ConfigLoader.Loaded loaded = ConfigLoader.read(configFile);

        assertThat(loaded.config().diagram().format()).isEqualTo("dot");
        assertThat(loaded.config().layout()).isEqualTo(LayoutSettings.defaults());
        assertThat(loaded.warnings()).hasSize(1);
        assertThat(loaded.warnings().get(0)).contains("Unknown section 'layuot'");
    }

    @Test
    void read_nonPositiveLimit_warnsAndUsesDefault() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, """
            limits:
              maxFiles: 0
              maxBytesPerFile: 1000
            """);

        ConfigLoader.Loaded loaded = ConfigLoader.read(configFile);

        assertThat(loaded.config().limits().maxFiles()).isEqualTo(Limits.DEFAULT_MAX_FILES);
        assertThat(loaded.config().limits().maxBytesPerFile()).isEqualTo(1000);
        assertThat(loaded.warnings()).containsExactly("limits.maxFiles must be positive, got 0. Using 25.");
    }

    @Test
    void read_sectionThatIsNotAMapping_usesDefaultsForIt() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "scalars"
            output: "./docs"
            """);

        ConfigLoader.Loaded loaded = ConfigLoader.read(configFile);

        assertThat(loaded.config().project().name()).isEqualTo("scalars");
        assertThat(loaded.config().output().directory()).isNull();
        assertThat(loaded.warnings()).hasSize(1);
        assertThat(loaded.warnings().get(0)).contains("Section 'output' must be a mapping");
    }

    @Test
    void read_topLevelList_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("infragraph.yaml");
        Files.writeString(configFile, """
            - layout
            - limits
            """);

        ConfigLoader.Loaded loaded = ConfigLoader.read(configFile);

        assertThat(loaded.config()).isEqualTo(ProjectConfig.defaults());
        assertThat(loaded.source()).isNull();
        assertThat(loaded.warnings()).hasSize(1);
    }

    @Test
    void read_missingFile_reportsWarningWithoutSource() {
        ConfigLoader.Loaded loaded = ConfigLoader.read(tempDir.resolve("missing.yaml"));

        assertThat(loaded.source()).isNull();
        assertThat(loaded.warnings()).hasSize(1);
        assertThat(loaded.warnings().get(0)).startsWith("Configuration file not found");
    }

    @Test
    void discover_prefersYamlOverYml() throws IOException {
        Files.writeString(tempDir.resolve("infragraph.yml"), "project:\n  name: short\n");

        assertThat(ConfigLoader.discover(tempDir)).contains(tempDir.resolve("infragraph.yml"));

        Files.writeString(tempDir.resolve("infragraph.yaml"), "project:\n  name: long\n");

        assertThat(ConfigLoader.discover(tempDir)).contains(tempDir.resolve("infragraph.yaml"));
    }

    @Test
    void discover_emptyDirectory_findsNothing() {
        assertThat(ConfigLoader.discover(tempDir)).isEmpty();
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void loadOrDefaults_withPath_loadsIt() throws IOException {
        Path configFile = tempDir.resolve("custom.yaml");
        Files.writeString(configFile, """
            project:
              name: "custom"
            """);

        assertThat(ConfigLoader.loadOrDefaults(configFile).project().name()).isEqualTo("custom");
    }
}
