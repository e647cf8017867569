package com.infragraph.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads {@code infragraph.yaml} into a {@link ProjectConfig}.
 *
 * <p>Each top-level section ({@code project}, {@code diagram}, {@code layout},
 * {@code limits}, {@code output}) is bound on its own. A section that fails to bind,
 * for example a negative spacing under {@code layout}, falls back to its defaults while
 * the other sections are kept. Unknown sections and out-of-range limits are reported as
 * warnings. Loading never throws: a missing or unreadable file yields
 * {@link ProjectConfig#defaults()}.
 *
 * <pre>{@code
 * ConfigLoader.Loaded loaded = ConfigLoader.read(Path.of("infragraph.yaml"));
 * loaded.warnings().forEach(System.err::println);
 * DiagramPipeline pipeline = new DiagramPipeline(loaded.config().layout());
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up when no path is given. */
    public static final String DEFAULT_FILE_NAME = "infragraph.yaml";

    /** Accepted file names in lookup order. */
    public static final List<String> FILE_NAMES = List.of(DEFAULT_FILE_NAME, "infragraph.yml");

    private static final Set<String> SECTIONS = Set.of("project", "diagram", "layout", "limits", "output");

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Outcome of reading one configuration file.
     *
     * @param config bound configuration, defaults where a section was absent or invalid
     * @param source file the configuration came from, {@code null} when defaults were used
     * @param warnings problems found while reading, in file order
     */
    public record Loaded(ProjectConfig config, Path source, List<String> warnings) {
        public Loaded {
            warnings = List.copyOf(warnings);
        }

        static Loaded defaults(List<String> warnings) {
            return new Loaded(ProjectConfig.defaults(), null, warnings);
        }
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code infragraph.yaml}
     * @return loaded configuration or defaults if unavailable
     * @see #read(Path)
     */
    public static ProjectConfig load(Path configPath) {
        return read(configPath).config();
    }

    /**
     * Loads configuration from the given path, or from the first of {@link #FILE_NAMES}
     * found in the working directory when the path is {@code null}.
     *
     * @param configPath optional path
     * @return loaded configuration or defaults
     */
    public static ProjectConfig loadOrDefaults(Path configPath) {
        if (configPath != null) {
            return load(configPath);
        }
        return discover(Path.of(""))
            .map(ConfigLoader::load)
            .orElseGet(() -> {
                log.debug("No {} in working directory, using defaults", FILE_NAMES);
                return ProjectConfig.defaults();
            });
    }

    /**
     * Finds the configuration file of a directory.
     *
     * @param directory directory to look in
     * @return first existing regular file named after {@link #FILE_NAMES}
     */
    public static Optional<Path> discover(Path directory) {
        for (String name : FILE_NAMES) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Reads and binds a configuration file section by section.
     *
     * @param configPath path to the YAML file
     * @return configuration, its source and the warnings raised
     */
    public static Loaded read(Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (!Files.exists(configPath)) {
            warn(warnings, "Configuration file not found: " + configPath + ". Using defaults.");
            return Loaded.defaults(warnings);
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            warn(warnings, "Configuration file is not readable: " + configPath + ". Using defaults.");
            return Loaded.defaults(warnings);
        }

        JsonNode root;
        try {
            log.debug("Loading configuration from: {}", configPath);
            root = YAML_MAPPER.readTree(configPath.toFile());
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            warnings.add("Failed to parse " + configPath + ": " + e.getMessage());
            return Loaded.defaults(warnings);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            warn(warnings, "Configuration file is empty: " + configPath + ". Using defaults.");
            return Loaded.defaults(warnings);
        }
        if (!root.isObject()) {
            warn(warnings, "Configuration file " + configPath + " must contain a mapping of sections. Using defaults.");
            return Loaded.defaults(warnings);
        }

        for (Iterator<String> names = root.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (!SECTIONS.contains(name)) {
                warn(warnings, "Unknown section '" + name + "' in " + configPath + " is ignored");
            }
        }

        ProjectConfig config = new ProjectConfig(
            section(root, "project", ProjectConfig.ProjectInfo.class, warnings),
            section(root, "diagram", ProjectConfig.DiagramSettings.class, warnings),
            section(root, "layout", LayoutSettings.class, warnings),
            limits(root, warnings),
            section(root, "output", ProjectConfig.OutputConfig.class, warnings));
        log.info("Loaded configuration from: {}", configPath);
        return new Loaded(config, configPath, warnings);
    }

    private static <T> T section(JsonNode root, String name, Class<T> type, List<String> warnings) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            warn(warnings, "Section '" + name + "' must be a mapping. Using defaults for it.");
            return null;
        }
        try {
            return YAML_MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            warn(warnings, "Invalid '" + name + "' section: " + rootCause(e).getMessage() + ". Using defaults for it.");
            return null;
        }
    }

    private static Limits limits(JsonNode root, List<String> warnings) {
        Limits limits = section(root, "limits", Limits.class, warnings);
        if (limits == null) {
            return null;
        }
        JsonNode node = root.get("limits");
        checkPositive(node, "maxFiles", Limits.DEFAULT_MAX_FILES, warnings);
        checkPositive(node, "maxBytesPerFile", Limits.DEFAULT_MAX_BYTES_PER_FILE, warnings);
        return limits;
    }

    // Limits replaces non-positive values itself, this only makes the replacement visible
    private static void checkPositive(JsonNode section, String field, int fallback, List<String> warnings) {
        JsonNode value = section.get(field);
        if (value != null && value.isNumber() && value.asLong() <= 0) {
            warn(warnings, "limits." + field + " must be positive, got " + value.asText() + ". Using " + fallback + ".");
        }
    }

    private static Throwable rootCause(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
