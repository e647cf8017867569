package com.infragraph.core.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Detects the deployment environment a document belongs to from its directory path.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>the directory directly below a {@code terraform} directory, unless it is a
 *       shared-code directory such as {@code modules}</li>
 *   <li>the first directory whose name is a well-known environment name</li>
 * </ol>
 * Only directory segments are considered; the file name never names an environment.
 * Names are lower-cased.
 */
public final class EnvironmentDetector {

    /** Environment assigned to documents without one when several environments are present. */
    public static final String SHARED = "shared";

    // --- Magic Strings ---
    private static final String TERRAFORM_DIR = "terraform";

    private static final Set<String> KNOWN_ENVIRONMENTS = Set.of(
        "dev", "development", "preprod", "pre-prod", "prod", "production",
        "stage", "staging", "qa", "test", "uat", "sandbox", SHARED
    );

    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
        "modules", "module", "account_config", "accounts", "artifacts", "templates", "template",
        "img", "images", "cloud_formation", "config", "configs"
    );

    private EnvironmentDetector() {
        // Prevent instantiation
    }

    /**
     * Detects the environment of a document path.
     *
     * @param path document path, either separator style
     * @return lower-case environment name, or empty if none is detected
     */
    public static Optional<String> detect(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        List<String> directories = directories(path);
        for (int i = 0; i + 1 < directories.size(); i++) {
            if (TERRAFORM_DIR.equals(directories.get(i))) {
                String candidate = directories.get(i + 1);
                if (!EXCLUDED_DIRECTORIES.contains(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return directories.stream()
            .filter(KNOWN_ENVIRONMENTS::contains)
            .findFirst();
    }

    /**
     * Returns true for one of the well-known environment names.
     *
     * @param name candidate name
     * @return true if known
     */
    public static boolean isKnownEnvironment(String name) {
        return name != null && KNOWN_ENVIRONMENTS.contains(name.strip().toLowerCase(Locale.ROOT));
    }

    private static List<String> directories(String path) {
        String[] segments = path.replace('\\', '/').split("/");
        List<String> directories = new ArrayList<>();
        for (int i = 0; i < segments.length - 1; i++) {
            String segment = segments[i].strip();
            if (!segment.isEmpty() && !segment.equals(".")) {
                directories.add(segment.toLowerCase(Locale.ROOT));
            }
        }
        return directories;
    }
}
