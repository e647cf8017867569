package com.infragraph.cli;

import com.infragraph.core.config.Limits;
import com.infragraph.core.model.Dialect;
import com.infragraph.core.parser.IacDocument;
import com.infragraph.core.parser.ParserRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Collects IaC documents from files and directories, enforcing {@link Limits}.
 *
 * <p>Directories are walked recursively; a file is picked up when a registered parser
 * claims its name. Files are sorted by path, capped at {@code maxFiles}, and each read
 * is truncated to {@code maxBytesPerFile}.
 */
public class InputCollector {

    private static final Logger log = LoggerFactory.getLogger(InputCollector.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(".git", ".terraform", "node_modules", "target", "build");

    private final ParserRegistry registry;
    private final Limits limits;

    public InputCollector(ParserRegistry registry, Limits limits) {
        this.registry = registry;
        this.limits = limits;
    }

    /**
     * Collects documents.
     *
     * @param inputs files and directories
     * @return documents in path order
     * @throws IOException if a directory cannot be walked or a file cannot be read
     */
    public List<IacDocument> collect(List<Path> inputs) throws IOException {
        TreeMap<String, DetectedFile> files = new TreeMap<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                walk(input, files);
            } else if (Files.isRegularFile(input)) {
                Optional<Dialect> dialect = registry.detectDialect(input);
                if (dialect.isPresent()) {
                    files.put(normalize(input), new DetectedFile(input, dialect.get()));
                } else {
                    log.warn("No parser recognizes {}, skipping", input);
                }
            } else {
                log.warn("Input not found: {}", input);
            }
        }

        if (files.size() > limits.maxFiles()) {
            log.warn("Found {} IaC files, only the first {} are read", files.size(), limits.maxFiles());
        }
        List<IacDocument> documents = new ArrayList<>();
        for (var entry : files.entrySet()) {
            if (documents.size() >= limits.maxFiles()) {
                break;
            }
            DetectedFile file = entry.getValue();
            documents.add(new IacDocument(entry.getKey(), file.dialect(), read(file.path())));
        }
        log.info("Collected {} documents", documents.size());
        return documents;
    }

    private void walk(Path root, TreeMap<String, DetectedFile> files) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile)
                .filter(path -> !isInSkippedDirectory(root, path))
                .forEach(path -> registry.detectDialect(path)
                    .ifPresent(dialect -> files.put(normalize(path), new DetectedFile(path, dialect))));
        }
    }

    private byte[] read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] content = in.readNBytes(limits.maxBytesPerFile());
            if (in.read() != -1) {
                log.warn("{} exceeds {} bytes, truncated", path, limits.maxBytesPerFile());
            }
            return content;
        }
    }

    private static boolean isInSkippedDirectory(Path root, Path path) {
        Path relative = root.relativize(path);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (SKIPPED_DIRECTORIES.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(Path path) {
        return path.normalize().toString().replace('\\', '/');
    }

    private record DetectedFile(Path path, Dialect dialect) {}
}
