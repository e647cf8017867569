package com.infragraph.core.parser;

import com.infragraph.core.model.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Immutable lookup of parsers by dialect.
 *
 * <p>{@link #load()} discovers parsers through {@link ServiceLoader}; tests can build a
 * registry from explicit instances with {@link #of(Collection)}.
 */
public final class ParserRegistry {

    private static final Logger log = LoggerFactory.getLogger(ParserRegistry.class);

    private final Map<Dialect, IacParser> parsers;

    private ParserRegistry(Map<Dialect, IacParser> parsers) {
        this.parsers = parsers;
    }

    /**
     * Discovers all parsers registered via SPI.
     *
     * @return registry of discovered parsers
     */
    public static ParserRegistry load() {
        List<IacParser> discovered = new ArrayList<>();
        ServiceLoader.load(IacParser.class).forEach(discovered::add);
        log.debug("Discovered {} parsers via ServiceLoader", discovered.size());
        return of(discovered);
    }

    /**
     * Builds a registry from explicit parser instances.
     *
     * @param parsers parsers, at most one per dialect
     * @return registry
     * @throws IllegalArgumentException if two parsers claim the same dialect
     */
    public static ParserRegistry of(Collection<? extends IacParser> parsers) {
        Map<Dialect, IacParser> byDialect = new EnumMap<>(Dialect.class);
        for (IacParser parser : parsers) {
            IacParser previous = byDialect.put(parser.getDialect(), parser);
            if (previous != null) {
                throw new IllegalArgumentException("Two parsers for dialect " + parser.getDialect()
                    + ": " + previous.getId() + ", " + parser.getId());
            }
        }
        return new ParserRegistry(byDialect);
    }

    /**
     * Returns the parser for a dialect.
     *
     * @param dialect dialect
     * @return parser, or empty if none is registered
     */
    public Optional<IacParser> forDialect(Dialect dialect) {
        return Optional.ofNullable(parsers.get(dialect));
    }

    /**
     * Detects a file's dialect from the parsers' file-name patterns.
     *
     * <p>Parsers are tried in dialect declaration order, so the result does not
     * depend on discovery order.
     *
     * @param file file path
     * @return dialect, or empty if no parser claims the file
     */
    public Optional<Dialect> detectDialect(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        for (IacParser parser : all()) {
            for (String pattern : parser.getSupportedFilePatterns()) {
                PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
                if (matcher.matches(fileName)) {
                    return Optional.of(parser.getDialect());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns all registered parsers in dialect order.
     *
     * @return parsers
     */
    public List<IacParser> all() {
        return parsers.values().stream()
            .sorted(Comparator.comparing(IacParser::getDialect))
            .toList();
    }
}
