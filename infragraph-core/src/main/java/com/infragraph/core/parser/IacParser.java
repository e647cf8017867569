package com.infragraph.core.parser;

import com.infragraph.core.model.Dialect;

import java.util.Set;

/**
 * Extracts declared resources and explicit dependency hints from one IaC dialect.
 *
 * <p>Parsers are discovered via Java Service Provider Interface (SPI). Each dialect has
 * exactly one implementation; implementations share helpers through
 * {@link com.infragraph.core.parser.base.AbstractParser} but never extend one another.
 *
 * <p>Parsers are stateless and thread-safe: the pipeline may call
 * {@link #parse(IacDocument)} for several documents concurrently.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.infragraph.core.parser.IacParser}
 *
 * @see ParseResult
 * @see ParserRegistry
 */
public interface IacParser {

    /**
     * Returns unique identifier for this parser (kebab-case, e.g. "terraform-hcl").
     *
     * @return parser identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this parser.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the dialect this parser handles.
     *
     * @return dialect
     */
    Dialect getDialect();

    /**
     * Returns glob patterns of file names written in this parser's dialect.
     *
     * <p>Used by callers to detect a document's dialect; the parser itself never
     * touches the file system.
     *
     * @return glob patterns matched against the file name
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Parses one document.
     *
     * <p>Must not throw for malformed input: syntax problems are reported as
     * diagnostics on the returned result, together with every resource that could
     * still be extracted.
     *
     * @param document document to parse
     * @return extracted resources, hints and diagnostics
     */
    ParseResult parse(IacDocument document);
}
