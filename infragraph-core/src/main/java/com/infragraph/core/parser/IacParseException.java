package com.infragraph.core.parser;

/**
 * Syntax error raised inside a parser.
 *
 * <p>Parsers catch this per resource block (or per document) and turn it into a
 * {@link com.infragraph.core.diagnostic.Diagnostic}; it never escapes
 * {@link IacParser#parse(IacDocument)}.
 */
public class IacParseException extends Exception {

    private final long offset;

    public IacParseException(String message, long offset) {
        super(message);
        this.offset = offset;
    }

    public IacParseException(String message, long offset, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }

    /**
     * Returns the byte offset of the error, or {@code -1} when unknown.
     *
     * @return byte offset
     */
    public long getOffset() {
        return offset;
    }
}
