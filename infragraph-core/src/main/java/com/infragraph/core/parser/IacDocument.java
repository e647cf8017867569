package com.infragraph.core.parser;

import com.infragraph.core.model.Dialect;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One infrastructure-as-code document, already read into memory.
 *
 * <p>The buffer may have been truncated by the caller to enforce size limits; parsers
 * accept whatever they are given.
 *
 * @param path document path, used for diagnostics, ordering and environment detection
 * @param dialect declared dialect
 * @param content raw bytes (UTF-8)
 */
public record IacDocument(
    String path,
    Dialect dialect,
    byte[] content
) {
    /**
     * Compact constructor with validation.
     */
    public IacDocument {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        if (content == null) {
            content = new byte[0];
        }
    }

    /**
     * Creates a document from text.
     *
     * @param path document path
     * @param dialect declared dialect
     * @param text document text
     * @return new document
     */
    public static IacDocument of(String path, Dialect dialect, String text) {
        return new IacDocument(path, dialect, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes the content as UTF-8.
     *
     * @return document text
     */
    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /**
     * Returns the file name part of the path.
     *
     * @return file name
     */
    public String fileName() {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IacDocument other)) {
            return false;
        }
        return path.equals(other.path)
            && dialect == other.dialect
            && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, dialect, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "IacDocument[path=" + path + ", dialect=" + dialect + ", bytes=" + content.length + "]";
    }
}
