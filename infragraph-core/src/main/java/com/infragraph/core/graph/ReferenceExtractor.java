package com.infragraph.core.graph;

import java.util.function.Consumer;

/**
 * Finds reference expressions in one attribute value of one dialect.
 *
 * <p>Extractors look only at the value they are given; the resolver walks the attribute
 * tree and calls the extractor for every map, list and scalar it visits.
 */
@FunctionalInterface
public interface ReferenceExtractor {

    /**
     * Reports the lookup keys referenced directly by a value.
     *
     * @param value attribute value (map, list, string, number, boolean or unresolved reference)
     * @param sink receives lookup keys, possibly repeated
     */
    void extract(Object value, Consumer<String> sink);
}
