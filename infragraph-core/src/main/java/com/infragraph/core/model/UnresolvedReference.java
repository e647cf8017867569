package com.infragraph.core.model;

import java.util.Objects;

/**
 * Marker for an attribute value that is an expression rather than a literal.
 *
 * <p>Parsers keep the expression text verbatim (for example {@code aws_vpc.main.id}
 * or {@code vnet.id}) so the reference resolver can inspect it later without
 * re-parsing the document.
 *
 * @param expression raw expression text
 */
public record UnresolvedReference(String expression) {

    public UnresolvedReference {
        Objects.requireNonNull(expression, "expression must not be null");
        expression = expression.strip();
    }

    @Override
    public String toString() {
        return expression;
    }
}
