package com.infragraph.core.parser.base;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

import java.util.Optional;
import java.util.function.Function;

/**
 * ANTLR error listener that keeps the first syntax error of one parse.
 *
 * <p>Later errors of the same parse are cascades of the first one and are dropped.
 * Offsets are code point indexes into the lexer input, see
 * {@link TopLevelUnits#charIndex(String, int)}.
 */
public final class SyntaxErrorCollector extends BaseErrorListener {

    /**
     * Syntax problem found while reading.
     *
     * @param offset code point index of the offending input
     * @param message description including line and column
     */
    public record SyntaxError(int offset, String message) {
    }

    private final Function<Token, String> describer;
    private SyntaxError first;

    /**
     * @param describer returns a description for special error tokens, or null to keep
     *                  the ANTLR message
     */
    public SyntaxErrorCollector(Function<Token, String> describer) {
        this.describer = describer;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        if (first != null) {
            return;
        }
        int offset = 0;
        String description = msg;
        if (offendingSymbol instanceof Token token) {
            offset = token.getStartIndex();
            String special = describer.apply(token);
            if (special != null) {
                description = special;
            }
        } else if (recognizer instanceof Lexer lexer) {
            offset = lexer._tokenStartCharIndex;
        }
        first = new SyntaxError(Math.max(offset, 0),
            description + " at line " + line + ", column " + (charPositionInLine + 1));
    }

    public Optional<SyntaxError> firstError() {
        return Optional.ofNullable(first);
    }
}
