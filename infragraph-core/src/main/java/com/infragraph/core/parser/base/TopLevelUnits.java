package com.infragraph.core.parser.base;

import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Splits a token stream into top-level statements so each one is parsed on its own.
 *
 * <p>A statement ends at a newline outside any bracket pair. Statements whose line
 * starts with the continuation token (a decorator) run on into the next line. When
 * the input ends inside an open bracket, the statement in progress is dropped and
 * its innermost open token is reported instead.
 *
 * <p>Parsing statements one by one keeps a malformed block from swallowing the
 * blocks after it.
 */
public final class TopLevelUnits {

    /**
     * Split outcome.
     *
     * @param units token lists, one per top-level statement, without trailing newline
     * @param unclosed innermost open bracket at end of input, or null
     * @param unclosedUnit tokens of the statement left open at end of input, empty when
     *                     {@code unclosed} is null
     */
    public record Split(List<List<Token>> units, Token unclosed, List<Token> unclosedUnit) {
    }

    private final int newlineType;
    private final Map<Integer, Integer> closerByOpener;
    private final int continuationType;

    /**
     * @param newlineType token type of a significant newline
     * @param closerByOpener closing token type for each opening token type
     * @param continuationType token type that continues a statement on the next line,
     *                         or {@link Token#INVALID_TYPE} for none
     */
    public TopLevelUnits(int newlineType, Map<Integer, Integer> closerByOpener, int continuationType) {
        this.newlineType = newlineType;
        this.closerByOpener = Map.copyOf(closerByOpener);
        this.continuationType = continuationType;
    }

    public Split split(List<? extends Token> tokens) {
        List<List<Token>> units = new ArrayList<>();
        Deque<Token> open = new ArrayDeque<>();
        List<Token> current = new ArrayList<>();
        boolean lineStart = true;
        boolean continued = false;

        for (Token token : tokens) {
            int type = token.getType();
            if (type == newlineType) {
                lineStart = true;
                if (!open.isEmpty() || (continued && !current.isEmpty())) {
                    current.add(token);
                } else if (!current.isEmpty()) {
                    units.add(current);
                    current = new ArrayList<>();
                }
                continue;
            }
            if (lineStart && open.isEmpty()) {
                continued = type == continuationType;
            }
            lineStart = false;
            if (closerByOpener.containsKey(type)) {
                open.push(token);
            } else if (!open.isEmpty() && closerByOpener.get(open.peek().getType()) == type) {
                open.pop();
            }
            current.add(token);
        }

        if (!open.isEmpty()) {
            return new Split(units, open.peek(), current);
        }
        if (!current.isEmpty()) {
            units.add(current);
        }
        return new Split(units, null, List.of());
    }

    /**
     * Converts an ANTLR code point index into a {@link String} character index.
     *
     * @param text the lexed text
     * @param codePointIndex index in code points
     * @return character index, clamped to the text length
     */
    public static int charIndex(String text, int codePointIndex) {
        int codePoints = text.codePointCount(0, text.length());
        if (codePointIndex >= codePoints) {
            return text.length();
        }
        return text.offsetByCodePoints(0, Math.max(codePointIndex, 0));
    }
}
