package com.infragraph.core.parser.impl.terraform.util;

import com.infragraph.core.model.UnresolvedReference;
import com.infragraph.core.parser.base.SyntaxErrorCollector;
import com.infragraph.core.parser.base.SyntaxErrorCollector.SyntaxError;
import com.infragraph.core.parser.base.TopLevelUnits;
import com.infragraph.parser.HclBaseVisitor;
import com.infragraph.parser.HclLexer;
import com.infragraph.parser.HclParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.RuleNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the block structure of an HCL file using the ANTLR-generated {@link HclParser}.
 *
 * <p>Every top-level statement is parsed separately (see {@link TopLevelUnits}), so a
 * malformed block costs one {@link SyntaxError} and the blocks around it are kept.
 * Top-level attributes are parsed but not returned.
 *
 * <p>Block bodies become plain Java values:
 * <ul>
 *   <li>strings and heredocs become {@link String}; {@code ${...}} and {@code %{...}}
 *       sequences stay verbatim</li>
 *   <li>numbers become {@link Long}, {@link BigInteger} or {@link Double}</li>
 *   <li>{@code true}, {@code false} and {@code null} become their Java values</li>
 *   <li>tuples become lists, object constructors become maps</li>
 *   <li>nested blocks become a list of maps under the block type</li>
 *   <li>every other expression (traversals, calls, operators, {@code for}) becomes an
 *       {@link UnresolvedReference} holding its source text</li>
 * </ul>
 */
public final class HclDocumentReader {

    private static final TopLevelUnits UNITS = new TopLevelUnits(HclLexer.NL, Map.of(
        HclLexer.LBRACE, HclLexer.RBRACE,
        HclLexer.LBRACKET, HclLexer.RBRACKET,
        HclLexer.LPAREN, HclLexer.RPAREN), Token.INVALID_TYPE);

    private HclDocumentReader() {
    }

    /**
     * One top-level block.
     *
     * @param type block type, e.g. {@code resource}
     * @param labels block labels in order
     * @param body attributes and nested blocks
     * @param offset character index of the block type
     */
    public record Block(String type, List<String> labels, Map<String, Object> body, int offset) {
    }

    /**
     * Read outcome.
     *
     * @param blocks top-level blocks in source order
     * @param errors syntax errors with character offsets
     */
    public record Result(List<Block> blocks, List<SyntaxError> errors) {
    }

    /**
     * Reads all top-level blocks of the text.
     *
     * @param text HCL source
     * @return blocks and syntax errors
     */
    public static Result read(String text) {
        HclLexer lexer = new HclLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        SyntaxErrorCollector lexerErrors = new SyntaxErrorCollector(HclDocumentReader::describe);
        lexer.addErrorListener(lexerErrors);
        List<? extends Token> tokens = lexer.getAllTokens();

        List<Block> blocks = new ArrayList<>();
        List<SyntaxError> errors = new ArrayList<>();
        lexerErrors.firstError().ifPresent(error -> errors.add(atCharIndex(text, error)));

        TopLevelUnits.Split split = UNITS.split(tokens);
        ValueVisitor values = new ValueVisitor();
        for (List<Token> unit : split.units()) {
            HclParser parser = new HclParser(new CommonTokenStream(new ListTokenSource(unit)));
            parser.removeErrorListeners();
            SyntaxErrorCollector collector = new SyntaxErrorCollector(HclDocumentReader::describe);
            parser.addErrorListener(collector);

            HclParser.UnitContext context = parser.unit();
            if (collector.firstError().isPresent()) {
                errors.add(atCharIndex(text, collector.firstError().get()));
                continue;
            }
            HclParser.BlockContext block = context.bodyItem().block();
            if (block != null) {
                blocks.add(new Block(
                    block.identifier().getText(),
                    labels(block),
                    values.body(block.body()),
                    TopLevelUnits.charIndex(text, block.getStart().getStartIndex())));
            }
        }

        if (split.unclosed() != null) {
            errors.add(unclosedError(text, split));
        }
        return new Result(blocks, errors);
    }

    private static List<String> labels(HclParser.BlockContext block) {
        List<String> labels = new ArrayList<>();
        for (HclParser.BlockLabelContext label : block.blockLabel()) {
            labels.add(label.STRING() != null ? Templates.unquote(label.STRING().getText()) : label.getText());
        }
        return labels;
    }

    private static String describe(Token token) {
        return switch (token.getType()) {
            case HclLexer.UNTERMINATED_STRING -> "Unterminated string literal";
            case HclParser.UNTERMINATED_HEREDOC -> "Unterminated heredoc";
            case HclLexer.ERROR_CHAR -> "Unexpected character '" + token.getText() + "'";
            default -> null;
        };
    }

    private static SyntaxError unclosedError(String text, TopLevelUnits.Split split) {
        // an unterminated literal usually is what swallowed the closing bracket
        for (Token token : split.unclosedUnit()) {
            String description = describe(token);
            if (description != null) {
                return new SyntaxError(TopLevelUnits.charIndex(text, token.getStartIndex()), description
                    + " at line " + token.getLine() + ", column " + (token.getCharPositionInLine() + 1));
            }
        }
        Token open = split.unclosed();
        String what = open.getType() == HclLexer.LBRACE ? "block" : "'" + open.getText() + "'";
        return new SyntaxError(TopLevelUnits.charIndex(text, open.getStartIndex()),
            "Unexpected end of file: " + what + " opened at line " + open.getLine() + " is not closed");
    }

    private static SyntaxError atCharIndex(String text, SyntaxError error) {
        return new SyntaxError(TopLevelUnits.charIndex(text, error.offset()), error.message());
    }

    /**
     * Turns parse trees into maps, lists and scalars.
     */
    private static final class ValueVisitor extends HclBaseVisitor<Object> {

        Map<String, Object> body(HclParser.BodyContext body) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (HclParser.BodyItemContext item : body.bodyItem()) {
                if (item.attribute() != null) {
                    values.put(item.attribute().identifier().getText(), visit(item.attribute().expression()));
                } else {
                    appendNested(values, item.block().identifier().getText(), body(item.block().body()));
                }
            }
            return values;
        }

        @SuppressWarnings("unchecked")
        private static void appendNested(Map<String, Object> values, String name, Map<String, Object> nested) {
            Object existing = values.get(name);
            if (existing instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map<?, ?>) {
                ((List<Object>) list).add(nested);
            } else {
                List<Object> blocks = new ArrayList<>();
                blocks.add(nested);
                values.put(name, blocks);
            }
        }

        @Override
        public Object visitTermExpression(HclParser.TermExpressionContext ctx) {
            return visit(ctx.exprTerm());
        }

        @Override
        public Object visitUnaryExpression(HclParser.UnaryExpressionContext ctx) {
            if ("-".equals(ctx.op.getText()) && ctx.expression() instanceof HclParser.TermExpressionContext term
                && term.exprTerm() instanceof HclParser.LiteralTermContext literal
                && literal.literalValue().NUMBER() != null) {
                return number("-" + literal.getText());
            }
            return raw(ctx);
        }

        @Override
        public Object visitLiteralTerm(HclParser.LiteralTermContext ctx) {
            HclParser.LiteralValueContext literal = ctx.literalValue();
            if (literal.NUMBER() != null) {
                return number(literal.getText());
            }
            if (literal.NULL() != null) {
                return null;
            }
            return literal.TRUE() != null;
        }

        @Override
        public Object visitTemplateTerm(HclParser.TemplateTermContext ctx) {
            if (ctx.STRING() != null) {
                return Templates.unquote(ctx.STRING().getText());
            }
            return Templates.heredoc(ctx.HEREDOC().getText());
        }

        @Override
        public Object visitTupleTerm(HclParser.TupleTermContext ctx) {
            List<Object> items = new ArrayList<>();
            for (HclParser.ExpressionContext item : ctx.tuple().expression()) {
                items.add(visit(item));
            }
            return items;
        }

        @Override
        public Object visitObjectTerm(HclParser.ObjectTermContext ctx) {
            Map<String, Object> entries = new LinkedHashMap<>();
            for (HclParser.ObjectItemContext item : ctx.object().objectItem()) {
                entries.put(key(item.key), visit(item.value));
            }
            return entries;
        }

        private String key(HclParser.ExpressionContext key) {
            if (key instanceof HclParser.TermExpressionContext term) {
                if (term.exprTerm() instanceof HclParser.TemplateTermContext template && template.STRING() != null) {
                    return Templates.unquote(template.STRING().getText());
                }
                if (term.exprTerm() instanceof HclParser.VariableTermContext
                    || term.exprTerm() instanceof HclParser.LiteralTermContext) {
                    return term.getText();
                }
            }
            return source(key);
        }

        @Override
        protected Object defaultResult() {
            return null;
        }

        @Override
        public Object visitChildren(RuleNode node) {
            return node instanceof ParserRuleContext ctx ? raw(ctx) : null;
        }

        private static UnresolvedReference raw(ParserRuleContext ctx) {
            return new UnresolvedReference(source(ctx));
        }

        private static String source(ParserRuleContext ctx) {
            return ctx.getStart().getInputStream()
                .getText(Interval.of(ctx.getStart().getStartIndex(), ctx.getStop().getStopIndex()));
        }

        private static Object number(String text) {
            if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
                return Double.parseDouble(text);
            }
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return new BigInteger(text);
            }
        }
    }
}
