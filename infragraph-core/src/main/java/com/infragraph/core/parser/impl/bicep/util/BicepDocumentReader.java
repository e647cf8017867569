package com.infragraph.core.parser.impl.bicep.util;

import com.infragraph.core.model.UnresolvedReference;
import com.infragraph.core.parser.base.SyntaxErrorCollector;
import com.infragraph.core.parser.base.SyntaxErrorCollector.SyntaxError;
import com.infragraph.core.parser.base.TopLevelUnits;
import com.infragraph.parser.BicepBaseVisitor;
import com.infragraph.parser.BicepLexer;
import com.infragraph.parser.BicepParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.RuleNode;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the declarations of a Bicep file using the ANTLR-generated {@link BicepParser}.
 *
 * <p>Extracted:
 * <ul>
 *   <li>{@code resource <sym> '<type>@<api>' [existing] = {...}}, including the
 *       {@code = if (...) {...}} and {@code = [for ...: {...}]} forms</li>
 *   <li>child resources declared inside a parent body; their short type is prefixed
 *       with the parent type and they inherit the parent API version</li>
 *   <li>{@code param}, {@code var}, {@code output}, {@code module}, {@code type} and
 *       {@code func} names, reported as symbols</li>
 * </ul>
 *
 * <p>Objects, arrays, strings, numbers, booleans and {@code null} become Java values;
 * any other expression is kept verbatim as an {@link UnresolvedReference}. Each
 * top-level statement is parsed on its own, so a malformed resource costs one
 * {@link SyntaxError} and the statements around it are kept.
 */
public final class BicepDocumentReader {

    private static final TopLevelUnits UNITS = new TopLevelUnits(BicepLexer.NL, Map.of(
        BicepLexer.LBRACE, BicepLexer.RBRACE,
        BicepLexer.LBRACKET, BicepLexer.RBRACKET,
        BicepLexer.LPAREN, BicepLexer.RPAREN), BicepLexer.AT);

    private BicepDocumentReader() {
    }

    /**
     * One resource declaration.
     *
     * @param symbol symbolic name
     * @param type full resource type without API version
     * @param apiVersion API version, empty when absent
     * @param existing true for {@code existing} references
     * @param body property tree
     * @param parentSymbol enclosing resource symbol for child declarations, else null
     * @param offset character index of the {@code resource} keyword
     */
    public record Declaration(
        String symbol,
        String type,
        String apiVersion,
        boolean existing,
        Map<String, Object> body,
        String parentSymbol,
        int offset
    ) {
    }

    /**
     * Read outcome.
     *
     * @param resources resource declarations in source order (children after parents)
     * @param symbols names of parameters, variables, outputs, modules, types and functions
     * @param errors syntax errors with character offsets
     */
    public record Result(List<Declaration> resources, Set<String> symbols, List<SyntaxError> errors) {
    }

    /**
     * Reads all declarations of the text.
     *
     * @param text Bicep source
     * @return declarations, symbols and syntax errors
     */
    public static Result read(String text) {
        BicepLexer lexer = new BicepLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        SyntaxErrorCollector lexerErrors = new SyntaxErrorCollector(BicepDocumentReader::describe);
        lexer.addErrorListener(lexerErrors);
        List<? extends Token> tokens = lexer.getAllTokens();

        List<Declaration> resources = new ArrayList<>();
        Set<String> symbols = new LinkedHashSet<>();
        List<SyntaxError> errors = new ArrayList<>();
        lexerErrors.firstError().ifPresent(error -> errors.add(atCharIndex(text, error)));

        TopLevelUnits.Split split = UNITS.split(tokens);
        for (List<Token> unit : split.units()) {
            BicepParser parser = new BicepParser(new CommonTokenStream(new ListTokenSource(unit)));
            parser.removeErrorListeners();
            SyntaxErrorCollector collector = new SyntaxErrorCollector(BicepDocumentReader::describe);
            parser.addErrorListener(collector);

            BicepParser.StatementContext statement = parser.unit().statement();
            if (collector.firstError().isPresent()) {
                errors.add(atCharIndex(text, collector.firstError().get()));
                continue;
            }
            if (statement.resourceDecl() != null) {
                new DeclarationVisitor(text, resources).visit(statement.resourceDecl());
            } else if (statement.symbolDecl() != null) {
                symbols.add(statement.symbolDecl().identifier().getText());
            }
        }

        if (split.unclosed() != null) {
            errors.add(unclosedError(text, split));
        }
        return new Result(resources, symbols, errors);
    }

    private static String describe(Token token) {
        return switch (token.getType()) {
            case BicepLexer.UNTERMINATED_STRING -> "Unterminated string literal";
            case BicepLexer.ERROR_CHAR -> "Unexpected character '" + token.getText() + "'";
            default -> null;
        };
    }

    private static SyntaxError unclosedError(String text, TopLevelUnits.Split split) {
        for (Token token : split.unclosedUnit()) {
            String description = describe(token);
            if (description != null) {
                return new SyntaxError(TopLevelUnits.charIndex(text, token.getStartIndex()), description
                    + " at line " + token.getLine() + ", column " + (token.getCharPositionInLine() + 1));
            }
        }
        Token open = split.unclosed();
        return new SyntaxError(TopLevelUnits.charIndex(text, open.getStartIndex()),
            "Unexpected end of file: '" + open.getText() + "' opened at line " + open.getLine() + " is not closed");
    }

    private static SyntaxError atCharIndex(String text, SyntaxError error) {
        return new SyntaxError(TopLevelUnits.charIndex(text, error.offset()), error.message());
    }

    /**
     * Enclosing resource of a child declaration.
     */
    private record Owner(String symbol, String type, String apiVersion) {
    }

    /**
     * Collects resource declarations and turns their bodies into Java values.
     */
    private static final class DeclarationVisitor extends BicepBaseVisitor<Object> {

        private final String text;
        private final List<Declaration> resources;
        private final Deque<Owner> owners = new ArrayDeque<>();

        DeclarationVisitor(String text, List<Declaration> resources) {
            this.text = text;
            this.resources = resources;
        }

        @Override
        public Object visitResourceDecl(BicepParser.ResourceDeclContext ctx) {
            String symbol = ctx.symbolName.getText();
            String rawType = BicepStrings.unquote(ctx.resourceType.getText());
            String type = rawType;
            String apiVersion = "";
            int at = rawType.indexOf('@');
            if (at >= 0) {
                type = rawType.substring(0, at);
                apiVersion = rawType.substring(at + 1);
            }
            Owner parent = owners.peek();
            if (parent != null && !type.contains("/")) {
                type = parent.type() + "/" + type;
                if (apiVersion.isEmpty()) {
                    apiVersion = parent.apiVersion();
                }
            }

            // children are visited with the body but listed after their parent
            int index = resources.size();
            owners.push(new Owner(symbol, type, apiVersion));
            Map<String, Object> body = object(bodyObject(ctx.resourceBody()));
            owners.pop();
            resources.add(index, new Declaration(symbol, type, apiVersion, ctx.EXISTING() != null, body,
                parent == null ? null : parent.symbol(),
                TopLevelUnits.charIndex(text, ctx.getStart().getStartIndex())));
            return null;
        }

        private static BicepParser.ObjectContext bodyObject(BicepParser.ResourceBodyContext body) {
            if (body instanceof BicepParser.ConditionalBodyContext conditional) {
                return conditional.object();
            }
            if (body instanceof BicepParser.LoopBodyContext loop) {
                return loop.object();
            }
            return ((BicepParser.ObjectBodyContext) body).object();
        }

        private Map<String, Object> object(BicepParser.ObjectContext ctx) {
            Map<String, Object> entries = new LinkedHashMap<>();
            for (BicepParser.ObjectItemContext item : ctx.objectItem()) {
                if (item.objectProperty() != null) {
                    BicepParser.PropertyKeyContext key = item.objectProperty().key;
                    String name = key.STRING() != null ? BicepStrings.unquote(key.STRING().getText()) : key.getText();
                    entries.put(name, visit(item.objectProperty().value));
                } else if (item.resourceDecl() != null) {
                    visit(item.resourceDecl());
                }
            }
            return entries;
        }

        @Override
        public Object visitPrimaryExpression(BicepParser.PrimaryExpressionContext ctx) {
            return visit(ctx.primary());
        }

        @Override
        public Object visitUnaryExpression(BicepParser.UnaryExpressionContext ctx) {
            if ("-".equals(ctx.op.getText()) && ctx.expression() instanceof BicepParser.PrimaryExpressionContext primary
                && primary.primary() instanceof BicepParser.LiteralPrimaryContext literal
                && literal.literalValue().NUMBER() != null) {
                return number("-" + literal.getText());
            }
            return raw(ctx);
        }

        @Override
        public Object visitLiteralPrimary(BicepParser.LiteralPrimaryContext ctx) {
            BicepParser.LiteralValueContext literal = ctx.literalValue();
            if (literal.NUMBER() != null) {
                return number(literal.getText());
            }
            if (literal.NULL() != null) {
                return null;
            }
            return literal.TRUE() != null;
        }

        @Override
        public Object visitStringPrimary(BicepParser.StringPrimaryContext ctx) {
            return BicepStrings.unquote(ctx.STRING().getText());
        }

        @Override
        public Object visitMultilineStringPrimary(BicepParser.MultilineStringPrimaryContext ctx) {
            return BicepStrings.multiline(ctx.MULTILINE_STRING().getText());
        }

        @Override
        public Object visitObjectPrimary(BicepParser.ObjectPrimaryContext ctx) {
            return object(ctx.object());
        }

        @Override
        public Object visitArrayPrimary(BicepParser.ArrayPrimaryContext ctx) {
            List<Object> items = new ArrayList<>();
            for (BicepParser.ExpressionContext item : ctx.array().expression()) {
                items.add(visit(item));
            }
            return items;
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
            return new UnresolvedReference(ctx.getStart().getInputStream()
                .getText(Interval.of(ctx.getStart().getStartIndex(), ctx.getStop().getStopIndex())));
        }

        private static Object number(String literal) {
            if (literal.indexOf('.') >= 0) {
                return Double.parseDouble(literal);
            }
            try {
                return Long.parseLong(literal);
            } catch (NumberFormatException e) {
                return new BigInteger(literal);
            }
        }
    }
}
