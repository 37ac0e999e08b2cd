package work.lcod.twine.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.twine.shared.Values;

/**
 * Recursive-descent parser for macro value expressions.
 *
 * <pre>
 * expression     := additive EOF
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/' | '%') unary)*
 * unary          := '-' unary | possessive
 * possessive     := primary ("'s" primary)*
 * primary        := NUMBER | STRING | VARIABLE | 'true' | 'false' | 'it'
 *                 | '(' additive ')' | MACRO [additive (',' additive)*] ')'
 * </pre>
 */
public final class ExpressionParser {
    private final List<Token> tokens;
    private final int sourceLength;
    private int index;

    private ExpressionParser(List<Token> tokens, int sourceLength) {
        this.tokens = tokens;
        this.sourceLength = sourceLength;
    }

    public static Expr parse(String source) {
        var text = source == null ? "" : source;
        return new ExpressionParser(ExpressionLexer.tokenize(text), text.length()).parseExpression();
    }

    public static Optional<Expr> tryParse(String source) {
        try {
            return Optional.of(parse(source));
        } catch (ExpressionSyntaxException ex) {
            return Optional.empty();
        }
    }

    private Expr parseExpression() {
        if (tokens.isEmpty()) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        var expr = additive();
        if (index < tokens.size()) {
            var extra = tokens.get(index);
            throw new ExpressionSyntaxException("Unexpected token '" + extra.text() + "'", extra.start());
        }
        return expr;
    }

    private Expr additive() {
        var left = multiplicative();
        while (peekOperator("+") || peekOperator("-")) {
            var operator = next().value();
            left = new Expr.BinaryOp(operator, left, multiplicative());
        }
        return left;
    }

    private Expr multiplicative() {
        var left = unary();
        while (peekOperator("*") || peekOperator("/") || peekOperator("%")) {
            var operator = next().value();
            left = new Expr.BinaryOp(operator, left, unary());
        }
        return left;
    }

    private Expr unary() {
        if (peekOperator("-")) {
            next();
            var operand = unary();
            if (operand instanceof Expr.NumberLiteral literal) {
                return new Expr.NumberLiteral(negate(literal.value()));
            }
            return new Expr.Negate(operand);
        }
        return possessive();
    }

    private Expr possessive() {
        var target = primary();
        while (peek(Token.Type.POSSESSIVE)) {
            next();
            target = new Expr.Possessive(target, primary());
        }
        return target;
    }

    private Expr primary() {
        if (index >= tokens.size()) {
            throw new ExpressionSyntaxException("Unexpected end of expression", sourceLength);
        }
        var token = next();
        switch (token.type()) {
            case NUMBER:
                return new Expr.NumberLiteral(Values.parseNumber(token.value()));
            case STRING:
                return new Expr.TextLiteral(token.value());
            case VARIABLE:
                return new Expr.VariableRef(token.value());
            case IDENT:
                if (token.isWord("true")) {
                    return new Expr.BooleanLiteral(true);
                }
                if (token.isWord("false")) {
                    return new Expr.BooleanLiteral(false);
                }
                if (token.isWord("it")) {
                    return new Expr.ItRef();
                }
                throw new ExpressionSyntaxException("Unexpected word '" + token.text() + "'", token.start());
            case LPAREN: {
                var inner = additive();
                expect(Token.Type.RPAREN);
                return inner;
            }
            case MACRO:
                return macroCall(token);
            default:
                throw new ExpressionSyntaxException("Unexpected token '" + token.text() + "'", token.start());
        }
    }

    private Expr macroCall(Token opening) {
        List<Expr> args = new ArrayList<>();
        if (peek(Token.Type.RPAREN)) {
            next();
            return new Expr.MacroCall(opening.value(), args);
        }
        args.add(additive());
        while (peek(Token.Type.COMMA)) {
            next();
            args.add(additive());
        }
        expect(Token.Type.RPAREN);
        return new Expr.MacroCall(opening.value(), args);
    }

    private static Number negate(Number value) {
        if (value instanceof Long l) {
            return -l;
        }
        return -value.doubleValue();
    }

    private boolean peek(Token.Type type) {
        return index < tokens.size() && tokens.get(index).is(type);
    }

    private boolean peekOperator(String symbol) {
        return index < tokens.size() && tokens.get(index).isOperator(symbol);
    }

    private Token next() {
        return tokens.get(index++);
    }

    private void expect(Token.Type type) {
        if (!peek(type)) {
            int position = index < tokens.size() ? tokens.get(index).start() : sourceLength;
            throw new ExpressionSyntaxException("Expected " + type, position);
        }
        index++;
    }
}
