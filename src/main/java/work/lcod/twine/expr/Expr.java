package work.lcod.twine.expr;

import java.util.List;

/**
 * Expression AST produced by {@link ExpressionParser}.
 */
public interface Expr {

    record NumberLiteral(Number value) implements Expr {}

    record TextLiteral(String value) implements Expr {}

    record BooleanLiteral(boolean value) implements Expr {}

    /** {@code $name}. */
    record VariableRef(String name) implements Expr {}

    /** {@code it}: the variable being assigned. */
    record ItRef() implements Expr {}

    record Negate(Expr operand) implements Expr {}

    record BinaryOp(String operator, Expr left, Expr right) implements Expr {}

    /** {@code (name: args...)}. */
    record MacroCall(String name, List<Expr> args) implements Expr {
        public MacroCall {
            args = List.copyOf(args);
        }

        public boolean is(String macroName) {
            return name.equals(macroName);
        }
    }

    /** {@code target's selector}, 1-indexed when the selector is numeric. */
    record Possessive(Expr target, Expr selector) implements Expr {}
}
