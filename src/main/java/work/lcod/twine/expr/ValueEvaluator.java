package work.lcod.twine.expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.shared.Arithmetic;
import work.lcod.twine.shared.Values;

/**
 * Evaluates an {@link Expr} against the live store. Undefined or non-numeric operands make an
 * arithmetic result {@code null} unless the evaluator treats them as zero (assignment mode).
 */
public final class ValueEvaluator {
    private final ExecutionContext ctx;
    private final Arithmetic.Division division;
    private final boolean undefinedAsZero;
    private final String itTarget;

    private ValueEvaluator(ExecutionContext ctx, Arithmetic.Division division, boolean undefinedAsZero, String itTarget) {
        this.ctx = ctx;
        this.division = division;
        this.undefinedAsZero = undefinedAsZero;
        this.itTarget = itTarget;
    }

    /** Comparison operands: exact division, undefined fails. */
    public static ValueEvaluator forComparison(ExecutionContext ctx) {
        return new ValueEvaluator(ctx, Arithmetic.Division.EXACT, false, null);
    }

    /** Arithmetic assignment: truncating division, undefined reads as 0, {@code it} is the target. */
    public static ValueEvaluator forAssignment(ExecutionContext ctx, String target) {
        return new ValueEvaluator(ctx, Arithmetic.Division.TRUNCATE, true, target);
    }

    /** Print expressions: truncating division, undefined fails. */
    public static ValueEvaluator forPrint(ExecutionContext ctx) {
        return new ValueEvaluator(ctx, Arithmetic.Division.TRUNCATE, false, null);
    }

    public Object value(Expr expr) {
        if (expr instanceof Expr.NumberLiteral literal) {
            return literal.value();
        }
        if (expr instanceof Expr.TextLiteral literal) {
            return literal.value();
        }
        if (expr instanceof Expr.BooleanLiteral literal) {
            return literal.value();
        }
        if (expr instanceof Expr.VariableRef ref) {
            return ctx.store().get(ref.name());
        }
        if (expr instanceof Expr.ItRef) {
            return itTarget == null ? null : ctx.store().get(itTarget);
        }
        if (expr instanceof Expr.Possessive possessive) {
            return select(value(possessive.target()), possessive.selector());
        }
        if (expr instanceof Expr.MacroCall call) {
            return macro(call);
        }
        if (expr instanceof Expr.Negate || expr instanceof Expr.BinaryOp) {
            return number(expr);
        }
        return null;
    }

    public Number number(Expr expr) {
        if (expr instanceof Expr.BinaryOp op) {
            var left = number(op.left());
            var right = number(op.right());
            return Arithmetic.apply(op.operator(), left, right, division);
        }
        if (expr instanceof Expr.Negate negate) {
            var operand = number(negate.operand());
            return operand == null ? null : Arithmetic.apply("-", 0L, operand, division);
        }
        var resolved = Values.toNumber(value(expr));
        if (resolved == null && undefinedAsZero && (expr instanceof Expr.VariableRef || expr instanceof Expr.ItRef)) {
            return 0L;
        }
        return resolved;
    }

    /**
     * Draws from {@code [min, max]}; {@code null} when either bound is not numeric or the inclusive
     * range does not fit in a {@code long}.
     */
    public Long random(Expr.MacroCall call) {
        if (call.args().size() != 2) {
            return null;
        }
        var min = number(call.args().get(0));
        var max = number(call.args().get(1));
        if (min == null || max == null) {
            return null;
        }
        long low = Math.min(min.longValue(), max.longValue());
        long high = Math.max(min.longValue(), max.longValue());
        if (!hasInclusiveSpan(low, high)) {
            ctx.trace("RANDOM", "Range [" + low + ", " + high + "] is too wide, rendering nothing");
            return null;
        }
        return ctx.random().nextLong(low, high);
    }

    private static boolean hasInclusiveSpan(long low, long high) {
        if (high == Long.MAX_VALUE) {
            return false;
        }
        try {
            Math.addExact(Math.subtractExact(high, low), 1L);
            return true;
        } catch (ArithmeticException ex) {
            return false;
        }
    }

    private Object select(Object target, Expr selector) {
        if (target instanceof List<?> list) {
            var index = number(selector);
            if (index == null || !Values.isIntegral(index)) {
                return null;
            }
            long position = index.longValue();
            if (position < 1 || position > list.size()) {
                return null;
            }
            return list.get((int) position - 1);
        }
        if (target instanceof Map<?, ?> map && selector instanceof Expr.TextLiteral key) {
            return map.get(key.value());
        }
        return null;
    }

    private Object macro(Expr.MacroCall call) {
        if (call.is("random")) {
            return random(call);
        }
        if (call.is("a")) {
            List<Object> items = new ArrayList<>();
            for (var arg : call.args()) {
                items.add(value(arg));
            }
            return items;
        }
        if (call.is("dm")) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i + 1 < call.args().size(); i += 2) {
                map.put(Values.render(value(call.args().get(i))), value(call.args().get(i + 1)));
            }
            return map;
        }
        return null;
    }
}
