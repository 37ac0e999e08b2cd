package work.lcod.twine.macro;

import java.util.List;
import java.util.Optional;
import work.lcod.twine.expr.Expr;
import work.lcod.twine.expr.ExpressionParser;
import work.lcod.twine.expr.ValueEvaluator;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.shared.SpanScanner;
import work.lcod.twine.shared.Values;

/**
 * Replaces {@code (print: expr)} macros with their rendered value.
 *
 * <p>Forms, first match wins: anything containing a comparison renders empty; possessive access
 * ({@code $list's (random: a, b)} or {@code $list's N}, 1-indexed); {@code (random: a, b)};
 * arithmetic over numbers and variables; a bare {@code $var}. Everything else renders empty.
 */
public final class PrintResolver {
    public static final String OPENING = "(print:";

    private final ExecutionContext ctx;
    private final List<PrintRule> rules;

    public PrintResolver(ExecutionContext ctx) {
        this.ctx = ctx;
        this.rules = List.of(
            this::possessive,
            this::random,
            this::arithmetic,
            this::variable
        );
    }

    @FunctionalInterface
    private interface PrintRule {
        Optional<String> render(Expr expr);
    }

    public String resolve(String content) {
        var result = new StringBuilder(content);
        int index = 0;
        while (true) {
            int found = result.indexOf(OPENING, index);
            if (found < 0) {
                break;
            }
            var text = result.toString();
            var span = SpanScanner.macroAt(text, found, OPENING);
            if (span.isEmpty()) {
                break;
            }
            var replacement = render(span.get().content(text).trim());
            result.replace(found, span.get().end(), replacement);
            index = found + replacement.length();
        }
        return result.toString();
    }

    /**
     * Rendered text of one print expression.
     */
    public String render(String expression) {
        if (expression.contains("<") || expression.contains(">") || expression.contains("==")) {
            return "";
        }
        var parsed = ExpressionParser.tryParse(expression);
        if (parsed.isEmpty()) {
            return "";
        }
        for (var rule : rules) {
            var rendered = rule.render(parsed.get());
            if (rendered.isPresent()) {
                return rendered.get();
            }
        }
        return "";
    }

    private Optional<String> possessive(Expr expr) {
        if (!(expr instanceof Expr.Possessive possessive)) {
            return Optional.empty();
        }
        var evaluator = ValueEvaluator.forPrint(ctx);
        if (!(evaluator.value(possessive.target()) instanceof List<?>)) {
            return Optional.of("");
        }
        return Optional.of(Values.render(evaluator.value(possessive)));
    }

    private Optional<String> random(Expr expr) {
        if (!(expr instanceof Expr.MacroCall call) || !call.is("random")) {
            return Optional.empty();
        }
        var drawn = ValueEvaluator.forPrint(ctx).random(call);
        return Optional.of(drawn == null ? "" : Values.render(drawn));
    }

    private Optional<String> arithmetic(Expr expr) {
        if (!(expr instanceof Expr.BinaryOp) && !(expr instanceof Expr.Negate)) {
            return Optional.empty();
        }
        var result = ValueEvaluator.forPrint(ctx).number(expr);
        return Optional.of(result == null ? "" : Values.render(result));
    }

    private Optional<String> variable(Expr expr) {
        if (!(expr instanceof Expr.VariableRef ref)) {
            return Optional.empty();
        }
        return Optional.of(Values.render(ctx.store().get(ref.name())));
    }
}
