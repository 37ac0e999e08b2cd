package work.lcod.twine.macro;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.twine.expr.ExpressionEvaluator;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.shared.SpanScanner;

/**
 * Reduces {@code (if:)[...](else-if:)[...](else:)[...]} chains and {@code (visited:)} guards.
 *
 * <p>A chain is an {@code (if:)} branch followed by any number of {@code (else-if:)} branches and
 * an optional terminal branch, either {@code (else:)[...]} or a bare {@code [...]}. The first branch
 * whose condition holds is selected; its body is reduced recursively, its {@code (set:)} commands
 * run against the live store and its {@code (print:)} macros are resolved. The whole chain is then
 * replaced by the reduced body (or by nothing when no branch holds).
 */
public final class ConditionalEvaluator {
    public static final String IF = "(if:";
    public static final String ELSE_IF = "(else-if:";
    public static final String ELSE = "(else:)";

    private final ExecutionContext ctx;
    private final ExpressionEvaluator expressions;
    private final AssignmentExecutor assignments;
    private final PrintResolver prints;
    private final VisitedEvaluator visited;

    public ConditionalEvaluator(ExecutionContext ctx) {
        this(ctx, new AssignmentExecutor(ctx), new PrintResolver(ctx));
    }

    public ConditionalEvaluator(ExecutionContext ctx, AssignmentExecutor assignments, PrintResolver prints) {
        this.ctx = ctx;
        this.expressions = new ExpressionEvaluator(ctx);
        this.assignments = assignments;
        this.prints = prints;
        this.visited = new VisitedEvaluator(ctx);
    }

    public String evaluate(String content) {
        var result = resolveChains(content);
        result = visited.resolve(result, this::evaluate);
        return removeOrphans(result);
    }

    private String resolveChains(String content) {
        var result = content;
        for (int iteration = 0; iteration < ctx.maxIterations(); iteration++) {
            int found = result.indexOf(IF);
            if (found < 0) {
                return result;
            }
            var chain = chainAt(result, found);
            if (chain.isEmpty()) {
                return result;
            }
            var replacement = reduce(select(chain.get()));
            result = result.substring(0, chain.get().start()) + replacement + result.substring(chain.get().end());
        }
        if (result.contains(IF)) {
            ctx.trace("CONDITIONAL", "Iteration cap of " + ctx.maxIterations() + " reached, leaving remaining chains");
        }
        return result;
    }

    /**
     * Collects the chain whose {@code (if:} starts at {@code start}; empty when the condition or its
     * hook is unbalanced.
     */
    Optional<ConditionalChain> chainAt(String text, int start) {
        var condition = SpanScanner.macroAt(text, start, IF);
        if (condition.isEmpty()) {
            return Optional.empty();
        }
        var hook = SpanScanner.hookFrom(text, condition.get().end());
        if (hook.isEmpty()) {
            return Optional.empty();
        }
        List<Branch> branches = new ArrayList<>();
        branches.add(new Branch(condition.get().content(text).trim(), hook.get().content(text)));
        int cursor = hook.get().end();

        while (cursor < text.length()) {
            int position = SpanScanner.skipWhitespace(text, cursor);
            if (text.startsWith(ELSE_IF, position)) {
                var elseIf = SpanScanner.macroAt(text, position, ELSE_IF);
                var elseIfHook = elseIf.flatMap(span -> SpanScanner.hookFrom(text, span.end()));
                if (elseIfHook.isPresent()) {
                    branches.add(new Branch(elseIf.get().content(text).trim(), elseIfHook.get().content(text)));
                    cursor = elseIfHook.get().end();
                    continue;
                }
            }
            var terminal = terminalHookAt(text, position);
            if (terminal.isPresent()) {
                branches.add(new Branch(null, terminal.get().content(text)));
                cursor = terminal.get().end();
            }
            break;
        }
        return Optional.of(new ConditionalChain(start, cursor, branches));
    }

    private static Optional<SpanScanner.Span> terminalHookAt(String text, int position) {
        if (text.startsWith(ELSE, position)) {
            return SpanScanner.hookAt(text, SpanScanner.skipWhitespace(text, position + ELSE.length()));
        }
        boolean bareHook = position < text.length() && text.charAt(position) == '['
            && (position + 1 >= text.length() || text.charAt(position + 1) != '[');
        return bareHook ? SpanScanner.hookAt(text, position) : Optional.empty();
    }

    private String select(ConditionalChain chain) {
        for (var branch : chain.branches()) {
            if (branch.isElse()) {
                return branch.body();
            }
            boolean holds = expressions.evaluate(branch.condition());
            ctx.trace("CONDITIONAL", "Evaluating: \"" + branch.condition() + "\" => " + holds);
            if (holds) {
                return branch.body();
            }
        }
        return "";
    }

    private String reduce(String body) {
        var reduced = evaluate(body);
        reduced = assignments.executeAll(reduced);
        return prints.resolve(reduced);
    }

    /**
     * Drops {@code (else:)[...]} and {@code (else-if: ...)[...]} spans left without an
     * {@code (if:)}. Stops at the first unbalanced span.
     */
    String removeOrphans(String content) {
        var result = content;
        while (true) {
            int found = result.indexOf(ELSE + "[");
            if (found < 0) {
                break;
            }
            var hook = SpanScanner.hookAt(result, found + ELSE.length());
            if (hook.isEmpty()) {
                break;
            }
            result = result.substring(0, found) + result.substring(hook.get().end());
        }
        while (true) {
            int found = result.indexOf(ELSE_IF);
            if (found < 0) {
                break;
            }
            var condition = SpanScanner.macroAt(result, found, ELSE_IF);
            var text = result;
            var hook = condition.flatMap(span -> SpanScanner.hookFrom(text, span.end()));
            if (hook.isEmpty()) {
                break;
            }
            result = result.substring(0, found) + result.substring(hook.get().end());
        }
        return result;
    }

    /**
     * One condition/body pair; {@code condition} is {@code null} for an else branch.
     */
    public record Branch(String condition, String body) {
        public boolean isElse() {
            return condition == null;
        }
    }

    /**
     * Branches of one chain spanning {@code [start, end)} in the content it was read from.
     */
    public record ConditionalChain(int start, int end, List<Branch> branches) {
        public ConditionalChain {
            branches = List.copyOf(branches);
        }
    }
}
