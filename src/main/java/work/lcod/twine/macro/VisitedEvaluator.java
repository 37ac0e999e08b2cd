package work.lcod.twine.macro;

import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.shared.SpanScanner;

/**
 * Resolves {@code (visited: arg)[body]} guards against the visit log.
 *
 * <p>{@code arg} is a passage name (quoted or bare) or {@code where its tags contains "x"}, which
 * holds when any visited passage carries a tag containing {@code x}.
 */
public final class VisitedEvaluator {
    public static final String OPENING = "(visited:";

    private static final Pattern TAGS_CONTAINS = Pattern.compile("its\\s+tags\\s+contains\\s+\"([^\"]+)\"");

    private final ExecutionContext ctx;

    public VisitedEvaluator(ExecutionContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Replaces each guard with its body (passed through {@code bodyReducer}) when the guard holds,
     * with nothing otherwise. Stops at the first unbalanced guard or after the iteration cap.
     */
    public String resolve(String content, UnaryOperator<String> bodyReducer) {
        var result = content;
        for (int iteration = 0; iteration < ctx.maxIterations(); iteration++) {
            int found = result.indexOf(OPENING);
            if (found < 0) {
                return result;
            }
            var guard = SpanScanner.macroAt(result, found, OPENING);
            if (guard.isEmpty()) {
                return result;
            }
            var hook = SpanScanner.hookFrom(result, guard.get().end());
            if (hook.isEmpty()) {
                return result;
            }
            var arg = guard.get().content(result).trim();
            boolean visited = isVisited(arg);
            ctx.trace("VISITED", "Evaluating: \"" + arg + "\" => " + visited);
            var replacement = visited ? bodyReducer.apply(hook.get().content(result)) : "";
            result = result.substring(0, found) + replacement + result.substring(hook.get().end());
        }
        if (result.contains(OPENING)) {
            ctx.trace("VISITED", "Iteration cap of " + ctx.maxIterations() + " reached, leaving remaining guards");
        }
        return result;
    }

    public boolean isVisited(String arg) {
        var trimmed = arg.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return ctx.visitLog().contains(trimmed.substring(1, trimmed.length() - 1));
        }
        if (trimmed.startsWith("where ")) {
            var condition = trimmed.substring("where ".length()).trim();
            for (var passageName : ctx.visitLog().entries()) {
                if (matches(passageName, condition)) {
                    return true;
                }
            }
            return false;
        }
        return ctx.visitLog().contains(trimmed);
    }

    private boolean matches(String passageName, String condition) {
        var matcher = TAGS_CONTAINS.matcher(condition);
        if (!matcher.find()) {
            return false;
        }
        var wanted = matcher.group(1);
        return ctx.tagLookup().tagsOf(passageName).stream().anyMatch(tag -> tag.contains(wanted));
    }
}
