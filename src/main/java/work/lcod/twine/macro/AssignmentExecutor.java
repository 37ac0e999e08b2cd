package work.lcod.twine.macro;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.twine.expr.Expr;
import work.lcod.twine.expr.ExpressionLexer;
import work.lcod.twine.expr.ExpressionParser;
import work.lcod.twine.expr.Token;
import work.lcod.twine.expr.ValueEvaluator;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.shared.SpanScanner;
import work.lcod.twine.shared.Values;

/**
 * Executes {@code (set: $name to value)} commands against the live store.
 *
 * <p>Plain values are resolved by the first matching rule: collection concatenation
 * ({@code $src + (a: ...)} / {@code $src + (dm: ...)}), array literal, map literal (always empty),
 * number, boolean, then text with quotes stripped. Commands shaped like
 * {@code $x to ($y|it) <op> ($z|n)} are arithmetic and take priority.
 */
public final class AssignmentExecutor {
    public static final String OPENING = "(set:";

    private static final Pattern COMMAND = Pattern.compile("\\$?(\\w+)\\s+to\\s+(.+)", Pattern.DOTALL);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"");

    private final ExecutionContext ctx;
    private final List<ValueRule> valueRules;

    public AssignmentExecutor(ExecutionContext ctx) {
        this.ctx = ctx;
        this.valueRules = List.of(
            this::concatenation,
            this::arrayLiteral,
            this::mapLiteral,
            this::numberLiteral,
            this::booleanLiteral
        );
    }

    @FunctionalInterface
    private interface ValueRule {
        Optional<Object> resolve(String valueText);
    }

    /**
     * Runs one command body (the text between {@code (set:} and its closing parenthesis).
     * Commands outside the grammar are ignored.
     */
    public void execute(String command) {
        var matcher = COMMAND.matcher(command == null ? "" : command);
        if (!matcher.find()) {
            ctx.trace("SET", "Ignoring malformed command: " + command);
            return;
        }
        var name = matcher.group(1);
        if (isArithmetic(command)) {
            executeArithmetic(name, matcher);
            return;
        }
        var value = resolveValue(matcher.group(2).trim());
        ctx.store().set(name, value);
        ctx.trace("SET", name + " = " + Values.render(value));
    }

    /**
     * Executes and removes the {@code (set:)} commands that are not inside a hook, together with
     * wrapping braces. Commands inside hooks are left for the branch that owns them.
     */
    public String executeTopLevel(String content) {
        return executeAndRemove(content, true, false);
    }

    /**
     * Executes and removes every {@code (set:)} command in a selected branch body, together with
     * wrapping braces and one trailing newline.
     */
    public String executeAll(String content) {
        return executeAndRemove(content, false, true);
    }

    private String executeAndRemove(String content, boolean topLevelOnly, boolean eatNewline) {
        var result = new StringBuilder(content);
        int index = 0;
        while (index < result.length()) {
            int found = result.indexOf(OPENING, index);
            if (found < 0) {
                break;
            }
            var text = result.toString();
            if (topLevelOnly && SpanScanner.bracketDepthAt(text, found) > 0) {
                index = found + OPENING.length();
                continue;
            }
            var span = SpanScanner.macroAt(text, found, OPENING);
            if (span.isEmpty()) {
                break;
            }
            execute(span.get().content(text).trim());

            int start = found;
            int end = span.get().end();
            if (start > 0 && text.charAt(start - 1) == '{') {
                start--;
            }
            if (end < text.length() && text.charAt(end) == '}') {
                end++;
            }
            if (eatNewline && end < text.length() && text.charAt(end) == '\n') {
                end++;
            }
            result.delete(start, end);
            index = start;
        }
        return result.toString();
    }

    /**
     * True for {@code $x to ($y|it) <op> ($z|n)} with {@code op} one of {@code + - * /}.
     */
    public static boolean isArithmetic(String command) {
        var tokens = arithmeticTokens(command);
        return tokens.isPresent();
    }

    private static Optional<List<Token>> arithmeticTokens(String command) {
        var tokens = ExpressionLexer.tokenize(command);
        for (int i = 0; i + 4 < tokens.size(); i++) {
            var target = tokens.get(i);
            var to = tokens.get(i + 1);
            var source = tokens.get(i + 2);
            var operator = tokens.get(i + 3);
            var operand = tokens.get(i + 4);
            if (target.is(Token.Type.VARIABLE)
                && to.isWord("to")
                && (source.is(Token.Type.VARIABLE) || source.isWord("it"))
                && operator.is(Token.Type.OPERATOR) && "+-*/".contains(operator.value())
                && (operand.is(Token.Type.VARIABLE) || operand.is(Token.Type.NUMBER))) {
                return Optional.of(tokens.subList(i, i + 5));
            }
        }
        return Optional.empty();
    }

    private void executeArithmetic(String name, Matcher matcher) {
        var evaluator = ValueEvaluator.forAssignment(ctx, name);
        var expression = ExpressionParser.tryParse(matcher.group(2).trim())
            .or(() -> arithmeticTokens(matcher.group(0)).map(tokens -> leadingTerm(matcher.group(0), tokens)));
        if (expression.isEmpty()) {
            ctx.trace("SET", "Unparseable arithmetic for " + name + ": " + matcher.group(2).trim());
            return;
        }
        var result = evaluator.number(expression.get());
        if (result == null) {
            ctx.trace("SET", "Arithmetic for " + name + " has no result, value left unchanged");
            return;
        }
        ctx.store().set(name, result);
        ctx.trace("SET", name + " = " + Values.render(result));
    }

    private static Expr leadingTerm(String command, List<Token> tokens) {
        var source = tokens.get(2);
        var operand = tokens.get(4);
        return ExpressionParser.parse(command.substring(source.start(), operand.end()));
    }

    private Object resolveValue(String valueText) {
        for (var rule : valueRules) {
            var value = rule.resolve(valueText);
            if (value.isPresent()) {
                return value.get();
            }
        }
        return valueText.replace("\"", "").replace("'", "");
    }

    private Optional<Object> concatenation(String valueText) {
        var tokens = ExpressionLexer.tokenize(valueText);
        if (tokens.size() < 3
            || !tokens.get(0).is(Token.Type.VARIABLE)
            || !tokens.get(1).isOperator("+")
            || !tokens.get(2).is(Token.Type.MACRO)) {
            return Optional.empty();
        }
        var macro = tokens.get(2);
        if (!"a".equals(macro.value()) && !"dm".equals(macro.value())) {
            return Optional.empty();
        }
        var span = SpanScanner.macroAt(valueText, macro.start(), macro.text());
        if (span.isEmpty() || span.get().end() != valueText.length()) {
            return Optional.empty();
        }
        var items = quotedItems(span.get().content(valueText));
        var source = tokens.get(0).value();
        if ("a".equals(macro.value())) {
            var list = ctx.store().listOrEmpty(source);
            list.addAll(items);
            return Optional.of(list);
        }
        var map = ctx.store().mapOrEmpty(source);
        putPairs(map, items);
        return Optional.of(map);
    }

    private Optional<Object> arrayLiteral(String valueText) {
        var tokens = ExpressionLexer.tokenize(valueText);
        if (tokens.isEmpty() || !tokens.get(0).is(Token.Type.MACRO) || !"a".equals(tokens.get(0).value())) {
            return Optional.empty();
        }
        var span = SpanScanner.macroAt(valueText, 0, tokens.get(0).text());
        if (span.isEmpty()) {
            return Optional.of(new ArrayList<>());
        }
        return Optional.of(new ArrayList<Object>(quotedItems(span.get().content(valueText))));
    }

    private Optional<Object> mapLiteral(String valueText) {
        var tokens = ExpressionLexer.tokenize(valueText);
        if (tokens.isEmpty() || !tokens.get(0).is(Token.Type.MACRO) || !"dm".equals(tokens.get(0).value())) {
            return Optional.empty();
        }
        return Optional.of(new LinkedHashMap<String, Object>());
    }

    private Optional<Object> numberLiteral(String valueText) {
        return Optional.ofNullable(Values.parseNumber(valueText));
    }

    private Optional<Object> booleanLiteral(String valueText) {
        if ("true".equals(valueText)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equals(valueText)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    private static List<String> quotedItems(String text) {
        List<String> items = new ArrayList<>();
        var matcher = QUOTED.matcher(text);
        while (matcher.find()) {
            items.add(matcher.group(1));
        }
        return items;
    }

    // trailing unpaired item is dropped
    private static void putPairs(Map<String, Object> map, List<String> items) {
        for (int i = 0; i + 1 < items.size(); i += 2) {
            map.put(items.get(i), items.get(i + 1));
        }
    }
}
