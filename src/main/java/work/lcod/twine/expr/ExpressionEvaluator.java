package work.lcod.twine.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.shared.SpanScanner;
import work.lcod.twine.shared.Values;

/**
 * Boolean guard evaluation for {@code (if:)} / {@code (else-if:)} conditions.
 *
 * <p>Rules are tried in a fixed order and the first one that applies decides the result:
 * <ol>
 *   <li>leading {@code not } negates the remainder</li>
 *   <li>an expression wrapped in one balanced {@code (...)} is unwrapped</li>
 *   <li>{@code  and } splits into parts that must all hold (every part is evaluated)</li>
 *   <li>{@code  or } splits into parts of which one must hold (every part is evaluated)</li>
 *   <li>comparison: word operators ({@code is}, {@code is not}, {@code contains},
 *       {@code does not contain}) before {@code >= <= > <}</li>
 *   <li>bare variable reference, read for truthiness; there are no boolean literals here</li>
 * </ol>
 */
public final class ExpressionEvaluator {
    private static final Pattern BARE_REFERENCE = Pattern.compile("\\$?(\\w+)");

    private final ExecutionContext ctx;
    private final List<Rule> rules;

    public ExpressionEvaluator(ExecutionContext ctx) {
        this.ctx = ctx;
        this.rules = List.of(
            this::negation,
            this::group,
            this::conjunction,
            this::disjunction,
            this::comparison
        );
    }

    public boolean evaluate(String expression) {
        var trimmed = expression == null ? "" : expression.trim();
        for (var rule : rules) {
            var outcome = rule.apply(trimmed);
            if (outcome.isPresent()) {
                return outcome.get();
            }
        }
        return bareReference(trimmed);
    }

    @FunctionalInterface
    private interface Rule {
        Optional<Boolean> apply(String expression);
    }

    private Optional<Boolean> negation(String expression) {
        if (!expression.startsWith("not ")) {
            return Optional.empty();
        }
        return Optional.of(!evaluate(expression.substring(4)));
    }

    private Optional<Boolean> group(String expression) {
        if (!SpanScanner.isWrappedInParens(expression)) {
            return Optional.empty();
        }
        return Optional.of(evaluate(expression.substring(1, expression.length() - 1)));
    }

    private Optional<Boolean> conjunction(String expression) {
        if (!expression.contains(" and ")) {
            return Optional.empty();
        }
        var results = evaluateAll(expression.split(" and ", -1));
        return Optional.of(results.stream().allMatch(Boolean::booleanValue));
    }

    private Optional<Boolean> disjunction(String expression) {
        if (!expression.contains(" or ")) {
            return Optional.empty();
        }
        var results = evaluateAll(expression.split(" or ", -1));
        return Optional.of(results.stream().anyMatch(Boolean::booleanValue));
    }

    private List<Boolean> evaluateAll(String[] parts) {
        List<Boolean> results = new ArrayList<>(parts.length);
        for (var part : parts) {
            results.add(evaluate(part));
        }
        return results;
    }

    private Optional<Boolean> comparison(String expression) {
        var tokens = ExpressionLexer.tokenize(expression);
        var split = findWordOperator(expression, tokens).or(() -> findSymbolOperator(expression, tokens));
        if (split.isEmpty()) {
            return Optional.empty();
        }
        var comparison = split.get();
        switch (comparison.operator()) {
            case "contains":
                return Optional.of(contains(comparison.left(), comparison.right()));
            case "does not contain":
                return Optional.of(!contains(comparison.left(), comparison.right()));
            case "is":
                return Optional.of(equalTo(comparison.left(), comparison.right()));
            case "is not":
                return Optional.of(!equalTo(comparison.left(), comparison.right()));
            default:
                return Optional.of(compareNumeric(comparison));
        }
    }

    private boolean contains(String left, String right) {
        var needle = right.replace("\"", "");
        var haystack = rawValue(left);
        if (haystack instanceof List<?> list) {
            return list.stream().anyMatch(item -> Values.render(item).equals(needle));
        }
        if (haystack == null) {
            return false;
        }
        return Values.render(haystack).contains(needle);
    }

    private boolean equalTo(String left, String right) {
        var leftValue = rawValue(left);
        if (leftValue == null) {
            return false;
        }
        Object rightValue = right.startsWith("$") ? rawValue(right) : right.replace("\"", "");
        if (rightValue == null) {
            return false;
        }
        var leftNumber = Values.toNumber(leftValue);
        var rightNumber = Values.toNumber(rightValue);
        if (leftNumber != null && rightNumber != null) {
            return Values.numbersEqual(leftNumber, rightNumber);
        }
        return Values.render(leftValue).equals(Values.render(rightValue));
    }

    private boolean compareNumeric(Comparison comparison) {
        var evaluator = ValueEvaluator.forComparison(ctx);
        var left = ExpressionParser.tryParse(comparison.left()).map(evaluator::number).orElse(null);
        var right = ExpressionParser.tryParse(comparison.right()).map(evaluator::number).orElse(null);
        if (left == null || right == null) {
            return false;
        }
        int order = Values.compareNumbers(left, right);
        switch (comparison.operator()) {
            case ">=":
                return order >= 0;
            case "<=":
                return order <= 0;
            case ">":
                return order > 0;
            case "<":
                return order < 0;
            default:
                return false;
        }
    }

    /**
     * Raw value of one side: a variable (optionally parenthesized) or possessive access resolves
     * through the store, a quoted literal to its text, anything else stays the literal text.
     */
    private Object rawValue(String side) {
        var trimmed = side.trim();
        var parsed = ExpressionParser.tryParse(trimmed);
        if (parsed.isEmpty()) {
            return trimmed;
        }
        var expr = parsed.get();
        if (expr instanceof Expr.VariableRef || expr instanceof Expr.Possessive || expr instanceof Expr.TextLiteral) {
            return ValueEvaluator.forComparison(ctx).value(expr);
        }
        return trimmed;
    }

    /** The whole remainder names a variable, so {@code true} is the variable {@code $true}. */
    private boolean bareReference(String expression) {
        var matcher = BARE_REFERENCE.matcher(expression);
        if (!matcher.matches()) {
            return false;
        }
        return Values.isTruthy(ctx.store().get(matcher.group(1)));
    }

    private static Optional<Comparison> findWordOperator(String expression, List<Token> tokens) {
        for (int i = 1; i < tokens.size(); i++) {
            var token = tokens.get(i);
            String operator = null;
            int last = i;
            if (token.isWord("does") && wordAt(tokens, i + 1, "not") && wordAt(tokens, i + 2, "contain")) {
                operator = "does not contain";
                last = i + 2;
            } else if (token.isWord("is") && wordAt(tokens, i + 1, "not")) {
                operator = "is not";
                last = i + 1;
            } else if (token.isWord("is")) {
                operator = "is";
            } else if (token.isWord("contains")) {
                operator = "contains";
            }
            if (operator == null) {
                continue;
            }
            int start = token.start();
            int end = tokens.get(last).end();
            if (!isSpace(expression, start - 1) || !isSpace(expression, end) || last + 1 >= tokens.size()) {
                continue;
            }
            return Optional.of(new Comparison(
                expression.substring(0, start).trim(),
                operator,
                expression.substring(end).trim()
            ));
        }
        return Optional.empty();
    }

    private static Optional<Comparison> findSymbolOperator(String expression, List<Token> tokens) {
        for (int i = 1; i < tokens.size() - 1; i++) {
            var token = tokens.get(i);
            if (token.isOperator(">=") || token.isOperator("<=") || token.isOperator(">") || token.isOperator("<")) {
                return Optional.of(new Comparison(
                    expression.substring(0, token.start()).trim(),
                    token.value(),
                    expression.substring(token.end()).trim()
                ));
            }
        }
        return Optional.empty();
    }

    private static boolean wordAt(List<Token> tokens, int index, String word) {
        return index < tokens.size() && tokens.get(index).isWord(word);
    }

    private static boolean isSpace(String text, int index) {
        return index >= 0 && index < text.length() && Character.isWhitespace(text.charAt(index));
    }

    private record Comparison(String left, String operator, String right) {}
}
