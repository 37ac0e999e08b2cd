package work.lcod.twine.compiler;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.twine.macro.AssignmentExecutor;
import work.lcod.twine.macro.ConditionalEvaluator;
import work.lcod.twine.macro.LinkExtractor;
import work.lcod.twine.macro.PrintResolver;
import work.lcod.twine.model.Passage;
import work.lcod.twine.model.RawPassageRecord;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.runtime.RandomSource;
import work.lcod.twine.runtime.TagLookup;
import work.lcod.twine.runtime.TraceSink;
import work.lcod.twine.runtime.VariableStore;
import work.lcod.twine.runtime.VisitLog;
import work.lcod.twine.shared.SpanScanner;
import work.lcod.twine.shared.Values;

/**
 * Turns a raw passage body into a {@link Passage}.
 *
 * <p>Each compile owns one {@link VariableStore} seeded from the caller's snapshot. Top-level
 * {@code (set:)} commands run first, then conditional and visited chains are reduced (running the
 * assignments of the selected branches). Choices are read from that intermediate text; the content
 * then goes through brace removal, content filters, link stripping, print resolution, italics,
 * inline {@code $var} substitution, collection residue cleanup and whitespace normalization.
 */
public final class PassageCompiler {
    private static final Pattern ITALIC = Pattern.compile("//(.+?)//");
    private static final Pattern INLINE_VARIABLE = Pattern.compile("\\$(\\w+)");
    private static final Pattern EMPTY_ARRAY = Pattern.compile("\\(a:\\)");
    private static final Pattern EMPTY_MAP = Pattern.compile("\\(dm:\\)");
    private static final Pattern ARRAY = Pattern.compile("\\(a:.*?\\)");
    private static final Pattern MAP = Pattern.compile("\\(dm:.*?\\)");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n\\s*\\n\\s*\\n+");
    private static final Pattern BLANK_LINE = Pattern.compile("^\\s+$", Pattern.MULTILINE);
    private static final String[] GROUPED_CONDITIONALS = { "{(if:", "{(unless:" };

    private final TagLookup tagLookup;
    private final RandomSource random;
    private final TraceSink traceSink;
    private final int maxIterations;
    private final List<ContentFilter> filters;

    public PassageCompiler(TagLookup tagLookup) {
        this(tagLookup, RandomSource.system(), TraceSink.none(), ExecutionContext.DEFAULT_MAX_ITERATIONS, List.of());
    }

    public PassageCompiler(
        TagLookup tagLookup,
        RandomSource random,
        TraceSink traceSink,
        int maxIterations,
        List<ContentFilter> filters
    ) {
        this.tagLookup = tagLookup == null ? TagLookup.none() : tagLookup;
        this.random = Objects.requireNonNull(random, "random");
        this.traceSink = Objects.requireNonNull(traceSink, "traceSink");
        this.maxIterations = maxIterations;
        this.filters = List.copyOf(filters);
    }

    public Passage compile(RawPassageRecord record, Map<String, ?> snapshot, VisitLog visitLog) {
        var baseline = snapshot == null ? Map.<String, Object>of() : snapshot;
        var ctx = newContext(VariableStore.seededFrom(baseline), visitLog);
        var reduced = reduce(record.rawBody(), ctx);
        var choices = LinkExtractor.extract(reduced.text());
        var content = clean(reduced.text(), ctx, reduced.prints());

        var changes = ctx.store().changesSince(baseline);
        if (!changes.isEmpty()) {
            ctx.trace("STATE_CHANGES", "Passage \"" + record.name() + "\" changes: " + Values.render(changes));
        }
        return new Passage(record.name(), content, choices, record.tags(), changes);
    }

    /**
     * Rendered content only, for header/footer passages: no choices and no state diff.
     */
    public String compileContent(RawPassageRecord record, Map<String, ?> snapshot) {
        var ctx = newContext(VariableStore.seededFrom(snapshot), VisitLog.empty());
        var reduced = reduce(record.rawBody(), ctx);
        return clean(reduced.text(), ctx, reduced.prints());
    }

    private ExecutionContext newContext(VariableStore store, VisitLog visitLog) {
        return new ExecutionContext(store, visitLog, tagLookup, random, traceSink, maxIterations);
    }

    private Reduction reduce(String rawBody, ExecutionContext ctx) {
        var assignments = new AssignmentExecutor(ctx);
        var prints = new PrintResolver(ctx);
        var conditionals = new ConditionalEvaluator(ctx, assignments, prints);

        var text = assignments.executeTopLevel(rawBody);
        text = unwrapGroupedConditionals(text);
        text = conditionals.evaluate(text);
        return new Reduction(text, prints);
    }

    private String clean(String text, ExecutionContext ctx, PrintResolver prints) {
        var cleaned = text.replace("{", "").replace("}", "");
        for (var filter : filters) {
            cleaned = filter.apply(cleaned);
        }
        cleaned = LinkExtractor.strip(cleaned);
        cleaned = prints.resolve(cleaned);
        cleaned = ITALIC.matcher(cleaned).replaceAll("*$1*");
        cleaned = substituteVariables(cleaned, ctx.store());

        cleaned = EMPTY_ARRAY.matcher(cleaned).replaceAll("");
        cleaned = EMPTY_MAP.matcher(cleaned).replaceAll("");
        cleaned = ARRAY.matcher(cleaned).replaceAll("[]");
        cleaned = MAP.matcher(cleaned).replaceAll("{}");

        cleaned = BLANK_RUN.matcher(cleaned).replaceAll("\n\n");
        cleaned = BLANK_LINE.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }

    // undefined variables keep their literal $name
    private static String substituteVariables(String text, VariableStore store) {
        var matcher = INLINE_VARIABLE.matcher(text);
        var result = new StringBuilder();
        while (matcher.find()) {
            var value = store.get(matcher.group(1));
            var replacement = value == null ? matcher.group(0) : Values.render(value);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * {@code {(if: ...)[...]}} becomes {@code (if: ...)[...]}; stops at the first group without a
     * matching closing brace.
     */
    static String unwrapGroupedConditionals(String text) {
        var result = text;
        while (true) {
            int start = firstGroupedConditional(result);
            if (start < 0) {
                return result;
            }
            int end = SpanScanner.scanClose(result, start + 1, '{', '}');
            if (end == SpanScanner.NOT_FOUND) {
                return result;
            }
            int close = end - 1;
            result = result.substring(0, start) + result.substring(start + 1, close) + result.substring(close + 1);
        }
    }

    private static int firstGroupedConditional(String text) {
        for (var opening : GROUPED_CONDITIONALS) {
            int found = text.indexOf(opening);
            if (found >= 0) {
                return found;
            }
        }
        return -1;
    }

    private record Reduction(String text, PrintResolver prints) {}
}
