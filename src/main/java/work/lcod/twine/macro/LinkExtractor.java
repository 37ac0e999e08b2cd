package work.lcod.twine.macro;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import work.lcod.twine.model.Choice;

/**
 * Link syntax: {@code [[[text|target]]]} and {@code [[text|target]]}, with {@code ->} (display on
 * the left) and {@code <-} (display on the right) as alternative separators.
 */
public final class LinkExtractor {
    private static final Pattern LINK = Pattern.compile("\\[\\[\\[([^\\]]+)\\]\\]\\]|\\[\\[([^\\]]+)\\]\\]");
    private static final Pattern TRIPLE_LINK = Pattern.compile("\\[\\[\\[.*?\\]\\]\\]", Pattern.DOTALL);
    private static final Pattern DOUBLE_LINK = Pattern.compile("\\[\\[.*?\\]\\]", Pattern.DOTALL);

    private LinkExtractor() {}

    /**
     * Choices in document order.
     */
    public static List<Choice> extract(String content) {
        List<Choice> choices = new ArrayList<>();
        var matcher = LINK.matcher(content);
        while (matcher.find()) {
            var inner = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            choices.add(parseLink(inner));
        }
        return choices;
    }

    public static String strip(String content) {
        var withoutTriple = TRIPLE_LINK.matcher(content).replaceAll("");
        return DOUBLE_LINK.matcher(withoutTriple).replaceAll("");
    }

    /**
     * Separators are tried as {@code ->}, {@code <-}, then {@code |}. Only the first two pieces of a
     * split count, so {@code a->b->c} links {@code a} to {@code b}.
     */
    public static Choice parseLink(String linkText) {
        var text = linkText.trim();
        if (text.contains("->")) {
            var parts = pieces(text, "->");
            return new Choice(parts[0], parts[1]);
        }
        if (text.contains("<-")) {
            var parts = pieces(text, "<-");
            return new Choice(parts[1], parts[0]);
        }
        if (text.contains("|")) {
            var parts = pieces(text, "|");
            return new Choice(parts[0], parts[1]);
        }
        return new Choice(text, text);
    }

    private static String[] pieces(String text, String separator) {
        var parts = text.split(Pattern.quote(separator), -1);
        return new String[] {parts[0].trim(), parts[1].trim()};
    }
}
