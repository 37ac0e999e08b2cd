package work.lcod.twine.shared;

import java.util.Optional;

/**
 * Balanced-span primitives shared by every macro component.
 *
 * <p>Only the delimiter class of the opener is counted: a parenthesis scan ignores brackets and the
 * other way round. Quotes and escapes are not special.
 */
public final class SpanScanner {
    public static final int NOT_FOUND = -1;

    private SpanScanner() {}

    /**
     * Returns the index one past the closer matching an opener whose content starts at {@code from}
     * (depth is 1 at {@code from}), or {@link #NOT_FOUND} when the depth never returns to zero.
     */
    public static int scanClose(String text, int from, char open, char close) {
        if (text == null || from < 0) {
            return NOT_FOUND;
        }
        int depth = 1;
        for (int i = from; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return NOT_FOUND;
    }

    /**
     * Locates a macro whose opening token (e.g. {@code (set:}) starts exactly at {@code start}.
     * The span content is the argument text between the token and the matching {@code )}.
     */
    public static Optional<Span> macroAt(String text, int start, String openingToken) {
        if (text == null || start < 0 || !text.startsWith(openingToken, start)) {
            return Optional.empty();
        }
        int contentStart = start + openingToken.length();
        int end = scanClose(text, contentStart, '(', ')');
        if (end == NOT_FOUND) {
            return Optional.empty();
        }
        return Optional.of(new Span(start, end, contentStart, end - 1));
    }

    /**
     * Locates the first hook ({@code [...]}) opening at or after {@code from}.
     */
    public static Optional<Span> hookFrom(String text, int from) {
        if (text == null || from < 0) {
            return Optional.empty();
        }
        int open = text.indexOf('[', from);
        if (open < 0) {
            return Optional.empty();
        }
        return hookAt(text, open);
    }

    /**
     * Scans the hook whose {@code [} sits exactly at {@code open}.
     */
    public static Optional<Span> hookAt(String text, int open) {
        if (text == null || open < 0 || open >= text.length() || text.charAt(open) != '[') {
            return Optional.empty();
        }
        int end = scanClose(text, open + 1, '[', ']');
        if (end == NOT_FOUND) {
            return Optional.empty();
        }
        return Optional.of(new Span(open, end, open + 1, end - 1));
    }

    /**
     * Running {@code [}/{@code ]} depth of everything before {@code index}.
     */
    public static int bracketDepthAt(String text, int index) {
        int depth = 0;
        int limit = Math.min(index, text.length());
        for (int i = 0; i < limit; i++) {
            char ch = text.charAt(i);
            if (ch == '[') {
                depth++;
            } else if (ch == ']') {
                depth--;
            }
        }
        return depth;
    }

    public static int skipWhitespace(String text, int from) {
        int cursor = from;
        while (cursor < text.length() && isBlank(text.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }

    /**
     * True when the whole string is one balanced {@code (...)} group.
     */
    public static boolean isWrappedInParens(String text) {
        if (text == null || text.length() < 2 || text.charAt(0) != '(' || text.charAt(text.length() - 1) != ')') {
            return false;
        }
        return scanClose(text, 1, '(', ')') == text.length();
    }

    private static boolean isBlank(char ch) {
        return ch == ' ' || ch == '\n' || ch == '\t' || ch == '\r';
    }

    /**
     * Half-open span {@code [start, end)} with its inner content range.
     */
    public record Span(int start, int end, int contentStart, int contentEnd) {
        public String content(String text) {
            return text.substring(contentStart, contentEnd);
        }
    }
}
