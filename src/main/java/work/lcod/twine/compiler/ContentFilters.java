package work.lcod.twine.compiler;

import java.util.regex.Pattern;

/**
 * Stock {@link ContentFilter}s.
 */
public final class ContentFilters {
    // **Suspicion:** X/100 | **Time:** X:XX PM | **Film:** X/30
    private static final Pattern STAT_DISPLAY = Pattern.compile(
        "\\*\\*Suspicion:\\*\\*.*?(?:\\*\\*Film:\\*\\*.*?/\\d+|\\*\\*Time:\\*\\*.*?(?:PM|Midnight))(?:\\s*\\|\\s*\\*\\*Film:\\*\\*.*?/\\d+)?",
        Pattern.MULTILINE | Pattern.DOTALL
    );

    private ContentFilters() {}

    /**
     * Removes the status line template ({@code **Suspicion:** ... | **Time:** ... | **Film:** ...}).
     */
    public static ContentFilter statDisplay() {
        return removing(STAT_DISPLAY);
    }

    /**
     * Removes every match of {@code regex} (multi-line, dot matches newlines).
     */
    public static ContentFilter stripping(String regex) {
        return removing(Pattern.compile(regex, Pattern.MULTILINE | Pattern.DOTALL));
    }

    private static ContentFilter removing(Pattern pattern) {
        return content -> pattern.matcher(content).replaceAll("");
    }
}
