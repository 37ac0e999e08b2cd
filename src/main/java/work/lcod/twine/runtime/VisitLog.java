package work.lcod.twine.runtime;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered history of passage names the player has entered. Read-only for the interpreter.
 */
public final class VisitLog {
    private static final VisitLog EMPTY = new VisitLog(List.of());

    private final List<String> entries;

    private VisitLog(List<String> entries) {
        this.entries = entries;
    }

    public static VisitLog empty() {
        return EMPTY;
    }

    public static VisitLog of(List<String> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        return new VisitLog(List.copyOf(entries));
    }

    public static VisitLog of(String... entries) {
        return of(Arrays.asList(entries));
    }

    public boolean contains(String passageName) {
        return entries.contains(passageName);
    }

    public List<String> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "VisitLog" + entries;
    }
}
