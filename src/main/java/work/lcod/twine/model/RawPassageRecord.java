package work.lcod.twine.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Passage as extracted from the story document: name, tags and the untouched body markup.
 */
public record RawPassageRecord(String name, List<String> tags, String rawBody) {
    public RawPassageRecord {
        Objects.requireNonNull(name, "name");
        tags = tags == null ? List.of() : List.copyOf(tags);
        rawBody = rawBody == null ? "" : rawBody;
    }

    /**
     * Builds a record from a whitespace-separated tag string, the way story documents store them.
     */
    public static RawPassageRecord of(String name, String tags, String rawBody) {
        return new RawPassageRecord(name, splitTags(tags), rawBody);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public static List<String> splitTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        return Arrays.asList(tags.trim().split("\\s+"));
    }
}
