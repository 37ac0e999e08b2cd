package work.lcod.twine.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Navigable link extracted from a passage.
 */
public record Choice(String text, String target) {
    public Choice {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(target, "target");
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("text", text);
        serializable.put("target", target);
        return serializable;
    }
}
