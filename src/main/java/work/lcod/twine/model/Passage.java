package work.lcod.twine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled passage: rendered content, choices, tags and the variables changed while compiling.
 */
public record Passage(String name, String content, List<Choice> choices, List<String> tags, Map<String, Object> stateChanges) {
    public Passage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        choices = List.copyOf(choices);
        tags = tags == null ? List.of() : List.copyOf(tags);
        stateChanges = Collections.unmodifiableMap(new LinkedHashMap<>(stateChanges == null ? Map.of() : stateChanges));
    }

    public boolean hasStateChanges() {
        return !stateChanges.isEmpty();
    }

    public Map<String, Object> toSerializableMap() {
        List<Map<String, Object>> serializedChoices = new ArrayList<>();
        for (var choice : choices) {
            serializedChoices.add(choice.toSerializableMap());
        }
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("name", name);
        serializable.put("content", content);
        serializable.put("choices", serializedChoices);
        serializable.put("tags", tags);
        serializable.put("stateChanges", stateChanges);
        return serializable;
    }
}
