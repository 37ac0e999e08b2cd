package work.lcod.twine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.twine.shared.Values;

/**
 * Story variables for one passage evaluation pass.
 *
 * <p>Seeded from a deep copy of the caller's snapshot and mutated in place by assignments; caller
 * state is never aliased in either direction.
 */
public final class VariableStore {
    private final Map<String, Object> values = new LinkedHashMap<>();

    public VariableStore() {}

    public static VariableStore seededFrom(Map<String, ?> snapshot) {
        var store = new VariableStore();
        if (snapshot != null) {
            store.values.putAll(Values.normalizeMap(snapshot));
        }
        return store;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name) && values.get(name) != null;
    }

    public void set(String name, Object value) {
        values.put(name, Values.normalize(value));
    }

    /**
     * Copy of the list bound to {@code name}, or an empty list when absent or not a list.
     */
    public List<Object> listOrEmpty(String name) {
        if (values.get(name) instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            List<Object> copy = (List<Object>) Values.normalize(list);
            return copy;
        }
        return new ArrayList<>();
    }

    /**
     * Copy of the map bound to {@code name}, or an empty map when absent or not a map.
     */
    public Map<String, Object> mapOrEmpty(String name) {
        if (values.get(name) instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> copy = (Map<String, Object>) Values.normalize(map);
            return copy;
        }
        return new LinkedHashMap<>();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, Object> snapshot() {
        return Values.normalizeMap(values);
    }

    /**
     * Variables whose current value differs from {@code baseline}; maps compare by size and per key,
     * everything else by value.
     */
    public Map<String, Object> changesSince(Map<String, ?> baseline) {
        Map<String, Object> initial = Values.normalizeMap(baseline);
        Map<String, Object> changes = new LinkedHashMap<>();
        for (var entry : values.entrySet()) {
            if (!Values.looselyEqual(initial.get(entry.getKey()), entry.getValue())) {
                changes.put(entry.getKey(), Values.normalize(entry.getValue()));
            }
        }
        return changes;
    }

    @Override
    public String toString() {
        return "VariableStore" + values;
    }
}
