package work.lcod.twine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VariableStoreTest {
    @Test
    void seedingCopiesTheSnapshot() {
        var items = new ArrayList<Object>(List.of("sword"));
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("items", items);
        snapshot.put("gold", 3);

        var store = VariableStore.seededFrom(snapshot);
        items.add("shield");
        snapshot.put("gold", 99);

        assertEquals(List.of("sword"), store.get("items"));
        assertEquals(3L, store.get("gold"));
    }

    @Test
    void collectionAccessorsReturnCopies() {
        var store = VariableStore.seededFrom(Map.of("items", List.of("a"), "name", "Bob"));
        var list = store.listOrEmpty("items");
        list.add("b");
        assertEquals(List.of("a"), store.get("items"));
        assertTrue(store.listOrEmpty("name").isEmpty());
        assertTrue(store.mapOrEmpty("missing").isEmpty());
    }

    @Test
    void reportsOnlyChangedVariables() {
        var baseline = Map.<String, Object>of("score", 50, "flags", Map.of("door", true), "name", "Ann");
        var store = VariableStore.seededFrom(baseline);
        store.set("score", 50L);
        store.set("flags", Map.of("door", true, "key", false));
        store.set("gold", 5);

        var changes = store.changesSince(baseline);
        assertEquals(Map.of("flags", Map.of("door", true, "key", false), "gold", 5L), changes);
        assertFalse(changes.containsKey("score"));
    }

    @Test
    void snapshotIsDetached() {
        var store = new VariableStore();
        store.set("gold", 1);
        var snapshot = store.snapshot();
        store.set("gold", 2);
        assertEquals(1L, snapshot.get("gold"));
        assertTrue(store.contains("gold"));
        assertFalse(store.contains("silver"));
    }
}
