package work.lcod.twine.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SnapshotLoaderTest {
    @Test
    void normalizesNumbers() {
        var snapshot = SnapshotLoader.parse("{\"gold\": 12, \"ratio\": 0.5, \"items\": [\"sword\", 2], \"stats\": {\"hp\": 3}}");

        assertEquals(12L, snapshot.get("gold"));
        assertEquals(0.5d, snapshot.get("ratio"));
        assertEquals(List.of("sword", 2L), snapshot.get("items"));
        assertEquals(Map.of("hp", 3L), snapshot.get("stats"));
    }

    @Test
    void emptyInputIsEmptySnapshot() throws Exception {
        assertTrue(SnapshotLoader.parse("  ").isEmpty());
        assertTrue(SnapshotLoader.read(new ByteArrayInputStream(new byte[0])).isEmpty());
    }

    @Test
    void readsFromStream() throws Exception {
        var in = new ByteArrayInputStream("{\"flag\": true}".getBytes(StandardCharsets.UTF_8));
        assertEquals(Map.of("flag", true), SnapshotLoader.read(in));
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> SnapshotLoader.parse("{gold:"));
        assertThrows(IllegalArgumentException.class, () -> SnapshotLoader.parse("[1, 2]"));
    }
}
