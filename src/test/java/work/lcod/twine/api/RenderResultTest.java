package work.lcod.twine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.twine.model.Choice;
import work.lcod.twine.model.Passage;

class RenderResultTest {
    private static final Instant STARTED = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void renderedPassageIsTyped() {
        var passage = new Passage("Hall", "Poor.", List.of(new Choice("Back", "Intro")), List.of("lit"), Map.of("gold", 3L));
        var result = RenderResult.rendered("story.json", LogLevel.INFO, passage, STARTED);

        assertTrue(result.isSuccess());
        assertEquals(passage, result.passage().orElseThrow());
        assertEquals(0, result.status().exitCode());
        assertEquals(passage.toSerializableMap(), result.metadata().get("passage"));
        assertEquals("INFO", result.metadata().get("logLevel"));
    }

    @Test
    void blankFailureMessageIsOmitted() {
        var result = RenderResult.failure("story.json", " ", STARTED);

        assertFalse(result.isSuccess());
        assertTrue(result.error().isEmpty());
        assertEquals(Map.of("story", "story.json"), result.metadata());
    }

    @Test
    void headerIsRequired() {
        assertThrows(NullPointerException.class, () -> RenderResult.header("story.json", LogLevel.INFO, null, STARTED));
    }

    @Test
    void serializesStatusInLowerCase() {
        var result = RenderResult.header("story.json", LogLevel.WARN, "Gold: 3", STARTED);
        var serialized = result.toSerializableMap();

        assertEquals("success", serialized.get("status"));
        assertEquals("2024-01-01T00:00:00Z", serialized.get("startedAt"));
        assertTrue(result.toPrettyJson().contains("\"header\" : \"Gold: 3\""));
    }
}
