package work.lcod.twine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogLevelTest {
    @Test
    void parsesCaseInsensitively() {
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertEquals(LogLevel.WARN, LogLevel.from(" Warn "));
        assertEquals(LogLevel.FATAL, LogLevel.from(null));
        assertEquals(LogLevel.FATAL, LogLevel.from(""));
    }

    @Test
    void rejectsUnknownLevels() {
        var ex = assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
        assertEquals("Unsupported log level: loud", ex.getMessage());
    }

    @Test
    void onlyVerboseLevelsTrace() {
        assertTrue(LogLevel.TRACE.tracesInterpreter());
        assertTrue(LogLevel.DEBUG.tracesInterpreter());
        assertFalse(LogLevel.INFO.tracesInterpreter());
        assertFalse(LogLevel.FATAL.tracesInterpreter());
    }
}
