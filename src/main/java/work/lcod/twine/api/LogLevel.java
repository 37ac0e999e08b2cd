package work.lcod.twine.api;

import java.util.Locale;

/**
 * Interpreter log levels. {@code TRACE} and {@code DEBUG} turn on the trace lines of the macro
 * components.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value, ex);
        }
    }

    public boolean tracesInterpreter() {
        return this == TRACE || this == DEBUG;
    }
}
