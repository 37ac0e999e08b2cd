package work.lcod.twine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.twine.model.Passage;

/**
 * Outcome of a {@link TwineRunner} render: exactly one of a compiled passage, a rendered header or an
 * error message.
 */
public final class RenderResult {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final Status status;
    private final String story;
    private final LogLevel logLevel;
    private final Passage passage;
    private final String header;
    private final String error;
    private final Instant startedAt;
    private final Instant finishedAt;

    private RenderResult(Status status, String story, LogLevel logLevel, Passage passage, String header, String error,
                         Instant startedAt) {
        this.status = status;
        this.story = Objects.requireNonNull(story, "story");
        this.logLevel = logLevel;
        this.passage = passage;
        this.header = header;
        this.error = error;
        this.startedAt = startedAt;
        this.finishedAt = Instant.now();
    }

    public static RenderResult rendered(String story, LogLevel logLevel, Passage passage, Instant startedAt) {
        return new RenderResult(Status.SUCCESS, story, logLevel, Objects.requireNonNull(passage, "passage"), null, null, startedAt);
    }

    public static RenderResult header(String story, LogLevel logLevel, String header, Instant startedAt) {
        return new RenderResult(Status.SUCCESS, story, logLevel, null, Objects.requireNonNull(header, "header"), null, startedAt);
    }

    /** A blank message is kept out of the serialized form. */
    public static RenderResult failure(String story, String message, Instant startedAt) {
        var error = message == null || message.isBlank() ? null : message;
        return new RenderResult(Status.FAILURE, story, null, null, null, error, startedAt);
    }

    public Status status() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String story() {
        return story;
    }

    public Optional<LogLevel> logLevel() {
        return Optional.ofNullable(logLevel);
    }

    public Optional<Passage> passage() {
        return Optional.ofNullable(passage);
    }

    public Optional<String> header() {
        return Optional.ofNullable(header);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("story", story);
        logLevel().ifPresent(level -> metadata.put("logLevel", level.name()));
        passage().ifPresent(compiled -> metadata.put("passage", compiled.toSerializableMap()));
        header().ifPresent(text -> metadata.put("header", text));
        error().ifPresent(message -> metadata.put("error", message));
        return metadata;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata());
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize render result", ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
