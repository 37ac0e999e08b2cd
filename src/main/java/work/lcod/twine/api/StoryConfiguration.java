package work.lcod.twine.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.twine.compiler.ContentFilter;
import work.lcod.twine.runtime.ExecutionContext;
import work.lcod.twine.runtime.RandomSource;
import work.lcod.twine.runtime.TraceSink;

/**
 * Immutable configuration of a {@link TwineStory}.
 */
public record StoryConfiguration(
    int maxIterations,
    RandomSource random,
    TraceSink traceSink,
    LogLevel logLevel,
    String startPassage,
    String headerTag,
    String footerTag,
    List<ContentFilter> filters
) {
    public static final String DEFAULT_START_PASSAGE = "Start";

    public StoryConfiguration {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        Objects.requireNonNull(random, "random");
        Objects.requireNonNull(traceSink, "traceSink");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(startPassage, "startPassage");
        Objects.requireNonNull(headerTag, "headerTag");
        Objects.requireNonNull(footerTag, "footerTag");
        filters = List.copyOf(filters);
    }

    public static StoryConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxIterations = ExecutionContext.DEFAULT_MAX_ITERATIONS;
        private RandomSource random = RandomSource.system();
        private TraceSink traceSink;
        private LogLevel logLevel = LogLevel.FATAL;
        private String startPassage = DEFAULT_START_PASSAGE;
        private String headerTag = "header";
        private String footerTag = "footer";
        private final List<ContentFilter> filters = new ArrayList<>();

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder random(RandomSource random) {
            this.random = random;
            return this;
        }

        public Builder seed(long seed) {
            this.random = RandomSource.seeded(seed);
            return this;
        }

        /**
         * Explicit trace destination; when unset, trace lines go to SLF4J for {@code TRACE} and
         * {@code DEBUG} levels and nowhere otherwise.
         */
        public Builder traceSink(TraceSink traceSink) {
            this.traceSink = traceSink;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder startPassage(String startPassage) {
            this.startPassage = startPassage;
            return this;
        }

        public Builder headerTag(String headerTag) {
            this.headerTag = headerTag;
            return this;
        }

        public Builder footerTag(String footerTag) {
            this.footerTag = footerTag;
            return this;
        }

        public Builder addFilter(ContentFilter filter) {
            this.filters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public StoryConfiguration build() {
            var sink = traceSink;
            if (sink == null) {
                sink = logLevel != null && logLevel.tracesInterpreter() ? TraceSink.slf4j() : TraceSink.none();
            }
            return new StoryConfiguration(
                maxIterations,
                random,
                sink,
                logLevel,
                startPassage,
                headerTag,
                footerTag,
                filters
            );
        }
    }
}
