package work.lcod.twine.api;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What {@link TwineRunner} should render: a story file, the passage (or header) to compile and the
 * caller-held state.
 */
public record RenderRequest(
    Path storyFile,
    Optional<String> passageName,
    Optional<Map<String, Object>> snapshot,
    List<String> visited,
    boolean header,
    StoryConfiguration configuration
) {
    public RenderRequest {
        Objects.requireNonNull(storyFile, "storyFile");
        Objects.requireNonNull(passageName, "passageName");
        Objects.requireNonNull(snapshot, "snapshot");
        visited = List.copyOf(visited);
        Objects.requireNonNull(configuration, "configuration");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path storyFile;
        private Optional<String> passageName = Optional.empty();
        private Optional<Map<String, Object>> snapshot = Optional.empty();
        private List<String> visited = List.of();
        private boolean header;
        private StoryConfiguration configuration = StoryConfiguration.defaults();

        public Builder storyFile(Path storyFile) {
            this.storyFile = storyFile;
            return this;
        }

        public Builder passageName(String passageName) {
            this.passageName = Optional.ofNullable(passageName);
            return this;
        }

        public Builder snapshot(Map<String, Object> snapshot) {
            this.snapshot = Optional.ofNullable(snapshot).map(LinkedHashMap::new);
            return this;
        }

        public Builder visited(List<String> visited) {
            this.visited = visited == null ? List.of() : visited;
            return this;
        }

        public Builder header(boolean header) {
            this.header = header;
            return this;
        }

        public Builder configuration(StoryConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public RenderRequest build() {
            return new RenderRequest(storyFile, passageName, snapshot, visited, header, configuration);
        }
    }
}
