package work.lcod.twine.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import work.lcod.twine.api.LogLevel;
import work.lcod.twine.api.StoryConfiguration;
import work.lcod.twine.compiler.ContentFilters;

/**
 * Reads a {@link StoryConfiguration} from TOML.
 *
 * <pre>
 * [interpreter]
 * max-iterations = 20
 * seed = 42
 * log-level = "debug"
 * start-passage = "Start"
 *
 * [filters]
 * stat-display = true
 * patterns = ["\\[DEBUG\\].*"]
 * </pre>
 *
 * Returns a builder so callers can still override single values (the CLI flags do).
 */
public final class StoryConfigurationLoader {
    private StoryConfigurationLoader() {}

    public static StoryConfiguration.Builder load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
    }

    public static StoryConfiguration.Builder parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration: " + result.errors().get(0));
        }
        var builder = StoryConfiguration.builder();

        Long maxIterations = result.getLong("interpreter.max-iterations");
        if (maxIterations != null) {
            builder.maxIterations(Math.toIntExact(maxIterations));
        }
        Long seed = result.getLong("interpreter.seed");
        if (seed != null) {
            builder.seed(seed);
        }
        String logLevel = result.getString("interpreter.log-level");
        if (logLevel != null) {
            builder.logLevel(LogLevel.from(logLevel));
        }
        String startPassage = result.getString("interpreter.start-passage");
        if (startPassage != null) {
            builder.startPassage(startPassage);
        }

        if (Boolean.TRUE.equals(result.getBoolean("filters.stat-display"))) {
            builder.addFilter(ContentFilters.statDisplay());
        }
        TomlArray patterns = result.getArray("filters.patterns");
        if (patterns != null) {
            for (int i = 0; i < patterns.size(); i++) {
                builder.addFilter(ContentFilters.stripping(patterns.getString(i)));
            }
        }
        return builder;
    }
}
