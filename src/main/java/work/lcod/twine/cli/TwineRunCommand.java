package work.lcod.twine.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.twine.api.LogLevel;
import work.lcod.twine.api.RenderRequest;
import work.lcod.twine.api.RenderResult;
import work.lcod.twine.api.StoryConfiguration;
import work.lcod.twine.api.TwineRunner;
import work.lcod.twine.io.SnapshotLoader;
import work.lcod.twine.io.StoryConfigurationLoader;

@CommandLine.Command(
    name = "twine-run",
    description = "Render a passage of a story given as passage records (JSON or YAML).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TwineRunCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-s", "--story"},
        required = true,
        description = "Story records file (.json, .yaml or .yml)."
    )
    private Path story;

    @CommandLine.Option(
        names = {"-p", "--passage"},
        description = "Passage to render (default: the start passage).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String passage;

    @CommandLine.Option(
        names = "--state",
        paramLabel = "PATH|-",
        description = "JSON variable snapshot file; use '-' to read from stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String state;

    @CommandLine.Option(
        names = "--visited",
        split = ",",
        description = "Comma-separated visit log, oldest first."
    )
    private List<String> visited = new ArrayList<>();

    @CommandLine.Option(
        names = "--seed",
        description = "Seed for (random:) draws.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Long seed;

    @CommandLine.Option(
        names = "--config",
        description = "TOML configuration file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--header",
        description = "Render the header passage instead of a navigable passage."
    )
    private boolean header;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        var storyFile = story.toAbsolutePath().normalize();
        if (!Files.isRegularFile(storyFile)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Story file not found: " + storyFile);
        }

        var request = RenderRequest.builder()
            .storyFile(storyFile)
            .passageName(passage)
            .snapshot(loadSnapshot())
            .visited(visited)
            .header(header)
            .configuration(buildConfiguration())
            .build();

        RenderResult result = new TwineRunner().render(request);
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private StoryConfiguration buildConfiguration() {
        var builder = config != null
            ? StoryConfigurationLoader.load(config.toAbsolutePath().normalize())
            : StoryConfiguration.builder();
        if (seed != null) {
            builder.seed(seed);
        }
        if (logLevelRaw != null) {
            try {
                builder.logLevel(LogLevel.from(logLevelRaw));
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
        }
        return builder.build();
    }

    private Map<String, Object> loadSnapshot() {
        if (state == null || state.isBlank()) {
            return null;
        }
        if ("-".equals(state)) {
            try {
                return SnapshotLoader.read(System.in);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
        var trimmed = state.trim();
        if (trimmed.startsWith("{")) {
            return SnapshotLoader.parse(trimmed);
        }
        var path = Paths.get(state).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read state file: " + path);
        }
        return SnapshotLoader.load(path);
    }
}
