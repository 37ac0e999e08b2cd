package work.lcod.twine.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.twine.compiler.PassageCompiler;
import work.lcod.twine.model.Passage;
import work.lcod.twine.model.RawPassageRecord;
import work.lcod.twine.runtime.VisitLog;

/**
 * Story-level lookups over a list of raw passage records.
 *
 * <p>Every navigable passage (not tagged header or footer) is compiled once with an empty
 * snapshot when the story is built; lookups with a snapshot recompile from the raw body. A passage
 * name defined twice resolves to its last definition.
 */
public final class TwineStory {
    private static final Logger LOG = LoggerFactory.getLogger(TwineStory.class);

    private final StoryConfiguration configuration;
    private final Map<String, RawPassageRecord> records = new LinkedHashMap<>();
    private final Map<String, Passage> defaults = new LinkedHashMap<>();
    private final PassageCompiler compiler;

    private TwineStory(List<RawPassageRecord> passageRecords, StoryConfiguration configuration) {
        this.configuration = configuration;
        for (var record : passageRecords) {
            if (records.put(record.name(), record) != null) {
                LOG.warn("Duplicate passage name '{}', keeping the last definition", record.name());
            }
        }
        this.compiler = new PassageCompiler(
            this::tagsOf,
            configuration.random(),
            configuration.traceSink(),
            configuration.maxIterations(),
            configuration.filters()
        );
        for (var record : records.values()) {
            if (isNavigable(record)) {
                defaults.put(record.name(), compiler.compile(record, Map.of(), VisitLog.empty()));
            }
        }
        LOG.debug("Story ready with {} navigable passages out of {}", defaults.size(), records.size());
    }

    public static TwineStory of(List<RawPassageRecord> records) {
        return of(records, StoryConfiguration.defaults());
    }

    public static TwineStory of(List<RawPassageRecord> records, StoryConfiguration configuration) {
        return new TwineStory(List.copyOf(records), configuration);
    }

    public StoryConfiguration configuration() {
        return configuration;
    }

    /**
     * Default-state compile of a navigable passage.
     */
    public Optional<Passage> passage(String name) {
        return Optional.ofNullable(defaults.get(name));
    }

    /**
     * Compiles {@code name} against {@code snapshot} and {@code visitLog}; without a snapshot the
     * default-state compile is returned.
     */
    public Optional<Passage> passage(String name, Map<String, ?> snapshot, VisitLog visitLog) {
        if (snapshot == null) {
            return passage(name);
        }
        var record = records.get(name);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(compiler.compile(record, snapshot, visitLog == null ? VisitLog.empty() : visitLog));
    }

    /**
     * The configured start passage, else the first navigable passage in document order.
     */
    public Passage startPassage() {
        var start = defaults.get(configuration.startPassage());
        if (start != null) {
            return start;
        }
        return defaults.values().stream()
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Story has no navigable passages"));
    }

    /**
     * Content of the first passage tagged as header, compiled against {@code snapshot}.
     */
    public Optional<String> header(Map<String, ?> snapshot) {
        return taggedContent(configuration.headerTag(), snapshot);
    }

    public Optional<String> footer(Map<String, ?> snapshot) {
        return taggedContent(configuration.footerTag(), snapshot);
    }

    public List<String> passageNames() {
        return new ArrayList<>(defaults.keySet());
    }

    public List<String> tagsOf(String name) {
        var record = records.get(name);
        return record == null ? List.of() : record.tags();
    }

    private Optional<String> taggedContent(String tag, Map<String, ?> snapshot) {
        return records.values().stream()
            .filter(record -> record.hasTag(tag))
            .findFirst()
            .map(record -> compiler.compileContent(record, snapshot));
    }

    private boolean isNavigable(RawPassageRecord record) {
        return !record.hasTag(configuration.headerTag()) && !record.hasTag(configuration.footerTag());
    }
}
