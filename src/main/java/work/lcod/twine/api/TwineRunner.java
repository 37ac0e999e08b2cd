package work.lcod.twine.api;

import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.twine.io.StoryLoader;
import work.lcod.twine.model.Passage;
import work.lcod.twine.runtime.VisitLog;

/**
 * Public entry point for rendering a passage out of a story file.
 */
public final class TwineRunner {
    private static final Logger LOG = LoggerFactory.getLogger(TwineRunner.class);

    public RenderResult render(RenderRequest request) {
        var started = Instant.now();
        try {
            var story = TwineStory.of(StoryLoader.load(request.storyFile()), request.configuration());
            var storyName = request.storyFile().toString();
            var logLevel = request.configuration().logLevel();
            if (request.header()) {
                var snapshot = request.snapshot().orElse(Map.of());
                var header = story.header(snapshot)
                    .orElseThrow(() -> new IllegalStateException("Story has no passage tagged '" + request.configuration().headerTag() + "'"));
                return RenderResult.header(storyName, logLevel, header, started);
            }
            return RenderResult.rendered(storyName, logLevel, resolvePassage(story, request), started);
        } catch (RuntimeException ex) {
            LOG.debug("Render of {} failed", request.storyFile(), ex);
            return RenderResult.failure(request.storyFile().toString(), ex.getMessage(), started);
        }
    }

    private Passage resolvePassage(TwineStory story, RenderRequest request) {
        var name = request.passageName().orElseGet(() -> story.startPassage().name());
        var visitLog = VisitLog.of(request.visited());
        if (request.snapshot().isEmpty() && visitLog.isEmpty()) {
            return story.passage(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown passage: " + name));
        }
        return story.passage(name, request.snapshot().orElse(Map.of()), visitLog)
            .orElseThrow(() -> new IllegalArgumentException("Unknown passage: " + name));
    }
}
