package work.lcod.twine.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Optional destination for interpreter trace lines ({@code [CONDITIONAL]}, {@code [SET]}, ...).
 */
@FunctionalInterface
public interface TraceSink {
    void trace(String category, String message);

    static TraceSink none() {
        return (category, message) -> {};
    }

    /**
     * Routes trace lines to the {@code work.lcod.twine.trace} SLF4J logger at debug level.
     */
    static TraceSink slf4j() {
        Logger logger = LoggerFactory.getLogger("work.lcod.twine.trace");
        return (category, message) -> logger.debug("[{}] {}", category, message);
    }
}
