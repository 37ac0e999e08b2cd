package work.lcod.twine.compiler;

/**
 * Optional post-processing stage applied to passage content after conditionals are reduced and
 * before links are stripped.
 */
@FunctionalInterface
public interface ContentFilter {
    String apply(String content);
}
