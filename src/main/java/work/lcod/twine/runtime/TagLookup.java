package work.lcod.twine.runtime;

import java.util.List;

/**
 * Resolves the tags of a passage by name (empty when unknown).
 */
@FunctionalInterface
public interface TagLookup {
    List<String> tagsOf(String passageName);

    static TagLookup none() {
        return name -> List.of();
    }
}
