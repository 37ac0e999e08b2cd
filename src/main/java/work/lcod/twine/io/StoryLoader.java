package work.lcod.twine.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import work.lcod.twine.model.RawPassageRecord;

/**
 * Loads raw passage records from JSON or YAML.
 *
 * <p>The root is either an array of records or an object with a {@code passages} array. A record
 * has a {@code name}, optional {@code tags} (whitespace-separated string or list) and the body in
 * {@code rawBody} (or {@code text}).
 */
public final class StoryLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private StoryLoader() {}

    public static List<RawPassageRecord> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return read(in, isYaml(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read story: " + path, ex);
        }
    }

    public static List<RawPassageRecord> read(InputStream in, boolean yaml) throws IOException {
        var root = (yaml ? YAML_MAPPER : JSON_MAPPER).readTree(in);
        return toRecords(root);
    }

    public static List<RawPassageRecord> parseJson(String json) {
        try {
            return toRecords(JSON_MAPPER.readTree(json));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid story JSON", ex);
        }
    }

    public static List<RawPassageRecord> parseYaml(String yaml) {
        try {
            return toRecords(YAML_MAPPER.readTree(yaml));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid story YAML", ex);
        }
    }

    private static List<RawPassageRecord> toRecords(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        var passages = root.isObject() ? root.get("passages") : root;
        if (passages == null || !passages.isArray()) {
            throw new IllegalArgumentException("Story must be an array of passages or an object with a 'passages' array");
        }
        var records = new ArrayList<RawPassageRecord>();
        int index = 0;
        for (var node : passages) {
            records.add(toRecord(node, index++));
        }
        return records;
    }

    private static RawPassageRecord toRecord(JsonNode node, int index) {
        if (!node.isObject() || !node.hasNonNull("name")) {
            throw new IllegalArgumentException("Passage #" + index + " has no name");
        }
        var name = node.get("name").asText();
        var body = node.hasNonNull("rawBody") ? node.get("rawBody").asText() : node.path("text").asText("");
        return new RawPassageRecord(name, readTags(node.get("tags")), body);
    }

    private static List<String> readTags(JsonNode tags) {
        if (tags == null || tags.isNull()) {
            return List.of();
        }
        if (tags.isArray()) {
            var values = new ArrayList<String>();
            for (var tag : tags) {
                values.add(tag.asText());
            }
            return values;
        }
        return RawPassageRecord.splitTags(tags.asText());
    }

    private static boolean isYaml(Path path) {
        var fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }
}
