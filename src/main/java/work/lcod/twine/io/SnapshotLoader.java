package work.lcod.twine.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.twine.shared.Values;

/**
 * Reads a variable snapshot from a JSON object. Integral numbers become {@code Long}, fractional
 * ones {@code Double}.
 */
public final class SnapshotLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private SnapshotLoader() {}

    public static Map<String, Object> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read snapshot: " + path, ex);
        }
    }

    public static Map<String, Object> read(InputStream in) throws IOException {
        var bytes = in.readAllBytes();
        if (bytes.length == 0) {
            return new LinkedHashMap<>();
        }
        return Values.normalizeMap(JSON.readValue(bytes, MAP_REF));
    }

    public static Map<String, Object> parse(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return Values.normalizeMap(JSON.readValue(json, MAP_REF));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON snapshot", ex);
        }
    }
}
