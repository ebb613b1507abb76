package dumb.normcode.perceive;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dumb.normcode.Json;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static dumb.normcode.Log.debug;

/** The built-in norm tags. */
public final class Norms {

    public static final String FILE_LOCATION = "file_location";
    public static final String FILE_LOCATIONS = "file_locations";
    public static final String PROMPT_LOCATION = "prompt_location";
    public static final String SCRIPT_LOCATION = "script_location";
    public static final String SAVE_PATH = "save_path";
    public static final String TRUTH_VALUE = "truth_value";
    public static final String MEMORIZED_PARAMETER = "memorized_parameter";

    private static final String PARAMETERS_FILE = "parameters.json";

    private Norms() {
    }

    /** A codec with every built-in tag; formatted values are written under {@code storeDir}. */
    public static Codec codec(PathMap paths, Path storeDir) {
        var codec = new Codec(paths);
        install(codec, storeDir);
        return codec;
    }

    public static void install(Codec codec, Path storeDir) {
        var paths = codec.paths();
        var store = storeDir.toAbsolutePath().normalize();
        var parameters = new ParameterStore(store.resolve(PARAMETERS_FILE));

        codec.register(FILE_LOCATION,
                sign -> Json.parseOrText(Files.readString(paths.resolve(sign.signifier()), StandardCharsets.UTF_8)),
                v -> TextNode.valueOf(write(store, FILE_LOCATION, contentOf(v)).encode()),
                true);

        codec.register(FILE_LOCATIONS,
                sign -> {
                    var list = Json.parseOrText(sign.signifier());
                    return codec.perceive(list);
                },
                v -> {
                    var out = Json.array();
                    if (v.isArray()) v.forEach(e -> out.add(write(store, FILE_LOCATION, contentOf(e)).encode()));
                    else out.add(write(store, FILE_LOCATION, contentOf(v)).encode());
                    return out;
                },
                false);

        codec.register(PROMPT_LOCATION,
                sign -> TextNode.valueOf(Files.readString(paths.resolve(sign.signifier()), StandardCharsets.UTF_8)),
                v -> TextNode.valueOf(write(store, PROMPT_LOCATION, v.isTextual() ? v.asText() : Json.compact(v)).encode()),
                true);

        codec.register(SCRIPT_LOCATION,
                sign -> TextNode.valueOf(sign.signifier()),
                v -> TextNode.valueOf(PerceptualSign.of(SCRIPT_LOCATION, v.asText()).encode()),
                true);

        codec.register(SAVE_PATH,
                sign -> TextNode.valueOf(sign.signifier()),
                v -> TextNode.valueOf(PerceptualSign.of(SAVE_PATH, v.asText()).encode()),
                false);

        codec.register(TRUTH_VALUE,
                sign -> BooleanNode.valueOf(Boolean.parseBoolean(sign.signifier().strip())),
                v -> TextNode.valueOf(PerceptualSign.of(TRUTH_VALUE, String.valueOf(truthy(v))).encode()),
                false);

        codec.register(MEMORIZED_PARAMETER,
                sign -> parameters.get(sign.signifier()),
                v -> {
                    var key = PerceptualSign.digest(Json.compact(v)).substring(0, 12);
                    parameters.put(key, v);
                    return TextNode.valueOf(new PerceptualSign(MEMORIZED_PARAMETER, key.substring(0, 3), key).encode());
                },
                false);
    }

    /** Boolean reading of a value: true, "true", or a non-empty array whose elements are all truthy. */
    public static boolean truthy(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return false;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isTextual()) return "true".equalsIgnoreCase(v.asText().strip());
        if (v.isNumber()) return v.asDouble() != 0;
        if (v.isArray()) {
            if (v.isEmpty()) return false;
            for (var e : v) if (!truthy(e)) return false;
            return true;
        }
        return !v.isEmpty();
    }

    /** Text to write so that reading it back with {@link Json#parseOrText} yields {@code v} again. */
    static String contentOf(JsonNode v) {
        if (v.isTextual()) {
            var t = v.asText();
            return Json.parseOrText(t).equals(v) ? t : Json.compact(v);
        }
        return Json.compact(v);
    }

    private static PerceptualSign write(Path store, String tag, String content) {
        var digest = PerceptualSign.digest(content);
        var file = store.resolve(tag + "_" + digest.substring(0, 16) + ".txt");
        try {
            Files.createDirectories(store);
            if (!Files.exists(file)) Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new Codec.PerceptionException("Cannot write " + file + ": " + e.getMessage(), e);
        }
        debug("Formatted value into " + file);
        return new PerceptualSign(tag, digest.substring(0, 3), file.toString());
    }

    /** Values held for {@code memorized_parameter} signs, persisted as one JSON object. */
    static class ParameterStore {
        private final Path file;
        private final Map<String, JsonNode> values = new ConcurrentHashMap<>();

        ParameterStore(Path file) {
            this.file = file;
            if (Files.exists(file)) {
                try {
                    values.putAll(Json.the.readValue(Files.readString(file), new TypeReference<Map<String, JsonNode>>() {
                    }));
                } catch (IOException e) {
                    throw new Codec.PerceptionException("Cannot read parameter store " + file + ": " + e.getMessage(), e);
                }
            }
        }

        JsonNode get(String key) throws IOException {
            var v = values.get(key);
            if (v == null) throw new IOException("No memorized parameter '" + key + "'");
            return v;
        }

        synchronized void put(String key, JsonNode v) throws IOException {
            values.put(key, v);
            Files.createDirectories(file.getParent());
            Files.writeString(file, Json.str(new LinkedHashMap<>(values)), StandardCharsets.UTF_8);
        }
    }
}
