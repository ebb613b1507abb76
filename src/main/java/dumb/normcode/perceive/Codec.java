package dumb.normcode.perceive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dumb.normcode.Json;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Registry of perceive/format pairs keyed by norm tag.
 * {@code perceive} resolves signs found anywhere inside a value and forwards literals untouched;
 * {@code format} wraps a produced value as a sign of the requested tag.
 */
public class Codec {

    public static final String LITERAL = "literal";

    private final Map<String, Norm> norms = new ConcurrentHashMap<>();
    private final PathMap paths;

    public Codec(PathMap paths) {
        this.paths = requireNonNull(paths);
        register(LITERAL, sign -> Json.parseOrText(sign.signifier()), v -> v, false);
    }

    public Codec register(String tag, Perceiver perceiver, Formatter formatter, boolean resource) {
        requireNonNull(tag);
        norms.put(tag, new Norm(tag, requireNonNull(perceiver), requireNonNull(formatter), resource));
        return this;
    }

    public boolean knows(String tag) {
        return norms.containsKey(tag);
    }

    public Set<String> tags() {
        return Set.copyOf(norms.keySet());
    }

    /** Whether signs of this tag name a resource that must exist before the run starts. */
    public boolean isResource(String tag) {
        var n = norms.get(tag);
        return n != null && n.resource();
    }

    public PathMap paths() {
        return paths;
    }

    public boolean isSign(JsonNode v) {
        return v != null && v.isTextual() && PerceptualSign.isSign(v.asText());
    }

    public Optional<String> tagOf(JsonNode v) {
        return isSign(v) ? PerceptualSign.parse(v.asText()).map(PerceptualSign::norm) : Optional.empty();
    }

    public JsonNode perceive(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return value;
        if (value.isTextual()) {
            var s = PerceptualSign.parse(value.asText());
            return s.isPresent() ? perceive(s.get()) : value;
        }
        if (value.isArray()) {
            var out = Json.array();
            value.forEach(e -> out.add(perceive(e)));
            return out;
        }
        if (value.isObject()) {
            var out = Json.node();
            value.fields().forEachRemaining(e -> out.set(e.getKey(), perceive(e.getValue())));
            return out;
        }
        return value;
    }

    public JsonNode perceive(PerceptualSign sign) {
        if (sign.norm() == null)
            return Json.parseOrText(sign.signifier());
        var n = norms.get(sign.norm());
        if (n == null)
            return TextNode.valueOf(sign.signifier());
        try {
            return n.perceiver().perceive(sign);
        } catch (IOException e) {
            throw new PerceptionException("Cannot perceive " + sign.encode() + ": " + e.getMessage(), e);
        }
    }

    public JsonNode format(JsonNode value, String tag) {
        var n = norms.get(tag);
        if (n == null)
            throw new IllegalArgumentException("Unknown norm tag: " + tag);
        try {
            return n.formatter().format(value);
        } catch (IOException e) {
            throw new PerceptionException("Cannot format value as " + tag + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Perceiver {
        JsonNode perceive(PerceptualSign sign) throws IOException;
    }

    @FunctionalInterface
    public interface Formatter {
        JsonNode format(JsonNode value) throws IOException;
    }

    record Norm(String tag, Perceiver perceiver, Formatter formatter, boolean resource) {
    }

    public static class PerceptionException extends RuntimeException {
        public PerceptionException(String msg, Throwable cause) {
            super(msg, cause);
        }

        public PerceptionException(String msg) {
            super(msg);
        }
    }
}
