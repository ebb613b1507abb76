package dumb.normcode.perceive;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Maps logical resource identifiers (paradigm ids, prompt, data and script paths) to physical locations.
 * Unmapped identifiers resolve against the base directory.
 */
public class PathMap {

    private final Path baseDir;
    private final Map<String, String> mapping = new ConcurrentHashMap<>();

    public PathMap(Path baseDir) {
        this.baseDir = requireNonNull(baseDir).toAbsolutePath().normalize();
    }

    public PathMap(Path baseDir, Map<String, String> mapping) {
        this(baseDir);
        if (mapping != null) this.mapping.putAll(mapping);
    }

    public PathMap map(String logical, String physical) {
        mapping.put(logical, physical);
        return this;
    }

    public boolean mapped(String logical) {
        return mapping.containsKey(logical);
    }

    public Path resolve(String logical) {
        var physical = mapping.getOrDefault(logical.strip(), logical.strip());
        var p = Path.of(physical);
        return (p.isAbsolute() ? p : baseDir.resolve(p)).normalize();
    }

    public boolean exists(String logical) {
        return Files.exists(resolve(logical));
    }

    public Path baseDir() {
        return baseDir;
    }

    public Map<String, String> mapping() {
        return Map.copyOf(mapping);
    }
}
