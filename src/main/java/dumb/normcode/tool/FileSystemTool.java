package dumb.normcode.tool;

import dumb.normcode.Tool;
import dumb.normcode.perceive.PathMap;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static dumb.normcode.Log.debug;
import static dumb.normcode.Log.error;
import static java.util.Objects.requireNonNull;

public class FileSystemTool implements Tool {

    public static final String NAME = "file_system";
    public static final String OPERATION = "operation";
    public static final String READ = "read";
    public static final String WRITE = "write";
    public static final String PATH = "path";
    public static final String CONTENT = "content";

    private final PathMap paths;
    private final Executor exe;

    public FileSystemTool(PathMap paths, Executor exe) {
        this.paths = requireNonNull(paths);
        this.exe = requireNonNull(exe);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Reads or writes a text file, resolving logical paths through the path map.";
    }

    @Override
    public CompletableFuture<?> execute(Map<String, Object> parameters) {
        var op = (String) parameters.get(OPERATION);
        var path = (String) parameters.get(PATH);
        if (path == null || path.isBlank()) {
            error("FileSystemTool requires a 'path' parameter.");
            return CompletableFuture.failedFuture(new ToolExecutionException("Missing 'path' parameter."));
        }
        if (READ.equals(op)) return read(path);
        if (WRITE.equals(op)) return write(path, String.valueOf(parameters.getOrDefault(CONTENT, "")));
        return CompletableFuture.failedFuture(new ToolExecutionException("Unknown file operation: " + op));
    }

    public CompletableFuture<String> read(String path) {
        return CompletableFuture.supplyAsync(() -> {
            var file = paths.resolve(path);
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ToolExecutionException("Cannot read " + file + ": " + e.getMessage(), e);
            }
        }, exe);
    }

    /** Writes the content and completes with the physical path written. */
    public CompletableFuture<String> write(String path, String content) {
        return CompletableFuture.supplyAsync(() -> {
            var file = paths.resolve(path);
            try {
                if (file.getParent() != null) Files.createDirectories(file.getParent());
                Files.writeString(file, content, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ToolExecutionException("Cannot write " + file + ": " + e.getMessage(), e);
            }
            debug("Wrote " + content.length() + " chars to " + file);
            return file.toString();
        }, exe);
    }
}
