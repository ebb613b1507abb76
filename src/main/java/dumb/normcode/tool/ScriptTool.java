package dumb.normcode.tool;

import dumb.normcode.Tool;
import dumb.normcode.perceive.PathMap;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static dumb.normcode.Log.debug;
import static dumb.normcode.Log.error;
import static java.util.Objects.requireNonNull;

/**
 * Runs a script as a subprocess: the inputs arrive as JSON on stdin, whatever it prints on stdout is the result.
 * {@code .py} runs under python3, {@code .sh} under sh, anything else is executed directly.
 */
public class ScriptTool implements Tool {

    public static final String NAME = "script";
    public static final String SCRIPT = "script";
    public static final String INPUT = "input";

    private final PathMap paths;
    private final Executor exe;
    private final Duration timeout;

    public ScriptTool(PathMap paths, Executor exe, Duration timeout) {
        this.paths = requireNonNull(paths);
        this.exe = requireNonNull(exe);
        this.timeout = requireNonNull(timeout);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Runs a script with JSON input on stdin and returns its stdout.";
    }

    @Override
    public CompletableFuture<?> execute(Map<String, Object> parameters) {
        var script = (String) parameters.get(SCRIPT);
        if (script == null || script.isBlank()) {
            error("ScriptTool requires a 'script' parameter.");
            return CompletableFuture.failedFuture(new ToolExecutionException("Missing 'script' parameter."));
        }
        var input = String.valueOf(parameters.getOrDefault(INPUT, "[]"));
        return run(script, input);
    }

    /** Cancelling the returned future kills the script together with anything it started. */
    public CompletableFuture<String> run(String script, String input) {
        var process = new AtomicReference<Process>();
        var result = new CompletableFuture<String>();
        result.whenComplete((out, t) -> {
            if (result.isCancelled()) kill(process.get());
        });
        exe.execute(() -> {
            if (result.isDone()) return;
            try {
                result.complete(exec(paths.resolve(script), input, result, process));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private String exec(Path file, String input, CompletableFuture<String> result, AtomicReference<Process> process) {
        var cmd = new ArrayList<String>();
        var name = file.getFileName().toString();
        if (name.endsWith(".py")) cmd.add("python3");
        else if (name.endsWith(".sh")) cmd.add("sh");
        cmd.add(file.toString());

        Process p = null;
        Path out = null, err = null;
        try {
            out = Files.createTempFile("normcode-script", ".out");
            err = Files.createTempFile("normcode-script", ".err");
            p = new ProcessBuilder(cmd)
                    .directory(paths.baseDir().toFile())
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            process.set(p);
            if (result.isCancelled()) kill(p);
            try (var stdin = p.getOutputStream()) {
                stdin.write(input.getBytes(StandardCharsets.UTF_8));
            }
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS))
                throw new ToolExecutionException("Script " + file + " timed out after " + timeout.toSeconds() + "s");
            if (result.isCancelled())
                throw new ToolExecutionException("Script " + file + " was cancelled");
            var code = p.exitValue();
            if (code != 0)
                throw new ToolExecutionException("Script " + file + " exited with " + code + ": " + Files.readString(err).strip());
            debug("Script " + file + " finished");
            return Files.readString(out, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ToolExecutionException("Cannot run " + file + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while running " + file, e);
        } finally {
            kill(p);
            delete(out);
            delete(err);
        }
    }

    private static void kill(Process p) {
        if (p == null || !p.isAlive()) return;
        debug("Killing script process " + p.pid());
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
    }

    private static void delete(Path f) {
        if (f == null) return;
        try {
            Files.deleteIfExists(f);
        } catch (IOException e) {
            debug("Cannot delete " + f + ": " + e.getMessage());
        }
    }
}
