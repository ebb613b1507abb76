package dumb.normcode.tool;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dumb.normcode.Tool;
import dumb.normcode.exec.AbstractEngineTest;
import dumb.normcode.exec.Blackboard.Status;
import dumb.normcode.exec.Engine;
import dumb.normcode.perceive.PathMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.file.Files;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static dumb.normcode.Plans.a;
import static dumb.normcode.Plans.function;
import static dumb.normcode.Plans.plan;
import static dumb.normcode.Plans.root;
import static dumb.normcode.Plans.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolsTest extends AbstractEngineTest {

    @Test
    void fileSystemWritesThenReads() throws Exception {
        var fs = new FileSystemTool(new PathMap(dir), exe);
        var written = fs.execute(Map.of(FileSystemTool.OPERATION, FileSystemTool.WRITE,
                FileSystemTool.PATH, "out/notes.txt", FileSystemTool.CONTENT, "line one")).join();
        assertEquals(dir.resolve("out/notes.txt").toString(), written);
        assertEquals("line one", fs.read("out/notes.txt").join());

        var missing = assertThrows(CompletionException.class, () -> fs.read("nope.txt").join());
        assertInstanceOf(Tool.ToolExecutionException.class, missing.getCause());
        var bad = assertThrows(CompletionException.class, () -> fs.execute(Map.of(FileSystemTool.OPERATION, "delete",
                FileSystemTool.PATH, "out/notes.txt")).join());
        assertTrue(bad.getCause().getMessage().contains("delete"));
    }

    @Test
    void toolsRejectDuplicates() {
        tools.add(new FileSystemTool(new PathMap(dir), exe));
        assertThrows(IllegalArgumentException.class, () -> tools.add(new FileSystemTool(new PathMap(dir), exe)));
        assertThrows(Tool.ToolExecutionException.class, () -> tools.require("missing"));
    }

    @Test
    void fileParadigmsThroughEngine() throws Exception {
        tools.add(new FileSystemTool(new PathMap(dir), exe));
        Files.writeString(dir.resolve("in.txt"), "42");
        var e = engine(plan()
                .group(root("saved", "1"), function("::(save {path} {n})", "1.1", a("norm_input", "file_write"), a("body_faculty", "file_system")),
                        value("path", "1.2", a("value", "\"copy.txt\"")), value("n", "1.3"))
                .group(value("n", "1.3"), function("::(load {source})", "1.3.1", a("norm_input", "file_read")),
                        value("source", "1.3.2", a("value", "\"in.txt\"")))
                .build());
        completed(e);
        assertEquals(IntNode.valueOf(42), e.value("n").orElseThrow().data());
        assertEquals("42", Files.readString(dir.resolve("copy.txt")));
        assertEquals(TextNode.valueOf(dir.resolve("copy.txt").toString()), e.value("saved").orElseThrow().data());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void scriptReadsInputsFromStdin() throws Exception {
        Files.writeString(dir.resolve("echo.sh"), "cat\n");
        Files.writeString(dir.resolve("fail.sh"), "echo broken >&2\nexit 3\n");
        var script = new ScriptTool(new PathMap(dir), exe, Duration.ofSeconds(10));
        assertEquals("[1,2]", script.run("echo.sh", "[1,2]").join());
        var failed = assertThrows(CompletionException.class, () -> script.run("fail.sh", "[]").join());
        assertTrue(failed.getCause().getMessage().contains("exited with 3"), failed.getCause().getMessage());
        assertTrue(failed.getCause().getMessage().contains("broken"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void scriptParadigmThroughEngine() throws Exception {
        tools.add(new ScriptTool(new PathMap(dir), exe, Duration.ofSeconds(10)));
        Files.writeString(dir.resolve("first.sh"), "cut -c2\n");
        var e = engine(plan()
                .group(root("first", "1"), function("::(first of {xs})", "1.1", a("norm_input", "script"), a("v_input_provision", "first.sh")),
                        value("xs", "1.2", a("value", "7")))
                .build());
        completed(e);
        assertEquals(IntNode.valueOf(7), e.value("first").orElseThrow().data());
        assertEquals(Status.COMPLETED, e.status("1"));
    }

    private static final String SLOW_SCRIPT = "touch started.marker\nsleep 1\ntouch survived.marker\n";

    private void awaitFile(String name) throws InterruptedException {
        var f = dir.resolve(name);
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!Files.exists(f) && System.nanoTime() < deadline) Thread.sleep(10);
        assertTrue(Files.exists(f), name + " never appeared");
    }

    private Engine slowScriptEngine(Duration callTimeout) throws Exception {
        tools.add(new ScriptTool(new PathMap(dir), exe, Duration.ofSeconds(10)));
        Files.writeString(dir.resolve("slow.sh"), SLOW_SCRIPT);
        var plan = plan()
                .group(root("out", "1"), function("::(slow {x})", "1.1", a("norm_input", "script"), a("v_input_provision", "slow.sh")),
                        value("x", "1.2", a("value", "1")))
                .build();
        return engine("slow", compile(plan), new Engine.Options(TEST_MAX_CYCLES, 4, callTimeout, 0));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cancellingScriptKillsProcess() throws Exception {
        Files.writeString(dir.resolve("slow.sh"), SLOW_SCRIPT);
        var script = new ScriptTool(new PathMap(dir), exe, Duration.ofSeconds(10));
        var f = script.run("slow.sh", "[]");
        awaitFile("started.marker");
        assertTrue(f.cancel(true));
        Thread.sleep(1500);
        assertFalse(Files.exists(dir.resolve("survived.marker")));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cancelledInferenceKillsItsScript() throws Exception {
        var e = slowScriptEngine(TEST_TOOL_TIMEOUT);
        var run = CompletableFuture.supplyAsync(e::run);
        awaitFile("started.marker");
        assertTrue(e.cancel("1"));
        var r = run.get(5, TimeUnit.SECONDS);
        assertEquals(Status.FAILED, e.status("1"));
        assertEquals("Actuation cancelled", r.errors().get("1"));
        Thread.sleep(1500);
        assertFalse(Files.exists(dir.resolve("survived.marker")));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void timedOutInferenceKillsItsScript() throws Exception {
        var e = slowScriptEngine(Duration.ofMillis(300));
        var r = e.run();
        assertEquals(Status.FAILED, e.status("1"));
        assertEquals("Actuation timed out", r.errors().get("1"));
        Thread.sleep(1500);
        assertFalse(Files.exists(dir.resolve("survived.marker")));
    }
}
