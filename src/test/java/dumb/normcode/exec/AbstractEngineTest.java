package dumb.normcode.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import dumb.normcode.Tools;
import dumb.normcode.activate.Activation;
import dumb.normcode.activate.Repositories;
import dumb.normcode.perceive.Codec;
import dumb.normcode.perceive.Norms;
import dumb.normcode.perceive.PathMap;
import dumb.normcode.plan.PlanGroup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertTrue;

public abstract class AbstractEngineTest {

    protected static final Duration TEST_TOOL_TIMEOUT = Duration.ofSeconds(5);
    protected static final int TEST_MAX_CYCLES = 50;

    @TempDir
    protected Path dir;

    protected ExecutorService exe;
    protected Codec codec;
    protected Tools tools;
    protected Paradigms paradigms;
    private final List<Engine> engines = new ArrayList<>();

    @BeforeEach
    protected void setUp() {
        exe = Executors.newFixedThreadPool(4);
        codec = Norms.codec(new PathMap(dir), dir.resolve("store"));
        tools = new Tools();
        paradigms = Paradigms.builtins()
                .add("double", in -> IntNode.valueOf(in.get(0).asInt() * 2))
                .add("add", in -> IntNode.valueOf(in.stream().mapToInt(JsonNode::asInt).sum()));
    }

    @AfterEach
    protected void tearDown() {
        engines.forEach(Engine::close);
        exe.shutdownNow();
    }

    protected Repositories compile(List<PlanGroup> plan) {
        return new Activation(codec).activate(plan).repositories();
    }

    protected Engine.Options options() {
        return new Engine.Options(TEST_MAX_CYCLES, 4, TEST_TOOL_TIMEOUT, 0);
    }

    protected Engine engine(List<PlanGroup> plan) {
        return engine("test-run", compile(plan), options());
    }

    protected Engine engine(String runId, Repositories repos, Engine.Options options) {
        var e = new Engine(runId, repos, codec, paradigms, tools, exe, options);
        engines.add(e);
        return e;
    }

    protected static Engine.Result completed(Engine e) {
        var r = e.run();
        assertTrue(r.status() == Engine.RunStatus.COMPLETED, () -> "Run ended " + r.status() + " with errors " + r.errors());
        return r;
    }
}
