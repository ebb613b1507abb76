package dumb.normcode;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import dumb.normcode.activate.ActivationException;
import dumb.normcode.activate.Problem;
import dumb.normcode.checkpoint.Checkpoint;
import dumb.normcode.exec.Engine;
import dumb.normcode.exec.Paradigms;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static dumb.normcode.Plans.a;
import static dumb.normcode.Plans.function;
import static dumb.normcode.Plans.plan;
import static dumb.normcode.Plans.root;
import static dumb.normcode.Plans.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NormCodeTest {

    @TempDir
    Path dir;

    private ExecutorService lmExe;
    private NormCode n;

    @BeforeEach
    void setUp() {
        lmExe = Executors.newSingleThreadExecutor();
        var model = new ChatLanguageModel() {
            @Override
            public Response<AiMessage> generate(List<ChatMessage> messages) {
                return Response.from(AiMessage.from("ok"));
            }
        };
        var cfg = new NormCode.Configuration(null, null, 20, 2, 5, 0, dir.toString(), "cp.db", true, null);
        n = new NormCode(cfg, new LM(model, lmExe));
    }

    @AfterEach
    void tearDown() {
        n.close();
        lmExe.shutdownNow();
    }

    private Path planFile(String name, Object plan) throws IOException {
        var f = dir.resolve(name);
        Files.writeString(f, Json.str(plan));
        return f;
    }

    @Test
    void configurationDefaults() throws IOException {
        var f = dir.resolve(NormCode.CONFIG_FILE);
        Files.writeString(f, """
                {
                  "maxCycles": 12,
                  "pathMap": {"data/in.json": "fixtures/in.json"}
                }
                """);
        var c = NormCode.Configuration.load(f);
        assertEquals(12, c.maxCycles());
        assertEquals(NormCode.DEFAULT_WORKERS, c.workers());
        assertEquals(NormCode.DEFAULT_CHECKPOINT_DB, c.checkpointDb());
        assertEquals(LM.DEFAULT_LLM_MODEL, c.llmModel());
        assertTrue(c.eagerResourceCheck());
        assertEquals(Map.of("data/in.json", "fixtures/in.json"), c.pathMap());

        var overridden = c.with(null, 8, 2);
        assertEquals(12, overridden.maxCycles());
        assertEquals(8, overridden.workers());
        assertEquals(2, overridden.retries());
    }

    @Test
    void badOrMissingConfigurationFallsBack() throws IOException {
        assertEquals(new NormCode.Configuration(), NormCode.Configuration.load(dir.resolve("absent.json")));
        var f = dir.resolve("broken.json");
        Files.writeString(f, "{ not json");
        assertEquals(new NormCode.Configuration(), NormCode.Configuration.load(f));
    }

    @Test
    void activateThenRunThenResume() throws IOException {
        var plan = planFile("plan.json", Plans.chain(2, 5, Paradigms.IDENTITY));
        var out = dir.resolve("repos");
        var summary = n.activate(plan, out).summary();
        assertEquals(2, summary.inferences());

        var r = n.run(out, "r1", false, null);
        assertEquals(Engine.RunStatus.COMPLETED, r.status());
        assertEquals(2, r.cycles());
        assertEquals(List.of(1, 2), n.store().list("r1").stream().map(Checkpoint.Summary::cycle).toList());

        var again = n.run(out, "r1", true, null);
        assertEquals(Engine.RunStatus.COMPLETED, again.status());
        assertEquals(2, n.store().list("r1").size());

        var forked = n.run(out, "r1", true, 1);
        assertEquals(Engine.RunStatus.COMPLETED, forked.status());
        assertEquals("r1-r1", forked.runId());
        assertEquals(List.of(2), n.store().list("r1-r1").stream().map(Checkpoint.Summary::cycle).toList());
        assertEquals(List.of("r1", "r1-r1"), n.store().listRuns().stream().map(Checkpoint.Run::runId).toList());

        var history = n.store().executions("r1");
        assertEquals(List.of("1.2", "1"), history.stream().map(Checkpoint.Execution::flowIndex).toList());
        assertEquals(List.of(1, 2), history.stream().map(Checkpoint.Execution::cycle).toList());
        assertEquals("c-x2", history.get(1).conceptInferred());
        assertEquals(List.of("1"), n.store().executions("r1-r1").stream().map(Checkpoint.Execution::flowIndex).toList());
    }

    @Test
    void resumingTheSameCycleAgainForksAnotherRun() throws IOException {
        var out = dir.resolve("repos");
        n.activate(planFile("plan.json", Plans.chain(3, 1, Paradigms.IDENTITY)), out);
        n.run(out, "r1", false, null);

        var first = n.run(out, "r1", true, 1);
        var second = n.run(out, "r1", true, 1);
        assertEquals("r1-r1", first.runId());
        assertEquals("r1-r1-2", second.runId());
        assertEquals(Engine.RunStatus.COMPLETED, second.status());
        assertEquals(List.of(2, 3), n.store().list("r1-r1-2").stream().map(Checkpoint.Summary::cycle).toList());
        assertEquals(List.of(2, 3), n.store().list("r1-r1").stream().map(Checkpoint.Summary::cycle).toList());
    }

    @Test
    void freshRunRejectsUsedRunId() throws IOException {
        var out = dir.resolve("repos");
        n.activate(planFile("plan.json", Plans.chain(1, 1, Paradigms.IDENTITY)), out);
        n.run(out, "r1", false, null);
        assertThrows(IllegalArgumentException.class, () -> n.run(out, "r1", false, null));
        assertEquals(1, n.store().list("r1").size());
    }

    @Test
    void failedActivationWritesNothing() throws IOException {
        var plan = planFile("bad.json", plan()
                .group(root("y", "1"), function("::(double {x})", "1.1", a("norm_input", "no_such_paradigm")),
                        value("x", "1.2", a("value", "5")))
                .build());
        var out = dir.resolve("repos");
        var ex = assertThrows(ActivationException.class, () -> n.activate(plan, out));
        assertTrue(ex.has(Problem.Code.UNKNOWN_PARADIGM));
        assertFalse(Files.exists(out));
    }

    @Test
    void logMessagesAreEmittedAsEvents() throws Exception {
        var wrote = new CountDownLatch(1);
        n.events.on(Events.LogMessageEvent.class, e -> {
            if (e.level() == Log.LogLevel.INFO && e.message().startsWith("Wrote ")) wrote.countDown();
        });
        n.activate(planFile("plan.json", Plans.chain(1, 1, Paradigms.IDENTITY)), dir.resolve("repos"));
        assertTrue(wrote.await(5, TimeUnit.SECONDS));
    }

    @Test
    void resumeNeedsKnownRun() throws IOException {
        var out = dir.resolve("repos");
        n.activate(planFile("plan.json", Plans.chain(1, 1, Paradigms.IDENTITY)), out);
        assertThrows(IllegalArgumentException.class, () -> n.run(out, "never-ran", true, null));
        assertThrows(IllegalArgumentException.class, () -> n.run(out, null, true, null));
    }
}
