package dumb.normcode.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.normcode.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointStoreTest {

    @TempDir
    Path dir;

    private CheckpointStore open(String kind) {
        return kind.equals("sqlite") ? new SqliteCheckpointStore(dir.resolve("db/checkpoints.db")) : new MemoryCheckpointStore();
    }

    private static Checkpoint checkpoint(String runId, int cycle) {
        var bb = Json.node();
        bb.put("cycle", cycle);
        return new Checkpoint(runId, cycle, cycle * 2, Instant.parse("2024-05-01T10:00:00Z").plusSeconds(cycle),
                bb, Json.node(), Json.node(), List.of("c-x" + cycle), Map.of("concept:c-x", "abc"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"memory", "sqlite"})
    void appendAndQuery(String kind) {
        try (var store = open(kind)) {
            for (var c = 1; c <= 3; c++) store.append(checkpoint("run", c));
            store.append(checkpoint("other", 1));

            var latest = store.latest("run").orElseThrow();
            assertEquals(3, latest.cycle());
            assertEquals(6, latest.inferenceCount());
            assertEquals(3, latest.blackboard().path("cycle").asInt());
            assertEquals(List.of("c-x3"), latest.completedConcepts());
            assertEquals(Map.of("concept:c-x", "abc"), latest.signatures());

            assertEquals(2, store.at("run", 2).orElseThrow().cycle());
            assertTrue(store.at("run", 7).isEmpty());
            assertTrue(store.latest("missing").isEmpty());

            assertEquals(List.of(1, 2, 3), store.list("run").stream().map(Checkpoint.Summary::cycle).toList());
            var runs = store.listRuns();
            assertEquals(List.of("other", "run"), runs.stream().map(Checkpoint.Run::runId).toList());
            assertEquals(3, runs.get(1).checkpoints());
            assertEquals(3, runs.get(1).lastCycle());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"memory", "sqlite"})
    void rejectsCycleNotAfterLast(String kind) {
        try (var store = open(kind)) {
            store.append(checkpoint("run", 2));
            assertThrows(CheckpointStore.StoreException.class, () -> store.append(checkpoint("run", 2)));
            assertThrows(CheckpointStore.StoreException.class, () -> store.append(checkpoint("run", 1)));
            store.append(checkpoint("run", 3));
            assertEquals(2, store.list("run").size());
        }
    }

    /** Tracker history is cumulative; each checkpoint contributes only its own cycle's executions. */
    private static Checkpoint withHistory(String runId, int cycle) throws JsonProcessingException {
        var history = new StringBuilder();
        for (var c = 1; c <= cycle; c++) {
            if (c > 1) history.append(',');
            history.append("""
                    {"cycle": %d, "flow_index": "1.%d", "sequence": "imperative", "concept": "c-x%d", "status": "COMPLETED"}
                    """.formatted(c, c, c));
        }
        var tracker = Json.the.readTree("{\"cycle\": " + cycle + ", \"history\": [" + history + "]}");
        return new Checkpoint(runId, cycle, cycle, Instant.parse("2024-05-01T10:00:00Z").plusSeconds(cycle),
                Json.node(), Json.node(), tracker, List.of(), Map.of());
    }

    @ParameterizedTest
    @ValueSource(strings = {"memory", "sqlite"})
    void executionsOfEachCycleAreListed(String kind) throws JsonProcessingException {
        try (var store = open(kind)) {
            store.append(withHistory("run", 1));
            store.append(withHistory("run", 2));
            store.append(checkpoint("run", 3));

            var executions = store.executions("run");
            assertEquals(List.of("1.1", "1.2"), executions.stream().map(Checkpoint.Execution::flowIndex).toList());
            var second = executions.get(1);
            assertEquals(2, second.cycle());
            assertEquals("imperative", second.inferenceType());
            assertEquals("c-x2", second.conceptInferred());
            assertEquals("COMPLETED", second.status());
            assertNull(second.message());
            assertTrue(store.executions("missing").isEmpty());
        }
    }

    @Test
    void sqliteSurvivesReopen() {
        var file = dir.resolve("checkpoints.db");
        try (var store = new SqliteCheckpointStore(file)) {
            store.append(checkpoint("run", 1));
        }
        try (var store = new SqliteCheckpointStore(file)) {
            assertEquals(1, store.latest("run").orElseThrow().cycle());
            assertEquals(Instant.parse("2024-05-01T10:00:01Z"), store.latest("run").orElseThrow().timestamp());
        }
    }
}
