package dumb.normcode.exec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.Json;
import dumb.normcode.activate.InferenceRecord;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.exec.Blackboard.Status;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Cycle count, per-execution history, completion order and attempt counts of one run. */
public class Tracker {

    private int cycle;
    private final List<Execution> history = new ArrayList<>();
    private final List<String> completionOrder = new ArrayList<>();
    private final Map<String, Integer> attempts = new TreeMap<>();
    private int succeeded, failed, skipped, retried;

    public int cycle() {
        return cycle;
    }

    public int nextCycle() {
        return ++cycle;
    }

    public void record(InferenceRecord r, Status status, @Nullable String message) {
        var flowIndex = r.flowIndex().toString();
        history.add(new Execution(cycle, flowIndex, r.sequence(), r.conceptToInfer(), status, message));
        switch (status) {
            case COMPLETED -> {
                succeeded++;
                completionOrder.add(flowIndex);
            }
            case FAILED, BLOCKED -> failed++;
            case SKIPPED -> skipped++;
            default -> {
            }
        }
    }

    /** Counts one more attempt of the inference and returns the total. */
    public int attempt(String flowIndex) {
        return attempts.merge(flowIndex, 1, Integer::sum);
    }

    public void retried() {
        retried++;
    }

    public void resetAttempts(String flowIndex) {
        attempts.remove(flowIndex);
    }

    public List<Execution> history() {
        return List.copyOf(history);
    }

    public List<String> completionOrder() {
        return List.copyOf(completionOrder);
    }

    public int succeeded() {
        return succeeded;
    }

    public int failed() {
        return failed;
    }

    public int skipped() {
        return skipped;
    }

    public int retries() {
        return retried;
    }

    public JsonNode snapshot() {
        return Json.node(new State(cycle, history, completionOrder, attempts, succeeded, failed, skipped, retried));
    }

    public static Tracker restore(JsonNode snapshot) throws JsonProcessingException {
        var s = Json.obj(snapshot, State.class);
        var t = new Tracker();
        t.cycle = s.cycle();
        if (s.history() != null) t.history.addAll(s.history());
        if (s.completionOrder() != null) t.completionOrder.addAll(s.completionOrder());
        if (s.attempts() != null) t.attempts.putAll(s.attempts());
        t.succeeded = s.succeeded();
        t.failed = s.failed();
        t.skipped = s.skipped();
        t.retried = s.retried();
        return t;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Execution(@JsonProperty("cycle") int cycle,
                            @JsonProperty("flow_index") String flowIndex,
                            @JsonProperty("sequence") @Nullable SequenceType sequence,
                            @JsonProperty("concept") @Nullable String concept,
                            @JsonProperty("status") Status status,
                            @JsonProperty("message") @Nullable String message) {
    }

    record State(@JsonProperty("cycle") int cycle,
                 @JsonProperty("history") List<Execution> history,
                 @JsonProperty("completion_order") List<String> completionOrder,
                 @JsonProperty("attempts") Map<String, Integer> attempts,
                 @JsonProperty("succeeded") int succeeded,
                 @JsonProperty("failed") int failed,
                 @JsonProperty("skipped") int skipped,
                 @JsonProperty("retried") int retried) {
    }
}
