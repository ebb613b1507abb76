package dumb.normcode.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.Json;
import dumb.normcode.activate.Repositories;
import dumb.normcode.perceive.PerceptualSign;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/** Durable snapshot of a run after one cycle. */
public record Checkpoint(
        @JsonProperty("run_id") String runId,
        @JsonProperty("cycle") int cycle,
        @JsonProperty("inference_count") int inferenceCount,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("blackboard") JsonNode blackboard,
        @JsonProperty("workspace") JsonNode workspace,
        @JsonProperty("tracker") JsonNode tracker,
        @JsonProperty("completed_concepts") List<String> completedConcepts,
        @JsonProperty("signatures") Map<String, String> signatures
) {
    public static final String CONCEPT = "concept:";
    public static final String INFERENCE = "inference:";

    public Checkpoint {
        requireNonNull(runId);
        requireNonNull(timestamp);
        blackboard = blackboard == null ? Json.node() : blackboard;
        workspace = workspace == null ? Json.node() : workspace;
        tracker = tracker == null ? Json.node() : tracker;
        completedConcepts = completedConcepts == null ? List.of() : List.copyOf(completedConcepts);
        signatures = signatures == null ? Map.of() : Map.copyOf(signatures);
    }

    /** SHA-256 of every concept and inference record, keyed {@code concept:<id>} and {@code inference:<flow>}. */
    public static Map<String, String> signatures(Repositories repos) {
        var out = new TreeMap<String, String>();
        repos.concepts().forEach(c -> out.put(CONCEPT + c.id(), PerceptualSign.digest(Json.compact(c))));
        repos.inferences().forEach(r -> out.put(INFERENCE + r.flowIndex(), PerceptualSign.digest(Json.compact(r))));
        return out;
    }

    /** The executions recorded during this checkpoint's own cycle, read from the tracker history. */
    public List<Execution> executions() {
        var out = new ArrayList<Execution>();
        for (var e : tracker.path("history")) {
            if (e.path("cycle").asInt() != cycle) continue;
            out.add(new Execution(cycle, e.path("flow_index").asText(), text(e, "sequence"), text(e, "concept"),
                    e.path("status").asText(), text(e, "message")));
        }
        return out;
    }

    private static @Nullable String text(JsonNode n, String field) {
        var v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    public record Execution(@JsonProperty("cycle") int cycle,
                            @JsonProperty("flow_index") String flowIndex,
                            @JsonProperty("inference_type") @Nullable String inferenceType,
                            @JsonProperty("concept_inferred") @Nullable String conceptInferred,
                            @JsonProperty("status") String status,
                            @JsonProperty("message") @Nullable String message) {
    }

    public record Summary(@JsonProperty("cycle") int cycle,
                          @JsonProperty("inference_count") int inferenceCount,
                          @JsonProperty("timestamp") Instant timestamp) {
    }

    public record Run(@JsonProperty("run_id") String runId,
                      @JsonProperty("checkpoints") int checkpoints,
                      @JsonProperty("last_cycle") int lastCycle,
                      @JsonProperty("updated") Instant updated) {
    }
}
