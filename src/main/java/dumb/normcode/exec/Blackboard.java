package dumb.normcode.exec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.Json;
import dumb.normcode.plan.FlowAddress;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Execution state of one run: the value and state of every concept, the status of every inference,
 * errors by flow address, aliases recorded by identity assignments and execution counts.
 * Owned by the engine thread; actuations never touch it.
 */
public class Blackboard {

    private final Map<String, Slot> concepts = new TreeMap<>();
    private final Map<FlowAddress, Status> items = new TreeMap<>();
    private final Map<String, String> errors = new TreeMap<>();
    private final Map<String, String> aliases = new TreeMap<>();
    private final Map<String, Integer> executions = new TreeMap<>();

    public ConceptState state(String conceptId) {
        var s = concepts.get(conceptId);
        return s == null ? ConceptState.EMPTY : s.state();
    }

    public Optional<Reference> value(String conceptId) {
        var s = concepts.get(conceptId);
        return s == null || s.state() != ConceptState.COMMITTED ? Optional.empty() : Optional.ofNullable(s.value());
    }

    public void commit(String conceptId, Reference value) {
        concepts.put(conceptId, new Slot(ConceptState.COMMITTED, value));
    }

    public void mark(String conceptId, ConceptState state) {
        concepts.put(conceptId, new Slot(state, null));
    }

    public void clear(String conceptId) {
        concepts.remove(conceptId);
    }

    public Status status(FlowAddress flow) {
        return items.getOrDefault(flow, Status.PENDING);
    }

    public void status(FlowAddress flow, Status status) {
        items.put(flow, status);
    }

    public Map<FlowAddress, Status> statuses() {
        return new TreeMap<>(items);
    }

    public void error(FlowAddress flow, String message) {
        errors.put(flow.toString(), message);
    }

    public void clearError(FlowAddress flow) {
        errors.remove(flow.toString());
    }

    public Map<String, String> errors() {
        return new TreeMap<>(errors);
    }

    public void alias(String alias, String canonical) {
        aliases.put(alias, canonical);
    }

    public Optional<String> canonical(String alias) {
        return Optional.ofNullable(aliases.get(alias));
    }

    public int executed(FlowAddress flow) {
        return executions.merge(flow.toString(), 1, Integer::sum);
    }

    public int executions(FlowAddress flow) {
        return executions.getOrDefault(flow.toString(), 0);
    }

    /** Concept ids in the committed state, sorted. */
    public List<String> committed() {
        return concepts.entrySet().stream().filter(e -> e.getValue().state() == ConceptState.COMMITTED).map(Map.Entry::getKey).toList();
    }

    public JsonNode snapshot() {
        var items = new LinkedHashMap<String, Status>();
        this.items.forEach((k, v) -> items.put(k.toString(), v));
        return Json.node(new State(concepts, items, errors, aliases, executions));
    }

    public static Blackboard restore(JsonNode snapshot) throws JsonProcessingException {
        var s = Json.obj(snapshot, State.class);
        var b = new Blackboard();
        if (s.concepts() != null) b.concepts.putAll(s.concepts());
        if (s.items() != null) s.items().forEach((k, v) -> b.items.put(FlowAddress.parse(k), v));
        if (s.errors() != null) b.errors.putAll(s.errors());
        if (s.aliases() != null) b.aliases.putAll(s.aliases());
        if (s.executions() != null) b.executions.putAll(s.executions());
        return b;
    }

    public enum ConceptState {
        EMPTY, COMMITTED, FAILED, SKIPPED, BLOCKED;

        public boolean settled() {
            return this != EMPTY;
        }
    }

    public enum Status {
        PENDING, IN_PROGRESS, COMPLETED, FAILED, SKIPPED, BLOCKED;

        public boolean terminal() {
            return this == COMPLETED || this == FAILED || this == SKIPPED || this == BLOCKED;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Slot(@JsonProperty("state") ConceptState state, @JsonProperty("value") @Nullable Reference value) {
    }

    record State(@JsonProperty("concepts") Map<String, Slot> concepts,
                 @JsonProperty("items") Map<String, Status> items,
                 @JsonProperty("errors") Map<String, String> errors,
                 @JsonProperty("aliases") Map<String, String> aliases,
                 @JsonProperty("executions") Map<String, Integer> executions) {
    }
}
