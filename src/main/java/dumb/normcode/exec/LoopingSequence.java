package dumb.normcode.exec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dumb.normcode.Json;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Looping;
import dumb.normcode.exec.Paradigm.ActuationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dumb.normcode.Log.debug;

/**
 * Runs the loop body once per element of the base collection. Each pass commits the current element and the
 * carried concepts; the engine then resets the body and calls back once the per-iteration concept is settled.
 * The final commit is the list of per-iteration results along the loop's grouping axis.
 */
public class LoopingSequence extends OperatorSequence {

    public static String key(String flowIndex) {
        return "loop:" + flowIndex;
    }

    @Override
    public SequenceType type() {
        return SequenceType.LOOPING;
    }

    /** Whether the loop at this step has handed an element to its body and waits for the result. */
    public static boolean awaiting(Map<String, JsonNode> workspace, String flowIndex) {
        var s = workspace.get(key(flowIndex));
        return s != null && s.path("awaiting").asBoolean(false);
    }

    @Override
    protected Outcome run(Step s) throws ActuationException {
        var wi = (Looping) s.inference().workingInterpretation();
        var key = key(s.flow());
        var state = load(s.workspace().get(key));
        var target = wi.conceptsToInfer().get(0);

        if (state.awaiting()) {
            switch (s.state(target)) {
                case COMMITTED -> {
                    var r = s.require(target);
                    state.results().add(r.data());
                    state = state.withAxes(r.axes());
                }
                case SKIPPED -> state.results().add(NullNode.getInstance());
                case FAILED, BLOCKED -> {
                    return new Outcome.Fail("Iteration " + state.index() + " of '" + wi.baseConcept() + "' failed at '" + target + "'");
                }
                default -> throw new ActuationException("Loop body of '" + wi.baseConcept() + "' has not settled '" + target + "'");
            }
            state = state.next(carried(s, wi));
        }

        var elements = s.require(wi.baseConcept()).elements();
        if (state.index() < elements.size()) {
            var commits = new LinkedHashMap<String, Reference>();
            commits.put(id(s, wi.currentElement()), elements.get(state.index()));
            for (var e : state.carries().entrySet()) commits.put(id(s, e.getKey()), e.getValue());
            debug(s.flow() + " iteration " + state.index() + " of " + elements.size());
            s.workspace().put(key, Json.node(state.await()));
            return new Outcome.Iterate(commits);
        }

        s.workspace().remove(key);
        var axes = new ArrayList<String>();
        axes.add(wi.groupKey());
        axes.addAll(state.axes());
        var data = Json.array();
        state.results().forEach(data::add);
        return new Outcome.Commit(Reference.of(axes, data));
    }

    private static Map<String, Reference> carried(Step s, Looping wi) {
        var out = new LinkedHashMap<String, Reference>();
        wi.carry().forEach((name, carry) -> s.value(carry.from()).ifPresent(v -> out.put(name, v)));
        return out;
    }

    private static String id(Step s, String name) throws ActuationException {
        return s.id(name).orElseThrow(() -> new ActuationException("Loop concept '" + name + "' is not in the concept table"));
    }

    private static State load(JsonNode node) throws ActuationException {
        if (node == null) return new State(0, false, new ArrayList<>(), Map.of(), List.of());
        try {
            var st = Json.obj(node, State.class);
            return new State(st.index(), st.awaiting(), new ArrayList<>(st.results()), st.carries(), st.axes());
        } catch (JsonProcessingException e) {
            throw new ActuationException("Corrupt loop state: " + e.getMessage(), e);
        }
    }

    record State(@JsonProperty("index") int index,
                 @JsonProperty("awaiting") boolean awaiting,
                 @JsonProperty("results") List<JsonNode> results,
                 @JsonProperty("carries") Map<String, Reference> carries,
                 @JsonProperty("axes") List<String> axes) {

        State {
            results = results == null ? new ArrayList<>() : results;
            carries = carries == null ? Map.of() : carries;
            axes = axes == null ? List.of() : axes;
        }

        State next(Map<String, Reference> carried) {
            return new State(index + 1, false, results, carried, axes);
        }

        State await() {
            return new State(index, true, results, carries, axes);
        }

        State withAxes(List<String> a) {
            return new State(index, awaiting, results, carries, a);
        }
    }
}
