package dumb.normcode.exec;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.Tools;
import dumb.normcode.activate.ConceptRecord;
import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.InferenceRecord;
import dumb.normcode.exec.Blackboard.ConceptState;
import dumb.normcode.perceive.Codec;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Everything one execution of an inference may read. Built by the engine on its own thread;
 * anything a sequence hands to the executor must not touch the blackboard.
 */
public record Step(InferenceRecord inference,
                   Blackboard blackboard,
                   ConceptTable concepts,
                   Codec codec,
                   Paradigms paradigms,
                   Tools tools,
                   Map<String, JsonNode> workspace,
                   Executor executor,
                   Duration timeout) {

    public String flow() {
        return inference.flowIndex().toString();
    }

    public ConceptRecord output() {
        return concepts.require(inference.conceptToInfer());
    }

    /** Concept id of a value concept by natural name, following aliases recorded by identity assignments. */
    public Optional<String> id(String name) {
        var c = concepts.value(name);
        if (c.isPresent()) return Optional.of(c.get().id());
        return blackboard.canonical(name).flatMap(this::id);
    }

    public Optional<Reference> value(String name) {
        return id(name).flatMap(blackboard::value);
    }

    public Reference require(String name) throws Paradigm.ActuationException {
        return value(name).orElseThrow(() -> new Paradigm.ActuationException("Concept '" + name + "' has no committed value"));
    }

    public ConceptState state(String name) {
        return id(name).map(blackboard::state).orElse(ConceptState.EMPTY);
    }
}
