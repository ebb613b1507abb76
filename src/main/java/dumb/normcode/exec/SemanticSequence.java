package dumb.normcode.exec;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.activate.ConceptRecord;
import dumb.normcode.activate.wi.ValueSelector;
import dumb.normcode.activate.wi.WorkingInterpretation.Semantic;
import dumb.normcode.exec.Paradigm.ActuationException;
import dumb.normcode.exec.Paradigm.Actuation;
import dumb.normcode.perceive.Codec;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Perception, composition and actuation shared by imperatives and judgements: the paradigm is called once per
 * element of the cross product of the inputs, each call bounded by the tool timeout.
 */
abstract class SemanticSequence implements Sequence {

    @Override
    public CompletableFuture<Outcome> execute(Step s) {
        var wi = (Semantic) s.inference().workingInterpretation();
        Paradigm paradigm;
        List<Input> inputs;
        try {
            paradigm = s.paradigms().require(wi.paradigm());
            inputs = inputs(s, wi);
        } catch (ActuationException e) {
            return CompletableFuture.completedFuture(new Outcome.Fail(e.getMessage(), e));
        }
        var vertical = s.concepts().get(s.inference().functionConcept()).map(ConceptRecord::referenceData).orElse(null);

        var calls = new Calls();
        var out = CompletableFuture.supplyAsync(() -> perceive(s.codec(), inputs), s.executor())
                .thenCompose(refs -> actuate(s, wi, paradigm, vertical == null ? null : s.codec().perceive(vertical), inputs, refs, calls))
                .thenApply(result -> format(s.codec(), wi.outputShape(), conclude(wi, result)))
                .exceptionally(t -> {
                    var e = ActuationException.of(t);
                    return new Outcome.Fail(e.getMessage(), e);
                });
        out.whenComplete((o, t) -> {
            if (t != null) calls.abandon();
        });
        return out;
    }

    /** Turns the per-element paradigm results into what is committed. */
    protected abstract Outcome conclude(Semantic wi, Reference result);

    /** Reads the references behind each position of the value order; nothing is perceived yet. */
    private static List<Input> inputs(Step s, Semantic wi) throws ActuationException {
        var out = new ArrayList<Input>();
        for (var name : wi.orderedInputs()) {
            var sel = wi.valueSelectors().get(name);
            Reference ref;
            if (sel != null) ref = s.require(sel.sourceConcept());
            else if (s.value(name).isPresent()) ref = s.value(name).get();
            else if (wi.values().containsKey(name)) ref = Reference.scalar(wi.values().get(name));
            else throw new ActuationException("Input '" + name + "' has no committed value");
            out.add(new Input(name, ref, sel));
        }
        return out;
    }

    private static List<Reference> perceive(Codec codec, List<Input> inputs) {
        var out = new ArrayList<Reference>(inputs.size());
        for (var in : inputs) {
            var sel = in.selector();
            if (sel == null) out.add(in.ref().map(codec::perceive));
            else if (sel.branch() == ValueSelector.Branch.BEFORE) out.add(in.ref().map(v -> Selectors.select(codec.perceive(v), sel)));
            else out.add(in.ref().map(v -> codec.perceive(Selectors.select(v, sel))));
        }
        return out;
    }

    private static CompletableFuture<Reference> actuate(Step s, Semantic wi, Paradigm paradigm, @Nullable JsonNode vertical,
                                                        List<Input> inputs, List<Reference> refs, Calls pending) {
        var layout = Reference.Layout.of(refs);
        var positions = layout.positions();
        var calls = new ArrayList<CompletableFuture<JsonNode>>(positions.size());
        for (var at : positions) {
            var args = new ArrayList<JsonNode>();
            var values = layout.args(refs, at);
            for (var i = 0; i < values.size(); i++) {
                var v = values.get(i);
                var sel = inputs.get(i).selector();
                if (sel != null && sel.spreads() && v.isArray()) v.forEach(args::add);
                else args.add(v);
            }
            var a = new Actuation(s.flow(), vertical, args, wi.bodyFaculty(), s.tools(), s.timeout());
            calls.add(pending.add(paradigm.actuate(a).orTimeout(s.timeout().toMillis(), TimeUnit.MILLISECONDS)));
        }
        var all = CompletableFuture.allOf(calls.toArray(CompletableFuture[]::new));
        all.whenComplete((x, t) -> {
            if (t != null) pending.abandon();
        });
        return all.thenApply(x -> {
            var results = new HashMap<Map<String, Integer>, JsonNode>();
            for (var i = 0; i < positions.size(); i++) results.put(positions.get(i), calls.get(i).join());
            return Reference.tabulate(layout.axes(), layout.sizes(), at -> results.get(at));
        });
    }

    private static Outcome format(Codec codec, @Nullable String shape, Outcome outcome) {
        if (shape == null || Codec.LITERAL.equals(shape) || !(outcome instanceof Outcome.Commit c)) return outcome;
        return new Outcome.Commit(c.value().map(v -> codec.format(v, shape)));
    }

    private record Input(String name, Reference ref, @Nullable ValueSelector selector) {
    }

    /** The paradigm calls of one execution. Once abandoned, calls added later are cancelled as they arrive. */
    private static final class Calls {
        private final List<CompletableFuture<?>> futures = new CopyOnWriteArrayList<>();
        private volatile boolean abandoned;

        <T> CompletableFuture<T> add(CompletableFuture<T> f) {
            futures.add(f);
            if (abandoned) f.cancel(true);
            return f;
        }

        void abandon() {
            abandoned = true;
            futures.forEach(f -> f.cancel(true));
        }
    }
}
