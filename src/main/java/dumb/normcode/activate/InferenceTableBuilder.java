package dumb.normcode.activate;

import dumb.normcode.activate.wi.WorkingInterpretation;
import dumb.normcode.activate.wi.WorkingInterpretation.Looping;
import dumb.normcode.activate.wi.WorkingInterpretation.Semantic;
import dumb.normcode.activate.wi.WorkingInterpretation.Timing;
import dumb.normcode.activate.wi.WorkingInterpretationBuilder;
import dumb.normcode.perceive.Codec;
import dumb.normcode.perceive.PerceptualSign;
import dumb.normcode.plan.FlowAddress;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dumb.normcode.activate.Problem.Code.*;

/**
 * Assembles one inference record per plan group (plus one per nested timing operator),
 * then resolves selectors for grouped inputs and checks the referential invariants.
 */
public class InferenceTableBuilder {

    private final WorkingInterpretationBuilder interpretations;
    private final @Nullable Codec codec;

    public InferenceTableBuilder(WorkingInterpretationBuilder interpretations, @Nullable Codec codec) {
        this.interpretations = interpretations;
        this.codec = codec;
    }

    public List<InferenceRecord> build(List<PlanGroup> plan, ConceptTable concepts, List<Problem> problems) {
        var drafts = new ArrayList<Draft>();
        for (var g : plan) {
            checkHierarchy(g, problems);
            draft(g, g.functionConcept(), g.conceptToInfer(), concepts, problems).ifPresent(drafts::add);
            for (var nested : g.nestedFunctions()) {
                if (Syntax.sequence(nested).orElse(null) == SequenceType.TIMING)
                    draft(g, nested, g.functionConcept(), concepts, problems).ifPresent(drafts::add);
            }
        }

        var byFlow = new HashMap<FlowAddress, Draft>();
        for (var d : drafts)
            if (byFlow.putIfAbsent(d.record.flowIndex(), d) != null)
                problems.add(new Problem(DUPLICATE_FLOW_ADDRESS, d.record.flowIndex().toString(), "Two inferences share this flow address"));

        var producers = producers(drafts, concepts);
        var resolver = new ProvenanceResolver(concepts, producers);
        var out = new ArrayList<InferenceRecord>();
        for (var d : drafts) {
            var rec = d.record;
            if (rec.workingInterpretation() instanceof Semantic sem) {
                try {
                    rec = rec.with(resolver.resolve(sem, d.group, rec.flowIndex().toString(), problems));
                } catch (Problem.Violation v) {
                    problems.add(v.at(rec.flowIndex().toString()));
                }
            }
            out.add(rec);
        }

        checkInputNorms(drafts, concepts, producers, problems);
        checkReferences(out, concepts, problems);
        out.sort(null);
        return out;
    }

    private Optional<Draft> draft(PlanGroup g, Occurrence function, Occurrence output, ConceptTable concepts, List<Problem> problems) {
        var flow = output == g.conceptToInfer() ? g.conceptToInfer().flowIndex() : function.flowIndex();
        var address = FlowAddress.tryParse(flow);
        var seq = Syntax.sequence(function);
        if (address.isEmpty() || seq.isEmpty()) return Optional.empty(); // already reported by the concept table

        WorkingInterpretation wi;
        try {
            wi = interpretations.build(seq.get(), g, function, concepts);
        } catch (Problem.Violation v) {
            problems.add(v.at(flow));
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            problems.add(new Problem(MISSING_SELECTOR, flow, e.getMessage()));
            return Optional.empty();
        }

        var outputId = output.isFunction() ? functionId(output.body(), concepts) : valueId(output.conceptName(), concepts);
        var functionId = functionId(function.body(), concepts);

        var values = new LinkedHashSet<String>();
        var contexts = new LinkedHashSet<String>();
        if (function == g.functionConcept()) {
            g.valueConcepts().forEach(v -> values.add(valueId(v.conceptName(), concepts)));
            g.contextConcepts().forEach(c -> contexts.add(valueId(c.conceptName(), concepts)));
        }
        if (wi instanceof Timing t) {
            var cond = concepts.value(t.condition());
            if (cond.isEmpty()) {
                problems.add(new Problem(MISSING_CONDITION, flow, "Condition concept '" + t.condition() + "' does not occur in the plan"));
                return Optional.empty();
            }
            values.add(cond.get().id());
        }
        if (wi instanceof Looping l) {
            concepts.value(l.baseConcept()).ifPresentOrElse(c -> values.add(c.id()),
                    () -> problems.add(new Problem(MISSING_LOOP_BASE, flow, "Base concept '" + l.baseConcept() + "' does not occur in the plan")));
            concepts.value(l.currentElement()).ifPresent(c -> {
                values.remove(c.id());
                contexts.add(c.id());
            });
            l.carry().keySet().forEach(name -> concepts.value(name).ifPresent(c -> contexts.add(c.id())));
        }

        var rec = new InferenceRecord(address.get(), seq.get(), outputId, functionId,
                List.copyOf(values), List.copyOf(contexts), wi);
        return Optional.of(new Draft(g, rec, function == g.functionConcept()));
    }

    private void checkHierarchy(PlanGroup g, List<Problem> problems) {
        var root = FlowAddress.tryParse(g.conceptToInfer().flowIndex());
        if (root.isEmpty()) return;
        var members = new ArrayList<Occurrence>();
        members.add(g.functionConcept());
        members.addAll(g.valueConcepts());
        members.addAll(g.otherConcepts());
        for (var o : members) {
            FlowAddress.tryParse(o.flowIndex()).filter(a -> !a.isDescendantOf(root.get())).ifPresent(a ->
                    problems.add(new Problem(NON_HIERARCHICAL_ADDRESS, a.toString(),
                            "'" + (o.isFunction() ? o.body() : o.conceptName()) + "' is not nested under " + root.get())));
        }
    }

    /** Producing inference per produced value concept, including each loop's current element. */
    private static Map<String, InferenceRecord> producers(List<Draft> drafts, ConceptTable concepts) {
        var producers = new LinkedHashMap<String, InferenceRecord>();
        for (var d : drafts) {
            concepts.get(d.record.conceptToInfer()).filter(c -> !c.isFunction())
                    .ifPresent(c -> producers.putIfAbsent(c.naturalName(), d.record));
            if (d.record.workingInterpretation() instanceof Looping l)
                producers.putIfAbsent(l.currentElement(), d.record);
        }
        return producers;
    }

    /** A declared input norm must agree with how the consumed concept arrives: as a sign of that tag, or as a literal. */
    private void checkInputNorms(List<Draft> drafts, ConceptTable concepts, Map<String, InferenceRecord> producers, List<Problem> problems) {
        for (var d : drafts) {
            if (!d.primary) continue;
            var flow = d.record.flowIndex().toString();
            for (var v : d.group.valueConcepts()) {
                var declared = v.annotation("input_norm").orElse(null);
                if (declared == null) continue;
                var concept = concepts.value(v.conceptName()).orElse(null);
                if (concept == null) continue;

                if (!Codec.LITERAL.equals(declared) && codec != null && !codec.knows(declared)) {
                    problems.add(new Problem(UNKNOWN_NORM, flow, "Input norm '" + declared + "' of '" + v.conceptName() + "' is not registered"));
                    continue;
                }
                var arriving = arrivingNorm(concept, producers.get(concept.naturalName()));
                if (Codec.LITERAL.equals(declared) != Codec.LITERAL.equals(arriving)) {
                    problems.add(new Problem(SIGN_LITERAL_MISMATCH, flow, "'" + v.conceptName() + "' arrives as "
                            + (Codec.LITERAL.equals(arriving) ? "a literal" : "a " + arriving + " sign") + " but is declared " + declared));
                } else if (!declared.equals(arriving)) {
                    problems.add(new Problem(NORM_MISMATCH, flow, "'" + v.conceptName() + "' arrives as " + arriving + " but is declared " + declared));
                }
            }
        }
    }

    private static String arrivingNorm(ConceptRecord concept, @Nullable InferenceRecord producer) {
        if (concept.ground()) {
            var data = concept.referenceData();
            if (data != null && data.isTextual())
                return PerceptualSign.parse(data.asText()).map(s -> s.norm() == null ? Codec.LITERAL : s.norm()).orElse(Codec.LITERAL);
            return Codec.LITERAL;
        }
        if (producer != null && producer.workingInterpretation() instanceof Semantic sem && sem.outputShape() != null)
            return sem.outputShape();
        return Codec.LITERAL;
    }

    /** No dangling function concepts; every consumed value concept is ground or produced exactly once. */
    private static void checkReferences(List<InferenceRecord> records, ConceptTable concepts, List<Problem> problems) {
        var produced = new HashMap<String, String>();
        for (var r : records) {
            var prev = produced.putIfAbsent(r.conceptToInfer(), r.flowIndex().toString());
            if (prev != null)
                problems.add(new Problem(MULTIPLE_PRODUCERS, r.flowIndex().toString(),
                        "Concept " + r.conceptToInfer() + " is also produced at " + prev));
            if (r.workingInterpretation() instanceof Looping l)
                concepts.value(l.currentElement()).ifPresent(c -> produced.putIfAbsent(c.id(), r.flowIndex().toString()));
        }
        for (var r : records) {
            var fn = concepts.get(r.functionConcept());
            if (fn.isEmpty() || !fn.get().isFunction())
                problems.add(new Problem(DANGLING_FUNCTION_CONCEPT, r.flowIndex().toString(),
                        "Function concept " + r.functionConcept() + " is not in the concept table"));
            var refs = new ArrayList<String>(r.valueConcepts());
            refs.addAll(r.contextConcepts());
            for (var id : refs) {
                var c = concepts.get(id);
                if (c.isEmpty())
                    problems.add(new Problem(DANGLING_VALUE_CONCEPT, r.flowIndex().toString(), "Value concept " + id + " is not in the concept table"));
                else if (!c.get().ground() && !produced.containsKey(id))
                    problems.add(new Problem(NO_PRODUCER, r.flowIndex().toString(), "Value concept " + id + " is neither ground nor produced"));
            }
        }
    }

    private static String valueId(String name, ConceptTable concepts) {
        return concepts.value(name).map(ConceptRecord::id).orElse("c-" + Syntax.slug(name));
    }

    private static String functionId(String body, ConceptTable concepts) {
        return concepts.function(body).map(ConceptRecord::id).orElse("fc-" + Syntax.slug(body));
    }

    private record Draft(PlanGroup group, InferenceRecord record, boolean primary) {
    }
}
