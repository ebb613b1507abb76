package dumb.normcode.activate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dumb.normcode.Json;
import dumb.normcode.activate.wi.WorkingInterpretation.AssigningMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.Looping;
import dumb.normcode.perceive.Norms;
import dumb.normcode.perceive.PerceptualSign;
import dumb.normcode.plan.Annotations;
import dumb.normcode.plan.Comment;
import dumb.normcode.plan.FlowAddress;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static dumb.normcode.activate.Problem.Code.*;

/**
 * Scans the plan tree and emits one record per value concept (merged by name across all its occurrences)
 * and one per function concept.
 */
public class ConceptTableBuilder {

    public ConceptTable build(List<PlanGroup> plan, List<Problem> problems) {
        var producers = producers(plan, problems);
        checkAddresses(plan, problems);

        var values = new LinkedHashMap<String, Merged>();
        var functions = new LinkedHashMap<String, Merged>();
        for (var g : plan) {
            var cti = g.conceptToInfer();
            (cti.isFunction() ? functions.computeIfAbsent(cti.body(), k -> new Merged(cti))
                    : values.computeIfAbsent(cti.conceptName(), k -> new Merged(cti))).add(cti);
            functions.computeIfAbsent(g.functionConcept().body(), k -> new Merged(g.functionConcept())).add(g.functionConcept());
            for (var v : g.valueConcepts())
                values.computeIfAbsent(v.conceptName(), k -> new Merged(v)).add(v);
            for (var o : g.otherConcepts()) {
                if (o.isContext()) values.computeIfAbsent(o.conceptName(), k -> new Merged(o)).add(o);
                else if (o.isFunction()) functions.computeIfAbsent(o.body(), k -> new Merged(o)).add(o);
            }
        }
        for (var g : plan) {
            if (Syntax.sequence(g.functionConcept()).orElse(null) != SequenceType.LOOPING) continue;
            loopElement(g.functionConcept()).ifPresent(name -> values.computeIfAbsent(name, k -> new Merged(null)));
        }

        var records = new ArrayList<ConceptRecord>();
        values.forEach((name, m) -> valueRecord(name, m, producers, problems).ifPresent(records::add));
        functions.forEach((body, m) -> functionRecord(body, m, producers, problems).ifPresent(records::add));
        return new ConceptTable(records);
    }

    /** Who produces what: value names and gated function bodies mapped to the flow indices of their producers. */
    private Producers producers(List<PlanGroup> plan, List<Problem> problems) {
        var p = new Producers();
        for (var g : plan) {
            var cti = g.conceptToInfer();
            var fn = g.functionConcept();
            var at = cti.flowIndex();
            if (cti.isFunction()) p.functions.add(cti.body());
            else p.values.computeIfAbsent(cti.conceptName(), k -> new ArrayList<>()).add(at);

            var seq = Syntax.sequence(fn);
            if (seq.isPresent() && seq.get() == SequenceType.ASSIGNING
                    && Syntax.assigningMarker(fn).orElse(null) == AssigningMarker.ABSTRACTION)
                Syntax.faceValue(fn.body()).ifPresent(v -> p.abstractions.put(cti.conceptName(), v));
            if (seq.isPresent() && seq.get() == SequenceType.LOOPING)
                loopElement(fn).ifPresent(name -> p.values.computeIfAbsent(name, k -> new ArrayList<>()).add(at));

            for (var nested : g.nestedFunctions()) {
                if (Syntax.sequence(nested).orElse(null) == SequenceType.TIMING) p.functions.add(fn.body());
                else problems.add(new Problem(UNRESOLVABLE_FUNCTION_BODY, nested.flowIndex(),
                        "Only timing operators may be nested under a function: '" + nested.body() + "'"));
            }
        }
        p.values.forEach((name, flows) -> {
            if (new HashSet<>(flows).size() > 1)
                problems.add(new Problem(MULTIPLE_PRODUCERS, flows.get(1),
                        "Concept '" + name + "' is produced by more than one inference: " + flows));
        });
        return p;
    }

    static Optional<String> loopElement(Occurrence fn) {
        var base = Annotations.arg(Syntax.SOURCES, fn.body()).map(Annotations::bare);
        var index = Annotations.arg(Syntax.LOOP_INDEX, fn.body()).map(String::strip);
        if (base.isEmpty() || index.isEmpty() || !index.get().matches("\\d+")) return Optional.empty();
        return Optional.of(Looping.currentElement(base.get(), Integer.parseInt(index.get())));
    }

    private void checkAddresses(List<PlanGroup> plan, List<Problem> problems) {
        var seen = new HashMap<String, String>();
        for (var g : plan) {
            var all = new ArrayList<Occurrence>();
            all.add(g.conceptToInfer());
            all.add(g.functionConcept());
            all.addAll(g.valueConcepts());
            all.addAll(g.otherConcepts());
            for (var o : all) {
                if (o.flowIndex() == null) {
                    problems.add(new Problem(MALFORMED_FLOW_ADDRESS, null, "Occurrence '" + o.conceptName() + o.ncMain() + "' has no flow index"));
                    continue;
                }
                try {
                    FlowAddress.parse(o.flowIndex());
                } catch (IllegalArgumentException e) {
                    problems.add(new Problem(MALFORMED_FLOW_ADDRESS, o.flowIndex(), e.getMessage()));
                    continue;
                }
                var key = o.isFunction() ? "fn:" + o.body() : "v:" + o.conceptName();
                var prev = seen.putIfAbsent(o.flowIndex(), key);
                if (prev != null && !prev.equals(key))
                    problems.add(new Problem(DUPLICATE_FLOW_ADDRESS, o.flowIndex(),
                            "Flow address used by both " + prev.substring(prev.indexOf(':') + 1) + " and " + key.substring(key.indexOf(':') + 1)));
            }
        }
    }

    private Optional<ConceptRecord> valueRecord(String name, Merged m, Producers producers, List<Problem> problems) {
        var comments = m.comments;
        var literal = Syntax.literal(name);
        var fileLocation = Annotations.value(comments, Norms.FILE_LOCATION);
        var refElement = Annotations.value(comments, "ref_element");
        var value = Annotations.value(comments, "value");
        var abstraction = producers.abstractions.get(name);
        var produced = producers.values.containsKey(name);

        var declaredGround = Annotations.groundMarker(comments) || fileLocation.isPresent() || literal.isPresent()
                || value.isPresent() || refElement.filter(ConceptRecord.PERCEPTUAL_SIGN::equals).isPresent();
        if (produced && abstraction == null && declaredGround) {
            problems.add(new Problem(MULTIPLE_PRODUCERS, producers.values.get(name).get(0),
                    "Concept '" + name + "' is declared ground but is also produced by an inference"));
        }
        var ground = abstraction != null || !produced;

        JsonNode data = null;
        if (fileLocation.isPresent()) data = TextNode.valueOf(PerceptualSign.of(Norms.FILE_LOCATION, fileLocation.get()).encode());
        else if (value.isPresent()) data = PerceptualSign.isSign(value.get()) ? TextNode.valueOf(value.get()) : Json.parseOrText(value.get());
        else if (literal.isPresent()) data = TextNode.valueOf(literal.get());
        else if (abstraction != null) data = abstraction;

        String element = null;
        if (data != null)
            element = data.isTextual() && PerceptualSign.isSign(data.asText()) ? ConceptRecord.PERCEPTUAL_SIGN : ConceptRecord.LITERAL;

        var conceptType = m.first != null ? m.first.conceptType() : "object";
        return Optional.of(new ConceptRecord(
                "c-" + Syntax.slug(name),
                Syntax.displayName(name, conceptType),
                name,
                ConceptRecord.Kind.VALUE,
                Syntax.typeMarker(conceptType),
                conceptType,
                element,
                m.sortedFlows(),
                ground,
                m.isFinal,
                data,
                Annotations.axes(comments)));
    }

    private Optional<ConceptRecord> functionRecord(String body, Merged m, Producers producers, List<Problem> problems) {
        var seq = m.first == null ? Optional.<SequenceType>empty() : Syntax.sequence(m.first);
        if (body.isBlank() || seq.isEmpty()) {
            problems.add(new Problem(UNRESOLVABLE_FUNCTION_BODY, m.firstFlow(),
                    "Function concept '" + body + "' has no resolvable action body"));
            return Optional.empty();
        }
        var semantic = seq.get().semantic();
        var judgement = seq.get() == SequenceType.JUDGEMENT || Syntax.hasAssertion(body);

        JsonNode data = null;
        var provision = Annotations.value(m.comments, "v_input_provision");
        if (provision.isPresent()) {
            var path = provision.get();
            var tag = path.endsWith(".md") || path.endsWith(".txt") ? Norms.PROMPT_LOCATION
                    : path.endsWith(".py") || path.endsWith(".sh") ? Norms.SCRIPT_LOCATION : Norms.FILE_LOCATION;
            data = TextNode.valueOf(PerceptualSign.of(tag, path).encode());
        }

        return Optional.of(new ConceptRecord(
                "fc-" + Syntax.slug(body),
                body,
                body,
                ConceptRecord.Kind.FUNCTION,
                judgement ? "<{}>" : "({})",
                judgement ? "judgement" : "operation",
                semantic ? ConceptRecord.PARADIGM : ConceptRecord.OPERATOR,
                m.sortedFlows(),
                !producers.functions.contains(body),
                false,
                data,
                List.of(Annotations.NONE_AXIS)));
    }

    private static class Producers {
        final Map<String, List<String>> values = new LinkedHashMap<>();
        final Set<String> functions = new HashSet<>();
        final Map<String, JsonNode> abstractions = new HashMap<>();
    }

    /** All occurrences of one concept folded together. */
    private static class Merged {
        final Occurrence first;
        final Set<String> flows = new LinkedHashSet<>();
        final List<Comment> comments = new ArrayList<>();
        boolean isFinal;

        Merged(Occurrence first) {
            this.first = first;
        }

        void add(Occurrence o) {
            if (o.flowIndex() != null) flows.add(o.flowIndex());
            comments.addAll(o.attachedComments());
            isFinal |= o.isFinal();
        }

        String firstFlow() {
            return first != null ? first.flowIndex() : null;
        }

        List<String> sortedFlows() {
            var sorted = new TreeSet<FlowAddress>();
            flows.forEach(f -> FlowAddress.tryParse(f).ifPresent(sorted::add));
            return sorted.stream().map(FlowAddress::toString).toList();
        }
    }
}
