package dumb.normcode.activate.wi;

import dumb.normcode.Json;
import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.Problem;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.Syntax;
import dumb.normcode.activate.wi.WorkingInterpretation.Abstraction;
import dumb.normcode.activate.wi.WorkingInterpretation.Continuation;
import dumb.normcode.activate.wi.WorkingInterpretation.Identity;
import dumb.normcode.activate.wi.WorkingInterpretation.Specification;
import dumb.normcode.plan.Annotations;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.List;
import java.util.Optional;

import static dumb.normcode.activate.Problem.Code.MISSING_MARKER_FIELDS;

public class AssigningBuilder implements InterpretationBuilder {

    @Override
    public SequenceType type() {
        return SequenceType.ASSIGNING;
    }

    @Override
    public WorkingInterpretation build(PlanGroup group, Occurrence function, ConceptTable concepts) {
        var marker = Syntax.assigningMarker(function).orElseThrow(() ->
                new Problem.Violation(Problem.Code.UNRECOGNIZED_MARKER, "Unrecognized assigning marker in '" + function.body() + "'"));
        var body = function.body();
        var inputs = group.valueConcepts().stream().map(Occurrence::conceptName).toList();
        var output = group.conceptToInfer();

        return switch (marker) {
            case IDENTITY -> {
                var pair = pair(marker.symbol, body);
                var canonical = pair.map(p -> p.get(0)).orElseGet(() -> first(inputs));
                var alias = pair.map(p -> p.get(1)).orElse(output.conceptName());
                yield new WorkingInterpretation.Assigning(marker, new Identity(canonical, alias), null, null, null, null);
            }
            case ABSTRACTION -> {
                var face = Syntax.faceValue(body)
                        .or(() -> Annotations.value(function.attachedComments(), "face_value").map(Json::parseOrText))
                        .orElse(null);
                yield new WorkingInterpretation.Assigning(marker, null, new Abstraction(face, Annotations.axes(output.attachedComments())), null, null, null);
            }
            case SPECIFICATION -> {
                var sources = Annotations.arg(Syntax.SOURCES, body).map(Annotations::list).orElse(inputs);
                yield new WorkingInterpretation.Assigning(marker, null, null, new Specification(sources), null, null);
            }
            case CONTINUATION -> {
                var pair = pair(marker.symbol, body).orElseThrow(() ->
                        new Problem.Violation(MISSING_MARKER_FIELDS, "Continuation needs $+({source}:{destination})"));
                var axes = Annotations.arg(Syntax.AXES, body).map(Annotations::list)
                        .or(() -> Annotations.value(function.attachedComments(), "grouping_axes").map(Annotations::list))
                        .orElse(List.of());
                yield new WorkingInterpretation.Assigning(marker, null, null, null, new Continuation(pair.get(0), pair.get(1), axes), null);
            }
            case DERELATION -> {
                var source = Annotations.arg(marker.symbol, body).map(Annotations::bare).orElseGet(() -> first(inputs));
                var comments = function.attachedComments();
                var index = Annotations.value(comments, "select_index").map(String::strip).map(Integer::valueOf).orElse(null);
                var key = Annotations.value(comments, "select_key").orElse(null);
                var unpack = Annotations.value(comments, "select_unpack").map(Boolean::parseBoolean).orElse(null);
                yield new WorkingInterpretation.Assigning(marker, null, null, null, null,
                        new ValueSelector(source, index, key, unpack, null));
            }
        };
    }

    /** {@code $x({a}:{b})} as the two bare names. */
    private static Optional<List<String>> pair(String symbol, String body) {
        return Annotations.arg(symbol, body)
                .map(a -> Annotations.splitTopLevel(a, ':'))
                .filter(p -> p.size() == 2)
                .map(p -> List.of(Annotations.bare(p.get(0)), Annotations.bare(p.get(1))));
    }

    private static String first(List<String> inputs) {
        return inputs.isEmpty() ? null : inputs.get(0);
    }
}
