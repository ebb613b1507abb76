package dumb.normcode.activate.wi;

import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.Problem;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.Syntax;
import dumb.normcode.plan.Annotations;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.List;

public class GroupingBuilder implements InterpretationBuilder {

    @Override
    public SequenceType type() {
        return SequenceType.GROUPING;
    }

    @Override
    public WorkingInterpretation build(PlanGroup group, Occurrence function, ConceptTable concepts) {
        var body = function.body();
        var marker = Syntax.groupingMarker(body).orElseThrow(() ->
                new Problem.Violation(Problem.Code.UNRECOGNIZED_MARKER, "Unrecognized grouping marker in '" + body + "'"));
        var sources = Annotations.arg(Syntax.SOURCES, body).map(Annotations::list)
                .orElseGet(() -> group.valueConcepts().stream().map(Occurrence::conceptName).toList());
        var axes = Annotations.arg(Syntax.AXES, body).map(Annotations::list).orElse(List.of());
        var protect = Annotations.value(function.attachedComments(), "protect_axes").map(Annotations::list).orElse(List.of());
        var create = Annotations.arg(Syntax.CREATE_AXIS, body).map(Annotations::bare).orElse(null);
        return new WorkingInterpretation.Grouping(marker, sources, axes, protect, create);
    }
}
