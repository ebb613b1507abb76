package dumb.normcode.activate.wi;

import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.Problem;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.Syntax;
import dumb.normcode.plan.Annotations;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

public class TimingBuilder implements InterpretationBuilder {

    @Override
    public SequenceType type() {
        return SequenceType.TIMING;
    }

    @Override
    public WorkingInterpretation build(PlanGroup group, Occurrence function, ConceptTable concepts) {
        var body = function.body();
        var marker = Syntax.timingMarker(body).orElseThrow(() ->
                new Problem.Violation(Problem.Code.UNRECOGNIZED_MARKER, "Unrecognized timing marker in '" + body + "'"));
        var condition = Annotations.arg(marker.symbol, body).map(Annotations::bare).orElse(null);
        return new WorkingInterpretation.Timing(marker, condition);
    }
}
