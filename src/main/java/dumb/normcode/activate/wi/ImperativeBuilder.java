package dumb.normcode.activate.wi;

import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.Map;

public class ImperativeBuilder extends SemanticBuilder {

    @Override
    public SequenceType type() {
        return SequenceType.IMPERATIVE;
    }

    @Override
    public WorkingInterpretation build(PlanGroup group, Occurrence function, ConceptTable concepts) {
        return new WorkingInterpretation.Imperative(
                paradigm(function),
                bodyFaculty(function),
                valueOrder(group),
                Map.of(),
                values(group, concepts),
                outputShape(function));
    }
}
