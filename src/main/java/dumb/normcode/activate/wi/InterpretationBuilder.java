package dumb.normcode.activate.wi;

import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

/**
 * Builds the working interpretation for one sequence type.
 * Implementations throw {@link dumb.normcode.activate.Problem.Violation} instead of returning a partial payload.
 */
public interface InterpretationBuilder {

    SequenceType type();

    /**
     * @param group    the plan group the inference comes from
     * @param function the function occurrence actually driving the inference (the group's own, or a nested operator)
     */
    WorkingInterpretation build(PlanGroup group, Occurrence function, ConceptTable concepts);
}
