package dumb.normcode.activate.wi;

import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.Problem;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.Syntax;
import dumb.normcode.activate.wi.WorkingInterpretation.AssertionCondition;
import dumb.normcode.activate.wi.WorkingInterpretation.Quantifier;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.Map;

import static dumb.normcode.activate.Problem.Code.MISSING_ASSERTION_CONDITION;
import static dumb.normcode.activate.Problem.Code.UNKNOWN_ASSERTION_CONCEPT;

public class JudgementBuilder extends SemanticBuilder {

    @Override
    public SequenceType type() {
        return SequenceType.JUDGEMENT;
    }

    @Override
    public WorkingInterpretation build(PlanGroup group, Occurrence function, ConceptTable concepts) {
        var order = valueOrder(group);
        return new WorkingInterpretation.Judgement(
                paradigm(function),
                bodyFaculty(function),
                order,
                Map.of(),
                values(group, concepts),
                outputShape(function),
                assertion(function.body(), order));
    }

    static AssertionCondition assertion(String body, Map<String, Integer> order) {
        var m = Syntax.assertion(body);
        if (!m.find())
            throw new Problem.Violation(MISSING_ASSERTION_CONDITION, "No <ALL ...> or <FOR EACH {...} ...> assertion in '" + body + "'");
        var forEach = m.group(2);
        var condition = Boolean.parseBoolean(m.group(3).toLowerCase());
        if (forEach == null)
            return new AssertionCondition(Quantifier.ALL, null, condition);
        var name = forEach.strip();
        if (!order.containsKey(name))
            throw new Problem.Violation(UNKNOWN_ASSERTION_CONCEPT, "For-each concept '" + name + "' is not an input of the judgement");
        return new AssertionCondition(Quantifier.FOR_EACH, name, condition);
    }
}
