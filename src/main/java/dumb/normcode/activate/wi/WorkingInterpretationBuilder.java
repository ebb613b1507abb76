package dumb.normcode.activate.wi;

import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.Problem;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.EnumMap;
import java.util.Map;

/** Dispatches to the strategy registered for an inference's sequence type. */
public class WorkingInterpretationBuilder {

    private final Map<SequenceType, InterpretationBuilder> strategies = new EnumMap<>(SequenceType.class);

    public WorkingInterpretationBuilder() {
        register(new ImperativeBuilder());
        register(new JudgementBuilder());
        register(new AssigningBuilder());
        register(new GroupingBuilder());
        register(new TimingBuilder());
        register(new LoopingBuilder());
    }

    public WorkingInterpretationBuilder register(InterpretationBuilder b) {
        strategies.put(b.type(), b);
        return this;
    }

    public WorkingInterpretation build(SequenceType type, PlanGroup group, Occurrence function, ConceptTable concepts) {
        var s = strategies.get(type);
        if (s == null)
            throw new Problem.Violation(Problem.Code.UNRESOLVABLE_FUNCTION_BODY, "No interpretation strategy for " + type);
        return s.build(group, function, concepts);
    }
}
