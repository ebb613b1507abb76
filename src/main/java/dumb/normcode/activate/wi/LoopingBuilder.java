package dumb.normcode.activate.wi;

import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.Problem;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.Syntax;
import dumb.normcode.activate.wi.WorkingInterpretation.Carry;
import dumb.normcode.plan.Annotations;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.LinkedHashMap;
import java.util.List;

public class LoopingBuilder implements InterpretationBuilder {

    @Override
    public SequenceType type() {
        return SequenceType.LOOPING;
    }

    @Override
    public WorkingInterpretation build(PlanGroup group, Occurrence function, ConceptTable concepts) {
        var body = function.body();
        var base = Annotations.arg(Syntax.SOURCES, body).map(Annotations::bare).orElse(null);
        var targets = Annotations.arg(Syntax.TARGET, body).map(Annotations::list).orElse(List.of());
        var key = Annotations.arg(Syntax.AXES, body).map(Annotations::bare).orElse(null);
        var index = Annotations.arg(Syntax.LOOP_INDEX, body).map(String::strip).orElse(null);
        if (index == null || !index.matches("\\d+"))
            throw new Problem.Violation(Problem.Code.MISSING_LOOP_INDEX, "Loop index %@(n) missing or not a number in '" + body + "'");

        var carry = new LinkedHashMap<String, Carry>();
        for (var ctx : group.contextConcepts()) {
            ctx.annotation("carry_from").ifPresent(from -> carry.put(ctx.conceptName(), new Carry(Annotations.bare(from), 1)));
        }
        return new WorkingInterpretation.Looping(Integer.parseInt(index), base, null, key, carry, targets);
    }
}
