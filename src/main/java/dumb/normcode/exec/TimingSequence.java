package dumb.normcode.exec;

import com.fasterxml.jackson.databind.node.BooleanNode;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Timing;
import dumb.normcode.activate.wi.WorkingInterpretation.TimingMarker;
import dumb.normcode.exec.Paradigm.ActuationException;
import dumb.normcode.perceive.Norms;

/**
 * Gates its output on the condition concept. {@code after} opens once the condition is committed;
 * {@code if} and {@code if-negated} open on a truthy or falsy condition, otherwise the output is skipped.
 * An open gate commits the first other input when there is one, true otherwise.
 */
public class TimingSequence extends OperatorSequence {

    @Override
    public SequenceType type() {
        return SequenceType.TIMING;
    }

    @Override
    protected Outcome run(Step s) throws ActuationException {
        var wi = (Timing) s.inference().workingInterpretation();
        var condition = s.require(wi.condition());
        if (wi.marker() != TimingMarker.AFTER) {
            var truth = Norms.truthy(s.codec().perceive(condition.data()));
            if (truth != (wi.marker() == TimingMarker.IF))
                return new Outcome.Skip("Condition '" + wi.condition() + "' is " + truth);
        }
        var conditionId = s.id(wi.condition()).orElse(null);
        for (var id : s.inference().valueConcepts()) {
            if (id.equals(conditionId)) continue;
            var v = s.blackboard().value(id);
            if (v.isPresent()) return new Outcome.Commit(v.get());
        }
        return new Outcome.Commit(Reference.scalar(BooleanNode.TRUE));
    }
}
