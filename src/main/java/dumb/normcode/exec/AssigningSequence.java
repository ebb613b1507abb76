package dumb.normcode.exec;

import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Assigning;
import dumb.normcode.exec.Blackboard.ConceptState;
import dumb.normcode.exec.Paradigm.ActuationException;
import dumb.normcode.plan.Annotations;

import static dumb.normcode.Log.debug;

public class AssigningSequence extends OperatorSequence {

    @Override
    public SequenceType type() {
        return SequenceType.ASSIGNING;
    }

    @Override
    protected Outcome run(Step s) throws ActuationException {
        var wi = (Assigning) s.inference().workingInterpretation();
        return switch (wi.marker()) {
            case IDENTITY -> {
                var id = wi.identity();
                var value = s.require(id.canonical());
                s.blackboard().alias(id.alias(), id.canonical());
                yield new Outcome.Commit(value);
            }
            case ABSTRACTION -> new Outcome.Commit(Reference.of(wi.abstraction().axes(), wi.abstraction().faceValue()));
            case SPECIFICATION -> specify(s, wi);
            case CONTINUATION -> {
                var c = wi.continuation();
                yield new Outcome.Commit(s.require(c.destination()).concat(s.require(c.source()), c.groupingAxes().get(0)));
            }
            case DERELATION -> {
                var sel = wi.selector();
                var source = s.require(sel.sourceConcept());
                var picked = source.map(v -> Selectors.select(v, sel));
                if (sel.spreads()) {
                    var axes = s.output().axes();
                    picked = picked.expand(axes.isEmpty() || axes.get(0).equals(Annotations.NONE_AXIS) ? sel.sourceConcept() + "*" : axes.get(0));
                }
                yield new Outcome.Commit(picked);
            }
        };
    }

    /** First committed candidate in declaration order; skipped candidates are passed over. */
    private static Outcome specify(Step s, Assigning wi) throws ActuationException {
        var failed = false;
        for (var name : wi.specification().sources()) {
            var state = s.state(name);
            if (state == ConceptState.COMMITTED) {
                debug(s.flow() + " specified by " + name);
                return new Outcome.Commit(s.require(name));
            }
            failed |= state == ConceptState.FAILED || state == ConceptState.BLOCKED;
        }
        if (failed) return new Outcome.Fail("No candidate of " + wi.specification().sources() + " was committed");
        return new Outcome.Skip("Every candidate of " + wi.specification().sources() + " was skipped");
    }
}
