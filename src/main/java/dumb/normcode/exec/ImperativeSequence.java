package dumb.normcode.exec;

import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Semantic;

public class ImperativeSequence extends SemanticSequence {

    @Override
    public SequenceType type() {
        return SequenceType.IMPERATIVE;
    }

    @Override
    protected Outcome conclude(Semantic wi, Reference result) {
        return new Outcome.Commit(result);
    }
}
