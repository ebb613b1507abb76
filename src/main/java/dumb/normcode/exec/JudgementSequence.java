package dumb.normcode.exec;

import com.fasterxml.jackson.databind.node.BooleanNode;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Judgement;
import dumb.normcode.activate.wi.WorkingInterpretation.Quantifier;
import dumb.normcode.activate.wi.WorkingInterpretation.Semantic;
import dumb.normcode.perceive.Norms;

/**
 * Compares each paradigm result with the assertion's expected truth value.
 * ALL reduces to one boolean; FOR EACH keeps one boolean per element.
 */
public class JudgementSequence extends SemanticSequence {

    @Override
    public SequenceType type() {
        return SequenceType.JUDGEMENT;
    }

    @Override
    protected Outcome conclude(Semantic wi, Reference result) {
        var assertion = ((Judgement) wi).assertionCondition();
        var expected = assertion.condition();
        var checked = result.map(v -> BooleanNode.valueOf(Norms.truthy(v) == expected));
        if (assertion.quantifier() == Quantifier.FOR_EACH)
            return new Outcome.Commit(checked);
        var all = new boolean[]{true};
        checked.map(v -> {
            all[0] &= v.booleanValue();
            return v;
        });
        return new Outcome.Commit(Reference.scalar(BooleanNode.valueOf(all[0])));
    }
}
