package dumb.normcode.exec;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.Json;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Grouping;
import dumb.normcode.activate.wi.WorkingInterpretation.GroupingMarker;
import dumb.normcode.exec.Paradigm.ActuationException;

import java.util.ArrayList;

/**
 * {@code in} builds one relation object per aligned element, keyed by source name;
 * {@code across} builds one flat list per element and lays it out along the created axis.
 * Grouping axes not protected are collapsed into the elements first.
 */
public class GroupingSequence extends OperatorSequence {

    @Override
    public SequenceType type() {
        return SequenceType.GROUPING;
    }

    @Override
    protected Outcome run(Step s) throws ActuationException {
        var wi = (Grouping) s.inference().workingInterpretation();
        var collapse = new ArrayList<>(wi.axisConcepts());
        collapse.removeAll(wi.protectAxes());

        var refs = new ArrayList<Reference>();
        for (var source : wi.sources()) refs.add(s.require(source).collapse(collapse));

        if (wi.marker() == GroupingMarker.IN) {
            return new Outcome.Commit(Reference.crossApply(refs, args -> {
                var rel = Json.node();
                for (var i = 0; i < args.size(); i++) rel.set(wi.sources().get(i), args.get(i));
                return rel;
            }));
        }
        var lists = Reference.crossApply(refs, args -> {
            var flat = Json.array();
            for (JsonNode a : args) {
                if (a.isArray()) a.forEach(flat::add);
                else flat.add(a);
            }
            return flat;
        });
        return new Outcome.Commit(lists.expand(wi.createAxis()));
    }
}
