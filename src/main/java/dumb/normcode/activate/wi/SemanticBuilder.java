package dumb.normcode.activate.wi;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.activate.ConceptRecord;
import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.Problem;
import dumb.normcode.plan.Annotations;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;

import java.util.LinkedHashMap;
import java.util.Map;

/** Fields shared by imperatives and judgements: paradigm, faculty, value order, fixed values, output shape. */
abstract class SemanticBuilder implements InterpretationBuilder {

    protected static String paradigm(Occurrence function) {
        return Annotations.value(function.attachedComments(), "norm_input").orElse(null);
    }

    protected static String bodyFaculty(Occurrence function) {
        return Annotations.value(function.attachedComments(), "body_faculty").orElse(null);
    }

    protected static String outputShape(Occurrence function) {
        return Annotations.value(function.attachedComments(), "output_shape").orElse(null);
    }

    /** Input positions from explicit {@code <:{n}>} bindings, falling back to 1-based list position. */
    protected static Map<String, Integer> valueOrder(PlanGroup group) {
        var order = new LinkedHashMap<String, Integer>();
        var i = 0;
        for (var v : group.valueConcepts()) {
            i++;
            var pos = Annotations.binding(v.ncMain());
            var prev = order.put(v.conceptName(), pos.isPresent() ? pos.getAsInt() : i);
            if (prev != null)
                throw new Problem.Violation(Problem.Code.DUPLICATE_VALUE_POSITION,
                        "Value concept '" + v.conceptName() + "' is bound twice");
        }
        return order;
    }

    /** Literal data of ground inputs, so an executor reading only the payload still has them. */
    protected static Map<String, JsonNode> values(PlanGroup group, ConceptTable concepts) {
        var values = new LinkedHashMap<String, JsonNode>();
        for (var v : group.valueConcepts()) {
            concepts.value(v.conceptName())
                    .filter(c -> c.ground() && ConceptRecord.LITERAL.equals(c.elementType()))
                    .ifPresent(c -> values.put(c.naturalName(), c.referenceData()));
        }
        return values;
    }
}
