package dumb.normcode.activate;

import dumb.normcode.activate.wi.ValueSelector;
import dumb.normcode.activate.wi.ValueSelector.Branch;
import dumb.normcode.activate.wi.WorkingInterpretation;
import dumb.normcode.activate.wi.WorkingInterpretation.Assigning;
import dumb.normcode.activate.wi.WorkingInterpretation.AssigningMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.Grouping;
import dumb.normcode.activate.wi.WorkingInterpretation.GroupingMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.Semantic;
import dumb.normcode.perceive.Codec;
import dumb.normcode.plan.Occurrence;
import dumb.normcode.plan.PlanGroup;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dumb.normcode.activate.Problem.Code.UNRESOLVABLE_SELECTOR_SOURCE;

/**
 * Reconciles the flat named inputs paradigms expect with concepts the plan built by grouping.
 * Each input whose value traces back to a grouping is replaced in the value order by one synthesized key per
 * extractable part, each described by a {@link ValueSelector} on the consumed concept.
 */
public class ProvenanceResolver {

    public static final String SEPARATOR = "/";
    public static final String SPREAD = "*";

    private final ConceptTable concepts;
    private final Map<String, InferenceRecord> producers;

    /**
     * @param producers inference records keyed by the natural name of the concept they produce
     */
    public ProvenanceResolver(ConceptTable concepts, Map<String, InferenceRecord> producers) {
        this.concepts = concepts;
        this.producers = producers;
    }

    public static boolean synthesized(String key) {
        return key.contains(SEPARATOR);
    }

    public Semantic resolve(Semantic wi, PlanGroup group, String flowIndex, List<Problem> problems) {
        var packed = new HashSet<String>();
        for (var v : group.valueConcepts())
            if (packed(v)) packed.add(v.conceptName());

        var order = new LinkedHashMap<String, Integer>();
        var selectors = new LinkedHashMap<String, ValueSelector>(wi.valueSelectors());
        var expanded = false;
        var pos = 0;
        for (var name : wi.orderedInputs()) {
            var grouping = packed.contains(name) || synthesized(name) ? Optional.<Grouping>empty() : origin(name);
            if (grouping.isEmpty()) {
                order.put(name, ++pos);
                continue;
            }
            expanded = true;
            var g = grouping.get();
            var branch = branch(name, g);
            if (g.marker() == GroupingMarker.IN) {
                for (var source : g.sources()) {
                    var key = name + SEPARATOR + source;
                    order.put(key, ++pos);
                    selectors.put(key, ValueSelector.key(name, source, branch));
                }
            } else {
                var key = name + SEPARATOR + SPREAD;
                order.put(key, ++pos);
                selectors.put(key, ValueSelector.spread(name, branch));
            }
        }

        for (var e : selectors.entrySet()) {
            if (concepts.value(e.getValue().sourceConcept()).isEmpty())
                problems.add(new Problem(UNRESOLVABLE_SELECTOR_SOURCE, flowIndex,
                        "Selector '" + e.getKey() + "' reads unknown concept '" + e.getValue().sourceConcept() + "'"));
        }
        return expanded ? wi.withInputs(order, selectors) : wi;
    }

    /** Walks back through identities and single-source specifications to the grouping that built {@code name}. */
    Optional<Grouping> origin(String name) {
        var seen = new HashSet<String>();
        var current = name;
        while (current != null && seen.add(current)) {
            var rec = producers.get(current);
            if (rec == null) return Optional.empty();
            var wi = rec.workingInterpretation();
            if (wi instanceof Grouping g) return Optional.of(g);
            current = passThrough(wi);
        }
        return Optional.empty();
    }

    private static @Nullable String passThrough(WorkingInterpretation wi) {
        if (!(wi instanceof Assigning a)) return null;
        if (a.marker() == AssigningMarker.IDENTITY) return a.identity().canonical();
        if (a.marker() == AssigningMarker.SPECIFICATION && a.specification().sources().size() == 1)
            return a.specification().sources().get(0);
        return null;
    }

    /**
     * BEFORE when the consumed concept itself is a sign that must be resolved into the grouped structure first,
     * AFTER when the grouped parts are signs, none otherwise.
     */
    private @Nullable Branch branch(String consumed, Grouping g) {
        if (concepts.value(consumed).map(ConceptRecord::isSign).orElse(false)) return Branch.BEFORE;
        for (var s : g.sources())
            if (signTyped(s)) return Branch.AFTER;
        return null;
    }

    private boolean signTyped(String name) {
        if (concepts.value(name).map(ConceptRecord::isSign).orElse(false)) return true;
        var rec = producers.get(name);
        if (rec != null && rec.workingInterpretation() instanceof Semantic sem) {
            var shape = sem.outputShape();
            return shape != null && !Codec.LITERAL.equals(shape);
        }
        return false;
    }

    static boolean packed(Occurrence o) {
        return o.annotation("packed").map(Boolean::parseBoolean).orElse(false);
    }
}
