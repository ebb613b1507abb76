package dumb.normcode.activate.wi;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.normcode.activate.SequenceType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

import static dumb.normcode.activate.Problem.Code.*;
import static dumb.normcode.activate.Problem.require;

/**
 * The execution payload of one inference, discriminated by sequence type.
 * Every variant validates its required fields on construction, so a partially populated payload cannot exist.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "sequence")
@JsonSubTypes({
        @Type(value = WorkingInterpretation.Imperative.class, name = "imperative"),
        @Type(value = WorkingInterpretation.Judgement.class, name = "judgement"),
        @Type(value = WorkingInterpretation.Assigning.class, name = "assigning"),
        @Type(value = WorkingInterpretation.Grouping.class, name = "grouping"),
        @Type(value = WorkingInterpretation.Timing.class, name = "timing"),
        @Type(value = WorkingInterpretation.Looping.class, name = "looping")
})
public sealed interface WorkingInterpretation {

    @JsonIgnore
    SequenceType sequence();

    /** Imperatives and judgements: a paradigm actuated over ordered inputs. */
    sealed interface Semantic extends WorkingInterpretation permits Imperative, Judgement {
        String paradigm();

        @Nullable String bodyFaculty();

        Map<String, Integer> valueOrder();

        Map<String, ValueSelector> valueSelectors();

        Map<String, JsonNode> values();

        @Nullable String outputShape();

        Semantic withInputs(Map<String, Integer> valueOrder, Map<String, ValueSelector> valueSelectors);

        /** Input names in position order. */
        default List<String> orderedInputs() {
            return List.copyOf(valueOrder().keySet());
        }
    }

    private static Map<String, Integer> order(String paradigm, Map<String, Integer> valueOrder) {
        require(paradigm != null && !paradigm.isBlank(), MISSING_PARADIGM, "No paradigm declared");
        require(valueOrder != null && !valueOrder.isEmpty(), EMPTY_VALUE_ORDER, "Value order is empty");
        var seen = new HashSet<Integer>();
        for (var e : valueOrder.entrySet()) {
            require(e.getValue() != null && e.getValue() >= 1, DUPLICATE_VALUE_POSITION,
                    "Position of '" + e.getKey() + "' must be a positive integer");
            require(seen.add(e.getValue()), DUPLICATE_VALUE_POSITION,
                    "Position " + e.getValue() + " is bound more than once");
        }
        var sorted = new ArrayList<>(valueOrder.entrySet());
        sorted.sort(Map.Entry.comparingByValue());
        var out = new LinkedHashMap<String, Integer>();
        sorted.forEach(e -> out.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(out);
    }

    private static Map<String, ValueSelector> selectors(Map<String, ValueSelector> selectors, Map<String, Integer> order) {
        if (selectors == null || selectors.isEmpty()) return Map.of();
        for (var k : selectors.keySet())
            require(order.containsKey(k), UNKNOWN_SELECTOR_KEY, "Selector '" + k + "' has no position in the value order");
        return Collections.unmodifiableMap(new LinkedHashMap<>(selectors));
    }

    private static <V> Map<String, V> copy(Map<String, V> m) {
        return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Imperative(
            @JsonProperty("paradigm") String paradigm,
            @JsonProperty("body_faculty") @Nullable String bodyFaculty,
            @JsonProperty("value_order") Map<String, Integer> valueOrder,
            @JsonProperty("value_selectors") Map<String, ValueSelector> valueSelectors,
            @JsonProperty("values") Map<String, JsonNode> values,
            @JsonProperty("output_shape") @Nullable String outputShape
    ) implements Semantic {
        public Imperative {
            valueOrder = order(paradigm, valueOrder);
            valueSelectors = selectors(valueSelectors, valueOrder);
            values = copy(values);
        }

        @Override
        public SequenceType sequence() {
            return SequenceType.IMPERATIVE;
        }

        @Override
        public Imperative withInputs(Map<String, Integer> valueOrder, Map<String, ValueSelector> valueSelectors) {
            return new Imperative(paradigm, bodyFaculty, valueOrder, valueSelectors, values, outputShape);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Judgement(
            @JsonProperty("paradigm") String paradigm,
            @JsonProperty("body_faculty") @Nullable String bodyFaculty,
            @JsonProperty("value_order") Map<String, Integer> valueOrder,
            @JsonProperty("value_selectors") Map<String, ValueSelector> valueSelectors,
            @JsonProperty("values") Map<String, JsonNode> values,
            @JsonProperty("output_shape") @Nullable String outputShape,
            @JsonProperty("assertion_condition") AssertionCondition assertionCondition
    ) implements Semantic {
        public Judgement {
            valueOrder = order(paradigm, valueOrder);
            valueSelectors = selectors(valueSelectors, valueOrder);
            values = copy(values);
            require(assertionCondition != null, MISSING_ASSERTION_CONDITION, "Judgement has no assertion condition");
        }

        @Override
        public SequenceType sequence() {
            return SequenceType.JUDGEMENT;
        }

        @Override
        public Judgement withInputs(Map<String, Integer> valueOrder, Map<String, ValueSelector> valueSelectors) {
            return new Judgement(paradigm, bodyFaculty, valueOrder, valueSelectors, values, outputShape, assertionCondition);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AssertionCondition(
            @JsonProperty("quantifier") Quantifier quantifier,
            @JsonProperty("for_each") @Nullable String forEach,
            @JsonProperty("condition") Boolean condition
    ) {
        public AssertionCondition {
            require(quantifier != null && condition != null, MISSING_ASSERTION_CONDITION, "Assertion needs a quantifier and a condition");
            require(quantifier != Quantifier.FOR_EACH || (forEach != null && !forEach.isBlank()), MISSING_ASSERTION_CONDITION,
                    "A for-each assertion must name the concept it ranges over");
        }
    }

    enum Quantifier {
        ALL("all"), FOR_EACH("for-each");

        private final String id;

        Quantifier(String id) {
            this.id = id;
        }

        @JsonValue
        public String id() {
            return id;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Assigning(
            @JsonProperty("marker") AssigningMarker marker,
            @JsonProperty("identity") @Nullable Identity identity,
            @JsonProperty("abstraction") @Nullable Abstraction abstraction,
            @JsonProperty("specification") @Nullable Specification specification,
            @JsonProperty("continuation") @Nullable Continuation continuation,
            @JsonProperty("selector") @Nullable ValueSelector selector
    ) implements WorkingInterpretation {
        public Assigning {
            require(marker != null, UNRECOGNIZED_MARKER, "Assigning needs a marker");
            var populated = Stream.of(identity, abstraction, specification, continuation, selector).filter(Objects::nonNull).count();
            require(populated <= 1, CONFLICTING_MARKER_FIELDS, "More than one marker field set populated for " + marker.id());
            var expected = switch (marker) {
                case IDENTITY -> identity;
                case ABSTRACTION -> abstraction;
                case SPECIFICATION -> specification;
                case CONTINUATION -> continuation;
                case DERELATION -> selector;
            };
            require(populated == 0 || expected != null, CONFLICTING_MARKER_FIELDS, "Populated field set does not belong to marker " + marker.id());
            require(expected != null, MISSING_MARKER_FIELDS, "Marker " + marker.id() + " has no field set");
        }

        @Override
        public SequenceType sequence() {
            return SequenceType.ASSIGNING;
        }

        /** Concepts this assignment reads. */
        @JsonIgnore
        public List<String> sources() {
            return switch (marker) {
                case IDENTITY -> List.of(identity.canonical());
                case ABSTRACTION -> List.of();
                case SPECIFICATION -> specification.sources();
                case CONTINUATION -> List.of(continuation.destination(), continuation.source());
                case DERELATION -> List.of(selector.sourceConcept());
            };
        }
    }

    enum AssigningMarker {
        IDENTITY("identity", "$="),
        ABSTRACTION("abstraction", "$%"),
        SPECIFICATION("specification", "$."),
        CONTINUATION("continuation", "$+"),
        DERELATION("derelation", "$-");

        public final String symbol;
        private final String id;

        AssigningMarker(String id, String symbol) {
            this.id = id;
            this.symbol = symbol;
        }

        @JsonValue
        public String id() {
            return id;
        }
    }

    record Identity(@JsonProperty("canonical") String canonical, @JsonProperty("alias") String alias) {
        public Identity {
            require(canonical != null && !canonical.isBlank() && alias != null && !alias.isBlank(), MISSING_MARKER_FIELDS,
                    "Identity needs a canonical and an alias concept");
        }
    }

    record Abstraction(@JsonProperty("face_value") JsonNode faceValue, @JsonProperty("axes") List<String> axes) {
        public Abstraction {
            require(faceValue != null && !faceValue.isMissingNode(), MISSING_MARKER_FIELDS, "Abstraction needs a face value");
            require(axes != null && !axes.isEmpty(), MISSING_MARKER_FIELDS, "Abstraction needs axis names");
            axes = List.copyOf(axes);
        }
    }

    record Specification(@JsonProperty("sources") List<String> sources) {
        public Specification {
            require(sources != null && !sources.isEmpty(), MISSING_MARKER_FIELDS, "Specification needs candidate sources");
            sources = List.copyOf(sources);
        }
    }

    record Continuation(@JsonProperty("source") String source,
                        @JsonProperty("destination") String destination,
                        @JsonProperty("grouping_axes") List<String> groupingAxes) {
        public Continuation {
            require(source != null && destination != null, MISSING_MARKER_FIELDS, "Continuation needs a source and a destination");
            require(groupingAxes != null && !groupingAxes.isEmpty(), MISSING_MARKER_FIELDS, "Continuation needs grouping axes");
            groupingAxes = List.copyOf(groupingAxes);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Grouping(
            @JsonProperty("marker") GroupingMarker marker,
            @JsonProperty("sources") List<String> sources,
            @JsonProperty("axis_concepts") List<String> axisConcepts,
            @JsonProperty("protect_axes") List<String> protectAxes,
            @JsonProperty("create_axis") @Nullable String createAxis
    ) implements WorkingInterpretation {
        public Grouping {
            require(marker != null, UNRECOGNIZED_MARKER, "Grouping needs marker 'in' or 'across'");
            require(sources != null && !sources.isEmpty(), MISSING_GROUPING_SOURCES, "Grouping has no sources");
            require(axisConcepts != null && !axisConcepts.isEmpty(), MISSING_GROUPING_AXES, "Grouping has no axis concepts");
            require(marker != GroupingMarker.ACROSS || (createAxis != null && !createAxis.isBlank()), MISSING_CREATE_AXIS,
                    "Grouping across needs a create_axis name");
            sources = List.copyOf(sources);
            axisConcepts = List.copyOf(axisConcepts);
            protectAxes = protectAxes == null ? List.of() : List.copyOf(protectAxes);
        }

        @Override
        public SequenceType sequence() {
            return SequenceType.GROUPING;
        }
    }

    enum GroupingMarker {
        IN("in"), ACROSS("across");

        private final String id;

        GroupingMarker(String id) {
            this.id = id;
        }

        @JsonValue
        public String id() {
            return id;
        }
    }

    record Timing(
            @JsonProperty("marker") TimingMarker marker,
            @JsonProperty("condition") String condition,
            @JsonProperty("blackboard") @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable JsonNode blackboard
    ) implements WorkingInterpretation {
        public Timing {
            require(marker != null, UNRECOGNIZED_MARKER, "Timing needs marker 'if', 'if-negated' or 'after'");
            require(condition != null && !condition.isBlank(), MISSING_CONDITION, "Timing has no condition concept");
        }

        public Timing(TimingMarker marker, String condition) {
            this(marker, condition, null);
        }

        @Override
        public SequenceType sequence() {
            return SequenceType.TIMING;
        }
    }

    enum TimingMarker {
        IF("if", "@:'"), IF_NOT("if-negated", "@:!"), AFTER("after", "@.");

        public final String symbol;
        private final String id;

        TimingMarker(String id, String symbol) {
            this.id = id;
            this.symbol = symbol;
        }

        @JsonValue
        public String id() {
            return id;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Looping(
            @JsonProperty("loop_index") Integer loopIndex,
            @JsonProperty("base_concept") String baseConcept,
            @JsonProperty("current_element") String currentElement,
            @JsonProperty("group_key") String groupKey,
            @JsonProperty("carry") Map<String, Carry> carry,
            @JsonProperty("concepts_to_infer") List<String> conceptsToInfer
    ) implements WorkingInterpretation {
        public Looping {
            require(loopIndex != null && loopIndex >= 1, MISSING_LOOP_INDEX, "Looping needs a positive loop index");
            require(baseConcept != null && !baseConcept.isBlank(), MISSING_LOOP_BASE, "Looping needs a base collection concept");
            require(groupKey != null && !groupKey.isBlank(), MISSING_GROUP_KEY, "Looping needs a grouping key");
            require(conceptsToInfer != null && !conceptsToInfer.isEmpty(), MISSING_LOOP_TARGET, "Looping names no concept to infer per iteration");
            if (currentElement == null || currentElement.isBlank()) currentElement = currentElement(baseConcept, loopIndex);
            carry = copy(carry);
            conceptsToInfer = List.copyOf(conceptsToInfer);
        }

        public static String currentElement(String base, int loopIndex) {
            return base + "*" + loopIndex;
        }

        @Override
        public SequenceType sequence() {
            return SequenceType.LOOPING;
        }
    }

    /** An in-loop concept that takes, at each iteration, the value {@code from} had at the end of the previous one. */
    record Carry(@JsonProperty("from") String from, @JsonProperty("carry_over") Integer carryOver) {
        public Carry {
            require(from != null && !from.isBlank(), MISSING_MARKER_FIELDS, "Carry concept needs a source");
            carryOver = carryOver == null ? 1 : carryOver;
        }
    }
}
