package dumb.normcode.activate.wi;

import com.fasterxml.jackson.databind.node.IntNode;
import dumb.normcode.activate.Activation;
import dumb.normcode.activate.ActivationException;
import dumb.normcode.activate.InferenceRecord;
import dumb.normcode.activate.Problem;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Assigning;
import dumb.normcode.activate.wi.WorkingInterpretation.AssigningMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.Grouping;
import dumb.normcode.activate.wi.WorkingInterpretation.GroupingMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.Judgement;
import dumb.normcode.activate.wi.WorkingInterpretation.Looping;
import dumb.normcode.activate.wi.WorkingInterpretation.Quantifier;
import dumb.normcode.activate.wi.WorkingInterpretation.Timing;
import dumb.normcode.activate.wi.WorkingInterpretation.TimingMarker;
import dumb.normcode.perceive.Norms;
import dumb.normcode.perceive.PathMap;
import dumb.normcode.plan.PlanGroup;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static dumb.normcode.Plans.a;
import static dumb.normcode.Plans.bound;
import static dumb.normcode.Plans.context;
import static dumb.normcode.Plans.function;
import static dumb.normcode.Plans.plan;
import static dumb.normcode.Plans.root;
import static dumb.normcode.Plans.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkingInterpretationBuilderTest {

    @TempDir
    Path dir;

    private List<InferenceRecord> activate(List<PlanGroup> plan) {
        return new Activation(Norms.codec(new PathMap(dir), dir.resolve("store"))).activate(plan).repositories().inferences();
    }

    private InferenceRecord only(List<PlanGroup> plan) {
        var all = activate(plan);
        assertEquals(1, all.size(), all::toString);
        return all.get(0);
    }

    private ActivationException failing(List<PlanGroup> plan) {
        return assertThrows(ActivationException.class, () -> activate(plan));
    }

    @Test
    void explicitBindingsOrderInputs() {
        var r = only(plan()
                .group(root("d", "1"), function("::(minus {a} {b})", "1.1", a("norm_input", "minus"), a("body_faculty", "llm")),
                        bound("a", 2, "1.2", a("value", "1")), bound("b", 1, "1.3", a("value", "2")))
                .build());
        var wi = assertInstanceOf(WorkingInterpretation.Imperative.class, r.workingInterpretation());
        assertEquals(Map.of("a", 2, "b", 1), wi.valueOrder());
        assertEquals(List.of("b", "a"), wi.orderedInputs());
        assertEquals("llm", wi.bodyFaculty());
        assertEquals(IntNode.valueOf(1), wi.values().get("a"));
    }

    @Test
    void imperativeNeedsParadigm() {
        var ex = failing(plan()
                .group(root("y", "1"), function("::(double {x})", "1.1"), value("x", "1.2", a("value", "1")))
                .build());
        assertTrue(ex.has(Problem.Code.MISSING_PARADIGM), ex.getMessage());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "::<ok>({x}) <ALL True>          | ALL      |   | true",
            "::<ok>({x}) <ALL False>         | ALL      |   | false",
            "::<ok>({x}) <FOR EACH {x} True> | FOR_EACH | x | true"
    })
    void judgementAssertion(String body, Quantifier quantifier, String forEach, Boolean condition) {
        var r = only(plan()
                .group(root("verdict", "1"), function(body, "1.1", a("norm_input", "ok")), value("x", "1.2", a("value", "1")))
                .build());
        assertEquals(SequenceType.JUDGEMENT, r.sequence());
        var c = ((Judgement) r.workingInterpretation()).assertionCondition();
        assertEquals(quantifier, c.quantifier());
        assertEquals(forEach, c.forEach());
        assertEquals(condition, c.condition());
    }

    @Test
    void judgementForEachMustNameAnInput() {
        var ex = failing(plan()
                .group(root("verdict", "1"), function("::<ok>({x}) <FOR EACH {z} True>", "1.1", a("norm_input", "ok")),
                        value("x", "1.2", a("value", "1")))
                .build());
        assertTrue(ex.has(Problem.Code.UNKNOWN_ASSERTION_CONCEPT), ex.getMessage());
    }

    @Test
    void assigningMarkers() {
        var all = activate(plan()
                .group(root("out", "1"), function("$. %>[{alias}, {nums}]", "1.1"), value("alias", "1.2"), value("nums", "1.3"))
                .group(value("alias", "1.2"), function("$=({x}:{alias})", "1.2.1"), value("x", "1.2.2", a("value", "1")))
                .group(value("nums", "1.3", a("ref_axes", "[n]")), function("$%([1, 2, 3])", "1.3.1"), List.of(), List.of())
                .build());
        var assigning = (Assigning) all.get(0).workingInterpretation();
        assertEquals(AssigningMarker.SPECIFICATION, assigning.marker());
        assertEquals(List.of("alias", "nums"), assigning.specification().sources());

        var identity = (Assigning) all.get(1).workingInterpretation();
        assertEquals(AssigningMarker.IDENTITY, identity.marker());
        assertEquals("x", identity.identity().canonical());
        assertEquals("alias", identity.identity().alias());

        var abstraction = (Assigning) all.get(2).workingInterpretation();
        assertEquals(List.of("n"), abstraction.abstraction().axes());
        assertEquals(3, abstraction.abstraction().faceValue().size());
        assertNull(abstraction.identity());
    }

    @Test
    void groupingAcrossNeedsCreatedAxis() {
        var ex = failing(plan()
                .group(root("items", "1"), function("&[#] %>[{a}, {b}] %:[{k}]", "1.1"),
                        value("a", "1.2", a("value", "1")), value("b", "1.3", a("value", "2")))
                .build());
        assertTrue(ex.has(Problem.Code.MISSING_CREATE_AXIS), ex.getMessage());

        var r = only(plan()
                .group(root("items", "1"), function("&[#] %>[{a}, {b}] %:[{k}] %+(item)", "1.1", a("protect_axes", "[k]")),
                        value("a", "1.2", a("value", "1")), value("b", "1.3", a("value", "2")))
                .build());
        var g = (Grouping) r.workingInterpretation();
        assertEquals(GroupingMarker.ACROSS, g.marker());
        assertEquals(List.of("a", "b"), g.sources());
        assertEquals(List.of("k"), g.axisConcepts());
        assertEquals(List.of("k"), g.protectAxes());
        assertEquals("item", g.createAxis());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "@:'(<ready>) | IF",
            "@:!(<ready>) | IF_NOT",
            "@.(<ready>)  | AFTER"
    })
    void timingOperatorGatesParentFunction(String gate, TimingMarker marker) {
        var all = activate(plan()
                .group(root("y", "1"), function("::(double {x})", "1.1", a("norm_input", "double")),
                        List.of(value("x", "1.2", a("value", "1"))),
                        List.of(function(gate, "1.3"), context("ready", "proposition", "1.4", a("value", "true"))))
                .build());
        assertEquals(2, all.size());
        var timing = all.get(1);
        assertEquals("1.3", timing.flowIndex().toString());
        var t = (Timing) timing.workingInterpretation();
        assertEquals(marker, t.marker());
        assertEquals("ready", t.condition());
        assertEquals(List.of("c-ready"), timing.valueConcepts());
        assertEquals(all.get(0).functionConcept(), timing.conceptToInfer());
        assertEquals(List.of("c-ready"), all.get(0).contextConcepts());
    }

    @Test
    void loopingFields() {
        var all = activate(plan()
                .group(root("results", "1"), function("*. %>({items}) %<({result}) %:({item}) %@(2)", "1.1"),
                        List.of(value("items", "1.2", a("value", "[1, 2]"), a("ref_axes", "[item]"))),
                        List.of(context("acc", "object", "1.3", a("carry_from", "{result}"), a("value", "0"))))
                .group(value("result", "1.4"), function("::(add {items*2} {acc})", "1.4.1", a("norm_input", "add")),
                        value("items*2", "1.4.2"), value("acc", "1.4.3"))
                .build());
        var l = (Looping) all.get(0).workingInterpretation();
        assertEquals(2, l.loopIndex());
        assertEquals("items", l.baseConcept());
        assertEquals("items*2", l.currentElement());
        assertEquals("item", l.groupKey());
        assertEquals(List.of("result"), l.conceptsToInfer());
        assertEquals("result", l.carry().get("acc").from());
        assertEquals(1, l.carry().get("acc").carryOver());
        assertEquals(List.of("c-items"), all.get(0).valueConcepts());
    }

    @Test
    void loopingNeedsIndex() {
        var ex = failing(plan()
                .group(root("results", "1"), function("*. %>({items}) %<({result}) %:({item})", "1.1"),
                        value("items", "1.2", a("value", "[1]")))
                .build());
        assertTrue(ex.has(Problem.Code.MISSING_LOOP_INDEX), ex.getMessage());
    }
}
