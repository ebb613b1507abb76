package dumb.normcode.activate;

import dumb.normcode.activate.wi.WorkingInterpretation;
import dumb.normcode.perceive.Codec;
import dumb.normcode.perceive.Norms;
import dumb.normcode.perceive.PathMap;
import dumb.normcode.plan.FlowAddress;
import dumb.normcode.plan.PlanGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.normcode.Plans.a;
import static dumb.normcode.Plans.context;
import static dumb.normcode.Plans.function;
import static dumb.normcode.Plans.plan;
import static dumb.normcode.Plans.root;
import static dumb.normcode.Plans.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActivationTest {

    private static final String PLAN = """
            [
              {
                "concept_to_infer": {"concept_name": "y", "flow_index": "1", "nc_main": ":<: {y}", "inference_marker": ":<:"},
                "function_concept": {
                  "concept_name": "::(double {x})", "concept_type": "imperative", "flow_index": "1.1",
                  "nc_main": "<= ::(double {x})", "inference_marker": "<=",
                  "attached_comments": [{"type": "comment", "nc_comment": "| %{norm_input}: double"}]
                },
                "value_concepts": [
                  {
                    "concept_name": "x", "flow_index": "1.2", "nc_main": "<- {x}", "inference_marker": "<-",
                    "attached_comments": [{"type": "comment", "nc_comment": "| %{value}: 5"}]
                  }
                ]
              }
            ]
            """;

    @TempDir
    Path dir;

    private Codec codec;

    @BeforeEach
    void setUp() {
        codec = Norms.codec(new PathMap(dir), dir.resolve("store"));
    }

    @Test
    void compilesSingleImperative() throws IOException {
        var r = new Activation(codec).activate(PlanGroup.read(PLAN));
        var repos = r.repositories();

        assertEquals(1, repos.inferences().size());
        var inf = repos.inferences().get(0);
        assertEquals(FlowAddress.parse("1"), inf.flowIndex());
        assertEquals(SequenceType.IMPERATIVE, inf.sequence());
        assertEquals("c-y", inf.conceptToInfer());
        assertEquals("fc-double-x", inf.functionConcept());
        assertEquals(List.of("c-x"), inf.valueConcepts());
        var wi = assertInstanceOf(WorkingInterpretation.Imperative.class, inf.workingInterpretation());
        assertEquals("double", wi.paradigm());
        assertEquals(Map.of("x", 1), wi.valueOrder());

        var table = repos.table();
        var x = table.require("c-x");
        assertTrue(x.ground());
        assertEquals(5, x.referenceData().asInt());
        assertEquals(ConceptRecord.LITERAL, x.elementType());
        var y = table.require("c-y");
        assertFalse(y.ground());
        assertTrue(y.isFinal());
        assertTrue(table.require("fc-double-x").ground());

        assertEquals(1, r.summary().inferences());
        assertEquals(1, r.summary().ground());
        assertTrue(r.warnings().stream().anyMatch(w -> w.code() == Activation.Warning.Code.MISSING_BODY_FACULTY));
    }

    @Test
    void everyReferenceResolves() {
        var repos = new Activation(codec).activate(plan()
                .group(root("all doubled", "1"), function("*. %>({numbers}) %<({doubled}) %:({number}) %@(1)", "1.1"),
                        List.of(value("numbers", "1.2", a("value", "[1, 2]"), a("ref_axes", "[number]"))),
                        List.of(context("total", "object", "1.3", a("carry_from", "{doubled}"), a("value", "0"))))
                .group(value("doubled", "1.4"), function("::(double {numbers*1})", "1.4.1", a("norm_input", "double")),
                        List.of(value("numbers*1", "1.4.2")),
                        List.of(function("@.(<ready>)", "1.4.3"), context("ready", "proposition", "1.4.4", a("value", "true"))))
                .build()).repositories();

        var table = repos.table();
        var produced = new HashSet<String>();
        repos.inferences().forEach(r -> produced.add(r.conceptToInfer()));
        produced.add("c-numbers*1");
        for (var r : repos.inferences()) {
            assertTrue(table.contains(r.functionConcept()), r.functionConcept());
            var refs = new ArrayList<>(r.valueConcepts());
            refs.addAll(r.contextConcepts());
            for (var id : refs) {
                assertTrue(table.contains(id), id);
                assertTrue(table.require(id).ground() || produced.contains(id), id);
            }
        }
        assertEquals(List.of("1", "1.4", "1.4.3"), repos.inferences().stream().map(r -> r.flowIndex().toString()).toList());
        var timing = repos.inferences().get(2);
        assertEquals(SequenceType.TIMING, timing.sequence());
        assertEquals("fc-double-numbers*1", timing.conceptToInfer());
        assertFalse(table.require("fc-double-numbers*1").ground());
        var loop = repos.inferences().get(0);
        assertTrue(loop.contextConcepts().containsAll(List.of("c-numbers*1", "c-total")));
    }

    @Test
    void reportsEveryProblemAtOnce() {
        var ex = assertThrows(ActivationException.class, () -> new Activation(codec, Set.of("double"), false).activate(plan()
                .group(root("y", "1"), function("::(triple {x})", "1.1", a("norm_input", "triple")), value("x", "1.2", a("value", "5")))
                .group(root("z", "2"), function("::(double {w})", "2.1", a("norm_input", "double")), value("w", "2.2"))
                .group(value("q", "3"), function("&[{}] %>[{x}]", "1.3"), value("x", "3.2"))
                .build()));
        assertTrue(ex.has(Problem.Code.UNKNOWN_PARADIGM));
        assertTrue(ex.has(Problem.Code.NON_HIERARCHICAL_ADDRESS));
        assertTrue(ex.has(Problem.Code.MISSING_GROUPING_AXES));
        assertTrue(ex.problems().size() >= 3, ex.getMessage());
    }

    @Test
    void signLiteralMismatch() {
        var ex = assertThrows(ActivationException.class, () -> new Activation(codec).activate(plan()
                .group(root("y", "1"), function("::(double {x})", "1.1", a("norm_input", "double")),
                        value("x", "1.2", a("value", "5"), a("input_norm", Norms.FILE_LOCATION)))
                .build()));
        assertTrue(ex.has(Problem.Code.SIGN_LITERAL_MISMATCH), ex.getMessage());
        assertEquals("1", ex.problems().get(0).flowIndex());
    }

    @Test
    void missingResourceOnlyWhenEager() {
        var p = plan()
                .group(root("y", "1"), function("::(double {x})", "1.1", a("norm_input", "double")),
                        value("x", "1.2", a(Norms.FILE_LOCATION, "data/x.json")))
                .build();
        new Activation(codec).activate(p);
        var ex = assertThrows(ActivationException.class, () -> new Activation(codec, null, true).activate(p));
        assertTrue(ex.has(Problem.Code.MISSING_RESOURCE));
    }

    @Test
    void repositoriesReadBack() throws IOException {
        var repos = new Activation(codec).activate(PlanGroup.read(PLAN)).repositories();
        var out = dir.resolve("repos");
        repos.write(out);
        assertTrue(Files.exists(out.resolve(Repositories.CONCEPT_REPO)));
        var back = Repositories.read(out);
        assertEquals(repos, back);
    }
}
