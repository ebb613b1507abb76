package dumb.normcode.activate;

import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.normcode.activate.wi.WorkingInterpretation.Semantic;
import dumb.normcode.activate.wi.WorkingInterpretationBuilder;
import dumb.normcode.perceive.Codec;
import dumb.normcode.perceive.PerceptualSign;
import dumb.normcode.plan.PlanGroup;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static dumb.normcode.Log.message;
import static dumb.normcode.Log.warning;
import static dumb.normcode.activate.Problem.Code.MISSING_RESOURCE;
import static dumb.normcode.activate.Problem.Code.UNKNOWN_PARADIGM;
import static java.util.Objects.requireNonNull;

/**
 * Compiles an annotated plan tree into the concept and inference repositories.
 * Either every problem is reported in one {@link ActivationException}, or complete repositories are returned.
 */
public class Activation {

    private final Codec codec;
    private final @Nullable Set<String> paradigms;
    private final boolean eagerResourceCheck;
    private final WorkingInterpretationBuilder interpretations = new WorkingInterpretationBuilder();

    public Activation(Codec codec) {
        this(codec, null, false);
    }

    /**
     * @param paradigms          paradigm ids the runtime provides; null skips paradigm validation
     * @param eagerResourceCheck whether missing data, prompt and script files fail compilation
     */
    public Activation(Codec codec, @Nullable Set<String> paradigms, boolean eagerResourceCheck) {
        this.codec = requireNonNull(codec);
        this.paradigms = paradigms == null ? null : Set.copyOf(paradigms);
        this.eagerResourceCheck = eagerResourceCheck;
    }

    public WorkingInterpretationBuilder interpretations() {
        return interpretations;
    }

    public Result activate(Path planFile) throws IOException {
        return activate(PlanGroup.read(planFile));
    }

    public Result activate(List<PlanGroup> plan) {
        var problems = new ArrayList<Problem>();
        message("Activating plan of " + plan.size() + " groups");

        var concepts = new ConceptTableBuilder().build(plan, problems);
        message("Concept table: " + concepts.size() + " concepts");

        var inferences = new InferenceTableBuilder(interpretations, codec).build(plan, concepts, problems);
        message("Inference table: " + inferences.size() + " inferences");

        if (eagerResourceCheck) checkResources(concepts, problems);
        if (paradigms != null) checkParadigms(inferences, problems);

        if (!problems.isEmpty()) {
            problems.forEach(p -> warning("Activation problem: " + p));
            throw new ActivationException(problems);
        }

        var warnings = warnings(concepts, inferences);
        warnings.forEach(w -> warning("Activation warning: " + w));
        var repos = new Repositories(concepts.all(), inferences);
        return new Result(repos, warnings, Summary.of(concepts, inferences, warnings));
    }

    private void checkResources(ConceptTable concepts, List<Problem> problems) {
        for (var c : concepts.all()) {
            var data = c.referenceData();
            if (data == null || !data.isTextual()) continue;
            PerceptualSign.parse(data.asText())
                    .filter(s -> s.norm() != null && codec.isResource(s.norm()))
                    .filter(s -> !codec.paths().exists(s.signifier()))
                    .ifPresent(s -> problems.add(new Problem(MISSING_RESOURCE, c.flowIndices().isEmpty() ? null : c.flowIndices().get(0),
                            c.name() + " refers to missing " + s.norm() + " " + codec.paths().resolve(s.signifier()))));
        }
    }

    private void checkParadigms(List<InferenceRecord> inferences, List<Problem> problems) {
        for (var r : inferences) {
            if (!(r.workingInterpretation() instanceof Semantic sem)) continue;
            var p = sem.paradigm();
            var known = paradigms.contains(p) || (codec.paths().mapped(p) && codec.paths().exists(p));
            if (!known)
                problems.add(new Problem(UNKNOWN_PARADIGM, r.flowIndex().toString(), "Paradigm '" + p + "' is not available"));
        }
    }

    private static List<Warning> warnings(ConceptTable concepts, List<InferenceRecord> inferences) {
        var out = new ArrayList<Warning>();
        var values = concepts.all().stream().filter(c -> !c.isFunction()).toList();
        if (values.stream().noneMatch(ConceptRecord::isFinal))
            out.add(new Warning(Warning.Code.NO_FINAL_CONCEPTS, null, "No concept is marked as the plan's final output"));
        if (values.stream().noneMatch(ConceptRecord::ground))
            out.add(new Warning(Warning.Code.NO_GROUND_CONCEPTS, null, "No ground concepts: nothing is supplied at plan start"));

        var consumed = new HashSet<String>();
        for (var r : inferences) {
            consumed.addAll(r.valueConcepts());
            consumed.addAll(r.contextConcepts());
            if (r.workingInterpretation() instanceof Semantic sem && sem.bodyFaculty() == null)
                out.add(new Warning(Warning.Code.MISSING_BODY_FACULTY, r.flowIndex().toString(),
                        "Paradigm '" + sem.paradigm() + "' has no body faculty"));
        }
        for (var c : values) {
            if (c.ground() && c.referenceData() == null)
                out.add(new Warning(Warning.Code.GROUND_WITHOUT_DATA, first(c), c.name() + " is ground but has no initial data"));
            if (!c.isFinal() && !consumed.contains(c.id()))
                out.add(new Warning(Warning.Code.UNUSED_CONCEPT, first(c), c.name() + " is never consumed"));
        }
        return out;
    }

    private static String first(ConceptRecord c) {
        return c.flowIndices().isEmpty() ? null : c.flowIndices().get(0);
    }

    public record Warning(@JsonProperty("code") Code code, @JsonProperty("flow_index") @Nullable String flowIndex,
                          @JsonProperty("message") String message) {
        @Override
        public String toString() {
            return code + (flowIndex != null ? " @" + flowIndex : "") + ": " + message;
        }

        public enum Code {
            NO_FINAL_CONCEPTS, NO_GROUND_CONCEPTS, MISSING_BODY_FACULTY, GROUND_WITHOUT_DATA, UNUSED_CONCEPT
        }
    }

    public record Summary(
            @JsonProperty("concepts") int concepts,
            @JsonProperty("inferences") int inferences,
            @JsonProperty("ground") int ground,
            @JsonProperty("final") int finals,
            @JsonProperty("sequences") Map<SequenceType, Integer> sequences,
            @JsonProperty("warnings") Map<Warning.Code, Integer> warnings) {

        static Summary of(ConceptTable concepts, List<InferenceRecord> inferences, List<Warning> warnings) {
            var seq = new EnumMap<SequenceType, Integer>(SequenceType.class);
            inferences.forEach(r -> seq.merge(r.sequence(), 1, Integer::sum));
            var w = new TreeMap<Warning.Code, Integer>();
            warnings.forEach(x -> w.merge(x.code(), 1, Integer::sum));
            var all = concepts.all();
            return new Summary(all.size(), inferences.size(),
                    (int) all.stream().filter(c -> !c.isFunction() && c.ground()).count(),
                    (int) all.stream().filter(ConceptRecord::isFinal).count(),
                    seq, w);
        }
    }

    public record Result(Repositories repositories, List<Warning> warnings, Summary summary) {
    }
}
