package dumb.normcode.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import dumb.normcode.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One inference group of the plan tree: the concept being inferred, the function that infers it,
 * its value inputs and everything else attached under it (context concepts, nested operators).
 */
public record PlanGroup(
        @JsonProperty("concept_to_infer") Occurrence conceptToInfer,
        @JsonProperty("function_concept") Occurrence functionConcept,
        @JsonProperty("value_concepts") List<Occurrence> valueConcepts,
        @JsonProperty("other_concepts") List<Occurrence> otherConcepts
) {
    @JsonCreator
    public PlanGroup {
        requireNonNull(conceptToInfer, "concept_to_infer");
        requireNonNull(functionConcept, "function_concept");
        valueConcepts = valueConcepts == null ? List.of() : List.copyOf(valueConcepts);
        otherConcepts = otherConcepts == null ? List.of() : List.copyOf(otherConcepts);
    }

    public List<Occurrence> contextConcepts() {
        return otherConcepts.stream().filter(Occurrence::isContext).toList();
    }

    public List<Occurrence> nestedFunctions() {
        return otherConcepts.stream().filter(o -> !o.isContext() && o.isFunction()).toList();
    }

    public static List<PlanGroup> read(Path file) throws IOException {
        return read(Files.readString(file));
    }

    public static List<PlanGroup> read(String json) throws IOException {
        return Json.the.readValue(json, new TypeReference<>() {
        });
    }
}
