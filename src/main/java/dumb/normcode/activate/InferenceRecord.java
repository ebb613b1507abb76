package dumb.normcode.activate;

import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.normcode.activate.wi.WorkingInterpretation;
import dumb.normcode.plan.FlowAddress;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** One executable step: exactly one output concept, read-only during execution. */
public record InferenceRecord(
        @JsonProperty("flow_index") FlowAddress flowIndex,
        @JsonProperty("inference_sequence") SequenceType sequence,
        @JsonProperty("concept_to_infer") String conceptToInfer,
        @JsonProperty("function_concept") String functionConcept,
        @JsonProperty("value_concepts") List<String> valueConcepts,
        @JsonProperty("context_concepts") List<String> contextConcepts,
        @JsonProperty("working_interpretation") WorkingInterpretation workingInterpretation
) implements Comparable<InferenceRecord> {

    public InferenceRecord {
        requireNonNull(flowIndex);
        requireNonNull(sequence);
        requireNonNull(conceptToInfer);
        requireNonNull(functionConcept);
        requireNonNull(workingInterpretation);
        valueConcepts = valueConcepts == null ? List.of() : List.copyOf(valueConcepts);
        contextConcepts = contextConcepts == null ? List.of() : List.copyOf(contextConcepts);
        if (workingInterpretation.sequence() != sequence)
            throw new IllegalArgumentException("Working interpretation " + workingInterpretation.sequence()
                    + " does not match inference sequence " + sequence + " at " + flowIndex);
    }

    public InferenceRecord with(WorkingInterpretation wi) {
        return new InferenceRecord(flowIndex, sequence, conceptToInfer, functionConcept, valueConcepts, contextConcepts, wi);
    }

    @Override
    public int compareTo(InferenceRecord o) {
        return flowIndex.compareTo(o.flowIndex);
    }
}
