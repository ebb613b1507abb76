package dumb.normcode.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/** One line of the annotated plan tree: a concept appearing at a flow address. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Occurrence(
        @JsonProperty("concept_name") String conceptName,
        @JsonProperty("concept_type") String conceptType,
        @JsonProperty("flow_index") String flowIndex,
        @JsonProperty("nc_main") String ncMain,
        @JsonProperty("inference_marker") @Nullable String inferenceMarker,
        @JsonProperty("operator_type") @Nullable String operatorType,
        @JsonProperty("attached_comments") List<Comment> attachedComments
) {
    public static final String FINAL = ":<:";
    public static final String FUNCTION = "<=";
    public static final String VALUE = "<-";
    public static final String CONTEXT = "<*";

    @JsonCreator
    public Occurrence {
        conceptName = conceptName == null ? "" : conceptName.strip();
        conceptType = conceptType == null ? "object" : conceptType;
        ncMain = ncMain == null ? "" : ncMain;
        attachedComments = attachedComments == null ? List.of() : List.copyOf(attachedComments);
    }

    @JsonIgnore
    public FlowAddress address() {
        return FlowAddress.parse(flowIndex);
    }

    @JsonIgnore
    public boolean isFunction() {
        return FUNCTION.equals(inferenceMarker) || ncMain.strip().startsWith(FUNCTION)
                || "imperative".equals(conceptType) || "judgement".equals(conceptType) || "operator".equals(conceptType);
    }

    @JsonIgnore
    public boolean isContext() {
        return CONTEXT.equals(inferenceMarker);
    }

    @JsonIgnore
    public boolean isFinal() {
        return FINAL.equals(inferenceMarker);
    }

    public Optional<String> annotation(String key) {
        return Annotations.value(attachedComments, key);
    }

    /** The function body with the leading {@code <=} removed. */
    @JsonIgnore
    public String body() {
        var s = ncMain.strip();
        return s.startsWith(FUNCTION) ? s.substring(FUNCTION.length()).strip() : s;
    }
}
