package dumb.normcode.activate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One entry of the concept repository: a value concept (data entity) or a function concept (operation).
 * Immutable once built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConceptRecord(
        @JsonProperty("id") String id,
        @JsonProperty("concept_name") String name,
        @JsonProperty("natural_name") String naturalName,
        @JsonProperty("kind") Kind kind,
        @JsonProperty("type") String type,
        @JsonProperty("concept_type") String conceptType,
        @JsonProperty("element_type") @Nullable String elementType,
        @JsonProperty("flow_indices") List<String> flowIndices,
        @JsonProperty("is_ground_concept") boolean ground,
        @JsonProperty("is_final_concept") boolean isFinal,
        @JsonProperty("reference_data") @Nullable JsonNode referenceData,
        @JsonProperty("reference_axis_names") List<String> axes
) {
    public static final String PARADIGM = "paradigm";
    public static final String OPERATOR = "operator";
    public static final String PERCEPTUAL_SIGN = "perceptual_sign";
    public static final String LITERAL = "literal";

    public ConceptRecord {
        requireNonNull(id);
        requireNonNull(name);
        requireNonNull(naturalName);
        requireNonNull(kind);
        flowIndices = flowIndices == null ? List.of() : List.copyOf(flowIndices);
        axes = axes == null || axes.isEmpty() ? List.of("_none_axis") : List.copyOf(axes);
    }

    @JsonIgnore
    public boolean isFunction() {
        return kind == Kind.FUNCTION;
    }

    @JsonIgnore
    public boolean isSign() {
        return PERCEPTUAL_SIGN.equals(elementType);
    }

    public enum Kind {
        VALUE, FUNCTION
    }
}
