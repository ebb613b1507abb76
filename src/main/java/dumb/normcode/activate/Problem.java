package dumb.normcode.activate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/** A compile-time error found while activating a plan. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Problem(@JsonProperty("code") Code code,
                      @JsonProperty("flow_index") @Nullable String flowIndex,
                      @JsonProperty("message") String message) {

    public Problem {
        requireNonNull(code);
        requireNonNull(message);
    }

    public Kind kind() {
        return code.kind;
    }

    @Override
    public String toString() {
        return code + (flowIndex != null ? " @" + flowIndex : "") + ": " + message;
    }

    public enum Kind {
        STRUCTURAL, RESOURCE, CONSISTENCY
    }

    public enum Code {
        MALFORMED_FLOW_ADDRESS(Kind.STRUCTURAL),
        DUPLICATE_FLOW_ADDRESS(Kind.STRUCTURAL),
        NON_HIERARCHICAL_ADDRESS(Kind.STRUCTURAL),
        DANGLING_FUNCTION_CONCEPT(Kind.STRUCTURAL),
        DANGLING_VALUE_CONCEPT(Kind.STRUCTURAL),
        NO_PRODUCER(Kind.STRUCTURAL),
        UNRESOLVABLE_FUNCTION_BODY(Kind.STRUCTURAL),
        MULTIPLE_PRODUCERS(Kind.STRUCTURAL),
        MISSING_PARADIGM(Kind.STRUCTURAL),
        EMPTY_VALUE_ORDER(Kind.STRUCTURAL),
        DUPLICATE_VALUE_POSITION(Kind.STRUCTURAL),
        UNKNOWN_SELECTOR_KEY(Kind.STRUCTURAL),
        UNRESOLVABLE_SELECTOR_SOURCE(Kind.STRUCTURAL),
        MISSING_SELECTOR(Kind.STRUCTURAL),
        MISSING_ASSERTION_CONDITION(Kind.STRUCTURAL),
        UNKNOWN_ASSERTION_CONCEPT(Kind.STRUCTURAL),
        UNRECOGNIZED_MARKER(Kind.STRUCTURAL),
        MISSING_MARKER_FIELDS(Kind.STRUCTURAL),
        CONFLICTING_MARKER_FIELDS(Kind.STRUCTURAL),
        MISSING_GROUPING_SOURCES(Kind.STRUCTURAL),
        MISSING_GROUPING_AXES(Kind.STRUCTURAL),
        MISSING_CREATE_AXIS(Kind.STRUCTURAL),
        MISSING_CONDITION(Kind.STRUCTURAL),
        MISSING_LOOP_INDEX(Kind.STRUCTURAL),
        MISSING_LOOP_BASE(Kind.STRUCTURAL),
        MISSING_LOOP_TARGET(Kind.STRUCTURAL),
        MISSING_GROUP_KEY(Kind.STRUCTURAL),
        MISSING_RESOURCE(Kind.RESOURCE),
        UNKNOWN_PARADIGM(Kind.RESOURCE),
        UNKNOWN_NORM(Kind.CONSISTENCY),
        SIGN_LITERAL_MISMATCH(Kind.CONSISTENCY),
        NORM_MISMATCH(Kind.CONSISTENCY);

        public final Kind kind;

        Code(Kind kind) {
            this.kind = kind;
        }
    }

    /**
     * Raised while constructing a working interpretation or reading plan syntax;
     * the compiler turns it into a {@link Problem} at the flow address being built.
     */
    public static class Violation extends RuntimeException {
        public final Code code;

        public Violation(Code code, String message) {
            super(message);
            this.code = requireNonNull(code);
        }

        public Problem at(@Nullable String flowIndex) {
            return new Problem(code, flowIndex, getMessage());
        }
    }

    public static void require(boolean condition, Code code, String message) {
        if (!condition) throw new Violation(code, message);
    }
}
