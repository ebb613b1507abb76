package dumb.normcode.activate.wi;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import static dumb.normcode.activate.Problem.Code.MISSING_SELECTOR;
import static dumb.normcode.activate.Problem.Code.UNRESOLVABLE_SELECTOR_SOURCE;
import static dumb.normcode.activate.Problem.require;

/**
 * Recovers a sub-value from a composite concept: by list index, by relation key, or by spreading a list
 * into several positional inputs. The source concept is read, never consumed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueSelector(
        @JsonProperty("source_concept") String sourceConcept,
        @JsonProperty("index") @Nullable Integer index,
        @JsonProperty("key") @Nullable String key,
        @JsonProperty("unpack") @Nullable Boolean unpack,
        @JsonProperty("branch") @Nullable Branch branch
) {
    public ValueSelector {
        require(sourceConcept != null && !sourceConcept.isBlank(), UNRESOLVABLE_SELECTOR_SOURCE, "Selector has no source concept");
        require(index != null || key != null || Boolean.TRUE.equals(unpack), MISSING_SELECTOR,
                "Selector on '" + sourceConcept + "' needs an index, a key or the unpack flag");
    }

    public static ValueSelector key(String source, String key, @Nullable Branch branch) {
        return new ValueSelector(source, null, key, null, branch);
    }

    public static ValueSelector spread(String source, @Nullable Branch branch) {
        return new ValueSelector(source, null, null, true, branch);
    }

    @JsonIgnore
    public boolean spreads() {
        return Boolean.TRUE.equals(unpack);
    }

    /** Whether perceptual signs are resolved on the whole source before extraction, or on the extracted part. */
    public enum Branch {
        BEFORE("before"), AFTER("after");

        private final String id;

        Branch(String id) {
            this.id = id;
        }

        @JsonValue
        public String id() {
            return id;
        }
    }
}
