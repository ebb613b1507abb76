package dumb.normcode.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Comment(@JsonProperty("type") String type, @JsonProperty("nc_comment") String ncComment) {

    public static Comment of(String ncComment) {
        return new Comment("comment", ncComment);
    }

    public static Comment inline(String ncComment) {
        return new Comment("inline_comment", ncComment);
    }

    public String text() {
        return ncComment == null ? "" : ncComment;
    }
}
