package dumb.normcode.activate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SequenceType {
    IMPERATIVE("imperative"),
    JUDGEMENT("judgement"),
    ASSIGNING("assigning"),
    GROUPING("grouping"),
    TIMING("timing"),
    LOOPING("looping");

    public final String id;

    SequenceType(String id) {
        this.id = id;
    }

    @JsonCreator
    public static SequenceType of(String s) {
        for (var t : values())
            if (t.id.equalsIgnoreCase(s.strip())) return t;
        throw new IllegalArgumentException("Unknown sequence type: " + s);
    }

    public boolean semantic() {
        return this == IMPERATIVE || this == JUDGEMENT;
    }

    @JsonValue
    @Override
    public String toString() {
        return id;
    }
}
