package dumb.normcode;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

import static java.util.Objects.requireNonNull;

@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "eventType",
        visible = true)
@JsonSubTypes({
        @Type(value = NormEvent.CycleEvent.class, name = "CycleEvent"),
        @Type(value = NormEvent.CommitEvent.class, name = "CommitEvent"),
        @Type(value = NormEvent.FailureEvent.class, name = "FailureEvent"),
        @Type(value = NormEvent.CheckpointEvent.class, name = "CheckpointEvent"),
        @Type(value = NormEvent.RunEvent.class, name = "RunEvent"),
        @Type(value = Events.LogMessageEvent.class, name = "LogMessageEvent")
})
public interface NormEvent {

    default JsonNode toJson() {
        return Json.node(this);
    }

    String getEventType();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CycleEvent(String runId, int cycle, List<String> selected) implements NormEvent {
        public CycleEvent {
            requireNonNull(runId);
            selected = List.copyOf(selected);
        }

        @Override
        public String getEventType() {
            return "CycleEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CommitEvent(String runId, String flowIndex, String concept, String status) implements NormEvent {
        public CommitEvent {
            requireNonNull(runId);
            requireNonNull(flowIndex);
            requireNonNull(concept);
            requireNonNull(status);
        }

        @Override
        public String getEventType() {
            return "CommitEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FailureEvent(String runId, String flowIndex, String message) implements NormEvent {
        public FailureEvent {
            requireNonNull(runId);
            requireNonNull(flowIndex);
        }

        @Override
        public String getEventType() {
            return "FailureEvent";
        }
    }

    record CheckpointEvent(String runId, int cycle) implements NormEvent {
        public CheckpointEvent {
            requireNonNull(runId);
        }

        @Override
        public String getEventType() {
            return "CheckpointEvent";
        }
    }

    record RunEvent(String runId, String status, int cycles) implements NormEvent {
        public RunEvent {
            requireNonNull(runId);
            requireNonNull(status);
        }

        @Override
        public String getEventType() {
            return "RunEvent";
        }
    }
}
