package dumb.normcode;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

public class Events {
    public final ExecutorService exe;
    final ConcurrentMap<Class<? extends NormEvent>, CopyOnWriteArrayList<Consumer<NormEvent>>> listeners = new ConcurrentHashMap<>();

    public Events(ExecutorService exe) {
        this.exe = requireNonNull(exe);
    }

    private static void exeSafe(Consumer<NormEvent> listener, NormEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            // not through Log: a failing LogMessageEvent listener would re-enter here
            org.slf4j.LoggerFactory.getLogger(Events.class).error("Error processing event listener for {}: {}",
                    event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    public <T extends NormEvent> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(NormEvent event) {
        if (exe.isShutdown()) {
            return;
        }
        var l = listeners.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>());
        if (l.isEmpty()) return;
        exe.submit(() -> l.forEach(listener -> exeSafe(listener, event)));
    }

    public void shutdown() {
        exe.shutdown();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LogMessageEvent(String message, Log.LogLevel level) implements NormEvent {
        public LogMessageEvent {
            requireNonNull(message);
            requireNonNull(level);
        }

        @Override
        public String getEventType() {
            return "LogMessageEvent";
        }
    }
}
