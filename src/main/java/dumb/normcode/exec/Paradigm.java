package dumb.normcode.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dumb.normcode.Tool;
import dumb.normcode.Tools;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A named way of carrying out a semantic inference: given the perceived vertical input (prompt, script) and the
 * ordered horizontal inputs, produce one value through a body faculty.
 */
public interface Paradigm {

    String id();

    CompletableFuture<JsonNode> actuate(Actuation a);

    static Paradigm of(String id, Function<Actuation, CompletableFuture<JsonNode>> f) {
        requireNonNull(id);
        requireNonNull(f);
        return new Paradigm() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public CompletableFuture<JsonNode> actuate(Actuation a) {
                try {
                    return f.apply(a);
                } catch (RuntimeException e) {
                    return CompletableFuture.failedFuture(e);
                }
            }

            @Override
            public String toString() {
                return "Paradigm[" + id + "]";
            }
        };
    }

    /**
     * Cancels {@code source} once {@code derived} is cancelled or times out, so the tool call behind a composed future
     * is abandoned with it.
     */
    static <T> CompletableFuture<T> linked(CompletableFuture<T> derived, CompletableFuture<?> source) {
        derived.whenComplete((v, t) -> {
            if (t != null && !source.isDone()) source.cancel(true);
        });
        return derived;
    }

    /** One paradigm call: a single element of the cross product of the inputs. */
    record Actuation(String flowIndex,
                     @Nullable JsonNode vertical,
                     List<JsonNode> inputs,
                     @Nullable String faculty,
                     Tools tools,
                     Duration timeout) {

        public Actuation {
            requireNonNull(flowIndex);
            inputs = List.copyOf(inputs);
            requireNonNull(tools);
        }

        /** 1-based, null node when absent. */
        public JsonNode input(int n) {
            return n >= 1 && n <= inputs.size() ? inputs.get(n - 1) : NullNode.getInstance();
        }

        /** The declared body faculty, or the given default tool. */
        public Tool tool(String fallback) {
            return tools.require(faculty != null ? faculty : fallback);
        }
    }

    class ActuationException extends Exception {
        public ActuationException(String message) {
            super(message);
        }

        public ActuationException(String message, Throwable cause) {
            super(message, cause);
        }

        /** Unwraps the future-layer exceptions so the recorded message names what actually went wrong. */
        public static ActuationException of(Throwable t) {
            var cause = t;
            while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null)
                cause = cause.getCause();
            if (cause instanceof ActuationException a) return a;
            if (cause instanceof TimeoutException) return new ActuationException("Actuation timed out", cause);
            if (cause instanceof CancellationException) return new ActuationException("Actuation cancelled", cause);
            var msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return new ActuationException(msg, cause);
        }
    }
}
