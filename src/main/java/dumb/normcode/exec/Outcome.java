package dumb.normcode.exec;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/** What one execution of an inference produced; applied to the blackboard by the engine thread. */
public sealed interface Outcome {

    /** The output concept takes this value. */
    record Commit(Reference value) implements Outcome {
    }

    /** The gate stayed closed: the inference and its output are skipped. */
    record Skip(String reason) implements Outcome {
    }

    record Fail(String message, @Nullable Throwable cause) implements Outcome {
        public Fail(String message) {
            this(message, null);
        }
    }

    /**
     * A loop advanced one element: commit these concepts (by id), reset the loop body and run the
     * loop again once the per-iteration concept is settled.
     */
    record Iterate(Map<String, Reference> commits) implements Outcome {
        public Iterate {
            commits = Map.copyOf(commits);
        }
    }
}
