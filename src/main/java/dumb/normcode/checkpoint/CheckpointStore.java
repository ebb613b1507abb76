package dumb.normcode.checkpoint;

import java.util.List;
import java.util.Optional;

/** Append-only log of checkpoints, queryable by run. */
public interface CheckpointStore extends AutoCloseable {

    /** Rejects a cycle that is not greater than the last one stored for the run. */
    void append(Checkpoint checkpoint);

    Optional<Checkpoint> latest(String runId);

    Optional<Checkpoint> at(String runId, int cycle);

    /** Checkpoints of a run in cycle order. */
    List<Checkpoint.Summary> list(String runId);

    List<Checkpoint.Run> listRuns();

    /** Every recorded execution of a run, in cycle order. */
    List<Checkpoint.Execution> executions(String runId);

    @Override
    void close();

    class StoreException extends RuntimeException {
        public StoreException(String message) {
            super(message);
        }

        public StoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
