package dumb.normcode.exec;

import dumb.normcode.activate.SequenceType;

import java.util.concurrent.CompletableFuture;

/**
 * Executes one kind of inference. {@code execute} is called on the engine thread and may read the blackboard
 * there; slow work (perception, actuation) belongs in the returned future.
 */
public interface Sequence {

    SequenceType type();

    CompletableFuture<Outcome> execute(Step step);
}
