package dumb.normcode.exec;

import dumb.normcode.exec.Paradigm.ActuationException;

import java.util.concurrent.CompletableFuture;

/** Syntactic sequences: pure reshaping of committed values, done on the engine thread without a paradigm. */
abstract class OperatorSequence implements Sequence {

    @Override
    public CompletableFuture<Outcome> execute(Step step) {
        try {
            return CompletableFuture.completedFuture(run(step));
        } catch (ActuationException e) {
            return CompletableFuture.completedFuture(new Outcome.Fail(e.getMessage(), e));
        }
    }

    protected abstract Outcome run(Step step) throws ActuationException;
}
