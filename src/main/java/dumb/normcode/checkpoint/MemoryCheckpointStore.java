package dumb.normcode.checkpoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps checkpoints in memory; for tests and runs that need no durability. */
public class MemoryCheckpointStore implements CheckpointStore {

    private final Map<String, TreeMap<Integer, Checkpoint>> runs = new ConcurrentHashMap<>();

    @Override
    public synchronized void append(Checkpoint cp) {
        var run = runs.computeIfAbsent(cp.runId(), k -> new TreeMap<>());
        if (!run.isEmpty() && cp.cycle() <= run.lastKey())
            throw new StoreException("Cycle " + cp.cycle() + " of run " + cp.runId() + " is not after " + run.lastKey());
        run.put(cp.cycle(), cp);
    }

    @Override
    public synchronized Optional<Checkpoint> latest(String runId) {
        var run = runs.get(runId);
        return run == null || run.isEmpty() ? Optional.empty() : Optional.of(run.lastEntry().getValue());
    }

    @Override
    public synchronized Optional<Checkpoint> at(String runId, int cycle) {
        var run = runs.get(runId);
        return run == null ? Optional.empty() : Optional.ofNullable(run.get(cycle));
    }

    @Override
    public synchronized List<Checkpoint.Summary> list(String runId) {
        var run = runs.get(runId);
        if (run == null) return List.of();
        return run.values().stream().map(c -> new Checkpoint.Summary(c.cycle(), c.inferenceCount(), c.timestamp())).toList();
    }

    @Override
    public synchronized List<Checkpoint.Run> listRuns() {
        var out = new ArrayList<Checkpoint.Run>();
        runs.forEach((id, run) -> {
            if (run.isEmpty()) return;
            var last = run.lastEntry().getValue();
            out.add(new Checkpoint.Run(id, run.size(), last.cycle(), last.timestamp()));
        });
        out.sort(Comparator.comparing(Checkpoint.Run::runId));
        return out;
    }

    @Override
    public synchronized List<Checkpoint.Execution> executions(String runId) {
        var run = runs.get(runId);
        if (run == null) return List.of();
        return run.values().stream().flatMap(c -> c.executions().stream()).toList();
    }

    @Override
    public void close() {
        runs.clear();
    }
}
