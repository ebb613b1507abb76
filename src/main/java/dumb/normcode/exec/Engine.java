package dumb.normcode.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import dumb.normcode.Events;
import dumb.normcode.Json;
import dumb.normcode.NormEvent;
import dumb.normcode.Tools;
import dumb.normcode.activate.ConceptRecord;
import dumb.normcode.activate.ConceptTable;
import dumb.normcode.activate.InferenceRecord;
import dumb.normcode.activate.Repositories;
import dumb.normcode.activate.SequenceType;
import dumb.normcode.activate.wi.WorkingInterpretation.Assigning;
import dumb.normcode.activate.wi.WorkingInterpretation.AssigningMarker;
import dumb.normcode.activate.wi.WorkingInterpretation.Looping;
import dumb.normcode.checkpoint.Checkpoint;
import dumb.normcode.checkpoint.CheckpointStore;
import dumb.normcode.exec.Blackboard.ConceptState;
import dumb.normcode.exec.Blackboard.Status;
import dumb.normcode.exec.Paradigm.ActuationException;
import dumb.normcode.perceive.Codec;
import dumb.normcode.plan.FlowAddress;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static dumb.normcode.Log.debug;
import static dumb.normcode.Log.error;
import static dumb.normcode.Log.message;
import static dumb.normcode.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Runs the inference repository in cycles. Each cycle settles inferences whose inputs were skipped or failed,
 * selects those whose inputs are all committed, executes them concurrently and commits their outcomes on the
 * calling thread in flow-address order, then appends a checkpoint.
 */
public class Engine implements AutoCloseable {

    private final String runId;
    private final ConceptTable concepts;
    private final List<InferenceRecord> inferences;
    private final Codec codec;
    private final Paradigms paradigms;
    private final Tools tools;
    private final ExecutorService exe;
    private final boolean ownsExecutor;
    private final Options options;
    private final Map<String, String> signatures;
    private final Map<SequenceType, Sequence> sequences = new EnumMap<>(SequenceType.class);
    private final Map<FlowAddress, CompletableFuture<Outcome>> inFlight = new ConcurrentHashMap<>();
    private final Set<FlowAddress> retryQueue = new LinkedHashSet<>();
    private final Map<String, JsonNode> workspace = new TreeMap<>();

    private Blackboard blackboard = new Blackboard();
    private Tracker tracker = new Tracker();
    private @Nullable CheckpointStore store;
    private @Nullable Events events;
    private volatile boolean stopped;
    private boolean started;

    public Engine(String runId, Repositories repos, Codec codec, Paradigms paradigms, Tools tools, Options options) {
        this(runId, repos, codec, paradigms, tools, Executors.newFixedThreadPool(options.workers()), true, options);
    }

    /** Uses an executor owned by the caller; {@link #close()} leaves it running. */
    public Engine(String runId, Repositories repos, Codec codec, Paradigms paradigms, Tools tools, ExecutorService exe, Options options) {
        this(runId, repos, codec, paradigms, tools, exe, false, options);
    }

    private Engine(String runId, Repositories repos, Codec codec, Paradigms paradigms, Tools tools, ExecutorService exe,
                   boolean ownsExecutor, Options options) {
        this.runId = requireNonNull(runId);
        this.concepts = repos.table();
        this.inferences = List.copyOf(repos.inferences());
        this.codec = requireNonNull(codec);
        this.paradigms = requireNonNull(paradigms);
        this.tools = requireNonNull(tools);
        this.exe = requireNonNull(exe);
        this.ownsExecutor = ownsExecutor;
        this.options = requireNonNull(options);
        this.signatures = Checkpoint.signatures(repos);
        List.of(new ImperativeSequence(), new JudgementSequence(), new AssigningSequence(),
                new GroupingSequence(), new TimingSequence(), new LoopingSequence()).forEach(this::register);
    }

    public Engine register(Sequence s) {
        sequences.put(s.type(), s);
        return this;
    }

    public Engine store(@Nullable CheckpointStore store) {
        this.store = store;
        return this;
    }

    public Engine events(@Nullable Events events) {
        this.events = events;
        return this;
    }

    public String runId() {
        return runId;
    }

    public Blackboard blackboard() {
        return blackboard;
    }

    public Tracker tracker() {
        return tracker;
    }

    public Map<String, JsonNode> workspace() {
        return Map.copyOf(workspace);
    }

    /** Committed value of a value concept, by natural name. */
    public Optional<Reference> value(String name) {
        return concepts.value(name).flatMap(c -> blackboard.value(c.id()));
    }

    public ConceptState state(String name) {
        return concepts.value(name).map(c -> blackboard.state(c.id())).orElse(ConceptState.EMPTY);
    }

    public Status status(String flowIndex) {
        return blackboard.status(FlowAddress.parse(flowIndex));
    }

    /** Commits ground concepts and marks inferences whose output is ground as done. */
    private void start() {
        for (var c : concepts.all()) if (c.ground()) seed(c);
        for (var r : inferences)
            blackboard.status(r.flowIndex(), concepts.get(r.conceptToInfer()).map(ConceptRecord::ground).orElse(false)
                    ? Status.COMPLETED : Status.PENDING);
        started = true;
        message("Run " + runId + ": " + inferences.size() + " inferences, " + blackboard.committed().size() + " ground concepts committed");
    }

    private void seed(ConceptRecord c) {
        if (c.isFunction())
            blackboard.commit(c.id(), Reference.scalar(c.referenceData() != null ? c.referenceData() : BooleanNode.TRUE));
        else
            blackboard.commit(c.id(), Reference.of(c.axes(), c.referenceData()));
    }

    /**
     * Restores blackboard, workspace and tracker from a checkpoint. Inferences or concepts whose definition changed
     * since the checkpoint lose their committed state, as does everything downstream of them.
     */
    public Engine resume(Checkpoint cp) {
        try {
            blackboard = Blackboard.restore(cp.blackboard());
            tracker = Tracker.restore(cp.tracker());
        } catch (JsonProcessingException e) {
            throw new CheckpointStore.StoreException("Unreadable checkpoint " + cp.runId() + "@" + cp.cycle() + ": " + e.getMessage(), e);
        }
        workspace.clear();
        cp.workspace().fields().forEachRemaining(e -> workspace.put(e.getKey(), e.getValue()));
        retryQueue.clear();
        for (var r : inferences) {
            var s = blackboard.status(r.flowIndex());
            if (s == Status.IN_PROGRESS) blackboard.status(r.flowIndex(), Status.PENDING);
        }
        if (cp.signatures().isEmpty()) warning("Checkpoint " + cp.runId() + "@" + cp.cycle() + " has no signatures; resuming as is");
        else reconcile(cp.signatures());
        started = true;
        message("Run " + runId + " resumed from " + cp.runId() + "@" + cp.cycle());
        return this;
    }

    private void reconcile(Map<String, String> old) {
        var changed = new LinkedHashSet<String>();
        for (var c : concepts.all()) {
            var key = Checkpoint.CONCEPT + c.id();
            if (Objects.equals(old.get(key), signatures.get(key))) continue;
            warning("Concept " + c.id() + " changed since the checkpoint");
            if (c.ground()) seed(c);
            else blackboard.clear(c.id());
            changed.add(c.id());
        }
        var requeue = new LinkedHashSet<InferenceRecord>();
        for (var r : inferences) {
            var key = Checkpoint.INFERENCE + r.flowIndex();
            if (!Objects.equals(old.get(key), signatures.get(key)) || changed.contains(r.conceptToInfer())) requeue.add(r);
        }
        var seeds = new HashSet<>(changed);
        requeue.forEach(r -> seeds.add(r.conceptToInfer()));
        requeue.addAll(downstream(seeds, null));
        for (var r : requeue) {
            if (concepts.get(r.conceptToInfer()).map(ConceptRecord::ground).orElse(false)) continue;
            if (blackboard.status(r.flowIndex()) != Status.PENDING)
                warning("Re-queued " + r.flowIndex() + ": its definition or inputs changed since the checkpoint");
            reset(r);
        }
    }

    /** Runs cycles until nothing is pending, no progress is possible, the cycle budget is spent or the run is stopped. */
    public Result run() {
        if (!started) start();
        emit(new NormEvent.RunEvent(runId, "STARTED", tracker.cycle()));
        RunStatus status;
        while (true) {
            if (stopped) {
                status = RunStatus.CANCELLED;
                break;
            }
            if (pending().isEmpty()) {
                status = RunStatus.COMPLETED;
                break;
            }
            if (tracker.cycle() >= options.maxCycles()) {
                status = RunStatus.EXHAUSTED;
                break;
            }
            var cycle = tracker.nextCycle();
            var settled = settle();
            var ready = select();
            if (ready.isEmpty() && settled == 0) {
                warning("Run " + runId + " stalled at cycle " + cycle + "; waiting: " + pending());
                checkpoint(cycle);
                status = RunStatus.STALLED;
                break;
            }
            if (!ready.isEmpty()) {
                var flows = ready.stream().map(r -> r.flowIndex().toString()).toList();
                message("Cycle " + cycle + ": " + ready.size() + " ready " + flows);
                emit(new NormEvent.CycleEvent(runId, cycle, flows));
                execute(ready);
            }
            checkpoint(cycle);
        }
        message("Run " + runId + " " + status + " after " + tracker.cycle() + " cycles: " + tracker.succeeded() + " completed, "
                + tracker.failed() + " failed, " + tracker.skipped() + " skipped");
        emit(new NormEvent.RunEvent(runId, status.name(), tracker.cycle()));
        return new Result(runId, status, tracker.cycle(), blackboard.errors());
    }

    /** Settles pending inferences and returns the addresses the next cycle would execute. */
    public List<String> nextSelection() {
        if (!started) start();
        settle();
        return select().stream().map(r -> r.flowIndex().toString()).toList();
    }

    /** Stops scheduling new cycles; the cycle in progress finishes and is checkpointed. */
    public void stop() {
        stopped = true;
    }

    /** Abandons one in-flight actuation, which is then recorded as failed. */
    public boolean cancel(String flowIndex) {
        var f = inFlight.get(FlowAddress.parse(flowIndex));
        if (f == null) return false;
        warning("Cancelling " + flowIndex);
        return f.cancel(true);
    }

    private List<FlowAddress> pending() {
        var out = new ArrayList<FlowAddress>();
        for (var r : inferences)
            if (blackboard.status(r.flowIndex()) == Status.PENDING) out.add(r.flowIndex());
        return out;
    }

    /** Marks pending inferences whose inputs failed as blocked and those whose inputs were skipped as skipped. */
    private int settle() {
        var n = 0;
        for (var r : inferences) {
            if (blackboard.status(r.flowIndex()) != Status.PENDING) continue;
            var v = verdict(r);
            if (v == Verdict.BLOCK) {
                finish(r, Status.BLOCKED, ConceptState.BLOCKED, "an input failed");
                n++;
            } else if (v == Verdict.SKIP) {
                finish(r, Status.SKIPPED, ConceptState.SKIPPED, "an input was skipped");
                n++;
            }
        }
        return n;
    }

    private void finish(InferenceRecord r, Status status, ConceptState state, String why) {
        var f = r.flowIndex().toString();
        blackboard.status(r.flowIndex(), status);
        blackboard.mark(r.conceptToInfer(), state);
        tracker.record(r, status, why);
        warning(status + " " + f + " (" + r.conceptToInfer() + "): " + why);
        emit(new NormEvent.CommitEvent(runId, f, r.conceptToInfer(), status.name()));
    }

    /** Ready inferences: retries first, then fresh work, each in address order. */
    private List<InferenceRecord> select() {
        var retries = new ArrayList<InferenceRecord>();
        var fresh = new ArrayList<InferenceRecord>();
        for (var r : inferences) {
            if (blackboard.status(r.flowIndex()) != Status.PENDING || verdict(r) != Verdict.READY) continue;
            (retryQueue.contains(r.flowIndex()) ? retries : fresh).add(r);
        }
        retries.addAll(fresh);
        return retries;
    }

    private Verdict verdict(InferenceRecord r) {
        var deps = dependencies(r);
        for (var d : deps) {
            var s = blackboard.state(d);
            if (s == ConceptState.FAILED || s == ConceptState.BLOCKED) return Verdict.BLOCK;
        }
        for (var d : deps)
            if (blackboard.state(d) == ConceptState.SKIPPED) return Verdict.SKIP;
        for (var d : deps)
            if (blackboard.state(d) == ConceptState.EMPTY) return Verdict.WAIT;

        var wi = r.workingInterpretation();
        if (specification(r)) {
            for (var v : r.valueConcepts())
                if (!blackboard.state(v).settled()) return Verdict.WAIT;
        }
        if (wi instanceof Looping l && LoopingSequence.awaiting(workspace, r.flowIndex().toString())) {
            var target = concepts.value(l.conceptsToInfer().get(0)).map(ConceptRecord::id).orElse(null);
            if (target == null || !blackboard.state(target).settled()) return Verdict.WAIT;
        }
        return Verdict.READY;
    }

    /** Concepts that must be committed before the inference runs. */
    private List<String> dependencies(InferenceRecord r) {
        var deps = new ArrayList<String>();
        deps.add(r.functionConcept());
        if (specification(r)) return deps;
        if (r.workingInterpretation() instanceof Looping l) {
            concepts.value(l.baseConcept()).ifPresent(c -> deps.add(c.id()));
            return deps;
        }
        deps.addAll(r.valueConcepts());
        deps.addAll(r.contextConcepts());
        return deps;
    }

    private static boolean specification(InferenceRecord r) {
        return r.workingInterpretation() instanceof Assigning a && a.marker() == AssigningMarker.SPECIFICATION;
    }

    private void execute(List<InferenceRecord> ready) {
        for (var r : ready) {
            var flow = r.flowIndex();
            blackboard.status(flow, Status.IN_PROGRESS);
            blackboard.executed(flow);
            var step = new Step(r, blackboard, concepts, codec, paradigms, tools, workspace, exe, options.toolTimeout());
            CompletableFuture<Outcome> f;
            try {
                var seq = sequences.get(r.sequence());
                if (seq == null) throw new IllegalStateException("No sequence registered for " + r.sequence());
                f = seq.execute(step);
            } catch (RuntimeException e) {
                f = CompletableFuture.completedFuture(new Outcome.Fail(e.getMessage(), e));
            }
            inFlight.put(flow, f);
        }
        retryQueue.removeAll(ready.stream().map(InferenceRecord::flowIndex).toList());

        var ordered = new ArrayList<>(ready);
        ordered.sort(null);
        for (var r : ordered) {
            Outcome o;
            try {
                o = inFlight.get(r.flowIndex()).join();
            } catch (CancellationException | CompletionException e) {
                var a = ActuationException.of(e);
                o = new Outcome.Fail(a.getMessage(), a);
            }
            apply(r, o);
        }
        inFlight.clear();
    }

    private void apply(InferenceRecord r, Outcome o) {
        var flow = r.flowIndex();
        var f = flow.toString();
        var out = r.conceptToInfer();
        if (o instanceof Outcome.Commit c) {
            blackboard.commit(out, c.value());
            blackboard.status(flow, Status.COMPLETED);
            blackboard.clearError(flow);
            tracker.record(r, Status.COMPLETED, null);
            message("Committed " + out + " at " + f + ": " + c.value());
            emit(new NormEvent.CommitEvent(runId, f, out, Status.COMPLETED.name()));
        } else if (o instanceof Outcome.Skip s) {
            finish(r, Status.SKIPPED, ConceptState.SKIPPED, s.reason());
        } else if (o instanceof Outcome.Iterate it) {
            it.commits().forEach(blackboard::commit);
            for (var b : downstream(it.commits().keySet(), flow)) reset(b);
            blackboard.status(flow, Status.PENDING);
            tracker.record(r, Status.PENDING, "iteration");
            debug("Loop " + f + " committed " + it.commits().keySet());
            it.commits().keySet().forEach(id -> emit(new NormEvent.CommitEvent(runId, f, id, "ITERATION")));
        } else if (o instanceof Outcome.Fail x) {
            fail(r, x);
        }
    }

    private void fail(InferenceRecord r, Outcome.Fail x) {
        var flow = r.flowIndex();
        var f = flow.toString();
        var attempts = tracker.attempt(f);
        var cancelled = x.cause() != null && (x.cause() instanceof CancellationException || x.cause().getCause() instanceof CancellationException);
        if (!cancelled && attempts <= options.retries()) {
            blackboard.status(flow, Status.PENDING);
            retryQueue.add(flow);
            tracker.retried();
            warning("Retrying " + f + " (attempt " + (attempts + 1) + "): " + x.message());
            return;
        }
        blackboard.mark(r.conceptToInfer(), ConceptState.FAILED);
        blackboard.status(flow, Status.FAILED);
        blackboard.error(flow, x.message());
        tracker.record(r, Status.FAILED, x.message());
        if (x.cause() != null) error("Inference " + f + " failed: " + x.message(), x.cause());
        else error("Inference " + f + " failed: " + x.message());
        emit(new NormEvent.FailureEvent(runId, f, x.message()));
    }

    private void reset(InferenceRecord r) {
        blackboard.status(r.flowIndex(), Status.PENDING);
        blackboard.clear(r.conceptToInfer());
        blackboard.clearError(r.flowIndex());
        retryQueue.remove(r.flowIndex());
        tracker.resetAttempts(r.flowIndex().toString());
        if (r.sequence() == SequenceType.LOOPING) workspace.remove(LoopingSequence.key(r.flowIndex().toString()));
    }

    /** Inferences that read any of the concepts, directly or through other inferences' outputs. */
    private Collection<InferenceRecord> downstream(Set<String> seeds, @Nullable FlowAddress exclude) {
        var ids = new HashSet<>(seeds);
        var out = new LinkedHashMap<FlowAddress, InferenceRecord>();
        var changed = true;
        while (changed) {
            changed = false;
            for (var r : inferences) {
                if (r.flowIndex().equals(exclude) || out.containsKey(r.flowIndex())) continue;
                if (ids.contains(r.functionConcept()) || r.valueConcepts().stream().anyMatch(ids::contains)
                        || r.contextConcepts().stream().anyMatch(ids::contains)) {
                    out.put(r.flowIndex(), r);
                    ids.add(r.conceptToInfer());
                    changed = true;
                }
            }
        }
        return out.values();
    }

    private void checkpoint(int cycle) {
        if (store == null) return;
        var completed = (int) inferences.stream().filter(r -> blackboard.status(r.flowIndex()) == Status.COMPLETED).count();
        var ws = Json.node();
        workspace.forEach(ws::set);
        store.append(new Checkpoint(runId, cycle, completed, Instant.now(), blackboard.snapshot(), ws,
                tracker.snapshot(), blackboard.committed(), signatures));
        debug("Checkpoint " + runId + "@" + cycle);
        emit(new NormEvent.CheckpointEvent(runId, cycle));
    }

    private void emit(NormEvent e) {
        var ev = events;
        if (ev != null) ev.emit(e);
    }

    @Override
    public void close() {
        inFlight.values().forEach(f -> f.cancel(true));
        if (ownsExecutor) exe.shutdownNow();
    }

    private enum Verdict {
        READY, WAIT, SKIP, BLOCK
    }

    public enum RunStatus {
        COMPLETED, STALLED, EXHAUSTED, CANCELLED
    }

    public record Result(String runId, RunStatus status, int cycles, Map<String, String> errors) {
        public Result {
            errors = Map.copyOf(errors);
        }
    }

    public record Options(int maxCycles, int workers, Duration toolTimeout, int retries) {
        public static final int DEFAULT_MAX_CYCLES = 300;
        public static final int DEFAULT_WORKERS = 4;
        public static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(120);

        public Options {
            if (maxCycles < 1) throw new IllegalArgumentException("maxCycles must be positive");
            if (workers < 1) throw new IllegalArgumentException("workers must be positive");
            requireNonNull(toolTimeout);
            if (retries < 0) throw new IllegalArgumentException("retries must not be negative");
        }

        public static Options defaults() {
            return new Options(DEFAULT_MAX_CYCLES, DEFAULT_WORKERS, DEFAULT_TOOL_TIMEOUT, 0);
        }

        public Options withRetries(int n) {
            return new Options(maxCycles, workers, toolTimeout, n);
        }

        public Options withMaxCycles(int n) {
            return new Options(n, workers, toolTimeout, retries);
        }

        public Options withToolTimeout(Duration d) {
            return new Options(maxCycles, workers, d, retries);
        }
    }
}
