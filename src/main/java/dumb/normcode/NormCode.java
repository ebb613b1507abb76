package dumb.normcode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.normcode.activate.Activation;
import dumb.normcode.activate.ActivationException;
import dumb.normcode.activate.Repositories;
import dumb.normcode.checkpoint.Checkpoint;
import dumb.normcode.checkpoint.CheckpointStore;
import dumb.normcode.checkpoint.SqliteCheckpointStore;
import dumb.normcode.exec.Engine;
import dumb.normcode.exec.Paradigms;
import dumb.normcode.perceive.Codec;
import dumb.normcode.perceive.Norms;
import dumb.normcode.perceive.PathMap;
import dumb.normcode.tool.FileSystemTool;
import dumb.normcode.tool.LlmTool;
import dumb.normcode.tool.ScriptTool;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static dumb.normcode.Log.error;
import static dumb.normcode.Log.message;
import static dumb.normcode.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Wires the compiler, the runtime and the checkpoint database from one {@link Configuration}, and exposes them as
 * command-line verbs.
 */
public class NormCode implements AutoCloseable {

    public static final String CONFIG_FILE = "normcode.json";
    static final int DEFAULT_MAX_CYCLES = Engine.Options.DEFAULT_MAX_CYCLES;
    static final int DEFAULT_WORKERS = Engine.Options.DEFAULT_WORKERS;
    static final int DEFAULT_TOOL_TIMEOUT_SECONDS = 120;
    static final String DEFAULT_CHECKPOINT_DB = "normcode_checkpoints.db";
    static final String STORE_DIR = "store";

    public final Configuration cfg;
    public final Events events;
    public final LM lm;
    public final Tools tools = new Tools();
    public final Paradigms paradigms;
    public final PathMap paths;
    public final Codec codec;
    private final ExecutorService exe;
    private @Nullable CheckpointStore store;

    public NormCode(Configuration cfg) {
        this(cfg, null);
    }

    /** @param lm a preconfigured language model; when null one is built from the configured URL and model */
    public NormCode(Configuration cfg, @Nullable LM lm) {
        this.cfg = requireNonNull(cfg);
        this.exe = Executors.newFixedThreadPool(cfg.workers());
        this.events = new Events(Executors.newSingleThreadExecutor());
        Log.setEvents(events);
        this.paths = new PathMap(baseDir(), cfg.pathMap());
        this.codec = Norms.codec(paths, baseDir().resolve(STORE_DIR));
        if (lm == null) {
            lm = new LM(exe);
            lm.reconfigure(cfg.llmApiUrl(), cfg.llmModel(), toolTimeout());
        }
        this.lm = lm;
        tools.add(new LlmTool(this.lm))
                .add(new FileSystemTool(paths, exe))
                .add(new ScriptTool(paths, exe, toolTimeout()));
        this.paradigms = Paradigms.builtins();
    }

    public static void main(String[] args) {
        var flags = new ArrayList<String>();
        Path configFile = Path.of(CONFIG_FILE);
        Integer maxCycles = null, workers = null, retries = null;
        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    case "--max-cycles" -> maxCycles = Integer.parseInt(args[++i]);
                    case "--workers" -> workers = Integer.parseInt(args[++i]);
                    case "--retries" -> retries = Integer.parseInt(args[++i]);
                    default -> flags.add(args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                error(String.format("Error parsing argument for %s: %s", args[i - 1], e.getMessage()));
                printUsageAndExit();
            }
        }
        if (flags.isEmpty()) printUsageAndExit();

        var cfg = Configuration.load(configFile).with(maxCycles, workers, retries);
        var code = 0;
        try (var n = new NormCode(cfg)) {
            code = n.command(flags);
        } catch (ActivationException e) {
            error(e.getMessage());
            e.problems().forEach(p -> error("  " + p));
            code = 2;
        } catch (IOException | RuntimeException e) {
            error("Command failed: " + e.getMessage(), e);
            code = 1;
        }
        System.exit(code);
    }

    private static void printUsageAndExit() {
        System.err.printf("""
                Usage: java %s [--config file] [--max-cycles n] [--workers n] [--retries n] <command>
                  activate <plan.json> <outDir>
                  run <outDir> [--run-id id] [--resume [cycle]]
                  runs
                  checkpoints <runId>
                  executions <runId>
                """, NormCode.class.getName());
        System.exit(1);
    }

    /** Runs one verb; returns the process exit code. */
    int command(List<String> args) throws IOException {
        var verb = args.get(0);
        switch (verb) {
            case "activate" -> {
                if (args.size() < 3) printUsageAndExit();
                var r = activate(Path.of(args.get(1)), Path.of(args.get(2)));
                System.out.println(Json.str(r.summary()));
                return 0;
            }
            case "run" -> {
                if (args.size() < 2) printUsageAndExit();
                String runId = null;
                Integer cycle = null;
                var resume = false;
                for (var i = 2; i < args.size(); i++) {
                    switch (args.get(i)) {
                        case "--run-id" -> runId = args.get(++i);
                        case "--resume" -> {
                            resume = true;
                            if (i + 1 < args.size() && args.get(i + 1).matches("\\d+")) cycle = Integer.parseInt(args.get(++i));
                        }
                        default -> warning("Unknown run option: " + args.get(i));
                    }
                }
                var r = run(Path.of(args.get(1)), runId, resume, cycle);
                System.out.println(Json.str(r));
                return r.status() == Engine.RunStatus.COMPLETED ? 0 : 3;
            }
            case "runs" -> {
                System.out.println(Json.str(store().listRuns()));
                return 0;
            }
            case "checkpoints" -> {
                if (args.size() < 2) printUsageAndExit();
                System.out.println(Json.str(store().list(args.get(1))));
                return 0;
            }
            case "executions" -> {
                if (args.size() < 2) printUsageAndExit();
                System.out.println(Json.str(store().executions(args.get(1))));
                return 0;
            }
            default -> {
                error("Unknown command: " + verb);
                printUsageAndExit();
                return 1;
            }
        }
    }

    /** Compiles a plan file and writes both repositories to {@code outDir}. Nothing is written when compilation fails. */
    public Activation.Result activate(Path plan, Path outDir) throws IOException {
        var activation = new Activation(codec, paradigms.ids(), cfg.eagerResourceCheck());
        var r = activation.activate(plan);
        r.warnings().forEach(w -> warning(w.toString()));
        r.repositories().write(outDir);
        message("Wrote " + Repositories.CONCEPT_REPO + " and " + Repositories.INFERENCE_REPO + " to " + outDir);
        return r;
    }

    /**
     * Runs compiled repositories. Resuming from an earlier cycle than the run's latest continues under a new run id,
     * since a run's checkpoint sequence is append-only.
     */
    public Engine.Result run(Path repoDir, @Nullable String runId, boolean resume, @Nullable Integer cycle) throws IOException {
        var repos = Repositories.read(repoDir);
        var id = runId != null ? runId : UUID.randomUUID().toString();
        Checkpoint from = null;
        if (resume) {
            if (runId == null) throw new IllegalArgumentException("--resume needs --run-id");
            var latest = store().latest(runId)
                    .orElseThrow(() -> new IllegalArgumentException("No checkpoints for run " + runId));
            from = cycle == null ? latest : store().at(runId, cycle)
                    .orElseThrow(() -> new IllegalArgumentException("No checkpoint " + runId + "@" + cycle));
            if (from.cycle() < latest.cycle()) {
                id = forkId(runId, from.cycle());
                message("Resuming " + runId + "@" + from.cycle() + " as " + id);
            }
        } else if (runId != null && store().latest(runId).isPresent()) {
            throw new IllegalArgumentException("Run " + runId + " already has checkpoints; resume it or pick another id");
        }
        try (var engine = new Engine(id, repos, codec, paradigms, tools, exe, options())) {
            engine.store(store()).events(events);
            if (from != null) engine.resume(from);
            return engine.run();
        }
    }

    /** {@code <runId>-r<cycle>}, suffixed {@code -2}, {@code -3}, ... when earlier resumes from that cycle exist. */
    private String forkId(String runId, int cycle) {
        var base = runId + "-r" + cycle;
        var id = base;
        for (var n = 2; store().latest(id).isPresent(); n++) id = base + "-" + n;
        return id;
    }

    public Engine.Options options() {
        return new Engine.Options(cfg.maxCycles(), cfg.workers(), toolTimeout(), cfg.retries());
    }

    private Duration toolTimeout() {
        return Duration.ofSeconds(cfg.toolTimeoutSeconds());
    }

    private Path baseDir() {
        return Path.of(cfg.baseDir()).toAbsolutePath().normalize();
    }

    public synchronized CheckpointStore store() {
        if (store == null) store = new SqliteCheckpointStore(baseDir().resolve(cfg.checkpointDb()));
        return store;
    }

    @Override
    public void close() {
        lm.cancelAll();
        if (store != null) store.close();
        exe.shutdownNow();
        Log.clearEvents();
        events.shutdown();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("llmApiUrl") String llmApiUrl,
            @JsonProperty("llmModel") String llmModel,
            @JsonProperty("maxCycles") int maxCycles,
            @JsonProperty("workers") int workers,
            @JsonProperty("toolTimeoutSeconds") int toolTimeoutSeconds,
            @JsonProperty("retries") int retries,
            @JsonProperty("baseDir") String baseDir,
            @JsonProperty("checkpointDb") String checkpointDb,
            @JsonProperty("eagerResourceCheck") boolean eagerResourceCheck,
            @JsonProperty("pathMap") Map<String, String> pathMap
    ) {
        public Configuration {
            pathMap = pathMap == null ? Map.of() : Map.copyOf(pathMap);
        }

        @JsonCreator
        public Configuration(
                @JsonProperty("llmApiUrl") String llmApiUrl,
                @JsonProperty("llmModel") String llmModel,
                @JsonProperty("maxCycles") Integer maxCycles,
                @JsonProperty("workers") Integer workers,
                @JsonProperty("toolTimeoutSeconds") Integer toolTimeoutSeconds,
                @JsonProperty("retries") Integer retries,
                @JsonProperty("baseDir") String baseDir,
                @JsonProperty("checkpointDb") String checkpointDb,
                @JsonProperty("eagerResourceCheck") Boolean eagerResourceCheck,
                @JsonProperty("pathMap") Map<String, String> pathMap
        ) {
            this(
                    llmApiUrl != null ? llmApiUrl : LM.DEFAULT_LLM_URL,
                    llmModel != null ? llmModel : LM.DEFAULT_LLM_MODEL,
                    maxCycles != null ? maxCycles : DEFAULT_MAX_CYCLES,
                    workers != null ? workers : DEFAULT_WORKERS,
                    toolTimeoutSeconds != null ? toolTimeoutSeconds : DEFAULT_TOOL_TIMEOUT_SECONDS,
                    retries != null ? retries : 0,
                    baseDir != null ? baseDir : ".",
                    checkpointDb != null ? checkpointDb : DEFAULT_CHECKPOINT_DB,
                    eagerResourceCheck == null || eagerResourceCheck,
                    pathMap
            );
        }

        public Configuration() {
            this(LM.DEFAULT_LLM_URL, LM.DEFAULT_LLM_MODEL, DEFAULT_MAX_CYCLES, DEFAULT_WORKERS, DEFAULT_TOOL_TIMEOUT_SECONDS,
                    0, ".", DEFAULT_CHECKPOINT_DB, true, Map.of());
        }

        /** Reads the file when it exists; a missing or unreadable file gives the defaults. */
        public static Configuration load(Path file) {
            if (!Files.exists(file)) return new Configuration();
            try {
                var c = Json.the.readValue(file.toFile(), Configuration.class);
                message("Loaded configuration from " + file);
                return c;
            } catch (IOException e) {
                error("Bad configuration in " + file + ", using defaults: " + e.getMessage());
                return new Configuration();
            }
        }

        public Configuration with(@Nullable Integer maxCycles, @Nullable Integer workers, @Nullable Integer retries) {
            return new Configuration(llmApiUrl, llmModel,
                    maxCycles != null ? maxCycles : this.maxCycles,
                    workers != null ? workers : this.workers,
                    toolTimeoutSeconds,
                    retries != null ? retries : this.retries,
                    baseDir, checkpointDb, eagerResourceCheck, pathMap);
        }
    }
}
