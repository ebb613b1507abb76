package dumb.normcode.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dumb.normcode.Json;
import dumb.normcode.exec.Paradigm.ActuationException;
import dumb.normcode.tool.FileSystemTool;
import dumb.normcode.tool.LlmTool;
import dumb.normcode.tool.ScriptTool;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static dumb.normcode.Log.message;

/** Registry of paradigms by id. */
public class Paradigms {

    public static final String LLM_PROMPT = "llm_prompt";
    public static final String SCRIPT = "script";
    public static final String FILE_READ = "file_read";
    public static final String FILE_WRITE = "file_write";
    public static final String IDENTITY = "identity";

    private static final Pattern INPUT_VAR = Pattern.compile("\\$input_(\\d+)");

    private final Map<String, Paradigm> paradigms = new ConcurrentHashMap<>();

    public Paradigms add(Paradigm p) {
        if (paradigms.putIfAbsent(p.id(), p) != null)
            throw new IllegalArgumentException("Paradigm '" + p.id() + "' already registered.");
        message("Registered paradigm: " + p.id());
        return this;
    }

    /** A synchronous paradigm computed directly from its inputs. */
    public Paradigms add(String id, Function<List<JsonNode>, JsonNode> f) {
        return add(Paradigm.of(id, a -> CompletableFuture.completedFuture(f.apply(a.inputs()))));
    }

    public Optional<Paradigm> get(String id) {
        return Optional.ofNullable(paradigms.get(id));
    }

    public Paradigm require(String id) throws ActuationException {
        var p = paradigms.get(id);
        if (p == null) throw new ActuationException("No paradigm registered as '" + id + "'");
        return p;
    }

    public Set<String> ids() {
        return new TreeSet<>(paradigms.keySet());
    }

    /** The paradigms every runtime has: prompting a language model, running a script, file I/O and identity. */
    public static Paradigms builtins() {
        return new Paradigms()
                .add(Paradigm.of(LLM_PROMPT, Paradigms::prompt))
                .add(Paradigm.of(SCRIPT, a -> call(a.tool(ScriptTool.NAME)
                        .execute(Map.of(ScriptTool.SCRIPT, text(a.vertical()), ScriptTool.INPUT, Json.compact(a.inputs()))),
                        out -> Json.parseOrText(String.valueOf(out)))))
                .add(Paradigm.of(FILE_READ, a -> call(a.tool(FileSystemTool.NAME)
                        .execute(Map.of(FileSystemTool.OPERATION, FileSystemTool.READ, FileSystemTool.PATH, text(a.input(1)))),
                        out -> Json.parseOrText(String.valueOf(out)))))
                .add(Paradigm.of(FILE_WRITE, a -> call(a.tool(FileSystemTool.NAME)
                        .execute(Map.of(FileSystemTool.OPERATION, FileSystemTool.WRITE, FileSystemTool.PATH, text(a.input(1)),
                                FileSystemTool.CONTENT, text(a.input(2)))),
                        out -> TextNode.valueOf(String.valueOf(out)))))
                .add(Paradigm.of(IDENTITY, a -> CompletableFuture.completedFuture(
                        a.inputs().size() == 1 ? a.input(1) : Json.node(a.inputs()))));
    }

    /** Fills {@code $input_n} in the prompt template; without a template the inputs are sent as they are. */
    private static CompletableFuture<JsonNode> prompt(Paradigm.Actuation a) {
        String prompt;
        if (a.vertical() == null || a.vertical().isNull()) {
            prompt = a.inputs().stream().map(Paradigms::text).reduce((x, y) -> x + "\n" + y).orElse("");
        } else {
            var m = INPUT_VAR.matcher(text(a.vertical()));
            var sb = new StringBuilder();
            while (m.find())
                m.appendReplacement(sb, Matcher.quoteReplacement(text(a.input(Integer.parseInt(m.group(1))))));
            m.appendTail(sb);
            prompt = sb.toString();
        }
        return call(a.tool(LlmTool.NAME).execute(Map.of(LlmTool.PROMPT, prompt, LlmTool.TASK_ID, a.flowIndex())),
                out -> Json.parseOrText(String.valueOf(out)));
    }

    /** Maps a tool's result; abandoning the mapped future abandons the tool call. */
    private static CompletableFuture<JsonNode> call(CompletableFuture<?> tool, Function<Object, JsonNode> result) {
        return Paradigm.linked(tool.thenApply(result), tool);
    }

    static String text(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return "";
        return v.isTextual() ? v.asText() : Json.compact(v);
    }
}
