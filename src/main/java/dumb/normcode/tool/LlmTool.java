package dumb.normcode.tool;

import dumb.normcode.LM;
import dumb.normcode.Tool;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static dumb.normcode.Log.error;
import static java.util.Objects.requireNonNull;

public class LlmTool implements Tool {

    public static final String NAME = "llm";
    public static final String PROMPT = "prompt";
    public static final String SYSTEM = "system";
    public static final String TASK_ID = "task_id";

    private final LM lm;

    public LlmTool(LM lm) {
        this.lm = requireNonNull(lm);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Sends a prompt to the configured language model and returns its reply.";
    }

    @Override
    public CompletableFuture<?> execute(Map<String, Object> parameters) {
        var prompt = (String) parameters.get(PROMPT);
        if (prompt == null || prompt.isBlank()) {
            error("LlmTool requires a 'prompt' parameter.");
            return CompletableFuture.failedFuture(new ToolExecutionException("Missing 'prompt' parameter."));
        }
        if (!lm.configured())
            return CompletableFuture.failedFuture(new ToolExecutionException("Language model is not configured."));
        var taskId = String.valueOf(parameters.getOrDefault(TASK_ID, "llm"));
        return lm.generate(taskId, (String) parameters.get(SYSTEM), prompt);
    }
}
