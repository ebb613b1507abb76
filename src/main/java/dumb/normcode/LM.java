package dumb.normcode;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

import static dumb.normcode.Log.error;
import static dumb.normcode.Log.message;
import static java.util.Objects.requireNonNull;

public class LM {
    static final String DEFAULT_LLM_URL = "http://localhost:11434";
    static final String DEFAULT_LLM_MODEL = "hf.co/bartowski/Meta-Llama-3.1-8B-Instruct-GGUF:Q8_0";
    static final int HTTP_TIMEOUT_SECONDS = 90;
    /** In-flight calls keyed {@code <taskId>#<call>}; one task id may have several calls running. */
    public final Map<String, CompletableFuture<?>> activeLlmTasks = new ConcurrentHashMap<>();
    private final AtomicLong calls = new AtomicLong();

    private final Executor executor;
    public volatile String llmApiUrl;
    public volatile String llmModel;
    private volatile ChatLanguageModel chatModel;

    public LM(Executor executor) {
        this.executor = requireNonNull(executor);
    }

    /** Uses an already built model instead of configuring one from a URL. */
    public LM(ChatLanguageModel chatModel, Executor executor) {
        this(executor);
        this.chatModel = requireNonNull(chatModel);
    }

    public void reconfigure(String apiUrl, String model, Duration timeout) {
        this.llmApiUrl = apiUrl;
        this.llmModel = model;
        try {
            var baseUrl = llmApiUrl;
            if (baseUrl == null || baseUrl.isBlank()) {
                error("LLM Reconfiguration skipped: API URL is not set.");
                this.chatModel = null;
                return;
            }
            if (baseUrl.endsWith("/api/chat")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - "/api/chat".length());
            } else if (baseUrl.endsWith("/api")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - "/api".length());
            }

            this.chatModel = OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(llmModel)
                    .temperature(0.2)
                    .timeout(timeout != null ? timeout : Duration.ofSeconds(HTTP_TIMEOUT_SECONDS))
                    .build();
            message(String.format("LM ChatModel reconfigured: Base URL=%s, Model=%s", baseUrl, llmModel));
        } catch (Exception e) {
            error("Failed to reconfigure LLM: " + e.getMessage(), e);
            this.chatModel = null;
        }
    }

    public boolean configured() {
        return chatModel != null;
    }

    public CompletableFuture<String> generate(String taskId, @Nullable String system, String prompt) {
        var model = chatModel;
        if (model == null)
            return CompletableFuture.failedFuture(new IllegalStateException("LLM Service not configured."));

        var history = new ArrayList<ChatMessage>();
        if (system != null && !system.isBlank()) history.add(SystemMessage.from(system));
        history.add(UserMessage.from(prompt));

        var task = CompletableFuture.supplyAsync(() -> {
            try {
                return model.generate(history).content().text();
            } catch (Exception e) {
                var cause = (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
                if (cause instanceof InterruptedException) Thread.currentThread().interrupt();
                error("LLM interaction error (" + taskId + "): " + cause.getMessage());
                throw new CompletionException("LLM interaction error (" + taskId + "): " + cause.getMessage(), cause);
            }
        }, executor);

        var key = taskId + "#" + calls.incrementAndGet();
        activeLlmTasks.put(key, task);
        task.whenComplete((result, err) -> activeLlmTasks.remove(key));
        return task;
    }

    public void cancelAll() {
        activeLlmTasks.values().forEach(f -> f.cancel(true));
        activeLlmTasks.clear();
    }
}
