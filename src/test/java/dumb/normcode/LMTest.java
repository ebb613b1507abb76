package dumb.normcode;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LMTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private ExecutorService exe;
    private LM lm;

    @BeforeEach
    void setUp() {
        exe = Executors.newFixedThreadPool(2);
        var model = new ChatLanguageModel() {
            @Override
            public Response<AiMessage> generate(List<ChatMessage> messages) {
                var text = ((UserMessage) messages.get(messages.size() - 1)).singleText();
                if (text.equals("slow")) {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return Response.from(AiMessage.from(text));
            }
        };
        lm = new LM(model, exe);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        exe.shutdownNow();
    }

    @Test
    void cancelAllReachesEveryCallOfOneTask() {
        var slow = lm.generate("1.1", null, "slow");
        assertEquals("fast", lm.generate("1.1", null, "fast").join());
        lm.cancelAll();
        assertTrue(slow.isCancelled());
        assertTrue(lm.activeLlmTasks.isEmpty());
    }
}
