package dumb.normcode;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A body faculty: something a paradigm actuates through (a language model, the file system, a script interpreter).
 */
public interface Tool {

    String name();

    String description();

    CompletableFuture<?> execute(Map<String, Object> parameters);

    class ToolExecutionException extends RuntimeException {
        public ToolExecutionException(String msg) {
            super(msg);
        }

        public ToolExecutionException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }
}
