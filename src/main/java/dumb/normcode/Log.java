package dumb.normcode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

public class Log {

    private static final Logger logger = LoggerFactory.getLogger("normcode");

    private static volatile Events events;

    public static void setEvents(Events events) {
        Log.events = requireNonNull(events);
    }

    public static void clearEvents() {
        Log.events = null;
    }

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void error(String message, Throwable cause) {
        logger.error(message, cause);
        emit(message, LogLevel.ERROR);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    public static void message(String message, LogLevel level) {
        switch (level) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
        if (level != LogLevel.DEBUG) emit(message, level);
    }

    private static void emit(String message, LogLevel level) {
        var e = events;
        if (e != null)
            e.emit(new Events.LogMessageEvent(message, level));
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
