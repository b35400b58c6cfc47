package org.docmutate.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    String DEBUG = "DEBUG";
    String INFO = "INFO";
    String WARN = "WARN";
    String ERROR = "ERROR";

    void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields);

    default void debug(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log(DEBUG, message, correlationContext, fields);
    }

    default void info(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log(INFO, message, correlationContext, fields);
    }

    default void info(String message, CorrelationContext correlationContext) {
        info(message, correlationContext, Collections.emptyMap());
    }

    default void warn(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log(WARN, message, correlationContext, fields);
    }

    default void error(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log(ERROR, message, correlationContext, fields);
    }

    @Override
    void close();

    /**
     * Logger that discards every event.
     */
    static JsonLinesLogger noop() {
        return NoopLogger.INSTANCE;
    }

    final class NoopLogger implements JsonLinesLogger {
        private static final NoopLogger INSTANCE = new NoopLogger();

        private NoopLogger() {
        }

        @Override
        public void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        }

        @Override
        public void close() {
        }
    }
}
