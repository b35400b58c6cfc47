package org.docmutate.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * JSON-lines logger intended for deterministic diagnostics. Events below the configured minimum level are
 * dropped.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final JsonWriterSettings JSON_SETTINGS =
            JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();
    private static final List<String> LEVELS = List.of(DEBUG, INFO, WARN, ERROR);

    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private final int minimumLevel;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true, INFO);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, String minimumLevel) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, true, minimumLevel);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush, String minimumLevel) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.minimumLevel = rank(normalizeLevel(minimumLevel));
        this.closed = false;
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        String safeLevel = normalizeLevel(level);
        if (rank(safeLevel) < minimumLevel) {
            return;
        }
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        Document event = new Document();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", safeLevel);
        event.put("message", message == null ? "" : message);
        event.putAll(safeCorrelation.asFields());
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || event.containsKey(key)) {
                continue;
            }
            event.put(key, encodable(entry.getValue()));
        }

        writeLine(event.toJson(JSON_SETTINGS));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    // Anything the default BSON codecs cannot encode is logged through its string form.
    private static Object encodable(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Document nested = new Document();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                nested.put(String.valueOf(entry.getKey()), encodable(entry.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(encodable(item));
            }
            return items;
        }
        return String.valueOf(value);
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return INFO;
        }
        return level.trim().toUpperCase(Locale.ROOT);
    }

    private static int rank(String level) {
        int index = LEVELS.indexOf(level);
        return index < 0 ? LEVELS.indexOf(INFO) : index;
    }
}
