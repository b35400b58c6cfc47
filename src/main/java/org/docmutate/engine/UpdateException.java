package org.docmutate.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every failure raised while parsing or applying an update, or while checking shard keys.
 *
 * <p>Each failure carries a wire-compatible error code and code name plus the structured details (operator,
 * path, shard key path) a caller needs to build a client-facing message.
 */
public abstract class UpdateException extends RuntimeException {
    private final int code;
    private final String codeName;
    private final Map<String, Object> details;

    protected UpdateException(
            final int code, final String codeName, final String message, final Map<String, ?> details) {
        super(requireText(message, "message"));
        this.code = code;
        this.codeName = requireText(codeName, "codeName");
        final Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) {
            for (final Map.Entry<String, ?> entry : details.entrySet()) {
                if (entry.getValue() != null) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        this.details = Collections.unmodifiableMap(copy);
    }

    public int code() {
        return code;
    }

    public String codeName() {
        return codeName;
    }

    public Map<String, Object> details() {
        return details;
    }

    static Map<String, Object> detail(final String key, final Object value) {
        final Map<String, Object> details = new LinkedHashMap<>();
        details.put(key, value);
        return details;
    }

    private static String requireText(final String value, final String fieldName) {
        final String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }
}
