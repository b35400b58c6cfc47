package org.docmutate.obs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields that tie log events to one driver and one phase of its work: request id, operation and, when known,
 * the namespace being updated.
 */
public final class CorrelationContext {
    private final Map<String, Object> fields;

    private CorrelationContext(Builder builder) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("requestId", requireText(builder.requestId, "requestId"));
        values.put("operation", requireText(builder.operation, "operation"));
        String namespace = trimToNull(builder.namespace);
        if (namespace != null) {
            values.put("namespace", namespace);
        }
        this.fields = Collections.unmodifiableMap(values);
    }

    public static Builder builder(String requestId, String operation) {
        return new Builder(requestId, operation);
    }

    /**
     * Correlation fields in emission order; {@code namespace} is absent when it was not set.
     */
    public Map<String, Object> asFields() {
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public static final class Builder {
        private final String requestId;
        private final String operation;
        private String namespace;

        private Builder(String requestId, String operation) {
            this.requestId = requestId;
            this.operation = operation;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
