package org.docmutate.engine;

import java.util.Map;

/**
 * Thrown when an operator body or a per-path operand has the wrong type, e.g. an array where a document
 * of target paths is required, or a non-numeric {@code $inc} value.
 */
public final class OperandShapeException extends UpdateParseException {
    private final String operator;
    private final String path;

    public OperandShapeException(final String operator, final String path, final String message) {
        super(message, details(operator, path));
        this.operator = operator;
        this.path = path;
    }

    public String operator() {
        return operator;
    }

    /**
     * Target path of the rejected operand, or {@code null} when the whole operator body was rejected.
     */
    public String path() {
        return path;
    }

    private static Map<String, Object> details(final String operator, final String path) {
        final Map<String, Object> details = detail("operator", operator);
        details.put("path", path);
        return details;
    }
}
