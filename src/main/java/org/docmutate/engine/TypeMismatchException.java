package org.docmutate.engine;

import java.util.Map;

public final class TypeMismatchException extends UpdateApplyException {
    private static final int CODE_TYPE_MISMATCH = 14;

    private final String operator;
    private final String path;

    public TypeMismatchException(final String operator, final String path, final String message) {
        super(CODE_TYPE_MISMATCH, "TypeMismatch", message, details(operator, path));
        this.operator = operator;
        this.path = path;
    }

    public String operator() {
        return operator;
    }

    public String path() {
        return path;
    }

    private static Map<String, Object> details(final String operator, final String path) {
        final Map<String, Object> details = detail("operator", operator);
        details.put("path", path);
        return details;
    }
}
