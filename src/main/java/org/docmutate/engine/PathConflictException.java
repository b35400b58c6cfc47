package org.docmutate.engine;

import java.util.Map;

/**
 * Thrown when a target path cannot be traversed: it goes through a scalar, or uses a non-numeric part
 * against an array.
 */
public final class PathConflictException extends UpdateApplyException {
    private static final int CODE_PATH_NOT_VIABLE = 28;

    private final String path;
    private final String part;

    public PathConflictException(final String path, final String part, final String message) {
        super(CODE_PATH_NOT_VIABLE, "PathNotViable", message, details(path, part));
        this.path = path;
        this.part = part;
    }

    public String path() {
        return path;
    }

    public String part() {
        return part;
    }

    private static Map<String, Object> details(final String path, final String part) {
        final Map<String, Object> details = detail("path", path);
        details.put("part", part);
        return details;
    }
}
