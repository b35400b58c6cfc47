package org.docmutate.engine;

import java.util.Map;

/**
 * Thrown when two operations of one specification target the same path, or one path is a prefix of another.
 */
public final class ConflictingPathsException extends UpdateParseException {
    private static final int CODE_CONFLICTING_UPDATE_OPERATORS = 40;

    private final String path;
    private final String conflictingPath;

    public ConflictingPathsException(final String path, final String conflictingPath) {
        super(CODE_CONFLICTING_UPDATE_OPERATORS,
                "ConflictingUpdateOperators",
                "Updating the path '" + conflictingPath + "' would create a conflict at '" + path + "'",
                details(path, conflictingPath));
        this.path = path;
        this.conflictingPath = conflictingPath;
    }

    public String path() {
        return path;
    }

    public String conflictingPath() {
        return conflictingPath;
    }

    private static Map<String, Object> details(final String path, final String conflictingPath) {
        final Map<String, Object> details = detail("path", path);
        details.put("conflictingPath", conflictingPath);
        return details;
    }
}
