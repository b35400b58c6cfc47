package org.docmutate.engine;

/**
 * Thrown for malformed field paths: blank paths, empty parts, misplaced positional parts or
 * unsupported {@code $}-prefixed parts.
 */
public final class InvalidPathException extends UpdateParseException {
    private final String path;

    public InvalidPathException(final String path, final String message) {
        super(message + (path == null ? "" : " (path '" + path + "')"), detail("path", path));
        this.path = path;
    }

    public String path() {
        return path;
    }
}
