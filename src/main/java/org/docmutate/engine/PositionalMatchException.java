package org.docmutate.engine;

/**
 * Thrown when a path uses the positional {@code $} part but no matched array index was supplied.
 */
public final class PositionalMatchException extends UpdateApplyException {
    private static final int CODE_BAD_VALUE = 2;

    private final String path;

    public PositionalMatchException(final String path) {
        super(CODE_BAD_VALUE,
                "BadValue",
                "the positional operator did not find the match needed from the query for '" + path + "'",
                detail("path", path));
        this.path = path;
    }

    public String path() {
        return path;
    }
}
