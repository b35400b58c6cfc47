package org.docmutate.engine;

/**
 * Thrown when a specification mixes {@code $}-prefixed operator keys with plain replacement fields.
 */
public final class MixedModeException extends UpdateParseException {
    private final String field;

    public MixedModeException(final String field) {
        super("update must either be an operator document or a replacement document, found '" + field + "'",
                detail("field", field));
        this.field = field;
    }

    public String field() {
        return field;
    }
}
