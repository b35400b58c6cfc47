package org.docmutate.engine;

public final class IdentityFieldImmutableException extends UpdateApplyException {
    static final int CODE_IMMUTABLE_FIELD = 66;

    private final String field;

    public IdentityFieldImmutableException(final String field) {
        super(CODE_IMMUTABLE_FIELD,
                "ImmutableField",
                "the update would alter the immutable field '" + field + "'",
                detail("field", field));
        this.field = field;
    }

    public String field() {
        return field;
    }
}
