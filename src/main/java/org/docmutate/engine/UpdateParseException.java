package org.docmutate.engine;

import java.util.Map;

/**
 * Update specification rejected at parse time. A driver whose last parse failed must not be used to update.
 */
public abstract class UpdateParseException extends UpdateException {
    static final int CODE_FAILED_TO_PARSE = 9;
    static final String FAILED_TO_PARSE = "FailedToParse";

    protected UpdateParseException(
            final int code, final String codeName, final String message, final Map<String, ?> details) {
        super(code, codeName, message, details);
    }

    protected UpdateParseException(final String message, final Map<String, ?> details) {
        this(CODE_FAILED_TO_PARSE, FAILED_TO_PARSE, message, details);
    }
}
