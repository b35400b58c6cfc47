package org.docmutate.engine;

import java.util.Map;

/**
 * Failure while applying a parsed update to one target document. It aborts that document only.
 */
public abstract class UpdateApplyException extends UpdateException {
    protected UpdateApplyException(
            final int code, final String codeName, final String message, final Map<String, ?> details) {
        super(code, codeName, message, details);
    }
}
