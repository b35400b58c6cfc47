package org.docmutate.engine;

public final class UnknownOperatorException extends UpdateParseException {
    private final String operator;

    public UnknownOperatorException(final String operator) {
        super("unknown modifier: " + operator, detail("operator", operator));
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }
}
