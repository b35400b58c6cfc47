package org.docmutate.engine;

public final class EmptyOperatorException extends UpdateParseException {
    private final String operator;

    public EmptyOperatorException(final String operator) {
        super("'" + operator + "' is empty. You must specify a field like so: {" + operator
                + ": {<field>: ...}}", detail("operator", operator));
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }
}
