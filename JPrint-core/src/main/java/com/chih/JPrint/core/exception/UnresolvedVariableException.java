package com.chih.JPrint.core.exception;

public class UnresolvedVariableException extends JPrintException {
    public UnresolvedVariableException(String expression) {
        super("Cannot resolve template variable: " + expression);
    }

    public UnresolvedVariableException(String expression, Throwable cause) {
        super("Cannot resolve template variable: " + expression, cause);
    }
}
