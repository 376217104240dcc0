package com.chih.JPrint.core.exception;

public class TemplateRenderException extends JPrintException {
    public TemplateRenderException(String expression, Throwable cause) {
        super("Failed to format template variable: " + expression, cause);
    }
}
