package com.chih.JPrint.core.exception;

/**
 * JPrint 框架根异常
 */
public class JPrintException extends RuntimeException {
    public JPrintException(String message) {
        super(message);
    }

    public JPrintException(String message, Throwable cause) {
        super(message, cause);
    }
}
