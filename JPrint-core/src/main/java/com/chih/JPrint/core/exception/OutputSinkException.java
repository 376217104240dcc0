package com.chih.JPrint.core.exception;

/**
 * 输出端写入失败，唯一会中断渲染的错误
 */
public class OutputSinkException extends JPrintException {
    public OutputSinkException(String message) {
        super(message);
    }

    public OutputSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
