package com.chih.JPrint.core.impl;

import com.chih.JPrint.core.exception.OutputSinkException;
import com.chih.JPrint.core.spi.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * 基于 {@link PrintStream} 的输出端（默认 System.out）
 * <p>
 * PrintStream 自身会吞掉 IOException，这里在每次 flush 之后检查错误标志，
 * 发现写入失败即抛出 {@link OutputSinkException}。
 * </p>
 *
 * @since 2026/10/19
 */
public class PrintStreamOutputSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(PrintStreamOutputSink.class);

    private final PrintStream stream;

    public PrintStreamOutputSink() {
        this(System.out);
    }

    public PrintStreamOutputSink(PrintStream stream) {
        if (stream == null) {
            throw new IllegalArgumentException("Output stream cannot be null");
        }
        this.stream = stream;
    }

    @Override
    public void write(String text, boolean newline) {
        if (newline) {
            stream.println(text);
        } else {
            stream.print(text);
        }
        stream.flush();
        if (stream.checkError()) {
            log.error("Failed to write {} chars to output stream", text.length());
            throw new OutputSinkException("Failed to write to output stream");
        }
    }
}
