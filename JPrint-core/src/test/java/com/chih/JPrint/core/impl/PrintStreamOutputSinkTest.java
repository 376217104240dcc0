package com.chih.JPrint.core.impl;

import com.chih.JPrint.core.exception.OutputSinkException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * PrintStreamOutputSink 单元测试
 */
@DisplayName("PrintStreamOutputSink 测试")
class PrintStreamOutputSinkTest {

    @Test
    @DisplayName("按换行标志写出")
    void testWrite() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStreamOutputSink sink = new PrintStreamOutputSink(new PrintStream(bytes, false, StandardCharsets.UTF_8));

        sink.write("a", false);
        sink.write("b", true);

        assertThat(bytes.toString(StandardCharsets.UTF_8)).isEqualTo("ab" + System.lineSeparator());
    }

    @Test
    @DisplayName("底层流写入失败时抛出 OutputSinkException")
    void testWriteFailure() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("disk full");
            }
        };
        PrintStreamOutputSink sink = new PrintStreamOutputSink(new PrintStream(broken));

        assertThatThrownBy(() -> sink.write("x", true)).isInstanceOf(OutputSinkException.class);
    }

    @Test
    @DisplayName("不接受 null 流")
    void testNullStream() {
        assertThatThrownBy(() -> new PrintStreamOutputSink(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
