package com.chih.JPrint.core.engine;

import com.chih.JPrint.core.domain.SeparatorDirective;
import com.chih.JPrint.core.exception.UnresolvedVariableException;
import com.chih.JPrint.core.format.FormatterRegistry;
import com.chih.JPrint.core.impl.MapValueResolver;
import com.chih.JPrint.core.spi.OutputSink;
import com.chih.JPrint.core.spi.RenderMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * ConsolePrinter 单元测试
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ConsolePrinter 测试")
class ConsolePrinterTest {

    private static final String RESET = "\u001B[0m";

    /**
     * 把写出内容按终端看到的样子拼起来
     */
    static class CapturingSink implements OutputSink {
        final StringBuilder screen = new StringBuilder();

        @Override
        public void write(String text, boolean newline) {
            screen.append(text);
            if (newline) {
                screen.append('\n');
            }
        }

        String plain() {
            return screen.toString().replaceAll("\u001B\\[[0-9;]*m", "");
        }
    }

    @Mock
    RenderMetrics metrics;

    private CapturingSink sink;
    private ConsolePrinter printer;

    @BeforeEach
    void setUp() {
        sink = new CapturingSink();
        printer = new ConsolePrinter(sink, FormatterRegistry.withDefaults(), MapValueResolver::new, metrics, true);
    }

    @Test
    @DisplayName("普通模板：输出后换行，末尾带重置码")
    void testPrintln() {
        printer.println("@(green)Hello@() {name}!", Map.of("name", "JPrint"));

        assertThat(sink.screen.toString())
                .isEqualTo(RESET + "\u001B[32mHello" + RESET + " JPrint!" + RESET + "\n");
    }

    @Test
    @DisplayName("分隔符指令：十次调用拼成同一行")
    void testSeparatorProgressiveLine() {
        for (int i = 1; i < 10; i++) {
            printer.println("{i}$( - )", Map.of("i", i));
        }
        printer.println("10");

        assertThat(sink.plain()).isEqualTo("1 - 2 - 3 - 4 - 5 - 6 - 7 - 8 - 9 - 10\n");
    }

    @Test
    @DisplayName("分隔符写出顺序：主体在前，分隔内容在后，均不换行")
    void testSeparatorWriteOrder() {
        OutputSink mockSink = mock(OutputSink.class);
        ConsolePrinter mocked = new ConsolePrinter(mockSink);

        mocked.println("{x}$(sep)", Map.of("x", 1, "sep", ", "));
        mocked.println("end");

        InOrder order = inOrder(mockSink);
        order.verify(mockSink).write("1" + RESET, false);
        order.verify(mockSink).write(", ", false);
        order.verify(mockSink).write("end" + RESET, true);
        order.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("空字符串分隔符只抑制换行")
    void testEmptyLiteralSeparator() {
        OutputSink mockSink = mock(OutputSink.class);
        ConsolePrinter mocked = new ConsolePrinter(mockSink);

        mocked.println("Name: $(\"\")");
        mocked.println("Age: $()");

        verify(mockSink).write("Name: " + RESET, false);
        verify(mockSink).write("Age: " + RESET, false);
        verifyNoMoreInteractions(mockSink);
    }

    @Test
    @DisplayName("分隔符内容不是标识符时按字面量输出")
    void testLiteralSeparator() {
        printer.println("a$(, )");
        printer.println("b$( | )");
        printer.println("c");

        assertThat(sink.plain()).isEqualTo("a, b | c\n");
    }

    @Test
    @DisplayName("分隔符指令后面还有换行时不算末尾指令，按普通文本输出")
    void testSeparatorFollowedByNewlineStaysText() {
        assertThat(SeparatorDirective.extract("line$( - )\n").present()).isFalse();

        printer.println("line$( - )\n");

        assertThat(sink.plain()).isEqualTo("line$( - )\n\n");
    }

    @Test
    @DisplayName("render 只返回文本，不写出")
    void testRender() {
        String out = printer.render("@(bold){v:04d}$(x)", Map.of("v", 7));

        assertThat(out).isEqualTo(RESET + "\u001B[1m0007" + RESET);
        assertThat(sink.screen).isEmpty();
    }

    @Test
    @DisplayName("关闭 ANSI 后去除所有样式码")
    void testAnsiDisabled() {
        ConsolePrinter plain = new ConsolePrinter(sink, null, null, null, false);

        plain.println("@(red, bold)Alert@() {n:m}", Map.of("n", java.util.List.of(java.util.List.of(1))));

        assertThat(sink.screen.toString()).isEqualTo("Alert ⦅  1  ⦆\n\n").doesNotContain("\u001B");
    }

    @Test
    @DisplayName("每次调用记录一次指标，失败时标记 failure 并抛出")
    void testMetrics() {
        printer.println("ok");

        assertThatThrownBy(() -> printer.println("{missing}"))
                .isInstanceOf(UnresolvedVariableException.class);

        verify(metrics).recordRender(eq("inline"), anyLong(), eq(true));
        verify(metrics).recordRender(eq("inline"), anyLong(), eq(false));
    }
}
