package com.chih.JPrint.core.engine;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.domain.StyleChange;
import com.chih.JPrint.core.domain.StyleReset;
import com.chih.JPrint.core.domain.StyleVariable;
import com.chih.JPrint.core.domain.Text;
import com.chih.JPrint.core.domain.Token;
import com.chih.JPrint.core.domain.Variable;
import com.chih.JPrint.core.exception.TemplateRenderException;
import com.chih.JPrint.core.exception.UnresolvedVariableException;
import com.chih.JPrint.core.format.FormatterRegistry;
import com.chih.JPrint.core.impl.MapValueResolver;
import com.chih.JPrint.core.spi.OutputSink;
import com.chih.JPrint.core.spi.ValueResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * TemplateRenderer 单元测试
 */
@DisplayName("TemplateRenderer 测试")
class TemplateRendererTest {

    private static final String RESET = "\u001B[0m";

    private final TemplateRenderer renderer = new TemplateRenderer(FormatterRegistry.withDefaults());

    private String assemble(List<Token> tokens, Map<String, ?> vars) {
        return renderer.assemble(tokens, new MapValueResolver(vars));
    }

    @Test
    @DisplayName("样式切换先重置再应用，末尾无条件重置")
    void testStyleSequence() {
        String out = assemble(List.of(StyleChange.of("red", "bold"), new Text("Hi"), new StyleReset()), Map.of());

        assertThat(out).isEqualTo(RESET + "\u001B[31;1m" + "Hi" + RESET + RESET);
    }

    @Test
    @DisplayName("样式是扁平的：第二次切换替换第一次")
    void testFlatStyles() {
        String out = assemble(List.of(StyleChange.of("red"), StyleChange.of("bold"), new Text("x")), Map.of());

        assertThat(out).isEqualTo(RESET + "\u001B[31m" + RESET + "\u001B[1m" + "x" + RESET);
    }

    @Test
    @DisplayName("样式变量的值按逗号切分后交给样式引擎")
    void testStyleVariable() {
        String out = assemble(List.of(new StyleVariable("theme"), new Text("t")), Map.of("theme", "bright_red, bold"));

        assertThat(out).isEqualTo(RESET + "\u001B[91;1m" + "t" + RESET);
        assertThat(assemble(List.of(new StyleVariable("theme")), Map.of("theme", List.of("green", "underline"))))
                .isEqualTo(RESET + "\u001B[32;4m" + RESET);
    }

    @Test
    @DisplayName("变量按格式说明符分发")
    void testVariableDispatch() {
        Map<String, Object> vars = Map.of("pi", 3.14159, "m", List.of(List.of(1, 2), List.of(3, 4)), "s", "txt");

        assertThat(assemble(List.of(Variable.of("pi", ".2f")), vars)).isEqualTo("3.14" + RESET);
        assertThat(assemble(List.of(Variable.of("m", "m")), vars)).isEqualTo("⎛  1  2  ⎞\n⎝  3  4  ⎠\n" + RESET);
        assertThat(assemble(List.of(Variable.of("s", "c")), vars)).isEqualTo("\"txt\"" + RESET);
        assertThat(assemble(List.of(Variable.of("s")), vars)).isEqualTo("txt" + RESET);
    }

    @Test
    @DisplayName("写出到输出端，按 noNewline 决定换行")
    void testRenderToSink() {
        OutputSink sink = mock(OutputSink.class);
        ValueResolver resolver = new MapValueResolver(Map.of());

        renderer.render(List.of(new Text("a")), resolver, false, sink);
        renderer.render(List.of(new Text("b")), resolver, true, sink);

        verify(sink).write("a" + RESET, true);
        verify(sink).write("b" + RESET, false);
        verifyNoMoreInteractions(sink);
    }

    @Test
    @DisplayName("自定义格式器的运行时异常被包装，解析失败原样抛出")
    void testErrors() {
        FormatterRegistry registry = FormatterRegistry.withDefaults()
                .register("boom", (value, spec, args) -> {
                    throw new IllegalStateException("boom");
                });
        TemplateRenderer custom = new TemplateRenderer(registry);
        ValueResolver resolver = expression -> ResolvedValue.of(1);

        assertThatThrownBy(() -> custom.assemble(List.of(Variable.of("x", "boom")), resolver))
                .isInstanceOf(TemplateRenderException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> assemble(List.of(Variable.of("missing")), Map.of()))
                .isInstanceOf(UnresolvedVariableException.class);
    }
}
