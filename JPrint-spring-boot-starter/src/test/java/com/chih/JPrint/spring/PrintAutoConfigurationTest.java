package com.chih.JPrint.spring;

import com.chih.JPrint.core.engine.ConsolePrinter;
import com.chih.JPrint.core.engine.PrintMapperFactory;
import com.chih.JPrint.core.format.FormatterRegistry;
import com.chih.JPrint.core.impl.NoOpRenderMetrics;
import com.chih.JPrint.core.impl.PrintStreamOutputSink;
import com.chih.JPrint.core.spi.OutputSink;
import com.chih.JPrint.core.spi.RenderMetrics;
import com.chih.JPrint.core.spi.ValueResolverFactory;
import com.chih.JPrint.spring.el.SpelValueResolverFactory;
import com.chih.JPrint.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * PrintAutoConfiguration 单元测试
 */
@DisplayName("PrintAutoConfiguration 测试")
class PrintAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PrintAutoConfiguration.class));

    @Test
    @DisplayName("JPrintProperties 默认配置应该正确")
    void testPropertiesDefaults() {
        JPrintProperties properties = new JPrintProperties();

        assertThat(properties.isAnsiEnabled()).isTrue();
        assertThat(properties.getTarget()).isEqualTo(JPrintProperties.Target.STDOUT);
        assertThat(properties.isExpressionLanguage()).isTrue();
    }

    @Test
    @DisplayName("默认装配全部组件")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ConsolePrinter.class);
            assertThat(context).hasSingleBean(PrintMapperFactory.class);
            assertThat(context).hasSingleBean(FormatterRegistry.class);
            assertThat(context.getBean(OutputSink.class)).isInstanceOf(PrintStreamOutputSink.class);
            assertThat(context.getBean(ValueResolverFactory.class)).isInstanceOf(SpelValueResolverFactory.class);
            assertThat(context.getBean(RenderMetrics.class)).isInstanceOf(NoOpRenderMetrics.class);
        });
    }

    @Test
    @DisplayName("属性绑定：关闭表达式语言与 ANSI")
    void testPropertyBinding() {
        contextRunner
                .withPropertyValues("j-print.expression-language=false", "j-print.ansi-enabled=false",
                        "j-print.target=stderr")
                .run(context -> {
                    JPrintProperties properties = context.getBean(JPrintProperties.class);
                    assertThat(properties.getTarget()).isEqualTo(JPrintProperties.Target.STDERR);
                    assertThat(properties.isAnsiEnabled()).isFalse();
                    assertThat(context.getBean(ValueResolverFactory.class))
                            .isNotInstanceOf(SpelValueResolverFactory.class);
                });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时使用 Micrometer 指标")
    void testMicrometerMetrics() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context.getBean(RenderMetrics.class))
                        .isInstanceOf(MicrometerRenderMetrics.class));
    }

    @Test
    @DisplayName("用户自定义输出端覆盖默认实现，并贯穿到 ConsolePrinter")
    void testUserSinkOverride() {
        List<String> written = new ArrayList<>();
        contextRunner
                .withPropertyValues("j-print.ansi-enabled=false")
                .withBean(OutputSink.class, () -> (text, newline) -> written.add(text))
                .run(context -> {
                    context.getBean(ConsolePrinter.class).println("@(red){a * b}", Map.of("a", 6, "b", 7));
                    assertThat(written).containsExactly("42");
                });
    }
}
