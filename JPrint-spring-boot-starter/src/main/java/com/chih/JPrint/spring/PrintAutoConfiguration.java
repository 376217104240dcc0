package com.chih.JPrint.spring;

import com.chih.JPrint.core.engine.ConsolePrinter;
import com.chih.JPrint.core.engine.PrintMapperFactory;
import com.chih.JPrint.core.format.FormatterRegistry;
import com.chih.JPrint.core.impl.MapValueResolver;
import com.chih.JPrint.core.impl.NoOpRenderMetrics;
import com.chih.JPrint.core.impl.PrintStreamOutputSink;
import com.chih.JPrint.core.spi.OutputSink;
import com.chih.JPrint.core.spi.RenderMetrics;
import com.chih.JPrint.core.spi.ValueResolverFactory;
import com.chih.JPrint.spring.el.SpelValueResolverFactory;
import com.chih.JPrint.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JPrint Spring Boot 自动配置类。
 * <p>
 * 所有组件都带 {@code @ConditionalOnMissingBean}，用户声明同类型 Bean 即可覆盖默认实现。
 * </p>
 *
 * <h3>默认组件：</h3>
 * <ul>
 *   <li><strong>OutputSink</strong>：按 {@code j-print.target} 写入 System.out 或 System.err</li>
 *   <li><strong>FormatterRegistry</strong>：内置 a / c / j / m / d / t 格式</li>
 *   <li><strong>ValueResolverFactory</strong>：默认 SpEL，{@code j-print.expression-language=false} 时只解析变量路径</li>
 *   <li><strong>RenderMetrics</strong>：存在 MeterRegistry 时使用 Micrometer，否则为空实现</li>
 *   <li><strong>ConsolePrinter</strong> / <strong>PrintMapperFactory</strong></li>
 * </ul>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * # application.yml
 * j-print:
 *   ansi-enabled: false
 *   target: stderr
 *
 * // 自定义格式（可选）
 * @Bean
 * public FormatterRegistry formatterRegistry() {
 *     return FormatterRegistry.withDefaults().register("money", new MoneyFormatter());
 * }
 * }</pre>
 *
 * @since 2026/10/19
 * @see JPrintProperties
 * @see ConsolePrinter
 */
@AutoConfiguration
@EnableConfigurationProperties(JPrintProperties.class)
public class PrintAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(OutputSink.class)
    public OutputSink outputSink(JPrintProperties properties) {
        return properties.getTarget() == JPrintProperties.Target.STDERR
                ? new PrintStreamOutputSink(System.err)
                : new PrintStreamOutputSink(System.out);
    }

    @Bean
    @ConditionalOnMissingBean(FormatterRegistry.class)
    public FormatterRegistry formatterRegistry() {
        return FormatterRegistry.withDefaults();
    }

    @Bean
    @ConditionalOnMissingBean(ValueResolverFactory.class)
    public ValueResolverFactory valueResolverFactory(JPrintProperties properties) {
        if (properties.isExpressionLanguage()) {
            return new SpelValueResolverFactory();
        }
        return MapValueResolver::new;
    }

    /**
     * Micrometer 在类路径中且存在 MeterRegistry Bean 时启用指标
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(RenderMetrics.class)
        public RenderMetrics renderMetrics(MeterRegistry registry) {
            return new MicrometerRenderMetrics(registry);
        }
    }

    // 保底配置：没有 Metrics 环境时注入空实现
    @Bean
    @ConditionalOnMissingBean(RenderMetrics.class)
    public RenderMetrics defaultRenderMetrics() {
        return new NoOpRenderMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(ConsolePrinter.class)
    public ConsolePrinter consolePrinter(OutputSink sink,
            FormatterRegistry formatters,
            ValueResolverFactory resolverFactory,
            RenderMetrics metrics,
            JPrintProperties properties) {
        return new ConsolePrinter(sink, formatters, resolverFactory, metrics, properties.isAnsiEnabled());
    }

    @Bean
    @ConditionalOnMissingBean(PrintMapperFactory.class)
    public PrintMapperFactory printMapperFactory(ConsolePrinter printer) {
        return new PrintMapperFactory(printer);
    }
}
