package com.chih.JPrint.spring.metrics;

import com.chih.JPrint.core.spi.RenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jprint.render.timer: 模板渲染耗时，tags: source={inline|Interface#method}, result={success|failure}</li>
 *   <li>jprint.render.count: 模板渲染次数计数器，tags 同上</li>
 * </ul>
 * </p>
 * <p>
 * source 的取值只有 {@code inline} 与映射器方法名两类，基数是有限的。
 * </p>
 */
public class MicrometerRenderMetrics implements RenderMetrics {

    private final MeterRegistry registry;

    public MicrometerRenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String source, long durationNs, boolean success) {
        String result = success ? "success" : "failure";

        Timer.builder("jprint.render.timer")
                .description("Timer for console template rendering")
                .tag("source", source)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder("jprint.render.count")
                .description("Counter for console template rendering")
                .tag("source", source)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
