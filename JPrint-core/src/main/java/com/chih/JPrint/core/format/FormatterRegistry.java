package com.chih.JPrint.core.format;

import com.chih.JPrint.core.spi.ValueFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 格式器注册表
 * <p>
 * 以格式说明符（不含参数部分）为键；未注册的说明符（包括无说明符）交给默认格式器处理。
 * </p>
 *
 * <h3>内置格式</h3>
 * <ul>
 *   <li>{@code a} - {@link ArrayFormatter}</li>
 *   <li>{@code c} - {@link CompactFormatter}</li>
 *   <li>{@code j} - {@link PrettyFormatter}</li>
 *   <li>{@code m} - {@link MatrixFormatter}</li>
 *   <li>{@code d} - {@link DeterminantFormatter}</li>
 *   <li>{@code t} - {@link TableFormatter}</li>
 * </ul>
 *
 * @since 2026/10/19
 */
public class FormatterRegistry {

    private static final Logger log = LoggerFactory.getLogger(FormatterRegistry.class);

    private final Map<String, ValueFormatter> formatters = new ConcurrentHashMap<>();
    private final ValueFormatter fallback;

    public FormatterRegistry() {
        this(new PrimitiveFormatter());
    }

    public FormatterRegistry(ValueFormatter fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback formatter must not be null");
    }

    /**
     * 注册全部内置格式的注册表
     */
    public static FormatterRegistry withDefaults() {
        return new FormatterRegistry()
                .register("a", new ArrayFormatter())
                .register("c", new CompactFormatter())
                .register("j", new PrettyFormatter())
                .register("m", new MatrixFormatter())
                .register("d", new DeterminantFormatter())
                .register("t", new TableFormatter());
    }

    /**
     * 注册（或覆盖）命名格式
     */
    public FormatterRegistry register(String spec, ValueFormatter formatter) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(formatter, "formatter must not be null");
        ValueFormatter previous = formatters.put(spec, formatter);
        if (previous != null) {
            log.debug("Formatter '{}' replaced: {} -> {}", spec,
                    previous.getClass().getSimpleName(), formatter.getClass().getSimpleName());
        }
        return this;
    }

    /**
     * 查找说明符对应的格式器，未注册时返回默认格式器
     */
    public ValueFormatter lookup(String spec) {
        if (spec == null) {
            return fallback;
        }
        return formatters.getOrDefault(spec, fallback);
    }

    public boolean isRegistered(String spec) {
        return spec != null && formatters.containsKey(spec);
    }
}
