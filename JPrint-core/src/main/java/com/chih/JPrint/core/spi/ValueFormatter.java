package com.chih.JPrint.core.spi;

import com.chih.JPrint.core.domain.ResolvedValue;

import java.util.List;

/**
 * 格式器 SPI 接口
 * <p>
 * 以格式说明符为键注册到 {@code FormatterRegistry}，新增命名格式无需改动分发逻辑。
 * 实现应当宽松：无法处理的输入返回可见的回退文本，而不是抛出异常。
 * </p>
 *
 * @since 2026/10/19
 */
@FunctionalInterface
public interface ValueFormatter {

    /**
     * @param value  解析后的值（含调试文本）
     * @param spec   格式说明符（不含参数部分），无说明符时为 null
     * @param args   格式参数，未给出时为 null
     * @return 格式化后的文本
     */
    String format(ResolvedValue value, String spec, List<String> args);
}
