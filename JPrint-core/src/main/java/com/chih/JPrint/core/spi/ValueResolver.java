package com.chih.JPrint.core.spi;

import com.chih.JPrint.core.domain.ResolvedValue;

/**
 * 变量解析 SPI 接口
 * <p>
 * 给定变量名或表达式，返回其当前运行时值及调试文本表示。
 * 模板中的 {@code {expr}}、样式变量 {@code @(name)} 以及分隔符变量 {@code $(name)} 都经由此接口取值。
 * </p>
 *
 * @since 2026/10/19
 */
@FunctionalInterface
public interface ValueResolver {

    /**
     * 解析表达式
     *
     * @param expression 变量名或表达式（原样传入，未 trim）
     * @return 解析结果
     * @throws com.chih.JPrint.core.exception.UnresolvedVariableException 无法解析时
     */
    ResolvedValue resolve(String expression);
}
