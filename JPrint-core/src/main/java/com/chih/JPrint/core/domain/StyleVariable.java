package com.chih.JPrint.core.domain;

/**
 * 样式变量：运行时值为逗号分隔的样式列表字符串
 * <p>
 * 来源有两种：{@code @(colorStyle)} 与插值写法 {@code @({colorStyle})}。
 * </p>
 *
 * @param name 变量名（或表达式）
 */
public record StyleVariable(String name) implements Token {
    public StyleVariable {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Style variable name cannot be null or empty");
        }
    }
}
