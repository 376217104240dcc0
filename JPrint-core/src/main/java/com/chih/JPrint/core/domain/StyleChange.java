package com.chih.JPrint.core.domain;

import java.util.List;

/**
 * 字面样式切换，例如 {@code @(red, bold)}
 *
 * @param specs 按书写顺序保留的样式名（包含未识别的名称，由样式引擎丢弃）
 */
public record StyleChange(List<String> specs) implements Token {
    public StyleChange {
        if (specs == null) {
            throw new IllegalArgumentException("Style specs cannot be null");
        }
        specs = List.copyOf(specs);
    }

    public static StyleChange of(String... specs) {
        return new StyleChange(List.of(specs));
    }
}
