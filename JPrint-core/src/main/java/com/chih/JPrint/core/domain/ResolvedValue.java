package com.chih.JPrint.core.domain;

import com.chih.JPrint.core.support.DebugRepresentation;

/**
 * 变量解析结果：运行时值 + 调试文本表示
 *
 * @param value 原始值，可为 null
 * @param debug 调试表示（字符串带引号，容器使用方括号）
 */
public record ResolvedValue(Object value, String debug) {

    public static ResolvedValue of(Object value) {
        return new ResolvedValue(value, DebugRepresentation.compact(value));
    }
}
