package com.chih.JPrint.core.domain;

import java.util.List;

/**
 * 变量占位符 {@code {expr}}、{@code {expr:format}} 或 {@code {expr:format(arg, ...)}}
 *
 * @param expr       变量名或表达式，原样保留
 * @param format     格式说明符，可为 null
 * @param formatArgs 格式参数（如表格表头），未给出括号时为 null
 */
public record Variable(String expr, String format, List<String> formatArgs) implements Token {
    public Variable {
        if (expr == null || expr.isEmpty()) {
            throw new IllegalArgumentException("Variable expression cannot be null or empty");
        }
        if (formatArgs != null) {
            formatArgs = List.copyOf(formatArgs);
        }
    }

    public static Variable of(String expr) {
        return new Variable(expr, null, null);
    }

    public static Variable of(String expr, String format) {
        return new Variable(expr, format, null);
    }
}
