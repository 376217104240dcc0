package com.chih.JPrint.core.domain;

/**
 * 模板词法单元
 * <p>
 * 模板由两类标记组成：样式标记 {@code @( ... )} 与变量标记 {@code { ... }}，
 * 标记之间的原样文本即 {@link Text}。所有 Token 一经产生即不可变。
 * </p>
 *
 * @since 2026/10/19
 */
public sealed interface Token permits StyleChange, StyleReset, StyleVariable, Text, Variable {
}
