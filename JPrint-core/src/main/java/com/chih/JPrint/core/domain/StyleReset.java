package com.chih.JPrint.core.domain;

/**
 * 样式重置 {@code @()}
 */
public record StyleReset() implements Token {
}
