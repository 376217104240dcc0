package com.chih.JPrint.core.domain;

/**
 * 原样输出的模板片段
 */
public record Text(String content) implements Token {
    public Text {
        if (content == null) {
            throw new IllegalArgumentException("Text content cannot be null");
        }
    }
}
