package com.chih.JPrint.core.domain;

import java.util.List;
import java.util.Set;

/**
 * 词法分析结果
 *
 * @param tokens          按源位置排序的 Token 序列
 * @param usedIdentifiers 模板中引用到的裸标识符（仅供宿主消除"未使用变量"提示，对渲染无影响）
 */
public record ParsedTemplate(List<Token> tokens, Set<String> usedIdentifiers) {
    public ParsedTemplate {
        tokens = List.copyOf(tokens);
        usedIdentifiers = Set.copyOf(usedIdentifiers);
    }
}
