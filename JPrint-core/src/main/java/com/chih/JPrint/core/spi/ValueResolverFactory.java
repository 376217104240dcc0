package com.chih.JPrint.core.spi;

import java.util.Map;

/**
 * 根据一次调用的变量表创建解析器
 * 默认实现为 {@code MapValueResolver::new}，Spring 环境下可替换为 SpEL 实现
 *
 * @since 2026/10/19
 */
@FunctionalInterface
public interface ValueResolverFactory {

    ValueResolver create(Map<String, ?> variables);
}
