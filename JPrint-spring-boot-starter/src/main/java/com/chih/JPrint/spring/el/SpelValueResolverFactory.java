package com.chih.JPrint.spring.el;

import com.chih.JPrint.core.spi.ValueResolver;
import com.chih.JPrint.core.spi.ValueResolverFactory;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;

import java.util.Map;

/**
 * 为每次调用创建 {@link SpelValueResolver}，表达式解析器在调用之间共享（线程安全）
 *
 * @since 2026/10/19
 */
public class SpelValueResolverFactory implements ValueResolverFactory {

    private final ExpressionParser parser;

    public SpelValueResolverFactory() {
        this(new SpelExpressionParser());
    }

    public SpelValueResolverFactory(ExpressionParser parser) {
        this.parser = parser;
    }

    @Override
    public ValueResolver create(Map<String, ?> variables) {
        return new SpelValueResolver(parser, variables);
    }
}
