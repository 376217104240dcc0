package com.chih.JPrint.spring.el;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.exception.UnresolvedVariableException;
import com.chih.JPrint.core.spi.ValueResolver;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 基于 Spring Expression Language 的解析器
 * <p>
 * 变量表作为根对象，变量名可以直接引用；因此算术、方法调用、嵌套访问都可以写在模板里：
 * {@code {age * 12}}、{@code {name.toUpperCase()}}、{@code {scores['math']}}。
 * 引用不存在的变量、表达式语法错误、求值失败都会转换为 {@link UnresolvedVariableException}。
 * </p>
 *
 * @since 2026/10/19
 */
public class SpelValueResolver implements ValueResolver {

    private final ExpressionParser parser;
    private final Map<String, Object> variables;
    private final EvaluationContext context;

    public SpelValueResolver(ExpressionParser parser, Map<String, ?> variables) {
        this.parser = parser;
        this.variables = variables == null ? Collections.emptyMap() : new HashMap<>(variables);

        StandardEvaluationContext evaluationContext = new StandardEvaluationContext(this.variables);
        evaluationContext.addPropertyAccessor(new StrictMapAccessor());
        this.context = evaluationContext;
    }

    @Override
    public ResolvedValue resolve(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new UnresolvedVariableException(String.valueOf(expression));
        }
        try {
            Expression parsed = parser.parseExpression(expression.trim());
            return ResolvedValue.of(parsed.getValue(context));
        } catch (ParseException | EvaluationException e) {
            throw new UnresolvedVariableException(expression, e);
        }
    }

    /**
     * 只对变量表中存在的键生效，未定义的变量交给 SpEL 报错，而不是得到 null
     */
    private static final class StrictMapAccessor extends MapAccessor {

        @Override
        public boolean canRead(EvaluationContext context, Object target, String name) {
            return target instanceof Map<?, ?> map && map.containsKey(name);
        }
    }
}
