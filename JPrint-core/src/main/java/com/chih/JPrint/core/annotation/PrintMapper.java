package com.chih.JPrint.core.annotation;

import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个接口为打印映射器接口。
 * <p>
 * 被标记的接口会被 Spring 容器扫描，并自动生成基于动态代理的实现类；
 * 不使用 Spring 时也可以直接交给 {@code PrintMapperFactory} 创建。
 * </p>
 *
 * <h3>方法约定：</h3>
 * <ul>
 *   <li>{@code void} 方法：渲染并输出到控制台</li>
 *   <li>{@code String} 方法：只渲染，返回带样式码的文本</li>
 *   <li>方法参数即模板变量，名称取 {@link Param}，没有时取编译保留的参数名</li>
 * </ul>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * @PrintMapper
 * public interface ReportPrinter {
 *
 *     @Print("@(bright_cyan, bold)Report@() for {user}")
 *     void title(@Param("user") String user);
 *
 *     @Print("{rows:t(Name, Score)}")
 *     void scores(@Param("rows") Map<String, Integer> rows);
 *
 *     @Print("{value:.2f}")
 *     String money(@Param("value") double value);
 * }
 * }</pre>
 *
 * @since 2026/10/19
 * @see Print
 * @see Param
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface PrintMapper {
}
