package com.chih.JPrint.core.annotation;
import java.lang.annotation.*;

/**
 * 标记在方法上，声明该方法输出（或返回）的模板
 *
 * @since 2026/10/19
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Print {
    /**
     * 模板字符串，例如 {@code "@(green)✔@() {name} done$( )"}
     */
    String value();
}
