package com.chih.JPrint.core.annotation;
import java.lang.annotation.*;

/**
 * 标记在方法参数上，用于指定模板变量的名称
 *
 * @since 2026/10/19
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface Param {
    /**
     * 对应模板 {name} 中的变量名
     */
    String value();
}
