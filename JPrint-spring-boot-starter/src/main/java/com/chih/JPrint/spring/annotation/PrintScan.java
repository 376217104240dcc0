package com.chih.JPrint.spring.annotation;

import com.chih.JPrint.spring.scan.PrintMapperScannerRegistrar;
import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 启用 PrintMapper 自动扫描
 * <p>
 * 用法: @PrintScan("com.example.console")，不指定包时扫描被标注类所在的包
 * </p>
 *
 * @since 2026/10/19
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
@Import(PrintMapperScannerRegistrar.class)
public @interface PrintScan {

    /**
     * 扫描包路径，别名 value
     */
    String[] value() default {};

    /**
     * 扫描包路径
     */
    String[] basePackages() default {};
}
