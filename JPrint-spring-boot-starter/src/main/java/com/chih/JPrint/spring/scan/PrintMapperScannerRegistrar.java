package com.chih.JPrint.spring.scan;

import com.chih.JPrint.spring.annotation.PrintScan;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.context.annotation.ImportBeanDefinitionRegistrar;
import org.springframework.core.annotation.AnnotationAttributes;
import org.springframework.core.type.AnnotationMetadata;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 处理 {@link PrintScan}：收集包路径并执行接口扫描
 */
public class PrintMapperScannerRegistrar implements ImportBeanDefinitionRegistrar {

    @Override
    public void registerBeanDefinitions(AnnotationMetadata importingClassMetadata, BeanDefinitionRegistry registry) {
        AnnotationAttributes annoAttrs = AnnotationAttributes.fromMap(
                importingClassMetadata.getAnnotationAttributes(PrintScan.class.getName()));

        if (annoAttrs == null) return;

        ClassPathPrintMapperScanner scanner = new ClassPathPrintMapperScanner(registry);
        scanner.registerFilters();

        List<String> basePackages = new ArrayList<>();
        for (String pkg : annoAttrs.getStringArray("value")) {
            if (StringUtils.hasText(pkg)) basePackages.add(pkg);
        }
        for (String pkg : annoAttrs.getStringArray("basePackages")) {
            if (StringUtils.hasText(pkg)) basePackages.add(pkg);
        }

        // 没填包名时扫描被标注类所在的包
        if (basePackages.isEmpty()) {
            basePackages.add(ClassUtils.getPackageName(importingClassMetadata.getClassName()));
        }

        scanner.doScan(basePackages.toArray(new String[0]));
    }
}
