package com.chih.JPrint.spring.scan;

import com.chih.JPrint.core.annotation.PrintMapper;
import org.springframework.beans.factory.annotation.AnnotatedBeanDefinition;
import org.springframework.beans.factory.config.BeanDefinitionHolder;
import org.springframework.beans.factory.support.AbstractBeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.GenericBeanDefinition;
import org.springframework.context.annotation.ClassPathBeanDefinitionScanner;
import org.springframework.core.type.filter.AnnotationTypeFilter;

import java.util.Arrays;
import java.util.Set;

/**
 * 扫描 {@link PrintMapper} 接口，并把 Bean 定义替换为 {@link PrintFactoryBean}
 */
public class ClassPathPrintMapperScanner extends ClassPathBeanDefinitionScanner {

    public ClassPathPrintMapperScanner(BeanDefinitionRegistry registry) {
        super(registry, false); // false = 不使用默认过滤器
    }

    public void registerFilters() {
        addIncludeFilter(new AnnotationTypeFilter(PrintMapper.class));
    }

    /**
     * 只接受顶层接口（默认实现只接受具体类）
     */
    @Override
    protected boolean isCandidateComponent(AnnotatedBeanDefinition beanDefinition) {
        return beanDefinition.getMetadata().isInterface()
                && beanDefinition.getMetadata().isIndependent();
    }

    @Override
    protected Set<BeanDefinitionHolder> doScan(String... basePackages) {
        Set<BeanDefinitionHolder> beanDefinitions = super.doScan(basePackages);

        if (beanDefinitions.isEmpty()) {
            logger.warn("No PrintMapper was found in '" + Arrays.toString(basePackages)
                    + "'. Please check your configuration.");
        }

        for (BeanDefinitionHolder holder : beanDefinitions) {
            GenericBeanDefinition definition = (GenericBeanDefinition) holder.getBeanDefinition();
            String beanClassName = definition.getBeanClassName();

            // 构造参数是接口类型，真实 Bean 类换成 FactoryBean
            definition.getConstructorArgumentValues().addGenericArgumentValue(beanClassName);
            definition.setBeanClass(PrintFactoryBean.class);
            // 按类型注入 PrintMapperFactory
            definition.setAutowireMode(AbstractBeanDefinition.AUTOWIRE_BY_TYPE);
        }

        return beanDefinitions;
    }
}
