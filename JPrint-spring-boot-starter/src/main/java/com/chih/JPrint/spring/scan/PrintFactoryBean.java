package com.chih.JPrint.spring.scan;

import com.chih.JPrint.core.engine.PrintMapperFactory;
import org.springframework.beans.factory.FactoryBean;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Spring FactoryBean，用于创建 PrintMapper 的代理实例
 *
 * @param <T> 接口类型
 */
public class PrintFactoryBean<T> implements FactoryBean<T> {

    private Class<T> mapperInterface;

    @Autowired
    private PrintMapperFactory printMapperFactory;

    public PrintFactoryBean() {
    }

    public PrintFactoryBean(Class<T> mapperInterface) {
        this.mapperInterface = mapperInterface;
    }

    @Override
    public T getObject() throws Exception {
        return printMapperFactory.createMapper(mapperInterface);
    }

    @Override
    public Class<?> getObjectType() {
        return mapperInterface;
    }

    @Override
    public boolean isSingleton() {
        return true;
    }

    public void setMapperInterface(Class<T> mapperInterface) {
        this.mapperInterface = mapperInterface;
    }
}
