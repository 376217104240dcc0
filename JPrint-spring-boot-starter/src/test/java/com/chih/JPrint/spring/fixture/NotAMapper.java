package com.chih.JPrint.spring.fixture;

/**
 * 没有 @PrintMapper 注解，扫描时应被忽略
 */
public interface NotAMapper {
    void ignored();
}
