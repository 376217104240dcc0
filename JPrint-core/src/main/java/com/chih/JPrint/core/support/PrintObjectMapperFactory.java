package com.chih.JPrint.core.support;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JPrint ObjectMapper 工厂类。
 * <p>
 * 格式器需要知道任意 JavaBean 有哪些可读属性，才能生成调试文本和表格；日期时间类型则要写成统一的文本。
 * 这里统一提供 Jackson 的配置，保证调试表示与表格使用同一套内省规则。
 * </p>
 *
 * <h3>配置策略说明：</h3>
 * <ul>
 *   <li>WRITE_DATES_AS_TIMESTAMPS: disabled - java.time 类型输出 ISO-8601 文本</li>
 *   <li>SORT_PROPERTIES_ALPHABETICALLY: false - 保持声明顺序</li>
 * </ul>
 *
 * @since 2026/10/19
 */
public class PrintObjectMapperFactory {

    private PrintObjectMapperFactory() {
    }

    /**
     * 创建用于对象内省的 ObjectMapper（线程安全，可复用）
     */
    public static ObjectMapper createIntrospectionMapper() {
        ObjectMapper mapper = JsonMapper.builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, false)
                .build();

        /* 注册 Java 8 时间模块，LocalDate 等类型按 ISO-8601 文本展开 */
        mapper.registerModule(new JavaTimeModule());

        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }
}
