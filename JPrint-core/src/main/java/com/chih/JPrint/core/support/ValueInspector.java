package com.chih.JPrint.core.support;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 运行时值的结构内省
 * <p>
 * 把任意值归一化为三类之一：序列（{@link List}）、映射（{@link Map}）或标量。
 * 数组与 Iterable 视为序列；Map、record 与 JavaBean 视为映射。
 * JavaBean 的属性名由 Jackson 内省得到（与序列化规则一致），属性值与 record 组件一样保留原始对象，
 * 嵌套的 bean 因此仍按 bean 展开。
 * </p>
 *
 * @since 2026/10/19
 */
public final class ValueInspector {

    private static final Logger log = LoggerFactory.getLogger(ValueInspector.class);

    private static final ObjectMapper MAPPER = PrintObjectMapperFactory.createIntrospectionMapper();

    private ValueInspector() {
    }

    /**
     * 是否按标量处理（字符串、数字、布尔、字符、枚举、时间、路径等）
     */
    public static boolean isScalar(Object value) {
        return value == null
                || value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>
                || value instanceof TemporalAccessor
                || value instanceof Date
                || value instanceof UUID
                || value instanceof Path
                || value instanceof Class<?>;
    }

    /**
     * 序列视图：数组、Collection 以及其他 Iterable
     *
     * @return 元素列表；不是序列时返回 null
     */
    public static List<Object> asList(Object value) {
        if (value == null || isScalar(value)) {
            return null;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> list = new ArrayList<>();
            iterable.forEach(list::add);
            return list;
        }
        return null;
    }

    /**
     * 映射视图：Map 原样（保持迭代顺序），record 与 JavaBean 展开为属性映射
     *
     * @return 键值映射；不是映射类值时返回 null
     */
    public static Map<Object, Object> asMap(Object value) {
        if (value == null || isScalar(value) || value instanceof Optional<?>) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>(map);
        }
        if (asList(value) != null) {
            return null;
        }
        Map<String, Object> properties = properties(value);
        return properties == null ? null : new LinkedHashMap<>(properties);
    }

    /**
     * 读取 record 组件或 JavaBean 属性
     *
     * @return 属性映射；值不是 record/bean 或没有可读属性时返回 null
     */
    public static Map<String, Object> properties(Object value) {
        Class<?> type = value.getClass();
        if (type.isRecord()) {
            return recordComponents(value);
        }
        if (type.getName().startsWith("java.") || type.getName().startsWith("javax.")) {
            return null;
        }
        try {
            BeanDescription description = MAPPER.getSerializationConfig().introspect(MAPPER.constructType(type));
            Map<String, Object> properties = new LinkedHashMap<>();
            for (BeanPropertyDefinition property : description.findProperties()) {
                AnnotatedMember accessor = property.getAccessor();
                if (accessor == null) {
                    continue;
                }
                accessor.fixAccess(true);
                properties.put(property.getName(), accessor.getValue(value));
            }
            return properties.isEmpty() ? null : properties;
        } catch (IllegalArgumentException e) {
            log.debug("Cannot introspect {} as a bean: {}", type.getName(), e.getMessage());
            return null;
        }
    }

    private static Map<String, Object> recordComponents(Object value) {
        Map<String, Object> components = new LinkedHashMap<>();
        for (RecordComponent component : value.getClass().getRecordComponents()) {
            try {
                component.getAccessor().setAccessible(true);
                components.put(component.getName(), component.getAccessor().invoke(value));
            } catch (ReflectiveOperationException | RuntimeException e) {
                log.debug("Cannot read record component {}.{}", value.getClass().getSimpleName(),
                        component.getName(), e);
                return null;
            }
        }
        return components;
    }

    /**
     * 结构名称：record / bean 使用简单类名
     */
    public static String typeName(Object value) {
        return value.getClass().getSimpleName();
    }

    /**
     * 显示文本（用于表格单元格与无格式说明符的变量）：标量取 toString，其他取紧凑调试表示
     */
    public static String display(Object value) {
        if (value == null) {
            return "null";
        }
        if (isScalar(value)) {
            return String.valueOf(value);
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(ValueInspector::display).orElse("null");
        }
        if (value.getClass().isArray()) {
            return DebugRepresentation.compact(value);
        }
        return String.valueOf(value);
    }
}
