package com.chih.JPrint.core.impl;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.exception.UnresolvedVariableException;
import com.chih.JPrint.core.spi.ValueResolver;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于变量表的解析器
 * <p>
 * 支持路径表达式：{@code name}、{@code name.property}、{@code name[0]}、{@code name["key"]}、
 * {@code name.method()}，可任意链式组合。属性依次尝试：Map 键、record 组件、
 * getter（getX / isX）、无参方法、public 字段。
 * 运算等复杂表达式不在此实现范围内，需要时使用 Spring 模块提供的 SpEL 解析器。
 * </p>
 *
 * @since 2026/10/19
 */
public class MapValueResolver implements ValueResolver {

    private final Map<String, ?> variables;

    public MapValueResolver(Map<String, ?> variables) {
        this.variables = variables == null ? Collections.emptyMap() : new HashMap<>(variables);
    }

    @Override
    public ResolvedValue resolve(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new UnresolvedVariableException(String.valueOf(expression));
        }
        String path = expression.trim();
        PathCursor cursor = new PathCursor(path);

        String root = cursor.identifier();
        if (root == null || !variables.containsKey(root)) {
            throw new UnresolvedVariableException(expression);
        }
        Object current = variables.get(root);
        if (cursor.callParentheses()) {
            throw new UnresolvedVariableException(expression);
        }

        while (!cursor.atEnd()) {
            char c = cursor.next();
            if (c == '.') {
                String name = cursor.identifier();
                if (name == null) {
                    throw new UnresolvedVariableException(expression);
                }
                boolean call = cursor.callParentheses();
                current = readProperty(current, name, call, expression);
            } else if (c == '[') {
                String key = cursor.until(']');
                if (key == null) {
                    throw new UnresolvedVariableException(expression);
                }
                current = readIndex(current, key.trim(), expression);
            } else {
                throw new UnresolvedVariableException(expression);
            }
        }
        return ResolvedValue.of(current);
    }

    private Object readProperty(Object target, String name, boolean call, String expression) {
        if (target == null) {
            throw new UnresolvedVariableException(expression,
                    new NullPointerException("'" + name + "' read on null"));
        }
        if (!call && target instanceof Map<?, ?> map) {
            if (map.containsKey(name)) {
                return map.get(name);
            }
            throw new UnresolvedVariableException(expression);
        }
        Class<?> type = target.getClass();
        try {
            if (!call) {
                Method getter = findNoArgMethod(type, "get" + capitalize(name));
                if (getter == null) {
                    getter = findNoArgMethod(type, "is" + capitalize(name));
                }
                if (getter != null) {
                    return getter.invoke(target);
                }
            }
            // record 组件访问器、普通无参方法
            Method method = findNoArgMethod(type, name);
            if (method != null) {
                return method.invoke(target);
            }
            if (!call) {
                Field field = type.getField(name);
                return field.get(target);
            }
        } catch (NoSuchFieldException e) {
            throw new UnresolvedVariableException(expression, e);
        } catch (InvocationTargetException e) {
            throw new UnresolvedVariableException(expression, e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new UnresolvedVariableException(expression, e);
        }
        throw new UnresolvedVariableException(expression);
    }

    private Object readIndex(Object target, String key, String expression) {
        if (target instanceof Map<?, ?> map) {
            String unquoted = unquote(key);
            if (unquoted != null) {
                if (map.containsKey(unquoted)) {
                    return map.get(unquoted);
                }
                throw new UnresolvedVariableException(expression);
            }
            Integer numeric = parseIndex(key);
            if (numeric != null && map.containsKey(numeric)) {
                return map.get(numeric);
            }
            if (map.containsKey(key)) {
                return map.get(key);
            }
            throw new UnresolvedVariableException(expression);
        }

        Integer index = parseIndex(key);
        if (index == null || target == null) {
            throw new UnresolvedVariableException(expression);
        }
        try {
            if (target instanceof List<?> list) {
                return list.get(index);
            }
            if (target.getClass().isArray()) {
                return Array.get(target, index);
            }
        } catch (IndexOutOfBoundsException e) {
            throw new UnresolvedVariableException(expression, e);
        }
        throw new UnresolvedVariableException(expression);
    }

    private static Method findNoArgMethod(Class<?> type, String name) {
        Method method;
        try {
            method = type.getMethod(name);
        } catch (NoSuchMethodException e) {
            return null;
        }
        if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
            return null;
        }
        if (Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            return method;
        }
        // 非 public 实现类（如 List.of() 的内部类）上的方法，改从 public 父类型调用
        Method declared = findPublicDeclaration(type, name);
        if (declared != null) {
            return declared;
        }
        return method.trySetAccessible() ? method : null;
    }

    private static Method findPublicDeclaration(Class<?> type, String name) {
        if (type == null) {
            return null;
        }
        if (Modifier.isPublic(type.getModifiers())) {
            try {
                return type.getMethod(name);
            } catch (NoSuchMethodException e) {
                return null;
            }
        }
        for (Class<?> anInterface : type.getInterfaces()) {
            Method method = findPublicDeclaration(anInterface, name);
            if (method != null) {
                return method;
            }
        }
        return findPublicDeclaration(type.getSuperclass(), name);
    }

    private static String capitalize(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static String unquote(String key) {
        if (key.length() >= 2
                && (key.startsWith("\"") && key.endsWith("\"") || key.startsWith("'") && key.endsWith("'"))) {
            return key.substring(1, key.length() - 1);
        }
        return null;
    }

    private static Integer parseIndex(String key) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 路径表达式游标
     */
    private static final class PathCursor {
        private final String path;
        private int pos;

        PathCursor(String path) {
            this.path = path;
        }

        boolean atEnd() {
            return pos >= path.length();
        }

        char next() {
            return path.charAt(pos++);
        }

        String identifier() {
            int start = pos;
            if (atEnd() || !Character.isJavaIdentifierStart(path.charAt(pos))) {
                return null;
            }
            pos++;
            while (!atEnd() && Character.isJavaIdentifierPart(path.charAt(pos))) {
                pos++;
            }
            return path.substring(start, pos);
        }

        boolean callParentheses() {
            if (path.startsWith("()", pos)) {
                pos += 2;
                return true;
            }
            return false;
        }

        String until(char terminator) {
            int end = path.indexOf(terminator, pos);
            if (end < 0) {
                return null;
            }
            String content = path.substring(pos, end);
            pos = end + 1;
            return content;
        }
    }
}
