package com.chih.JPrint.core.engine;

import com.chih.JPrint.core.annotation.Param;
import com.chih.JPrint.core.annotation.Print;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.Proxy;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 动态代理工厂：为 {@code @PrintMapper} 接口生成代理实例
 * <p>
 * 每个方法的模板、参数名、返回类型只在第一次调用时解析一次并缓存。
 * 创建代理时预先校验所有方法（Fail-Fast）：必须带 {@link Print}，返回类型只能是 {@code void} 或 {@code String}。
 * </p>
 *
 * @since 2026/10/19
 */
public class PrintMapperFactory {

    private static final Logger log = LoggerFactory.getLogger(PrintMapperFactory.class);

    private final ConsolePrinter printer;

    // 方法元数据缓存
    private final Map<Method, MethodMetadata> methodCache = new ConcurrentHashMap<>();

    public PrintMapperFactory(ConsolePrinter printer) {
        this.printer = Objects.requireNonNull(printer, "printer must not be null");
    }

    /**
     * 方法元数据：模板、参数名、是否只渲染、指标来源名
     */
    private record MethodMetadata(String template, String[] parameterNames, boolean renderOnly, String source) {
    }

    private MethodMetadata parseMethodMetadata(Method method) {
        Print print = method.getAnnotation(Print.class);
        validateMethod(method.getDeclaringClass(), method);

        Parameter[] parameters = method.getParameters();
        String[] names = new String[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            Param param = parameters[i].getAnnotation(Param.class);
            // 没有 @Param 时依赖 -parameters 编译选项，否则得到 arg0, arg1
            names[i] = param != null ? param.value() : parameters[i].getName();
        }

        String source = method.getDeclaringClass().getSimpleName() + "#" + method.getName();
        return new MethodMetadata(print.value(), names, method.getReturnType().equals(String.class), source);
    }

    @SuppressWarnings("unchecked")
    public <T> T createMapper(Class<T> interfaceType) {
        if (!interfaceType.isInterface()) {
            throw new IllegalArgumentException("PrintMapper type must be an interface: " + interfaceType.getName());
        }
        validateInterfaceMethods(interfaceType);

        return (T) Proxy.newProxyInstance(
                interfaceType.getClassLoader(),
                new Class[]{interfaceType},
                new PrintInvocationHandler(interfaceType)
        );
    }

    private <T> void validateInterfaceMethods(Class<T> interfaceType) {
        int validated = 0;
        for (Method method : interfaceType.getMethods()) {
            if (Object.class.equals(method.getDeclaringClass()) || method.isDefault()
                    || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            validateMethod(interfaceType, method);
            validated++;
        }
        log.debug("Interface validation passed for '{}' ({} methods validated)",
                interfaceType.getSimpleName(), validated);
    }

    private static void validateMethod(Class<?> interfaceType, Method method) {
        if (method.getAnnotation(Print.class) == null) {
            throw new IllegalArgumentException(String.format(
                    "Interface '%s' method '%s' is missing the @Print template.",
                    interfaceType.getName(), method.getName()));
        }
        Class<?> returnType = method.getReturnType();
        if (!returnType.equals(void.class) && !returnType.equals(String.class)) {
            throw new IllegalArgumentException(String.format(
                    "Interface '%s' method '%s' has unsupported return type '%s'. " +
                    "Supported return types are: void (print) and String (render only).",
                    interfaceType.getName(), method.getName(), returnType.getSimpleName()));
        }
    }

    class PrintInvocationHandler implements InvocationHandler {
        private final Class<?> interfaceType;

        PrintInvocationHandler(Class<?> interfaceType) {
            this.interfaceType = interfaceType;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (Object.class.equals(method.getDeclaringClass())) {
                return switch (method.getName()) {
                    case "equals" -> proxy == args[0];
                    case "hashCode" -> System.identityHashCode(proxy);
                    case "toString" -> "PrintMapper proxy for " + interfaceType.getName();
                    default -> method.invoke(this, args);
                };
            }
            if (method.isDefault()) {
                return InvocationHandler.invokeDefault(proxy, method, args);
            }

            MethodMetadata metadata = methodCache.computeIfAbsent(method, PrintMapperFactory.this::parseMethodMetadata);
            Map<String, Object> vars = extractArguments(metadata.parameterNames(), args);

            if (metadata.renderOnly()) {
                return printer.render(metadata.source(), metadata.template(), printer.createResolver(vars));
            }
            printer.print(metadata.source(), metadata.template(), printer.createResolver(vars));
            return null;
        }

        private Map<String, Object> extractArguments(String[] names, Object[] args) {
            if (args == null || names.length == 0) {
                return Collections.emptyMap();
            }
            Map<String, Object> vars = new HashMap<>(names.length);
            for (int i = 0; i < names.length; i++) {
                vars.put(names[i], args[i]);
            }
            return vars;
        }
    }
}
