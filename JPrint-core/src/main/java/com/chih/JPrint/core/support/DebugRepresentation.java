package com.chih.JPrint.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 通用调试表示
 * <p>
 * 所有结构化格式器共用的文本基底：
 * </p>
 * <ul>
 *   <li>字符串带双引号并转义，字符带单引号</li>
 *   <li>日期时间经 Jackson 写成带双引号的 ISO-8601 文本</li>
 *   <li>序列（集合、数组）：{@code [e1, e2]}</li>
 *   <li>映射：{@code {k: v, k2: v2}}</li>
 *   <li>record / JavaBean：{@code Name {field: value}}</li>
 * </ul>
 * 紧凑模式单行输出；美化模式每个元素一行，每层缩进四个空格。
 *
 * @since 2026/10/19
 */
public final class DebugRepresentation {

    private static final Logger log = LoggerFactory.getLogger(DebugRepresentation.class);

    private static final ObjectMapper MAPPER = PrintObjectMapperFactory.createIntrospectionMapper();

    private static final String PRETTY_INDENT = "    ";
    private static final String CYCLE = "...";

    private DebugRepresentation() {
    }

    public static String compact(Object value) {
        StringBuilder out = new StringBuilder();
        writeCompact(out, value, newVisiting());
        return out.toString();
    }

    public static String pretty(Object value) {
        StringBuilder out = new StringBuilder();
        writePretty(out, value, 0, newVisiting());
        return out.toString();
    }

    /**
     * 带引号并转义的字符串字面量
     */
    public static String quote(String text, char quote) {
        StringBuilder out = new StringBuilder(text.length() + 2);
        out.append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c == quote) {
                        out.append('\\');
                    }
                    out.append(c);
                }
            }
        }
        return out.append(quote).toString();
    }

    private static Set<Object> newVisiting() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static boolean writeScalar(StringBuilder out, Object value) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof CharSequence text) {
            out.append(quote(text.toString(), '"'));
        } else if (value instanceof Character c) {
            out.append(quote(String.valueOf(c), '\''));
        } else if (value instanceof Enum<?> e) {
            out.append(e.name());
        } else if (value instanceof TemporalAccessor || value instanceof Date) {
            out.append(temporal(value));
        } else if (ValueInspector.isScalar(value)) {
            out.append(value);
        } else {
            return false;
        }
        return true;
    }

    private static String temporal(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Cannot write {} as ISO text: {}", value.getClass().getSimpleName(), e.getMessage());
            return quote(String.valueOf(value), '"');
        }
    }

    private static void writeCompact(StringBuilder out, Object value, Set<Object> visiting) {
        if (writeScalar(out, value)) {
            return;
        }
        if (value instanceof Optional<?> optional) {
            writeCompact(out, optional.orElse(null), visiting);
            return;
        }
        if (!visiting.add(value)) {
            out.append(CYCLE);
            return;
        }
        try {
            List<Object> list = ValueInspector.asList(value);
            if (list != null) {
                out.append('[');
                for (int i = 0; i < list.size(); i++) {
                    if (i > 0) {
                        out.append(", ");
                    }
                    writeCompact(out, list.get(i), visiting);
                }
                out.append(']');
                return;
            }
            if (value instanceof Map<?, ?> map) {
                writeCompactEntries(out, map, visiting, true);
                return;
            }
            Map<String, Object> properties = ValueInspector.properties(value);
            if (properties != null) {
                out.append(ValueInspector.typeName(value)).append(' ');
                writeCompactEntries(out, properties, visiting, false);
                return;
            }
            out.append(value);
        } finally {
            visiting.remove(value);
        }
    }

    private static void writeCompactEntries(StringBuilder out, Map<?, ?> entries, Set<Object> visiting,
            boolean debugKeys) {
        out.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            writeKey(out, entry.getKey(), visiting, debugKeys);
            out.append(": ");
            writeCompact(out, entry.getValue(), visiting);
        }
        out.append('}');
    }

    private static void writeKey(StringBuilder out, Object key, Set<Object> visiting, boolean debugKeys) {
        if (debugKeys) {
            writeCompact(out, key, visiting);
        } else {
            out.append(key);
        }
    }

    private static void writePretty(StringBuilder out, Object value, int level, Set<Object> visiting) {
        if (writeScalar(out, value)) {
            return;
        }
        if (value instanceof Optional<?> optional) {
            writePretty(out, optional.orElse(null), level, visiting);
            return;
        }
        if (!visiting.add(value)) {
            out.append(CYCLE);
            return;
        }
        try {
            List<Object> list = ValueInspector.asList(value);
            if (list != null) {
                if (list.isEmpty()) {
                    out.append("[]");
                    return;
                }
                out.append("[\n");
                for (int i = 0; i < list.size(); i++) {
                    indent(out, level + 1);
                    writePretty(out, list.get(i), level + 1, visiting);
                    out.append(i < list.size() - 1 ? ",\n" : "\n");
                }
                indent(out, level);
                out.append(']');
                return;
            }
            if (value instanceof Map<?, ?> map) {
                writePrettyEntries(out, map, level, visiting, true);
                return;
            }
            Map<String, Object> properties = ValueInspector.properties(value);
            if (properties != null) {
                out.append(ValueInspector.typeName(value)).append(' ');
                writePrettyEntries(out, properties, level, visiting, false);
                return;
            }
            out.append(value);
        } finally {
            visiting.remove(value);
        }
    }

    private static void writePrettyEntries(StringBuilder out, Map<?, ?> entries, int level,
            Set<Object> visiting, boolean debugKeys) {
        if (entries.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        int remaining = entries.size();
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            indent(out, level + 1);
            writeKey(out, entry.getKey(), visiting, debugKeys);
            out.append(": ");
            writePretty(out, entry.getValue(), level + 1, visiting);
            out.append(--remaining > 0 ? ",\n" : "\n");
        }
        indent(out, level);
        out.append('}');
    }

    private static void indent(StringBuilder out, int level) {
        out.append(PRETTY_INDENT.repeat(level));
    }
}
