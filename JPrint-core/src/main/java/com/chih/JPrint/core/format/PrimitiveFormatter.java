package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.spi.ValueFormatter;
import com.chih.JPrint.core.support.ValueInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 默认格式器：透传给 {@link java.util.Formatter}
 * <p>
 * 说明符按 {@code %} + spec 使用（标志、宽度、精度、转换符不变），例如 {@code .2f}、{@code 04d}、
 * {@code x}、{@code -10s}。缺少转换符时按值类型推断：整数 -> {@code d}，带精度的浮点数 -> {@code f}，
 * 字符 -> {@code c}，其他 -> 基于显示文本的 {@code s}。
 * 整数配合 {@code b} 输出二进制（{@code #} 加 {@code 0b} 前缀，{@code 0} 补零），
 * 负数按所属类型的位宽取补码；其他值的 {@code b} 仍是 Formatter 的布尔转换。
 * 非法说明符退化为显示文本并记录 warn 日志。
 * </p>
 *
 * @since 2026/10/19
 */
public class PrimitiveFormatter implements ValueFormatter {

    private static final Logger log = LoggerFactory.getLogger(PrimitiveFormatter.class);

    private static final Pattern SPECIFIER = Pattern.compile(
            "^([-#+ 0,(]*)(\\d+)?(\\.\\d+)?([bBhHsScCdoxXeEfgGaA]|[tT][a-zA-Z])?$");

    @Override
    public String format(ResolvedValue value, String spec, List<String> args) {
        Object raw = value.value();
        String display = ValueInspector.display(raw);
        if (spec == null || spec.isEmpty()) {
            return display;
        }

        Matcher matcher = SPECIFIER.matcher(spec);
        if (!matcher.matches()) {
            log.warn("Unsupported format specifier '{}', falling back to display text", spec);
            return display;
        }

        String conversion = matcher.group(4);
        boolean hasPrecision = matcher.group(3) != null;
        if (conversion == null) {
            conversion = inferConversion(raw, hasPrecision);
        }
        if ("b".equalsIgnoreCase(conversion) && isIntegral(raw)) {
            return binary(raw, nullToEmpty(matcher.group(1)), matcher.group(2));
        }
        Object argument = "s".equalsIgnoreCase(conversion) ? display : raw;
        String pattern = "%" + nullToEmpty(matcher.group(1)) + nullToEmpty(matcher.group(2))
                + nullToEmpty(matcher.group(3)) + conversion;
        try {
            return String.format(Locale.ROOT, pattern, argument);
        } catch (IllegalFormatException e) {
            log.warn("Format specifier '{}' does not apply to {}: {}", spec,
                    raw == null ? "null" : raw.getClass().getSimpleName(), e.getMessage());
            return display;
        }
    }

    private static String inferConversion(Object value, boolean hasPrecision) {
        if (isIntegral(value)) {
            return "d";
        }
        if (value instanceof Number && hasPrecision) {
            return "f";
        }
        if (value instanceof Character) {
            return "c";
        }
        return "s";
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger;
    }

    private static String binary(Object value, String flags, String width) {
        String digits;
        if (value instanceof Byte b) {
            digits = Integer.toBinaryString(b & 0xFF);
        } else if (value instanceof Short s) {
            digits = Integer.toBinaryString(s & 0xFFFF);
        } else if (value instanceof Integer i) {
            digits = Integer.toBinaryString(i);
        } else if (value instanceof Long l) {
            digits = Long.toBinaryString(l);
        } else {
            digits = ((BigInteger) value).toString(2);
        }

        String sign = "";
        if (digits.startsWith("-")) {
            sign = "-";
            digits = digits.substring(1);
        }
        String prefix = sign + (flags.contains("#") ? "0b" : "");
        String text = prefix + digits;
        int padding = width == null ? 0 : Integer.parseInt(width) - text.length();
        if (padding <= 0) {
            return text;
        }
        if (flags.contains("-")) {
            return text + " ".repeat(padding);
        }
        if (flags.contains("0")) {
            return prefix + "0".repeat(padding) + digits;
        }
        return " ".repeat(padding) + text;
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
