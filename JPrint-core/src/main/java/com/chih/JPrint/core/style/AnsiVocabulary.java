package com.chih.JPrint.core.style;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 颜色 / 样式词表
 * <p>
 * 名称（小写）到 ANSI SGR 数值代码的两张只读映射表，进程级常量，无需同步。
 * </p>
 *
 * <h3>颜色（17 项）：</h3>
 * <ul>
 *   <li>标准色：black, red, green, yellow, blue, magenta, cyan, white (30-37)</li>
 *   <li>亮色：bright_black(别名 gray), bright_red ... bright_white (90-97)</li>
 * </ul>
 *
 * <h3>样式（8 项）：</h3>
 * bold, italic, underline, dimmed, blink, reversed, hidden, strikethrough
 *
 * @since 2026/10/19
 */
public final class AnsiVocabulary {

    /**
     * 重置序列 ESC[0m
     */
    public static final String RESET = "\u001B[0m";

    private static final Map<String, Integer> COLORS;
    private static final Map<String, Integer> STYLES;

    static {
        Map<String, Integer> colors = new LinkedHashMap<>();
        colors.put("black", 30);
        colors.put("red", 31);
        colors.put("green", 32);
        colors.put("yellow", 33);
        colors.put("blue", 34);
        colors.put("magenta", 35);
        colors.put("cyan", 36);
        colors.put("white", 37);
        colors.put("bright_black", 90);
        colors.put("gray", 90);
        colors.put("bright_red", 91);
        colors.put("bright_green", 92);
        colors.put("bright_yellow", 93);
        colors.put("bright_blue", 94);
        colors.put("bright_magenta", 95);
        colors.put("bright_cyan", 96);
        colors.put("bright_white", 97);
        COLORS = Map.copyOf(colors);

        Map<String, Integer> styles = new LinkedHashMap<>();
        styles.put("bold", 1);
        styles.put("dimmed", 2);
        styles.put("italic", 3);
        styles.put("underline", 4);
        styles.put("blink", 5);
        styles.put("reversed", 7);
        styles.put("hidden", 8);
        styles.put("strikethrough", 9);
        STYLES = Map.copyOf(styles);
    }

    private AnsiVocabulary() {
        // 静态常量类
    }

    /**
     * 查找名称对应的 SGR 代码，先查颜色表再查样式表
     *
     * @param name 颜色或样式名（大小写敏感，需为小写）
     * @return SGR 代码；未知名称返回 null
     */
    public static Integer codeOf(String name) {
        if (name == null) {
            return null;
        }
        Integer code = COLORS.get(name);
        return code != null ? code : STYLES.get(name);
    }

    /**
     * 判断名称是否为已知的颜色或样式（会先 trim）
     */
    public static boolean isKnownTerm(String term) {
        if (term == null) {
            return false;
        }
        String trimmed = term.trim();
        return COLORS.containsKey(trimmed) || STYLES.containsKey(trimmed);
    }

    public static Map<String, Integer> colors() {
        return COLORS;
    }

    public static Map<String, Integer> styles() {
        return STYLES;
    }
}
