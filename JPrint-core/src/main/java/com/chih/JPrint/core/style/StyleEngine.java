package com.chih.JPrint.core.style;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 样式引擎：把一组颜色/样式名转换为一条 ANSI 转义序列
 * <p>
 * 纯函数，保持输入顺序：{@code ["red", "bold"]} 得到 {@code ESC[31;1m}，
 * {@code ["bold", "red"]} 得到 {@code ESC[1;31m}。
 * 未知名称静默丢弃；若全部未知（或输入为空）则返回重置序列。
 * </p>
 *
 * @since 2026/10/19
 */
public final class StyleEngine {

    private StyleEngine() {
        // Static utility class
    }

    /**
     * 生成 ANSI 序列
     *
     * @param names 颜色/样式名列表
     * @return ANSI 转义序列，至少是 {@link AnsiVocabulary#RESET}
     */
    public static String ansiCode(List<String> names) {
        if (names == null || names.isEmpty()) {
            return AnsiVocabulary.RESET;
        }

        List<String> codes = new ArrayList<>(names.size());
        for (String name : names) {
            Integer code = AnsiVocabulary.codeOf(name);
            if (code != null) {
                codes.add(String.valueOf(code));
            }
        }

        if (codes.isEmpty()) {
            return AnsiVocabulary.RESET;
        }
        return "\u001B[" + String.join(";", codes) + "m";
    }

    public static String ansiCode(String... names) {
        return ansiCode(names == null ? Collections.emptyList() : Arrays.asList(names));
    }

    /**
     * 解析逗号分隔的样式列表字符串（如 "bright_red, bold"）
     * <p>
     * 用于样式变量：运行时值被当作样式列表而不是单个名称。
     * </p>
     */
    public static List<String> splitStyleList(String styleList) {
        if (styleList == null) {
            return Collections.emptyList();
        }
        List<String> terms = new ArrayList<>();
        for (String part : styleList.split(",", -1)) {
            terms.add(part.trim());
        }
        return terms;
    }
}
