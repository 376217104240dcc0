package com.chih.JPrint.core.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 调试文本的结构扫描工具（引号感知）
 * <p>
 * 所有结构化格式器都以调试文本为输入。扫描时双引号字符串与完整的单引号字符字面量内的
 * 方括号、逗号一律不计入结构，引号内的反斜杠转义（{@code \"}）也会被跳过。
 * </p>
 *
 * @since 2026/10/19
 */
public final class StructureScanner {

    private StructureScanner() {
        // Static utility class
    }

    /**
     * 引号状态机：逐位置喂入，返回该字符是否位于引号之外（即是否具有结构意义）
     * <p>
     * 单引号只有在构成完整字符字面量（{@code 'x'} 或 {@code '\n'}）时才开启引号，
     * 裸标量里的撇号（如路径 {@code it's}）仍按普通字符处理。
     * </p>
     */
    public static final class QuoteState {
        private char quote;
        private boolean escaped;

        public boolean accept(CharSequence text, int index) {
            char c = text.charAt(index);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                return false;
            }
            if (c == '"' || c == '\'' && isCharLiteral(text, index)) {
                quote = c;
                return false;
            }
            return true;
        }

        private static boolean isCharLiteral(CharSequence text, int start) {
            int length = text.length();
            if (start + 2 < length && text.charAt(start + 1) != '\\' && text.charAt(start + 2) == '\'') {
                return true;
            }
            return start + 3 < length && text.charAt(start + 1) == '\\' && text.charAt(start + 3) == '\'';
        }

        public boolean inQuotes() {
            return quote != 0;
        }
    }

    /**
     * 计算引号之外的最大方括号嵌套深度
     */
    public static int nestingDepth(String text) {
        if (text == null) {
            return 0;
        }
        QuoteState state = new QuoteState();
        int depth = 0;
        int max = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!state.accept(text, i)) {
                continue;
            }
            if (c == '[') {
                depth++;
                max = Math.max(max, depth);
            } else if (c == ']') {
                depth--;
            }
        }
        return max;
    }

    /**
     * 查找第一层方括号分组，返回每组 [start, end]（end 指向闭合方括号）
     */
    public static List<int[]> firstLevelBrackets(String content) {
        List<int[]> spans = new ArrayList<>();
        QuoteState state = new QuoteState();
        int level = 0;
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (!state.accept(content, i)) {
                continue;
            }
            if (c == '[') {
                if (level == 0) {
                    start = i;
                }
                level++;
            } else if (c == ']') {
                level--;
                if (level == 0) {
                    spans.add(new int[]{start, i});
                }
            }
        }
        return spans;
    }

    /**
     * 按顶层逗号切分（方括号、花括号、圆括号内的逗号不切分），元素已 trim，空元素被丢弃
     */
    public static List<String> splitTopLevel(String content) {
        if (content == null || content.isBlank()) {
            return Collections.emptyList();
        }
        List<String> parts = new ArrayList<>();
        QuoteState state = new QuoteState();
        StringBuilder element = new StringBuilder();
        int level = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (state.accept(content, i)) {
                if (c == '[' || c == '{' || c == '(') {
                    level++;
                } else if (c == ']' || c == '}' || c == ')') {
                    level--;
                } else if (c == ',' && level == 0) {
                    addTrimmed(parts, element);
                    element.setLength(0);
                    continue;
                }
            }
            element.append(c);
        }
        addTrimmed(parts, element);
        return parts;
    }

    private static void addTrimmed(List<String> parts, StringBuilder element) {
        String trimmed = element.toString().trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    /**
     * 去掉最外层的方括号
     *
     * @return 方括号内的内容；文本不是 {@code [ ... ]} 形式时返回 null
     */
    public static String unwrapBrackets(String text) {
        if (text == null || text.length() < 2 || !text.startsWith("[") || !text.endsWith("]")) {
            return null;
        }
        return text.substring(1, text.length() - 1);
    }

    /**
     * 把调试文本解析成行向量网格（矩阵 / 行列式格式器共用）
     * <p>
     * 行是第一层方括号分组，行内元素按顶层逗号切分；不在方括号中的顶层元素被忽略。
     * </p>
     *
     * @return 网格；文本不是方括号包裹的形式时返回 empty
     */
    public static Optional<List<List<String>>> parseGrid(String debug) {
        String content = unwrapBrackets(debug);
        if (content == null) {
            return Optional.empty();
        }
        List<List<String>> grid = new ArrayList<>();
        for (int[] span : firstLevelBrackets(content)) {
            String row = content.substring(span[0] + 1, span[1]);
            grid.add(splitTopLevel(row));
        }
        return Optional.of(grid);
    }

    /**
     * 显示宽度：按 code point 计数
     */
    public static int displayWidth(String text) {
        return text.codePointCount(0, text.length());
    }
}
