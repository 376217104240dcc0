package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.spi.ValueFormatter;
import com.chih.JPrint.core.support.StructureScanner;
import com.chih.JPrint.core.support.StructureScanner.QuoteState;

import java.util.List;

/**
 * 数组格式 {@code :a}
 * <p>
 * 按嵌套深度分三种情况：
 * </p>
 * <ul>
 *   <li>深度 0 / 1：原样返回</li>
 *   <li>深度 2：外层括号后换行缩进两格，行与行之间换行，闭合括号单独一行</li>
 *   <li>深度 &ge; 3：递归展开，每深一层多缩进两格，闭合括号与父级对齐</li>
 * </ul>
 * 所有扫描均忽略引号内的方括号与逗号。
 *
 * @since 2026/10/19
 */
public class ArrayFormatter implements ValueFormatter {

    private static final String INDENT = "  ";

    @Override
    public String format(ResolvedValue value, String spec, List<String> args) {
        return formatDebug(value.debug());
    }

    public String formatDebug(String debug) {
        if (debug == null || !debug.startsWith("[")) {
            return debug;
        }
        int depth = StructureScanner.nestingDepth(debug);
        if (depth <= 1) {
            return debug;
        }
        if (depth == 2) {
            return format2d(debug);
        }
        return formatNested(debug, 0);
    }

    /**
     * 二维：{@code "[["->"[\n  ["}、{@code "]]"->"]\n]"}、{@code "], ["->"],\n  ["}，仅替换引号外的文本
     */
    private String format2d(String debug) {
        StringBuilder out = new StringBuilder(debug.length() + 16);
        QuoteState state = new QuoteState();
        int i = 0;
        while (i < debug.length()) {
            char c = debug.charAt(i);
            if (!state.inQuotes()) {
                if (debug.startsWith("[[", i)) {
                    out.append("[\n").append(INDENT).append('[');
                    i += 2;
                    continue;
                }
                if (debug.startsWith("]]", i)) {
                    out.append("]\n]");
                    i += 2;
                    continue;
                }
                if (debug.startsWith("], [", i)) {
                    out.append("],\n").append(INDENT).append('[');
                    i += 4;
                    continue;
                }
            }
            state.accept(debug, i);
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * 多维：在第一层元素处切分，仍含二层以上嵌套的元素继续递归
     */
    private String formatNested(String array, int level) {
        String content = StructureScanner.unwrapBrackets(array);
        if (content == null || StructureScanner.nestingDepth(array) < 2) {
            return array;
        }
        List<String> elements = StructureScanner.splitTopLevel(content);
        StringBuilder out = new StringBuilder("[\n");
        for (int i = 0; i < elements.size(); i++) {
            out.append(INDENT.repeat(level + 1));
            out.append(formatNested(elements.get(i), level + 1));
            if (i < elements.size() - 1) {
                out.append(",\n");
            }
        }
        out.append('\n').append(INDENT.repeat(level)).append(']');
        return out.toString();
    }
}
