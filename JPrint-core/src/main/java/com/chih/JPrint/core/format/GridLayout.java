package com.chih.JPrint.core.format;

import com.chih.JPrint.core.support.StructureScanner;

import java.util.List;

/**
 * 矩阵 / 行列式共用的网格排版
 * <p>
 * 列宽 = 该列所有行中最长元素的宽度；元素左对齐，列间两个空格，括号内侧各留两个空格。
 * </p>
 */
final class GridLayout {

    private static final String GAP = "  ";

    private GridLayout() {
    }

    static int[] columnWidths(List<List<String>> grid) {
        int columns = 0;
        for (List<String> row : grid) {
            columns = Math.max(columns, row.size());
        }
        int[] widths = new int[columns];
        for (List<String> row : grid) {
            for (int j = 0; j < row.size(); j++) {
                widths[j] = Math.max(widths[j], StructureScanner.displayWidth(row.get(j)));
            }
        }
        return widths;
    }

    static void appendRow(StringBuilder out, List<String> row, int[] widths, String left, String right) {
        out.append(left).append(GAP);
        for (int j = 0; j < row.size(); j++) {
            String cell = row.get(j);
            out.append(cell);
            out.append(" ".repeat(widths[j] - StructureScanner.displayWidth(cell)));
            if (j < row.size() - 1) {
                out.append(GAP);
            }
        }
        out.append(GAP).append(right).append('\n');
    }
}
