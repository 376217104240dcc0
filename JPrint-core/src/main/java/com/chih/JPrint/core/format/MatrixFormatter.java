package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.spi.ValueFormatter;
import com.chih.JPrint.core.support.StructureScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 矩阵格式 {@code :m}
 * <p>
 * 单行矩阵使用 {@code ⦅ ⦆}；多行矩阵首行 {@code ⎛ ⎞}、末行 {@code ⎝ ⎠}、中间行 {@code │ │}。
 * 无法解析成网格时原样返回调试文本。
 * </p>
 *
 * @since 2026/10/19
 */
public class MatrixFormatter implements ValueFormatter {

    private static final Logger log = LoggerFactory.getLogger(MatrixFormatter.class);

    static final String EMPTY_MATRIX = "[Empty Matrix]";

    @Override
    public String format(ResolvedValue value, String spec, List<String> args) {
        return formatDebug(value.debug());
    }

    public String formatDebug(String debug) {
        Optional<List<List<String>>> parsed = StructureScanner.parseGrid(debug);
        if (parsed.isEmpty()) {
            log.warn("Value is not a bracketed sequence, matrix layout skipped: {}", debug);
            return debug;
        }
        List<List<String>> grid = parsed.get();
        if (grid.isEmpty()) {
            return EMPTY_MATRIX;
        }

        int[] widths = GridLayout.columnWidths(grid);
        StringBuilder out = new StringBuilder();
        int last = grid.size() - 1;
        for (int i = 0; i <= last; i++) {
            String left;
            String right;
            if (last == 0) {
                left = "⦅";
                right = "⦆";
            } else if (i == 0) {
                left = "⎛";
                right = "⎞";
            } else if (i == last) {
                left = "⎝";
                right = "⎠";
            } else {
                left = "│";
                right = "│";
            }
            GridLayout.appendRow(out, grid.get(i), widths, left, right);
        }
        return out.toString();
    }
}
