package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.spi.ValueFormatter;
import com.chih.JPrint.core.support.StructureScanner;

import java.util.List;
import java.util.Optional;

/**
 * 行列式格式 {@code :d}
 * <p>
 * 只接受至少两行的方阵，每行都用 {@code │ │} 包裹；其他形状返回固定的说明文本，不抛出异常。
 * </p>
 *
 * @since 2026/10/19
 */
public class DeterminantFormatter implements ValueFormatter {

    static final String INVALID_MATRIX = "Determinant undefined (invalid matrix)";
    static final String NOT_SQUARE = "Determinant undefined (non-square or too small matrix)";

    private static final String BAR = "│";

    @Override
    public String format(ResolvedValue value, String spec, List<String> args) {
        return formatDebug(value.debug());
    }

    public String formatDebug(String debug) {
        Optional<List<List<String>>> parsed = StructureScanner.parseGrid(debug);
        if (parsed.isEmpty()) {
            return INVALID_MATRIX;
        }
        List<List<String>> grid = parsed.get();
        int size = grid.size();
        if (size < 2 || grid.stream().anyMatch(row -> row.size() != size)) {
            return NOT_SQUARE;
        }

        int[] widths = GridLayout.columnWidths(grid);
        StringBuilder out = new StringBuilder();
        for (List<String> row : grid) {
            GridLayout.appendRow(out, row, widths, BAR, BAR);
        }
        return out.toString();
    }
}
