package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.spi.ValueFormatter;
import com.chih.JPrint.core.style.AnsiVocabulary;
import com.chih.JPrint.core.style.StyleEngine;
import com.chih.JPrint.core.support.DebugRepresentation;
import com.chih.JPrint.core.support.ValueInspector;
import com.github.freva.asciitable.AsciiTable;
import com.github.freva.asciitable.Column;
import com.github.freva.asciitable.ColumnData;
import com.github.freva.asciitable.HorizontalAlign;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表格格式 {@code :t} / {@code :t(Header1, Header2, ...)}
 * <p>
 * 值先经 {@link ValueInspector} 归一化，再按形状选择列：
 * </p>
 * <ul>
 *   <li>扁平映射：{@code Key | Value}</li>
 *   <li>标量序列：{@code # | Value}（下标从 0 开始）</li>
 *   <li>映射 / record / bean 序列：所有键的并集，按首次出现顺序</li>
 *   <li>序列的序列：{@code 0 .. n-1}</li>
 *   <li>两层映射：{@code Key} + 内层键的并集</li>
 *   <li>三层映射：每个外层键一个分节，分节内是两层表格</li>
 *   <li>标量：单列 {@code Value}</li>
 * </ul>
 * 传入的表头按位置原样替换自动表头，多余的忽略，缺少的保留自动表头。
 * 分节标题使用 {@code bright_cyan, bold}；表头行在分节内为 {@code bold}，否则为 {@code bright_cyan, bold}。
 *
 * @since 2026/10/19
 */
public class TableFormatter implements ValueFormatter {

    private static final String SECTION_STYLE = StyleEngine.ansiCode("bright_cyan", "bold");
    private static final String HEADER_STYLE = StyleEngine.ansiCode("bright_cyan", "bold");
    private static final String NESTED_HEADER_STYLE = StyleEngine.ansiCode("bold");

    /**
     * FANCY_ASCII 边框下第 0 行是上边框，第 1 行是表头
     */
    private static final int HEADER_LINE = 1;

    /**
     * 列定义 + 行数据
     */
    private record Grid(List<String> headers, List<List<String>> rows) {
    }

    @Override
    public String format(ResolvedValue value, String spec, List<String> args) {
        List<String> headers = args == null ? List.of() : args;
        Object data = value.value();

        Map<Object, Object> map = ValueInspector.asMap(data);
        if (map != null && !map.isEmpty() && depthOf(map) >= 3) {
            return renderSections(map, headers);
        }
        return renderTable(gridOf(data), headers, HEADER_STYLE);
    }

    private String renderSections(Map<Object, Object> sections, List<String> headers) {
        StringBuilder out = new StringBuilder();
        for (Map.Entry<Object, Object> section : sections.entrySet()) {
            out.append(SECTION_STYLE).append(ValueInspector.display(section.getKey()))
                    .append(AnsiVocabulary.RESET).append('\n');
            out.append(renderTable(gridOf(section.getValue()), headers, NESTED_HEADER_STYLE)).append('\n');
        }
        // 末尾换行交给调用方
        return out.substring(0, out.length() - 1);
    }

    private String renderTable(Grid grid, List<String> supplied, String headerStyle) {
        List<ColumnData<List<String>>> columns = new ArrayList<>();
        for (int i = 0; i < grid.headers().size(); i++) {
            int index = i;
            String header = i < supplied.size() ? supplied.get(i) : grid.headers().get(i);
            columns.add(new Column().header(header)
                    .headerAlign(HorizontalAlign.LEFT)
                    .dataAlign(HorizontalAlign.LEFT)
                    .with((List<String> row) -> index < row.size() ? row.get(index) : ""));
        }
        String table = AsciiTable.getTable(AsciiTable.FANCY_ASCII, grid.rows(), columns);

        String[] lines = table.split("\\R", -1);
        if (lines.length > HEADER_LINE) {
            lines[HEADER_LINE] = headerStyle + lines[HEADER_LINE] + AnsiVocabulary.RESET;
        }
        return String.join("\n", lines);
    }

    private Grid gridOf(Object data) {
        Map<Object, Object> map = ValueInspector.asMap(data);
        if (map != null) {
            return depthOf(map) >= 2 ? nestedMapGrid(map) : flatMapGrid(map);
        }
        List<Object> list = ValueInspector.asList(data);
        if (list != null) {
            return listGrid(list);
        }
        return new Grid(List.of("Value"), List.of(List.of(cell(data))));
    }

    private Grid flatMapGrid(Map<Object, Object> map) {
        List<List<String>> rows = new ArrayList<>();
        map.forEach((key, value) -> rows.add(List.of(cell(key), cell(value))));
        return new Grid(List.of("Key", "Value"), rows);
    }

    private Grid nestedMapGrid(Map<Object, Object> map) {
        Set<Object> keys = new LinkedHashSet<>();
        List<Map<Object, Object>> inner = new ArrayList<>();
        for (Object value : map.values()) {
            Map<Object, Object> row = ValueInspector.asMap(value);
            inner.add(row);
            keys.addAll(row.keySet());
        }

        List<String> headers = new ArrayList<>();
        headers.add("Key");
        keys.forEach(key -> headers.add(ValueInspector.display(key)));

        List<List<String>> rows = new ArrayList<>();
        int i = 0;
        for (Object outerKey : map.keySet()) {
            Map<Object, Object> row = inner.get(i++);
            List<String> cells = new ArrayList<>();
            cells.add(cell(outerKey));
            for (Object key : keys) {
                cells.add(row.containsKey(key) ? cell(row.get(key)) : "");
            }
            rows.add(cells);
        }
        return new Grid(headers, rows);
    }

    private Grid listGrid(List<Object> list) {
        if (!list.isEmpty() && list.stream().allMatch(e -> ValueInspector.asMap(e) != null)) {
            List<Map<Object, Object>> records = new ArrayList<>();
            Set<Object> keys = new LinkedHashSet<>();
            for (Object element : list) {
                Map<Object, Object> record = ValueInspector.asMap(element);
                records.add(record);
                keys.addAll(record.keySet());
            }
            List<String> headers = new ArrayList<>();
            keys.forEach(key -> headers.add(ValueInspector.display(key)));
            List<List<String>> rows = new ArrayList<>();
            for (Map<Object, Object> record : records) {
                List<String> cells = new ArrayList<>();
                for (Object key : keys) {
                    cells.add(record.containsKey(key) ? cell(record.get(key)) : "");
                }
                rows.add(cells);
            }
            return new Grid(headers, rows);
        }

        // 元素全是空序列时没有列可言，退回 # | Value
        if (!list.isEmpty() && list.stream().allMatch(e -> ValueInspector.asList(e) != null)
                && list.stream().anyMatch(e -> !ValueInspector.asList(e).isEmpty())) {
            List<List<String>> rows = new ArrayList<>();
            int width = 0;
            for (Object element : list) {
                List<String> cells = new ArrayList<>();
                for (Object item : ValueInspector.asList(element)) {
                    cells.add(cell(item));
                }
                width = Math.max(width, cells.size());
                rows.add(cells);
            }
            List<String> headers = new ArrayList<>();
            for (int i = 0; i < width; i++) {
                headers.add(String.valueOf(i));
            }
            return new Grid(headers, rows);
        }

        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            rows.add(List.of(String.valueOf(i), cell(list.get(i))));
        }
        return new Grid(List.of("#", "Value"), rows);
    }

    /**
     * 映射嵌套层数：所有值都是映射类时加一层
     */
    private static int depthOf(Map<Object, Object> map) {
        if (map.isEmpty()) {
            return 1;
        }
        int innerDepth = Integer.MAX_VALUE;
        for (Object value : map.values()) {
            Map<Object, Object> inner = ValueInspector.asMap(value);
            if (inner == null) {
                return 1;
            }
            innerDepth = Math.min(innerDepth, depthOf(inner));
        }
        return 1 + innerDepth;
    }

    private static String cell(Object value) {
        return ValueInspector.isScalar(value) ? ValueInspector.display(value) : DebugRepresentation.compact(value);
    }
}
