package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.style.AnsiVocabulary;
import com.chih.JPrint.core.style.StyleEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * TableFormatter 单元测试
 * <p>
 * 边框字符由 ascii-table 决定，这里只校验表头、单元格内容与着色。
 * </p>
 */
@DisplayName("TableFormatter 测试")
class TableFormatterTest {

    private static final String HEADER_STYLE = StyleEngine.ansiCode("bright_cyan", "bold");
    private static final String NESTED_HEADER_STYLE = StyleEngine.ansiCode("bold");

    record Person(String name, int age) {
    }

    private final TableFormatter formatter = new TableFormatter();

    private String format(Object value, List<String> headers) {
        return formatter.format(ResolvedValue.of(value), "t", headers);
    }

    private static String headerLine(String table) {
        return table.split("\n")[1];
    }

    @Test
    @DisplayName("扁平映射：Key | Value，表头行着色")
    void testFlatMap() {
        Map<String, Integer> stock = new LinkedHashMap<>();
        stock.put("apple", 3);
        stock.put("pear", 15);

        String table = format(stock, null);

        assertThat(headerLine(table))
                .startsWith(HEADER_STYLE)
                .endsWith(AnsiVocabulary.RESET)
                .contains("Key", "Value");
        assertThat(table).contains("apple", "pear", "15");
        assertThat(table.indexOf("apple")).isLessThan(table.indexOf("pear"));
    }

    @Test
    @DisplayName("传入表头按位置原样替换")
    void testSuppliedHeaders() {
        String table = format(Map.of("apple", 3), List.of("Fruit", "Count", "Ignored"));

        assertThat(headerLine(table)).contains("Fruit", "Count").doesNotContain("Key", "Ignored");
    }

    @Test
    @DisplayName("部分表头：缺少的保留自动表头")
    void testPartialHeaders() {
        String table = format(Map.of("apple", 3), List.of("Fruit"));

        assertThat(headerLine(table)).contains("Fruit", "Value");
    }

    @Test
    @DisplayName("标量序列：# | Value，下标从 0 开始")
    void testScalarSequence() {
        String table = format(List.of("x", "y"), null);

        assertThat(headerLine(table)).contains("#", "Value");
        assertThat(table).contains("0", "x", "1", "y");
        assertThat(table).doesNotContain("\"x\"");
    }

    @Test
    @DisplayName("空序列组成的序列没有列，退回 # | Value")
    void testSequenceOfEmptySequences() {
        String table = format(List.of(List.of(), List.of()), null);

        assertThat(headerLine(table)).contains("#", "Value");
        assertThat(table).contains("0", "1", "[]");
    }

    @Test
    @DisplayName("record 序列：每个组件一列")
    void testRecordSequence() {
        String table = format(List.of(new Person("Ann", 31), new Person("Bob", 27)), null);

        assertThat(headerLine(table)).contains("name", "age");
        assertThat(table).contains("Ann", "31", "Bob", "27");
    }

    @Test
    @DisplayName("两层映射：Key + 内层键并集")
    void testTwoLevelMap() {
        Map<String, Map<String, Integer>> scores = new LinkedHashMap<>();
        scores.put("Ann", Map.of("math", 90));
        scores.put("Bob", Map.of("art", 70));

        String table = format(scores, null);

        assertThat(headerLine(table)).contains("Key", "math", "art");
        assertThat(table).contains("Ann", "90", "Bob", "70");
    }

    @Test
    @DisplayName("三层映射：每个外层键一个分节")
    void testThreeLevelSections() {
        Map<String, Map<String, Map<String, Integer>>> years = new LinkedHashMap<>();
        years.put("2024", Map.of("Ann", Map.of("math", 90)));
        years.put("2025", Map.of("Bob", Map.of("math", 75)));

        String table = format(years, null);

        assertThat(table).startsWith(HEADER_STYLE + "2024" + AnsiVocabulary.RESET + "\n");
        assertThat(table).contains(HEADER_STYLE + "2025" + AnsiVocabulary.RESET + "\n");
        assertThat(table).contains(NESTED_HEADER_STYLE);
        assertThat(table).contains("Ann", "Bob", "90", "75");
        assertThat(table).doesNotEndWith("\n");
    }

    @Test
    @DisplayName("标量值：单列 Value")
    void testScalar() {
        String table = format(42, null);

        assertThat(headerLine(table)).contains("Value");
        assertThat(table).contains("42");
    }
}
