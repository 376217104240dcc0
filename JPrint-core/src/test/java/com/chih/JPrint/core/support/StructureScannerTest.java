package com.chih.JPrint.core.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * StructureScanner 单元测试（重点是引号感知）
 */
@DisplayName("StructureScanner 测试")
class StructureScannerTest {

    @Test
    @DisplayName("嵌套深度")
    void testNestingDepth() {
        assertThat(StructureScanner.nestingDepth("42")).isZero();
        assertThat(StructureScanner.nestingDepth("[1, 2]")).isEqualTo(1);
        assertThat(StructureScanner.nestingDepth("[[1], [2, [3]]]")).isEqualTo(3);
    }

    @Test
    @DisplayName("引号内的方括号不计入深度")
    void testQuotedBracketsIgnored() {
        assertThat(StructureScanner.nestingDepth("[\"[[x]]\", \"]\"]")).isEqualTo(1);
        assertThat(StructureScanner.nestingDepth("['[', ']']")).isEqualTo(1);
        assertThat(StructureScanner.nestingDepth("[\"a\\\"[\"]")).isEqualTo(1);
    }

    @Test
    @DisplayName("裸标量里的撇号不开启引号")
    void testApostropheInBareScalar() {
        assertThat(StructureScanner.nestingDepth("[[it's], [[x]]]")).isEqualTo(3);
        assertThat(StructureScanner.splitTopLevel("/tmp/it's, [a, b], '\\''"))
                .containsExactly("/tmp/it's", "[a, b]", "'\\''");
        assertThat(StructureScanner.parseGrid("[[it's, 1], [x, 2]]"))
                .hasValue(List.of(List.of("it's", "1"), List.of("x", "2")));
    }

    @Test
    @DisplayName("顶层逗号切分跳过嵌套与引号")
    void testSplitTopLevel() {
        assertThat(StructureScanner.splitTopLevel("1, [2, 3], \"a, b\", {k: 1, j: 2}"))
                .containsExactly("1", "[2, 3]", "\"a, b\"", "{k: 1, j: 2}");
        assertThat(StructureScanner.splitTopLevel("  ")).isEmpty();
    }

    @Test
    @DisplayName("解析网格")
    void testParseGrid() {
        assertThat(StructureScanner.parseGrid("[[4, 3], [2, 1]]"))
                .hasValue(List.of(List.of("4", "3"), List.of("2", "1")));
        assertThat(StructureScanner.parseGrid("[[\"x]\", \"y,z\"]]"))
                .hasValue(List.of(List.of("\"x]\"", "\"y,z\"")));
        assertThat(StructureScanner.parseGrid("[]")).hasValue(List.of());
        assertThat(StructureScanner.parseGrid("not a grid")).isEmpty();
    }

    @Test
    @DisplayName("显示宽度按 code point 计数")
    void testDisplayWidth() {
        assertThat(StructureScanner.displayWidth("abc")).isEqualTo(3);
        assertThat(StructureScanner.displayWidth("😀")).isEqualTo(1);
    }
}
