package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * PrimitiveFormatter 单元测试
 */
@DisplayName("PrimitiveFormatter 测试")
class PrimitiveFormatterTest {

    private final PrimitiveFormatter formatter = new PrimitiveFormatter();

    private String format(Object value, String spec) {
        return formatter.format(ResolvedValue.of(value), spec, null);
    }

    @Test
    @DisplayName("无说明符时输出显示文本")
    void testNoSpec() {
        assertThat(format("plain", null)).isEqualTo("plain");
        assertThat(format(List.of(1, 2), null)).isEqualTo("[1, 2]");
        assertThat(format(new int[]{1, 2}, null)).isEqualTo("[1, 2]");
        assertThat(format(null, null)).isEqualTo("null");
    }

    @Test
    @DisplayName("完整说明符透传给 Formatter")
    void testExplicitConversion() {
        assertThat(format(3.14159, ".2f")).isEqualTo("3.14");
        assertThat(format(42, "04d")).isEqualTo("0042");
        assertThat(format(255, "x")).isEqualTo("ff");
        assertThat(format(255, "#X")).isEqualTo("0XFF");
        assertThat(format("abc", "-5s")).isEqualTo("abc  ");
        assertThat(format(1234567, ",d")).isEqualTo("1,234,567");
        assertThat(format(5, "+d")).isEqualTo("+5");
    }

    @Test
    @DisplayName("整数配合 b 输出二进制，其他值仍是布尔转换")
    void testBinary() {
        assertThat(format(5, "b")).isEqualTo("101");
        assertThat(format(5, "08b")).isEqualTo("00000101");
        assertThat(format(5, "#b")).isEqualTo("0b101");
        assertThat(format(5, "#08b")).isEqualTo("0b000101");
        assertThat(format(5, "-6b")).isEqualTo("101   ");
        assertThat(format((byte) -1, "b")).isEqualTo("11111111");
        assertThat(format(true, "b")).isEqualTo("true");
    }

    @Test
    @DisplayName("缺少转换符时按类型推断")
    void testInferredConversion() {
        assertThat(format(42, "5")).isEqualTo("   42");
        assertThat(format(2.5, ".3")).isEqualTo("2.500");
        assertThat(format('x', "3")).isEqualTo("  x");
        assertThat(format("ab", "4")).isEqualTo("  ab");
        assertThat(format(List.of(1), "6")).isEqualTo("   [1]");
    }

    @Test
    @DisplayName("不适用或无法识别的说明符退化为显示文本")
    void testLenientFallback() {
        assertThat(format("abc", "d")).isEqualTo("abc");
        assertThat(format(1, "???")).isEqualTo("1");
        assertThat(format(7, ".2")).isEqualTo("7");
    }
}
