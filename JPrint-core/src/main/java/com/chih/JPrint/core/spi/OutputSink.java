package com.chih.JPrint.core.spi;

/**
 * 输出端 SPI 接口
 * <p>
 * 每次调用必须完成"写入 + 立即 flush"，保证多次调用严格按调用顺序交错输出
 * （同一行上由多次调用拼出的进度输出依赖这一点）。
 * </p>
 *
 * @since 2026/10/19
 */
@FunctionalInterface
public interface OutputSink {

    /**
     * 写出一段完整文本
     *
     * @param text    已组装完成的文本
     * @param newline 是否追加行终止符
     * @throws com.chih.JPrint.core.exception.OutputSinkException 写入或 flush 失败时
     */
    void write(String text, boolean newline);
}
