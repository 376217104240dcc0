package com.chih.JPrint.core.spi;

/**
 * 监控指标 SPI 接口
 */
public interface RenderMetrics {

    /**
     * 记录一次渲染
     *
     * @param source     调用来源（"inline" 或 Mapper 的 "接口#方法"）
     * @param durationNs 耗时 (纳秒)
     * @param success    是否成功
     */
    void recordRender(String source, long durationNs, boolean success);
}
