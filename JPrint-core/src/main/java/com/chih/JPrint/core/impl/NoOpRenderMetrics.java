package com.chih.JPrint.core.impl;

import com.chih.JPrint.core.spi.RenderMetrics;

public class NoOpRenderMetrics implements RenderMetrics {
    @Override
    public void recordRender(String source, long durationNs, boolean success) {
        // Do nothing
    }
}
