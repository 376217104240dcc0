package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.spi.ValueFormatter;

import java.util.List;

/**
 * 紧凑调试格式 {@code :c}
 */
public class CompactFormatter implements ValueFormatter {

    @Override
    public String format(ResolvedValue value, String spec, List<String> args) {
        return value.debug();
    }
}
