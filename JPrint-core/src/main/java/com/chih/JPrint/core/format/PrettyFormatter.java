package com.chih.JPrint.core.format;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.spi.ValueFormatter;
import com.chih.JPrint.core.support.DebugRepresentation;

import java.util.List;

/**
 * 美化调试格式 {@code :j}，每个元素一行，四空格缩进
 */
public class PrettyFormatter implements ValueFormatter {

    @Override
    public String format(ResolvedValue value, String spec, List<String> args) {
        return DebugRepresentation.pretty(value.value());
    }
}
