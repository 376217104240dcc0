package com.chih.JPrint.core.engine;

import com.chih.JPrint.core.domain.ResolvedValue;
import com.chih.JPrint.core.domain.StyleChange;
import com.chih.JPrint.core.domain.StyleReset;
import com.chih.JPrint.core.domain.StyleVariable;
import com.chih.JPrint.core.domain.Text;
import com.chih.JPrint.core.domain.Token;
import com.chih.JPrint.core.domain.Variable;
import com.chih.JPrint.core.exception.JPrintException;
import com.chih.JPrint.core.exception.TemplateRenderException;
import com.chih.JPrint.core.format.FormatterRegistry;
import com.chih.JPrint.core.spi.OutputSink;
import com.chih.JPrint.core.spi.ValueFormatter;
import com.chih.JPrint.core.spi.ValueResolver;
import com.chih.JPrint.core.style.AnsiVocabulary;
import com.chih.JPrint.core.style.StyleEngine;
import com.chih.JPrint.core.support.ValueInspector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 渲染器：按顺序把 Token 序列拼装成一次输出
 * <p>
 * 样式是扁平的：每次切换都先输出重置码再输出新样式码，不做嵌套组合；
 * 全部 Token 处理完后无条件追加重置码，保证终端不会停留在带样式的状态。
 * </p>
 *
 * @since 2026/10/19
 */
public class TemplateRenderer {

    private final FormatterRegistry formatters;

    public TemplateRenderer(FormatterRegistry formatters) {
        this.formatters = Objects.requireNonNull(formatters, "formatters must not be null");
    }

    /**
     * 单次渲染的可变状态，不跨调用共享
     */
    private static final class RenderState {
        final StringBuilder buffer = new StringBuilder();

        void applyStyle(String code) {
            buffer.append(AnsiVocabulary.RESET).append(code);
        }

        void reset() {
            buffer.append(AnsiVocabulary.RESET);
        }
    }

    /**
     * 渲染并写出：写入后由输出端立即 flush
     *
     * @param noNewline 为 true 时不追加换行
     */
    public void render(List<Token> tokens, ValueResolver resolver, boolean noNewline, OutputSink sink) {
        sink.write(assemble(tokens, resolver), !noNewline);
    }

    /**
     * 只拼装文本（含样式码与末尾重置码），不写出
     */
    public String assemble(List<Token> tokens, ValueResolver resolver) {
        RenderState state = new RenderState();
        for (Token token : tokens) {
            if (token instanceof StyleChange change) {
                state.applyStyle(StyleEngine.ansiCode(change.specs()));
            } else if (token instanceof StyleVariable variable) {
                state.applyStyle(StyleEngine.ansiCode(styleTerms(resolver.resolve(variable.name()))));
            } else if (token instanceof StyleReset) {
                state.reset();
            } else if (token instanceof Text text) {
                state.buffer.append(text.content());
            } else if (token instanceof Variable variable) {
                state.buffer.append(formatVariable(variable, resolver));
            }
        }
        state.buffer.append(AnsiVocabulary.RESET);
        return state.buffer.toString();
    }

    /**
     * 样式变量的运行时值是逗号分隔的样式列表；序列值按元素逐项取用
     */
    private static List<String> styleTerms(ResolvedValue resolved) {
        List<Object> elements = ValueInspector.asList(resolved.value());
        if (elements == null) {
            return StyleEngine.splitStyleList(ValueInspector.display(resolved.value()));
        }
        List<String> terms = new ArrayList<>(elements.size());
        for (Object element : elements) {
            terms.addAll(StyleEngine.splitStyleList(ValueInspector.display(element)));
        }
        return terms;
    }

    private String formatVariable(Variable variable, ValueResolver resolver) {
        ResolvedValue resolved = resolver.resolve(variable.expr());
        ValueFormatter formatter = formatters.lookup(variable.format());
        try {
            return formatter.format(resolved, variable.format(), variable.formatArgs());
        } catch (JPrintException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TemplateRenderException(variable.expr(), e);
        }
    }
}
