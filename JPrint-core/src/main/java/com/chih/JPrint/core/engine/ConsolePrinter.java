package com.chih.JPrint.core.engine;

import com.chih.JPrint.core.domain.ParsedTemplate;
import com.chih.JPrint.core.domain.SeparatorDirective;
import com.chih.JPrint.core.format.FormatterRegistry;
import com.chih.JPrint.core.impl.MapValueResolver;
import com.chih.JPrint.core.impl.NoOpRenderMetrics;
import com.chih.JPrint.core.impl.PrintStreamOutputSink;
import com.chih.JPrint.core.spi.OutputSink;
import com.chih.JPrint.core.spi.RenderMetrics;
import com.chih.JPrint.core.spi.ValueResolver;
import com.chih.JPrint.core.spi.ValueResolverFactory;
import com.chih.JPrint.core.support.TemplateLexer;
import com.chih.JPrint.core.support.ValueInspector;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 控制台打印门面
 * <p>
 * 一次调用的完整流程：剥离末尾分隔符指令 -> 词法分析 -> 渲染 -> 写出并 flush -> 写出分隔内容并 flush。
 * 每次调用都重新解析模板，调用之间没有共享的可变状态。
 * </p>
 *
 * <h3>分隔符指令 {@code $( ... )}：</h3>
 * <ul>
 *   <li>存在时不输出自动换行</li>
 *   <li>内容为裸标识符：按变量解析后输出其显示文本</li>
 *   <li>内容为 {@code ""} 或为空：不追加任何内容</li>
 *   <li>其他内容：按字面量原样输出</li>
 * </ul>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * ConsolePrinter printer = new ConsolePrinter();
 * printer.println("@(green, bold)Hello@() {name}!", Map.of("name", "JPrint"));
 * for (int i = 1; i < 10; i++) {
 *     printer.println("{i}$( - )", Map.of("i", i));
 * }
 * printer.println("10");
 * }</pre>
 *
 * @since 2026/10/19
 */
public class ConsolePrinter {

    private static final Pattern SGR_SEQUENCE = Pattern.compile("\u001B\\[[0-9;]*m");

    static final String INLINE_SOURCE = "inline";

    private final OutputSink sink;
    private final TemplateRenderer renderer;
    private final ValueResolverFactory resolverFactory;
    private final RenderMetrics metrics;
    private final boolean ansiEnabled;

    // 全参构造函数
    public ConsolePrinter(OutputSink sink, FormatterRegistry formatters, ValueResolverFactory resolverFactory,
                          RenderMetrics metrics, boolean ansiEnabled) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.renderer = new TemplateRenderer(formatters != null ? formatters : FormatterRegistry.withDefaults());
        this.resolverFactory = resolverFactory != null ? resolverFactory : MapValueResolver::new;
        this.metrics = metrics != null ? metrics : new NoOpRenderMetrics();
        this.ansiEnabled = ansiEnabled;
    }

    public ConsolePrinter(OutputSink sink) {
        this(sink, FormatterRegistry.withDefaults(), MapValueResolver::new, new NoOpRenderMetrics(), true);
    }

    public ConsolePrinter() {
        this(new PrintStreamOutputSink());
    }

    public void println(String template) {
        println(template, Collections.emptyMap());
    }

    public void println(String template, Map<String, ?> variables) {
        println(template, resolverFactory.create(variables));
    }

    public void println(String template, ValueResolver resolver) {
        print(INLINE_SOURCE, template, resolver);
    }

    public String render(String template) {
        return render(template, Collections.emptyMap());
    }

    public String render(String template, Map<String, ?> variables) {
        return render(template, resolverFactory.create(variables));
    }

    /**
     * 只渲染不输出：分隔符指令被剥离，返回值含样式码与末尾重置码（关闭 ANSI 时已去除）
     */
    public String render(String template, ValueResolver resolver) {
        return render(INLINE_SOURCE, template, resolver);
    }

    ValueResolver createResolver(Map<String, ?> variables) {
        return resolverFactory.create(variables);
    }

    void print(String source, String template, ValueResolver resolver) {
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            SeparatorDirective directive = SeparatorDirective.extract(template);
            ParsedTemplate parsed = TemplateLexer.parse(directive.template());
            String text = renderer.assemble(parsed.tokens(), resolver);
            sink.write(postProcess(text), !directive.present());
            if (directive.present()) {
                writeSeparator(directive, resolver);
            }
            success = true;
        } finally {
            metrics.recordRender(source, System.nanoTime() - startTime, success);
        }
    }

    String render(String source, String template, ValueResolver resolver) {
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            SeparatorDirective directive = SeparatorDirective.extract(template);
            ParsedTemplate parsed = TemplateLexer.parse(directive.template());
            String result = postProcess(renderer.assemble(parsed.tokens(), resolver));
            success = true;
            return result;
        } finally {
            metrics.recordRender(source, System.nanoTime() - startTime, success);
        }
    }

    private void writeSeparator(SeparatorDirective directive, ValueResolver resolver) {
        String content = directive.content();
        if (content.isEmpty() || directive.isEmptyLiteral()) {
            return;
        }
        String separator = directive.isVariable()
                ? ValueInspector.display(resolver.resolve(content).value())
                : content;
        sink.write(postProcess(separator), false);
    }

    private String postProcess(String text) {
        return ansiEnabled ? text : SGR_SEQUENCE.matcher(text).replaceAll("");
    }
}
