package com.chih.JPrint.core.support;

import com.chih.JPrint.core.domain.ParsedTemplate;
import com.chih.JPrint.core.domain.SeparatorDirective;
import com.chih.JPrint.core.domain.StyleChange;
import com.chih.JPrint.core.domain.StyleReset;
import com.chih.JPrint.core.domain.StyleVariable;
import com.chih.JPrint.core.domain.Text;
import com.chih.JPrint.core.domain.Token;
import com.chih.JPrint.core.domain.Variable;
import com.chih.JPrint.core.style.AnsiVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模板词法分析器
 * <p>
 * 基于位置的宽松扫描，没有形式文法：
 * </p>
 * <ol>
 *   <li>扫描所有样式标记 {@code @( CONTENT )}（非贪婪、不支持嵌套括号），按优先级分类：
 *       空内容 -> 重置；{@code {name}} -> 插值样式变量；任一项为已知颜色/样式 -> 字面样式；
 *       否则 -> 样式变量</li>
 *   <li>扫描所有变量标记 {@code { EXPR (: FORMAT (( ARGS ))?)? }}，位于样式标记内部的跳过</li>
 *   <li>两类标记按起始位置合并，标记之间的片段生成 {@link Text}</li>
 * </ol>
 * 不匹配或不平衡的标记不会报错，只会作为普通文本保留。
 *
 * @since 2026/10/19
 */
public class TemplateLexer {

    private static final Logger log = LoggerFactory.getLogger(TemplateLexer.class);

    private static final Pattern STYLE_MARKER = Pattern.compile("@\\(([^)]*)\\)");

    private static final Pattern VARIABLE_MARKER = Pattern.compile("\\{([^{}]+?)(?::([^{}]+))?}");

    private static final Pattern FORMAT_WITH_ARGS = Pattern.compile("^([^()]*)\\((.*)\\)$", Pattern.DOTALL);

    private static final Pattern INTERPOLATION = Pattern.compile("^\\{([^{}]+)}$");

    private TemplateLexer() {
        // Static utility class
    }

    /**
     * 源位置上的一个标记
     */
    private record Marker(int start, int end, Token token) {
    }

    /**
     * 解析模板
     *
     * @param template 模板字符串（分隔符指令应已剥离）
     * @return Token 序列与引用到的标识符集合
     */
    public static ParsedTemplate parse(String template) {
        if (template == null || template.isEmpty()) {
            return new ParsedTemplate(List.of(), Set.of());
        }

        Set<String> usedIdentifiers = new LinkedHashSet<>();
        List<Marker> styleMarkers = scanStyleMarkers(template, usedIdentifiers);
        List<Marker> variableMarkers = scanVariableMarkers(template, styleMarkers, usedIdentifiers);

        List<Marker> markers = new ArrayList<>(styleMarkers.size() + variableMarkers.size());
        markers.addAll(styleMarkers);
        markers.addAll(variableMarkers);
        markers.sort(Comparator.comparingInt(Marker::start));

        List<Token> tokens = new ArrayList<>(markers.size() * 2 + 1);
        int lastPos = 0;
        for (Marker marker : markers) {
            if (marker.start() > lastPos) {
                tokens.add(new Text(template.substring(lastPos, marker.start())));
            }
            tokens.add(marker.token());
            lastPos = marker.end();
        }
        if (lastPos < template.length()) {
            tokens.add(new Text(template.substring(lastPos)));
        }

        log.debug("Parsed template into {} tokens ({} style markers, {} variables)",
                tokens.size(), styleMarkers.size(), variableMarkers.size());
        return new ParsedTemplate(tokens, usedIdentifiers);
    }

    private static List<Marker> scanStyleMarkers(String template, Set<String> usedIdentifiers) {
        List<Marker> markers = new ArrayList<>();
        Matcher matcher = STYLE_MARKER.matcher(template);
        while (matcher.find()) {
            Token token = classifyStyle(matcher.group(1), usedIdentifiers);
            if (token == null) {
                // 无法识别的样式标记原样保留，同时占住位置，内部的花括号不再当作变量
                token = new Text(matcher.group());
            }
            markers.add(new Marker(matcher.start(), matcher.end(), token));
        }
        return markers;
    }

    /**
     * 样式内容分类，优先级固定：重置 > 插值 > 已知项 > 样式变量
     *
     * @return 对应的 Token；插值写法的变量名为空（如 {@code @({ })}）时返回 null
     */
    static Token classifyStyle(String content, Set<String> usedIdentifiers) {
        if (content.isEmpty()) {
            return new StyleReset();
        }

        String trimmed = content.trim();
        Matcher interpolation = INTERPOLATION.matcher(trimmed);
        if (interpolation.matches()) {
            String name = interpolation.group(1).trim();
            if (name.isEmpty()) {
                return null;
            }
            usedIdentifiers.add(name);
            return new StyleVariable(name);
        }

        List<String> terms = splitTerms(content);
        if (terms.stream().anyMatch(AnsiVocabulary::isKnownTerm)) {
            return new StyleChange(terms);
        }

        if (trimmed.isEmpty()) {
            // 只有空白：没有可识别的项也没有变量名
            return new StyleChange(terms);
        }
        return new StyleVariable(trimmed);
    }

    private static List<Marker> scanVariableMarkers(String template, List<Marker> styleMarkers,
            Set<String> usedIdentifiers) {
        List<Marker> markers = new ArrayList<>();
        Matcher matcher = VARIABLE_MARKER.matcher(template);
        while (matcher.find()) {
            if (insideStyleMarker(matcher.start(), matcher.end(), styleMarkers)) {
                // @({name}) 已作为样式变量消费
                continue;
            }

            String expr = matcher.group(1);
            String format = matcher.group(2);
            List<String> formatArgs = null;
            if (format != null) {
                Matcher withArgs = FORMAT_WITH_ARGS.matcher(format);
                if (withArgs.matches()) {
                    format = withArgs.group(1).trim();
                    String args = withArgs.group(2);
                    formatArgs = args.isBlank() ? List.of() : splitTerms(args);
                }
            }

            if (SeparatorDirective.isIdentifier(expr)) {
                usedIdentifiers.add(expr);
            }
            markers.add(new Marker(matcher.start(), matcher.end(), new Variable(expr, format, formatArgs)));
        }
        return markers;
    }

    private static boolean insideStyleMarker(int start, int end, List<Marker> styleMarkers) {
        for (Marker style : styleMarkers) {
            if (start < style.end() && end > style.start()) {
                return true;
            }
        }
        return false;
    }

    private static List<String> splitTerms(String content) {
        List<String> terms = new ArrayList<>();
        for (String part : content.split(",", -1)) {
            terms.add(part.trim());
        }
        return terms;
    }
}
