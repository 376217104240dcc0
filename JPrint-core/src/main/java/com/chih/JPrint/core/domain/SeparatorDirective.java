package com.chih.JPrint.core.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模板末尾的分隔符指令 {@code $( ... )}
 * <p>
 * 存在该指令时：从模板中剥离、抑制自动换行，主体输出之后再输出分隔内容。
 * 内容是裸标识符则按变量解析，否则按字面量原样输出；
 * 字面量 {@code ""} 只用于抑制换行，不追加任何内容。
 * </p>
 *
 * @param template 剥离指令后的模板
 * @param content  指令内容；模板不以指令结尾时为 null
 */
public record SeparatorDirective(String template, String content) {

    // \z 而不是 $：指令后面跟着换行符时不算末尾
    private static final Pattern TRAILING_SEPARATOR = Pattern.compile("\\$\\(([^)]*)\\)\\z");
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final String EMPTY_LITERAL = "\"\"";

    public static SeparatorDirective extract(String template) {
        if (template == null) {
            return new SeparatorDirective("", null);
        }
        Matcher matcher = TRAILING_SEPARATOR.matcher(template);
        if (!matcher.find()) {
            return new SeparatorDirective(template, null);
        }
        return new SeparatorDirective(template.substring(0, matcher.start()), matcher.group(1));
    }

    public boolean present() {
        return content != null;
    }

    /**
     * 是否需要按变量解析分隔内容
     */
    public boolean isVariable() {
        return content != null && IDENTIFIER.matcher(content).matches();
    }

    /**
     * 是否为仅抑制换行的 {@code ""}
     */
    public boolean isEmptyLiteral() {
        return EMPTY_LITERAL.equals(content);
    }

    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches();
    }
}
