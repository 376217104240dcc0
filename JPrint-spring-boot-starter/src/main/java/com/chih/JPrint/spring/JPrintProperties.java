package com.chih.JPrint.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 控制台输出配置
 *
 * @since 2026/10/19
 */
@ConfigurationProperties(prefix = "j-print")
public class JPrintProperties {

    /**
     * 是否输出 ANSI 样式码
     * 输出重定向到文件或 CI 日志时可关闭，关闭后所有 SGR 序列会被去除
     */
    private boolean ansiEnabled = true;

    /**
     * 输出目标流
     */
    private Target target = Target.STDOUT;

    /**
     * 是否使用 SpEL 解析模板表达式
     * 关闭后只支持变量路径（name、name.prop、name[0]）
     */
    private boolean expressionLanguage = true;

    public enum Target {
        STDOUT,
        STDERR
    }

    public boolean isAnsiEnabled() {
        return ansiEnabled;
    }

    public void setAnsiEnabled(boolean ansiEnabled) {
        this.ansiEnabled = ansiEnabled;
    }

    public Target getTarget() {
        return target;
    }

    public void setTarget(Target target) {
        this.target = target;
    }

    public boolean isExpressionLanguage() {
        return expressionLanguage;
    }

    public void setExpressionLanguage(boolean expressionLanguage) {
        this.expressionLanguage = expressionLanguage;
    }
}
