package com.chih.JSugar.core.ast;

/**
 * 动态表达式的转义上下文
 */
public enum OutputContext {
    HTML,
    HTML_ATTRIBUTE,
    JAVASCRIPT,
    CSS,
    URL,
    JSON,
    JSON_ATTRIBUTE,
    RAW;

    /**
     * JSON 系列上下文是显式固定的，上下文分析不会改写
     */
    public boolean isJsonFamily() {
        return this == JSON || this == JSON_ATTRIBUTE;
    }
}
