package com.chih.JSugar.core.exception;

/**
 * 模板语法错误：指令用法不正确、属性组合非法、未知指令等。
 * 只能由模板作者修正模板来恢复。
 */
public class SyntaxException extends TemplateException {
    public SyntaxException(String message) {
        super(message);
    }

    public SyntaxException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public SyntaxException withLocation(String templatePath, Integer line, Integer column) {
        super.withLocation(templatePath, line, column);
        return this;
    }

    @Override
    public SyntaxException withSnippet(String snippet) {
        super.withSnippet(snippet);
        return this;
    }
}
