package com.chih.JSugar.core.exception;

/**
 * 模板错误基类
 * <p>
 * 携带可选的模板路径、行号、列号。位置信息可以在构造之后通过 {@link #withLocation} 补充，
 * 补充后 {@link #getMessage()} 会追加 {@code (template: path line:N column:N)} 后缀，
 * 而 {@link #getRawMessage()} 始终返回未加工的原始消息。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public abstract class TemplateException extends JSugarException {

    private final String rawMessage;

    private String templatePath;
    private Integer templateLine;
    private Integer templateColumn;
    private String snippet;

    protected TemplateException(String message) {
        super(message);
        this.rawMessage = message;
    }

    protected TemplateException(String message, Throwable cause) {
        super(message, cause);
        this.rawMessage = message;
    }

    /**
     * 附加模板位置信息，返回自身以便链式调用：
     * <pre>{@code
     * throw new SyntaxException("Bad token").withLocation("page.sugar.html", 10, 5);
     * }</pre>
     */
    public TemplateException withLocation(String templatePath, Integer line, Integer column) {
        this.templatePath = templatePath;
        this.templateLine = line;
        this.templateColumn = column;
        return this;
    }

    /**
     * 附加出错位置附近的模板源码片段（调试模式），不影响 {@link #getMessage()}
     */
    public TemplateException withSnippet(String snippet) {
        this.snippet = snippet;
        return this;
    }

    /**
     * 是否已经附加过位置信息
     */
    public boolean hasLocation() {
        return templatePath != null || templateLine != null;
    }

    @Override
    public String getMessage() {
        return formatMessage(rawMessage);
    }

    public String getRawMessage() {
        return rawMessage;
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public Integer getTemplateLine() {
        return templateLine;
    }

    public Integer getTemplateColumn() {
        return templateColumn;
    }

    /**
     * @return 带行号和列指示符的源码片段，没有时为 null
     */
    public String getSnippet() {
        return snippet;
    }

    private String formatMessage(String message) {
        if (templatePath == null) {
            return message;
        }

        StringBuilder location = new StringBuilder("template: ").append(templatePath);
        if (templateLine != null) {
            location.append(" line:").append(templateLine);
        }
        if (templateColumn != null && templateColumn > 0) {
            location.append(" column:").append(templateColumn);
        }

        return message + " (" + location + ")";
    }
}
