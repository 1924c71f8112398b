package com.chih.JSugar.core.compiler;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.ast.AttributeValue;
import com.chih.JSugar.core.ast.AttributedNode;
import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.ast.ParentNode;
import com.chih.JSugar.core.exception.SyntaxException;
import com.chih.JSugar.core.exception.TemplateException;
import com.chih.JSugar.core.support.SourceSnippet;

/**
 * 单次编译的上下文：模板路径、源码以及调试开关，并负责构造带位置的语法错误。
 * 调试模式下错误会附带出错位置附近的源码片段。
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public class CompilationContext {

    private final String templatePath;
    private final String source;
    private final boolean debug;

    public CompilationContext(String templatePath, String source, boolean debug) {
        this.templatePath = templatePath;
        this.source = source;
        this.debug = debug;
    }

    public CompilationContext(String templatePath, String source) {
        this(templatePath, source, false);
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public String getSource() {
        return source;
    }

    public boolean isDebug() {
        return debug;
    }

    public SyntaxException syntaxError(String message, Integer line, Integer column) {
        return located(message, templatePath, line, column);
    }

    /**
     * 以节点位置构造语法错误，节点自带模板路径时优先使用
     */
    public SyntaxException syntaxErrorForNode(String message, Node node) {
        return syntaxErrorForNode(message, node, node.getLine(), node.getColumn());
    }

    public SyntaxException syntaxErrorForNode(String message, Node node, Integer line, Integer column) {
        String path = node.getTemplatePath() != null ? node.getTemplatePath() : templatePath;
        return located(message, path, line, column);
    }

    public SyntaxException syntaxErrorForAttribute(String message, AttributeNode attribute) {
        return syntaxErrorForAttribute(message, attribute, attribute.getLine(), attribute.getColumn());
    }

    public SyntaxException syntaxErrorForAttribute(String message, AttributeNode attribute, Integer line,
                                                   Integer column) {
        String path = attribute.getTemplatePath() != null ? attribute.getTemplatePath() : templatePath;
        return located(message, path, line, column);
    }

    /**
     * 调试模式下为已定位的错误附加源码片段；已有片段、缺少行列号或没有源码时原样返回
     */
    public <E extends TemplateException> E withSnippet(E error) {
        if (!debug || error.getSnippet() != null || error.getTemplateLine() == null
                || error.getTemplateColumn() == null) {
            return error;
        }

        String snippet = SourceSnippet.generate(source, error.getTemplateLine(), error.getTemplateColumn());
        if (!snippet.isEmpty()) {
            error.withSnippet(snippet);
        }
        return error;
    }

    private SyntaxException located(String message, String path, Integer line, Integer column) {
        return withSnippet(new SyntaxException(message).withLocation(path, line, column));
    }

    /**
     * 为整棵树（包括属性）标记当前模板路径
     */
    public void stampTemplatePath(DocumentNode document) {
        stampTemplatePath(document, templatePath);
    }

    public void stampTemplatePath(DocumentNode document, String path) {
        stamp(document, path);
    }

    private void stamp(Node node, String path) {
        node.setTemplatePath(path);

        if (node instanceof AttributedNode attributed) {
            for (AttributeNode attribute : attributed.getAttributes()) {
                attribute.setTemplatePath(path);
                AttributeValue value = attribute.getValue();
                if (value.isOutput()) {
                    value.getOutput().setTemplatePath(path);
                } else if (value.isParts()) {
                    for (Object part : value.getParts()) {
                        if (part instanceof OutputNode output) {
                            output.setTemplatePath(path);
                        }
                    }
                }
            }
        }

        if (node instanceof ParentNode parent) {
            for (Node child : parent.getChildren()) {
                stamp(child, path);
            }
        }
    }
}
