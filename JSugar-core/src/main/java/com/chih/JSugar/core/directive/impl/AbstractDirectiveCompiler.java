package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.HostCodeNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.TextNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveCompiler;

import java.util.ArrayList;
import java.util.List;

/**
 * 内置指令的公共基类，提供宿主代码节点构造与表达式校验
 *
 * @author lizhiyuan
 * @since 2026/01/15
 */
public abstract class AbstractDirectiveCompiler implements DirectiveCompiler {

    protected static final String VALUES = "com.chih.JSugar.runtime.Values";
    protected static final String HTML_ATTRIBUTES = "com.chih.JSugar.runtime.HtmlAttributes";
    protected static final String HTML_TAGS = "com.chih.JSugar.runtime.HtmlTags";

    /**
     * 创建继承来源节点位置与模板路径的宿主代码
     */
    protected HostCodeNode code(String code, Node origin) {
        HostCodeNode node = new HostCodeNode(code, origin.getLine(), origin.getColumn());
        node.inheritTemplatePathFrom(origin);
        return node;
    }

    /**
     * @return 去除首尾空白的表达式
     * @throws com.chih.JSugar.core.exception.SyntaxException 表达式为空
     */
    protected String requireExpression(DirectiveNode node, CompilationContext context) {
        String expression = node.getExpression() == null ? "" : node.getExpression().trim();
        if (expression.isEmpty()) {
            throw context.syntaxErrorForNode("The \"" + node.getName() + "\" directive requires an expression", node);
        }
        return expression;
    }

    /**
     * open + 子节点 + close
     */
    protected List<Node> wrap(DirectiveNode node, String open, String close) {
        List<Node> parts = new ArrayList<>(node.getChildren().size() + 2);
        parts.add(code(open, node));
        parts.addAll(node.getChildren());
        parts.add(code(close, node));
        return parts;
    }

    protected static boolean isBlankText(Node node) {
        return node instanceof TextNode text && text.getContent().isBlank();
    }
}
