package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.OutputContext;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;

/**
 * text / html：用表达式的值替换元素内容。text 转义（具体上下文由上下文分析决定），html 原样输出。
 */
public class ContentDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTENT;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        String expression = requireExpression(node, context);
        boolean escape = !"html".equals(node.getName());
        OutputNode output = new OutputNode(expression, escape, escape ? OutputContext.HTML : OutputContext.RAW,
                node.getLine(), node.getColumn());
        output.inheritTemplatePathFrom(node);
        return List.of(output);
    }
}
