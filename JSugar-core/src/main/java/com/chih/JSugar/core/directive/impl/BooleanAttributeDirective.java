package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;
import com.chih.JSugar.core.support.AttributeHelper;

import java.util.List;

/**
 * checked / selected / disabled：条件成立时输出同名布尔属性
 */
public class BooleanAttributeDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.ATTRIBUTE;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        String condition = requireExpression(node, context);
        return List.of(code(HTML_ATTRIBUTES + ".booleanAttribute(" + AttributeHelper.javaLiteral(node.getName())
                + ", " + condition + ")", node));
    }
}
