package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;

/**
 * 值不为 null 时渲染
 */
public class IssetDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        return wrap(node, "if (" + VALUES + ".isSet(" + requireExpression(node, context) + ")) {", "}");
    }
}
