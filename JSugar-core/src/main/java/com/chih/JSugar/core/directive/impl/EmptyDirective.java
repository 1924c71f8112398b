package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;

/**
 * empty / notempty，空值判断规则见 {@code Values.isEmpty}
 * <p>
 * 作为 forelse 的后继时由 {@link ForelseDirective} 编译。
 * </p>
 */
public class EmptyDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        String check = VALUES + ".isEmpty(" + requireExpression(node, context) + ")";
        String condition = "notempty".equals(node.getName()) ? "!" + check : check;
        return wrap(node, "if (" + condition + ") {", "}");
    }
}
