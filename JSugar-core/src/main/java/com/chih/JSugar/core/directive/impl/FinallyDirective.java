package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;

/**
 * finally 分支，由前面的 {@link TryDirective} 消费
 */
public class FinallyDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        throw context.syntaxErrorForNode("The \"finally\" directive must follow a \"try\" directive", node);
    }
}
