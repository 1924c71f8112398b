package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;

/**
 * else 分支，只能作为 if 链的结尾，由领头的 {@link IfDirective} 编译
 */
public class ElseDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        throw context.syntaxErrorForNode("The \"else\" directive must follow an \"if\" or \"elseif\" directive", node);
    }
}
