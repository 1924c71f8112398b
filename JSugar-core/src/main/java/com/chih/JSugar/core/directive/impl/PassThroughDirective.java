package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;

/**
 * 由组件、插槽等后续阶段处理的属性（slot / bind / raw），指令阶段原样保留
 */
public class PassThroughDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.PASS_THROUGH;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        return node.getChildren();
    }
}
