package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.ArrayList;
import java.util.List;

/**
 * try 块：有后继 finally 时生成 try/finally，否则吞掉块内的运行时异常，块内输出被丢弃
 */
public class TryDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<String> getPairingDirectives() {
        return List.of("finally");
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        List<Node> parts = new ArrayList<>();
        parts.add(code("try {", node));
        parts.addAll(node.getChildren());

        DirectiveNode paired = node.getPairedSibling();
        if (paired != null) {
            parts.add(code("} finally {", paired));
            parts.addAll(paired.getChildren());
            parts.add(code("}", node));
            return parts;
        }

        parts.add(code("} catch (RuntimeException __ignored) {", node));
        parts.add(code("}", node));
        return parts;
    }
}
