package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 带空集合分支的循环，后继的 empty 指令在集合为空时渲染
 */
public class ForelseDirective extends ForeachDirective {

    @Override
    public List<String> getPairingDirectives() {
        return List.of("empty");
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        Loop loop = parse(node, context);
        DirectiveNode empty = node.getPairedSibling();
        if (empty == null) {
            return compileLoop(node, loop);
        }

        List<Node> parts = new ArrayList<>();
        parts.add(code("if (!" + VALUES + ".isEmpty(" + loop.collection() + ")) {", node));
        parts.addAll(compileLoop(node, loop));
        parts.add(code("} else {", empty));
        parts.addAll(empty.getChildren());
        parts.add(code("}", node));
        return parts;
    }
}
