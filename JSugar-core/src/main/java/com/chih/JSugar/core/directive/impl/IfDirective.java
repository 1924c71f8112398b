package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.ArrayList;
import java.util.List;

/**
 * if / elseif 条件链
 * <p>
 * 领头的 if 沿着配对链（elseif、else）一次性生成完整的 {@code if {} else if {} else {}} 结构，
 * 后继节点在链中被消费，不会单独编译。独立出现（未被配对）的 elseif 是语法错误。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/15
 */
public class IfDirective extends AbstractDirectiveCompiler {

    private static final List<String> FOLLOWERS = List.of("elseif", "else");

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<String> getPairingDirectives() {
        return FOLLOWERS;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        if (!"if".equals(node.getName())) {
            throw context.syntaxErrorForNode("The \"" + node.getName()
                    + "\" directive must follow an \"if\" or \"elseif\" directive", node);
        }

        List<Node> parts = new ArrayList<>();
        parts.add(code("if (" + requireExpression(node, context) + ") {", node));
        parts.addAll(node.getChildren());

        DirectiveNode branch = node.getPairedSibling();
        while (branch != null) {
            if ("elseif".equals(branch.getName())) {
                parts.add(code("} else if (" + requireExpression(branch, context) + ") {", branch));
            } else if ("else".equals(branch.getName())) {
                parts.add(code("} else {", branch));
            } else {
                throw context.syntaxErrorForNode("Unexpected \"" + branch.getName() + "\" in an if chain", branch);
            }
            parts.addAll(branch.getChildren());
            branch = branch.getPairedSibling();
        }

        parts.add(code("}", node));
        return parts;
    }
}
