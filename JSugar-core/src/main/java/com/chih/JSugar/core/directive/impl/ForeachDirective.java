package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 循环：{@code item : items} 或 {@code (index, item) : items}，index 是从 0 开始的计数器
 *
 * @author lizhiyuan
 * @since 2026/01/15
 */
public class ForeachDirective extends AbstractDirectiveCompiler {

    private static final Pattern LOOP = Pattern.compile(
            "^(?:\\(\\s*([A-Za-z_]\\w*)\\s*,\\s*([A-Za-z_]\\w*)\\s*\\)|([A-Za-z_]\\w*))\\s*:\\s*(\\S.*)$",
            Pattern.DOTALL);

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        return compileLoop(node, parse(node, context));
    }

    protected Loop parse(DirectiveNode node, CompilationContext context) {
        String expression = node.getExpression() == null ? "" : node.getExpression().trim();
        Matcher matcher = LOOP.matcher(expression);
        if (!matcher.matches()) {
            throw context.syntaxErrorForNode("The \"" + node.getName()
                    + "\" directive requires an expression like \"item : items\" or \"(index, item) : items\"", node);
        }

        if (matcher.group(3) != null) {
            return new Loop(null, matcher.group(3), matcher.group(4).trim());
        }
        if (matcher.group(1).equals(matcher.group(2))) {
            throw context.syntaxErrorForNode("Loop index and item must use different names", node);
        }
        return new Loop(matcher.group(1), matcher.group(2), matcher.group(4).trim());
    }

    protected List<Node> compileLoop(DirectiveNode node, Loop loop) {
        List<Node> parts = new ArrayList<>();
        if (loop.index() == null) {
            parts.add(code("for (var " + loop.item() + " : " + loop.collection() + ") {", node));
            parts.addAll(node.getChildren());
            parts.add(code("}", node));
            return parts;
        }

        parts.add(code("{", node));
        parts.add(code("int " + loop.index() + " = 0;", node));
        parts.add(code("for (var " + loop.item() + " : " + loop.collection() + ") {", node));
        parts.addAll(node.getChildren());
        parts.add(code(loop.index() + "++;", node));
        parts.add(code("}", node));
        parts.add(code("}", node));
        return parts;
    }

    /**
     * @param index 可选的计数器变量名
     */
    protected record Loop(String index, String item, String collection) {
    }
}
