package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 固定次数循环：{@code count} 或 {@code count as i}
 */
public class TimesDirective extends AbstractDirectiveCompiler {

    private static final Pattern AS = Pattern.compile("\\s+as\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        String raw = requireExpression(node, context);
        String[] parts = AS.split(raw, 2);
        String count = parts[0].trim();
        if (count.isEmpty()) {
            throw context.syntaxErrorForNode("The \"times\" directive requires a count expression", node);
        }

        String index;
        if (parts.length > 1) {
            index = parts[1].trim();
            if (!IDENTIFIER.matcher(index).matches()) {
                throw context.syntaxErrorForNode("The \"times\" directive index must be a valid variable name", node);
            }
        } else {
            // line and column keep nested loops apart
            index = "__times_" + node.getLine() + "_" + node.getColumn();
        }

        return wrap(node, "for (int " + index + " = 0; " + index + " < (" + count + "); " + index + "++) {", "}");
    }
}
