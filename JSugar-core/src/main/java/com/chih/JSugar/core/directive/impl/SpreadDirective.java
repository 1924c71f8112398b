package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.AttributeMergePolicy;
import com.chih.JSugar.core.directive.DirectiveType;
import com.chih.JSugar.core.support.AttributeHelper;

import java.util.List;
import java.util.Optional;

/**
 * 把属性 Map 展开到元素上（spread / attr），元素上显式声明的属性优先，不会被重复输出
 */
public class SpreadDirective extends AbstractDirectiveCompiler {

    private static final AttributeMergePolicy MERGE_POLICY =
            AttributeMergePolicy.excludeNamed(SpreadDirective::spreadExpression);

    @Override
    public DirectiveType getType() {
        return DirectiveType.ATTRIBUTE;
    }

    @Override
    public Optional<AttributeMergePolicy> getAttributeMergePolicy() {
        return Optional.of(MERGE_POLICY);
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        return List.of(code(spreadExpression(requireExpression(node, context), List.of()), node));
    }

    static String spreadExpression(String source, List<String> excludedNames) {
        StringBuilder expression = new StringBuilder(HTML_ATTRIBUTES).append(".spread(").append(source);
        for (String name : excludedNames) {
            expression.append(", ").append(AttributeHelper.javaLiteral(name));
        }
        return expression.append(')').toString();
    }
}
