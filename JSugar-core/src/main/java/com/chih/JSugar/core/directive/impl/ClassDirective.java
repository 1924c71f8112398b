package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.AttributeMergePolicy;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;
import java.util.Optional;

/**
 * 条件 class 列表，与元素上已有的 class 属性合并
 */
public class ClassDirective extends AbstractDirectiveCompiler {

    private static final AttributeMergePolicy MERGE_POLICY = AttributeMergePolicy.mergeNamed("class",
            (existing, incoming) -> HTML_ATTRIBUTES + ".classNames(java.util.Arrays.asList("
                    + existing + ", " + incoming + "))");

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
        String expression = requireExpression(node, context);
        return List.of(code("class=\"" + HTML_ATTRIBUTES + ".classNames(" + expression + ")\"", node));
    }
}
