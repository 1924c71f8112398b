package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.FragmentNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.NodeCloner;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;
import com.chih.JSugar.core.directive.ElementExtraction;

import java.util.List;
import java.util.Optional;

/**
 * 动态标签名：{@code <div s:tag="level">} 在运行时以 level 的值作为标签名
 * <p>
 * 元素上的用法改写为一个片段：先把校验后的标签名存入局部变量，再输出绑定了该变量的元素。
 * 标签名在运行时由 {@code HtmlTags.validateTagName} 校验，拒绝非法名称和 script、iframe 等危险标签。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/17
 */
public class TagDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.ATTRIBUTE;
    }

    @Override
    public Optional<ElementExtraction> getElementExtraction() {
        return Optional.of(this::extractFromElement);
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        return List.of(code(validation(variableName(node), requireExpression(node, context)), node));
    }

    private Node extractFromElement(ElementNode element, String expression, CompilationContext context) {
        String trimmed = expression == null ? "" : expression.trim();
        if (trimmed.isEmpty() || "true".equals(trimmed)) {
            throw context.syntaxErrorForNode("The \"tag\" directive requires an expression", element);
        }

        String variable = variableName(element);
        ElementNode dynamic = NodeCloner.withChildren(element, element.getChildren());
        dynamic.setDynamicTag(variable);

        FragmentNode fragment = new FragmentNode(List.of(),
                List.of(code(validation(variable, trimmed), element), dynamic),
                element.getLine(), element.getColumn());
        fragment.inheritTemplatePathFrom(element);
        return fragment;
    }

    private String validation(String variable, String expression) {
        return "String " + variable + " = " + HTML_TAGS + ".validateTagName(" + expression + ");";
    }

    private String variableName(Node node) {
        return "__tag_" + node.getLine() + "_" + node.getColumn();
    }
}
