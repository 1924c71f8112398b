package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.NodeCloner;
import com.chih.JSugar.core.ast.OutputContext;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;
import com.chih.JSugar.core.directive.ElementExtraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 内容非空时才输出外层元素：{@code <div class="card" s:ifcontent>...</div>}
 * <p>
 * 子节点的输出先被捕获（宿主模板基类提供 {@code startCapture()} / {@code endCapture()}），
 * 去掉空白后不为空时输出元素，元素内容就是捕获的结果。没有外层元素（片段、组件）时只输出捕获的内容。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/17
 */
public class IfContentDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public Optional<ElementExtraction> getElementExtraction() {
        return Optional.of(this::extractFromElement);
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        String variable = "__content_" + node.getLine() + "_" + node.getColumn();

        List<Node> parts = new ArrayList<>();
        parts.add(code("startCapture();", node));
        parts.addAll(node.getChildren());
        parts.add(code("String " + variable + " = endCapture();", node));
        parts.add(code("if (!" + variable + ".isBlank()) {", node));

        OutputNode captured = new OutputNode(variable, false, OutputContext.RAW, node.getLine(), node.getColumn());
        captured.inheritTemplatePathFrom(node);

        ElementNode element = node.getElement();
        if (element == null) {
            parts.add(captured);
        } else if (element.isSelfClosing()) {
            parts.add(NodeCloner.withChildren(element, List.of()));
        } else {
            parts.add(NodeCloner.withChildren(element, List.of(captured)));
        }

        parts.add(code("}", node));
        return parts;
    }

    private Node extractFromElement(ElementNode element, String expression, CompilationContext context) {
        DirectiveNode directive = new DirectiveNode("ifcontent", expression, element.getChildren(),
                element.getLine(), element.getColumn());
        directive.inheritTemplatePathFrom(element);
        directive.setElement(NodeCloner.withChildren(element, List.of()));
        return directive;
    }
}
