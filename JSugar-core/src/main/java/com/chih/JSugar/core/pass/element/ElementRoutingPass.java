package com.chih.JSugar.core.pass.element;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.ast.AttributeValue;
import com.chih.JSugar.core.ast.ComponentNode;
import com.chih.JSugar.core.ast.FragmentNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveClassifier;
import com.chih.JSugar.core.pipeline.AstPass;
import com.chih.JSugar.core.pipeline.NodeAction;
import com.chih.JSugar.core.pipeline.PipelineContext;
import com.chih.JSugar.core.support.DirectivePrefixHelper;

import java.util.ArrayList;
import java.util.List;

/**
 * 元素路由：把被元素认领型指令注册的自定义元素 {@code <s-name expr="...">}
 * 改写为携带合成指令属性 {@code s:name="expr"} 的片段，交给指令提取阶段处理。
 * <p>
 * 合成属性放在最前面，其余指令属性保持原顺序；除表达式属性外不允许出现普通 HTML 属性。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/16
 */
public class ElementRoutingPass implements AstPass {

    private final DirectiveClassifier classifier;
    private final DirectivePrefixHelper prefixHelper;

    public ElementRoutingPass(DirectiveClassifier classifier) {
        this.classifier = classifier;
        this.prefixHelper = classifier.getPrefixHelper();
    }

    @Override
    public NodeAction before(Node node, PipelineContext context) {
        if (!(node instanceof ComponentNode component) || !classifier.isElementClaiming(component.getName())) {
            return NodeAction.none();
        }

        CompilationContext compilation = context.compilation();
        String expressionAttribute = classifier.elementExpressionAttribute(component.getName());
        String expression = "";
        List<AttributeNode> directiveAttributes = new ArrayList<>();

        for (AttributeNode attribute : component.getAttributes()) {
            if (expressionAttribute != null && expressionAttribute.equals(attribute.getName())) {
                expression = staticExpression(component, attribute, expressionAttribute, compilation);
                continue;
            }

            if (!prefixHelper.isDirective(attribute.getName())) {
                return NodeAction.fail(compilation.syntaxErrorForAttribute(String.format(
                        "Custom element directive \"<%s%s>\" only accepts directive attributes (e.g. %s:if, %s:foreach). "
                                + "Regular HTML attribute \"%s\" is not allowed.",
                        prefixHelper.getElementPrefix(), component.getName(), prefixHelper.getPrefix(),
                        prefixHelper.getPrefix(), attribute.getName()), attribute));
            }
            directiveAttributes.add(attribute);
        }

        AttributeNode synthesized = new AttributeNode(prefixHelper.buildName(component.getName()),
                AttributeValue.staticValue(expression), component.getLine(), component.getColumn());
        synthesized.setTemplatePath(component.getTemplatePath());

        List<AttributeNode> attributes = new ArrayList<>(directiveAttributes.size() + 1);
        attributes.add(synthesized);
        attributes.addAll(directiveAttributes);

        FragmentNode fragment = new FragmentNode(attributes, component.getChildren(),
                component.getLine(), component.getColumn());
        fragment.inheritTemplatePathFrom(component);
        return NodeAction.replace(fragment);
    }

    private String staticExpression(ComponentNode component, AttributeNode attribute, String attributeName,
                                    CompilationContext compilation) {
        AttributeValue value = attribute.getValue();
        if (value.isBoolean()) {
            return "true";
        }
        if (value.isStatic()) {
            return value.getStaticValue();
        }
        throw compilation.syntaxErrorForAttribute(String.format(
                "The \"%s\" expression attribute on custom element directive \"<%s%s>\" must be a static "
                        + "expression, not a dynamic output expression.",
                attributeName, prefixHelper.getElementPrefix(), component.getName()), attribute);
    }
}
